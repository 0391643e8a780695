package com.example.terminal_bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TerminalBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TerminalBridgeApplication.class, args);
    }
}
