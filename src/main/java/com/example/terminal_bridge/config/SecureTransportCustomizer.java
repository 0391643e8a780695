package com.example.terminal_bridge.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.Ssl;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Serves the bridge over TLS with the provisioned certificate. When the
 * certificate cannot be set up the server stays plain and moves to the
 * fallback port.
 */
@Component
@ConditionalOnProperty(prefix = "bridge.secure", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class SecureTransportCustomizer implements WebServerFactoryCustomizer<TomcatServletWebServerFactory> {

    private final CertificateProvisioner provisioner;
    private final BridgeProperties properties;

    @Override
    public void customize(TomcatServletWebServerFactory factory) {
        BridgeProperties.Secure secure = properties.getSecure();
        try {
            Path keystore = provisioner.provision();
            factory.setSsl(buildSsl(keystore, secure));
            log.info("🔒 Secure transport enabled on port {}", factory.getPort());
        } catch (IOException | RuntimeException e) {
            int fallbackPort = fallbackPort(factory.getPort(), secure.getFallbackPortOffset());
            log.error("❌ Secure transport setup failed, serving plain on port {}: {}", fallbackPort, e.getMessage());
            factory.setSsl(null);
            factory.setPort(fallbackPort);
        }
    }

    static Ssl buildSsl(Path keystore, BridgeProperties.Secure secure) {
        Ssl ssl = new Ssl();
        ssl.setEnabled(true);
        ssl.setKeyStore(keystore.toUri().toString());
        ssl.setKeyStoreType("PKCS12");
        ssl.setKeyStorePassword(secure.getKeystorePassword());
        ssl.setKeyAlias(secure.getKeyAlias());
        return ssl;
    }

    static int fallbackPort(int port, int offset) {
        // 0 asks for an ephemeral port, keep it that way
        return port <= 0 ? port : port + offset;
    }
}
