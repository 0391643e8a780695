package com.example.terminal_bridge.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.SystemUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Creates the self-signed PKCS12 keystore used by the secure listener on first
 * start and reuses it afterwards.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CertificateProvisioner {

    static final String KEYSTORE_FILE = "keystore.p12";
    private static final long KEYTOOL_TIMEOUT_SECONDS = 60;

    private final BridgeProperties properties;

    public Path provision() throws IOException {
        BridgeProperties.Secure secure = properties.getSecure();
        Path dir = Paths.get(secure.getCertificateDir());
        Path keystore = dir.resolve(KEYSTORE_FILE);

        if (Files.isRegularFile(keystore) && Files.size(keystore) > 0) {
            log.info("🔐 Reusing certificate at {}", keystore);
            return keystore;
        }

        Files.createDirectories(dir);
        List<String> command = List.of(
                keytoolPath(),
                "-genkeypair",
                "-alias", secure.getKeyAlias(),
                "-keyalg", "RSA",
                "-keysize", "2048",
                "-validity", "365",
                "-storetype", "PKCS12",
                "-keystore", keystore.toString(),
                "-storepass", secure.getKeystorePassword(),
                "-keypass", secure.getKeystorePassword(),
                "-dname", "CN=localhost, OU=Terminal Bridge, O=Local, C=US",
                "-ext", "SAN=dns:localhost,ip:127.0.0.1",
                "-noprompt");

        log.info("🔐 Generating self-signed certificate in {}", dir);
        Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
        String output;
        try {
            output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (!process.waitFor(KEYTOOL_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException("keytool did not finish within " + KEYTOOL_TIMEOUT_SECONDS + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while generating certificate", e);
        }

        if (process.exitValue() != 0 || !Files.isRegularFile(keystore)) {
            throw new IOException("keytool exited with " + process.exitValue() + ": " + output.trim());
        }
        log.info("✅ Certificate generated: {}", keystore);
        return keystore;
    }

    static String keytoolPath() {
        String executable = SystemUtils.IS_OS_WINDOWS ? "keytool.exe" : "keytool";
        Path bundled = Paths.get(System.getProperty("java.home"), "bin", executable);
        return Files.isExecutable(bundled) ? bundled.toString() : executable;
    }
}
