package com.projectpulse.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the client shared by collectors, publishers and the summarizer. A custom truststore is used when
 * {@code PULSE_TRUSTSTORE_PATH} is set.
 */
public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        SSLContext sslContext = sslContextFromEnvironment(environment);
        if (sslContext != null) {
            builder.sslContext(sslContext);
        }
        return builder.build();
    }

    private static SSLContext sslContextFromEnvironment(Map<String, String> environment) {
        String truststorePath = environment.get("PULSE_TRUSTSTORE_PATH");
        if (truststorePath == null || truststorePath.isBlank()) {
            return null;
        }

        String truststorePassword = environment.get("PULSE_TRUSTSTORE_PASSWORD");
        if (truststorePassword == null) {
            throw new IllegalStateException("PULSE_TRUSTSTORE_PASSWORD must be set when PULSE_TRUSTSTORE_PATH is configured");
        }

        Path path = Path.of(truststorePath);
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }

        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(truststoreType(path));
            trustStore.load(in, truststorePassword.toCharArray());

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
            return sslContext;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }

    private static String truststoreType(Path path) {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return lower.endsWith(".jks") ? "JKS" : "PKCS12";
    }
}
