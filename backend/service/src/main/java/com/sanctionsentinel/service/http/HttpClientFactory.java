package com.sanctionsentinel.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Shared client for list downloads and webhook delivery. Follows redirects, since the list
 * publishers move their files behind redirecting URLs. Reads its network options from the
 * environment:
 * <ul>
 *     <li>{@code TRUSTSTORE_PATH} / {@code TRUSTSTORE_PASSWORD}: extra CA certificates, JKS or PKCS12</li>
 *     <li>{@code HTTPS_PROXY}: outbound proxy as {@code http://host:port}</li>
 * </ul>
 */
public final class HttpClientFactory {
    private static final Logger LOGGER = Logger.getLogger(HttpClientFactory.class.getName());

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        return create(NetworkOptions.fromEnvironment(connectTimeout, environment));
    }

    public static HttpClient create(NetworkOptions options) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(options.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (options.proxy() != null) {
            builder.proxy(ProxySelector.of(options.proxy()));
            LOGGER.info("Routing outbound HTTP through proxy " + options.proxy());
        }
        if (options.truststore() != null) {
            builder.sslContext(sslContext(options.truststore(), options.truststorePassword()));
        }
        return builder.build();
    }

    static SSLContext sslContext(Path truststore, String password) {
        if (!Files.exists(truststore)) {
            throw new IllegalStateException("Truststore file does not exist: " + truststore);
        }
        try (InputStream in = Files.newInputStream(truststore)) {
            KeyStore keyStore = KeyStore.getInstance(truststoreType(truststore));
            keyStore.load(in, password.toCharArray());
            TrustManagerFactory trustManagers = TrustManagerFactory.getInstance(
                    TrustManagerFactory.getDefaultAlgorithm());
            trustManagers.init(keyStore);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers.getTrustManagers(), new SecureRandom());
            LOGGER.info(() -> "Loaded " + keyStore.getType() + " truststore from " + truststore);
            return context;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + truststore, e);
        }
    }

    static String truststoreType(Path path) {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12")) {
            return "PKCS12";
        }
        return "JKS";
    }

    public record NetworkOptions(Duration connectTimeout, Path truststore, String truststorePassword,
                                 InetSocketAddress proxy) {
        public NetworkOptions {
            Objects.requireNonNull(connectTimeout, "connectTimeout is required");
            if (truststore != null && truststorePassword == null) {
                throw new IllegalStateException("TRUSTSTORE_PASSWORD must be set when TRUSTSTORE_PATH is configured");
            }
        }

        public static NetworkOptions fromEnvironment(Duration connectTimeout, Map<String, String> environment) {
            String truststorePath = environment.get("TRUSTSTORE_PATH");
            Path truststore = truststorePath == null || truststorePath.isBlank() ? null : Path.of(truststorePath);
            return new NetworkOptions(connectTimeout, truststore, environment.get("TRUSTSTORE_PASSWORD"),
                    parseProxy(environment.get("HTTPS_PROXY")));
        }

        static InetSocketAddress parseProxy(String raw) {
            if (raw == null || raw.isBlank()) {
                return null;
            }
            String candidate = raw.contains("://") ? raw.trim() : "http://" + raw.trim();
            try {
                URI uri = new URI(candidate);
                if (uri.getHost() == null) {
                    throw new IllegalStateException("HTTPS_PROXY has no host: " + raw);
                }
                int port = uri.getPort() > 0 ? uri.getPort() : 80;
                return InetSocketAddress.createUnresolved(uri.getHost(), port);
            } catch (URISyntaxException e) {
                throw new IllegalStateException("HTTPS_PROXY is not a valid URL: " + raw, e);
            }
        }
    }
}
