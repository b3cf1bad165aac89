package io.github.lukaszsamson.spark.pushsource;

import com.rabbitmq.stream.Environment;
import com.rabbitmq.stream.EnvironmentBuilder;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Builds a RabbitMQ {@link Environment} from {@link ConnectorOptions}.
 *
 * <p>Handles endpoints/URIs, credentials, vhost, TLS and connection tuning.
 */
final class EnvironmentBuilderHelper {

    private static final int DEFAULT_STREAM_PORT = 5552;
    private static final int DEFAULT_STREAM_TLS_PORT = 5551;

    private EnvironmentBuilderHelper() {}

    /**
     * Build a RabbitMQ Environment from connector options.
     *
     * @param options parsed connector options
     * @return a configured Environment, connected unless lazy initialization is on
     */
    static Environment buildEnvironment(ConnectorOptions options) {
        EnvironmentBuilder builder = Environment.builder();
        configureConnection(builder, options);
        configureCredentials(builder, options);
        configureTls(builder, options);
        configureTuning(builder, options);
        return builder.build();
    }

    static List<String> resolveUris(ConnectorOptions options) {
        List<String> uris = new ArrayList<>();
        if (options.getUris() != null && !options.getUris().isEmpty()) {
            Arrays.stream(options.getUris().split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(uris::add);
        } else if (options.getEndpoints() != null && !options.getEndpoints().isEmpty()) {
            String scheme = options.isTls() ? "rabbitmq-stream+tls" : "rabbitmq-stream";
            int defaultPort = options.isTls() ? DEFAULT_STREAM_TLS_PORT : DEFAULT_STREAM_PORT;
            for (String endpoint : options.getEndpoints().split(",")) {
                String trimmed = endpoint.trim();
                if (!trimmed.isEmpty()) {
                    uris.add(endpointToUri(scheme, trimmed, defaultPort));
                }
            }
        }
        return uris;
    }

    private static void configureConnection(EnvironmentBuilder builder, ConnectorOptions options) {
        List<String> uris = resolveUris(options);
        if (!uris.isEmpty()) {
            builder.uris(uris);
        }
    }

    private static String endpointToUri(String scheme, String endpoint, int defaultPort) {
        try {
            URI parsed = new URI(scheme + "://" + endpoint);
            String host = parsed.getHost();
            if (host == null || host.isEmpty()) {
                throw new IllegalArgumentException("missing host");
            }
            int port = parsed.getPort() >= 0 ? parsed.getPort() : defaultPort;
            return new URI(scheme, null, host, port, null, null, null).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid endpoint '" + endpoint + "'. Expected host, host:port, [ipv6], or [ipv6]:port",
                    e);
        }
    }

    private static void configureCredentials(EnvironmentBuilder builder,
                                             ConnectorOptions options) {
        if (options.getUsername() != null) {
            builder.username(options.getUsername());
        }
        if (options.getPassword() != null) {
            builder.password(options.getPassword());
        }
        if (options.getVhost() != null) {
            builder.virtualHost(options.getVhost());
        }
    }

    private static void configureTls(EnvironmentBuilder builder, ConnectorOptions options) {
        if (!options.isTls()) {
            return;
        }
        if (options.isTlsTrustAll()) {
            builder.tls().trustEverything().environmentBuilder();
            return;
        }
        String truststore = options.getTlsTruststore();
        if (truststore == null || truststore.isEmpty()) {
            builder.tls().environmentBuilder();
            return;
        }
        builder.tls().sslContext(buildSslContext(truststore,
                options.getTlsTruststorePassword())).environmentBuilder();
    }

    private static void configureTuning(EnvironmentBuilder builder, ConnectorOptions options) {
        builder.lazyInitialization(options.isLazyInitialization());
        if (options.getRpcTimeoutMs() != null) {
            builder.rpcTimeout(Duration.ofMillis(options.getRpcTimeoutMs()));
        }
        if (options.getRequestedHeartbeatSeconds() != null) {
            builder.requestedHeartbeat(Duration.ofSeconds(options.getRequestedHeartbeatSeconds()));
        }
    }

    private static SslContext buildSslContext(String truststorePath, String password) {
        try {
            KeyStore trustStore = KeyStore.getInstance(keyStoreType(truststorePath));
            try (InputStream in = Files.newInputStream(Paths.get(truststorePath))) {
                trustStore.load(in, password != null ? password.toCharArray() : new char[0]);
            }
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(
                    TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);
            return SslContextBuilder.forClient().trustManager(tmf).build();
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalArgumentException(
                    "Failed to load '" + ConnectorOptions.TLS_TRUSTSTORE + "' from " + truststorePath, e);
        }
    }

    static String keyStoreType(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".jks")) {
            return "JKS";
        }
        if (lower.endsWith(".p12") || lower.endsWith(".pfx")) {
            return "PKCS12";
        }
        return KeyStore.getDefaultType();
    }
}
