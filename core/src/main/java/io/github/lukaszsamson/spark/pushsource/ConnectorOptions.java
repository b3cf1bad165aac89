package io.github.lukaszsamson.spark.pushsource;

import java.io.Serializable;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.Map;

/**
 * Parsed and validated configuration for the RabbitMQ push source.
 *
 * <p>Constructed from the raw option map provided by Spark. Lookups are
 * case-insensitive. Call {@link #validateCommon()} at
 * {@code TableProvider.getTable()} time and {@link #validateForSource()} at
 * {@code ScanBuilder} construction.
 */
public final class ConnectorOptions implements Serializable {
    private static final long serialVersionUID = 1L;

    // ---- Option key constants ----

    // Broker connection
    public static final String ENDPOINTS = "endpoints";
    public static final String URIS = "uris";
    /** Spark passes the argument of {@code load(path)} under this key; an alias for {@link #URIS}. */
    public static final String PATH = "path";
    public static final String USERNAME = "username";
    public static final String PASSWORD = "password";
    public static final String VHOST = "vhost";
    public static final String TLS = "tls";
    public static final String TLS_TRUSTSTORE = "tls.truststore";
    public static final String TLS_TRUSTSTORE_PASSWORD = "tls.truststorePassword";
    public static final String TLS_TRUST_ALL = "tls.trustAll";
    public static final String RPC_TIMEOUT_MS = "rpcTimeoutMs";
    public static final String REQUESTED_HEARTBEAT_SECONDS = "requestedHeartbeatSeconds";
    public static final String LAZY_INITIALIZATION = "lazyInitialization";

    // Subscription
    public static final String STREAM = "stream";
    public static final String SUBSCRIPTION_OFFSET = "subscriptionOffset";

    // Ledger
    public static final String PERSISTENCE = "persistence";
    public static final String LOCAL_STORAGE = "localStorage";
    public static final String MESSAGE_PARSER_CLASS = "messageParserClass";
    public static final String CHARSET = "charset";

    // ---- Default values ----

    public static final boolean DEFAULT_TLS = false;
    public static final boolean DEFAULT_TLS_TRUST_ALL = false;
    public static final SubscriptionOffsetMode DEFAULT_SUBSCRIPTION_OFFSET =
            SubscriptionOffsetMode.NEXT;
    public static final PersistenceMode DEFAULT_PERSISTENCE = PersistenceMode.FILE;
    public static final String DEFAULT_CHARSET = StandardCharsets.UTF_8.name();
    /** Directory under the checkpoint location used when {@link #LOCAL_STORAGE} is not set. */
    public static final String DEFAULT_LOCAL_STORAGE_DIR = "ledger-store";

    // ---- Parsed fields ----

    private final String endpoints;
    private final String uris;
    private final String username;
    private final String password;
    private final String vhost;
    private final boolean tls;
    private final String tlsTruststore;
    private final String tlsTruststorePassword;
    private final boolean tlsTrustAll;
    private final Long rpcTimeoutMs;
    private final Long requestedHeartbeatSeconds;
    private final boolean lazyInitialization;

    private final String stream;
    private final SubscriptionOffsetMode subscriptionOffset;

    private final PersistenceMode persistence;
    private final String localStorage;
    private final String messageParserClass;
    private final String charset;

    /**
     * Parse connector options from the raw option map.
     *
     * @param options raw option map (typically from Spark's CaseInsensitiveStringMap)
     */
    public ConnectorOptions(Map<String, String> options) {
        this.endpoints = getString(options, ENDPOINTS);
        String explicitUris = getString(options, URIS);
        this.uris = explicitUris != null ? explicitUris : getString(options, PATH);
        this.username = getString(options, USERNAME);
        this.password = getString(options, PASSWORD);
        this.vhost = getString(options, VHOST);
        this.tls = getBoolean(options, TLS, DEFAULT_TLS);
        this.tlsTruststore = getString(options, TLS_TRUSTSTORE);
        this.tlsTruststorePassword = getString(options, TLS_TRUSTSTORE_PASSWORD);
        this.tlsTrustAll = getBoolean(options, TLS_TRUST_ALL, DEFAULT_TLS_TRUST_ALL);
        this.rpcTimeoutMs = getLong(options, RPC_TIMEOUT_MS);
        this.requestedHeartbeatSeconds = getLong(options, REQUESTED_HEARTBEAT_SECONDS);
        this.lazyInitialization = getBoolean(options, LAZY_INITIALIZATION, false);

        this.stream = getString(options, STREAM);
        this.subscriptionOffset = parseEnum(options, SUBSCRIPTION_OFFSET,
                SubscriptionOffsetMode::fromString, DEFAULT_SUBSCRIPTION_OFFSET);

        this.persistence = parseEnum(options, PERSISTENCE,
                PersistenceMode::fromString, DEFAULT_PERSISTENCE);
        this.localStorage = getString(options, LOCAL_STORAGE);
        this.messageParserClass = getString(options, MESSAGE_PARSER_CLASS);
        this.charset = getString(options, CHARSET, DEFAULT_CHARSET);
    }

    // ---- Validation ----

    /**
     * Validate connection and subscription options.
     *
     * @throws IllegalArgumentException if any option is invalid
     */
    public void validateCommon() {
        if (stream == null || stream.isEmpty()) {
            throw new IllegalArgumentException(
                    "'" + STREAM + "' must be specified, e.g. .option(\"" + STREAM + "\", ...)");
        }

        boolean hasEndpoints = endpoints != null && !endpoints.isEmpty();
        boolean hasUris = uris != null && !uris.isEmpty();
        if (!hasEndpoints && !hasUris) {
            throw new IllegalArgumentException(
                    "At least one of '" + ENDPOINTS + "' or '" + URIS +
                            "' must be specified (or pass the broker URI to load())");
        }

        if (tlsTrustAll && !tls) {
            throw new IllegalArgumentException(
                    "'" + TLS_TRUST_ALL + "' requires '" + TLS + "' to be true");
        }
        if (tlsTruststore != null && !tlsTruststore.isEmpty() && !tls) {
            throw new IllegalArgumentException(
                    "'" + TLS_TRUSTSTORE + "' requires '" + TLS + "' to be true");
        }
        if ((username == null) != (password == null)) {
            throw new IllegalArgumentException(
                    "'" + USERNAME + "' and '" + PASSWORD + "' must be specified together");
        }
        if (rpcTimeoutMs != null && rpcTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                    "'" + RPC_TIMEOUT_MS + "' must be > 0, got: " + rpcTimeoutMs);
        }
        if (requestedHeartbeatSeconds != null && requestedHeartbeatSeconds <= 0) {
            throw new IllegalArgumentException(
                    "'" + REQUESTED_HEARTBEAT_SECONDS + "' must be > 0, got: " +
                            requestedHeartbeatSeconds);
        }
    }

    /**
     * Validate ledger options. Also validates common options.
     *
     * @throws IllegalArgumentException if any option is invalid
     */
    public void validateForSource() {
        validateCommon();

        if (persistence == PersistenceMode.MEMORY && localStorage != null) {
            throw new IllegalArgumentException(
                    "'" + LOCAL_STORAGE + "' cannot be combined with '" + PERSISTENCE +
                            "' = 'memory'");
        }
        getCharset();
        if (messageParserClass != null && !messageParserClass.isEmpty()) {
            ExtensionLoader.resolve(messageParserClass, MessageParser.class,
                    MESSAGE_PARSER_CLASS);
        }
    }

    // ---- Getters: Broker connection ----

    public String getEndpoints() { return endpoints; }
    public String getUris() { return uris; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public String getVhost() { return vhost; }
    public boolean isTls() { return tls; }
    public String getTlsTruststore() { return tlsTruststore; }
    public String getTlsTruststorePassword() { return tlsTruststorePassword; }
    public boolean isTlsTrustAll() { return tlsTrustAll; }
    public Long getRpcTimeoutMs() { return rpcTimeoutMs; }
    public Long getRequestedHeartbeatSeconds() { return requestedHeartbeatSeconds; }
    public boolean isLazyInitialization() { return lazyInitialization; }

    // ---- Getters: Subscription ----

    public String getStream() { return stream; }
    public SubscriptionOffsetMode getSubscriptionOffset() { return subscriptionOffset; }

    // ---- Getters: Ledger ----

    public PersistenceMode getPersistence() { return persistence; }
    public String getLocalStorage() { return localStorage; }
    public String getMessageParserClass() { return messageParserClass; }

    /**
     * @throws IllegalArgumentException if the configured charset is unknown
     */
    public Charset getCharset() {
        try {
            return Charset.forName(charset.trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new IllegalArgumentException(
                    "'" + CHARSET + "' is not a supported charset: '" + charset + "'", e);
        }
    }

    // ---- Parsing helpers ----

    private static String lookupOption(Map<String, String> options, String key) {
        String value = options.get(key);
        if (value != null || options.containsKey(key)) {
            return value;
        }
        String lowerKey = key.toLowerCase(Locale.ROOT);
        value = options.get(lowerKey);
        if (value != null || options.containsKey(lowerKey)) {
            return value;
        }
        for (Map.Entry<String, String> entry : options.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(key)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String getString(Map<String, String> options, String key) {
        return lookupOption(options, key);
    }

    private static String getString(Map<String, String> options, String key, String defaultValue) {
        String value = lookupOption(options, key);
        return (value != null) ? value : defaultValue;
    }

    private static boolean getBoolean(Map<String, String> options, String key,
                                      boolean defaultValue) {
        String value = lookupOption(options, key);
        if (value == null) {
            return defaultValue;
        }
        String lower = value.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(lower)) return true;
        if ("false".equals(lower)) return false;
        throw new IllegalArgumentException(
                "'" + key + "' must be 'true' or 'false', got: '" + value + "'");
    }

    private static Long getLong(Map<String, String> options, String key) {
        String value = lookupOption(options, key);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "'" + key + "' must be a valid long, got: '" + value + "'");
        }
    }

    private static <T> T parseEnum(Map<String, String> options, String key,
                                   java.util.function.Function<String, T> parser, T defaultValue) {
        String value = lookupOption(options, key);
        if (value == null) {
            return defaultValue;
        }
        return parser.apply(value.trim());
    }
}
