package io.github.lukaszsamson.spark.pushsource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Builds an {@link OffsetLedger} and its collaborators from {@link ConnectorOptions}.
 */
public final class LedgerFactory {

    private static final Logger LOG = LoggerFactory.getLogger(LedgerFactory.class);

    private LedgerFactory() {}

    /**
     * Create a ledger backed by the configured persistence and parser. The
     * ledger is not yet started.
     *
     * @param options validated source options
     * @param checkpointLocation Spark checkpoint location, used to place the
     *                           file store when {@code localStorage} is not set (may be null)
     */
    public static OffsetLedger createLedger(ConnectorOptions options, String checkpointLocation) {
        MessageParser parser = createParser(options);
        LocalMessageStore store = new LocalMessageStore(createPersistence(options, checkpointLocation));
        return new OffsetLedger(store, parser);
    }

    static MessageParser createParser(ConnectorOptions options) {
        String parserClass = options.getMessageParserClass();
        if (parserClass == null || parserClass.isEmpty()) {
            return new TextMessageParser(options.getCharset());
        }
        return ExtensionLoader.load(parserClass, MessageParser.class,
                ConnectorOptions.MESSAGE_PARSER_CLASS);
    }

    static MessagePersistence createPersistence(ConnectorOptions options, String checkpointLocation) {
        if (options.getPersistence() == PersistenceMode.MEMORY) {
            LOG.warn("Using in-memory persistence for stream '{}'; " +
                    "recovering from failure is not supported in this mode", options.getStream());
            return new InMemoryMessagePersistence();
        }
        Path directory = resolveStorageDirectory(options, checkpointLocation);
        LOG.info("Storing consumed records for stream '{}' in {}", options.getStream(), directory);
        return new FileMessagePersistence(directory);
    }

    static Path resolveStorageDirectory(ConnectorOptions options, String checkpointLocation) {
        String localStorage = options.getLocalStorage();
        if (localStorage != null && !localStorage.isEmpty()) {
            return Paths.get(localStorage);
        }
        if (checkpointLocation != null && !checkpointLocation.isEmpty()) {
            return localCheckpointPath(checkpointLocation)
                    .resolve(ConnectorOptions.DEFAULT_LOCAL_STORAGE_DIR);
        }
        throw new IllegalArgumentException(
                "'" + ConnectorOptions.LOCAL_STORAGE + "' must be specified when no checkpoint " +
                        "location is available, or use '" + ConnectorOptions.PERSISTENCE +
                        "' = 'memory'");
    }

    /**
     * The store is written with local file I/O, so only a scheme-less or
     * {@code file:} checkpoint can host it.
     */
    private static Path localCheckpointPath(String location) {
        URI uri;
        try {
            uri = new URI(location);
        } catch (URISyntaxException e) {
            // not a URI, e.g. a Windows path
            return Paths.get(location);
        }
        String scheme = uri.getScheme();
        if (scheme == null || scheme.length() == 1) {
            return Paths.get(location);
        }
        if (!"file".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException(
                    "Checkpoint location '" + location + "' is not on the local file system; " +
                            "set '" + ConnectorOptions.LOCAL_STORAGE + "' to a local directory " +
                            "for the ledger store");
        }
        String path = uri.getPath() != null ? uri.getPath() : uri.getSchemeSpecificPart();
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException(
                    "Checkpoint location '" + location + "' has no path");
        }
        return Paths.get(path);
    }
}
