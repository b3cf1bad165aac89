package io.github.lukaszsamson.spark.pushsource;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class LedgerFactoryTest {

    private static Map<String, String> minimalOptions() {
        Map<String, String> opts = new HashMap<>();
        opts.put("stream", "sensor-readings");
        opts.put("endpoints", "localhost:5552");
        return opts;
    }

    @Nested
    class Parser {

        @Test
        void defaultParserUsesConfiguredCharset() {
            Map<String, String> opts = minimalOptions();
            opts.put("charset", "ISO-8859-1");

            MessageParser parser = LedgerFactory.createParser(new ConnectorOptions(opts));

            assertThat(parser).isInstanceOf(TextMessageParser.class);
            assertThat(((TextMessageParser) parser).getCharset())
                    .isEqualTo(StandardCharsets.ISO_8859_1);
        }

        @Test
        void customParserIsLoadedByName() {
            Map<String, String> opts = minimalOptions();
            opts.put("messageParserClass", ExtensionLoaderTest.UpperCaseParser.class.getName());

            assertThat(LedgerFactory.createParser(new ConnectorOptions(opts)))
                    .isInstanceOf(ExtensionLoaderTest.UpperCaseParser.class);
        }
    }

    @Nested
    class StorageDirectory {

        @Test
        void explicitLocalStorageWins() {
            Map<String, String> opts = minimalOptions();
            opts.put("localStorage", "/data/ledger");

            assertThat(LedgerFactory.resolveStorageDirectory(
                    new ConnectorOptions(opts), "/checkpoints/q1"))
                    .isEqualTo(Paths.get("/data/ledger"));
        }

        @Test
        void defaultsUnderCheckpointLocation() {
            assertThat(LedgerFactory.resolveStorageDirectory(
                    new ConnectorOptions(minimalOptions()), "file:/checkpoints/q1/sources/0"))
                    .isEqualTo(Paths.get("/checkpoints/q1/sources/0/ledger-store"));
        }

        @Test
        void acceptsFileUrisAndPlainPaths() {
            ConnectorOptions options = new ConnectorOptions(minimalOptions());

            assertThat(LedgerFactory.resolveStorageDirectory(options, "file:///checkpoints/q1"))
                    .isEqualTo(Paths.get("/checkpoints/q1/ledger-store"));
            assertThat(LedgerFactory.resolveStorageDirectory(options, "/checkpoints/q 1"))
                    .isEqualTo(Paths.get("/checkpoints/q 1/ledger-store"));
        }

        @Test
        void remoteCheckpointRequiresLocalStorage() {
            ConnectorOptions options = new ConnectorOptions(minimalOptions());

            assertThatThrownBy(() -> LedgerFactory.resolveStorageDirectory(
                    options, "hdfs://nn:8020/ckpt/q1/sources/0"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("hdfs://nn:8020/ckpt/q1/sources/0")
                    .hasMessageContaining("'localStorage'");
            assertThatThrownBy(() -> LedgerFactory.resolveStorageDirectory(
                    options, "s3a://bucket/ckpt"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void localStorageMakesRemoteCheckpointUsable() {
            Map<String, String> opts = minimalOptions();
            opts.put("localStorage", "/data/ledger");

            assertThat(LedgerFactory.resolveStorageDirectory(
                    new ConnectorOptions(opts), "abfs://c@acct.dfs.core.windows.net/ckpt"))
                    .isEqualTo(Paths.get("/data/ledger"));
        }

        @Test
        void noLocationAtAllIsRejected() {
            assertThatThrownBy(() -> LedgerFactory.resolveStorageDirectory(
                    new ConnectorOptions(minimalOptions()), null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("localStorage");
        }
    }

    @Nested
    class CreateLedger {

        @Test
        void memoryPersistenceNeedsNoDirectory() {
            Map<String, String> opts = minimalOptions();
            opts.put("persistence", "memory");

            assertThat(LedgerFactory.createPersistence(new ConnectorOptions(opts), null))
                    .isInstanceOf(InMemoryMessagePersistence.class);
        }

        @Test
        void fileLedgerCreatesItsDirectory(@TempDir Path checkpoint) {
            OffsetLedger ledger = LedgerFactory.createLedger(
                    new ConnectorOptions(minimalOptions()), checkpoint.toString());
            try {
                assertThat(ledger.state()).isEqualTo(LedgerState.INITIALIZING);
                assertThat(Files.isDirectory(checkpoint.resolve("ledger-store"))).isTrue();
            } finally {
                ledger.stop();
            }
        }
    }
}
