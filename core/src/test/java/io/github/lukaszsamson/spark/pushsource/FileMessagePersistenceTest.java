package io.github.lukaszsamson.spark.pushsource;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FileMessagePersistenceTest {

    @TempDir
    Path dir;

    private FileMessagePersistence opened(Path directory) throws IOException {
        FileMessagePersistence persistence = new FileMessagePersistence(directory, false);
        persistence.open();
        return persistence;
    }

    @Nested
    class ReadWrite {

        @Test
        void putThenGet() throws IOException {
            FileMessagePersistence persistence = opened(dir);
            persistence.put("1", new byte[]{1, 2, 3});

            assertThat(persistence.get("1")).containsExactly(1, 2, 3);
            assertThat(Files.exists(dir.resolve("1.msg"))).isTrue();
        }

        @Test
        void missingKeyReturnsNull() throws IOException {
            FileMessagePersistence persistence = opened(dir);

            assertThat(persistence.get("404")).isNull();
        }

        @Test
        void putReplacesAndLeavesNoTemporaryFiles() throws IOException {
            FileMessagePersistence persistence = opened(dir);
            persistence.put("1", new byte[]{1});
            persistence.put("1", new byte[]{2});

            assertThat(persistence.get("1")).containsExactly(2);
            try (var files = Files.list(dir)) {
                assertThat(files.map(p -> p.getFileName().toString()))
                        .containsExactly("1.msg");
            }
        }

        @Test
        void pathLikeKeysAreRejected() throws IOException {
            FileMessagePersistence persistence = opened(dir);

            assertThatThrownBy(() -> persistence.put("../escape", new byte[]{1}))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> persistence.get(".hidden"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Lifecycle {

        @Test
        void openCreatesMissingDirectories() throws IOException {
            Path nested = dir.resolve("a").resolve("b");
            opened(nested);

            assertThat(Files.isDirectory(nested)).isTrue();
        }

        @Test
        void operationsBeforeOpenFail() {
            FileMessagePersistence persistence = new FileMessagePersistence(dir);

            assertThatThrownBy(() -> persistence.get("1"))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("not open");
        }

        @Test
        void keysSurviveANewInstance() throws IOException {
            FileMessagePersistence first = opened(dir);
            first.put("1", new byte[]{1});
            first.put("2", new byte[]{2});
            first.close();
            Files.write(dir.resolve("3.7.tmp"), new byte[]{3});
            Files.write(dir.resolve("notes.txt"), new byte[]{4});

            FileMessagePersistence second = opened(dir);

            assertThat(second.keys()).containsExactlyInAnyOrder("1", "2");
            assertThat(second.get("2")).containsExactly(2);
        }
    }
}
