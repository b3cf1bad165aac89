package io.github.lukaszsamson.spark.pushsource;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class TextMessageParserTest {

    private static final Clock CLOCK =
            Clock.fixed(Instant.parse("2024-05-01T10:15:30.987Z"), ZoneOffset.UTC);

    @Test
    void decodesUtf8AndTruncatesTimestampToSeconds() {
        TextMessageParser parser = new TextMessageParser(StandardCharsets.UTF_8, CLOCK);

        LedgerRecord record = parser.parse("temp=21.5°C".getBytes(StandardCharsets.UTF_8));

        assertThat(record.getValue()).isEqualTo("temp=21.5°C");
        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:15:30Z"));
    }

    @Test
    void usesConfiguredCharset() {
        TextMessageParser parser = new TextMessageParser(StandardCharsets.ISO_8859_1, CLOCK);

        LedgerRecord record = parser.parse(new byte[]{(byte) 0xE9});

        assertThat(record.getValue()).isEqualTo("é");
        assertThat(parser.getCharset()).isEqualTo(StandardCharsets.ISO_8859_1);
    }

    @Test
    void defaultsToUtf8() {
        assertThat(new TextMessageParser().getCharset()).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    void rejectsNullPayload() {
        assertThatThrownBy(() -> new TextMessageParser().parse(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void stillParsesAfterJavaSerialization() throws IOException, ClassNotFoundException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(new TextMessageParser(StandardCharsets.UTF_16BE, CLOCK));
        }
        TextMessageParser copy;
        try (ObjectInputStream in = new ObjectInputStream(
                new ByteArrayInputStream(bytes.toByteArray()))) {
            copy = (TextMessageParser) in.readObject();
        }

        assertThat(copy.getCharset()).isEqualTo(StandardCharsets.UTF_16BE);
        assertThat(copy.parse("ok".getBytes(StandardCharsets.UTF_16BE)).getValue())
                .isEqualTo("ok");
    }
}
