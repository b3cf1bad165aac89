package io.github.lukaszsamson.spark.pushsource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;

/**
 * Binary encoding of {@link LedgerRecord} for the durable store.
 *
 * <p>Layout: format version byte, value length (int), UTF-8 value bytes,
 * epoch seconds (long), nano adjustment (int). Decoding an encoded record
 * yields an equal record.
 */
final class LedgerRecordCodec {

    static final byte FORMAT_V1 = 1;

    private LedgerRecordCodec() {}

    static byte[] encode(LedgerRecord record) {
        byte[] value = record.getValue().getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(value.length + 17);
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeByte(FORMAT_V1);
            out.writeInt(value.length);
            out.write(value);
            out.writeLong(record.getTimestamp().getEpochSecond());
            out.writeInt(record.getTimestamp().getNano());
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    /**
     * @throws IllegalArgumentException if the bytes are not a valid encoded record
     */
    static LedgerRecord decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("Encoded record must not be empty");
        }
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
            byte format = in.readByte();
            if (format != FORMAT_V1) {
                throw new IllegalArgumentException("Unsupported record format: " + format);
            }
            int length = in.readInt();
            if (length < 0 || length > data.length) {
                throw new IllegalArgumentException("Invalid encoded value length: " + length);
            }
            byte[] value = new byte[length];
            in.readFully(value);
            long seconds = in.readLong();
            int nanos = in.readInt();
            if (in.available() > 0) {
                throw new IllegalArgumentException(
                        "Trailing bytes after encoded record: " + in.available());
            }
            return new LedgerRecord(new String(value, StandardCharsets.UTF_8),
                    Instant.ofEpochSecond(seconds, nanos));
        } catch (IOException | DateTimeException e) {
            throw new IllegalArgumentException("Malformed encoded record", e);
        }
    }
}
