package io.github.lukaszsamson.spark.pushsource;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Default parser: decodes the payload as text and stamps it with the
 * arrival time, truncated to whole seconds.
 */
public class TextMessageParser implements MessageParser {
    private static final long serialVersionUID = 1L;

    private final String charsetName;
    private final transient Clock clock;

    public TextMessageParser() {
        this(StandardCharsets.UTF_8, Clock.systemDefaultZone());
    }

    public TextMessageParser(Charset charset) {
        this(charset, Clock.systemDefaultZone());
    }

    TextMessageParser(Charset charset, Clock clock) {
        this.charsetName = Objects.requireNonNull(charset, "charset").name();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public LedgerRecord parse(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        Clock effectiveClock = clock != null ? clock : Clock.systemDefaultZone();
        return new LedgerRecord(
                new String(payload, Charset.forName(charsetName)),
                effectiveClock.instant().truncatedTo(ChronoUnit.SECONDS));
    }

    public Charset getCharset() {
        return Charset.forName(charsetName);
    }
}
