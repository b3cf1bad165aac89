package io.github.lukaszsamson.spark.pushsource;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class LedgerOffsetTest {

    @Test
    void jsonIsAnObjectWithTheOffset() {
        assertThat(new LedgerOffset(42).json()).isEqualTo("{\"offset\":42}");
        assertThat(LedgerOffset.ZERO.json()).isEqualTo("{\"offset\":0}");
    }

    @Test
    void fromJsonReadsWhatJsonWrites() {
        LedgerOffset offset = new LedgerOffset(1_234_567_890_123L);

        assertThat(LedgerOffset.fromJson(offset.json())).isEqualTo(offset);
    }

    @Test
    void fromJsonToleratesWhitespaceAndBareNumbers() {
        assertThat(LedgerOffset.fromJson(" { \"offset\" : 7 } ").getOffset()).isEqualTo(7);
        assertThat(LedgerOffset.fromJson("7").getOffset()).isEqualTo(7);
    }

    @Test
    void fromJsonRejectsMalformedInput() {
        assertThatThrownBy(() -> LedgerOffset.fromJson("{\"stream\":7}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> LedgerOffset.fromJson("-1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LedgerOffset.fromJson(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LedgerOffset.fromJson("99999999999999999999"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    void negativeOffsetIsRejected() {
        assertThatThrownBy(() -> new LedgerOffset(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ofConvertsSparkOffsets() {
        assertThat(LedgerOffset.of(null)).isEqualTo(LedgerOffset.ZERO);
        assertThat(LedgerOffset.of(new LedgerOffset(3))).isEqualTo(new LedgerOffset(3));
        assertThat(new LedgerOffset(3)).hasSameHashCodeAs(new LedgerOffset(3));
    }
}
