/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.postgres;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class LsnTest {

    @Test
    public void shouldRenderAsTwoHexadecimalHalves() {
        assertThat(Lsn.valueOf(607931488L).asString()).isEqualTo("0/243C4C60");
        assertThat(Lsn.valueOf(692097666144L).asString()).isEqualTo("A1/243C4C60");
        assertThat(Lsn.valueOf(0x16_0000_00FFL).asString()).isEqualTo("16/000000FF");
        assertThat(Lsn.INVALID.asString()).isEqualTo("0/00000000");
        assertThat(Lsn.valueOf(-1L).asString()).isEqualTo("FFFFFFFF/FFFFFFFF");
    }

    @Test
    public void shouldParseTextualForm() {
        assertThat(Lsn.valueOf("0/243C4C60").asLong()).isEqualTo(607931488L);
        assertThat(Lsn.valueOf("A1/243C4C60").asLong()).isEqualTo(692097666144L);
        assertThat(Lsn.valueOf("a1/243c4c60").asLong()).isEqualTo(692097666144L);
        assertThat(Lsn.valueOf("16/3002D50").asLong()).isEqualTo(0x16_0300_2D50L);
        assertThat(Lsn.valueOf("FFFFFFFF/FFFFFFFF").asLong()).isEqualTo(-1L);
        assertThat(Lsn.valueOf("00000000A1/0243C4C60").asLong()).isEqualTo(692097666144L);
    }

    @Test
    public void shouldRoundTripThroughText() {
        Random random = new Random(42);
        long[] values = { 0L, 1L, 0xFFFFFFFFL, 0x1_0000_0000L, Long.MAX_VALUE, Long.MIN_VALUE, -1L };
        for (long value : values) {
            assertThat(Lsn.valueOf(Lsn.valueOf(value).asString()).asLong()).isEqualTo(value);
        }
        for (int i = 0; i < 10_000; i++) {
            Lsn lsn = Lsn.valueOf(random.nextLong());
            assertThat(Lsn.valueOf(lsn.asString())).isEqualTo(lsn);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "0", "0/", "/0", "0/1/2", "G/0", "0/-1", "+1/0", " 0/1", "0/1 ", "1FFFFFFFF/0", "0/100000000", "0x1/0",
            "00000000000000001/0" })
    public void shouldRejectMalformedText(String text) {
        assertThatThrownBy(() -> Lsn.valueOf(text)).isInstanceOf(LsnFormatException.class);
    }

    @Test
    public void shouldRejectNull() {
        assertThatThrownBy(() -> Lsn.valueOf((String) null)).isInstanceOf(LsnFormatException.class);
    }

    @Test
    public void shouldCompareAsUnsigned() {
        Lsn low = Lsn.valueOf("0/1");
        Lsn high = Lsn.valueOf("FFFFFFFF/0");
        assertThat(high.asLong()).isNegative();
        assertThat(low).isLessThan(high);
        assertThat(Lsn.valueOf("1/0")).isGreaterThan(Lsn.valueOf("0/FFFFFFFF"));
        assertThat(Lsn.valueOf("1/0").isBetween(low, high)).isTrue();
        assertThat(high.isBetween(low, Lsn.valueOf("1/0"))).isFalse();
        assertThat(low.isBetween(low, low)).isTrue();
    }

    @Test
    public void shouldHaveValueSemantics() {
        assertThat(Lsn.valueOf("A1/243C4C60")).isEqualTo(Lsn.valueOf(692097666144L))
                .hasSameHashCodeAs(Lsn.valueOf(692097666144L));
        assertThat(Lsn.INVALID.isValid()).isFalse();
        assertThat(Lsn.valueOf(1).isValid()).isTrue();
        assertThat(Lsn.valueOf("A1/243C4C60")).hasToString("LSN{A1/243C4C60}");
    }
}
