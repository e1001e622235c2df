package com.marketpulse.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RoundingTest {

    @Test
    void percentRoundsToOneDecimal() {
        assertThat(Rounding.percent(1, 3)).isEqualTo(33.3);
        assertThat(Rounding.percent(2, 3)).isEqualTo(66.7);
        assertThat(Rounding.percent(6, 10)).isEqualTo(60.0);
    }

    @Test
    void percentOfZeroWholeIsZero() {
        assertThat(Rounding.percent(0, 0)).isZero();
    }

    @Test
    void roundUsesExactBinaryValue() {
        // 0.125 is exact in binary, so half-even applies
        assertThat(Rounding.round(0.125, 2)).isEqualTo(0.12);
        assertThat(Rounding.round(0.375, 2)).isEqualTo(0.38);
        assertThat(Rounding.round(-0.4, 3)).isEqualTo(-0.4);
    }

    @Test
    void nonFiniteValuesPassThrough() {
        assertThat(Rounding.round(Double.NaN, 2)).isNaN();
        assertThat(Rounding.round(Double.POSITIVE_INFINITY, 2)).isInfinite();
    }
}
