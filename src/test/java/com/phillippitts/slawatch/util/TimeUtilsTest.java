package com.phillippitts.slawatch.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TimeUtilsTest {

    @Test
    void shouldConvertDurationToFractionalSeconds() {
        assertThat(TimeUtils.toSeconds(Duration.ofMillis(1500))).isEqualTo(1.5, within(1e-9));
        assertThat(TimeUtils.toSeconds(Duration.ZERO)).isZero();
    }

    @Test
    void shouldConvertFractionalSecondsToDuration() {
        assertThat(TimeUtils.fromSeconds(2.25)).isEqualTo(Duration.ofMillis(2250));
        assertThat(TimeUtils.fromSeconds(0)).isEqualTo(Duration.ZERO);
    }

    @Test
    void shouldRejectNegativeOrNonFiniteSeconds() {
        assertThatThrownBy(() -> TimeUtils.fromSeconds(-0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TimeUtils.fromSeconds(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TimeUtils.fromSeconds(Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldMeasureElapsedMillis() throws InterruptedException {
        long start = System.nanoTime();
        Thread.sleep(20);

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(20);
    }
}
