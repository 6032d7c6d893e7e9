package com.forecastsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnomalyStatus#classify(double, double, double)}.
 */
class AnomalyStatusTest {

    @Test
    @DisplayName("Bounds are inclusive")
    void boundsShouldBeInRange() {
        assertThat(AnomalyStatus.classify(90, 90, 110)).isEqualTo(AnomalyStatus.IN_RANGE);
        assertThat(AnomalyStatus.classify(110, 90, 110)).isEqualTo(AnomalyStatus.IN_RANGE);
    }

    @Test
    @DisplayName("Should classify values just outside the interval")
    void shouldClassifyOutside() {
        assertThat(AnomalyStatus.classify(89.999, 90, 110)).isEqualTo(AnomalyStatus.BELOW_LOWER);
        assertThat(AnomalyStatus.classify(110.001, 90, 110)).isEqualTo(AnomalyStatus.ABOVE_UPPER);
    }

    @Test
    @DisplayName("Exactly one interval status holds for every actual when lower < upper")
    void shouldBeTotalAndExclusive() {
        double[][] intervals = { { 90, 110 }, { -5, 5 }, { 0, 1 }, { -10, 0 }, { 1e-9, 2e-9 } };
        for (double[] interval : intervals) {
            double lower = interval[0];
            double upper = interval[1];
            double width = upper - lower;
            for (double actual = lower - 2 * width; actual <= upper + 2 * width; actual += width / 8) {
                AnomalyStatus status = AnomalyStatus.classify(actual, lower, upper);
                boolean below = actual < lower;
                boolean above = actual > upper;
                AnomalyStatus expected = below ? AnomalyStatus.BELOW_LOWER
                        : above ? AnomalyStatus.ABOVE_UPPER : AnomalyStatus.IN_RANGE;
                assertThat(status).as("actual=%s in [%s, %s]", actual, lower, upper).isEqualTo(expected);
            }
        }
    }

    @Test
    @DisplayName("Zero-zero interval means no forecast, whatever the actual")
    void zeroIntervalShouldBeNoForecast() {
        assertThat(AnomalyStatus.classify(42, 0, 0)).isEqualTo(AnomalyStatus.NO_FORECAST);
        assertThat(AnomalyStatus.classify(0, 0, 0)).isEqualTo(AnomalyStatus.NO_FORECAST);
        assertThat(AnomalyStatus.NO_FORECAST.isAnomaly()).isFalse();
    }
}
