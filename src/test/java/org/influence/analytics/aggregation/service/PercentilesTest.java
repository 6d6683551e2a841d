package org.influence.analytics.aggregation.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PercentilesTest {

    @Test
    void nearestRankOnUnsortedSample() {
        // Arrange
        double[] sample = {40, 10, 50, 20, 30};

        // Act / Assert
        assertThat(Percentiles.nearestRank(sample, 50)).isEqualTo(30);
        assertThat(Percentiles.nearestRank(sample, 90)).isEqualTo(50);
        assertThat(Percentiles.nearestRank(sample, 20)).isEqualTo(10);
        assertThat(Percentiles.nearestRank(sample, 100)).isEqualTo(50);
    }

    @Test
    void doesNotReorderTheCallersSample() {
        // Arrange
        double[] sample = {3, 1, 2};

        // Act
        Percentiles.nearestRank(sample, 50);

        // Assert
        assertThat(sample).containsExactly(3, 1, 2);
    }

    @Test
    void emptySampleIsZero() {
        assertThat(Percentiles.nearestRank(new double[0], 90)).isZero();
    }

    @Test
    void rejectsPercentileOutsideRange() {
        assertThatThrownBy(() -> Percentiles.nearestRank(new double[]{1}, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
