package com.typepulse.anomaly.stats;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SampleStatsTest {

  @Test
  void shouldComputePopulationStatistics() {
    SampleStats stats = SampleStats.of(List.of(2L, 4L, 4L, 4L, 5L, 5L, 7L, 9L));

    assertThat(stats.count()).isEqualTo(8);
    assertThat(stats.mean()).isEqualTo(5.0);
    assertThat(stats.variance()).isEqualTo(4.0);
    assertThat(stats.stddev()).isEqualTo(2.0);
    assertThat(stats.coefficientOfVariation()).isCloseTo(0.4, within(1e-9));
  }

  @Test
  void shouldReportEmptySampleWithoutNaN() {
    SampleStats stats = SampleStats.of(List.<Long>of());

    assertThat(stats.isEmpty()).isTrue();
    assertThat(stats.mean()).isZero();
    assertThat(stats.variance()).isZero();
  }

  @Test
  void shouldReportNaNCoefficientForZeroMean() {
    assertThat(SampleStats.of(List.of(0L, 0L)).coefficientOfVariation()).isNaN();
  }
}
