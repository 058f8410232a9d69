package com.typepulse.anomaly.detection;

import com.typepulse.anomaly.model.KeystrokeTimings;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

final class TimingFixtures {

  private TimingFixtures() {}

  /** {@code count} presses {@code interval} ms apart, each held {@code dwell} ms. */
  static KeystrokeTimings uniform(int count, long interval, long dwell) {
    List<Long> presses = new ArrayList<>();
    List<Long> flights = new ArrayList<>();
    long t = 1_000;
    for (int i = 0; i < count; i++) {
      presses.add(t);
      if (i > 0) flights.add(interval - dwell);
      t += interval;
    }
    return new KeystrokeTimings(presses, flights);
  }

  /** Human-like presses: gaussian gaps (mean 150 ms, sd 40 ms, floor 60 ms), dwell 40-100 ms. */
  static KeystrokeTimings human(int count, long seed) {
    Random random = new Random(seed);
    List<Long> presses = new ArrayList<>();
    List<Long> flights = new ArrayList<>();
    long t = 1_000;
    long lastRelease = -1;
    for (int i = 0; i < count; i++) {
      if (i > 0) t += Math.max(60, Math.round(150 + random.nextGaussian() * 40));
      presses.add(t);
      if (lastRelease >= 0) flights.add(t - lastRelease);
      lastRelease = t + 40 + random.nextInt(61);
    }
    return new KeystrokeTimings(presses, flights);
  }

  static KeystrokeTimings fromGaps(long... gaps) {
    List<Long> presses = new ArrayList<>();
    long t = 1_000;
    presses.add(t);
    for (long gap : gaps) {
      t += gap;
      presses.add(t);
    }
    return new KeystrokeTimings(presses, List.of());
  }
}
