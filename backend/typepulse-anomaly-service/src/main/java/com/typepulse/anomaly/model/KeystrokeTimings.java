package com.typepulse.anomaly.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Timing vectors extracted from a closed event log: press timestamps in log order and the
 * flight times of the events that have one.
 */
public record KeystrokeTimings(List<Long> pressTimes, List<Long> flightTimes) {

  public KeystrokeTimings {
    pressTimes = List.copyOf(Objects.requireNonNull(pressTimes, "pressTimes"));
    flightTimes = List.copyOf(Objects.requireNonNull(flightTimes, "flightTimes"));
  }

  public int eventCount() {
    return pressTimes.size();
  }

  /** Consecutive press-to-press gaps, keeping only strictly positive ones. */
  public List<Long> positivePressIntervals() {
    List<Long> out = new ArrayList<>(Math.max(0, pressTimes.size() - 1));
    for (int i = 1; i < pressTimes.size(); i++) {
      long interval = pressTimes.get(i) - pressTimes.get(i - 1);
      if (interval > 0) out.add(interval);
    }
    return out;
  }
}
