package com.typepulse.anomaly.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of the synthetic-input heuristics for one session.
 *
 * @param suspicious             true once the number of flags reaches the configured threshold
 * @param flags                  heuristics that fired, in detection order
 * @param validationScore        0-100, lower is more suspicious
 * @param minInterval            smallest positive press-to-press gap in ms, null when none
 * @param intervalVariance       population variance of those gaps (ms², two decimals), null when fewer than two
 * @param syntheticInputDetected true when a heuristic indicating automated input fired
 */
public record AntiCheatResult(
    boolean suspicious,
    Set<SuspicionFlag> flags,
    int validationScore,
    Long minInterval,
    Double intervalVariance,
    boolean syntheticInputDetected
) {

  public AntiCheatResult {
    flags = Collections.unmodifiableSet(new LinkedHashSet<>(flags));
  }

  /** Not enough data to judge. */
  public static AntiCheatResult neutral() {
    return new AntiCheatResult(false, Set.of(), 100, null, null, false);
  }

  public boolean hasFlag(SuspicionFlag flag) {
    return flags.contains(flag);
  }
}
