package com.typepulse.anomaly.detection;

import com.typepulse.anomaly.model.AntiCheatResult;
import com.typepulse.anomaly.model.KeystrokeTimings;
import com.typepulse.anomaly.model.SuspicionFlag;
import com.typepulse.anomaly.stats.SampleStats;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Heuristic pass over a session's keystroke timings that flags input inconsistent with human
 * motor variability. Each heuristic is independent; the score is
 * {@code 100 - flagPenalty * flags - (syntheticPenalty if synthetic)}, clamped to [0, 100].
 * Stateless and thread-safe.
 */
public class AntiCheatValidator {

  private final AntiCheatThresholds t;

  public AntiCheatValidator(AntiCheatThresholds thresholds) {
    this.t = Objects.requireNonNull(thresholds, "thresholds");
  }

  public AntiCheatThresholds thresholds() {
    return t;
  }

  /**
   * @param timings press timestamps and flight times of the closed event log
   * @param wpm     the session's net WPM as reported by the host, checked against the hard ceiling
   */
  public AntiCheatResult validate(KeystrokeTimings timings, double wpm) {
    if (timings.eventCount() < t.minKeystrokesForAnalysis()) {
      return AntiCheatResult.neutral();
    }

    List<Long> intervals = timings.positivePressIntervals();
    Long minInterval = intervals.stream().min(Long::compare).orElse(null);
    SampleStats stats = SampleStats.of(intervals);
    Double variance = intervals.size() > 1 ? stats.variance() : null;

    Set<SuspicionFlag> flags = new LinkedHashSet<>();
    boolean synthetic = false;

    if (minInterval != null && minInterval < t.minKeystrokeIntervalMs()) {
      flags.add(SuspicionFlag.INHUMAN_SPEED);
      synthetic = true;
    }

    if (wpm > t.maxWpmWithoutFlag()) {
      flags.add(SuspicionFlag.IMPOSSIBLE_WPM);
    }

    if (variance != null && variance < t.maxConsistentVariance() && intervals.size() > t.minIntervalsForPattern()) {
      flags.add(SuspicionFlag.PROGRAMMATIC_PATTERN);
      synthetic = true;
    }

    if (hasSuspiciousBurst(intervals)) {
      flags.add(SuspicionFlag.BURST_TYPING);
    }

    if (hasPerfectRhythm(intervals)) {
      flags.add(SuspicionFlag.PERFECT_RHYTHM);
      synthetic = true;
    }

    if (hasUniformFlightTimes(timings.flightTimes())) {
      // same signal as programmatic_pattern when both fire; count it once
      if (!flags.contains(SuspicionFlag.PROGRAMMATIC_PATTERN)) {
        flags.add(SuspicionFlag.UNIFORM_FLIGHT_TIMES);
      }
      synthetic = true;
    }

    int score = 100 - flags.size() * t.flagPenalty() - (synthetic ? t.syntheticPenalty() : 0);
    score = Math.max(0, Math.min(100, score));
    boolean suspicious = flags.size() >= t.suspiciousFlagThreshold();

    return new AntiCheatResult(
        suspicious,
        flags,
        score,
        minInterval,
        variance != null ? Math.round(variance * 100) / 100.0 : null,
        synthetic);
  }

  boolean hasSuspiciousBurst(List<Long> intervals) {
    int window = t.burstWindowSize();
    if (intervals.size() < window * 2) return false;

    for (int i = 0; i <= intervals.size() - window; i++) {
      int fast = 0;
      for (int j = i; j < i + window; j++) {
        if (intervals.get(j) < t.suspectIntervalMs()) fast++;
      }
      if ((double) fast / window >= t.burstThresholdRatio()) return true;
    }
    return false;
  }

  boolean hasPerfectRhythm(List<Long> intervals) {
    if (intervals.size() < t.minIntervalsForPattern()) return false;

    int consistent = 0;
    for (int i = 1; i < intervals.size(); i++) {
      if (Math.abs(intervals.get(i) - intervals.get(i - 1)) < t.maxConsistentVariance()) {
        consistent++;
      }
    }
    return (double) consistent / intervals.size() > t.perfectRhythmThreshold();
  }

  boolean hasUniformFlightTimes(List<Long> flightTimes) {
    if (flightTimes.size() <= t.minIntervalsForPattern()) return false;

    List<Long> plausible = flightTimes.stream()
        .filter(f -> f > 0 && f < t.maxPlausibleFlightMs())
        .toList();
    if (plausible.size() <= t.minUniformFlightSamples()) return false;

    return SampleStats.of(plausible).variance() < t.maxConsistentVariance();
  }
}
