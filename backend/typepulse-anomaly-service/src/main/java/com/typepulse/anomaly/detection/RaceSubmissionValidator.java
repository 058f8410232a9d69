package com.typepulse.anomaly.detection;

import com.typepulse.anomaly.model.ChallengeOutcome;
import com.typepulse.anomaly.model.SubmissionContext;
import com.typepulse.anomaly.model.SubmissionVerdict;
import com.typepulse.anomaly.model.SubmittedKeystroke;
import com.typepulse.anomaly.model.SuspicionFlag;
import com.typepulse.anomaly.stats.SampleStats;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Server-side re-check of a race result. Unlike {@link AntiCheatValidator} this never trusts
 * the client's timing summary: WPM and interval statistics are recomputed from the raw
 * keystroke timestamps, and the client-reported WPM is compared against that.
 */
public class RaceSubmissionValidator {

  private final SubmissionThresholds t;

  public RaceSubmissionValidator(SubmissionThresholds thresholds) {
    this.t = Objects.requireNonNull(thresholds, "thresholds");
  }

  public SubmissionVerdict validate(List<SubmittedKeystroke> keystrokes, SubmissionContext ctx) {
    int clientWpm = ctx.clientReportedWpm();
    if (keystrokes.size() < t.minKeystrokesForAnalysis()) {
      return new SubmissionVerdict(true, false, List.of(), clientWpm, false, 0,
          new SubmissionVerdict.Metrics(0, 0, 0, clientWpm, 0));
    }

    List<Long> intervals = intervals(keystrokes);
    SampleStats stats = SampleStats.of(intervals);
    long min = intervals.stream().min(Long::compare).orElse(0L);
    int serverWpm = serverWpm(keystrokes);
    int discrepancy = Math.abs(serverWpm - clientWpm);

    List<SuspicionFlag> reasons = new ArrayList<>();
    int patterns = 0;
    boolean review = false;

    if (min < t.minKeystrokeIntervalMs()) {
      reasons.add(SuspicionFlag.INHUMAN_SPEED);
      patterns++;
      review = true;
    }
    if (discrepancy > t.wpmDiscrepancyThreshold()) {
      reasons.add(SuspicionFlag.WPM_DISCREPANCY);
      patterns++;
      review = true;
    }
    if (hasBurst(keystrokes.size(), intervals)) {
      reasons.add(SuspicionFlag.BURST_TYPING);
      patterns++;
    }
    if (isProgrammatic(intervals)) {
      reasons.add(SuspicionFlag.PROGRAMMATIC_PATTERN);
      patterns++;
      review = true;
    }
    if (hasUntrustedEvents(keystrokes)) {
      reasons.add(SuspicionFlag.UNTRUSTED_EVENTS);
      patterns++;
      review = true;
    }

    long correct = keystrokes.stream().filter(SubmittedKeystroke::correct).count();
    if (correct == keystrokes.size() && serverWpm > t.perfectAccuracyWpmThreshold()) {
      reasons.add(SuspicionFlag.PERFECT_ACCURACY_HIGH_WPM);
      patterns++;
    }

    if (serverWpm > t.maxWpmWithoutCertification() && ctx.identifiedUser()) {
      Integer certified = ctx.certifiedWpm();
      if (certified == null || serverWpm > certified * t.certificationTolerance()) {
        reasons.add(SuspicionFlag.REQUIRES_CERTIFICATION);
        review = true;
      }
    }

    boolean valid = patterns < t.maxSuspiciousPatterns() && !reasons.contains(SuspicionFlag.INHUMAN_SPEED);
    return new SubmissionVerdict(valid, !reasons.isEmpty(), reasons, serverWpm, review, patterns,
        new SubmissionVerdict.Metrics(stats.mean(), min, stats.stddev(), clientWpm, discrepancy));
  }

  /**
   * Checks a verification-challenge attempt. A pass certifies the user at 125% of the speed
   * measured here.
   */
  public ChallengeOutcome verifyChallenge(List<SubmittedKeystroke> keystrokes, int clientWpm) {
    if (keystrokes.size() < t.challengeMinKeystrokes()) {
      return ChallengeOutcome.failed("Not enough keystrokes recorded");
    }

    List<Long> intervals = intervals(keystrokes);
    long min = intervals.stream().min(Long::compare).orElse(0L);
    int serverWpm = serverWpm(keystrokes);

    if (min < t.minKeystrokeIntervalMs()) {
      return ChallengeOutcome.failed("Inhuman typing speed detected");
    }
    if (isProgrammatic(intervals)) {
      return ChallengeOutcome.failed("Suspicious typing pattern detected");
    }
    if (Math.abs(serverWpm - clientWpm) > t.wpmDiscrepancyThreshold() * 2) {
      return ChallengeOutcome.failed("WPM mismatch detected");
    }
    return ChallengeOutcome.passed(serverWpm, (int) Math.round(serverWpm * t.certificationTolerance()));
  }

  static List<Long> intervals(List<SubmittedKeystroke> keystrokes) {
    List<Long> out = new ArrayList<>(Math.max(0, keystrokes.size() - 1));
    for (int i = 1; i < keystrokes.size(); i++) {
      out.add(keystrokes.get(i).timestamp() - keystrokes.get(i - 1).timestamp());
    }
    return out;
  }

  static int serverWpm(List<SubmittedKeystroke> keystrokes) {
    if (keystrokes.size() < 2) return 0;
    long totalMs = keystrokes.get(keystrokes.size() - 1).timestamp() - keystrokes.get(0).timestamp();
    if (totalMs <= 0) return 0;
    long correct = keystrokes.stream().filter(SubmittedKeystroke::correct).count();
    return (int) Math.round((correct / 5.0) / (totalMs / 60000.0));
  }

  private boolean hasBurst(int keystrokeCount, List<Long> intervals) {
    int window = t.burstWindowSize();
    if (keystrokeCount < window * 2) return false;
    for (int i = 0; i <= intervals.size() - window; i++) {
      int fast = 0;
      for (int j = i; j < i + window; j++) {
        if (intervals.get(j) < t.suspectIntervalMs()) fast++;
      }
      if ((double) fast / window >= t.burstThresholdRatio()) return true;
    }
    return false;
  }

  private boolean isProgrammatic(List<Long> intervals) {
    if (intervals.size() < t.minIntervalsForPattern()) return false;
    int consistent = 0;
    for (int i = 1; i < intervals.size(); i++) {
      if (Math.abs(intervals.get(i) - intervals.get(i - 1)) < t.maxConsistentIntervalDelta()) {
        consistent++;
      }
    }
    return (double) consistent / intervals.size() > t.programmaticRatio();
  }

  private boolean hasUntrustedEvents(List<SubmittedKeystroke> keystrokes) {
    long untrusted = keystrokes.stream().filter(k -> Boolean.FALSE.equals(k.trusted())).count();
    return untrusted > keystrokes.size() * t.untrustedRatio();
  }
}
