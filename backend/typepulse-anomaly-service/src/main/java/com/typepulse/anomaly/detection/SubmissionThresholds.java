package com.typepulse.anomaly.detection;

public record SubmissionThresholds(
    int minKeystrokesForAnalysis,
    long minKeystrokeIntervalMs,
    long suspectIntervalMs,
    int wpmDiscrepancyThreshold,
    int perfectAccuracyWpmThreshold,
    int maxWpmWithoutCertification,
    double certificationTolerance,
    long maxConsistentIntervalDelta,
    int minIntervalsForPattern,
    double programmaticRatio,
    int burstWindowSize,
    double burstThresholdRatio,
    double untrustedRatio,
    int maxSuspiciousPatterns,
    int challengeMinKeystrokes
) {

  public static SubmissionThresholds defaults() {
    return new SubmissionThresholds(20, 10, 25, 15, 80, 100, 1.25, 5, 10, 0.9, 10, 0.8, 0.1, 3, 10);
  }
}
