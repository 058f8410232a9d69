package com.typepulse.anomaly.detection;

/**
 * Tunables for {@link AntiCheatValidator}. Changing any of these changes the false-positive
 * behaviour of every downstream consumer, so keep them pinned per deployment.
 */
public record AntiCheatThresholds(
    int minKeystrokesForAnalysis,
    long minKeystrokeIntervalMs,
    long suspectIntervalMs,
    double maxWpmWithoutFlag,
    double maxConsistentVariance,
    int minIntervalsForPattern,
    int burstWindowSize,
    double burstThresholdRatio,
    double perfectRhythmThreshold,
    long maxPlausibleFlightMs,
    int minUniformFlightSamples,
    int suspiciousFlagThreshold,
    int flagPenalty,
    int syntheticPenalty
) {

  public static AntiCheatThresholds defaults() {
    return new AntiCheatThresholds(
        20,    // keystrokes before any judgement is made
        10,    // ms, faster than any human key-to-key press
        25,    // ms, fast enough to count towards a burst
        200,   // wpm
        5,     // ms² for variance checks, ms for delta checks
        20,
        10,
        0.8,
        0.95,
        500,   // ms, upper bound of the flight-time band
        10,
        2,
        20,
        30);
  }
}
