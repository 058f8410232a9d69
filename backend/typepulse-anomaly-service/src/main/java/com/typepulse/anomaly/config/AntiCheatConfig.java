package com.typepulse.anomaly.config;

import com.typepulse.anomaly.detection.AntiCheatThresholds;
import com.typepulse.anomaly.detection.AntiCheatValidator;
import com.typepulse.anomaly.detection.ChallengePhrases;
import com.typepulse.anomaly.detection.RaceSubmissionValidator;
import com.typepulse.anomaly.detection.SubmissionThresholds;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;

@Configuration
public class AntiCheatConfig {

  @Bean
  public AntiCheatThresholds antiCheatThresholds(
      @Value("${typepulse.anticheat.min-keystrokes-for-analysis:20}") int minKeystrokes,
      @Value("${typepulse.anticheat.min-keystroke-interval-ms:10}") long minIntervalMs,
      @Value("${typepulse.anticheat.suspect-interval-ms:25}") long suspectIntervalMs,
      @Value("${typepulse.anticheat.max-wpm-without-flag:200}") double maxWpm,
      @Value("${typepulse.anticheat.max-consistent-variance:5}") double maxConsistentVariance,
      @Value("${typepulse.anticheat.min-intervals-for-pattern:20}") int minIntervalsForPattern,
      @Value("${typepulse.anticheat.burst-window-size:10}") int burstWindowSize,
      @Value("${typepulse.anticheat.burst-threshold-ratio:0.8}") double burstRatio,
      @Value("${typepulse.anticheat.perfect-rhythm-threshold:0.95}") double perfectRhythm,
      @Value("${typepulse.anticheat.max-plausible-flight-ms:500}") long maxFlightMs,
      @Value("${typepulse.anticheat.min-uniform-flight-samples:10}") int minFlightSamples,
      @Value("${typepulse.anticheat.suspicious-flag-threshold:2}") int flagThreshold,
      @Value("${typepulse.anticheat.flag-penalty:20}") int flagPenalty,
      @Value("${typepulse.anticheat.synthetic-penalty:30}") int syntheticPenalty) {
    return new AntiCheatThresholds(minKeystrokes, minIntervalMs, suspectIntervalMs, maxWpm,
        maxConsistentVariance, minIntervalsForPattern, burstWindowSize, burstRatio, perfectRhythm,
        maxFlightMs, minFlightSamples, flagThreshold, flagPenalty, syntheticPenalty);
  }

  @Bean
  public SubmissionThresholds submissionThresholds(
      @Value("${typepulse.submission.min-keystrokes-for-analysis:20}") int minKeystrokes,
      @Value("${typepulse.submission.min-keystroke-interval-ms:10}") long minIntervalMs,
      @Value("${typepulse.submission.suspect-interval-ms:25}") long suspectIntervalMs,
      @Value("${typepulse.submission.wpm-discrepancy-threshold:15}") int wpmDiscrepancy,
      @Value("${typepulse.submission.perfect-accuracy-wpm-threshold:80}") int perfectAccuracyWpm,
      @Value("${typepulse.submission.max-wpm-without-certification:100}") int maxUncertifiedWpm,
      @Value("${typepulse.submission.certification-tolerance:1.25}") double certificationTolerance,
      @Value("${typepulse.submission.max-consistent-interval-delta:5}") long maxDelta,
      @Value("${typepulse.submission.min-intervals-for-pattern:10}") int minIntervalsForPattern,
      @Value("${typepulse.submission.programmatic-ratio:0.9}") double programmaticRatio,
      @Value("${typepulse.submission.burst-window-size:10}") int burstWindowSize,
      @Value("${typepulse.submission.burst-threshold-ratio:0.8}") double burstRatio,
      @Value("${typepulse.submission.untrusted-ratio:0.1}") double untrustedRatio,
      @Value("${typepulse.submission.max-suspicious-patterns:3}") int maxPatterns,
      @Value("${typepulse.submission.challenge-min-keystrokes:10}") int challengeMinKeystrokes) {
    return new SubmissionThresholds(minKeystrokes, minIntervalMs, suspectIntervalMs, wpmDiscrepancy,
        perfectAccuracyWpm, maxUncertifiedWpm, certificationTolerance, maxDelta, minIntervalsForPattern,
        programmaticRatio, burstWindowSize, burstRatio, untrustedRatio, maxPatterns, challengeMinKeystrokes);
  }

  @Bean
  public AntiCheatValidator antiCheatValidator(AntiCheatThresholds thresholds) {
    return new AntiCheatValidator(thresholds);
  }

  @Bean
  public RaceSubmissionValidator raceSubmissionValidator(SubmissionThresholds thresholds) {
    return new RaceSubmissionValidator(thresholds);
  }

  @Bean
  public ChallengePhrases challengePhrases() {
    return new ChallengePhrases(new SecureRandom());
  }
}
