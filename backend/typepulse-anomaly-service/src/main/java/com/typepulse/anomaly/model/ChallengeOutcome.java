package com.typepulse.anomaly.model;

/**
 * Result of a verification-challenge attempt. On success {@code certifiedWpm} is the new
 * ceiling above which the user's race results require another challenge.
 */
public record ChallengeOutcome(boolean passed, String reason, Integer serverWpm, Integer certifiedWpm) {

  public static ChallengeOutcome failed(String reason) {
    return new ChallengeOutcome(false, reason, null, null);
  }

  public static ChallengeOutcome passed(int serverWpm, int certifiedWpm) {
    return new ChallengeOutcome(true, null, serverWpm, certifiedWpm);
  }
}
