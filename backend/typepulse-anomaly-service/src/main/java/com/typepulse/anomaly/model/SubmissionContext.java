package com.typepulse.anomaly.model;

/**
 * What the caller knows about a race submission besides its keystrokes.
 *
 * @param identifiedUser whether the submission belongs to a signed-in user
 * @param certifiedWpm   the user's certified WPM, null when the user has never passed a challenge
 */
public record SubmissionContext(int clientReportedWpm, boolean identifiedUser, Integer certifiedWpm) {

  public static SubmissionContext anonymous(int clientReportedWpm) {
    return new SubmissionContext(clientReportedWpm, false, null);
  }
}
