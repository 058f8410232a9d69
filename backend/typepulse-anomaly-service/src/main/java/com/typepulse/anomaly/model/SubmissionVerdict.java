package com.typepulse.anomaly.model;

import java.util.List;

public record SubmissionVerdict(
    boolean valid,
    boolean flagged,
    List<SuspicionFlag> flagReasons,
    int serverCalculatedWpm,
    boolean requiresReview,
    int suspiciousPatterns,
    Metrics metrics
) {
  public SubmissionVerdict {
    flagReasons = List.copyOf(flagReasons);
  }

  public record Metrics(
      double avgInterval,
      long minInterval,
      double stdDevInterval,
      int clientReportedWpm,
      int wpmDiscrepancy
  ) {}
}
