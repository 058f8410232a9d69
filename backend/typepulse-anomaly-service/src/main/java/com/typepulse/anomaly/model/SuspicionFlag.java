package com.typepulse.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SuspicionFlag {
  INHUMAN_SPEED("inhuman_speed"),
  IMPOSSIBLE_WPM("impossible_wpm"),
  PROGRAMMATIC_PATTERN("programmatic_pattern"),
  BURST_TYPING("burst_typing"),
  PERFECT_RHYTHM("perfect_rhythm"),
  UNIFORM_FLIGHT_TIMES("uniform_flight_times"),
  WPM_DISCREPANCY("wpm_discrepancy"),
  UNTRUSTED_EVENTS("untrusted_events"),
  PERFECT_ACCURACY_HIGH_WPM("perfect_accuracy_high_wpm"),
  REQUIRES_CERTIFICATION("requires_certification");

  private final String code;

  SuspicionFlag(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }
}
