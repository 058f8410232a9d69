package com.typepulse.anomaly.model;

/**
 * One keystroke as submitted by a race client.
 *
 * @param trusted whether the browser marked the event as user-generated; null when the client did not say
 */
public record SubmittedKeystroke(
    String key,
    String expected,
    long timestamp,
    boolean correct,
    int position,
    Boolean trusted
) {}
