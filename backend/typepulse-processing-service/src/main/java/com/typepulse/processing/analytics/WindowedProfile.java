package com.typepulse.processing.analytics;

import java.util.List;

public record WindowedProfile(
        Integer burstWpm,
        List<Integer> wpmByPosition,
        List<Integer> rollingAccuracy,
        PeakWindow peakPerformanceWindow,
        Integer fatigueIndicator,
        Integer adjustedWpm
) {

    /** Best contiguous stretch of the session, positions taken from its first and last event. */
    public record PeakWindow(int startPosition, int endPosition, int wpm) {}
}
