package com.typepulse.processing.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.typepulse.anomaly.model.AntiCheatResult;
import com.typepulse.processing.analytics.DigraphTiming;
import com.typepulse.processing.analytics.ErrorType;
import com.typepulse.processing.analytics.WindowedProfile.PeakWindow;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything computed for one finished typing test. Any field that could not be computed
 * from the data available is null; consumers must treat every field as optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalyticsReport(
        Integer wpm,
        Integer rawWpm,
        Double accuracy,
        Double consistency,
        Integer consistencyRating,
        Double avgDwellTime,
        Double avgFlightTime,
        Double stdDevFlightTime,
        String fastestDigraph,
        String slowestDigraph,
        List<DigraphTiming> topDigraphs,
        List<DigraphTiming> bottomDigraphs,
        Map<String, Integer> fingerUsage,
        Double handBalance,
        int totalErrors,
        Map<ErrorType, Integer> errorsByType,
        Set<String> errorKeys,
        List<Integer> wpmByPosition,
        List<String> slowestWords,
        Map<String, Integer> keyHeatmap,
        Integer burstWpm,
        Integer adjustedWpm,
        List<Integer> rollingAccuracy,
        Integer typingRhythm,
        PeakWindow peakPerformanceWindow,
        Integer fatigueIndicator,
        Integer errorBurstCount,
        AntiCheatResult antiCheat
) {}
