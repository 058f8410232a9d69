package com.typepulse.processing.analytics;

import com.typepulse.anomaly.stats.SampleStats;
import com.typepulse.processing.recorder.KeystrokeEvent;

import java.util.List;

/**
 * Dwell/flight statistics and the two coefficient-of-variation scores.
 * <p>
 * Both scores map {@code cv = stddev / mean} of flight times to {@code 100 - cv * CV_SCALE},
 * clamped to [0, 100]. Long pauses are dropped first; if that leaves too few samples every
 * positive flight time is used instead.
 */
public final class TimingAnalyzer {

    /**
     * Tunable. Puts ordinary human flight-time variance (cv roughly 0.3 to 1.0) in the
     * 50-85 range. Scores are only comparable across sessions scored with the same value.
     */
    public static final double CV_SCALE = 50.0;

    public static final long PAUSE_THRESHOLD_MS = 1000;

    static final int MIN_CONSISTENCY_SAMPLES = 2;
    static final int MIN_RHYTHM_SAMPLES = 3;

    private TimingAnalyzer() {}

    public static TimingProfile analyze(List<KeystrokeEvent> events) {
        List<Long> dwell = events.stream().map(KeystrokeEvent::dwellTime).toList();
        List<Long> flight = flightTimes(events);

        Double avgDwell = dwell.isEmpty() ? null : SampleStats.of(dwell).mean();
        SampleStats flightStats = SampleStats.of(flight);
        Double avgFlight = flight.isEmpty() ? null : flightStats.mean();
        Double stdDevFlight = flight.size() > 1 ? flightStats.stddev() : null;

        Double consistency = cvScore(flight, MIN_CONSISTENCY_SAMPLES);
        Integer rating = consistency != null ? clamp((int) Math.round(consistency)) : null;
        Double rhythm = cvScore(flight, MIN_RHYTHM_SAMPLES);

        return new TimingProfile(avgDwell, avgFlight, stdDevFlight, consistency, rating,
                rhythm != null ? (int) Math.round(rhythm) : null);
    }

    public static List<Long> flightTimes(List<KeystrokeEvent> events) {
        return events.stream()
                .filter(KeystrokeEvent::hasFlightTime)
                .map(KeystrokeEvent::flightTime)
                .toList();
    }

    static Double cvScore(List<Long> flightTimes, int minSamples) {
        if (flightTimes.size() < minSamples) return null;

        List<Long> sample = flightTimes.stream().filter(f -> f > 0 && f < PAUSE_THRESHOLD_MS).toList();
        if (sample.size() < minSamples) {
            sample = flightTimes.stream().filter(f -> f > 0).toList();
        }
        if (sample.size() < minSamples) return null;

        double cv = SampleStats.of(sample).coefficientOfVariation();
        return Math.max(0.0, Math.min(100.0, 100.0 - cv * CV_SCALE));
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
