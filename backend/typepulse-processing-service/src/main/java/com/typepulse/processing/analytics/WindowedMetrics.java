package com.typepulse.processing.analytics;

import com.typepulse.processing.recorder.KeystrokeEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Metrics computed over windows of the event log: by wall-clock (burst), by equal-size chunks
 * (position buckets, rolling accuracy) and by a sliding fraction of the log (peak window).
 */
public final class WindowedMetrics {

    public static final int MIN_EVENTS = 5;
    public static final long BURST_WINDOW_MS = 5000;
    public static final int POSITION_BUCKETS = 10;
    public static final int ACCURACY_BUCKETS = 5;
    // peak window covers 1/5 of the log
    static final int PEAK_WINDOW_DIVISOR = 5;

    private WindowedMetrics() {}

    public static WindowedProfile analyze(List<KeystrokeEvent> events, Integer netWpm) {
        return new WindowedProfile(
                burstWpm(events),
                wpmByPosition(events),
                rollingAccuracy(events),
                peakPerformanceWindow(events),
                fatigueIndicator(events),
                adjustedWpm(events, netWpm));
    }

    public static Integer burstWpm(List<KeystrokeEvent> events) {
        if (events.size() < MIN_EVENTS) return null;

        long best = 0;
        for (int i = 0; i < events.size(); i++) {
            long windowEnd = events.get(i).pressTime() + BURST_WINDOW_MS;
            int chars = 0;
            for (int j = i; j < events.size(); j++) {
                KeystrokeEvent e = events.get(j);
                if (e.pressTime() > windowEnd) break;
                if (e.correct()) chars++;
            }
            long wpm = Math.round(Wpm.of(chars, BURST_WINDOW_MS));
            if (wpm > best) best = wpm;
        }
        return best > 0 ? (int) Math.min(best, Wpm.MAX_WPM) : null;
    }

    public static List<Integer> wpmByPosition(List<KeystrokeEvent> events) {
        if (events.size() < POSITION_BUCKETS) return null;

        List<Integer> out = new ArrayList<>(POSITION_BUCKETS);
        for (List<KeystrokeEvent> chunk : chunks(events, POSITION_BUCKETS)) {
            if (chunk.size() < 2) {
                out.add(0);
                continue;
            }
            long duration = Wpm.span(chunk);
            if (duration <= 0) {
                out.add(0);
                continue;
            }
            out.add(Wpm.capped(Wpm.of(Wpm.correctCount(chunk), duration)));
        }
        return List.copyOf(out);
    }

    public static List<Integer> rollingAccuracy(List<KeystrokeEvent> events) {
        if (events.size() < MIN_EVENTS) return null;

        List<Integer> out = new ArrayList<>(ACCURACY_BUCKETS);
        for (List<KeystrokeEvent> chunk : chunks(events, ACCURACY_BUCKETS)) {
            if (chunk.isEmpty()) {
                out.add(0);
                continue;
            }
            out.add((int) Math.round(Wpm.correctCount(chunk) * 100.0 / chunk.size()));
        }
        return List.copyOf(out);
    }

    public static WindowedProfile.PeakWindow peakPerformanceWindow(List<KeystrokeEvent> events) {
        if (events.size() < MIN_EVENTS) return null;

        int size = (events.size() + PEAK_WINDOW_DIVISOR - 1) / PEAK_WINDOW_DIVISOR;
        WindowedProfile.PeakWindow best = null;
        long bestRaw = 0;
        for (int i = 0; i + size <= events.size(); i++) {
            List<KeystrokeEvent> window = events.subList(i, i + size);
            long duration = Wpm.span(window);
            if (duration <= 0) continue;

            // ranked uncapped; only the reported value is capped
            long raw = Math.round(Wpm.of(Wpm.correctCount(window), duration));
            if (raw > bestRaw) {
                bestRaw = raw;
                best = new WindowedProfile.PeakWindow(
                        window.get(0).position(), window.get(window.size() - 1).position(), Wpm.capped(raw));
            }
        }
        return best;
    }

    // positive means the typist slowed down
    public static Integer fatigueIndicator(List<KeystrokeEvent> events) {
        if (events.size() < MIN_EVENTS * 2) return null;

        int mid = events.size() / 2;
        double first = halfWpm(events.subList(0, mid));
        double second = halfWpm(events.subList(mid, events.size()));
        if (first == 0.0) return null;

        return (int) Math.round((first - second) / first * 100.0);
    }

    /**
     * Correct characters over first-press-to-last-release time. Falls back to the net WPM
     * only when the log has no usable duration.
     */
    public static Integer adjustedWpm(List<KeystrokeEvent> events, Integer netWpm) {
        if (events.size() >= 2) {
            long duration = Wpm.span(events);
            if (duration > 0) {
                return (int) Math.round(Wpm.of(Wpm.correctCount(events), duration));
            }
        }
        return netWpm != null ? Math.max(0, netWpm) : null;
    }

    private static double halfWpm(List<KeystrokeEvent> half) {
        if (half.size() < MIN_EVENTS) return 0.0;
        long duration = Wpm.span(half);
        if (duration <= 0) return 0.0;
        return Wpm.of(Wpm.correctCount(half), duration);
    }

    // ceil(n / count) events each; trailing chunks may be empty
    static List<List<KeystrokeEvent>> chunks(List<KeystrokeEvent> events, int count) {
        int size = (events.size() + count - 1) / count;
        List<List<KeystrokeEvent>> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int from = Math.min(i * size, events.size());
            int to = Math.min((i + 1) * size, events.size());
            out.add(events.subList(from, to));
        }
        return out;
    }
}
