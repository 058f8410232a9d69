package com.typepulse.processing.report;

import com.typepulse.processing.recorder.KeystrokeEvent;

import java.util.List;

/**
 * Headline numbers of a test. Hosts usually track these themselves and pass them in; when they
 * do not, {@link #derive(List)} computes them from the event log.
 *
 * @param wpm      net WPM, null when unknown
 * @param rawWpm   gross WPM, null when unknown
 * @param accuracy percent, null when unknown
 */
public record SessionScore(Integer wpm, Integer rawWpm, Double accuracy, int totalErrors) {

    public static SessionScore derive(List<KeystrokeEvent> events) {
        if (events.isEmpty()) return new SessionScore(null, null, null, 0);

        long correct = events.stream().filter(KeystrokeEvent::correct).count();
        int errors = (int) (events.size() - correct);
        double accuracy = Math.round(correct * 10000.0 / events.size()) / 100.0;

        Integer wpm = null;
        Integer rawWpm = null;
        if (events.size() >= 2) {
            long durationMs = events.get(events.size() - 1).releaseTime() - events.get(0).pressTime();
            if (durationMs > 0) {
                double minutes = durationMs / 60000.0;
                wpm = (int) Math.round(correct / 5.0 / minutes);
                rawWpm = (int) Math.round(events.size() / 5.0 / minutes);
            }
        }
        return new SessionScore(wpm, rawWpm, accuracy, errors);
    }
}
