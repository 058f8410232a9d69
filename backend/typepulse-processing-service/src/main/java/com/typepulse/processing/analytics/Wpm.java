package com.typepulse.processing.analytics;

import com.typepulse.processing.recorder.KeystrokeEvent;

import java.util.List;

/** Words-per-minute arithmetic shared by the windowed metrics. A "word" is five characters. */
final class Wpm {

    static final int CHARS_PER_WORD = 5;
    // guards tiny-denominator windows
    static final int MAX_WPM = 300;

    private Wpm() {}

    static double of(long chars, long durationMs) {
        return (chars / (double) CHARS_PER_WORD) / (durationMs / 60000.0);
    }

    static long correctCount(List<KeystrokeEvent> events) {
        return events.stream().filter(KeystrokeEvent::correct).count();
    }

    // first press to last release, ms
    static long span(List<KeystrokeEvent> events) {
        return events.get(events.size() - 1).releaseTime() - events.get(0).pressTime();
    }

    static int capped(double wpm) {
        return (int) Math.min(Math.round(wpm), MAX_WPM);
    }
}
