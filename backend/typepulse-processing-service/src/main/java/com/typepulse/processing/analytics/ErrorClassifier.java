package com.typepulse.processing.analytics;

import com.typepulse.processing.recorder.KeystrokeEvent;
import com.typepulse.processing.text.WordSpans;
import com.typepulse.processing.text.WordSpans.WordSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class ErrorClassifier {

    public static final int MIN_EVENTS_FOR_BURSTS = 3;
    public static final int MIN_EVENTS_FOR_WORDS = 5;
    public static final int MIN_RESOLVABLE_WORDS = 3;
    public static final double SLOW_WORD_FACTOR = 1.3;
    public static final int MAX_SLOW_WORDS = 10;

    private ErrorClassifier() {}

    public static ErrorProfile classify(List<KeystrokeEvent> events, String expectedText) {
        Map<ErrorType, Integer> byType = new EnumMap<>(ErrorType.class);
        for (ErrorType type : ErrorType.values()) byType.put(type, 0);
        Set<String> errorKeys = new LinkedHashSet<>();
        int errors = 0;

        for (KeystrokeEvent e : events) {
            if (e.correct()) continue;
            errors++;
            byType.merge(typeOf(e), 1, Integer::sum);
            if (e.expectedKey() != null) errorKeys.add(e.expectedKey());
        }

        return new ErrorProfile(
                errors,
                Collections.unmodifiableMap(byType),
                Collections.unmodifiableSet(errorKeys),
                errorBurstCount(events),
                slowestWords(events, expectedText));
    }

    public static ErrorType typeOf(KeystrokeEvent e) {
        if (e.expectedKey() == null) return ErrorType.OTHER;
        return Objects.equals(e.key(), e.expectedKey()) ? ErrorType.DOUBLET : ErrorType.SUBSTITUTION;
    }

    // a run of any length counts once
    public static Integer errorBurstCount(List<KeystrokeEvent> events) {
        if (events.size() < MIN_EVENTS_FOR_BURSTS) return null;

        int bursts = 0;
        boolean inBurst = false;
        for (KeystrokeEvent e : events) {
            if (!e.correct()) {
                if (!inBurst) bursts++;
                inBurst = true;
            } else {
                inBurst = false;
            }
        }
        return bursts;
    }

    /**
     * Words whose typing time exceeds {@value #SLOW_WORD_FACTOR} times the mean word time,
     * slowest first. A word resolves when at least two events fall inside its span and the
     * span has positive duration.
     */
    public static List<String> slowestWords(List<KeystrokeEvent> events, String expectedText) {
        if (events.size() < MIN_EVENTS_FOR_WORDS) return null;
        List<WordSpan> spans = WordSpans.of(expectedText);
        if (spans.size() < 2) return null;

        record WordTime(String word, long duration) {}
        List<WordTime> timed = new ArrayList<>();
        for (WordSpan span : spans) {
            List<KeystrokeEvent> inWord = events.stream().filter(e -> span.contains(e.position())).toList();
            if (inWord.size() < 2) continue;
            long duration = inWord.get(inWord.size() - 1).releaseTime() - inWord.get(0).pressTime();
            if (duration > 0) timed.add(new WordTime(span.word(), duration));
        }
        if (timed.size() < MIN_RESOLVABLE_WORDS) return null;

        double mean = timed.stream().mapToLong(WordTime::duration).average().orElse(0);
        return timed.stream()
                .filter(w -> w.duration() > mean * SLOW_WORD_FACTOR)
                .sorted(Comparator.comparingLong(WordTime::duration).reversed())
                .limit(MAX_SLOW_WORDS)
                .map(WordTime::word)
                .toList();
    }
}
