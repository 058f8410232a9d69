package com.typepulse.processing.analytics;

import com.typepulse.anomaly.stats.SampleStats;
import com.typepulse.processing.recorder.KeystrokeEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Transition timing for consecutive key pairs: next press minus previous release. */
public final class DigraphProfiler {

    // rarer digraphs are not ranked
    public static final int MIN_OCCURRENCES = 2;
    public static final int RANK_SIZE = 5;

    private DigraphProfiler() {}

    public static DigraphProfile profile(List<KeystrokeEvent> events) {
        Map<String, List<Long>> transitions = transitions(events);

        String fastest = null;
        String slowest = null;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, List<Long>> e : transitions.entrySet()) {
            double avg = SampleStats.of(e.getValue()).mean();
            if (avg < min) {
                min = avg;
                fastest = e.getKey();
            }
            if (avg > max) {
                max = avg;
                slowest = e.getKey();
            }
        }

        List<DigraphTiming> ranked = ranked(transitions);
        if (ranked == null) {
            return new DigraphProfile(fastest, slowest, null, null);
        }
        List<DigraphTiming> bottom = new ArrayList<>(ranked.subList(ranked.size() - RANK_SIZE, ranked.size()));
        Collections.reverse(bottom);
        return new DigraphProfile(fastest, slowest, List.copyOf(ranked.subList(0, RANK_SIZE)), List.copyOf(bottom));
    }

    static Map<String, List<Long>> transitions(List<KeystrokeEvent> events) {
        Map<String, List<Long>> out = new LinkedHashMap<>();
        for (int i = 1; i < events.size(); i++) {
            KeystrokeEvent prev = events.get(i - 1);
            KeystrokeEvent curr = events.get(i);
            out.computeIfAbsent(prev.key() + curr.key(), k -> new ArrayList<>())
                    .add(curr.pressTime() - prev.releaseTime());
        }
        return out;
    }

    private static List<DigraphTiming> ranked(Map<String, List<Long>> transitions) {
        if (transitions.size() < RANK_SIZE) return null;

        List<DigraphTiming> eligible = new ArrayList<>();
        transitions.forEach((digraph, times) -> {
            if (times.size() >= MIN_OCCURRENCES) {
                eligible.add(new DigraphTiming(digraph, Math.round(SampleStats.of(times).mean()), times.size()));
            }
        });
        if (eligible.size() < RANK_SIZE) return null;

        eligible.sort(Comparator.comparingLong(DigraphTiming::avgTime));
        return eligible;
    }
}
