package com.typepulse.processing.analytics;

import com.typepulse.processing.keyboard.Hand;
import com.typepulse.processing.recorder.KeystrokeEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class KeyUsageProfiler {

    private KeyUsageProfiler() {}

    public static KeyUsageProfile profile(List<KeystrokeEvent> events) {
        Map<String, Integer> fingers = new LinkedHashMap<>();
        Map<String, Integer> heatmap = new LinkedHashMap<>();
        int left = 0;
        int right = 0;

        for (KeystrokeEvent e : events) {
            if (e.key() != null) heatmap.merge(e.key().toUpperCase(Locale.ROOT), 1, Integer::sum);
            if (e.finger() != null) fingers.merge(e.finger().label(), 1, Integer::sum);
            if (e.hand() == Hand.LEFT) left++;
            else if (e.hand() == Hand.RIGHT) right++;
        }

        Double balance = left + right > 0 ? left * 100.0 / (left + right) : null;
        return new KeyUsageProfile(
                Collections.unmodifiableMap(fingers), balance, Collections.unmodifiableMap(heatmap));
    }
}
