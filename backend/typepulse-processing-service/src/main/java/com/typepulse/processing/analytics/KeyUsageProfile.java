package com.typepulse.processing.analytics;

import java.util.Map;

/**
 * @param fingerUsage keystrokes per finger label, only for keys on the layout
 * @param handBalance share of left-hand keystrokes among left and right (0-100), null when neither was seen
 * @param keyHeatmap  keystrokes per upper-cased key glyph
 */
public record KeyUsageProfile(
        Map<String, Integer> fingerUsage,
        Double handBalance,
        Map<String, Integer> keyHeatmap
) {}
