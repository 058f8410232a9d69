package com.typepulse.processing.analytics;

import java.util.List;

/**
 * @param fastest single digraph with the lowest mean transition, any occurrence count
 * @param slowest single digraph with the highest mean transition, any occurrence count
 * @param top     five fastest repeated digraphs, null when fewer than five qualify
 * @param bottom  five slowest repeated digraphs, slowest first, null when fewer than five qualify
 */
public record DigraphProfile(
        String fastest,
        String slowest,
        List<DigraphTiming> top,
        List<DigraphTiming> bottom
) {}
