package com.typepulse.processing.replay;

/**
 * One line of a captured session.
 * <ul>
 *   <li>{@code down}: key, code, timestamp</li>
 *   <li>{@code up}: key, code, timestamp, correct; expected and position override the cursor defaults when present</li>
 *   <li>{@code cursor}: position becomes the session cursor</li>
 * </ul>
 */
public record CapturedKeyEvent(
        String type,
        String key,
        String code,
        long timestamp,
        Boolean correct,
        String expected,
        Integer position
) {}
