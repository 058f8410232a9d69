package com.typepulse.processing.replay;

import java.util.List;

/** @param wpm host-reported net WPM; when null the score is derived from the events */
public record CapturedSession(
        String expectedText,
        Integer wpm,
        Integer rawWpm,
        Double accuracy,
        Integer totalErrors,
        List<CapturedKeyEvent> events
) {}
