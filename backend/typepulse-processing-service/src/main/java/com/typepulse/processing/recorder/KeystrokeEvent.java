package com.typepulse.processing.recorder;

import com.typepulse.processing.keyboard.Finger;
import com.typepulse.processing.keyboard.Hand;

/**
 * One completed key press (press and matching release).
 *
 * @param dwellTime   release - press, never negative
 * @param flightTime  press - previous release, null for the first event of a session; negative when keys overlap
 * @param expectedKey character expected at the time of typing, null when unknown
 * @param position    index into the expected text, as tracked by the host
 * @param finger      null when the key is not on the layout
 * @param hand        null when the key is not on the layout
 */
public record KeystrokeEvent(
        String key,
        String code,
        long pressTime,
        long releaseTime,
        long dwellTime,
        Long flightTime,
        boolean correct,
        String expectedKey,
        int position,
        Finger finger,
        Hand hand
) {

    public boolean hasFlightTime() {
        return flightTime != null;
    }
}
