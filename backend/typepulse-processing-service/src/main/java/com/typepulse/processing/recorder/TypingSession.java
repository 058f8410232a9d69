package com.typepulse.processing.recorder;

import com.typepulse.processing.keyboard.Finger;
import com.typepulse.processing.keyboard.KeyboardLayout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Records the key events of one timed typing test against a fixed expected text.
 * <p>
 * Not thread-safe: press/release callbacks are expected serially from the interaction thread.
 * Take a {@link #snapshot()} before handing the log to analytics on another thread.
 * <p>
 * The cursor position is owned by the host and never advanced here, so backspacing and IME
 * composition are handled wherever the input state lives.
 */
public class TypingSession {

    private final String expectedText;
    private final List<KeystrokeEvent> events = new ArrayList<>();
    private final Map<String, Long> pendingPresses = new HashMap<>();
    private Long lastReleaseTime;
    private int cursorPosition;

    public TypingSession(String expectedText) {
        this.expectedText = Objects.requireNonNull(expectedText, "expectedText");
    }

    // key repeat: the first press time wins
    public void onKeyDown(String key, String code, long timestamp) {
        if (key == null) return;
        pendingPresses.putIfAbsent(key, timestamp);
    }

    public void onKeyUp(String key, String code, long timestamp, boolean correct) {
        onKeyUp(key, code, timestamp, correct, expectedAt(cursorPosition), cursorPosition);
    }

    /**
     * Release with caller-supplied expected character (null for none) and position.
     * A release without a matching press is dropped, as is one with no key glyph.
     */
    public void onKeyUp(String key, String code, long timestamp, boolean correct, String expectedKey, int position) {
        if (key == null) return;
        Long pressTime = pendingPresses.remove(key);
        if (pressTime == null) return;
        // clock went backwards; recording it would give a negative dwell
        if (timestamp < pressTime) return;

        Long flightTime = lastReleaseTime != null ? pressTime - lastReleaseTime : null;
        Finger finger = KeyboardLayout.fingerFor(key, code).orElse(null);

        events.add(new KeystrokeEvent(
                key,
                code,
                pressTime,
                timestamp,
                timestamp - pressTime,
                flightTime,
                correct,
                expectedKey,
                position,
                finger,
                finger != null ? finger.hand() : null));
        lastReleaseTime = timestamp;
    }

    public String expectedText() {
        return expectedText;
    }

    public int cursorPosition() {
        return cursorPosition;
    }

    public void setCursorPosition(int cursorPosition) {
        this.cursorPosition = cursorPosition;
    }

    public List<KeystrokeEvent> events() {
        return Collections.unmodifiableList(events);
    }

    public List<KeystrokeEvent> snapshot() {
        return List.copyOf(events);
    }

    public int pendingKeyCount() {
        return pendingPresses.size();
    }

    public void reset() {
        events.clear();
        pendingPresses.clear();
        lastReleaseTime = null;
        cursorPosition = 0;
    }

    private String expectedAt(int position) {
        if (position < 0 || position >= expectedText.length()) return null;
        return String.valueOf(expectedText.charAt(position));
    }
}
