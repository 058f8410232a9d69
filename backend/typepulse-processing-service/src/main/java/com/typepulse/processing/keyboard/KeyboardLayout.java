package com.typepulse.processing.keyboard;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves which finger typed a key. The physical key code wins; the produced character is
 * the fallback for hosts that only report glyphs. Keys outside {@link PhysicalKey} resolve to
 * empty.
 */
public final class KeyboardLayout {

    private static final Map<String, PhysicalKey> BY_CODE = new HashMap<>();
    private static final Map<Character, PhysicalKey> BY_GLYPH = new HashMap<>();

    static {
        for (PhysicalKey k : PhysicalKey.values()) {
            BY_CODE.put(k.code(), k);
            for (char c : k.glyphs().toCharArray()) {
                BY_GLYPH.put(c, k);
            }
        }
    }

    private KeyboardLayout() {}

    public static Optional<PhysicalKey> resolve(String key, String code) {
        if (code != null) {
            PhysicalKey byCode = BY_CODE.get(code);
            if (byCode != null) return Optional.of(byCode);
        }
        if (key != null && key.length() == 1) {
            return Optional.ofNullable(BY_GLYPH.get(key.charAt(0)));
        }
        return Optional.empty();
    }

    public static Optional<Finger> fingerFor(String key, String code) {
        return resolve(key, code).map(PhysicalKey::finger);
    }
}
