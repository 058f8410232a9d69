package com.typepulse.processing.keyboard;

import static com.typepulse.processing.keyboard.Finger.*;

/**
 * US ANSI keys with the finger that strikes them under touch-typing rules. {@code code} is the
 * physical key code reported by the browser ({@code KeyboardEvent.code}); {@code glyphs} are the
 * characters the key produces, unshifted and shifted.
 */
public enum PhysicalKey {
    BACKQUOTE("Backquote", LEFT_PINKY, "`~"),
    DIGIT1("Digit1", LEFT_PINKY, "1!"),
    DIGIT2("Digit2", LEFT_RING, "2@"),
    DIGIT3("Digit3", LEFT_MIDDLE, "3#"),
    DIGIT4("Digit4", LEFT_INDEX, "4$"),
    DIGIT5("Digit5", LEFT_INDEX, "5%"),
    KEY_Q("KeyQ", LEFT_PINKY, "qQ"),
    KEY_W("KeyW", LEFT_RING, "wW"),
    KEY_E("KeyE", LEFT_MIDDLE, "eE"),
    KEY_R("KeyR", LEFT_INDEX, "rR"),
    KEY_T("KeyT", LEFT_INDEX, "tT"),
    KEY_A("KeyA", LEFT_PINKY, "aA"),
    KEY_S("KeyS", LEFT_RING, "sS"),
    KEY_D("KeyD", LEFT_MIDDLE, "dD"),
    KEY_F("KeyF", LEFT_INDEX, "fF"),
    KEY_G("KeyG", LEFT_INDEX, "gG"),
    KEY_Z("KeyZ", LEFT_PINKY, "zZ"),
    KEY_X("KeyX", LEFT_RING, "xX"),
    KEY_C("KeyC", LEFT_MIDDLE, "cC"),
    KEY_V("KeyV", LEFT_INDEX, "vV"),
    KEY_B("KeyB", LEFT_INDEX, "bB"),
    TAB("Tab", LEFT_PINKY, ""),
    CAPS_LOCK("CapsLock", LEFT_PINKY, ""),
    SHIFT_LEFT("ShiftLeft", LEFT_PINKY, ""),
    CONTROL_LEFT("ControlLeft", LEFT_PINKY, ""),
    ALT_LEFT("AltLeft", LEFT_THUMB, ""),
    META_LEFT("MetaLeft", LEFT_THUMB, ""),
    ESCAPE("Escape", LEFT_PINKY, ""),

    DIGIT6("Digit6", RIGHT_INDEX, "6^"),
    DIGIT7("Digit7", RIGHT_INDEX, "7&"),
    DIGIT8("Digit8", RIGHT_MIDDLE, "8*"),
    DIGIT9("Digit9", RIGHT_RING, "9("),
    DIGIT0("Digit0", RIGHT_PINKY, "0)"),
    MINUS("Minus", RIGHT_PINKY, "-_"),
    EQUAL("Equal", RIGHT_PINKY, "=+"),
    BACKSPACE("Backspace", RIGHT_PINKY, ""),
    KEY_Y("KeyY", RIGHT_INDEX, "yY"),
    KEY_U("KeyU", RIGHT_INDEX, "uU"),
    KEY_I("KeyI", RIGHT_MIDDLE, "iI"),
    KEY_O("KeyO", RIGHT_RING, "oO"),
    KEY_P("KeyP", RIGHT_PINKY, "pP"),
    BRACKET_LEFT("BracketLeft", RIGHT_PINKY, "[{"),
    BRACKET_RIGHT("BracketRight", RIGHT_PINKY, "]}"),
    BACKSLASH("Backslash", RIGHT_PINKY, "\\|"),
    KEY_H("KeyH", RIGHT_INDEX, "hH"),
    KEY_J("KeyJ", RIGHT_INDEX, "jJ"),
    KEY_K("KeyK", RIGHT_MIDDLE, "kK"),
    KEY_L("KeyL", RIGHT_RING, "lL"),
    SEMICOLON("Semicolon", RIGHT_PINKY, ";:"),
    QUOTE("Quote", RIGHT_PINKY, "'\""),
    ENTER("Enter", RIGHT_PINKY, ""),
    KEY_N("KeyN", RIGHT_INDEX, "nN"),
    KEY_M("KeyM", RIGHT_INDEX, "mM"),
    COMMA("Comma", RIGHT_MIDDLE, ",<"),
    PERIOD("Period", RIGHT_RING, ".>"),
    SLASH("Slash", RIGHT_PINKY, "/?"),
    SHIFT_RIGHT("ShiftRight", RIGHT_PINKY, ""),
    CONTROL_RIGHT("ControlRight", RIGHT_PINKY, ""),
    ALT_RIGHT("AltRight", RIGHT_THUMB, ""),
    META_RIGHT("MetaRight", RIGHT_THUMB, ""),
    ARROW_UP("ArrowUp", RIGHT_INDEX, ""),
    ARROW_DOWN("ArrowDown", RIGHT_INDEX, ""),
    ARROW_LEFT("ArrowLeft", RIGHT_INDEX, ""),
    ARROW_RIGHT("ArrowRight", RIGHT_INDEX, ""),

    SPACE("Space", THUMBS, " ");

    private final String code;
    private final Finger finger;
    private final String glyphs;

    PhysicalKey(String code, Finger finger, String glyphs) {
        this.code = code;
        this.finger = finger;
        this.glyphs = glyphs;
    }

    public String code() {
        return code;
    }

    public Finger finger() {
        return finger;
    }

    public String glyphs() {
        return glyphs;
    }
}
