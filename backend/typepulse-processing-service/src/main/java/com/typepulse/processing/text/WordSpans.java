package com.typepulse.processing.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the expected text into whitespace-delimited words, keeping each word's character
 * offsets so keystroke positions can be mapped back to it.
 */
public final class WordSpans {

    private static final Pattern WORD = Pattern.compile("\\S+");

    private WordSpans() {}

    /** @param end inclusive offset of the last character */
    public record WordSpan(String word, int start, int end) {
        public boolean contains(int position) {
            return position >= start && position <= end;
        }
    }

    public static List<WordSpan> of(String text) {
        if (text == null || text.isBlank()) return List.of();
        List<WordSpan> out = new ArrayList<>();
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            out.add(new WordSpan(m.group(), m.start(), m.end() - 1));
        }
        return out;
    }
}
