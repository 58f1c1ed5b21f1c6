package com.example.kbassist.util;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/** Whitespace tokenization that treats every Unicode space (no-break, em, ideographic) as a separator. */
public final class Words {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private Words() {
    }

    public static List<String> split(String text) {
        if (text == null) {
            return List.of();
        }
        return Arrays.stream(WHITESPACE.split(text))
                .filter(word -> !word.isEmpty())
                .toList();
    }
}
