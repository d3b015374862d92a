package dev.everydaythings.bubbletype.text;

import java.util.regex.Pattern;

/**
 * Cleans translated text before layout: machine translation of Japanese source text
 * tends to leave full-width punctuation and spaced-out ellipses that waste box width.
 */
public final class TextNormalizer {

    private static final Pattern SPACED_PERIODS = Pattern.compile("\\.[ \\t\\u3000]+\\.");
    private static final Pattern LONG_ELLIPSIS = Pattern.compile("\\.{3,}");
    private static final Pattern SPACES = Pattern.compile("[ \\t\\x0B\\f\\r\\u3000]+");

    private TextNormalizer() {
    }

    /**
     * Normalize {@code text} for typesetting. Null becomes the empty string.
     *
     * <ul>
     *   <li>full-width period {@code ．} becomes {@code .}, ellipsis {@code …} becomes {@code ...}</li>
     *   <li>{@code ". ."} sequences are closed up, runs of three or more periods become {@code ...}</li>
     *   <li>runs of spaces collapse to one; newlines are kept as explicit breaks</li>
     * </ul>
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String s = text.replace('．', '.').replace("…", "...");
        String previous;
        do {
            previous = s;
            s = SPACED_PERIODS.matcher(s).replaceAll("..");
        } while (!s.equals(previous));
        s = LONG_ELLIPSIS.matcher(s).replaceAll("...");
        s = SPACES.matcher(s).replaceAll(" ");

        StringBuilder out = new StringBuilder(s.length());
        for (String line : s.split("\n", -1)) {
            if (out.length() > 0) out.append('\n');
            out.append(line.trim());
        }
        return out.toString().strip();
    }
}
