package dev.everydaythings.bubbletype.text;

import dev.everydaythings.bubbletype.Orientation;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy word-wrap against a {@link MetricsProvider}.
 *
 * <p>Tokens are whitespace-delimited words; CJK ideographs and kana are additionally
 * tokens of their own, joined to their neighbours without a space, so unspaced Japanese
 * or Chinese text can wrap between characters. Tokens are appended to the current line
 * while the line still fits; a token that does not fit starts a new line. A token
 * longer than the available extent on its own is never split: it gets a line of its
 * own, flagged as overflowing. Newlines in the text always break.
 *
 * <p>For {@link Orientation#VERTICAL} text the lines are columns: glyphs are stacked
 * top-to-bottom, a column's advance is the sum of its glyph heights and its thickness
 * is the widest glyph. Columns are returned in reading order (rightmost first).
 */
public class LineBreaker {

    private final MetricsProvider metrics;

    private record Token(String text, boolean attached) {}

    public LineBreaker(MetricsProvider metrics) {
        this.metrics = metrics;
    }

    /**
     * Wrap {@code text} to {@code maxExtent}.
     *
     * @param text        text to wrap (already normalized)
     * @param fontFamily  font family
     * @param fontSizePx  font size in pixels
     * @param maxExtent   available width (horizontal) or column height (vertical)
     * @param orientation writing direction
     */
    public LineBreak breakLines(String text, String fontFamily, int fontSizePx, float maxExtent,
                                Orientation orientation) {
        TextExtent base = metrics.measure(fontFamily, fontSizePx, "");
        List<Line> lines = new ArrayList<>();
        boolean forced = false;

        for (String paragraph : text.split("\n")) {
            List<Token> tokens = tokenize(paragraph);
            StringBuilder current = new StringBuilder();

            for (Token token : tokens) {
                if (current.length() == 0) {
                    current.append(token.text());
                    continue;
                }
                String candidate = current + (token.attached() ? "" : " ") + token.text();
                if (measureLine(candidate, fontFamily, fontSizePx, orientation).advance() <= maxExtent) {
                    current.setLength(0);
                    current.append(candidate);
                } else {
                    forced |= emit(lines, current.toString(), fontFamily, fontSizePx, maxExtent, orientation);
                    current.setLength(0);
                    current.append(token.text());
                }
            }
            if (current.length() > 0) {
                forced |= emit(lines, current.toString(), fontFamily, fontSizePx, maxExtent, orientation);
            }
        }
        return new LineBreak(lines, forced, base.lineGap(), base.resolvedFamily());
    }

    /** Measure one line (or column) without wrapping. */
    public Line measureLine(String text, String fontFamily, int fontSizePx, Orientation orientation) {
        if (orientation == Orientation.HORIZONTAL) {
            TextExtent extent = metrics.measure(fontFamily, fontSizePx, text);
            return new Line(text, extent.width(), extent.height(), false);
        }
        float height = 0;
        float width = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            TextExtent glyph = metrics.measure(fontFamily, fontSizePx, new String(Character.toChars(cp)));
            height += glyph.height();
            width = Math.max(width, glyph.width());
        }
        if (text.isEmpty()) {
            width = metrics.measure(fontFamily, fontSizePx, "").height();
        }
        return new Line(text, height, width, false);
    }

    private boolean emit(List<Line> lines, String text, String fontFamily, int fontSizePx, float maxExtent,
                         Orientation orientation) {
        Line measured = measureLine(text, fontFamily, fontSizePx, orientation);
        boolean overflow = measured.advance() > maxExtent;
        lines.add(new Line(text, measured.advance(), measured.thickness(), overflow));
        return overflow;
    }

    static boolean isBreakableEverywhere(int codepoint) {
        Character.UnicodeScript script = Character.UnicodeScript.of(codepoint);
        return script == Character.UnicodeScript.HAN
                || script == Character.UnicodeScript.HIRAGANA
                || script == Character.UnicodeScript.KATAKANA;
    }

    private static List<Token> tokenize(String paragraph) {
        List<Token> tokens = new ArrayList<>();
        for (String word : paragraph.trim().split("\\s+")) {
            if (word.isEmpty()) continue;

            StringBuilder run = new StringBuilder();
            boolean attached = false;
            for (int i = 0; i < word.length(); ) {
                int cp = word.codePointAt(i);
                i += Character.charCount(cp);
                if (isBreakableEverywhere(cp)) {
                    if (run.length() > 0) {
                        tokens.add(new Token(run.toString(), attached));
                        run.setLength(0);
                        attached = true;
                    }
                    tokens.add(new Token(new String(Character.toChars(cp)), attached));
                    attached = true;
                } else {
                    run.appendCodePoint(cp);
                }
            }
            if (run.length() > 0) {
                tokens.add(new Token(run.toString(), attached));
            }
        }
        return tokens;
    }
}
