package dev.everydaythings.bubbletype.text;

import dev.everydaythings.bubbletype.Orientation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LineBreakerTest {

    // At 10px every character is 6px wide, so 60px holds ten characters
    private static final int SIZE = 10;

    private final LineBreaker breaker = new LineBreaker(new FixedAdvanceMetrics());

    @Test
    void wrapsGreedilyAtWordBoundaries() {
        LineBreak result = breaker.breakLines("the quick brown fox jumps", "default", SIZE, 60,
                Orientation.HORIZONTAL);

        assertEquals(List.of("the quick", "brown fox", "jumps"), texts(result));
        assertFalse(result.hadForcedBreak());
        assertEquals(54f, result.maxAdvance(), 1e-3);
        assertEquals(36f, result.blockExtent(), 1e-3);
    }

    @Test
    void neverSplitsAWord() {
        String[] inputs = {
                "a b c d e f g h",
                "internationalization is long",
                "one two three four five six seven eight nine ten",
                "x yy zzz wwww vvvvv uuuuuu ttttttt",
        };
        for (String input : inputs) {
            for (int width = 6; width <= 120; width += 7) {
                LineBreak result = breaker.breakLines(input, "default", SIZE, width, Orientation.HORIZONTAL);
                assertEquals(input, String.join(" ", texts(result)), input + " @ " + width);
            }
        }
    }

    @Test
    void overlongWordGetsItsOwnOverflowingLine() {
        LineBreak result = breaker.breakLines("a extraordinarily b", "default", SIZE, 60,
                Orientation.HORIZONTAL);

        assertEquals(List.of("a", "extraordinarily", "b"), texts(result));
        assertTrue(result.hadForcedBreak());
        assertFalse(result.lines().get(0).overflow());
        assertTrue(result.lines().get(1).overflow());
        assertEquals(90f, result.lines().get(1).advance(), 1e-3);
    }

    @Test
    void newlinesAlwaysBreak() {
        LineBreak result = breaker.breakLines("one\ntwo", "default", SIZE, 1000, Orientation.HORIZONTAL);
        assertEquals(List.of("one", "two"), texts(result));
    }

    @Test
    void unspacedCjkWrapsBetweenCharacters() {
        LineBreak wide = breaker.breakLines("日本語のテキスト", "default", SIZE, 60, Orientation.HORIZONTAL);
        assertEquals(List.of("日本語のテキスト"), texts(wide));

        LineBreak narrow = breaker.breakLines("日本語のテキスト", "default", SIZE, 33, Orientation.HORIZONTAL);
        assertEquals(List.of("日本語のテ", "キスト"), texts(narrow));
        assertFalse(narrow.hadForcedBreak());
    }

    @Test
    void latinRunNextToCjkStaysWhole() {
        LineBreak result = breaker.breakLines("ABC日本", "default", SIZE, 26, Orientation.HORIZONTAL);
        assertEquals(List.of("ABC日", "本"), texts(result));
    }

    @Test
    void verticalColumnsStackGlyphHeights() {
        Line column = breaker.measureLine("日本語", "default", SIZE, Orientation.VERTICAL);
        assertEquals(36f, column.advance(), 1e-3);
        assertEquals(6f, column.thickness(), 1e-3);

        // 12px per glyph, 40px column holds three
        LineBreak result = breaker.breakLines("日本語のテキスト", "default", SIZE, 40, Orientation.VERTICAL);
        assertEquals(List.of("日本語", "のテキ", "スト"), texts(result));
    }

    @Test
    void emptyTextHasNoLines() {
        LineBreak result = breaker.breakLines("", "default", SIZE, 60, Orientation.HORIZONTAL);
        assertTrue(result.lines().isEmpty());
        assertEquals(0f, result.blockExtent(), 1e-6);
    }

    private static List<String> texts(LineBreak result) {
        return result.lines().stream().map(Line::text).collect(Collectors.toList());
    }
}
