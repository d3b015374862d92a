package dev.everydaythings.bubbletype.text;

/**
 * A line with its position on the page.
 *
 * <p>{@code (x, y)} is the top-left corner of the line's box in image pixels; for
 * horizontal text the baseline sits one ascent below {@code y}. {@code width} and
 * {@code height} are the box extent: advance by thickness for horizontal lines,
 * thickness by advance for vertical columns.
 */
public record PlacedLine(Line line, float x, float y, float width, float height) {

    public String text() {
        return line.text();
    }
}
