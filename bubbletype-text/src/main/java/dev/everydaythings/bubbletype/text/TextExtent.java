package dev.everydaythings.bubbletype.text;

/**
 * Measured size of a single line of text, in pixels.
 *
 * @param width          advance width of the string
 * @param height         line height (ascent + descent)
 * @param lineGap        extra leading the font asks for between lines
 * @param resolvedFamily family actually used; differs from the requested one on fallback
 */
public record TextExtent(float width, float height, float lineGap, String resolvedFamily) {
}
