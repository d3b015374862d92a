package dev.everydaythings.bubbletype.text;

/**
 * One wrapped line (or, for vertical text, one column).
 *
 * @param text      the line's text
 * @param advance   extent along the reading direction: width for horizontal lines,
 *                  height for vertical columns
 * @param thickness extent across the reading direction: line height, or column width
 * @param overflow  true if the line is a single token longer than the available extent
 */
public record Line(String text, float advance, float thickness, boolean overflow) {}
