package dev.everydaythings.bubbletype.text;

import java.util.List;

/**
 * Output of {@link LineBreaker}: wrapped lines in reading order plus the font metrics
 * they were measured with.
 *
 * @param lines          lines (or columns, right-to-left) in reading order
 * @param hadForcedBreak true if some token alone exceeded the available extent
 * @param lineGap        gap between consecutive lines or columns in pixels
 * @param resolvedFamily font family the backend actually used
 */
public record LineBreak(List<Line> lines, boolean hadForcedBreak, float lineGap, String resolvedFamily) {

    public LineBreak {
        lines = List.copyOf(lines);
    }

    /** Longest line advance. */
    public float maxAdvance() {
        float max = 0;
        for (Line line : lines) {
            max = Math.max(max, line.advance());
        }
        return max;
    }

    /** Stacked extent of all lines: thicknesses plus the gaps between them. */
    public float blockExtent() {
        if (lines.isEmpty()) {
            return 0;
        }
        float sum = 0;
        for (Line line : lines) {
            sum += line.thickness();
        }
        return sum + (lines.size() - 1) * lineGap;
    }
}
