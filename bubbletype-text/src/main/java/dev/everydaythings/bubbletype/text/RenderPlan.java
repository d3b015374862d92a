package dev.everydaythings.bubbletype.text;

import dev.everydaythings.bubbletype.Box;
import dev.everydaythings.bubbletype.LayoutIssue;
import dev.everydaythings.bubbletype.Orientation;
import dev.everydaythings.bubbletype.TextStyle;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Everything a glyph renderer needs to draw a region's translation: font, size, style
 * and positioned lines. Immutable; produced by {@link Typesetter}.
 *
 * @param fontFamily  family the lines were measured with (after fallback)
 * @param fontSizePx  chosen font size, 0 for an empty plan
 * @param style       region style (color, outline, alignment)
 * @param orientation writing direction
 * @param lines       positioned lines or columns in reading order
 * @param available   the padded box the lines were fitted into
 * @param overflow    true if the text does not fit at the chosen size
 * @param issues      conditions to surface to the user
 */
public record RenderPlan(String fontFamily, int fontSizePx, TextStyle style, Orientation orientation,
                         List<PlacedLine> lines, Box available, boolean overflow, Set<LayoutIssue> issues) {

    public RenderPlan {
        lines = List.copyOf(lines);
    }

    /** True if there is nothing to draw. */
    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /** True if the region should be drawn: it has lines and no issue excludes it. */
    public boolean isRenderable() {
        return !isEmpty() && issues.stream().noneMatch(LayoutIssue::excludesRendering);
    }

    public boolean hasIssue(LayoutIssue issue) {
        return issues.contains(issue);
    }

    /** The laid-out text with line breaks. */
    public String text() {
        return lines.stream().map(PlacedLine::text).collect(Collectors.joining("\n"));
    }

    /** Stacked height of the lines (horizontal) or width of the columns (vertical). */
    public float blockExtent() {
        if (lines.isEmpty()) {
            return 0;
        }
        float min = Float.MAX_VALUE;
        float max = -Float.MAX_VALUE;
        for (PlacedLine line : lines) {
            if (orientation == Orientation.HORIZONTAL) {
                min = Math.min(min, line.y());
                max = Math.max(max, line.y() + line.height());
            } else {
                min = Math.min(min, line.x());
                max = Math.max(max, line.x() + line.width());
            }
        }
        return max - min;
    }
}
