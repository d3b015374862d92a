package dev.everydaythings.bubbletype.text;

import dev.everydaythings.bubbletype.Box;
import dev.everydaythings.bubbletype.LayoutIssue;
import dev.everydaythings.bubbletype.Orientation;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Output of {@link FitSolver}: the chosen font size and the lines broken at that size.
 *
 * @param fontSizePx  chosen size; 0 when there is nothing to lay out
 * @param lineBreak   lines at that size
 * @param available   the edit box minus inner padding
 * @param orientation writing direction the lines were broken for
 * @param overflow    true if the text does not fit (or a pinned size had to be overridden)
 * @param issues      conditions to surface to the user
 */
public record FitResult(int fontSizePx, LineBreak lineBreak, Box available, Orientation orientation,
                        boolean overflow, Set<LayoutIssue> issues) {

    public FitResult {
        issues = issues.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(issues));
    }

    static FitResult empty(Box available, Orientation orientation, String family, Set<LayoutIssue> issues) {
        return new FitResult(0, new LineBreak(List.of(), false, 0, family), available, orientation, false, issues);
    }

    /** Stacked extent of the lines across the reading direction. */
    public float blockExtent() {
        return lineBreak.blockExtent();
    }
}
