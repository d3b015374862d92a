package dev.everydaythings.bubbletype.text;

import dev.everydaythings.bubbletype.Box;
import dev.everydaythings.bubbletype.LayoutIssue;
import dev.everydaythings.bubbletype.Orientation;
import dev.everydaythings.bubbletype.TextStyle;

import java.util.EnumSet;
import java.util.Set;

/**
 * Chooses the largest font size whose wrapped text fits a box.
 *
 * <p>The box is shrunk by the configured inner padding. For each candidate size the
 * text is broken with {@link LineBreaker}; the candidate is feasible when the stacked
 * lines (line thicknesses plus gaps) fit across the reading direction and the longest
 * line fits along it. Sizes in {@code [minFontPx, maxFontPx]} are binary searched for
 * the largest feasible one.
 *
 * <p>When nothing fits, the minimum size is used and the result is flagged
 * {@link LayoutIssue#INFEASIBLE_FIT}; text is never dropped. A pinned size from
 * {@link TextStyle#fontSizeHint()} is used as-is when it fits; otherwise the search runs
 * and the result is flagged overflowing with {@link LayoutIssue#PINNED_SIZE_INFEASIBLE},
 * so the user sees a warning instead of a silent resize.
 *
 * <p>Stateless and deterministic.
 */
public class FitSolver {

    private final LineBreaker lineBreaker;
    private final LayoutConfig config;

    public FitSolver(LineBreaker lineBreaker, LayoutConfig config) {
        this.lineBreaker = lineBreaker;
        this.config = config;
    }

    public LayoutConfig config() {
        return config;
    }

    /**
     * Fit {@code text} into {@code editBox}.
     *
     * @param text        normalized text; blank text yields an empty result
     * @param style       style; family and size hint are used
     * @param orientation writing direction
     * @param editBox     box to fill, before inner padding
     */
    public FitResult solve(String text, TextStyle style, Orientation orientation, Box editBox) {
        Box available = editBox.inset(config.innerPaddingPx());
        String family = style.fontFamily();

        if (available.isEmpty()) {
            return FitResult.empty(available, orientation, family, EnumSet.of(LayoutIssue.DEGENERATE_BOX));
        }
        if (text == null || text.isBlank()) {
            return FitResult.empty(available, orientation, family, Set.of());
        }

        int main = orientation == Orientation.HORIZONTAL ? available.w() : available.h();
        int cross = orientation == Orientation.HORIZONTAL ? available.h() : available.w();
        EnumSet<LayoutIssue> issues = EnumSet.noneOf(LayoutIssue.class);
        boolean overflow = false;

        Integer hint = style.fontSizeHint();
        if (hint != null) {
            LineBreak pinned = lineBreaker.breakLines(text, family, hint, main, orientation);
            if (fits(pinned, main, cross)) {
                return result(hint, pinned, available, orientation, false, issues, family);
            }
            issues.add(LayoutIssue.PINNED_SIZE_INFEASIBLE);
            overflow = true;
        }

        int lo = config.minFontPx();
        int hi = config.maxFontPx();
        int best = -1;
        LineBreak bestBreak = null;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            LineBreak candidate = lineBreaker.breakLines(text, family, mid, main, orientation);
            if (fits(candidate, main, cross)) {
                best = mid;
                bestBreak = candidate;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }

        if (bestBreak == null) {
            best = config.minFontPx();
            bestBreak = lineBreaker.breakLines(text, family, best, main, orientation);
            issues.add(LayoutIssue.INFEASIBLE_FIT);
            overflow = true;
        }
        return result(best, bestBreak, available, orientation, overflow, issues, family);
    }

    private static boolean fits(LineBreak lineBreak, int main, int cross) {
        return !lineBreak.hadForcedBreak()
                && lineBreak.maxAdvance() <= main
                && lineBreak.blockExtent() <= cross;
    }

    private static FitResult result(int size, LineBreak lineBreak, Box available, Orientation orientation,
                                    boolean overflow, EnumSet<LayoutIssue> issues, String requestedFamily) {
        if (!lineBreak.resolvedFamily().equals(requestedFamily)) {
            issues.add(LayoutIssue.UNKNOWN_FONT);
        }
        return new FitResult(size, lineBreak, available, orientation, overflow, issues);
    }
}
