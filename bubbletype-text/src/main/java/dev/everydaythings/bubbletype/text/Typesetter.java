package dev.everydaythings.bubbletype.text;

import dev.everydaythings.bubbletype.Box;
import dev.everydaythings.bubbletype.Orientation;
import dev.everydaythings.bubbletype.TextStyle;

import java.util.logging.Logger;

/**
 * Runs normalization, fitting and placement for one region.
 *
 * <p>Usage:
 * <pre>{@code
 * Typesetter typesetter = new Typesetter(fontManager, LayoutConfig.defaults());
 * RenderPlan plan = typesetter.typeset(translated, style, Orientation.HORIZONTAL, editBox);
 * if (plan.overflow()) { ... flag region for manual correction ... }
 * }</pre>
 *
 * <p>Holds no mutable state; one instance may serve any number of worker threads as
 * long as the {@link MetricsProvider} is thread-safe.
 */
public class Typesetter {

    private static final Logger log = Logger.getLogger(Typesetter.class.getName());

    private final FitSolver fitSolver;
    private final PlacementEngine placementEngine = new PlacementEngine();

    public Typesetter(MetricsProvider metrics, LayoutConfig config) {
        this.fitSolver = new FitSolver(new LineBreaker(metrics), config);
    }

    public LayoutConfig config() {
        return fitSolver.config();
    }

    public RenderPlan typeset(String text, TextStyle style, Orientation orientation, Box editBox) {
        String normalized = TextNormalizer.normalize(text);
        FitResult fit = fitSolver.solve(normalized, style, orientation, editBox);
        RenderPlan plan = new RenderPlan(
                fit.lineBreak().resolvedFamily(),
                fit.fontSizePx(),
                style,
                orientation,
                placementEngine.place(fit, style.alignment()),
                fit.available(),
                fit.overflow(),
                fit.issues());
        log.fine(() -> String.format("Typeset %s into %s: %dpx, %d lines, overflow=%s, issues=%s",
                orientation, editBox, plan.fontSizePx(), plan.lines().size(), plan.overflow(), plan.issues()));
        return plan;
    }
}
