package dev.everydaythings.bubbletype.text;

/**
 * Measures rendered text. The single capability the layout engine needs from a font
 * backend; any implementation of this one method can be substituted.
 *
 * <p>Implementations must be deterministic for a given font asset and must not depend
 * on any rendering surface state. They must be safe to call from worker threads.
 */
@FunctionalInterface
public interface MetricsProvider {

    /**
     * Measure {@code text} set on a single line.
     *
     * @param fontFamily logical family name; unknown names fall back to the backend's default
     * @param fontSizePx font size in pixels
     * @param text       text to measure, may be empty
     * @return the extent, including which family was actually used
     */
    TextExtent measure(String fontFamily, int fontSizePx, String text);
}
