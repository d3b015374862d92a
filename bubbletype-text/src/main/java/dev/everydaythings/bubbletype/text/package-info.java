/**
 * Box-constrained typesetting.
 *
 * <p>Measures text with FreeType through LWJGL's bindings, wraps it into lines, finds the
 * largest font size that fits a region's box and positions the lines inside it.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * // Load fonts (system defaults with fallback chain)
 * FontManager fonts = new FontManager("default");
 * fonts.loadDefaultFont();
 *
 * // Fit and place text
 * Typesetter typesetter = new Typesetter(fonts, LayoutConfig.defaults());
 * RenderPlan plan = typesetter.typeset("HELLO THERE WORLD", TextStyle.defaults(),
 *         Orientation.HORIZONTAL, new Box(0, 0, 200, 80));
 * for (PlacedLine line : plan.lines()) {
 *     // draw line.text() at (line.x(), line.y()) with plan.fontSizePx()
 * }
 * }</pre>
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>{@link dev.everydaythings.bubbletype.text.TextNormalizer} cleans punctuation.</li>
 *   <li>{@link dev.everydaythings.bubbletype.text.LineBreaker} wraps greedily, never
 *       splitting a token.</li>
 *   <li>{@link dev.everydaythings.bubbletype.text.FitSolver} binary searches the font size.</li>
 *   <li>{@link dev.everydaythings.bubbletype.text.PlacementEngine} aligns the lines and
 *       centers the block.</li>
 * </ol>
 *
 * <h2>Coordinates</h2>
 * <p>All positions are image pixels with the origin at the top-left and Y growing
 * downwards. A {@link dev.everydaythings.bubbletype.text.PlacedLine} origin is the
 * top-left of the line box, not the baseline.
 *
 * @see dev.everydaythings.bubbletype.text.FontManager
 * @see dev.everydaythings.bubbletype.text.Typesetter
 */
package dev.everydaythings.bubbletype.text;
