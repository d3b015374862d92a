/*
 * Copyright (C) 2024 bubbletype contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.everydaythings.bubbletype.ledger;

import dev.everydaythings.bubbletype.Orientation;
import dev.everydaythings.bubbletype.text.FontManager;
import dev.everydaythings.bubbletype.text.FreeTypeFont;
import dev.everydaythings.bubbletype.text.PlacedLine;
import dev.everydaythings.bubbletype.text.RenderPlan;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontFormatException;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Shape;
import java.awt.font.FontRenderContext;
import java.awt.font.TextLayout;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reference {@link PlanRenderer} drawing with Java2D: filled glyph outlines with an
 * optional stroke behind them, the usual lettering look for speech bubbles.
 *
 * <p>Lines only stay inside their box when they are drawn with the face they were
 * measured with, so register the measuring fonts with {@link #registerFonts(FontManager)}.
 * Families with no registered AWT font use plain SansSerif, whose advances will not
 * match the measurement.
 */
public class Java2dPlanRenderer implements PlanRenderer {

    private static final Logger log = Logger.getLogger(Java2dPlanRenderer.class.getName());

    private final Map<String, Font> fonts = new HashMap<>();
    private final Font fallback = new Font(Font.SANS_SERIF, Font.PLAIN, 12);

    public Java2dPlanRenderer registerFont(String family, Font font) {
        fonts.put(family, font);
        return this;
    }

    /**
     * Register every family of {@code fontManager} with an AWT font created from the
     * same font file bytes FreeType measured. Families whose data AWT cannot read are
     * logged and left on the fallback.
     */
    public Java2dPlanRenderer registerFonts(FontManager fontManager) {
        for (String family : fontManager.families()) {
            FreeTypeFont measured = fontManager.font(family).orElse(null);
            if (measured == null) continue;
            try {
                registerFont(family, Font.createFont(Font.TRUETYPE_FONT,
                        new ByteArrayInputStream(measured.fontData())));
            } catch (FontFormatException | IOException e) {
                log.warning(() -> String.format("Font '%s' cannot be used for drawing (%s), using %s",
                        family, e.getMessage(), fallback.getFamily()));
            }
        }
        return this;
    }

    /** AWT font for drawing {@code plan}, sized to the plan. */
    Font fontFor(RenderPlan plan) {
        return fonts.getOrDefault(plan.fontFamily(), fallback).deriveFont((float) plan.fontSizePx());
    }

    @Override
    public void render(BufferedImage page, RenderPlan plan) {
        if (!plan.isRenderable()) {
            return;
        }
        Graphics2D g = page.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);

            Font font = fontFor(plan);
            FontRenderContext frc = g.getFontRenderContext();
            Color fill = new Color(plan.style().colorArgb(), true);
            Color outline = new Color(plan.style().outlineArgb(), true);
            int outlineWidth = plan.style().outlineWidthPx();
            BasicStroke stroke = new BasicStroke(2f * outlineWidth, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND);

            for (PlacedLine line : plan.lines()) {
                if (plan.orientation() == Orientation.HORIZONTAL) {
                    drawRun(g, font, frc, line.text(), line.x(), line.y(), fill, outline, outlineWidth, stroke);
                } else {
                    drawColumn(g, font, frc, line, fill, outline, outlineWidth, stroke);
                }
            }
        } finally {
            g.dispose();
        }
    }

    private static void drawColumn(Graphics2D g, Font font, FontRenderContext frc, PlacedLine column,
                                   Color fill, Color outline, int outlineWidth, BasicStroke stroke) {
        int count = column.text().codePointCount(0, column.text().length());
        if (count == 0) return;
        float cell = column.height() / count;
        float y = column.y();
        for (int i = 0; i < column.text().length(); ) {
            int cp = column.text().codePointAt(i);
            i += Character.charCount(cp);
            String glyph = new String(Character.toChars(cp));
            if (!Character.isWhitespace(cp)) {
                float glyphWidth = new TextLayout(glyph, font, frc).getAdvance();
                float x = column.x() + (column.width() - glyphWidth) / 2f;
                drawRun(g, font, frc, glyph, x, y, fill, outline, outlineWidth, stroke);
            }
            y += cell;
        }
    }

    private static void drawRun(Graphics2D g, Font font, FontRenderContext frc, String text, float x, float top,
                                Color fill, Color outline, int outlineWidth, BasicStroke stroke) {
        if (text.isBlank()) return;
        TextLayout layout = new TextLayout(text, font, frc);
        float baseline = top + layout.getAscent();
        Shape shape = layout.getOutline(AffineTransform.getTranslateInstance(x, baseline));
        if (outlineWidth > 0) {
            g.setColor(outline);
            g.setStroke(stroke);
            g.draw(shape);
        }
        g.setColor(fill);
        g.fill(shape);
    }
}
