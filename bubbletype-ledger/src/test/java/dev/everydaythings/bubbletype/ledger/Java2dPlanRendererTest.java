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

import dev.everydaythings.bubbletype.Box;
import dev.everydaythings.bubbletype.Orientation;
import dev.everydaythings.bubbletype.TextStyle;
import dev.everydaythings.bubbletype.text.FontManager;
import dev.everydaythings.bubbletype.text.LayoutConfig;
import dev.everydaythings.bubbletype.text.RenderPlan;
import dev.everydaythings.bubbletype.text.TextExtent;
import dev.everydaythings.bubbletype.text.Typesetter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.Font;
import java.awt.font.FontRenderContext;
import java.awt.font.TextLayout;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class Java2dPlanRendererTest {

    private static final int WHITE = 0xFFFFFFFF;

    private static final Path SYSTEM_FONT = Stream.of(
                    "/usr/share/fonts/truetype/dejavu/DejaVuSans.ttf",
                    "/usr/share/fonts/TTF/DejaVuSans.ttf",
                    "/usr/share/fonts/dejavu/DejaVuSans.ttf",
                    "/usr/share/fonts/truetype/liberation/LiberationSans-Regular.ttf")
            .map(Path::of)
            .filter(Files::isRegularFile)
            .findFirst()
            .orElse(null);

    @BeforeEach
    void requireAwtFonts() {
        boolean available;
        try {
            new Font(Font.SANS_SERIF, Font.BOLD, 12).createGlyphVector(new FontRenderContext(null, true, true), "A");
            available = true;
        } catch (Throwable e) {
            available = false;
        }
        assumeTrue(available, "AWT fonts unavailable");
    }

    private static BufferedImage whitePage() {
        BufferedImage page = new BufferedImage(200, 200, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < page.getHeight(); y++) {
            for (int x = 0; x < page.getWidth(); x++) {
                page.setRGB(x, y, WHITE);
            }
        }
        return page;
    }

    private static int inkedPixels(BufferedImage page, Box box) {
        int count = 0;
        for (int y = box.y(); y < box.bottom(); y++) {
            for (int x = box.x(); x < box.right(); x++) {
                if (page.getRGB(x, y) != WHITE) count++;
            }
        }
        return count;
    }

    @Test
    void drawsHorizontalTextInsideItsBox() {
        Box editBox = new Box(20, 20, 160, 60);
        RenderPlan plan = LayoutFixtures.typesetter()
                .typeset("HELLO", TextStyle.defaults(), Orientation.HORIZONTAL, editBox);
        BufferedImage page = whitePage();

        new Java2dPlanRenderer().render(page, plan);

        assertTrue(inkedPixels(page, editBox) > 0);
        assertEquals(0, inkedPixels(page, new Box(0, 120, 200, 80)));
    }

    @Test
    void drawsVerticalColumns() {
        Box editBox = new Box(60, 10, 80, 180);
        RenderPlan plan = LayoutFixtures.typesetter()
                .typeset("ABCD", TextStyle.defaults(), Orientation.VERTICAL, editBox);
        BufferedImage page = whitePage();

        new Java2dPlanRenderer().render(page, plan);

        assertTrue(inkedPixels(page, editBox) > 0);
    }

    @Test
    void skipsPlansThatAreNotRenderable() {
        RenderPlan plan = LayoutFixtures.typesetter(20)
                .typeset("HELLO", TextStyle.defaults(), Orientation.HORIZONTAL, new Box(0, 0, 10, 10));
        BufferedImage page = whitePage();

        new Java2dPlanRenderer().render(page, plan);

        assertEquals(0, inkedPixels(page, new Box(0, 0, 200, 200)));
    }

    @Test
    void drawsWithTheFaceThatWasMeasured() throws Exception {
        assumeTrue(SYSTEM_FONT != null, "no system font available");
        try (FontManager fonts = new FontManager("default")) {
            assertNotNull(fonts.registerFont("default", SYSTEM_FONT));
            Java2dPlanRenderer renderer = new Java2dPlanRenderer().registerFonts(fonts);
            RenderPlan plan = new Typesetter(fonts, LayoutConfig.defaults())
                    .typeset("HELLO THERE", TextStyle.defaults(), Orientation.HORIZONTAL, new Box(0, 0, 200, 80));

            Font font = renderer.fontFor(plan);

            assertEquals(Font.createFont(Font.TRUETYPE_FONT, SYSTEM_FONT.toFile()).getFontName(), font.getFontName());
            assertEquals(plan.fontSizePx(), font.getSize2D(), 1e-3);
            assertFalse(font.isBold());

            // Drawn width matches measured width, so the line stays in its box
            float measured = plan.lines().get(0).width();
            float drawn = new TextLayout(plan.lines().get(0).text(), font,
                    new FontRenderContext(null, true, true)).getAdvance();
            assertEquals(measured, drawn, measured * 0.03f);
        }
    }

    @Test
    void unregisteredFamilyUsesPlainSansSerif() {
        RenderPlan plan = new Typesetter((family, size, text) ->
                new TextExtent(text.length() * 0.6f * size, 1.2f * size, 0, "Comic"), LayoutConfig.defaults())
                .typeset("HELLO", TextStyle.defaults().withFontFamily("Comic"), Orientation.HORIZONTAL,
                        new Box(0, 0, 200, 80));

        Font font = new Java2dPlanRenderer().fontFor(plan);

        assertEquals(Font.SANS_SERIF, font.getName());
        assertFalse(font.isBold());
        assertEquals(plan.fontSizePx(), font.getSize2D(), 1e-3);
    }
}
