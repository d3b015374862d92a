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

import dev.everydaythings.bubbletype.mask.Mask;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Inpainter that paints masked pixels with one solid color. Good enough for white
 * speech bubbles and for previews while a model-backed inpainter is running.
 */
public class FillInpainter implements Inpainter {

    private final int fillArgb;

    public FillInpainter() {
        this(0xFFFFFFFF);
    }

    public FillInpainter(int fillArgb) {
        this.fillArgb = fillArgb;
    }

    @Override
    public BufferedImage inpaint(BufferedImage source, Mask mask) {
        if (source.getWidth() != mask.width() || source.getHeight() != mask.height()) {
            throw new IllegalArgumentException(String.format("mask %dx%d does not match image %dx%d",
                    mask.width(), mask.height(), source.getWidth(), source.getHeight()));
        }
        BufferedImage cleaned = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = cleaned.createGraphics();
        g.drawImage(source, 0, 0, null);
        g.dispose();

        for (int y = 0; y < mask.height(); y++) {
            for (int x = 0; x < mask.width(); x++) {
                if (mask.isErased(x, y)) {
                    cleaned.setRGB(x, y, fillArgb);
                }
            }
        }
        return cleaned;
    }
}
