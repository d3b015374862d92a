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

package dev.everydaythings.bubbletype;

import java.util.Objects;

/**
 * Typographic style of a region.
 *
 * @param fontFamily     logical family name registered with the metrics backend
 * @param fontSizeHint   pinned font size in pixels, or {@code null} to let the fit solver choose
 * @param colorArgb      fill color in ARGB
 * @param alignment      line alignment within the box
 * @param outlineArgb    outline (stroke) color in ARGB
 * @param outlineWidthPx outline width in pixels, 0 for none
 */
public record TextStyle(String fontFamily, Integer fontSizeHint, int colorArgb,
                        Alignment alignment, int outlineArgb, int outlineWidthPx) {

    public static final String DEFAULT_FAMILY = "default";

    public TextStyle {
        Objects.requireNonNull(fontFamily, "fontFamily");
        Objects.requireNonNull(alignment, "alignment");
        if (fontSizeHint != null && fontSizeHint <= 0) {
            throw new IllegalArgumentException("fontSizeHint must be positive: " + fontSizeHint);
        }
        if (outlineWidthPx < 0) {
            throw new IllegalArgumentException("outlineWidthPx must not be negative: " + outlineWidthPx);
        }
    }

    /** Black centered text with a 2px white outline, the usual look for speech bubbles. */
    public static TextStyle defaults() {
        return new TextStyle(DEFAULT_FAMILY, null, 0xFF000000, Alignment.CENTER, 0xFFFFFFFF, 2);
    }

    public TextStyle withFontFamily(String family) {
        return new TextStyle(family, fontSizeHint, colorArgb, alignment, outlineArgb, outlineWidthPx);
    }

    public TextStyle withFontSizeHint(Integer hint) {
        return new TextStyle(fontFamily, hint, colorArgb, alignment, outlineArgb, outlineWidthPx);
    }

    public TextStyle withColor(int argb) {
        return new TextStyle(fontFamily, fontSizeHint, argb, alignment, outlineArgb, outlineWidthPx);
    }

    public TextStyle withAlignment(Alignment value) {
        return new TextStyle(fontFamily, fontSizeHint, colorArgb, value, outlineArgb, outlineWidthPx);
    }

    public TextStyle withOutline(int argb, int widthPx) {
        return new TextStyle(fontFamily, fontSizeHint, colorArgb, alignment, argb, widthPx);
    }
}
