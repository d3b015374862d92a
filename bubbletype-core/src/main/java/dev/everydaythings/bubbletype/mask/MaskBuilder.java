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

package dev.everydaythings.bubbletype.mask;

import dev.everydaythings.bubbletype.Box;
import dev.everydaythings.bubbletype.LayoutIssue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Fluent builder that rasterizes region boxes into a single {@link Mask}.
 *
 * <p>Usage:
 * <pre>{@code
 * Mask mask = new MaskBuilder()
 *     .imageSize(page.getWidth(), page.getHeight())
 *     .padding(10)
 *     .dilation(3)
 *     .add(region.id(), region.editBox())
 *     .build();
 * }</pre>
 *
 * <p>Each box is grown by the padding, clamped to the image and then dilated with a
 * disc of the configured radius. All footprints are OR-ed into one raster, so
 * overlapping or touching boxes come out as one connected erase area with no seam.
 * The mask is always built from the full box set; the output depends only on the set
 * of boxes, not the order they were added in.
 */
public class MaskBuilder {

    private static final Logger log = Logger.getLogger(MaskBuilder.class.getName());

    /** Padding used by the inpainting step unless configured otherwise. */
    public static final int DEFAULT_PADDING = 10;

    private record Entry(long regionId, Box box) {}

    private final List<Entry> entries = new ArrayList<>();
    private int width = -1;
    private int height = -1;
    private int padding = DEFAULT_PADDING;
    private int dilation = 0;

    /** Set the canvas size in pixels. Required. */
    public MaskBuilder imageSize(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("image size must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        return this;
    }

    /** Pixels added on every side of each box (default {@value #DEFAULT_PADDING}). */
    public MaskBuilder padding(int paddingPx) {
        if (paddingPx < 0) {
            throw new IllegalArgumentException("padding must not be negative: " + paddingPx);
        }
        this.padding = paddingPx;
        return this;
    }

    /** Radius of the disc used to dilate each footprint (default 0 = hard edges). */
    public MaskBuilder dilation(int dilationPx) {
        if (dilationPx < 0) {
            throw new IllegalArgumentException("dilation must not be negative: " + dilationPx);
        }
        this.dilation = dilationPx;
        return this;
    }

    /** Add one region's box. */
    public MaskBuilder add(long regionId, Box box) {
        if (box == null) {
            throw new IllegalArgumentException("box must not be null");
        }
        entries.add(new Entry(regionId, box));
        return this;
    }

    /**
     * Build the mask.
     *
     * @throws IllegalStateException if the image size is not set
     */
    public Mask build() {
        if (width <= 0 || height <= 0) {
            throw new IllegalStateException("imageSize must be set");
        }

        // Sorted so skip reporting is stable; the raster itself is order-independent.
        List<Entry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingLong(Entry::regionId)
                .thenComparingInt(e -> e.box().y())
                .thenComparingInt(e -> e.box().x()));

        byte[] pixels = new byte[width * height];
        List<Mask.Skipped> skipped = new ArrayList<>();

        for (Entry entry : sorted) {
            Box padded = entry.box().expand(padding);
            Box clamped = padded.clampTo(width, height);
            if (clamped.isEmpty()) {
                log.warning(() -> String.format("Mask: region %d skipped, %s %s (%dx%d)",
                        entry.regionId(), padded, LayoutIssue.MASK_CLAMPED_TO_ZERO.description(), width, height));
                skipped.add(new Mask.Skipped(entry.regionId(), padded));
                continue;
            }
            paint(pixels, clamped);
        }

        Mask mask = new Mask(width, height, pixels, skipped);
        log.fine(() -> String.format("Mask built: %dx%d, %d boxes, %d skipped, padding=%d, dilation=%d",
                width, height, entries.size(), skipped.size(), padding, dilation));
        return mask;
    }

    /** OR the dilated footprint of {@code box} into the raster. */
    private void paint(byte[] pixels, Box box) {
        int r = dilation;
        int x0 = box.x();
        int x1 = box.right() - 1;
        int y0 = box.y();
        int y1 = box.bottom() - 1;

        int rowStart = Math.max(0, y0 - r);
        int rowEnd = Math.min(height - 1, y1 + r);

        for (int y = rowStart; y <= rowEnd; y++) {
            int dy = y < y0 ? y0 - y : (y > y1 ? y - y1 : 0);
            // Horizontal reach of the disc at this distance from the rectangle
            int reach = (int) Math.floor(Math.sqrt((double) r * r - (double) dy * dy));
            int from = Math.max(0, x0 - reach);
            int to = Math.min(width - 1, x1 + reach);
            if (from > to) continue;
            int rowOffset = y * width;
            Arrays.fill(pixels, rowOffset + from, rowOffset + to + 1, Mask.ERASE);
        }
    }
}
