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

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Binary erase mask produced by {@link MaskBuilder}.
 *
 * <p>One byte per pixel, row-major: {@link #ERASE} marks pixels the inpainter must
 * repaint, {@link #KEEP} everything else. Instances are immutable; {@link #pixels()}
 * returns a copy.
 */
public final class Mask {

    public static final byte KEEP = 0;
    public static final byte ERASE = (byte) 0xFF;

    /**
     * A region that contributed nothing to the mask.
     *
     * @param regionId id of the region as passed to {@link MaskBuilder#add(long, Box)}
     * @param box      the rectangle after padding, before clamping
     */
    public record Skipped(long regionId, Box box) {

        public LayoutIssue issue() {
            return LayoutIssue.MASK_CLAMPED_TO_ZERO;
        }
    }

    private final int width;
    private final int height;
    private final byte[] pixels;
    private final List<Skipped> skipped;

    Mask(int width, int height, byte[] pixels, List<Skipped> skipped) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
        this.skipped = List.copyOf(skipped);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean isErased(int x, int y) {
        if (x < 0 || y < 0 || x >= width || y >= height) {
            return false;
        }
        return pixels[y * width + x] == ERASE;
    }

    /** Number of pixels marked for erasure. */
    public int erasedCount() {
        int n = 0;
        for (byte p : pixels) {
            if (p == ERASE) n++;
        }
        return n;
    }

    /** Copy of the raw raster, row-major, one byte per pixel. */
    public byte[] pixels() {
        return pixels.clone();
    }

    /** Regions dropped because their clamped rectangle had zero area. */
    public List<Skipped> skipped() {
        return skipped;
    }

    /**
     * Bounding boxes of the 4-connected erase regions, in the order their first pixel
     * is met scanning rows top-to-bottom, left-to-right.
     */
    public List<Box> regions() {
        List<Box> result = new ArrayList<>();
        boolean[] seen = new boolean[pixels.length];
        int[] queue = new int[pixels.length];

        for (int start = 0; start < pixels.length; start++) {
            if (pixels[start] != ERASE || seen[start]) continue;

            int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE;
            int maxX = Integer.MIN_VALUE, maxY = Integer.MIN_VALUE;
            int head = 0;
            int tail = 0;
            queue[tail++] = start;
            seen[start] = true;

            while (head < tail) {
                int idx = queue[head++];
                int px = idx % width;
                int py = idx / width;
                if (px < minX) minX = px;
                if (py < minY) minY = py;
                if (px > maxX) maxX = px;
                if (py > maxY) maxY = py;

                if (px > 0) tail = visit(idx - 1, seen, queue, tail);
                if (px < width - 1) tail = visit(idx + 1, seen, queue, tail);
                if (py > 0) tail = visit(idx - width, seen, queue, tail);
                if (py < height - 1) tail = visit(idx + width, seen, queue, tail);
            }
            result.add(Box.fromCorners(minX, minY, maxX + 1, maxY + 1));
        }
        return result;
    }

    /**
     * Render as an 8-bit grayscale image (white = erase), the format inpainting
     * backends expect.
     */
    public BufferedImage toImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        System.arraycopy(pixels, 0, target, 0, pixels.length);
        return image;
    }

    /** True if both masks have the same size and byte-identical rasters. */
    public boolean sameRaster(Mask other) {
        return other != null && width == other.width && height == other.height
                && Arrays.equals(pixels, other.pixels);
    }

    private int visit(int idx, boolean[] seen, int[] queue, int tail) {
        if (pixels[idx] == ERASE && !seen[idx]) {
            seen[idx] = true;
            queue[tail++] = idx;
        }
        return tail;
    }
}
