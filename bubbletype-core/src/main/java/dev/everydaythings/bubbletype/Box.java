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

/**
 * Axis-aligned integer rectangle in image pixel space.
 *
 * <p>{@code (x, y)} is the top-left corner, {@code w}/{@code h} the extent. The right
 * and bottom edges are exclusive, so two boxes with {@code a.right() == b.x()} touch
 * without overlapping. A box with a non-positive width or height is empty; empty boxes
 * are legal values (padding and clamping produce them) but cover no pixels.
 */
public record Box(int x, int y, int w, int h) {

    /** Build a box from corner coordinates {@code (xMin, yMin)} inclusive and {@code (xMax, yMax)} exclusive. */
    public static Box fromCorners(int xMin, int yMin, int xMax, int yMax) {
        return new Box(xMin, yMin, xMax - xMin, yMax - yMin);
    }

    /** Exclusive right edge. */
    public int right() {
        return x + w;
    }

    /** Exclusive bottom edge. */
    public int bottom() {
        return y + h;
    }

    public boolean isEmpty() {
        return w <= 0 || h <= 0;
    }

    public long area() {
        return isEmpty() ? 0 : (long) w * h;
    }

    /**
     * Shrink by {@code amount} on every side. The result may be empty; callers decide
     * whether that is an error.
     */
    public Box inset(int amount) {
        return new Box(x + amount, y + amount, w - 2 * amount, h - 2 * amount);
    }

    /** Grow by {@code amount} on every side. */
    public Box expand(int amount) {
        return inset(-amount);
    }

    /**
     * Clamp to the canvas {@code [0, width) x [0, height)}.
     *
     * <p>Never produces negative or out-of-canvas coordinates. A box lying entirely
     * outside the canvas collapses to a zero-area box on the nearest canvas edge.
     */
    public Box clampTo(int width, int height) {
        int x0 = clamp(x, 0, width);
        int y0 = clamp(y, 0, height);
        int x1 = clamp(right(), 0, width);
        int y1 = clamp(bottom(), 0, height);
        return new Box(x0, y0, Math.max(0, x1 - x0), Math.max(0, y1 - y0));
    }

    /** Smallest box containing both. */
    public Box union(Box other) {
        int x0 = Math.min(x, other.x);
        int y0 = Math.min(y, other.y);
        int x1 = Math.max(right(), other.right());
        int y1 = Math.max(bottom(), other.bottom());
        return fromCorners(x0, y0, x1, y1);
    }

    /** True if the boxes share at least one pixel. */
    public boolean intersects(Box other) {
        return x < other.right() && other.x < right() && y < other.bottom() && other.y < bottom();
    }

    private static int clamp(int v, int lo, int hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
