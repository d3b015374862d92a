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
 * Recoverable conditions reported by layout and mask generation.
 *
 * <p>None of these abort a page: the affected region is flagged (and, where noted,
 * skipped) while every other region is processed normally. Translated text is never
 * dropped silently.
 */
public enum LayoutIssue {

    /** No font size in the configured range fits; text is set at the minimum size. */
    INFEASIBLE_FIT("text overflows the box at the minimum font size"),

    /** The edit box has no writable area left after inner padding; region is not rendered. */
    DEGENERATE_BOX("box has no writable area after padding"),

    /** The requested font family is not registered; the default family was used. */
    UNKNOWN_FONT("font family not registered, default family used"),

    /** The padded box lies entirely outside the canvas and contributes nothing to the mask. */
    MASK_CLAMPED_TO_ZERO("mask rectangle is empty after clamping to the image"),

    /** A pinned font size does not fit; the solver searched for a smaller size instead. */
    PINNED_SIZE_INFEASIBLE("pinned font size does not fit the box");

    private final String description;

    LayoutIssue(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /** Whether the region should be left out of rendering. */
    public boolean excludesRendering() {
        return this == DEGENERATE_BOX;
    }
}
