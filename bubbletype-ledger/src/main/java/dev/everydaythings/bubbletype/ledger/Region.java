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

import java.util.Objects;

/**
 * Immutable snapshot of one text region.
 *
 * <p>The ledger replaces the snapshot on every edit and bumps {@link #version()}, so a
 * snapshot can be handed to a worker thread and compared later to detect staleness.
 *
 * @param id             stable id, never reused
 * @param sourceBox      box as detected
 * @param editBox        box as edited; always non-empty
 * @param sourceText     recognized source-language text
 * @param translatedText translation, empty until the translator fills it
 * @param orientation    writing direction
 * @param style          typographic style
 * @param version        edit counter, starting at 1
 */
public record Region(long id, Box sourceBox, Box editBox, String sourceText, String translatedText,
                     Orientation orientation, TextStyle style, long version) {

    public Region {
        Objects.requireNonNull(sourceBox, "sourceBox");
        Objects.requireNonNull(editBox, "editBox");
        Objects.requireNonNull(orientation, "orientation");
        Objects.requireNonNull(style, "style");
        if (editBox.isEmpty()) {
            throw new IllegalArgumentException("editBox must have positive width and height: " + editBox);
        }
        sourceText = sourceText == null ? "" : sourceText;
        translatedText = translatedText == null ? "" : translatedText;
    }

    Region withEditBox(Box box) {
        return new Region(id, sourceBox, box, sourceText, translatedText, orientation, style, version + 1);
    }

    Region withTranslatedText(String text) {
        return new Region(id, sourceBox, editBox, sourceText, text, orientation, style, version + 1);
    }

    Region withOrientation(Orientation value) {
        return new Region(id, sourceBox, editBox, sourceText, translatedText, value, style, version + 1);
    }

    Region withStyle(TextStyle value) {
        return new Region(id, sourceBox, editBox, sourceText, translatedText, orientation, value, version + 1);
    }

    public boolean isEdited() {
        return !editBox.equals(sourceBox);
    }
}
