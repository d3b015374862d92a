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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Groups detector boxes that belong to the same speech bubble.
 *
 * <p>Detectors usually return one box per printed line. Boxes are sorted top-to-bottom
 * (then left-to-right) and a box joins the previous group when its top edge lies between
 * 0 and {@code yThreshold} pixels below the previous box's bottom edge. Each group
 * becomes one block spanning the union of its boxes, with the texts joined by spaces.
 */
public final class BoxGrouper {

    public static final int DEFAULT_Y_THRESHOLD = 50;

    private BoxGrouper() {
    }

    public static List<DetectedBlock> group(List<DetectedBlock> blocks) {
        return group(blocks, DEFAULT_Y_THRESHOLD);
    }

    public static List<DetectedBlock> group(List<DetectedBlock> blocks, int yThreshold) {
        if (blocks.isEmpty()) {
            return List.of();
        }
        List<DetectedBlock> sorted = new ArrayList<>(blocks);
        sorted.sort(Comparator.comparingInt((DetectedBlock b) -> b.sourceBox().y())
                .thenComparingInt(b -> b.sourceBox().x()));

        List<DetectedBlock> grouped = new ArrayList<>();
        DetectedBlock previous = sorted.get(0);
        Box groupBox = previous.sourceBox();
        StringBuilder groupText = new StringBuilder(previous.sourceText());
        DetectedBlock first = previous;

        for (int i = 1; i < sorted.size(); i++) {
            DetectedBlock current = sorted.get(i);
            int distance = current.sourceBox().y() - previous.sourceBox().bottom();
            if (distance >= 0 && distance <= yThreshold) {
                groupBox = groupBox.union(current.sourceBox());
                appendText(groupText, current.sourceText());
            } else {
                grouped.add(new DetectedBlock(groupBox, groupText.toString(), first.orientation()));
                first = current;
                groupBox = current.sourceBox();
                groupText = new StringBuilder(current.sourceText());
            }
            previous = current;
        }
        grouped.add(new DetectedBlock(groupBox, groupText.toString(), first.orientation()));
        return grouped;
    }

    private static void appendText(StringBuilder text, String more) {
        if (more.isEmpty()) return;
        if (text.length() > 0) text.append(' ');
        text.append(more);
    }
}
