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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BoxTest {

    @Test
    void insetCanProduceEmptyBox() {
        Box box = new Box(0, 0, 10, 10);
        assertEquals(new Box(4, 4, 2, 2), box.inset(4));
        assertFalse(box.inset(4).isEmpty());
        assertTrue(box.inset(5).isEmpty());
        assertTrue(box.inset(20).isEmpty());
    }

    @Test
    void expandIsNegativeInset() {
        assertEquals(new Box(0, 0, 70, 70), new Box(10, 10, 50, 50).expand(10));
    }

    @Test
    void clampKeepsCoordinatesOnCanvas() {
        assertEquals(new Box(0, 0, 10, 10), new Box(-20, -20, 30, 30).clampTo(100, 100));
        assertEquals(new Box(90, 95, 10, 5), new Box(90, 95, 50, 50).clampTo(100, 100));

        Box outside = new Box(300, 300, 10, 10).clampTo(200, 100);
        assertTrue(outside.isEmpty());
        assertTrue(outside.x() >= 0 && outside.x() <= 200);
        assertTrue(outside.y() >= 0 && outside.y() <= 100);
        assertEquals(0, outside.area());
    }

    @Test
    void touchingBoxesDoNotIntersect() {
        Box a = new Box(0, 0, 10, 10);
        assertFalse(a.intersects(new Box(10, 0, 10, 10)));
        assertTrue(a.intersects(new Box(9, 9, 10, 10)));
    }

    @Test
    void unionSpansBoth() {
        Box union = new Box(10, 10, 20, 20).union(new Box(50, 0, 10, 5));
        assertEquals(Box.fromCorners(10, 0, 60, 30), union);
    }
}
