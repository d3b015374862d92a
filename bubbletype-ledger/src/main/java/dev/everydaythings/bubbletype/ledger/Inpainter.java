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

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Removes the original glyphs: repaints every masked pixel of the source image.
 * Implementations typically hand the image and mask to an inpainting model.
 */
@FunctionalInterface
public interface Inpainter {

    /**
     * @param source page image; must not be modified
     * @param mask   erase mask of the same size
     * @return a new image with the masked pixels filled
     * @throws IOException if the backend cannot be reached or fails
     */
    BufferedImage inpaint(BufferedImage source, Mask mask) throws IOException;
}
