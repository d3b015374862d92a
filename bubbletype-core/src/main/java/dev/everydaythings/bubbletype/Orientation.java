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
 * Writing direction of a region.
 *
 * <p>{@link #VERTICAL} text is set in columns read top-to-bottom, with columns
 * ordered right-to-left.
 */
public enum Orientation {
    HORIZONTAL,
    VERTICAL
}
