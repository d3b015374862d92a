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

import dev.everydaythings.bubbletype.text.RenderPlan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Plans for a set of regions, keyed by region id in id order, plus the regions whose
 * layout failed.
 */
public record PlanSet(Map<Long, RenderPlan> plans, Map<Long, Throwable> failures) {

    public PlanSet {
        plans = Collections.unmodifiableMap(new LinkedHashMap<>(plans));
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    /** Ids of regions that should be drawn. */
    public List<Long> renderable() {
        return plans.entrySet().stream()
                .filter(e -> e.getValue().isRenderable())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    /** Ids of regions needing attention: overflow, degenerate box, unknown font. */
    public List<Long> flagged() {
        return plans.entrySet().stream()
                .filter(e -> e.getValue().overflow() || !e.getValue().issues().isEmpty())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
