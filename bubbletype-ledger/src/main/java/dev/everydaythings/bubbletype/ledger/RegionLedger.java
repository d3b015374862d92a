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
import dev.everydaythings.bubbletype.LayoutIssue;
import dev.everydaythings.bubbletype.Orientation;
import dev.everydaythings.bubbletype.TextStyle;
import dev.everydaythings.bubbletype.mask.Mask;
import dev.everydaythings.bubbletype.mask.MaskBuilder;
import dev.everydaythings.bubbletype.text.RenderPlan;
import dev.everydaythings.bubbletype.text.Typesetter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * In-memory table of the regions on one page, shared by the editor and the pipeline.
 *
 * <p>Entries are addressed by region id. Every mutation replaces the entry atomically
 * through {@link ConcurrentHashMap#compute}, so writes to one id are serialized (the
 * later write wins) while writes to different ids never contend. Each entry carries the
 * region's version stamp and a cached {@link RenderPlan}; an edit that affects layout
 * drops the cached plan, and {@link #renderPlan(long)} recomputes it on the next read.
 *
 * <p>Plans are computed outside the table lock and published only if the region has
 * not changed meanwhile, so a slow layout can never overwrite a newer edit and a plan
 * for an outdated version is never returned.
 */
public class RegionLedger {

    private static final Logger log = Logger.getLogger(RegionLedger.class.getName());

    /** Cached plan is null while the entry is dirty. */
    private record Entry(Region region, RenderPlan plan) {
        boolean dirty() {
            return plan == null;
        }
    }

    private final Typesetter typesetter;
    private final TextStyle defaultStyle;
    private final ConcurrentHashMap<Long, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    public RegionLedger(Typesetter typesetter) {
        this(typesetter, TextStyle.defaults().withFontFamily(typesetter.config().defaultFamily()));
    }

    public RegionLedger(Typesetter typesetter, TextStyle defaultStyle) {
        this.typesetter = typesetter;
        this.defaultStyle = defaultStyle;
    }

    // ==================================================================================
    // Seeding and removal
    // ==================================================================================

    /** Add a detected block with the default style. */
    public Region seed(DetectedBlock block) {
        return seed(block, defaultStyle);
    }

    /**
     * Add a detected block as a new region. The edit box starts equal to the source box
     * and the translated text empty.
     *
     * @throws IllegalArgumentException if the detected box is empty
     */
    public Region seed(DetectedBlock block, TextStyle style) {
        long id = nextId.getAndIncrement();
        Region region = new Region(id, block.sourceBox(), block.sourceBox(), block.sourceText(), "",
                block.orientation(), style, 1);
        entries.put(id, new Entry(region, null));
        log.fine(() -> String.format("Seeded region %d at %s (%s)", id, block.sourceBox(), block.orientation()));
        return region;
    }

    public List<Region> seedAll(List<DetectedBlock> blocks) {
        List<Region> seeded = new ArrayList<>(blocks.size());
        for (DetectedBlock block : blocks) {
            seeded.add(seed(block));
        }
        return seeded;
    }

    /** Remove a region. Returns false if it did not exist. */
    public boolean delete(long id) {
        return entries.remove(id) != null;
    }

    /** Remove every region, e.g. before a new detection pass. Ids are not reused. */
    public void clear() {
        entries.clear();
    }

    // ==================================================================================
    // Reads
    // ==================================================================================

    public Optional<Region> get(long id) {
        Entry entry = entries.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.region());
    }

    /** Current snapshot of a region. */
    public Region require(long id) {
        return entry(id).region();
    }

    /** All regions ordered by id. */
    public List<Region> snapshot() {
        List<Region> regions = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            regions.add(entry.region());
        }
        regions.sort(Comparator.comparingLong(Region::id));
        return regions;
    }

    public int size() {
        return entries.size();
    }

    /** True if the region has a cached plan for its current version. */
    public boolean isPlanCurrent(long id) {
        return !entry(id).dirty();
    }

    // ==================================================================================
    // Mutations
    // ==================================================================================

    /**
     * Replace the edit box.
     *
     * @throws IllegalArgumentException if the box has no area
     */
    public Region resizeEditBox(long id, Box box) {
        Objects.requireNonNull(box, "box");
        if (box.isEmpty()) {
            throw new IllegalArgumentException("editBox must have positive width and height: " + box);
        }
        return update(id, r -> r.editBox().equals(box) ? r : r.withEditBox(box));
    }

    /** Restore the edit box to the detected box. */
    public Region resetEditBox(long id) {
        return update(id, r -> r.isEdited() ? r.withEditBox(r.sourceBox()) : r);
    }

    /**
     * Set the translation. Null is treated as empty; setting the current value again
     * is a no-op and keeps the cached plan.
     */
    public Region setTranslatedText(long id, String text) {
        String value = text == null ? "" : text;
        return update(id, r -> r.translatedText().equals(value) ? r : r.withTranslatedText(value));
    }

    public Region setOrientation(long id, Orientation orientation) {
        Objects.requireNonNull(orientation, "orientation");
        return update(id, r -> r.orientation() == orientation ? r : r.withOrientation(orientation));
    }

    public Region setStyle(long id, TextStyle style) {
        Objects.requireNonNull(style, "style");
        return update(id, r -> r.style().equals(style) ? r : r.withStyle(style));
    }

    // ==================================================================================
    // Derived data
    // ==================================================================================

    /**
     * Layout for the region's current version, computed on demand and cached.
     *
     * @throws NoSuchElementException if the region does not exist (or is deleted meanwhile)
     */
    public RenderPlan renderPlan(long id) {
        while (true) {
            Entry entry = entry(id);
            if (!entry.dirty()) {
                return entry.plan();
            }
            Region region = entry.region();
            RenderPlan plan = typesetter.typeset(region.translatedText(), region.style(),
                    region.orientation(), region.editBox());

            Entry published = entries.computeIfPresent(id, (k, current) ->
                    current.region().version() == region.version() && current.dirty()
                            ? new Entry(current.region(), plan)
                            : current);
            if (published == null) {
                throw new NoSuchElementException("Region " + id + " was deleted");
            }
            if (published.region().version() == region.version()) {
                if (published.plan() == plan) {
                    report(region, plan);
                }
                return published.plan();
            }
            log.fine(() -> String.format("Region %d changed during layout (v%d), recomputing", id, region.version()));
        }
    }

    /**
     * Layout for exactly the given region snapshot, whatever the region's current
     * version is. The cached plan is returned when the snapshot is still current; a plan
     * computed for the current version is cached as usual. Used by {@link PagePipeline}
     * so the text of a page run is placed inside the boxes its mask erased.
     *
     * <p>Also works for regions deleted after the snapshot was taken.
     */
    public RenderPlan renderPlan(Region snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        long id = snapshot.id();
        Entry entry = entries.get(id);
        if (entry != null && entry.region().version() == snapshot.version() && !entry.dirty()) {
            return entry.plan();
        }
        RenderPlan plan = typesetter.typeset(snapshot.translatedText(), snapshot.style(),
                snapshot.orientation(), snapshot.editBox());
        Entry published = entries.computeIfPresent(id, (k, current) ->
                current.region().version() == snapshot.version() && current.dirty()
                        ? new Entry(current.region(), plan)
                        : current);
        if (published != null && published.region().version() == snapshot.version()) {
            if (published.plan() == plan) {
                report(snapshot, plan);
            }
            return published.plan();
        }
        log.fine(() -> String.format("Region %d planned from snapshot v%d, ledger has moved on", id, snapshot.version()));
        report(snapshot, plan);
        return plan;
    }

    /**
     * Build the erase mask from a consistent snapshot of every region's edit box.
     */
    public Mask buildMask(int imageWidth, int imageHeight, int paddingPx, int dilationPx) {
        return buildMask(snapshot(), imageWidth, imageHeight, paddingPx, dilationPx);
    }

    static Mask buildMask(List<Region> regions, int imageWidth, int imageHeight, int paddingPx, int dilationPx) {
        MaskBuilder builder = new MaskBuilder()
                .imageSize(imageWidth, imageHeight)
                .padding(paddingPx)
                .dilation(dilationPx);
        for (Region region : regions) {
            builder.add(region.id(), region.editBox());
        }
        return builder.build();
    }

    // ==================================================================================
    // Private
    // ==================================================================================

    private Region update(long id, UnaryOperator<Region> change) {
        Entry updated = entries.computeIfPresent(id, (k, current) -> {
            Region next = change.apply(current.region());
            return next == current.region() ? current : new Entry(next, null);
        });
        if (updated == null) {
            throw new NoSuchElementException("No region with id " + id);
        }
        return updated.region();
    }

    private Entry entry(long id) {
        Entry entry = entries.get(id);
        if (entry == null) {
            throw new NoSuchElementException("No region with id " + id);
        }
        return entry;
    }

    private static void report(Region region, RenderPlan plan) {
        if (plan.hasIssue(LayoutIssue.DEGENERATE_BOX)) {
            log.warning(() -> String.format("Region %d: %s %s, not rendered",
                    region.id(), region.editBox(), LayoutIssue.DEGENERATE_BOX.description()));
        } else if (plan.overflow()) {
            log.warning(() -> String.format("Region %d: overflow at %dpx (%s)",
                    region.id(), plan.fontSizePx(), plan.issues()));
        }
    }
}
