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
import dev.everydaythings.bubbletype.mask.MaskBuilder;
import dev.everydaythings.bubbletype.text.RenderPlan;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives one page through layout, masking, inpainting and rendering.
 *
 * <p>Layout runs per region on the supplied executor, so partially translated pages are
 * usable: regions without a translation simply get empty plans. A region whose layout
 * or rendering throws is logged and reported in {@link PlanSet#failures()}; the other
 * regions are unaffected. Layout and mask both use one snapshot of the ledger taken when
 * the run starts, so edits made during a run apply to the next run.
 *
 * <p>Usage:
 * <pre>{@code
 * PagePipeline pipeline = new PagePipeline(ledger, executor)
 *     .maskPadding(10)
 *     .maskDilation(2);
 * PageResult result = pipeline.run(page, new FillInpainter(), new Java2dPlanRenderer()).join();
 * }</pre>
 */
public class PagePipeline {

    private static final Logger log = Logger.getLogger(PagePipeline.class.getName());

    private final RegionLedger ledger;
    private final Executor executor;
    private int maskPadding = MaskBuilder.DEFAULT_PADDING;
    private int maskDilation = 0;
    private PipelineListener listener = PipelineListener.NONE;

    public PagePipeline(RegionLedger ledger, Executor executor) {
        this.ledger = ledger;
        this.executor = executor;
    }

    /** Mask padding in pixels (default {@value MaskBuilder#DEFAULT_PADDING}). */
    public PagePipeline maskPadding(int paddingPx) {
        this.maskPadding = paddingPx;
        return this;
    }

    /** Mask dilation radius in pixels (default 0). */
    public PagePipeline maskDilation(int dilationPx) {
        this.maskDilation = dilationPx;
        return this;
    }

    public PagePipeline listener(PipelineListener listener) {
        this.listener = listener == null ? PipelineListener.NONE : listener;
        return this;
    }

    /**
     * Compute (or fetch cached) plans for a snapshot of every region currently in the ledger.
     */
    public CompletableFuture<PlanSet> planAll() {
        return plan(ledger.snapshot());
    }

    /**
     * Run the whole page.
     *
     * @param source    original page image
     * @param inpainter removes the original glyphs
     * @param renderer  draws the translations
     * @return future completing with the result, or exceptionally with {@link PipelineException}
     *         if inpainting fails
     */
    public CompletableFuture<PageResult> run(BufferedImage source, Inpainter inpainter, PlanRenderer renderer) {
        List<Region> regions = ledger.snapshot();
        log.info(() -> String.format("Page %dx%d: %d regions", source.getWidth(), source.getHeight(), regions.size()));

        return plan(regions).thenApplyAsync(plans -> {
            listener.stepStarted("mask");
            Mask mask = RegionLedger.buildMask(regions, source.getWidth(), source.getHeight(), maskPadding, maskDilation);

            listener.stepStarted("inpaint");
            BufferedImage page;
            try {
                page = inpainter.inpaint(source, mask);
            } catch (IOException e) {
                throw new PipelineException("Inpainting failed", e);
            }

            listener.stepStarted("render");
            Map<Long, Throwable> failures = new LinkedHashMap<>(plans.failures());
            int rendered = 0;
            for (Long id : plans.renderable()) {
                RenderPlan plan = plans.plans().get(id);
                try {
                    renderer.render(page, plan);
                    rendered++;
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "Rendering region " + id + " failed", e);
                    failures.put(id, e);
                    listener.regionFailed(id, e);
                }
            }
            PlanSet finalPlans = new PlanSet(plans.plans(), failures);
            int renderedCount = rendered;
            log.info(() -> String.format("Page done: %d rendered, %d flagged, %d failed, %d mask regions",
                    renderedCount, finalPlans.flagged().size(), failures.size(), mask.regions().size()));
            return new PageResult(finalPlans, mask, page);
        }, executor);
    }

    private CompletableFuture<PlanSet> plan(List<Region> regions) {
        listener.stepStarted("layout");
        List<CompletableFuture<Void>> futures = new ArrayList<>(regions.size());
        Map<Long, RenderPlan> plans = new ConcurrentHashMap<>();
        Map<Long, Throwable> failures = new ConcurrentHashMap<>();

        for (Region region : regions) {
            long id = region.id();
            futures.add(CompletableFuture.supplyAsync(() -> ledger.renderPlan(region), executor)
                    .handle((plan, error) -> {
                        if (error == null) {
                            plans.put(id, plan);
                            listener.regionPlanned(id, plan);
                        } else {
                            Throwable cause = error instanceof CompletionException && error.getCause() != null
                                    ? error.getCause() : error;
                            log.log(Level.WARNING, "Layout of region " + id + " failed", cause);
                            failures.put(id, cause);
                            listener.regionFailed(id, cause);
                        }
                        return null;
                    }));
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(done -> {
                    Map<Long, RenderPlan> ordered = new LinkedHashMap<>();
                    Map<Long, Throwable> orderedFailures = new LinkedHashMap<>();
                    for (Region region : regions) {
                        RenderPlan plan = plans.get(region.id());
                        if (plan != null) ordered.put(region.id(), plan);
                        Throwable failure = failures.get(region.id());
                        if (failure != null) orderedFailures.put(region.id(), failure);
                    }
                    return new PlanSet(ordered, orderedFailures);
                });
    }
}
