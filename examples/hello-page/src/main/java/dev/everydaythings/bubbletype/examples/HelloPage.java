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

package dev.everydaythings.bubbletype.examples;

import dev.everydaythings.bubbletype.Box;
import dev.everydaythings.bubbletype.Orientation;
import dev.everydaythings.bubbletype.ledger.BoxGrouper;
import dev.everydaythings.bubbletype.ledger.DetectedBlock;
import dev.everydaythings.bubbletype.ledger.FillInpainter;
import dev.everydaythings.bubbletype.ledger.Java2dPlanRenderer;
import dev.everydaythings.bubbletype.ledger.PagePipeline;
import dev.everydaythings.bubbletype.ledger.PageResult;
import dev.everydaythings.bubbletype.ledger.PipelineListener;
import dev.everydaythings.bubbletype.ledger.Region;
import dev.everydaythings.bubbletype.ledger.RegionLedger;
import dev.everydaythings.bubbletype.mask.MaskBuilder;
import dev.everydaythings.bubbletype.text.FontManager;
import dev.everydaythings.bubbletype.text.LayoutConfig;
import dev.everydaythings.bubbletype.text.RenderPlan;
import dev.everydaythings.bubbletype.text.Typesetter;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Typesets translations into a page image.
 *
 * <p>Usage: {@code HelloPage <page.png> <regions.txt> <out.png> [mask.png]}
 *
 * <p>Each non-blank line of {@code regions.txt} describes one detected block:
 * <pre>
 * x,y,w,h|HORIZONTAL|source text|translated text
 * </pre>
 * Lines starting with {@code #} are comments. Blocks are grouped into bubbles, the
 * original text is erased with a solid fill and the translations are drawn with Java2D.
 */
public class HelloPage {

    private static final Logger log = Logger.getLogger(HelloPage.class.getName());

    public static void main(String[] args) throws Exception {
        if (args.length < 3) {
            System.err.println("Usage: HelloPage <page.png> <regions.txt> <out.png> [mask.png]");
            System.exit(2);
        }
        configureLogging();

        Properties props = loadProperties("bubbletype.properties");
        LayoutConfig config = LayoutConfig.fromProperties(props);
        int maskPadding = Integer.parseInt(props.getProperty("bubbletype.mask.padding",
                String.valueOf(MaskBuilder.DEFAULT_PADDING)).trim());
        int maskDilation = Integer.parseInt(props.getProperty("bubbletype.mask.dilation", "0").trim());
        log.info(() -> "Layout: " + config);

        BufferedImage page = ImageIO.read(Path.of(args[0]).toFile());
        if (page == null) {
            throw new IOException("Not a readable image: " + args[0]);
        }

        List<String[]> rows = readRegions(Path.of(args[1]));
        List<DetectedBlock> detected = new ArrayList<>();
        for (String[] row : rows) {
            detected.add(new DetectedBlock(parseBox(row[0]), row[2], Orientation.valueOf(row[1].trim())));
        }

        ExecutorService workers = Executors.newFixedThreadPool(
                Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
        try (FontManager fonts = new FontManager(config.defaultFamily())) {
            if (!fonts.loadDefaultFont()) {
                throw new IllegalStateException("No usable system font found");
            }

            RegionLedger ledger = new RegionLedger(new Typesetter(fonts, config));
            // Translations are matched to grouped blocks by box overlap
            List<DetectedBlock> blocks = BoxGrouper.group(detected);
            for (DetectedBlock block : blocks) {
                Region region = ledger.seed(block);
                ledger.setTranslatedText(region.id(), translationFor(block, rows));
            }

            PagePipeline pipeline = new PagePipeline(ledger, workers)
                    .maskPadding(maskPadding)
                    .maskDilation(maskDilation)
                    .listener(new PipelineListener() {
                        @Override
                        public void stepStarted(String step) {
                            log.info(() -> "Step: " + step);
                        }

                        @Override
                        public void regionPlanned(long regionId, RenderPlan plan) {
                            if (plan.overflow() || !plan.issues().isEmpty()) {
                                log.warning(() -> String.format("Region %d needs attention: %s",
                                        regionId, plan.issues()));
                            }
                        }
                    });

            // Draw with the faces the layout was measured with
            Java2dPlanRenderer renderer = new Java2dPlanRenderer().registerFonts(fonts);
            PageResult result = pipeline.run(page, new FillInpainter(), renderer).join();

            ImageIO.write(result.image(), "png", Path.of(args[2]).toFile());
            if (args.length > 3) {
                ImageIO.write(result.mask().toImage(), "png", Path.of(args[3]).toFile());
            }
            log.info(() -> String.format("Wrote %s (%d regions, %d flagged)",
                    args[2], ledger.size(), result.plans().flagged().size()));
        } finally {
            workers.shutdown();
        }
    }

    private static String translationFor(DetectedBlock block, List<String[]> rows) {
        StringBuilder text = new StringBuilder();
        for (String[] row : rows) {
            Box box = parseBox(row[0]);
            if (block.sourceBox().intersects(box) && row.length > 3 && !row[3].isBlank()) {
                if (text.length() > 0) text.append(' ');
                text.append(row[3].trim());
            }
        }
        return text.toString();
    }

    private static List<String[]> readRegions(Path file) throws IOException {
        List<String[]> rows = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (line.isBlank() || line.startsWith("#")) continue;
            String[] parts = line.split("\\|", -1);
            if (parts.length < 3) {
                throw new IOException("Malformed region line (need box|orientation|text[|translation]): " + line);
            }
            rows.add(parts);
        }
        return rows;
    }

    private static Box parseBox(String value) {
        String[] p = value.split(",");
        if (p.length != 4) {
            throw new IllegalArgumentException("Box must be x,y,w,h: " + value);
        }
        return new Box(Integer.parseInt(p[0].trim()), Integer.parseInt(p[1].trim()),
                Integer.parseInt(p[2].trim()), Integer.parseInt(p[3].trim()));
    }

    private static Properties loadProperties(String resourcePath) throws IOException {
        Properties props = new Properties();
        try (InputStream in = HelloPage.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in != null) {
                props.load(in);
            }
        }
        return props;
    }

    private static void configureLogging() throws IOException {
        try (InputStream in = HelloPage.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        }
    }
}
