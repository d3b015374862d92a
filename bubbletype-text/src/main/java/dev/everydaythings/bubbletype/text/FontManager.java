package dev.everydaythings.bubbletype.text;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * FreeType-backed {@link MetricsProvider} managing several fonts with a fallback chain.
 *
 * <p>Fonts are registered by family name and appended to the fallback chain. A string
 * is measured with the requested family; each codepoint that family lacks is measured
 * with the first font in the chain that has it, like browser font-family fallback.
 *
 * <p>An unregistered family falls back to the default family. The substitution is
 * reported through {@link TextExtent#resolvedFamily()} on every call but logged only
 * once per family for the lifetime of the manager.
 *
 * @see FreeTypeFont
 */
public class FontManager implements MetricsProvider, AutoCloseable {

    private static final Logger log = Logger.getLogger(FontManager.class.getName());

    private final String defaultFamily;
    private final Map<String, FreeTypeFont> fonts = new ConcurrentHashMap<>();

    /** Ordered fallback chain; the first font with the glyph wins. */
    private final List<FreeTypeFont> fallbackChain = new CopyOnWriteArrayList<>();

    /** Fonts replaced by a later registration; other threads may still hold them. */
    private final List<FreeTypeFont> retired = new CopyOnWriteArrayList<>();

    private final Set<String> warnedFamilies = ConcurrentHashMap.newKeySet();

    /**
     * @param defaultFamily family used when a requested family is not registered
     */
    public FontManager(String defaultFamily) {
        this.defaultFamily = defaultFamily;
    }

    // ==================================================================================
    // Font Registration
    // ==================================================================================

    /**
     * Register a font from raw TTF/OTF bytes.
     * The font is appended to the fallback chain. A font previously registered under
     * the same family leaves the chain but stays open until {@link #close()}, so
     * measurements already running against it complete normally.
     *
     * @param family   logical family name (e.g., "default", "wildwords")
     * @param fontData raw font file bytes
     * @return the opened font
     */
    public FreeTypeFont registerFont(String family, byte[] fontData) {
        FreeTypeFont font = new FreeTypeFont(family, fontData);
        FreeTypeFont previous = fonts.put(family, font);
        if (previous != null) {
            fallbackChain.remove(previous);
            retired.add(previous);
        }
        fallbackChain.add(font);
        log.info(() -> String.format("Registered font: %s (chain position %d)", family, fallbackChain.size()));
        return font;
    }

    /**
     * Register a font from a classpath resource.
     *
     * @return the opened font, or null if the resource does not exist
     */
    public FreeTypeFont registerFont(String family, String resourcePath) {
        byte[] data = loadResource(resourcePath);
        if (data == null) {
            log.warning(() -> "Font resource not found: " + resourcePath);
            return null;
        }
        return registerFont(family, data);
    }

    /**
     * Register a font file from disk.
     *
     * @return the opened font, or null if the file cannot be read
     */
    public FreeTypeFont registerFont(String family, Path file) {
        try {
            return registerFont(family, Files.readAllBytes(file));
        } catch (IOException e) {
            log.warning(() -> "Cannot read font file " + file + ": " + e.getMessage());
            return null;
        }
    }

    /**
     * Load the default family and broad-coverage fallbacks from well-known system paths:
     * <ol>
     *   <li>a comic lettering face if installed, otherwise DejaVu/Liberation Sans (default family)</li>
     *   <li>Noto Sans CJK (Japanese/Chinese/Korean coverage)</li>
     *   <li>DejaVu Sans (broad Unicode coverage fallback)</li>
     * </ol>
     *
     * @return true if the default family could be loaded
     */
    public boolean loadDefaultFont() {
        String home = System.getProperty("user.home", "");
        String[] primaryPaths = {
                home + "/.local/share/fonts/WildWordsRoman.ttf",
                home + "/.local/share/fonts/animeace2_reg.otf",
                "/usr/share/fonts/truetype/dejavu/DejaVuSans.ttf",
                "/usr/share/fonts/truetype/liberation/LiberationSans-Regular.ttf",
                "/usr/share/fonts/TTF/DejaVuSans.ttf",
                "/usr/share/fonts/truetype/freefont/FreeSans.ttf",
                "/usr/share/fonts/dejavu/DejaVuSans.ttf",
                "/Library/Fonts/Arial.ttf",
                "C:/Windows/Fonts/arial.ttf",
        };
        boolean loaded = loadFirstAvailable(defaultFamily, primaryPaths);

        String[] cjkPaths = {
                "/usr/share/fonts/opentype/noto/NotoSansCJK-Regular.ttc",
                "/usr/share/fonts/noto-cjk/NotoSansCJK-Regular.ttc",
                "/usr/share/fonts/truetype/droid/DroidSansFallbackFull.ttf",
        };
        loadFirstAvailable("cjk", cjkPaths);

        String[] broadFallbackPaths = {
                "/usr/share/fonts/truetype/dejavu/DejaVuSans.ttf",
                "/usr/share/fonts/truetype/freefont/FreeSans.ttf",
        };
        loadFirstAvailable("unicode", broadFallbackPaths);

        if (fallbackChain.isEmpty()) {
            log.warning("No fonts found for text measurement");
        } else {
            log.info(() -> "Font fallback chain: " + fallbackChain.size() + " fonts");
        }
        return loaded;
    }

    private boolean loadFirstAvailable(String family, String[] paths) {
        for (String path : paths) {
            Path file = Path.of(path);
            if (Files.isRegularFile(file) && registerFont(family, file) != null) {
                log.info(() -> String.format("Font '%s': %s", family, path));
                return true;
            }
        }
        log.fine(() -> String.format("No font found for '%s', tried %d paths", family, paths.length));
        return false;
    }

    // ==================================================================================
    // Measurement
    // ==================================================================================

    @Override
    public TextExtent measure(String fontFamily, int fontSizePx, String text) {
        FreeTypeFont primary = resolve(fontFamily);
        float width = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            width += fontFor(primary, cp).advance(cp, fontSizePx);
        }
        return new TextExtent(width, primary.lineHeight(fontSizePx), primary.lineGap(fontSizePx), primary.name());
    }

    /** Whether {@code family} is registered. */
    public boolean hasFamily(String family) {
        return fonts.containsKey(family);
    }

    /** Registered family names in fallback-chain order. */
    public List<String> families() {
        List<String> names = new ArrayList<>(fallbackChain.size());
        for (FreeTypeFont font : fallbackChain) {
            names.add(font.name());
        }
        return names;
    }

    /** The font registered under {@code family}, if any. */
    public Optional<FreeTypeFont> font(String family) {
        return Optional.ofNullable(fonts.get(family));
    }

    private FreeTypeFont resolve(String family) {
        FreeTypeFont font = fonts.get(family);
        if (font != null) {
            return font;
        }
        FreeTypeFont fallback = fonts.get(defaultFamily);
        if (fallback == null) {
            if (fallbackChain.isEmpty()) {
                throw new IllegalStateException("No fonts registered");
            }
            fallback = fallbackChain.get(0);
        }
        if (warnedFamilies.add(family)) {
            String used = fallback.name();
            log.warning(() -> String.format("Unknown font family '%s', using '%s'", family, used));
        }
        return fallback;
    }

    /** Walk the fallback chain for a font containing {@code codepoint}; the primary font if none does. */
    private FreeTypeFont fontFor(FreeTypeFont primary, int codepoint) {
        if (Character.isWhitespace(codepoint) || primary.hasGlyph(codepoint)) {
            return primary;
        }
        for (FreeTypeFont font : fallbackChain) {
            if (font != primary && font.hasGlyph(codepoint)) {
                return font;
            }
        }
        return primary;
    }

    // ==================================================================================
    // Cleanup
    // ==================================================================================

    @Override
    public void close() {
        for (FreeTypeFont font : fonts.values()) {
            font.close();
        }
        for (FreeTypeFont font : retired) {
            font.close();
        }
        fonts.clear();
        fallbackChain.clear();
        retired.clear();
    }

    private byte[] loadResource(String resourcePath) {
        String path = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(path)) {
            if (in == null) return null;
            return in.readAllBytes();
        } catch (IOException e) {
            log.warning(() -> "Cannot read font resource " + path + ": " + e.getMessage());
            return null;
        }
    }
}
