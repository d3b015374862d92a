package dev.everydaythings.bubbletype.text;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Measures with a real FreeType face. Skipped on machines without one of the usual
 * sans-serif system fonts.
 */
class FontManagerTest {

    private static final Path FONT = Stream.of(
                    "/usr/share/fonts/truetype/dejavu/DejaVuSans.ttf",
                    "/usr/share/fonts/TTF/DejaVuSans.ttf",
                    "/usr/share/fonts/dejavu/DejaVuSans.ttf",
                    "/usr/share/fonts/truetype/liberation/LiberationSans-Regular.ttf")
            .map(Path::of)
            .filter(Files::isRegularFile)
            .findFirst()
            .orElse(null);

    private FontManager fonts;

    @BeforeEach
    void setUp() {
        assumeTrue(FONT != null, "no system font available");
        fonts = new FontManager("default");
        assertNotNull(fonts.registerFont("default", FONT));
    }

    @AfterEach
    void tearDown() {
        if (fonts != null) {
            fonts.close();
        }
    }

    @Test
    void widthScalesLinearlyWithSize() {
        TextExtent small = fonts.measure("default", 10, "Hello");
        TextExtent large = fonts.measure("default", 20, "Hello");

        assertTrue(small.width() > 0);
        assertEquals(small.width() * 2, large.width(), 1e-3);
        assertEquals(small.height() * 2, large.height(), 1e-3);
        assertEquals("default", small.resolvedFamily());
    }

    @Test
    void longerTextIsWider() {
        float one = fonts.measure("default", 16, "WORLD").width();
        float two = fonts.measure("default", 16, "WORLD WORLD").width();
        assertTrue(two > 2 * one);
    }

    @Test
    void measurementIsRepeatable() {
        assertEquals(fonts.measure("default", 17, "Do you hear that?"),
                fonts.measure("default", 17, "Do you hear that?"));
    }

    @Test
    void unknownFamilyFallsBackToDefault() {
        TextExtent extent = fonts.measure("NoSuchFont", 12, "abc");
        assertEquals("default", extent.resolvedFamily());
        assertEquals(fonts.measure("default", 12, "abc").width(), extent.width(), 1e-6);
    }

    @Test
    void missingResourceIsNotRegistered() {
        assertNull(fonts.registerFont("other", "fonts/does-not-exist.ttf"));
        assertFalse(fonts.hasFamily("other"));
        assertTrue(fonts.hasFamily("default"));
    }

    @Test
    void emptyManagerCannotMeasure() {
        try (FontManager empty = new FontManager("default")) {
            assertThrows(IllegalStateException.class, () -> empty.measure("default", 12, "x"));
        }
    }

    @Test
    void unknownFamilyIsLoggedOncePerFamily() {
        Logger logger = Logger.getLogger(FontManager.class.getName());
        List<String> warnings = new CopyOnWriteArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                if (record.getLevel() == Level.WARNING) {
                    warnings.add(record.getMessage());
                }
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(handler);
        try {
            for (int i = 0; i < 5; i++) {
                fonts.measure("Comic", 12 + i, "abc");
            }
            fonts.measure("Papyrus", 12, "abc");
            fonts.measure("Papyrus", 20, "xyz");
        } finally {
            logger.removeHandler(handler);
        }

        assertEquals(2, warnings.size(), warnings.toString());
        assertEquals(1, warnings.stream().filter(m -> m.contains("'Comic'")).count());
        assertEquals(1, warnings.stream().filter(m -> m.contains("'Papyrus'")).count());
    }

    @Test
    void replacedFontStaysOpenUntilManagerCloses() {
        FreeTypeFont first = fonts.font("default").orElseThrow();
        FreeTypeFont second = fonts.registerFont("default", FONT);

        assertNotSame(first, second);
        assertSame(second, fonts.font("default").orElseThrow());
        assertEquals(List.of("default"), fonts.families());
        // A worker still holding the old font keeps measuring without error
        assertTrue(first.hasGlyph('A'));
        assertTrue(first.advance('W', 12) > 0);
    }
}
