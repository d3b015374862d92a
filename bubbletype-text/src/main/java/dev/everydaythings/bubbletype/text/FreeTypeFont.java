package dev.everydaythings.bubbletype.text;

import org.lwjgl.PointerBuffer;
import org.lwjgl.system.MemoryStack;
import org.lwjgl.util.freetype.FT_Face;
import org.lwjgl.util.freetype.FT_GlyphSlot;
import org.lwjgl.util.freetype.FreeType;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * One TTF/OTF face loaded through LWJGL's FreeType bindings, exposing the unscaled
 * metrics the layout engine needs.
 *
 * <p>All measurements use {@code FT_LOAD_NO_SCALE} design units, scaled linearly by
 * font size. Hinting is never applied, so a string's measured width is exactly
 * proportional to the font size and identical across runs and machines.
 *
 * <p>Advances are cached per codepoint. Access to the FreeType face is synchronized,
 * so a font may be shared between worker threads.
 */
public class FreeTypeFont implements AutoCloseable {

    private static final Logger log = Logger.getLogger(FreeTypeFont.class.getName());

    private final String name;

    /** Font data buffer. MUST stay alive as long as the face is open.
     *  FreeType keeps an internal pointer to this memory. */
    private final ByteBuffer fontDataBuffer;

    private long ftLibHandle;
    private FT_Face ftFace;

    /** Font units per em (e.g. 2048 for TrueType, 1000 for CFF). */
    private final double unitsPerEm;
    private final double ascender;
    private final double descender;
    /** Baseline-to-baseline distance in font units. */
    private final double lineSpacing;

    private final Map<Integer, Integer> advances = new ConcurrentHashMap<>();

    /**
     * Open a face from raw font file bytes.
     *
     * @param name     logical name, used in log messages
     * @param fontData raw TTF/OTF bytes
     * @throws IllegalStateException if FreeType cannot be initialized or the data is not a font
     */
    public FreeTypeFont(String name, byte[] fontData) {
        this.name = name;
        this.fontDataBuffer = ByteBuffer.allocateDirect(fontData.length).order(ByteOrder.nativeOrder());
        fontDataBuffer.put(fontData);
        fontDataBuffer.flip();

        try (MemoryStack stack = MemoryStack.stackPush()) {
            PointerBuffer ftLibPtr = stack.mallocPointer(1);
            int result = FreeType.FT_Init_FreeType(ftLibPtr);
            if (result != 0) {
                throw new IllegalStateException("Failed to init FreeType: " + result);
            }
            ftLibHandle = ftLibPtr.get(0);

            PointerBuffer facePtr = stack.mallocPointer(1);
            result = FreeType.FT_New_Memory_Face(ftLibHandle, fontDataBuffer, 0, facePtr);
            if (result != 0) {
                FreeType.FT_Done_FreeType(ftLibHandle);
                ftLibHandle = 0;
                throw new IllegalStateException("Failed to load font '" + name + "': FreeType error " + result);
            }
            ftFace = FT_Face.create(facePtr.get(0));
        }

        unitsPerEm = ftFace.units_per_EM();
        ascender = ftFace.ascender();
        descender = ftFace.descender();
        lineSpacing = ftFace.height();
        log.info(() -> String.format("Font '%s' metrics: unitsPerEm=%.0f, ascender=%.0f, descender=%.0f, height=%.0f",
                name, unitsPerEm, ascender, descender, lineSpacing));
    }

    public String name() {
        return name;
    }

    /** Copy of the font file bytes the face was opened from. */
    public byte[] fontData() {
        ByteBuffer view = fontDataBuffer.duplicate();
        view.position(0);
        byte[] copy = new byte[view.remaining()];
        view.get(copy);
        return copy;
    }

    /**
     * Check if the font actually contains this codepoint (not .notdef).
     * FreeType's FT_Get_Char_Index returns 0 when the codepoint has no
     * mapping in the font's cmap.
     */
    public synchronized boolean hasGlyph(int codepoint) {
        ensureOpen();
        return FreeType.FT_Get_Char_Index(ftFace, codepoint) != 0;
    }

    /** Horizontal advance of one codepoint in pixels at {@code fontSizePx}. */
    public float advance(int codepoint, int fontSizePx) {
        int units = advances.computeIfAbsent(codepoint, this::loadAdvance);
        return (float) (units * fontSizePx / unitsPerEm);
    }

    /** Ascent plus descent in pixels. */
    public float lineHeight(int fontSizePx) {
        return (float) ((ascender - descender) * fontSizePx / unitsPerEm);
    }

    /** Extra leading between lines in pixels; never negative. */
    public float lineGap(int fontSizePx) {
        double gap = Math.max(0, lineSpacing - (ascender - descender));
        return (float) (gap * fontSizePx / unitsPerEm);
    }

    @Override
    public synchronized void close() {
        if (ftFace != null) {
            FreeType.FT_Done_Face(ftFace);
            ftFace = null;
        }
        if (ftLibHandle != 0) {
            FreeType.FT_Done_FreeType(ftLibHandle);
            ftLibHandle = 0;
        }
    }

    private synchronized int loadAdvance(int codepoint) {
        ensureOpen();
        int result = FreeType.FT_Load_Char(ftFace, codepoint, FreeType.FT_LOAD_NO_SCALE);
        if (result != 0) {
            log.fine(() -> String.format("Font '%s' cannot load U+%04X (error %d), advance 0", name, codepoint, result));
            return 0;
        }
        FT_GlyphSlot slot = ftFace.glyph();
        return slot == null ? 0 : (int) slot.advance().x();
    }

    private void ensureOpen() {
        if (ftFace == null) {
            throw new IllegalStateException("Font '" + name + "' is closed");
        }
    }
}
