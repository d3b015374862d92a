package dev.everydaythings.bubbletype.text;

import dev.everydaythings.bubbletype.TextStyle;

import java.util.Properties;

/**
 * Tunables for the fit solver and placement engine. Immutable; build with
 * {@link #builder()} or read from properties with {@link #fromProperties(Properties)}.
 */
public final class LayoutConfig {

    public static final String PROP_MIN_FONT = "bubbletype.font.min";
    public static final String PROP_MAX_FONT = "bubbletype.font.max";
    public static final String PROP_INNER_PADDING = "bubbletype.padding.inner";
    public static final String PROP_DEFAULT_FAMILY = "bubbletype.font.default";

    private static final int DEFAULT_MIN_FONT_PX = 8;
    private static final int DEFAULT_MAX_FONT_PX = 40;
    private static final int DEFAULT_INNER_PADDING_PX = 4;

    private final int minFontPx;
    private final int maxFontPx;
    private final int innerPaddingPx;
    private final String defaultFamily;

    private LayoutConfig(Builder b) {
        if (b.minFontPx <= 0) {
            throw new IllegalArgumentException("minFontPx must be positive: " + b.minFontPx);
        }
        if (b.maxFontPx < b.minFontPx) {
            throw new IllegalArgumentException(
                    "maxFontPx (" + b.maxFontPx + ") must not be below minFontPx (" + b.minFontPx + ")");
        }
        if (b.innerPaddingPx < 0) {
            throw new IllegalArgumentException("innerPaddingPx must not be negative: " + b.innerPaddingPx);
        }
        this.minFontPx = b.minFontPx;
        this.maxFontPx = b.maxFontPx;
        this.innerPaddingPx = b.innerPaddingPx;
        this.defaultFamily = b.defaultFamily;
    }

    public static LayoutConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read a config from properties; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value is not a number or out of range
     */
    public static LayoutConfig fromProperties(Properties props) {
        Builder b = builder();
        b.minFontPx(intProperty(props, PROP_MIN_FONT, b.minFontPx));
        b.maxFontPx(intProperty(props, PROP_MAX_FONT, b.maxFontPx));
        b.innerPaddingPx(intProperty(props, PROP_INNER_PADDING, b.innerPaddingPx));
        b.defaultFamily(props.getProperty(PROP_DEFAULT_FAMILY, b.defaultFamily).trim());
        return b.build();
    }

    public int minFontPx() {
        return minFontPx;
    }

    public int maxFontPx() {
        return maxFontPx;
    }

    /** Padding subtracted from every side of the edit box before fitting. */
    public int innerPaddingPx() {
        return innerPaddingPx;
    }

    public String defaultFamily() {
        return defaultFamily;
    }

    public Builder toBuilder() {
        return builder().minFontPx(minFontPx).maxFontPx(maxFontPx)
                .innerPaddingPx(innerPaddingPx).defaultFamily(defaultFamily);
    }

    @Override
    public String toString() {
        return "LayoutConfig[font=" + minFontPx + ".." + maxFontPx + "px, padding=" + innerPaddingPx
                + "px, defaultFamily=" + defaultFamily + "]";
    }

    private static int intProperty(Properties props, String key, int fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: '" + value + "'", e);
        }
    }

    public static final class Builder {
        private int minFontPx = DEFAULT_MIN_FONT_PX;
        private int maxFontPx = DEFAULT_MAX_FONT_PX;
        private int innerPaddingPx = DEFAULT_INNER_PADDING_PX;
        private String defaultFamily = TextStyle.DEFAULT_FAMILY;

        private Builder() {
        }

        public Builder minFontPx(int value) {
            this.minFontPx = value;
            return this;
        }

        public Builder maxFontPx(int value) {
            this.maxFontPx = value;
            return this;
        }

        public Builder innerPaddingPx(int value) {
            this.innerPaddingPx = value;
            return this;
        }

        public Builder defaultFamily(String value) {
            this.defaultFamily = value;
            return this;
        }

        public LayoutConfig build() {
            return new LayoutConfig(this);
        }
    }
}
