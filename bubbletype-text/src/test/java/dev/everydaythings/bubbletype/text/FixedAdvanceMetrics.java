package dev.everydaythings.bubbletype.text;

/**
 * Deterministic metrics for layout tests: every codepoint advances 0.6 em, every line
 * is 1.2 em tall, no extra line gap. Only the families passed to the constructor are
 * known; anything else resolves to the first one.
 */
final class FixedAdvanceMetrics implements MetricsProvider {

    static final float ADVANCE_EM = 0.6f;
    static final float LINE_HEIGHT_EM = 1.2f;

    private final String[] families;

    FixedAdvanceMetrics(String... families) {
        this.families = families.length == 0 ? new String[]{"default"} : families;
    }

    @Override
    public TextExtent measure(String fontFamily, int fontSizePx, String text) {
        String resolved = families[0];
        for (String family : families) {
            if (family.equals(fontFamily)) {
                resolved = family;
            }
        }
        int count = text.codePointCount(0, text.length());
        return new TextExtent(count * ADVANCE_EM * fontSizePx, LINE_HEIGHT_EM * fontSizePx, 0, resolved);
    }
}
