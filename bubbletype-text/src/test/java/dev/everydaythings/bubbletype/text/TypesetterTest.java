package dev.everydaythings.bubbletype.text;

import dev.everydaythings.bubbletype.Alignment;
import dev.everydaythings.bubbletype.Box;
import dev.everydaythings.bubbletype.LayoutIssue;
import dev.everydaythings.bubbletype.Orientation;
import dev.everydaythings.bubbletype.TextStyle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypesetterTest {

    private final Typesetter typesetter = new Typesetter(new FixedAdvanceMetrics(), LayoutConfig.defaults());

    @Test
    void fitsAndPlacesLeftAlignedText() {
        RenderPlan plan = typesetter.typeset("HELLO THERE WORLD",
                TextStyle.defaults().withAlignment(Alignment.LEFT), Orientation.HORIZONTAL, new Box(0, 0, 200, 80));

        assertEquals(29, plan.fontSizePx());
        assertEquals("default", plan.fontFamily());
        assertEquals("HELLO THERE\nWORLD", plan.text());
        assertTrue(plan.isRenderable());
        assertFalse(plan.overflow());

        List<PlacedLine> lines = plan.lines();
        assertEquals(4f, lines.get(0).x(), 1e-3);
        assertEquals(4f, lines.get(1).x(), 1e-3);
        assertEquals(5.2f, lines.get(0).y(), 1e-3);
        assertEquals(40.0f, lines.get(1).y(), 1e-3);
        assertEquals(69.6f, plan.blockExtent(), 1e-3);
    }

    @Test
    void normalizesBeforeFitting() {
        RenderPlan plan = typesetter.typeset("Wait．．．  what", TextStyle.defaults(), Orientation.HORIZONTAL,
                new Box(0, 0, 400, 80));
        assertEquals("Wait... what", plan.text());
    }

    @Test
    void sameInputsGiveEqualPlans() {
        TextStyle style = TextStyle.defaults();
        Box box = new Box(12, 30, 150, 90);
        RenderPlan first = typesetter.typeset("Do you hear that sound?", style, Orientation.HORIZONTAL, box);
        RenderPlan second = typesetter.typeset("Do you hear that sound?", style, Orientation.HORIZONTAL, box);
        assertEquals(first, second);
    }

    @Test
    void degenerateBoxIsNotRenderable() {
        Typesetter padded = new Typesetter(new FixedAdvanceMetrics(),
                LayoutConfig.builder().innerPaddingPx(20).build());
        RenderPlan plan = padded.typeset("HELLO", TextStyle.defaults(), Orientation.HORIZONTAL, new Box(0, 0, 10, 10));

        assertTrue(plan.hasIssue(LayoutIssue.DEGENERATE_BOX));
        assertFalse(plan.isRenderable());
        assertTrue(plan.isEmpty());
    }
}
