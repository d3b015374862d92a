package dev.everydaythings.bubbletype.text;

import dev.everydaythings.bubbletype.Alignment;
import dev.everydaythings.bubbletype.Box;
import dev.everydaythings.bubbletype.Orientation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PlacementEngineTest {

    private static final Box AVAILABLE = new Box(10, 20, 100, 50);

    private final PlacementEngine engine = new PlacementEngine();

    private static FitResult rows() {
        LineBreak lines = new LineBreak(List.of(
                new Line("aa", 20, 12, false),
                new Line("aaaa", 40, 12, false)), false, 2, "default");
        return new FitResult(10, lines, AVAILABLE, Orientation.HORIZONTAL, false, Set.of());
    }

    @Test
    void blockIsCenteredVertically() {
        List<PlacedLine> placed = engine.place(rows(), Alignment.LEFT);

        // block = 12 + 2 + 12 = 26, so (50 - 26) / 2 = 12 below the top
        assertEquals(32f, placed.get(0).y(), 1e-4);
        assertEquals(46f, placed.get(1).y(), 1e-4);
    }

    @Test
    void leftAlignment() {
        List<PlacedLine> placed = engine.place(rows(), Alignment.LEFT);
        assertEquals(10f, placed.get(0).x(), 1e-4);
        assertEquals(10f, placed.get(1).x(), 1e-4);
    }

    @Test
    void centerAlignment() {
        List<PlacedLine> placed = engine.place(rows(), Alignment.CENTER);
        assertEquals(50f, placed.get(0).x(), 1e-4);
        assertEquals(40f, placed.get(1).x(), 1e-4);
    }

    @Test
    void rightAlignment() {
        List<PlacedLine> placed = engine.place(rows(), Alignment.RIGHT);
        assertEquals(90f, placed.get(0).x(), 1e-4);
        assertEquals(70f, placed.get(1).x(), 1e-4);
        assertEquals(110f, placed.get(1).x() + placed.get(1).width(), 1e-4);
    }

    @Test
    void columnsRunRightToLeft() {
        LineBreak columns = new LineBreak(List.of(
                new Line("こんにち", 192, 24, false),
                new Line("は世界", 144, 24, false)), false, 0, "default");
        FitResult fit = new FitResult(40, columns, new Box(4, 4, 92, 202), Orientation.VERTICAL, false, Set.of());

        List<PlacedLine> placed = engine.place(fit, Alignment.CENTER);

        assertEquals(50f, placed.get(0).x(), 1e-4);
        assertEquals(26f, placed.get(1).x(), 1e-4);
        assertTrue(placed.get(0).x() > placed.get(1).x());
        assertEquals(9f, placed.get(0).y(), 1e-4);
        assertEquals(33f, placed.get(1).y(), 1e-4);
        assertEquals(24f, placed.get(0).width(), 1e-4);
        assertEquals(192f, placed.get(0).height(), 1e-4);
    }

    @Test
    void topAlignedColumnsStartAtTheTop() {
        LineBreak columns = new LineBreak(List.of(new Line("は世界", 144, 24, false)), false, 0, "default");
        FitResult fit = new FitResult(40, columns, new Box(4, 4, 92, 202), Orientation.VERTICAL, false, Set.of());

        assertEquals(4f, engine.place(fit, Alignment.LEFT).get(0).y(), 1e-4);
        assertEquals(62f, engine.place(fit, Alignment.RIGHT).get(0).y(), 1e-4);
    }

    @Test
    void overflowingBlockSpillsEvenly() {
        LineBreak tall = new LineBreak(List.of(
                new Line("a", 6, 40, false),
                new Line("b", 6, 40, false)), false, 0, "default");
        FitResult fit = new FitResult(8, tall, AVAILABLE, Orientation.HORIZONTAL, true, Set.of());

        List<PlacedLine> placed = engine.place(fit, Alignment.CENTER);
        assertEquals(5f, placed.get(0).y(), 1e-4);
        assertEquals(85f, placed.get(1).y() + placed.get(1).height(), 1e-4);
    }
}
