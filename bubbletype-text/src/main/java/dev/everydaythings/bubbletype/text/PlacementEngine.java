package dev.everydaythings.bubbletype.text;

import dev.everydaythings.bubbletype.Alignment;
import dev.everydaythings.bubbletype.Box;
import dev.everydaythings.bubbletype.Orientation;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps solved lines to page coordinates inside the padded box.
 *
 * <p>Horizontal text: each line is aligned left, centered or right within the box
 * width, and the block of lines is always centered top-to-bottom. Vertical text:
 * columns run right-to-left, the block of columns is centered left-to-right, and each
 * column is aligned top, centered or bottom within the box height.
 *
 * <p>Overflowing blocks are still centered, so they spill evenly past both edges.
 */
public class PlacementEngine {

    public List<PlacedLine> place(FitResult fit, Alignment alignment) {
        List<Line> lines = fit.lineBreak().lines();
        if (lines.isEmpty()) {
            return List.of();
        }
        return fit.orientation() == Orientation.HORIZONTAL
                ? placeRows(lines, fit.available(), fit.blockExtent(), fit.lineBreak().lineGap(), alignment)
                : placeColumns(lines, fit.available(), fit.blockExtent(), fit.lineBreak().lineGap(), alignment);
    }

    private static List<PlacedLine> placeRows(List<Line> lines, Box box, float blockHeight, float gap,
                                              Alignment alignment) {
        List<PlacedLine> placed = new ArrayList<>(lines.size());
        float y = box.y() + (box.h() - blockHeight) / 2f;
        for (Line line : lines) {
            float x = box.x() + offset(box.w(), line.advance(), alignment);
            placed.add(new PlacedLine(line, x, y, line.advance(), line.thickness()));
            y += line.thickness() + gap;
        }
        return placed;
    }

    private static List<PlacedLine> placeColumns(List<Line> lines, Box box, float blockWidth, float gap,
                                                 Alignment alignment) {
        List<PlacedLine> placed = new ArrayList<>(lines.size());
        float right = box.x() + (box.w() + blockWidth) / 2f;
        for (Line column : lines) {
            float x = right - column.thickness();
            float y = box.y() + offset(box.h(), column.advance(), alignment);
            placed.add(new PlacedLine(column, x, y, column.thickness(), column.advance()));
            right = x - gap;
        }
        return placed;
    }

    private static float offset(int available, float extent, Alignment alignment) {
        switch (alignment) {
            case LEFT:
                return 0;
            case RIGHT:
                return available - extent;
            case CENTER:
            default:
                return (available - extent) / 2f;
        }
    }
}
