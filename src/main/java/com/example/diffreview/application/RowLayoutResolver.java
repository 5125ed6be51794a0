package com.example.diffreview.application;

import com.example.diffreview.domain.LayoutTarget;

import java.util.function.IntToDoubleFunction;

/**
 * Maps between vertical pixel positions and rows when every row is followed by an optional
 * comment box of variable height. All positions are relative to the top of the content.
 *
 * <p>Each lookup walks the rows from the top. It runs once per pointer or scroll event, not per
 * frame.
 */
public final class RowLayoutResolver {

    private RowLayoutResolver() {}

    public static LayoutTarget hitTest(
            double y, int rowCount, double rowHeight, IntToDoubleFunction commentHeight) {
        if (y < 0) {
            return LayoutTarget.none();
        }
        double top = 0;
        for (int row = 0; row < rowCount; row++) {
            double rowBottom = top + rowHeight;
            if (y < rowBottom) {
                return LayoutTarget.row(row);
            }
            double boxBottom = rowBottom + Math.max(0, commentHeight.applyAsDouble(row));
            if (y < boxBottom) {
                return LayoutTarget.comment(row);
            }
            top = boxBottom;
        }
        return LayoutTarget.none();
    }

    /** Pixel Y of the top of {@code rowIndex}; {@code rowIndex == rowCount} gives the total height. */
    public static double rowTop(int rowIndex, double rowHeight, IntToDoubleFunction commentHeight) {
        if (rowIndex < 0) {
            throw new IndexOutOfBoundsException("Negative row index " + rowIndex);
        }
        double top = 0;
        for (int row = 0; row < rowIndex; row++) {
            top += rowHeight + Math.max(0, commentHeight.applyAsDouble(row));
        }
        return top;
    }

    /** Pixel Y of the top of the comment box below {@code rowIndex}. */
    public static double commentTop(int rowIndex, double rowHeight, IntToDoubleFunction commentHeight) {
        return rowTop(rowIndex, rowHeight, commentHeight) + rowHeight;
    }

    public static double contentHeight(int rowCount, double rowHeight, IntToDoubleFunction commentHeight) {
        return rowTop(rowCount, rowHeight, commentHeight);
    }
}
