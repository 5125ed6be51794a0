package com.example.diffreview.application;

import java.util.ArrayList;
import java.util.List;

/**
 * Measures and wraps raw line bytes in display columns.
 *
 * <p>A tab counts as a fixed number of columns, control bytes count as zero and every other
 * UTF-8 code point as one. Lines are cut greedily and only between code points; a single unit
 * wider than the wrap width gets a slice of its own.
 */
public final class LineSlicer {
    private final int tabWidth;

    public LineSlicer(int tabWidth) {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("Tab width must be positive: " + tabWidth);
        }
        this.tabWidth = tabWidth;
    }

    public int displayWidth(byte[] text) {
        return displayWidth(text, 0, text.length);
    }

    public int displayWidth(byte[] text, int from, int to) {
        int width = 0;
        int i = from;
        while (i < to) {
            int length = unitLength(text, i, to);
            width += unitWidth(text, i, length);
            i += length;
        }
        return width;
    }

    /**
     * Cuts {@code text} into slices of at most {@code width} columns. A width of zero or less
     * means unlimited. The result is never empty; an empty line yields one empty slice.
     */
    public List<Slice> slice(byte[] text, int width) {
        if (width <= 0 || displayWidth(text) <= width) {
            return List.of(new Slice(0, text.length));
        }
        List<Slice> slices = new ArrayList<>();
        int sliceStart = 0;
        int column = 0;
        int i = 0;
        while (i < text.length) {
            int length = unitLength(text, i, text.length);
            int unitWidth = unitWidth(text, i, length);
            if (column + unitWidth > width && i > sliceStart) {
                slices.add(new Slice(sliceStart, i));
                sliceStart = i;
                column = 0;
            }
            column += unitWidth;
            i += length;
        }
        slices.add(new Slice(sliceStart, text.length));
        return slices;
    }

    /** Byte offset of the last wrap row {@code text} produces at {@code width}. */
    public int finalSliceOffset(byte[] text, int width) {
        List<Slice> slices = slice(text, width);
        return slices.get(slices.size() - 1).start();
    }

    /** Length of the code point starting at {@code index}, never reaching past {@code end}. */
    static int unitLength(byte[] text, int index, int end) {
        int lead = text[index] & 0xFF;
        int expected;
        if (lead >= 0xF0 && lead < 0xF8) {
            expected = 4;
        } else if (lead >= 0xE0 && lead < 0xF0) {
            expected = 3;
        } else if (lead >= 0xC0 && lead < 0xE0) {
            expected = 2;
        } else {
            expected = 1;
        }
        int length = 1;
        while (length < expected && index + length < end && isContinuation(text[index + length])) {
            length++;
        }
        return length;
    }

    private int unitWidth(byte[] text, int index, int length) {
        int lead = text[index] & 0xFF;
        if (length == 1) {
            if (lead == '\t') {
                return tabWidth;
            }
            if (lead < 0x20 || lead >= 0x7F) {
                // ASCII controls, DEL and stray bytes of broken sequences
                return 0;
            }
            return 1;
        }
        if (length == 2 && lead == 0xC2 && (text[index + 1] & 0xFF) < 0xA0) {
            // C1 controls U+0080..U+009F
            return 0;
        }
        return 1;
    }

    private static boolean isContinuation(byte value) {
        return (value & 0xC0) == 0x80;
    }

    /** Half-open byte range {@code [start, end)} of a line. */
    public record Slice(int start, int end) {}
}
