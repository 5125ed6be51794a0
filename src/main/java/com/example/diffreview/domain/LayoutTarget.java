package com.example.diffreview.domain;

/** What occupies a vertical pixel position of the diff content. */
public record LayoutTarget(Type type, int rowIndex) {
    private static final LayoutTarget NONE = new LayoutTarget(Type.NONE, -1);

    public enum Type {
        ROW,
        COMMENT,
        NONE
    }

    public static LayoutTarget row(int rowIndex) {
        return new LayoutTarget(Type.ROW, rowIndex);
    }

    public static LayoutTarget comment(int rowIndex) {
        return new LayoutTarget(Type.COMMENT, rowIndex);
    }

    public static LayoutTarget none() {
        return NONE;
    }

    public boolean isNone() {
        return type == Type.NONE;
    }
}
