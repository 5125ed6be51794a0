package com.example.diffreview.domain;

import java.util.Objects;

/**
 * Positional identity of a comment. A line removed and re-added at another position gets a
 * different key, so its comment no longer anchors after a reload.
 */
public record CommentKey(String filePath, int lineNumber) {
    public CommentKey {
        Objects.requireNonNull(filePath, "filePath");
    }

    public static CommentKey of(DiffFile file, DiffLine line) {
        return new CommentKey(file.getPath(), line.getAnchorLineNumber());
    }

    public boolean matches(DiffFile file, DiffLine line) {
        return filePath.equals(file.getPath()) && lineNumber == line.getAnchorLineNumber();
    }

    @Override
    public String toString() {
        return filePath + ":" + lineNumber;
    }
}
