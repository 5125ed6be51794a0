package com.example.diffreview.domain;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One line of a hunk, without its leading prefix character.
 *
 * <p>The text is kept as the raw bytes the diff tool produced, so tabs, control bytes and
 * invalid UTF-8 survive untouched. Which line numbers are present depends on the kind: added
 * lines carry only a new-side number, removed lines only an old-side number, context lines both.
 */
public final class DiffLine {
    private final DiffLineKind kind;
    private final byte[] text;
    private final Integer oldLineNumber;
    private final Integer newLineNumber;

    private DiffLine(DiffLineKind kind, byte[] text, Integer oldLineNumber, Integer newLineNumber) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text").clone();
        this.oldLineNumber = oldLineNumber;
        this.newLineNumber = newLineNumber;
    }

    public static DiffLine context(byte[] text, int oldLineNumber, int newLineNumber) {
        return new DiffLine(DiffLineKind.CONTEXT, text, oldLineNumber, newLineNumber);
    }

    public static DiffLine add(byte[] text, int newLineNumber) {
        return new DiffLine(DiffLineKind.ADD, text, null, newLineNumber);
    }

    public static DiffLine remove(byte[] text, int oldLineNumber) {
        return new DiffLine(DiffLineKind.REMOVE, text, oldLineNumber, null);
    }

    public DiffLineKind getKind() {
        return kind;
    }

    public Integer getOldLineNumber() {
        return oldLineNumber;
    }

    public Integer getNewLineNumber() {
        return newLineNumber;
    }

    /** Line number comments are keyed on: old side for removals, new side otherwise. */
    public int getAnchorLineNumber() {
        return kind == DiffLineKind.REMOVE ? oldLineNumber : newLineNumber;
    }

    public int length() {
        return text.length;
    }

    public byte[] getText() {
        return text.clone();
    }

    public byte[] slice(int from, int to) {
        return Arrays.copyOfRange(text, from, to);
    }

    public String textAsString() {
        return new String(text, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return kind + "(" + oldLineNumber + "," + newLineNumber + "): " + textAsString();
    }
}
