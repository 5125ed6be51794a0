package com.example.diffreview.domain;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One renderable unit of the projected diff. Each variant carries only the fields that are
 * meaningful for it; {@link #kind()} lets consumers switch on the variant.
 */
public interface DisplayRow {

    Kind kind();

    enum Kind {
        FILE_HEADER,
        HUNK_HEADER,
        DIFF_LINE,
        MESSAGE
    }

    record FileHeader(DiffFile file) implements DisplayRow {
        public FileHeader {
            Objects.requireNonNull(file, "file");
        }

        @Override
        public Kind kind() {
            return Kind.FILE_HEADER;
        }
    }

    record HunkHeader(DiffFile file, DiffHunk hunk) implements DisplayRow {
        public HunkHeader {
            Objects.requireNonNull(file, "file");
            Objects.requireNonNull(hunk, "hunk");
        }

        @Override
        public Kind kind() {
            return Kind.HUNK_HEADER;
        }
    }

    /**
     * A slice {@code [byteOffset, byteEnd)} of a diff line. Rows of the same line with increasing
     * offsets are wrap continuations.
     */
    record DiffLineRow(DiffFile file, DiffHunk hunk, DiffLine line, int byteOffset, int byteEnd)
            implements DisplayRow {
        public DiffLineRow {
            Objects.requireNonNull(file, "file");
            Objects.requireNonNull(hunk, "hunk");
            Objects.requireNonNull(line, "line");
            if (byteOffset < 0 || byteEnd < byteOffset || byteEnd > line.length()) {
                throw new IllegalArgumentException(
                        "Invalid slice [" + byteOffset + ", " + byteEnd + ") of " + line.length() + " bytes");
            }
        }

        @Override
        public Kind kind() {
            return Kind.DIFF_LINE;
        }

        public byte[] bytes() {
            return line.slice(byteOffset, byteEnd);
        }

        public String text() {
            return new String(bytes(), StandardCharsets.UTF_8);
        }

        public boolean isContinuation() {
            return byteOffset > 0;
        }

        public boolean isSameLine(DiffLineRow other) {
            return other != null && other.file == file && other.hunk == hunk && other.line == line;
        }

        public CommentKey commentKey() {
            return CommentKey.of(file, line);
        }
    }

    record Message(String text) implements DisplayRow {
        public Message {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public Kind kind() {
            return Kind.MESSAGE;
        }
    }
}
