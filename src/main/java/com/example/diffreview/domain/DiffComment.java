package com.example.diffreview.domain;

import lombok.Getter;
import lombok.Setter;

import java.util.Objects;

/**
 * A review comment attached to a diff line. {@code displayRowIndex} is recomputed after every
 * projection rebuild and is {@code null} while the keyed line is not visible. {@code anchorLine}
 * is the line of the loaded model the comment was last anchored to; neither is persisted.
 */
@Getter
@Setter
public class DiffComment {
    private final CommentKey key;
    private String text;
    private boolean sent;
    private Integer displayRowIndex;
    private DiffLine anchorLine;

    public DiffComment(CommentKey key, String text) {
        this.key = Objects.requireNonNull(key, "key");
        this.text = Objects.requireNonNull(text, "text");
    }

    public void markSent() {
        this.sent = true;
        this.displayRowIndex = null;
        this.anchorLine = null;
    }
}
