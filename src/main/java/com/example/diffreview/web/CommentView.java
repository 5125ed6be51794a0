package com.example.diffreview.web;

import com.example.diffreview.domain.DiffComment;

public record CommentView(int index, String file, int line, String text, boolean sent, Integer row) {

    static CommentView of(int index, DiffComment comment) {
        return new CommentView(
                index,
                comment.getKey().filePath(),
                comment.getKey().lineNumber(),
                comment.getText(),
                comment.isSent(),
                comment.getDisplayRowIndex());
    }
}
