package com.example.diffreview.application;

import com.example.diffreview.domain.DiffComment;

import java.util.List;
import java.util.stream.Collectors;

public final class ReviewPromptFormatter {

    private ReviewPromptFormatter() {}

    /** {@code <file>:<line>: <text>} blocks separated by a blank line, with a trailing newline. */
    public static String format(List<DiffComment> comments) {
        if (comments.isEmpty()) {
            return "";
        }
        return comments.stream()
                        .map(
                                comment ->
                                        String.format(
                                                "%s:%d: %s",
                                                comment.getKey().filePath(),
                                                comment.getKey().lineNumber(),
                                                comment.getText()))
                        .collect(Collectors.joining("\n\n"))
                + "\n";
    }
}
