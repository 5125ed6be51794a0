package com.example.diffreview.domain;

import java.util.List;
import java.util.Objects;

public record DiffHunk(String header, int oldStart, int newStart, List<DiffLine> lines) {
    public DiffHunk {
        Objects.requireNonNull(header, "header");
        lines = List.copyOf(lines);
    }
}
