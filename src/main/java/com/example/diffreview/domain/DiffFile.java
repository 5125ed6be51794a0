package com.example.diffreview.domain;

import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * A file section of a diff. The collapsed flag is the only mutable state of the model; the rest
 * is replaced wholesale on every reload.
 */
@Getter
public class DiffFile {
    private final String path;
    private final List<DiffHunk> hunks;
    @Setter private boolean collapsed;

    public DiffFile(String path, List<DiffHunk> hunks) {
        this.path = path;
        this.hunks = List.copyOf(hunks);
    }

    public void toggleCollapsed() {
        collapsed = !collapsed;
    }
}
