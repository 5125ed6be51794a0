package com.example.diffreview.application;

import com.example.diffreview.domain.DiffFile;
import com.example.diffreview.domain.DiffHunk;
import com.example.diffreview.domain.DiffLine;
import com.example.diffreview.domain.DisplayRow;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens the parsed model into display rows for a given wrap width. The projection is a pure
 * function of the files, their collapse flags and the width; callers rebuild it whenever any of
 * those change.
 */
@Component
public class DisplayRowProjector {
    private final LineSlicer slicer;

    public DisplayRowProjector(@Value("${diff-review.tab-width:4}") int tabWidth) {
        this.slicer = new LineSlicer(tabWidth);
    }

    public List<DisplayRow> project(List<DiffFile> files, int wrapWidth) {
        List<DisplayRow> rows = new ArrayList<>();
        for (DiffFile file : files) {
            rows.add(new DisplayRow.FileHeader(file));
            if (file.isCollapsed()) {
                continue;
            }
            for (DiffHunk hunk : file.getHunks()) {
                rows.add(new DisplayRow.HunkHeader(file, hunk));
                for (DiffLine line : hunk.lines()) {
                    for (LineSlicer.Slice slice : slicer.slice(line.getText(), wrapWidth)) {
                        rows.add(
                                new DisplayRow.DiffLineRow(
                                        file, hunk, line, slice.start(), slice.end()));
                    }
                }
            }
        }
        return List.copyOf(rows);
    }

    public List<DisplayRow> message(String text) {
        return List.of(new DisplayRow.Message(text));
    }
}
