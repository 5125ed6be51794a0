package com.example.diffreview.web;

import com.example.diffreview.domain.DiffComment;
import com.example.diffreview.domain.DisplayRow;

/** JSON shape of a display row; fields that do not apply to the row kind are null. */
public record RowView(
        int index,
        DisplayRow.Kind kind,
        String path,
        Boolean collapsed,
        String header,
        String lineKind,
        Integer oldLine,
        Integer newLine,
        Integer byteOffset,
        String text,
        String comment) {

    static RowView of(int index, DisplayRow row, DiffComment comment) {
        String commentText = comment == null ? null : comment.getText();
        if (row instanceof DisplayRow.FileHeader fileHeader) {
            return new RowView(
                    index, row.kind(), fileHeader.file().getPath(), fileHeader.file().isCollapsed(),
                    null, null, null, null, null, null, commentText);
        }
        if (row instanceof DisplayRow.HunkHeader hunkHeader) {
            return new RowView(
                    index, row.kind(), hunkHeader.file().getPath(), null,
                    hunkHeader.hunk().header(), null, null, null, null, null, commentText);
        }
        if (row instanceof DisplayRow.DiffLineRow lineRow) {
            boolean continuation = lineRow.isContinuation();
            return new RowView(
                    index,
                    row.kind(),
                    lineRow.file().getPath(),
                    null,
                    null,
                    lineRow.line().getKind().name(),
                    continuation ? null : lineRow.line().getOldLineNumber(),
                    continuation ? null : lineRow.line().getNewLineNumber(),
                    lineRow.byteOffset(),
                    lineRow.text(),
                    commentText);
        }
        DisplayRow.Message message = (DisplayRow.Message) row;
        return new RowView(
                index, row.kind(), null, null, null, null, null, null, null, message.text(), null);
    }
}
