package com.example.diffreview.application;

import com.example.diffreview.domain.CommentKey;
import com.example.diffreview.domain.DiffComment;
import com.example.diffreview.domain.DiffLine;
import com.example.diffreview.domain.DisplayRow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Review comments of the currently loaded diff, anchored to display rows by their
 * {@link CommentKey}.
 *
 * <p>Row indices are only valid for the row list last passed to {@link #resolvePositions}; every
 * projection rebuild has to be followed by another call. Every mutation is written through to the
 * {@link CommentRepository}.
 */
public class CommentOverlay {
    private static final Logger log = LogManager.getLogger(CommentOverlay.class);

    private final CommentRepository repository;
    private final List<DiffComment> comments = new ArrayList<>();
    private Path repoRoot;

    public CommentOverlay(CommentRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
    }

    public void load(Path repoRoot) {
        this.repoRoot = repoRoot;
        comments.clear();
        comments.addAll(repository.load(repoRoot));
        log.info("Loaded {} review comments for {}", comments.size(), repoRoot);
    }

    public void clear() {
        comments.clear();
        repoRoot = null;
    }

    public List<DiffComment> comments() {
        return Collections.unmodifiableList(comments);
    }

    public List<DiffComment> pending() {
        return comments.stream().filter(comment -> !comment.isSent()).toList();
    }

    /**
     * Sets the text of the comment on the logical line shown by {@code targetRow}, creating the
     * comment if the line has none yet. Blank text removes an existing comment.
     *
     * @return the created or updated comment, empty when the text was blank
     */
    public Optional<DiffComment> addOrUpdate(List<DisplayRow> rows, int targetRow, String text) {
        Objects.checkIndex(targetRow, rows.size());
        if (!(rows.get(targetRow) instanceof DisplayRow.DiffLineRow)) {
            throw new IllegalArgumentException(
                    "Row " + targetRow + " is a " + rows.get(targetRow).kind() + ", not a diff line");
        }
        DisplayRow.DiffLineRow lineRow =
                (DisplayRow.DiffLineRow) rows.get(finalWrapRow(rows, targetRow));
        CommentKey key = lineRow.commentKey();
        Optional<DiffComment> existing = findPending(key);

        String value = text == null ? "" : text;
        if (value.isBlank()) {
            existing.ifPresent(
                    comment -> {
                        comments.remove(comment);
                        persist();
                    });
            return Optional.empty();
        }

        DiffComment comment =
                existing.orElseGet(
                        () -> {
                            DiffComment created = new DiffComment(key, value);
                            comments.add(created);
                            return created;
                        });
        comment.setText(value);
        comment.setAnchorLine(lineRow.line());
        resolvePositions(rows);
        persist();
        return Optional.of(comment);
    }

    public DiffComment remove(int index) {
        Objects.checkIndex(index, comments.size());
        DiffComment removed = comments.remove(index);
        persist();
        return removed;
    }

    /**
     * Anchors every unsent comment to the final wrap row of its line, or to {@code null} when that
     * line is not currently projected. A comment that has not been anchored within the loaded model
     * yet takes the first logical line matching its key.
     */
    public void resolvePositions(List<DisplayRow> rows) {
        for (DiffComment comment : comments) {
            comment.setDisplayRowIndex(comment.isSent() ? null : findAnchor(rows, comment));
        }
    }

    /** Freezes every held comment after delivery; sent comments are no longer stored. */
    public List<DiffComment> markSent() {
        List<DiffComment> delivered = pending();
        comments.forEach(DiffComment::markSent);
        persist();
        return delivered;
    }

    public Optional<DiffComment> commentAtRow(int rowIndex) {
        for (DiffComment comment : comments) {
            Integer anchor = comment.getDisplayRowIndex();
            if (!comment.isSent() && anchor != null && anchor == rowIndex) {
                return Optional.of(comment);
            }
        }
        return Optional.empty();
    }

    public void persist() {
        if (repoRoot == null) {
            log.debug("No repository loaded, skipping comment save");
            return;
        }
        repository.save(repoRoot, pending());
    }

    private Optional<DiffComment> findPending(CommentKey key) {
        return comments.stream()
                .filter(comment -> !comment.isSent() && comment.getKey().equals(key))
                .findFirst();
    }

    private static Integer findAnchor(List<DisplayRow> rows, DiffComment comment) {
        DiffLine anchorLine = comment.getAnchorLine();
        for (int i = 0; i < rows.size(); i++) {
            if (!(rows.get(i) instanceof DisplayRow.DiffLineRow row)) {
                continue;
            }
            boolean match =
                    anchorLine != null
                            ? row.line() == anchorLine
                            : comment.getKey().matches(row.file(), row.line());
            if (match) {
                comment.setAnchorLine(row.line());
                return finalWrapRow(rows, i);
            }
        }
        return null;
    }

    private static int finalWrapRow(List<DisplayRow> rows, int index) {
        DisplayRow.DiffLineRow first = (DisplayRow.DiffLineRow) rows.get(index);
        int last = index;
        while (last + 1 < rows.size()
                && rows.get(last + 1) instanceof DisplayRow.DiffLineRow next
                && first.isSameLine(next)
                && next.byteOffset() > ((DisplayRow.DiffLineRow) rows.get(last)).byteOffset()) {
            last++;
        }
        return last;
    }
}
