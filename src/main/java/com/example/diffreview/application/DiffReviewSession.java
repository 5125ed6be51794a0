package com.example.diffreview.application;

import com.example.diffreview.domain.DiffComment;
import com.example.diffreview.domain.DiffFile;
import com.example.diffreview.domain.DisplayRow;
import com.example.diffreview.domain.LayoutTarget;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The diff review overlay: owns the parsed model, its current projection and the comments laid
 * over it.
 *
 * <p>Not thread-safe. Every structural change goes through {@link #rebuild()}, which projects the
 * rows and then re-anchors the comments, so nothing ever reads a row index from a stale
 * projection.
 */
@Service
public class DiffReviewSession {
    private static final Logger log = LogManager.getLogger(DiffReviewSession.class);

    static final String NO_CHANGES_MESSAGE = "No changes in working tree";
    private static final int COMMENT_CONTROL_ROWS = 1;

    private final DiffSource diffSource;
    private final UnifiedDiffParser parser;
    private final DisplayRowProjector projector;
    private final CommentOverlay comments;
    private final AgentSink agentSink;

    private Path repoRoot;
    private boolean visible;
    private List<DiffFile> files = List.of();
    private String message;
    private int wrapWidth;
    private List<DisplayRow> rows = List.of();

    public DiffReviewSession(
            DiffSource diffSource,
            UnifiedDiffParser parser,
            DisplayRowProjector projector,
            CommentRepository commentRepository,
            AgentSink agentSink) {
        this.diffSource = diffSource;
        this.parser = parser;
        this.projector = projector;
        this.comments = new CommentOverlay(commentRepository);
        this.agentSink = agentSink;
    }

    private static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }

    public void show(Path repoRoot) {
        Objects.requireNonNull(repoRoot, "repoRoot");
        visible = true;
        load(repoRoot);
    }

    public void hide() {
        if (!visible) {
            return;
        }
        comments.persist();
        visible = false;
        files = List.of();
        message = null;
        rows = List.of();
        comments.clear();
    }

    public void toggle(Path repoRoot) {
        if (visible) {
            hide();
        } else {
            show(repoRoot);
        }
    }

    public void reload() {
        if (repoRoot == null) {
            throw new IllegalStateException("No repository has been shown yet");
        }
        load(repoRoot);
    }

    private void load(Path root) {
        this.repoRoot = root;
        this.files = List.of();
        this.message = null;

        long start = System.nanoTime();
        try {
            byte[] raw = diffSource.acquire(root);
            files = parser.parse(raw);
            if (files.isEmpty()) {
                message = NO_CHANGES_MESSAGE;
            }
            log.info(
                    "Loaded diff of {} ({} files) in {}s",
                    root,
                    files.size(),
                    nanosToSeconds(System.nanoTime() - start));
        } catch (DiffAcquisitionException e) {
            log.warn("Could not load diff of {}: {}", root, e.getMessage());
            message = e.getMessage();
        }

        comments.load(root);
        rebuild();
    }

    private void rebuild() {
        rows = message != null ? projector.message(message) : projector.project(files, wrapWidth);
        comments.resolvePositions(rows);
    }

    public void setWrapWidth(int columns) {
        if (columns < 0) {
            throw new IllegalArgumentException("Wrap width must not be negative: " + columns);
        }
        if (columns == wrapWidth) {
            return;
        }
        wrapWidth = columns;
        rebuild();
    }

    public void toggleCollapsed(int fileIndex) {
        Objects.checkIndex(fileIndex, files.size());
        files.get(fileIndex).toggleCollapsed();
        rebuild();
    }

    public Optional<DiffComment> addOrUpdateComment(int rowIndex, String text) {
        return comments.addOrUpdate(rows, rowIndex, text);
    }

    public DiffComment removeComment(int index) {
        return comments.remove(index);
    }

    public Optional<DiffComment> commentAtRow(int rowIndex) {
        return comments.commentAtRow(rowIndex);
    }

    /** Height of the comment box under {@code rowIndex}: its text lines plus the button row. */
    public double commentHeight(int rowIndex, double rowHeight) {
        return commentAtRow(rowIndex)
                .map(comment -> (comment.getText().split("\n", -1).length + COMMENT_CONTROL_ROWS) * rowHeight)
                .orElse(0.0);
    }

    public LayoutTarget hitTest(double y, double rowHeight) {
        return RowLayoutResolver.hitTest(y, rows.size(), rowHeight, row -> commentHeight(row, rowHeight));
    }

    public double rowTop(int rowIndex, double rowHeight) {
        Objects.checkIndex(rowIndex, rows.size() + 1);
        return RowLayoutResolver.rowTop(rowIndex, rowHeight, row -> commentHeight(row, rowHeight));
    }

    /** Top of the comment box under {@code rowIndex}, where its text and controls are laid out. */
    public double commentTop(int rowIndex, double rowHeight) {
        Objects.checkIndex(rowIndex, rows.size());
        return RowLayoutResolver.commentTop(rowIndex, rowHeight, row -> commentHeight(row, rowHeight));
    }

    public double contentHeight(double rowHeight) {
        return RowLayoutResolver.contentHeight(rows.size(), rowHeight, row -> commentHeight(row, rowHeight));
    }

    /**
     * Delivers all unsent comments to the agent and freezes them.
     *
     * @return number of comments sent, zero when there was nothing to send or delivery failed
     */
    public int sendComments(String command) {
        List<DiffComment> pending = comments.pending();
        if (pending.isEmpty()) {
            return 0;
        }
        String payload = ReviewPromptFormatter.format(pending);
        if (!agentSink.deliver(repoRoot, payload, command)) {
            log.warn("Review comments were not delivered, keeping {} unsent", pending.size());
            return 0;
        }
        comments.markSent();
        log.info("Sent {} review comments", pending.size());
        return pending.size();
    }

    public boolean isVisible() {
        return visible;
    }

    public Path getRepoRoot() {
        return repoRoot;
    }

    public List<DiffFile> files() {
        return files;
    }

    public List<DisplayRow> rows() {
        return rows;
    }

    public List<DiffComment> comments() {
        return comments.comments();
    }
}
