package com.example.diffreview.web;

import com.example.diffreview.application.DiffReviewSession;
import com.example.diffreview.domain.DiffComment;
import com.example.diffreview.domain.DisplayRow;
import com.example.diffreview.domain.LayoutTarget;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * JSON endpoints driving the review session. The session is single-owner state, so every request
 * runs while holding its monitor.
 */
@RestController
@RequestMapping("/review")
public class DiffReviewController {
    private final DiffReviewSession session;

    public DiffReviewController(DiffReviewSession session) {
        this.session = session;
    }

    @PostMapping("/show")
    public List<RowView> show(@RequestParam("repo") String repo) {
        Path repoRoot = toPath(repo);
        return withSession(
                () -> {
                    session.show(repoRoot);
                    return rows();
                });
    }

    @PostMapping("/hide")
    public Map<String, Boolean> hide() {
        return withSession(
                () -> {
                    session.hide();
                    return Map.of("visible", session.isVisible());
                });
    }

    @GetMapping("/rows")
    public List<RowView> listRows() {
        return withSession(this::rows);
    }

    @PutMapping("/wrap")
    public List<RowView> wrap(@RequestParam("width") int width) {
        return withSession(
                () -> {
                    session.setWrapWidth(width);
                    return rows();
                });
    }

    @PostMapping("/files/{index}/toggle")
    public List<RowView> toggleFile(@PathVariable("index") int index) {
        return withSession(
                () -> {
                    session.toggleCollapsed(index);
                    return rows();
                });
    }

    @GetMapping("/comments")
    public List<CommentView> listComments() {
        return withSession(this::comments);
    }

    @PostMapping("/comments")
    public List<CommentView> saveComment(@RequestBody CommentRequest request) {
        return withSession(
                () -> {
                    session.addOrUpdateComment(request.row(), request.text());
                    return comments();
                });
    }

    @DeleteMapping("/comments/{index}")
    public List<CommentView> deleteComment(@PathVariable("index") int index) {
        return withSession(
                () -> {
                    session.removeComment(index);
                    return comments();
                });
    }

    @GetMapping("/hit")
    public LayoutTarget hit(
            @RequestParam("y") double y,
            @RequestParam(name = "rowHeight", defaultValue = "22") double rowHeight) {
        return withSession(() -> session.hitTest(y, rowHeight));
    }

    @PostMapping("/send")
    public Map<String, Integer> send(@RequestBody(required = false) SendRequest request) {
        String command = request == null ? null : request.command();
        return withSession(() -> Map.of("sent", session.sendComments(command)));
    }

    private List<RowView> rows() {
        List<DisplayRow> rows = session.rows();
        List<RowView> views = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            DiffComment comment = session.commentAtRow(i).orElse(null);
            views.add(RowView.of(i, rows.get(i), comment));
        }
        return views;
    }

    private List<CommentView> comments() {
        List<DiffComment> comments = session.comments();
        List<CommentView> views = new ArrayList<>(comments.size());
        for (int i = 0; i < comments.size(); i++) {
            views.add(CommentView.of(i, comments.get(i)));
        }
        return views;
    }

    private <T> T withSession(Supplier<T> action) {
        synchronized (session) {
            try {
                return action.get();
            } catch (IllegalArgumentException | IllegalStateException | IndexOutOfBoundsException ex) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
            }
        }
    }

    private static Path toPath(String repo) {
        if (repo == null || repo.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Repository path is required");
        }
        try {
            return Path.of(repo.trim()).toAbsolutePath().normalize();
        } catch (InvalidPathException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid repository path", ex);
        }
    }
}
