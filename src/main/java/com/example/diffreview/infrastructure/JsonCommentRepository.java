package com.example.diffreview.infrastructure;

import com.example.diffreview.application.CommentRepository;
import com.example.diffreview.domain.CommentKey;
import com.example.diffreview.domain.DiffComment;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Keeps review comments in {@code <repoRoot>/.architect/diff_comments.json} as an array of
 * {@code {"file", "line", "text"}} objects. Writes replace the whole file.
 */
@Component
public class JsonCommentRepository implements CommentRepository {
    private static final Logger log = LogManager.getLogger(JsonCommentRepository.class);

    static final String FILE_NAME = "diff_comments.json";

    private final ObjectMapper objectMapper;
    private final String directoryName;

    public JsonCommentRepository(
            ObjectMapper objectMapper,
            @Value("${diff-review.comments.dir:.architect}") String directoryName) {
        this.objectMapper = objectMapper;
        this.directoryName = directoryName;
    }

    public Path commentsFile(Path repoRoot) {
        return repoRoot.resolve(directoryName).resolve(FILE_NAME);
    }

    @Override
    public List<DiffComment> load(Path repoRoot) {
        Path file = commentsFile(repoRoot);
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            log.warn("Ignoring unreadable comment file {}: {}", file, e.getMessage());
            return List.of();
        }
        if (root == null || !root.isArray()) {
            log.warn("Ignoring comment file {}: expected a JSON array", file);
            return List.of();
        }

        List<DiffComment> comments = new ArrayList<>();
        for (JsonNode element : root) {
            Optional<DiffComment> comment = toComment(element);
            if (comment.isPresent()) {
                comments.add(comment.get());
            } else {
                log.debug("Skipping malformed comment entry {}", element);
            }
        }
        return comments;
    }

    @Override
    public void save(Path repoRoot, List<DiffComment> comments) {
        Path file = commentsFile(repoRoot);
        List<StoredComment> stored =
                comments.stream()
                        .filter(comment -> !comment.isSent())
                        .map(
                                comment ->
                                        new StoredComment(
                                                comment.getKey().filePath(),
                                                comment.getKey().lineNumber(),
                                                comment.getText()))
                        .toList();
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), stored);
        } catch (IOException e) {
            log.warn("Failed to save review comments to {}: {}", file, e.getMessage());
        }
    }

    private static Optional<DiffComment> toComment(JsonNode element) {
        if (element == null || !element.isObject()) {
            return Optional.empty();
        }
        JsonNode file = element.get("file");
        JsonNode line = element.get("line");
        JsonNode text = element.get("text");
        if (file == null || !file.isTextual()
                || line == null || !line.isIntegralNumber() || !line.canConvertToInt()
                || text == null || !text.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(new DiffComment(new CommentKey(file.asText(), line.intValue()), text.asText()));
    }

    record StoredComment(String file, int line, String text) {}
}
