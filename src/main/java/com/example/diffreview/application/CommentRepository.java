package com.example.diffreview.application;

import com.example.diffreview.domain.DiffComment;

import java.nio.file.Path;
import java.util.List;

/**
 * Stores the unsent review comments of a repository. Implementations recover from I/O problems
 * themselves: a failed load yields an empty list and a failed save leaves the caller's state
 * untouched.
 */
public interface CommentRepository {
    List<DiffComment> load(Path repoRoot);

    void save(Path repoRoot, List<DiffComment> comments);
}
