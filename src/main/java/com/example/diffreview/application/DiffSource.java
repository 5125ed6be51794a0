package com.example.diffreview.application;

import java.nio.file.Path;

/** Produces the complete unified diff of a working tree. */
public interface DiffSource {
    byte[] acquire(Path repoRoot) throws DiffAcquisitionException;
}
