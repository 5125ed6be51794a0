package com.example.diffreview.application;

import java.nio.file.Path;

public interface AgentSink {
    /**
     * Hands formatted review comments to an agent process.
     *
     * @param command agent command to run, or {@code null} for the configured default
     * @return whether the payload was delivered
     */
    boolean deliver(Path repoRoot, String payload, String command);
}
