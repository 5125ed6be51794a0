package com.example.diffreview.infrastructure;

import com.example.diffreview.application.AgentSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Starts the agent command through {@code sh -c} in the repository and writes the review
 * comments to its standard input. The agent keeps running after the payload is handed over.
 */
@Component
public class ProcessAgentSink implements AgentSink {
    private static final Logger log = LogManager.getLogger(ProcessAgentSink.class);

    private final String defaultCommand;

    public ProcessAgentSink(@Value("${diff-review.agent.command:}") String defaultCommand) {
        this.defaultCommand = defaultCommand;
    }

    @Override
    public boolean deliver(Path repoRoot, String payload, String command) {
        String effective = command != null && !command.isBlank() ? command : defaultCommand;
        if (effective == null || effective.isBlank()) {
            log.warn("No agent command configured, review comments were not sent");
            return false;
        }

        ProcessBuilder builder =
                new ProcessBuilder("sh", "-c", effective)
                        .redirectOutput(ProcessBuilder.Redirect.INHERIT)
                        .redirectError(ProcessBuilder.Redirect.INHERIT);
        if (repoRoot != null) {
            builder.directory(repoRoot.toFile());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.warn("Could not start agent command '{}': {}", effective, e.getMessage());
            return false;
        }
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(payload.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Agent command '{}' did not accept the review comments: {}", effective, e.getMessage());
            process.destroy();
            return false;
        }
        log.info("Handed {} bytes of review comments to '{}'", payload.length(), effective);
        return true;
    }
}
