package com.example.diffreview.infrastructure;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes git-style "new file" diffs for untracked files so they flow through the same parser as
 * the tracked changes.
 */
@Component
public class UntrackedFileSynthesizer {
    private static final Logger log = LogManager.getLogger(UntrackedFileSynthesizer.class);

    static final int BINARY_PROBE_BYTES = 8 * 1024;
    static final String BINARY_PLACEHOLDER = "[binary file]";

    private final long maxFileBytes;

    public UntrackedFileSynthesizer(
            @Value("${diff-review.untracked.max-file-bytes:1048576}") long maxFileBytes) {
        this.maxFileBytes = maxFileBytes;
    }

    public byte[] synthesize(Path repoRoot, List<String> relativePaths) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (String relativePath : relativePaths) {
            try {
                out.writeBytes(synthesizeFile(repoRoot, relativePath));
            } catch (IOException e) {
                log.warn("Skipping untracked file {}: {}", relativePath, e.getMessage());
            }
        }
        return out.toByteArray();
    }

    byte[] synthesizeFile(Path repoRoot, String relativePath) throws IOException {
        Path file = repoRoot.resolve(relativePath);
        if (!Files.isRegularFile(file)) {
            throw new IOException("not a regular file");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeLine(out, "diff --git a/" + relativePath + " b/" + relativePath);
        writeLine(out, "new file mode 100644");
        writeLine(out, "--- /dev/null");
        writeLine(out, "+++ b/" + relativePath);

        long size = Files.size(file);
        if (size > maxFileBytes) {
            writePlaceholder(out, "[file too large: " + size + " bytes]");
            return out.toByteArray();
        }
        byte[] content = Files.readAllBytes(file);
        if (isBinary(content)) {
            writePlaceholder(out, BINARY_PLACEHOLDER);
            return out.toByteArray();
        }
        if (content.length == 0) {
            return out.toByteArray();
        }

        boolean trailingNewline = content[content.length - 1] == '\n';
        int lineCount = 0;
        for (byte b : content) {
            if (b == '\n') {
                lineCount++;
            }
        }
        if (!trailingNewline) {
            lineCount++;
        }

        writeLine(out, "@@ -0,0 +1," + lineCount + " @@");
        int start = 0;
        for (int i = 0; i <= content.length; i++) {
            if (i == content.length || content[i] == '\n') {
                if (i == content.length && trailingNewline) {
                    break;
                }
                out.write('+');
                out.write(content, start, i - start);
                out.write('\n');
                start = i + 1;
            }
        }
        if (!trailingNewline) {
            writeLine(out, "\\ No newline at end of file");
        }
        return out.toByteArray();
    }

    static boolean isBinary(byte[] content) {
        int probe = Math.min(content.length, BINARY_PROBE_BYTES);
        for (int i = 0; i < probe; i++) {
            if (content[i] == 0) {
                return true;
            }
        }
        return false;
    }

    private static void writePlaceholder(ByteArrayOutputStream out, String text) {
        writeLine(out, "@@ -0,0 +1 @@");
        writeLine(out, "+" + text);
    }

    private static void writeLine(ByteArrayOutputStream out, String line) {
        out.writeBytes(line.getBytes(StandardCharsets.UTF_8));
        out.write('\n');
    }
}
