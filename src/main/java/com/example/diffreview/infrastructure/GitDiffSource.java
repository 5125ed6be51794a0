package com.example.diffreview.infrastructure;

import com.example.diffreview.application.DiffAcquisitionException;
import com.example.diffreview.application.DiffSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects unstaged changes, staged changes and untracked files of a git working tree into one
 * unified diff. The whole acquisition shares one byte ceiling; crossing it fails the load instead
 * of returning a truncated diff.
 */
@Component
public class GitDiffSource implements DiffSource {
    private static final Logger log = LogManager.getLogger(GitDiffSource.class);

    private static final List<String> UNSTAGED_DIFF =
            List.of("diff", "--no-ext-diff", "--unified=3", "--no-color");
    private static final List<String> STAGED_DIFF =
            List.of("diff", "--staged", "--no-ext-diff", "--unified=3", "--no-color");
    private static final List<String> UNTRACKED_FILES =
            List.of("ls-files", "--others", "--exclude-standard", "-z");

    private final String gitExecutable;
    private final long maxDiffBytes;
    private final UntrackedFileSynthesizer untrackedFileSynthesizer;

    public GitDiffSource(
            @Value("${diff-review.git.executable:git}") String gitExecutable,
            @Value("${diff-review.max-diff-bytes:10485760}") long maxDiffBytes,
            UntrackedFileSynthesizer untrackedFileSynthesizer) {
        this.gitExecutable = gitExecutable;
        this.maxDiffBytes = maxDiffBytes;
        this.untrackedFileSynthesizer = untrackedFileSynthesizer;
    }

    @Override
    public byte[] acquire(Path repoRoot) throws DiffAcquisitionException {
        ByteArrayOutputStream combined = new ByteArrayOutputStream();

        append(combined, runGit(repoRoot, UNSTAGED_DIFF, remaining(combined)));
        append(combined, runGit(repoRoot, STAGED_DIFF, remaining(combined)));

        List<String> untracked = splitPaths(runGit(repoRoot, UNTRACKED_FILES, maxDiffBytes));
        if (!untracked.isEmpty()) {
            log.debug("Synthesizing diffs for {} untracked files", untracked.size());
            append(combined, untrackedFileSynthesizer.synthesize(repoRoot, untracked));
        }
        return combined.toByteArray();
    }

    private void append(ByteArrayOutputStream combined, byte[] chunk)
            throws DiffAcquisitionException {
        if (chunk.length == 0) {
            return;
        }
        if (combined.size() > 0) {
            combined.write('\n');
        }
        if (combined.size() + (long) chunk.length > maxDiffBytes) {
            throw tooLarge();
        }
        combined.writeBytes(chunk);
    }

    private long remaining(ByteArrayOutputStream combined) {
        return Math.max(0, maxDiffBytes - combined.size());
    }

    /**
     * Runs git in {@code repoRoot} and returns its standard output.
     *
     * @param limit largest output accepted before the run is aborted
     */
    protected byte[] runGit(Path repoRoot, List<String> arguments, long limit)
            throws DiffAcquisitionException {
        List<String> command = new ArrayList<>();
        command.add(gitExecutable);
        command.add("-C");
        command.add(repoRoot.toString());
        command.addAll(arguments);

        Process process;
        try {
            process =
                    new ProcessBuilder(command)
                            .redirectError(ProcessBuilder.Redirect.DISCARD)
                            .start();
        } catch (IOException e) {
            throw new DiffAcquisitionException("Could not run " + gitExecutable + ": " + e.getMessage(), e);
        }

        try {
            byte[] output;
            try (InputStream stdout = process.getInputStream()) {
                output = readBounded(stdout, limit);
            }
            if (output == null) {
                process.destroyForcibly();
                throw tooLarge();
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new DiffAcquisitionException(
                        "No git diff available (git " + arguments.get(0) + " exited with " + exitCode + ")");
            }
            return output;
        } catch (IOException e) {
            process.destroyForcibly();
            throw new DiffAcquisitionException("Failed to read git output: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new DiffAcquisitionException("Interrupted while running git", e);
        }
    }

    /** Reads the whole stream, or returns {@code null} once it grows past {@code limit} bytes. */
    static byte[] readBounded(InputStream in, long limit) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        int read;
        while ((read = in.read(buffer)) != -1) {
            if (out.size() + (long) read > limit) {
                return null;
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }

    static List<String> splitPaths(byte[] nulSeparated) {
        List<String> paths = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= nulSeparated.length; i++) {
            if (i == nulSeparated.length || nulSeparated[i] == 0) {
                if (i > start) {
                    paths.add(new String(nulSeparated, start, i - start, StandardCharsets.UTF_8));
                }
                start = i + 1;
            }
        }
        return paths;
    }

    private DiffAcquisitionException tooLarge() {
        return new DiffAcquisitionException("Diff is too large to display (over " + maxDiffBytes + " bytes)");
    }
}
