package com.example.diffreview.application;

import com.example.diffreview.domain.DiffFile;
import com.example.diffreview.domain.DiffHunk;
import com.example.diffreview.domain.DiffLine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Best-effort parser for git's unified diff output. Input comes from an external tool, so
 * anything it does not understand is skipped instead of reported.
 */
@Component
public class UnifiedDiffParser {
    private static final Logger log = LogManager.getLogger(UnifiedDiffParser.class);

    private static final byte[] FILE_PREFIX = ascii("diff --git ");
    private static final byte[] HUNK_PREFIX = ascii("@@");
    private static final List<byte[]> METADATA_PREFIXES =
            List.of(
                    ascii("index "),
                    ascii("--- "),
                    ascii("+++ "),
                    ascii("new file"),
                    ascii("deleted file"),
                    ascii("old mode"),
                    ascii("new mode"),
                    ascii("rename "),
                    ascii("copy "),
                    ascii("similarity "),
                    ascii("dissimilarity "));

    public List<DiffFile> parse(String raw) {
        return parse(raw.getBytes(StandardCharsets.UTF_8));
    }

    public List<DiffFile> parse(byte[] raw) {
        List<DiffFile> files = new ArrayList<>();
        FileBuilder file = null;
        HunkBuilder hunk = null;

        int pos = 0;
        while (pos < raw.length) {
            int newline = indexOf(raw, (byte) '\n', pos);
            int next = newline < 0 ? raw.length : newline + 1;
            int end = newline < 0 ? raw.length : newline;
            if (end > pos && raw[end - 1] == '\r') {
                end--;
            }
            int start = pos;
            pos = next;

            if (startsWith(raw, start, end, FILE_PREFIX)) {
                if (file != null) {
                    file.finishHunk(hunk);
                    files.add(file.build());
                }
                hunk = null;
                file = new FileBuilder(parsePath(decode(raw, start + FILE_PREFIX.length, end)));
                continue;
            }
            // a counted hunk still expecting lines owns "--- "/"+++ " lines such as a removed "-- note"
            boolean expectingHunkLine = hunk != null && hunk.isCounted();
            if (!expectingHunkLine && isMetadata(raw, start, end)) {
                continue;
            }
            if (startsWith(raw, start, end, HUNK_PREFIX)) {
                if (file == null) {
                    continue;
                }
                file.finishHunk(hunk);
                hunk = HunkBuilder.fromHeader(decode(raw, start, end));
                if (hunk.isExhausted()) {
                    file.finishHunk(hunk);
                    hunk = null;
                }
                continue;
            }
            if (hunk == null) {
                continue;
            }

            hunk.accept(raw, start, end);
            if (hunk.isExhausted()) {
                file.finishHunk(hunk);
                hunk = null;
            }
        }

        if (file != null) {
            file.finishHunk(hunk);
            files.add(file.build());
        }
        log.debug("Parsed {} files from {} bytes of diff output", files.size(), raw.length);
        return files;
    }

    static String parsePath(String remainder) {
        // "a/P b/P" is split down the middle so paths containing " b/" still resolve.
        int length = remainder.length();
        if (remainder.startsWith("a/") && length >= 5 && (length - 5) % 2 == 0) {
            int half = (length - 5) / 2;
            String left = remainder.substring(2, 2 + half);
            if (remainder.substring(2 + half).equals(" b/" + left)) {
                return left;
            }
        }
        int delimiter = remainder.lastIndexOf(" b/");
        if (delimiter >= 0) {
            return remainder.substring(delimiter + 3);
        }
        return remainder.trim();
    }

    private static boolean isMetadata(byte[] raw, int start, int end) {
        for (byte[] prefix : METADATA_PREFIXES) {
            if (startsWith(raw, start, end, prefix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean startsWith(byte[] raw, int start, int end, byte[] prefix) {
        if (end - start < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (raw[start + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static int indexOf(byte[] raw, byte value, int from) {
        for (int i = from; i < raw.length; i++) {
            if (raw[i] == value) {
                return i;
            }
        }
        return -1;
    }

    private static String decode(byte[] raw, int start, int end) {
        return new String(raw, start, end - start, StandardCharsets.UTF_8);
    }

    private static byte[] ascii(String value) {
        return value.getBytes(StandardCharsets.US_ASCII);
    }

    private static final class FileBuilder {
        private final String path;
        private final List<DiffHunk> hunks = new ArrayList<>();

        private FileBuilder(String path) {
            this.path = path;
        }

        private void finishHunk(HunkBuilder hunk) {
            if (hunk != null && !hunk.finished) {
                hunk.finished = true;
                hunks.add(hunk.build());
            }
        }

        private DiffFile build() {
            return new DiffFile(path, hunks);
        }
    }

    private static final class HunkBuilder {
        private static final int UNBOUNDED = -1;

        private final String header;
        private final int oldStart;
        private final int newStart;
        private final List<DiffLine> lines = new ArrayList<>();
        private int oldLine;
        private int newLine;
        private int oldRemaining;
        private int newRemaining;
        private boolean finished;

        private HunkBuilder(String header, int oldStart, int oldCount, int newStart, int newCount) {
            this.header = header;
            this.oldStart = oldStart;
            this.newStart = newStart;
            this.oldLine = oldStart;
            this.newLine = newStart;
            this.oldRemaining = oldCount;
            this.newRemaining = newCount;
        }

        static HunkBuilder fromHeader(String header) {
            int[] old = scanRange(header, '-', 2);
            int[] revised = old == null ? null : scanRange(header, '+', old[2]);
            if (old == null || revised == null) {
                return new HunkBuilder(
                        header,
                        old == null ? 0 : old[0],
                        UNBOUNDED,
                        revised == null ? 0 : revised[0],
                        UNBOUNDED);
            }
            return new HunkBuilder(header, old[0], old[1], revised[0], revised[1]);
        }

        /** Finds {@code <marker>start[,count]}; returns {start, count, indexAfter} or null. */
        private static int[] scanRange(String header, char marker, int from) {
            for (int i = Math.max(0, from); i < header.length() - 1; i++) {
                if (header.charAt(i) != marker || !Character.isDigit(header.charAt(i + 1))) {
                    continue;
                }
                int cursor = i + 1;
                int startEnd = skipDigits(header, cursor);
                Integer start = toInt(header.substring(cursor, startEnd));
                if (start == null) {
                    return null;
                }
                int count = 1;
                cursor = startEnd;
                if (cursor < header.length() - 1
                        && header.charAt(cursor) == ','
                        && Character.isDigit(header.charAt(cursor + 1))) {
                    int countEnd = skipDigits(header, cursor + 1);
                    Integer parsed = toInt(header.substring(cursor + 1, countEnd));
                    if (parsed == null) {
                        return null;
                    }
                    count = parsed;
                    cursor = countEnd;
                }
                return new int[] {start, count, cursor};
            }
            return null;
        }

        private static int skipDigits(String value, int from) {
            int i = from;
            while (i < value.length() && Character.isDigit(value.charAt(i))) {
                i++;
            }
            return i;
        }

        private static Integer toInt(String digits) {
            try {
                return Integer.parseInt(digits);
            } catch (NumberFormatException e) {
                return null;
            }
        }

        void accept(byte[] raw, int start, int end) {
            if (start == end) {
                addContext(new byte[0]);
                return;
            }
            byte prefix = raw[start];
            byte[] body = Arrays.copyOfRange(raw, start + 1, end);
            switch (prefix) {
                case '+' -> {
                    lines.add(DiffLine.add(body, newLine++));
                    newRemaining = decrement(newRemaining);
                }
                case '-' -> {
                    lines.add(DiffLine.remove(body, oldLine++));
                    oldRemaining = decrement(oldRemaining);
                }
                case '\\' -> {
                    // "\ No newline at end of file"
                }
                case ' ' -> addContext(body);
                default -> addContext(Arrays.copyOfRange(raw, start, end));
            }
        }

        private void addContext(byte[] text) {
            lines.add(DiffLine.context(text, oldLine++, newLine++));
            oldRemaining = decrement(oldRemaining);
            newRemaining = decrement(newRemaining);
        }

        private static int decrement(int remaining) {
            return remaining == UNBOUNDED ? UNBOUNDED : Math.max(0, remaining - 1);
        }

        boolean isCounted() {
            return oldRemaining != UNBOUNDED && newRemaining != UNBOUNDED;
        }

        boolean isExhausted() {
            return oldRemaining == 0 && newRemaining == 0;
        }

        DiffHunk build() {
            return new DiffHunk(header, oldStart, newStart, lines);
        }
    }
}
