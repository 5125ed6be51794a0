package com.example.diffreview.application;

import com.example.diffreview.domain.DiffFile;
import com.example.diffreview.domain.DisplayRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DisplayRowProjectorTest {

    private static final String TWO_FILES =
            "diff --git a/x.txt b/x.txt\n"
                    + "@@ -1,2 +1,3 @@\n"
                    + " context\n"
                    + "-old\n"
                    + "+new\n"
                    + "+added\n"
                    + "diff --git a/y.txt b/y.txt\n"
                    + "@@ -1 +1 @@\n"
                    + "-abcdefgh\n"
                    + "+abcdefghijklmnop\n"
                    + "@@ -9 +9 @@\n"
                    + " tail\n";

    private final UnifiedDiffParser parser = new UnifiedDiffParser();
    private final DisplayRowProjector projector = new DisplayRowProjector(4);

    @Test
    void emitsHeadersThenOneRowPerUnwrappedLine() {
        List<DisplayRow> rows = projector.project(parser.parse(TWO_FILES), 0);

        assertThat(rows)
                .extracting(DisplayRow::kind)
                .containsExactly(
                        DisplayRow.Kind.FILE_HEADER,
                        DisplayRow.Kind.HUNK_HEADER,
                        DisplayRow.Kind.DIFF_LINE,
                        DisplayRow.Kind.DIFF_LINE,
                        DisplayRow.Kind.DIFF_LINE,
                        DisplayRow.Kind.DIFF_LINE,
                        DisplayRow.Kind.FILE_HEADER,
                        DisplayRow.Kind.HUNK_HEADER,
                        DisplayRow.Kind.DIFF_LINE,
                        DisplayRow.Kind.DIFF_LINE,
                        DisplayRow.Kind.HUNK_HEADER,
                        DisplayRow.Kind.DIFF_LINE);
        assertThat(rows.stream().filter(row -> row instanceof DisplayRow.DiffLineRow))
                .allMatch(row -> ((DisplayRow.DiffLineRow) row).byteOffset() == 0);
    }

    @Test
    void wrapsLongLinesIntoContinuationRows() {
        List<DiffFile> files =
                parser.parse("diff --git a/w b/w\n@@ -0,0 +1 @@\n+abcdefgh\n");

        List<DisplayRow> rows = projector.project(files, 5);

        assertThat(rows).hasSize(4);
        DisplayRow.DiffLineRow first = (DisplayRow.DiffLineRow) rows.get(2);
        DisplayRow.DiffLineRow second = (DisplayRow.DiffLineRow) rows.get(3);
        assertThat(first.byteOffset()).isZero();
        assertThat(first.text()).isEqualTo("abcde");
        assertThat(second.byteOffset()).isEqualTo(5);
        assertThat(second.text()).isEqualTo("fgh");
        assertThat(second.isContinuation()).isTrue();
        assertThat(first.isSameLine(second)).isTrue();
    }

    @Test
    void collapsingKeepsOnlyTheFileHeaderAndExpandingRestoresRows() {
        List<DiffFile> files = parser.parse(TWO_FILES);
        int expanded = projector.project(files, 6).size();

        files.get(1).setCollapsed(true);
        List<DisplayRow> collapsed = projector.project(files, 6);

        assertThat(collapsed.stream().filter(row -> rowBelongsTo(row, files.get(1)))).hasSize(1);
        assertThat(collapsed.stream().filter(row -> row instanceof DisplayRow.FileHeader header
                        && header.file() == files.get(1)))
                .hasSize(1);

        files.get(1).setCollapsed(false);
        assertThat(projector.project(files, 6)).hasSize(expanded);
    }

    @Test
    void projectingTwiceYieldsEqualRows() {
        List<DiffFile> files = parser.parse(TWO_FILES);
        files.get(0).setCollapsed(true);

        assertThat(projector.project(files, 3)).isEqualTo(projector.project(files, 3));
    }

    @Test
    void messageProjectionIsSingleRow() {
        assertThat(projector.message("No changes"))
                .containsExactly(new DisplayRow.Message("No changes"));
    }

    private static boolean rowBelongsTo(DisplayRow row, DiffFile file) {
        if (row instanceof DisplayRow.FileHeader header) {
            return header.file() == file;
        }
        if (row instanceof DisplayRow.HunkHeader header) {
            return header.file() == file;
        }
        return row instanceof DisplayRow.DiffLineRow line && line.file() == file;
    }
}
