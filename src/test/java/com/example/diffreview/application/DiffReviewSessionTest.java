package com.example.diffreview.application;

import com.example.diffreview.domain.CommentKey;
import com.example.diffreview.domain.DiffComment;
import com.example.diffreview.domain.DisplayRow;
import com.example.diffreview.domain.LayoutTarget;
import com.example.diffreview.infrastructure.JsonCommentRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiffReviewSessionTest {

    private static final Path REPO = Path.of("/work/repo");
    private static final byte[] EXAMPLE =
            ("diff --git a/x.txt b/x.txt\n"
                            + "@@ -1,2 +1,3 @@\n"
                            + " context\n"
                            + "-old\n"
                            + "+new\n"
                            + "+added\n"
                            + "diff --git a/long.txt b/long.txt\n"
                            + "@@ -0,0 +1 @@\n"
                            + "+0123456789abcdef\n")
                    .getBytes(StandardCharsets.UTF_8);

    @Mock private DiffSource diffSource;
    @Mock private CommentRepository repository;
    @Mock private AgentSink agentSink;

    private DiffReviewSession session;

    @BeforeEach
    void setUp() {
        session =
                new DiffReviewSession(
                        diffSource, new UnifiedDiffParser(), new DisplayRowProjector(4), repository, agentSink);
    }

    @Test
    void showLoadsAndProjectsWorkingTreeDiff() throws Exception {
        when(diffSource.acquire(REPO)).thenReturn(EXAMPLE);

        session.show(REPO);

        assertThat(session.isVisible()).isTrue();
        assertThat(session.getRepoRoot()).isEqualTo(REPO);
        assertThat(session.files()).hasSize(2);
        assertThat(session.rows()).hasSize(9);
        verify(repository).load(REPO);
    }

    @Test
    void acquisitionFailureShowsSingleMessageRow() throws Exception {
        when(diffSource.acquire(REPO)).thenThrow(new DiffAcquisitionException("No git diff available"));

        session.show(REPO);

        assertThat(session.rows()).containsExactly(new DisplayRow.Message("No git diff available"));
        assertThat(session.files()).isEmpty();
        assertThat(session.hitTest(5, 10)).isEqualTo(LayoutTarget.row(0));
        assertThatThrownBy(() -> session.addOrUpdateComment(0, "nope"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyDiffShowsNoChangesMessage() throws Exception {
        when(diffSource.acquire(REPO)).thenReturn(new byte[0]);

        session.show(REPO);

        assertThat(session.rows()).containsExactly(new DisplayRow.Message(DiffReviewSession.NO_CHANGES_MESSAGE));
    }

    @Test
    void commentFollowsItsLineThroughWrapAndFold() throws Exception {
        when(diffSource.acquire(REPO)).thenReturn(EXAMPLE);
        session.show(REPO);
        DiffComment comment = session.addOrUpdateComment(8, "split this").orElseThrow();
        assertThat(comment.getDisplayRowIndex()).isEqualTo(8);

        session.setWrapWidth(5);
        assertThat(session.rows()).hasSize(13);
        assertThat(comment.getDisplayRowIndex()).isEqualTo(12);
        assertThat(session.commentAtRow(12)).contains(comment);

        session.toggleCollapsed(1);
        assertThat(comment.getDisplayRowIndex()).isNull();
        session.toggleCollapsed(1);
        assertThat(comment.getDisplayRowIndex()).isEqualTo(12);

        session.toggleCollapsed(0);
        assertThat(comment.getDisplayRowIndex()).isEqualTo(6);
    }

    @Test
    void sendDeliversPendingCommentsAndFreezesThem() throws Exception {
        when(diffSource.acquire(REPO)).thenReturn(EXAMPLE);
        when(agentSink.deliver(eq(REPO), anyString(), eq("agent"))).thenReturn(true);
        session.show(REPO);
        session.addOrUpdateComment(5, "looks good");

        int sent = session.sendComments("agent");

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(agentSink).deliver(eq(REPO), payload.capture(), eq("agent"));
        assertThat(sent).isEqualTo(1);
        assertThat(payload.getValue()).isEqualTo("x.txt:3: looks good\n");
        assertThat(session.comments()).allMatch(DiffComment::isSent);
        assertThat(session.commentAtRow(5)).isEmpty();
        assertThat(session.sendComments("agent")).isZero();
    }

    @Test
    void failedDeliveryKeepsCommentsPending() throws Exception {
        when(diffSource.acquire(REPO)).thenReturn(EXAMPLE);
        session.show(REPO);
        session.addOrUpdateComment(5, "looks good");

        assertThat(session.sendComments(null)).isZero();

        assertThat(session.comments()).noneMatch(DiffComment::isSent);
        assertThat(session.commentAtRow(5)).isPresent();
    }

    @Test
    void nothingPendingSendsNothing() throws Exception {
        when(diffSource.acquire(REPO)).thenReturn(EXAMPLE);
        session.show(REPO);

        assertThat(session.sendComments("agent")).isZero();
        verify(agentSink, never()).deliver(any(), anyString(), any());
    }

    @Test
    void hidePersistsCommentsAndClearsState() throws Exception {
        when(diffSource.acquire(REPO)).thenReturn(EXAMPLE);
        session.show(REPO);
        session.addOrUpdateComment(2, "context note");

        session.toggle(REPO);

        assertThat(session.isVisible()).isFalse();
        assertThat(session.rows()).isEmpty();
        assertThat(session.comments()).isEmpty();
        verify(repository, times(2)).save(eq(REPO), any());
    }

    @Test
    void hitTestAccountsForCommentBoxHeight() throws Exception {
        when(diffSource.acquire(REPO)).thenReturn(EXAMPLE);
        session.show(REPO);
        session.addOrUpdateComment(2, "first\nsecond");

        assertThat(session.commentHeight(2, 10)).isEqualTo(30);
        assertThat(session.hitTest(25, 10)).isEqualTo(LayoutTarget.row(2));
        assertThat(session.hitTest(35, 10)).isEqualTo(LayoutTarget.comment(2));
        assertThat(session.hitTest(60, 10)).isEqualTo(LayoutTarget.row(3));
        assertThat(session.rowTop(3, 10)).isEqualTo(60);
        assertThat(session.commentTop(2, 10)).isEqualTo(30);
        assertThat(session.hitTest(session.commentTop(2, 10), 10)).isEqualTo(LayoutTarget.comment(2));
        assertThat(session.contentHeight(10)).isEqualTo(120);
        assertThat(session.hitTest(120, 10).isNone()).isTrue();
    }

    @Test
    void rejectsInvalidRequests() throws Exception {
        assertThatThrownBy(() -> session.reload()).isInstanceOf(IllegalStateException.class);

        when(diffSource.acquire(REPO)).thenReturn(EXAMPLE);
        session.show(REPO);

        assertThatThrownBy(() -> session.toggleCollapsed(2)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> session.setWrapWidth(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> session.rowTop(10, 10)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> session.commentTop(9, 10)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void reloadReparsesAndReloadsComments() throws Exception {
        when(diffSource.acquire(REPO)).thenReturn(EXAMPLE, new byte[0]);
        session.show(REPO);

        session.reload();

        assertThat(session.files()).isEmpty();
        assertThat(session.rows()).containsExactly(new DisplayRow.Message(DiffReviewSession.NO_CHANGES_MESSAGE));
        verify(repository, times(2)).load(REPO);
    }

    @Test
    void sharedKeyCommentIsStoredOnceAndVisibleAfterReload(@TempDir Path repoRoot) throws Exception {
        when(diffSource.acquire(repoRoot)).thenReturn(EXAMPLE);
        JsonCommentRepository store = new JsonCommentRepository(new ObjectMapper(), ".architect");
        DiffReviewSession persisted =
                new DiffReviewSession(
                        diffSource, new UnifiedDiffParser(), new DisplayRowProjector(4), store, agentSink);
        persisted.show(repoRoot);

        persisted.addOrUpdateComment(4, "on new");
        persisted.addOrUpdateComment(3, "on old");
        persisted.reload();

        assertThat(store.load(repoRoot))
                .singleElement()
                .satisfies(
                        comment -> {
                            assertThat(comment.getKey()).isEqualTo(new CommentKey("x.txt", 2));
                            assertThat(comment.getText()).isEqualTo("on old");
                        });
        assertThat(persisted.comments())
                .singleElement()
                .satisfies(
                        comment -> {
                            assertThat(comment.getDisplayRowIndex()).isEqualTo(3);
                            assertThat(persisted.commentAtRow(3)).containsSame(comment);
                        });
        assertThat(persisted.commentHeight(3, 10)).isEqualTo(20);
        assertThat(persisted.commentAtRow(4)).isEmpty();
    }
}
