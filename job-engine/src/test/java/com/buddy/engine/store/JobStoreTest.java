package com.buddy.engine.store;

import com.buddy.engine.error.InvalidTransitionException;
import com.buddy.engine.error.JobNotFoundException;
import com.buddy.engine.model.JobPatch;
import com.buddy.engine.model.JobSnapshot;
import com.buddy.engine.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobStore. The archive is mocked; no database.
 */
@ExtendWith(MockitoExtension.class)
class JobStoreTest {

    @Mock JobArchive archive;

    JobStore store;

    @BeforeEach
    void setUp() {
        store = new JobStore(archive, 30);
    }

    // ------------------------------------------------------------------
    // create / get
    // ------------------------------------------------------------------

    @Test
    void create_returnsPendingJobWithFreshId() {
        JobSnapshot a = store.create("build", "all", Map.of());
        JobSnapshot b = store.create("build", "all", Map.of());

        assertThat(a.status()).isEqualTo(JobStatus.PENDING);
        assertThat(a.output()).isEmpty();
        assertThat(a.id()).isNotEqualTo(b.id());
        assertThat(store.get(a.id())).contains(a);
    }

    @Test
    void get_unknownId_fallsBackToArchive() {
        JobSnapshot archived = new JobSnapshot("old", "build", "all", Map.of(), JobStatus.COMPLETED, 100,
                List.of("done"), Instant.now(), Instant.now(), null, null, "build");
        when(archive.find("old")).thenReturn(Optional.of(archived));

        assertThat(store.get("old")).contains(archived);
        assertThat(store.find("old")).get().extracting(j -> j.getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    // ------------------------------------------------------------------
    // update
    // ------------------------------------------------------------------

    @Test
    void update_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> store.update("nope", JobPatch.lines("x")))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void update_terminalTransition_archivesSnapshot() {
        JobSnapshot job = store.create("build", "all", Map.of());
        store.update(job.id(), JobPatch.status(JobStatus.RUNNING));

        store.update(job.id(), JobPatch.status(JobStatus.FAILED).withError("Exit code 2"));

        ArgumentCaptor<JobSnapshot> saved = ArgumentCaptor.forClass(JobSnapshot.class);
        verify(archive).save(saved.capture());
        assertThat(saved.getValue().status()).isEqualTo(JobStatus.FAILED);
        assertThat(saved.getValue().error()).isEqualTo("Exit code 2");
    }

    @Test
    void update_nonTerminal_doesNotArchive() {
        JobSnapshot job = store.create("build", "all", Map.of());

        store.update(job.id(), JobPatch.status(JobStatus.RUNNING));
        store.appendOutput(job.id(), "line");

        verify(archive, never()).save(any());
        assertThat(store.get(job.id()).orElseThrow().output()).containsExactly("line");
    }

    @Test
    void update_afterTerminal_throwsInvalidTransition() {
        JobSnapshot job = store.create("build", "all", Map.of());
        store.update(job.id(), JobPatch.status(JobStatus.CANCELLED));

        assertThatThrownBy(() -> store.appendOutput(job.id(), "late"))
                .isInstanceOf(InvalidTransitionException.class);
    }

    // ------------------------------------------------------------------
    // list / clear
    // ------------------------------------------------------------------

    @Test
    void list_isNewestFirstAndActiveFilterDropsTerminal() {
        JobSnapshot first  = store.create("build", "a", Map.of());
        JobSnapshot second = store.create("build", "b", Map.of());
        store.update(first.id(), JobPatch.status(JobStatus.CANCELLED));
        when(archive.recent(anyInt())).thenReturn(List.of());

        assertThat(store.list(false)).extracting(JobSnapshot::id).containsExactly(second.id(), first.id());
        assertThat(store.list(true)).extracting(JobSnapshot::id).containsExactly(second.id());
        assertThat(store.activeCount()).isEqualTo(1);
    }

    @Test
    void list_mergesArchivedJobsWithoutDuplicates() {
        JobSnapshot live = store.create("build", "a", Map.of());
        store.update(live.id(), JobPatch.status(JobStatus.CANCELLED));
        JobSnapshot liveArchived = store.get(live.id()).orElseThrow();
        JobSnapshot older = new JobSnapshot("older", "diff", "s", Map.of(), JobStatus.COMPLETED, 100,
                List.of(), Instant.now().minusSeconds(3600), Instant.now().minusSeconds(3500), null, null, null);
        when(archive.recent(30)).thenReturn(List.of(liveArchived, older));

        assertThat(store.list(false)).extracting(JobSnapshot::id).containsExactly(live.id(), "older");
    }

    @Test
    void clear_evictsTerminalJobsAndKeepsActiveOnes() {
        JobSnapshot done    = store.create("build", "a", Map.of());
        JobSnapshot running = store.create("build", "b", Map.of());
        store.update(done.id(), JobPatch.status(JobStatus.CANCELLED));
        store.update(running.id(), JobPatch.status(JobStatus.RUNNING));

        int removed = store.clear();

        assertThat(removed).isEqualTo(1);
        assertThat(store.get(running.id())).isPresent();
        assertThat(store.get(done.id())).isEmpty();   // archive mock has nothing
    }
}
