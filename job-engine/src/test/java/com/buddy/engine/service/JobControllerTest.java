package com.buddy.engine.service;

import com.buddy.engine.approval.ApprovalDecision;
import com.buddy.engine.approval.ApprovalGate;
import com.buddy.engine.definition.JobDefinition;
import com.buddy.engine.definition.JobDefinitionRegistry;
import com.buddy.engine.definition.PhaseDefinition;
import com.buddy.engine.error.ActiveJobLimitException;
import com.buddy.engine.error.AlreadyRespondedException;
import com.buddy.engine.error.JobNotFoundException;
import com.buddy.engine.error.NotAwaitingApprovalException;
import com.buddy.engine.error.PolicyViolationException;
import com.buddy.engine.error.UnknownJobTypeException;
import com.buddy.engine.model.JobSnapshot;
import com.buddy.engine.model.JobStatus;
import com.buddy.engine.policy.ConcurrencyPolicy;
import com.buddy.engine.policy.EnvironmentPolicy;
import com.buddy.engine.process.ProcessSupervisor;
import com.buddy.engine.process.ProcessTrees;
import com.buddy.engine.store.BuildLedger;
import com.buddy.engine.store.JobArchive;
import com.buddy.engine.store.JobStore;
import com.buddy.engine.stream.OutputBroadcaster;
import com.buddy.engine.stream.OutputEvent;
import com.buddy.engine.stream.OutputSubscription;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * End-to-end tests for the engine façade.
 *
 * Everything is wired by hand with real {@code sh} processes; only the
 * archive and build ledger are mocked, so no Spring context and no
 * database are involved.
 */
@ExtendWith(MockitoExtension.class)
class JobControllerTest {

    private static final Duration WAIT = Duration.ofSeconds(15);

    @Mock JobArchive  archive;
    @Mock BuildLedger builds;

    @TempDir Path tmp;

    ExecutorService     workers;
    ProcessSupervisor   supervisor;
    JobStore            store;
    SimpleMeterRegistry meters;
    JobController       controller;

    @BeforeEach
    void setUp() {
        controller = engine(0);
    }

    @AfterEach
    void tearDown() {
        controller.clear();
        workers.shutdownNow();
        supervisor.shutdown();
    }

    // ------------------------------------------------------------------
    // Wiring
    // ------------------------------------------------------------------

    private JobController engine(int maxActiveJobs) {
        return engine(JobRunner.newOwnerPool(), maxActiveJobs, null);
    }

    private JobController engine(ExecutorService pool, int maxActiveJobs, Duration approvalTimeout) {
        if (workers != null) {
            workers.shutdownNow();
            supervisor.shutdown();
        }
        workers    = pool;
        supervisor = new ProcessSupervisor(Duration.ofSeconds(1));
        store      = new JobStore(archive, 30);
        meters     = new SimpleMeterRegistry();
        ExecutionSettings settings = new ExecutionSettings(Duration.ofSeconds(2), approvalTimeout,
                Pattern.compile("^\\[progress (\\d{1,3})%]"));
        ApprovalGate gate = new ApprovalGate(store);
        JobRunner runner = new JobRunner(workers, store, supervisor, gate, settings, builds, meters);
        return new JobController(registry(), store, runner, gate, new OutputBroadcaster(store),
                new EnvironmentPolicy("alice", List.of("prod")), new ConcurrencyPolicy(maxActiveJobs));
    }

    private JobDefinitionRegistry registry() {
        Path applied = tmp.resolve("applied");
        Path grandchild = tmp.resolve("grandchild.pid");
        return new JobDefinitionRegistry(List.of(
                type("build", sh("echo '> building'; echo 'compiling'; sleep 60 & echo $! > '" + grandchild + "'; wait")),
                type("quick", sh("echo '> building'; sleep 1; echo done")),
                type("fail", sh("echo a; echo b; echo c; echo d; exit 3")),
                type("progress", sh("echo '[progress 40%] halfway'; sleep 0.2; echo 'tail'")),
                type("sleepy", sh("sleep 30")),
                type("missing-binary", PhaseDefinition.of("run", "/no/such/binary")),
                type("templated", sh("echo {param.awsFunctionName}")),
                new JobDefinition("deploy", "diff then deploy", true, List.of(), List.of(
                        sh("echo '+ resourceX'; exit 1").asPreview(Pattern.compile("^\\+"), 0, 1),
                        sh("sleep 2; touch '" + applied + "'; echo 'deployed'"))),
                new JobDefinition("deploy-clean", null, false, List.of(), List.of(
                        sh("echo 'There were no differences'").asPreview(Pattern.compile("^\\+"), 0, 1),
                        sh("touch '" + applied + "'"))),
                new JobDefinition("deploy-lambda", null, true, List.of("awsFunctionName"), List.of(
                        sh("echo uploading {param.awsFunctionName}"))),
                new JobDefinition("lambda-build", null, false, List.of(), List.of(
                        sh("echo 'built {target}'")), true),
                new JobDefinition("lambda-build-broken", null, false, List.of(), List.of(
                        sh("echo 'syntax error'; exit 2")), true)
        ));
    }

    private static JobDefinition type(String name, PhaseDefinition phase) {
        return new JobDefinition(name, null, false, List.of(), List.of(phase));
    }

    private static PhaseDefinition sh(String script) {
        return PhaseDefinition.of("run", "sh", "-c", script);
    }

    private JobSnapshot awaitStatus(String id, JobStatus status) {
        await().atMost(WAIT).until(() -> controller.get(id).status() == status);
        return controller.get(id);
    }

    private static List<String> lines(OutputSubscription sub) throws InterruptedException {
        List<String> lines = new ArrayList<>();
        while (!sub.isFinished()) {
            sub.next(Duration.ofSeconds(5)).map(OutputEvent::line).ifPresent(line -> {
                if (line != null) {
                    lines.add(line);
                }
            });
        }
        return lines;
    }

    // ------------------------------------------------------------------
    // create()
    // ------------------------------------------------------------------

    @Test
    void create_unknownType_throwsAndCreatesNothing() {
        assertThatThrownBy(() -> controller.create(new CreateJobCommand("teleport", "x")))
                .isInstanceOf(UnknownJobTypeException.class);
        assertThat(controller.list(false)).isEmpty();
    }

    @Test
    void create_missingTarget_isBadRequest() {
        assertThatThrownBy(() -> controller.create(new CreateJobCommand("build", " ")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing type or target");
    }

    @Test
    void create_missingRequiredParam_isBadRequest() {
        assertThatThrownBy(() -> controller.create(new CreateJobCommand("deploy-lambda", "orders")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("awsFunctionName");
    }

    @Test
    void create_protectedEnvironment_refusedBeforeSpawning() {
        assertThatThrownBy(() -> controller.create(
                new CreateJobCommand("deploy", "stackA", Map.of("environment", "prod"))))
                .isInstanceOf(PolicyViolationException.class)
                .hasMessageContaining("protected environment \"prod\"");
        assertThat(controller.list(false)).isEmpty();
        assertThat(Files.exists(tmp.resolve("applied"))).isFalse();
    }

    @Test
    void create_overActiveLimit_isRefused() {
        controller = engine(1);
        controller.create(new CreateJobCommand("sleepy", "x"));

        assertThatThrownBy(() -> controller.create(new CreateJobCommand("sleepy", "y")))
                .isInstanceOf(ActiveJobLimitException.class);
        assertThat(controller.list(true)).hasSize(1);
    }

    @Test
    void create_expandsParamsIntoCommand() {
        JobSnapshot job = controller.create(new CreateJobCommand("templated", "x", Map.of("awsFunctionName", "orders-api")));

        JobSnapshot done = awaitStatus(job.id(), JobStatus.COMPLETED);
        assertThat(done.output()).containsExactly("orders-api");
        assertThat(done.progress()).isEqualTo(100);
        assertThat(meters.counter("buddy.jobs.created", "type", "templated").count()).isEqualTo(1.0);
        await().atMost(WAIT).until(() ->
                meters.counter("buddy.jobs.finished", "type", "templated", "status", "completed").count() == 1.0);
    }

    // ------------------------------------------------------------------
    // Process outcomes
    // ------------------------------------------------------------------

    @Test
    void nonZeroExit_failsWithExitCodeAndLastLines() {
        JobSnapshot job = controller.create(new CreateJobCommand("fail", "x"));

        JobSnapshot failed = awaitStatus(job.id(), JobStatus.FAILED);
        assertThat(failed.error()).isEqualTo("Exit code 3 (last output: b | c | d)");
        assertThat(failed.output()).containsExactly("a", "b", "c", "d");
        assertThat(failed.completedAt()).isNotNull();
    }

    @Test
    void spawnFailure_failsWithoutOutput() {
        JobSnapshot job = controller.create(new CreateJobCommand("missing-binary", "x"));

        JobSnapshot failed = awaitStatus(job.id(), JobStatus.FAILED);
        assertThat(failed.error()).contains("Failed to start /no/such/binary");
        assertThat(failed.output()).isEmpty();
    }

    @Test
    void progressLines_updateProgress() {
        JobSnapshot job = controller.create(new CreateJobCommand("progress", "x"));

        await().atMost(WAIT).until(() -> controller.get(job.id()).progress() >= 40);
        assertThat(awaitStatus(job.id(), JobStatus.COMPLETED).progress()).isEqualTo(100);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    @Test
    void cancel_afterTwoLines_keepsExactlyThoseLinesAndKillsTree() throws Exception {
        JobSnapshot job = controller.create(new CreateJobCommand("build", "all"));
        Path pidFile = tmp.resolve("grandchild.pid");
        await().atMost(WAIT).until(() -> controller.get(job.id()).output().size() == 2 && Files.exists(pidFile)
                && !Files.readString(pidFile).isBlank());
        long grandchild = Long.parseLong(Files.readString(pidFile).trim());

        JobSnapshot cancelled = controller.cancel(job.id());

        assertThat(cancelled.status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(cancelled.error()).isEqualTo(JobController.USER_CANCEL_REASON);
        assertThat(cancelled.output()).containsExactly("> building", "compiling");
        await().atMost(WAIT).until(() -> !ProcessTrees.isRunning(grandchild));
        Thread.sleep(200);
        assertThat(controller.get(job.id()).output()).hasSize(2);
    }

    @Test
    void cancel_pendingJob_neverRuns() {
        controller = engine(Executors.newFixedThreadPool(1), 0, null);
        JobSnapshot blocker = controller.create(new CreateJobCommand("sleepy", "x"));
        awaitStatus(blocker.id(), JobStatus.RUNNING);
        JobSnapshot queued = controller.create(new CreateJobCommand("deploy-clean", "y"));

        JobSnapshot cancelled = controller.cancel(queued.id());
        controller.cancel(blocker.id());

        assertThat(cancelled.status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(cancelled.output()).isEmpty();
        assertThat(Files.exists(tmp.resolve("applied"))).isFalse();
    }

    @Test
    void cancel_terminalJob_isNoOp() {
        JobSnapshot job = controller.create(new CreateJobCommand("fail", "x"));
        JobSnapshot failed = awaitStatus(job.id(), JobStatus.FAILED);

        assertThat(controller.cancel(job.id())).isEqualTo(failed);
        assertThat(controller.cancel(job.id()).status()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void cancel_unknownJob_throwsNotFound() {
        assertThatThrownBy(() -> controller.cancel("nope")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void cancel_whileAwaitingApproval_releasesGate() {
        JobSnapshot job = controller.create(new CreateJobCommand("deploy", "stackA"));
        awaitStatus(job.id(), JobStatus.AWAITING_APPROVAL);

        JobSnapshot cancelled = controller.cancel(job.id());

        assertThat(cancelled.status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(Files.exists(tmp.resolve("applied"))).isFalse();
    }

    // ------------------------------------------------------------------
    // Approval
    // ------------------------------------------------------------------

    @Test
    void approvalWaits_doNotStarveLaterJobs() {
        List<String> parked = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            parked.add(controller.create(new CreateJobCommand("deploy", "stack" + i)).id());
        }
        parked.forEach(id -> awaitStatus(id, JobStatus.AWAITING_APPROVAL));

        JobSnapshot quick = controller.create(new CreateJobCommand("quick", "x"));

        assertThat(awaitStatus(quick.id(), JobStatus.COMPLETED).output()).containsExactly("> building", "done");
        assertThat(controller.list(true)).hasSize(6);
    }

    @Test
    void deploy_rejected_isCancelledAndApplyNeverRuns() throws Exception {
        JobSnapshot job = controller.create(new CreateJobCommand("deploy", "stackA"));
        JobSnapshot waiting = awaitStatus(job.id(), JobStatus.AWAITING_APPROVAL);
        assertThat(waiting.diffOutput()).containsExactly("+ resourceX");
        assertThat(controller.diff(job.id()).diffOutput()).containsExactly("+ resourceX");

        assertThat(controller.respond(job.id(), false)).isEqualTo(ApprovalDecision.REJECTED);

        JobSnapshot cancelled = awaitStatus(job.id(), JobStatus.CANCELLED);
        assertThat(cancelled.error()).isEqualTo(JobExecution.REJECTED_ERROR);
        assertThat(cancelled.output()).endsWith(JobExecution.REJECTED_LINE);
        Thread.sleep(300);
        assertThat(Files.exists(tmp.resolve("applied"))).isFalse();
    }

    @Test
    void deploy_approved_runsApplyAndKeepsLineOrder() {
        JobSnapshot job = controller.create(new CreateJobCommand("deploy", "stackA"));
        awaitStatus(job.id(), JobStatus.AWAITING_APPROVAL);

        controller.respond(job.id(), true);

        assertThat(controller.get(job.id()).status()).isIn(JobStatus.AWAITING_APPROVAL, JobStatus.RUNNING);
        JobSnapshot done = awaitStatus(job.id(), JobStatus.COMPLETED);
        assertThat(done.output()).containsExactly(
                "+ resourceX", JobExecution.AWAITING_LINE, JobExecution.APPROVED_LINE, "deployed");
        assertThat(done.diffOutput()).containsExactly("+ resourceX");
        assertThat(Files.exists(tmp.resolve("applied"))).isTrue();
    }

    @Test
    void respond_twice_secondFailsAndFirstOutcomeStands() {
        JobSnapshot job = controller.create(new CreateJobCommand("deploy", "stackA"));
        awaitStatus(job.id(), JobStatus.AWAITING_APPROVAL);

        controller.respond(job.id(), true);

        assertThatThrownBy(() -> controller.respond(job.id(), false))
                .isInstanceOf(AlreadyRespondedException.class);
        assertThat(awaitStatus(job.id(), JobStatus.COMPLETED).output()).doesNotContain(JobExecution.REJECTED_LINE);
    }

    @Test
    void respond_notAwaiting_failsAndLeavesStatus() {
        JobSnapshot job = controller.create(new CreateJobCommand("sleepy", "x"));
        awaitStatus(job.id(), JobStatus.RUNNING);

        assertThatThrownBy(() -> controller.respond(job.id(), true))
                .isInstanceOf(NotAwaitingApprovalException.class);
        assertThatThrownBy(() -> controller.diff(job.id()))
                .isInstanceOf(NotAwaitingApprovalException.class);
        assertThat(controller.get(job.id()).status()).isEqualTo(JobStatus.RUNNING);
    }

    @Test
    void approvalTimeout_cancelsWithReason() {
        controller = engine(JobRunner.newOwnerPool(), 0, Duration.ofMillis(300));
        JobSnapshot job = controller.create(new CreateJobCommand("deploy", "stackA"));

        JobSnapshot cancelled = awaitStatus(job.id(), JobStatus.CANCELLED);

        assertThat(cancelled.error()).startsWith("Approval timed out after");
        assertThat(cancelled.output()).endsWith(JobExecution.REJECTED_LINE);
        assertThatThrownBy(() -> controller.respond(job.id(), true))
                .isInstanceOfAny(NotAwaitingApprovalException.class, AlreadyRespondedException.class);
    }

    @Test
    void preview_withoutChanges_completesWithoutApproval() {
        JobSnapshot job = controller.create(new CreateJobCommand("deploy-clean", "stackA"));

        JobSnapshot done = awaitStatus(job.id(), JobStatus.COMPLETED);
        assertThat(done.output()).containsExactly("There were no differences", JobExecution.NO_CHANGES_LINE);
        assertThat(done.diffOutput()).isNull();
        assertThat(Files.exists(tmp.resolve("applied"))).isFalse();
    }

    // ------------------------------------------------------------------
    // Build records
    // ------------------------------------------------------------------

    @Test
    void buildType_recordsOutcomeOnSettle() {
        JobSnapshot ok = controller.create(new CreateJobCommand("lambda-build", "orders-api"));
        JobSnapshot broken = controller.create(new CreateJobCommand("lambda-build-broken", "users-api"));
        awaitStatus(ok.id(), JobStatus.COMPLETED);
        awaitStatus(broken.id(), JobStatus.FAILED);

        verify(builds, timeout(5000)).record(argThat(s -> s.id().equals(ok.id()) && s.status() == JobStatus.COMPLETED));
        verify(builds, timeout(5000)).record(argThat(s -> s.id().equals(broken.id()) && s.status() == JobStatus.FAILED));
    }

    @Test
    void otherTypes_neverTouchBuildRecords() {
        JobSnapshot job = controller.create(new CreateJobCommand("templated", "x", Map.of("awsFunctionName", "f")));
        awaitStatus(job.id(), JobStatus.COMPLETED);
        await().atMost(WAIT).until(() ->
                meters.counter("buddy.jobs.finished", "type", "templated", "status", "completed").count() == 1.0);

        verifyNoInteractions(builds);
    }

    // ------------------------------------------------------------------
    // Streaming
    // ------------------------------------------------------------------

    @Test
    void twoSubscribers_seeSameLinesInSameOrder() throws Exception {
        JobSnapshot job = controller.create(new CreateJobCommand("quick", "x"));
        OutputSubscription a = controller.subscribe(job.id());
        OutputSubscription b = controller.subscribe(job.id());

        CompletableFuture<List<String>> seenByA = CompletableFuture.supplyAsync(() -> drain(a));
        CompletableFuture<List<String>> seenByB = CompletableFuture.supplyAsync(() -> drain(b));

        assertThat(seenByA.get(15, TimeUnit.SECONDS)).containsExactly("> building", "done");
        assertThat(seenByB.get(15, TimeUnit.SECONDS)).containsExactly("> building", "done");
    }

    @Test
    void lateSubscriber_getsHistoryThenDone() throws Exception {
        JobSnapshot job = controller.create(new CreateJobCommand("quick", "x"));
        awaitStatus(job.id(), JobStatus.COMPLETED);

        try (OutputSubscription sub = controller.subscribe(job.id())) {
            assertThat(lines(sub)).containsExactly("> building", "done");
            assertThat(sub.finalStatus()).isEqualTo(JobStatus.COMPLETED);
        }
    }

    // ------------------------------------------------------------------
    // clear()
    // ------------------------------------------------------------------

    @Test
    void clear_terminatesEveryActiveJobAndArchivesIt() {
        JobSnapshot running = controller.create(new CreateJobCommand("sleepy", "x"));
        JobSnapshot waiting = controller.create(new CreateJobCommand("deploy", "stackA"));
        awaitStatus(running.id(), JobStatus.RUNNING);
        awaitStatus(waiting.id(), JobStatus.AWAITING_APPROVAL);

        int cleared = controller.clear();

        assertThat(cleared).isEqualTo(2);
        assertThat(controller.list(true)).isEmpty();
        verify(archive).save(argThat(s -> s.id().equals(running.id()) && s.status() == JobStatus.CANCELLED
                && JobController.CLEAR_CANCEL_REASON.equals(s.error())));
        verify(archive).save(argThat(s -> s.id().equals(waiting.id()) && s.status() == JobStatus.CANCELLED));
        // Evicted from memory; the mocked archive has nothing to read back.
        assertThat(controller.findById(running.id())).isEmpty();
    }

    private static List<String> drain(OutputSubscription sub) {
        try (sub) {
            return lines(sub);
        } catch (InterruptedException e) {
            throw new IllegalStateException(e);
        }
    }
}
