package com.buddy.engine.process;

import com.buddy.engine.error.SpawnException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs real {@code sh} processes. No Spring context.
 */
class ProcessSupervisorTest {

    ProcessSupervisor supervisor;
    List<String>      lines;

    @TempDir Path tmp;

    @BeforeEach
    void setUp() {
        supervisor = new ProcessSupervisor(Duration.ofSeconds(1));
        lines = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    private static ProcessSpec sh(String script) {
        return ProcessSpec.of("sh", "-c", script);
    }

    // ------------------------------------------------------------------
    // Output capture
    // ------------------------------------------------------------------

    @Test
    void spawn_capturesStdoutAndStderrAndSkipsBlankLines() throws Exception {
        try (SupervisedProcess p = supervisor.spawn(sh("echo out; echo; echo err 1>&2"), lines::add)) {
            assertThat(p.awaitExit()).isZero();
        }
        assertThat(lines).containsExactlyInAnyOrder("out", "err");
    }

    @Test
    void spawn_stripsAnsiEscapes() throws Exception {
        try (SupervisedProcess p = supervisor.spawn(sh("printf '\\033[32mgreen\\033[0m\\n'"), lines::add)) {
            p.awaitExit();
        }
        assertThat(lines).containsExactly("green");
    }

    @Test
    void spawn_setsNoColorAndExtraEnvironment() throws Exception {
        ProcessSpec spec = new ProcessSpec(List.of("sh", "-c", "echo $NO_COLOR $FORCE_COLOR $STACK"),
                tmp, Map.of("STACK", "orders"));
        try (SupervisedProcess p = supervisor.spawn(spec, lines::add)) {
            p.awaitExit();
        }
        assertThat(lines).containsExactly("1 0 orders");
    }

    @Test
    void awaitExit_returnsNonZeroCodeAfterAllLines() throws Exception {
        try (SupervisedProcess p = supervisor.spawn(sh("for i in 1 2 3 4 5; do echo $i; done; exit 7"), lines::add)) {
            assertThat(p.awaitExit()).isEqualTo(7);
        }
        assertThat(lines).containsExactly("1", "2", "3", "4", "5");
    }

    @Test
    void sinkFailure_doesNotStopReading() throws Exception {
        List<String> seen = new CopyOnWriteArrayList<>();
        LineSink flaky = line -> {
            seen.add(line);
            if (line.equals("2")) {
                throw new IllegalStateException("rejected");
            }
        };
        try (SupervisedProcess p = supervisor.spawn(sh("echo 1; echo 2; echo 3"), flaky)) {
            p.awaitExit();
        }
        assertThat(seen).containsExactly("1", "2", "3");
    }

    // ------------------------------------------------------------------
    // Spawn failures
    // ------------------------------------------------------------------

    @Test
    void spawn_missingExecutable_throwsSpawnException() {
        assertThatThrownBy(() -> supervisor.spawn(ProcessSpec.of("/definitely/not/here"), lines::add))
                .isInstanceOf(SpawnException.class)
                .hasMessageContaining("/definitely/not/here");
    }

    @Test
    void spawn_relativeExecutable_resolvesAgainstWorkingDirectory() throws Exception {
        Path script = tmp.resolve("build.sh");
        Files.writeString(script, "#!/bin/sh\necho built in $(pwd)\n");
        assertThat(script.toFile().setExecutable(true)).isTrue();
        ProcessSpec spec = new ProcessSpec(List.of("./build.sh"), tmp, Map.of());

        try (SupervisedProcess p = supervisor.spawn(spec, lines::add)) {
            assertThat(p.awaitExit()).isZero();
        }
        assertThat(lines).hasSize(1);
        assertThat(lines.get(0)).startsWith("built in ").endsWith(tmp.getFileName().toString());
    }

    @Test
    void spawn_missingWorkingDirectory_throwsSpawnException() {
        ProcessSpec spec = new ProcessSpec(List.of("sh", "-c", "true"), tmp.resolve("gone"), Map.of());

        assertThatThrownBy(() -> supervisor.spawn(spec, lines::add))
                .isInstanceOf(SpawnException.class)
                .hasMessageContaining("working directory does not exist");
    }

    // ------------------------------------------------------------------
    // Termination
    // ------------------------------------------------------------------

    @Test
    void terminate_killsForkedGrandchild() throws Exception {
        Path pidFile = tmp.resolve("child.pid");
        String script = "sleep 60 & echo $! > '" + pidFile + "'; echo started; wait";
        SupervisedProcess p = supervisor.spawn(sh(script), lines::add);
        await().atMost(Duration.ofSeconds(5)).until(() -> lines.contains("started"));
        long grandchild = Long.parseLong(Files.readString(pidFile).trim());

        TerminationResult result = p.terminate(Duration.ofSeconds(2));

        assertThat(result.clean()).isTrue();
        assertThat(p.awaitExit()).isNotZero();
        await().atMost(Duration.ofSeconds(5)).until(() -> !ProcessTrees.isRunning(grandchild));
    }

    @Test
    void terminate_escalatesWhenTermIsIgnored() throws Exception {
        String script = "trap '' TERM; echo ready; while true; do sleep 1; done";
        SupervisedProcess p = supervisor.spawn(sh(script), lines::add);
        await().atMost(Duration.ofSeconds(5)).until(() -> lines.contains("ready"));

        TerminationResult result = p.terminate(Duration.ofMillis(300));

        assertThat(result.forced()).isTrue();
        assertThat(result.survivors()).isEmpty();
        await().atMost(Duration.ofSeconds(5)).until(() -> !p.isAlive());
    }

    @Test
    void terminate_isIdempotent() throws Exception {
        SupervisedProcess p = supervisor.spawn(sh("sleep 30"), lines::add);

        TerminationResult first  = p.terminate(Duration.ofSeconds(2));
        TerminationResult second = p.terminate(Duration.ofSeconds(2));

        assertThat(second).isSameAs(first);
    }

    @Test
    void terminate_afterExit_isNoOp() throws Exception {
        SupervisedProcess p = supervisor.spawn(sh("true"), lines::add);
        p.awaitExit();

        assertThat(p.terminate(Duration.ofSeconds(1))).isEqualTo(TerminationResult.ALREADY_EXITED);
    }

    @Test
    void terminate_afterRootExited_killsOrphanedChild() throws Exception {
        assumeTrue(ProcessSessions.supported(), "needs setsid and /proc");
        Path pidFile = tmp.resolve("orphan.pid");
        String script = "sleep 30 > /dev/null 2>&1 & echo $! > '" + pidFile + "'; exit 0";
        SupervisedProcess p = supervisor.spawn(sh(script), lines::add);
        await().atMost(Duration.ofSeconds(5)).until(() -> !p.isAlive());
        long orphan = Long.parseLong(Files.readString(pidFile).trim());
        assertThat(ProcessTrees.isRunning(orphan)).isTrue();

        TerminationResult result = p.terminate(Duration.ofSeconds(1));

        assertThat(result).isNotEqualTo(TerminationResult.ALREADY_EXITED);
        assertThat(result.clean()).isTrue();
        await().atMost(Duration.ofSeconds(5)).until(() -> !ProcessTrees.isRunning(orphan));
    }

    @Test
    void close_afterNormalExit_sweepsLeftoverChildren() throws Exception {
        assumeTrue(ProcessSessions.supported(), "needs setsid and /proc");
        Path pidFile = tmp.resolve("leftover.pid");
        String script = "sleep 30 > /dev/null 2>&1 & echo $! > '" + pidFile + "'; echo done";
        SupervisedProcess p = supervisor.spawn(sh(script), lines::add);
        assertThat(p.awaitExit()).isZero();
        long leftover = Long.parseLong(Files.readString(pidFile).trim());
        assertThat(ProcessTrees.isRunning(leftover)).isTrue();

        p.close();

        await().atMost(Duration.ofSeconds(5)).until(() -> !ProcessTrees.isRunning(leftover));
        assertThat(lines).containsExactly("done");
    }

    @Test
    void ansiStripper_removesColourAndCursorSequences() {
        assertThat(AnsiStripper.strip("\u001B[1;31mred\u001B[0m text\u001B[2K")).isEqualTo("red text");
        assertThat(AnsiStripper.strip("plain")).isEqualTo("plain");
    }
}
