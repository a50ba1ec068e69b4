package com.nanik.agentbridge.execution;

import com.nanik.agentbridge.StubAgents;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

final class AgentProcessTest {

    @TempDir
    Path dir;

    @Test
    void walksThroughTheLifecycleStates() throws Exception {
        Path script = StubAgents.script(dir, "echo", StubAgents.ECHO);
        AgentProcess process = AgentProcess.start(new ProcessBuilder(StubAgents.SHELL, script.toString()), "echo");

        Assertions.assertEquals(ProcessState.SPAWNED, process.getState());
        process.sendInput("{\"a\":1}".getBytes(StandardCharsets.UTF_8));
        Assertions.assertEquals(ProcessState.WRITING_INPUT, process.getState());
        Assertions.assertTrue(process.awaitInput(Duration.ofSeconds(10)));
        Assertions.assertTrue(process.isInputDelivered());
        Assertions.assertEquals(ProcessState.AWAITING_OUTPUT, process.getState());
        Assertions.assertTrue(process.awaitExit(Duration.ofSeconds(10)));
        Assertions.assertEquals(ProcessState.COMPLETED, process.getState());
        Assertions.assertTrue(process.awaitOutput(Duration.ofSeconds(5)));

        Assertions.assertEquals("{\"a\":1}", process.stdout());
        Assertions.assertEquals("", process.stderr());
        Assertions.assertEquals(0, process.exitCode());
        Assertions.assertFalse(process.isStdoutTruncated());
    }

    @Test
    void rejectsIllegalTransitions() throws Exception {
        Path script = StubAgents.script(dir, "echo", StubAgents.ECHO);
        AgentProcess process = AgentProcess.start(new ProcessBuilder(StubAgents.SHELL, script.toString()), "echo");
        try {
            Assertions.assertThrows(IllegalStateException.class, () -> process.transition(ProcessState.COMPLETED));
            Assertions.assertEquals(ProcessState.SPAWNED, process.getState());
        } finally {
            process.kill();
        }
        Assertions.assertEquals(ProcessState.KILLED, process.getState());
    }

    @Test
    void terminateReleasesABlockedInputWriter() throws Exception {
        Path script = StubAgents.script(dir, "deaf", StubAgents.SLEEP);
        AgentProcess process = AgentProcess.start(new ProcessBuilder(StubAgents.SHELL, script.toString()), "deaf");
        process.sendInput(new byte[1024 * 1024]);

        Assertions.assertFalse(process.awaitInput(Duration.ofMillis(200)));
        process.terminate(Duration.ofSeconds(2));

        Assertions.assertTrue(process.getState() == ProcessState.TIMED_OUT
                || process.getState() == ProcessState.KILLED);
        Assertions.assertFalse(process.isAlive());
        Assertions.assertFalse(process.isInputDelivered());
    }

    @Test
    void killStopsARunningProcess() throws Exception {
        Path script = StubAgents.script(dir, "sleep", StubAgents.SLEEP);
        AgentProcess process = AgentProcess.start(new ProcessBuilder(StubAgents.SHELL, script.toString()), "sleep");
        process.sendInput(new byte[0]);
        Assertions.assertTrue(process.awaitInput(Duration.ofSeconds(10)));

        Assertions.assertFalse(process.awaitExit(Duration.ofMillis(100)));
        process.kill();

        Assertions.assertEquals(ProcessState.KILLED, process.getState());
        Assertions.assertTrue(process.awaitOutput(Duration.ofSeconds(5)));
    }
}
