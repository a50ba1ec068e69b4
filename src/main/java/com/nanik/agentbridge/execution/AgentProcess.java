package com.nanik.agentbridge.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * One running agent process and its {@link ProcessState}.
 *
 * Every state change goes through {@link #transition(ProcessState)}, which
 * rejects moves the state machine does not allow.
 */
public class AgentProcess {

    private static final Logger log = LoggerFactory.getLogger(AgentProcess.class);

    static final int MAX_STDOUT_BYTES = 16 * 1024 * 1024;
    static final int MAX_STDERR_BYTES = 256 * 1024;

    private final Process process;
    private final String label;
    private final StreamCollector stdout;
    private final StreamCollector stderr;
    private volatile ProcessState state;
    private volatile boolean inputDelivered;
    private Thread inputWriter;

    AgentProcess(Process process, String label) {
        this.process = process;
        this.label = label;
        this.state = ProcessState.SPAWNED;
        this.stdout = new StreamCollector(process.getInputStream(), MAX_STDOUT_BYTES, label + "-stdout").start();
        this.stderr = new StreamCollector(process.getErrorStream(), MAX_STDERR_BYTES, label + "-stderr").start();
    }

    /**
     * Start a process. Output collection begins immediately.
     */
    public static AgentProcess start(ProcessBuilder builder, String label) throws IOException {
        builder.redirectErrorStream(false);
        Process process = builder.start();
        log.debug("Spawned {} (pid {})", label, process.pid());
        return new AgentProcess(process, label);
    }

    /**
     * Start writing the input document on a background thread; stdin is
     * closed once everything is written so the agent sees end-of-input. The
     * writer unblocks when the process dies, so an agent that never reads
     * cannot hold it past {@link #terminate(Duration)}.
     */
    public void sendInput(byte[] input) {
        transition(ProcessState.WRITING_INPUT);
        inputWriter = new Thread(() -> writeAll(input), label + "-stdin");
        inputWriter.setDaemon(true);
        inputWriter.start();
    }

    /**
     * Wait up to {@code timeout} for the input to be written.
     *
     * @return true if the writer finished, whether or not the agent accepted
     *         all of the input
     */
    public boolean awaitInput(Duration timeout) throws InterruptedException {
        if (inputWriter == null) {
            throw new IllegalStateException(label + ": no input was sent");
        }
        inputWriter.join(Math.max(1, timeout.toMillis()));
        if (inputWriter.isAlive()) {
            return false;
        }
        transition(ProcessState.AWAITING_OUTPUT);
        return true;
    }

    /**
     * @return false if the agent closed its stdin before reading everything
     */
    public boolean isInputDelivered() {
        return inputDelivered;
    }

    private void writeAll(byte[] input) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(input);
            stdin.flush();
            inputDelivered = true;
        } catch (IOException e) {
            log.debug("{} did not accept its input: {}", label, e.getMessage());
        }
    }

    /**
     * Wait up to {@code timeout} for the process to exit.
     *
     * @return true if it exited
     */
    public boolean awaitExit(Duration timeout) throws InterruptedException {
        long millis = Math.max(0, timeout.toMillis());
        if (process.waitFor(millis, TimeUnit.MILLISECONDS)) {
            transition(ProcessState.COMPLETED);
            return true;
        }
        return false;
    }

    /**
     * Terminate after a timeout: ask the process tree to stop, wait up to
     * {@code grace}, then force kill whatever is still alive.
     */
    public void terminate(Duration grace) throws InterruptedException {
        transition(ProcessState.TIMED_OUT);
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        process.destroy();
        descendants.forEach(ProcessHandle::destroy);

        if (process.waitFor(Math.max(0, grace.toMillis()), TimeUnit.MILLISECONDS)) {
            destroyForcibly(descendants);
            log.debug("{} stopped after graceful termination", label);
            return;
        }
        transition(ProcessState.KILLED);
        process.destroyForcibly();
        destroyForcibly(descendants);
        if (!process.waitFor(Math.max(1000, grace.toMillis()), TimeUnit.MILLISECONDS)) {
            log.warn("{} (pid {}) still alive after force kill", label, process.pid());
        } else {
            log.debug("{} force killed", label);
        }
    }

    /**
     * Force kill from any unfinished state, used when the bridge itself is
     * interrupted mid-call.
     */
    public void kill() {
        if (state.isFinished() && state != ProcessState.TIMED_OUT) {
            return;
        }
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        transition(ProcessState.KILLED);
        process.destroyForcibly();
        destroyForcibly(descendants);
    }

    /**
     * Wait for both output streams to reach end-of-file.
     *
     * @return true if both were fully drained within {@code timeout}
     */
    public boolean awaitOutput(Duration timeout) throws InterruptedException {
        boolean out = stdout.await(timeout);
        boolean err = stderr.await(timeout);
        return out && err;
    }

    public ProcessState getState() {
        return state;
    }

    public long pid() {
        return process.pid();
    }

    public int exitCode() {
        return process.exitValue();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public String stdout() {
        return stdout.text();
    }

    public String stderr() {
        return stderr.text();
    }

    public boolean isStdoutTruncated() {
        return stdout.isTruncated();
    }

    void transition(ProcessState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(label + ": illegal transition " + state + " -> " + next);
        }
        log.trace("{}: {} -> {}", label, state, next);
        state = next;
    }

    private static void destroyForcibly(List<ProcessHandle> handles) {
        for (ProcessHandle handle : handles) {
            if (handle.isAlive()) {
                handle.destroyForcibly();
            }
        }
    }
}
