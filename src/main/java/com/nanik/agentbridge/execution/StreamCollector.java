package com.nanik.agentbridge.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Drains a process stream on a background daemon thread so the child never
 * blocks on a full pipe. Bytes beyond {@code limit} are read and discarded.
 */
public class StreamCollector {

    private static final Logger log = LoggerFactory.getLogger(StreamCollector.class);

    private final InputStream stream;
    private final int limit;
    private final ByteArrayOutputStream buffer;
    private final Thread thread;
    private volatile boolean truncated;

    public StreamCollector(InputStream stream, int limit, String name) {
        this.stream = stream;
        this.limit = limit;
        this.buffer = new ByteArrayOutputStream();
        this.thread = new Thread(this::drain, name);
        this.thread.setDaemon(true);
    }

    public StreamCollector start() {
        thread.start();
        return this;
    }

    /**
     * Wait for the stream to reach end-of-file.
     *
     * @return true if the stream was fully drained
     */
    public boolean await(Duration timeout) throws InterruptedException {
        thread.join(Math.max(1, timeout.toMillis()));
        return !thread.isAlive();
    }

    /**
     * Text collected so far, decoded as UTF-8.
     */
    public String text() {
        synchronized (buffer) {
            return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
        }
    }

    public boolean isTruncated() {
        return truncated;
    }

    private void drain() {
        byte[] chunk = new byte[8192];
        try {
            int len;
            while ((len = stream.read(chunk)) != -1) {
                synchronized (buffer) {
                    int room = limit - buffer.size();
                    if (room > 0) {
                        buffer.write(chunk, 0, Math.min(room, len));
                    }
                    if (len > room) {
                        truncated = true;
                    }
                }
            }
        } catch (IOException e) {
            log.debug("{} closed: {}", thread.getName(), e.getMessage());
        }
    }
}
