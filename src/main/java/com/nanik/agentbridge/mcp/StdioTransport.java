package com.nanik.agentbridge.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Line-oriented transport over a pair of byte streams.
 *
 * Reads one record per line from the input (blank lines are skipped) and
 * writes one record per line to the output, flushing after each. Diagnostics
 * never go to the output stream; they are logged.
 *
 * A failed write means the peer stopped reading. The transport then marks
 * itself closed and every later send is dropped.
 */
public class StdioTransport {

    private static final Logger log = LoggerFactory.getLogger(StdioTransport.class);

    private final BufferedReader reader;
    private final Writer writer;
    private volatile boolean closed;

    public StdioTransport(InputStream in, OutputStream out) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    /**
     * Read the next non-blank line.
     *
     * @return the line, or null at end of input
     */
    public String readMessage() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.trim().isEmpty()) {
                return line;
            }
        }
        return null;
    }

    /**
     * Write one record and flush.
     *
     * @return false if the peer has closed its side and the record was dropped
     */
    public boolean send(String record) {
        if (closed) {
            return false;
        }
        try {
            writer.write(record);
            writer.write('\n');
            writer.flush();
            return true;
        } catch (IOException e) {
            closed = true;
            log.info("Output closed by peer ({}); shutting down", e.getMessage());
            return false;
        }
    }

    /**
     * Whether the output peer has gone away.
     */
    public boolean isClosed() {
        return closed;
    }
}
