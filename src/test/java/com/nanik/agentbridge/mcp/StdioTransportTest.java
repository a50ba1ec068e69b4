package com.nanik.agentbridge.mcp;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

final class StdioTransportTest {

    @Test
    void skipsBlankLinesAndReportsEndOfInput() throws IOException {
        StdioTransport transport = transport("{\"a\":1}\n\n   \n{\"b\":2}\n", new ByteArrayOutputStream());

        Assertions.assertEquals("{\"a\":1}", transport.readMessage());
        Assertions.assertEquals("{\"b\":2}", transport.readMessage());
        Assertions.assertNull(transport.readMessage());
    }

    @Test
    void writesOneRecordPerLine() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StdioTransport transport = transport("", out);

        Assertions.assertTrue(transport.send("{\"x\":\"é\"}"));
        Assertions.assertTrue(transport.send("{}"));

        Assertions.assertEquals("{\"x\":\"é\"}\n{}\n", out.toString(StandardCharsets.UTF_8));
        Assertions.assertFalse(transport.isClosed());
    }

    @Test
    void closesAfterFailedWrite() {
        int[] attempts = {0};
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                attempts[0]++;
                throw new IOException("Broken pipe");
            }
        };
        StdioTransport transport = transport("", broken);

        Assertions.assertFalse(transport.send("{}"));
        Assertions.assertTrue(transport.isClosed());
        int afterFirst = attempts[0];
        Assertions.assertFalse(transport.send("{}"));
        Assertions.assertEquals(afterFirst, attempts[0]);
    }

    private static StdioTransport transport(String input, OutputStream out) {
        return new StdioTransport(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out);
    }
}
