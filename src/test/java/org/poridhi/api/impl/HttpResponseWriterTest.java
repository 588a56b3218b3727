package org.poridhi.api.impl;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HttpResponseWriterTest {

    @Test
    void writesStatusHeadersAndBody() throws IOException {
        HttpResponseImpl res = HttpResponseImpl.html(200, "hello");
        res.header("X-A", "1");
        res.header("X-A", "2");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpResponseWriter.write(out, res);
        String sent = out.toString(StandardCharsets.UTF_8);

        assertEquals("HTTP/1.1 200 OK\r\n" +
                "Content-Type: text/html\r\n" +
                "X-A: 1\r\n" +
                "X-A: 2\r\n" +
                "Connection: close\r\n" +
                "Content-Length: 5\r\n" +
                "\r\n" +
                "hello", sent);
    }

    @Test
    void keepsExplicitLengthAndConnection() throws IOException {
        HttpResponseImpl res = new HttpResponseImpl();
        res.header("Content-Length", "0");
        res.header("Connection", "keep-alive");
        String sent = new String(HttpResponseWriter.toBytes(res), StandardCharsets.UTF_8);
        assertEquals(1, sent.split("Content-Length", -1).length - 1);
        assertTrue(sent.contains("Connection: keep-alive\r\n"));
        assertFalse(sent.contains("Connection: close"));
    }

    @Test
    void contentLengthCountsBytesNotChars() throws IOException {
        HttpResponseImpl res = HttpResponseImpl.html(200, "ü");
        String sent = new String(HttpResponseWriter.toBytes(res), StandardCharsets.UTF_8);
        assertTrue(sent.contains("Content-Length: 2\r\n"), sent);
    }
}
