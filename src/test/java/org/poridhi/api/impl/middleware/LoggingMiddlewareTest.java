package org.poridhi.api.impl.middleware;

import org.poridhi.api.impl.HttpResponseImpl;
import org.poridhi.api.impl.MinimalHttpRequest;
import org.poridhi.api.interfaces.http.HttpRequest;
import org.poridhi.api.interfaces.http.HttpResponse;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class LoggingMiddlewareTest {

    @Test
    void logsRequestLineAndDuration() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        LoggingMiddleware m = new LoggingMiddleware(new PrintStream(buf, true, StandardCharsets.UTF_8));
        HttpRequest req = new MinimalHttpRequest("GET", "/slow", "", null, null);
        HttpResponse res = new HttpResponseImpl();

        m.before(req);
        assertTrue(req.attribute(LoggingMiddleware.START_TIME) instanceof Long);
        assertSame(res, m.after(req, res));

        String[] lines = buf.toString(StandardCharsets.UTF_8).split("\\R");
        assertEquals(2, lines.length);
        assertTrue(lines[0].startsWith("[") && lines[0].endsWith("] GET /slow"), lines[0]);
        assertTrue(lines[1].matches("Response took \\d+\\.\\d{3} seconds"), lines[1]);
    }

    @Test
    void afterWithoutBeforeStillLogs() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        LoggingMiddleware m = new LoggingMiddleware(new PrintStream(buf, true, StandardCharsets.UTF_8));
        m.after(new MinimalHttpRequest("GET", "/", "", null, null), new HttpResponseImpl());
        assertTrue(buf.toString(StandardCharsets.UTF_8).startsWith("Response took 0.0"));
    }
}
