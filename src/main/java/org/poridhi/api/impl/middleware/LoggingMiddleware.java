package org.poridhi.api.impl.middleware;

import org.poridhi.api.interfaces.IMiddleware;
import org.poridhi.api.interfaces.http.HttpRequest;
import org.poridhi.api.interfaces.http.HttpResponse;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.util.Locale;

/** Logs each request line on the way in and the elapsed time on the way out. */
public class LoggingMiddleware implements IMiddleware {

    /** Request attribute holding {@link System#nanoTime()} at {@code before}. */
    public static final String START_TIME = "start_time";

    private final PrintStream log;

    public LoggingMiddleware() { this(System.out); }

    public LoggingMiddleware(PrintStream log) { this.log = log; }

    @Override
    public void before(HttpRequest req) {
        log.println("[" + LocalDateTime.now() + "] " + req.method() + " " + req.path());
        req.attribute(START_TIME, System.nanoTime());
    }

    @Override
    public HttpResponse after(HttpRequest req, HttpResponse res) {
        Object start = req.attribute(START_TIME);
        long began = start instanceof Long ? (Long) start : System.nanoTime();
        double seconds = (System.nanoTime() - began) / 1_000_000_000.0;
        log.println(String.format(Locale.ROOT, "Response took %.3f seconds", seconds));
        return res;
    }
}
