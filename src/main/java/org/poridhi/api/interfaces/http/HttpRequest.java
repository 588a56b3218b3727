package org.poridhi.api.interfaces.http;

import java.util.List;
import java.util.Map;

/** Minimal request contract */
public interface HttpRequest {
    String method();
    String path();
    String queryString();

    /**
     * Parsed query parameters. A key seen once maps to a {@code String},
     * a key seen more than once maps to a {@code List<String>}.
     */
    Map<String, Object> params();

    /** First value of a query parameter, or {@code null}. */
    String param(String name);

    /** All values of a query parameter, empty if absent. */
    List<String> paramValues(String name);

    String header(String name);
    byte[] body();

    // per-call scratch space for middleware (timings etc.)
    Object attribute(String name);
    void attribute(String name, Object value);
}
