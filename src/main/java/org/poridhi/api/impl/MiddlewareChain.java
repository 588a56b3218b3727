package org.poridhi.api.impl;

import org.poridhi.api.interfaces.IMiddleware;
import org.poridhi.api.interfaces.http.HttpRequest;
import org.poridhi.api.interfaces.http.HttpResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered middleware list. {@link #runBefore} walks it front to back,
 * {@link #runAfter} back to front. The first exception stops the walk and propagates.
 */
public final class MiddlewareChain {

    private final List<IMiddleware> middlewares;

    public MiddlewareChain() {
        this.middlewares = new ArrayList<>();
    }

    private MiddlewareChain(List<IMiddleware> middlewares) {
        this.middlewares = middlewares;
    }

    public void add(IMiddleware middleware) {
        if (middleware == null) throw new IllegalArgumentException("middleware is null");
        middlewares.add(middleware);
    }

    public void runBefore(HttpRequest req) throws Exception {
        for (IMiddleware m : middlewares) {
            m.before(req);
        }
    }

    public HttpResponse runAfter(HttpRequest req, HttpResponse res) throws Exception {
        HttpResponse current = res;
        for (int i = middlewares.size() - 1; i >= 0; i--) {
            HttpResponse next = middlewares.get(i).after(req, current);
            if (next == null) {
                throw new IllegalStateException(middlewares.get(i).getClass().getSimpleName()
                        + " returned no response");
            }
            current = next;
        }
        return current;
    }

    /** Immutable copy for serving. */
    public MiddlewareChain freeze() {
        return new MiddlewareChain(List.copyOf(middlewares));
    }

    public int size() { return middlewares.size(); }
}
