package org.poridhi.api.impl;

import org.poridhi.api.interfaces.IMiddleware;
import org.poridhi.api.interfaces.http.HttpRequest;
import org.poridhi.api.interfaces.http.HttpResponse;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MiddlewareChainTest {

    /** Records its hook calls into a shared log. */
    static final class Recorder implements IMiddleware {
        final String name;
        final List<String> log;

        Recorder(String name, List<String> log) { this.name = name; this.log = log; }

        @Override public void before(HttpRequest req) { log.add(name + ".before"); }

        @Override
        public HttpResponse after(HttpRequest req, HttpResponse res) {
            log.add(name + ".after");
            return res;
        }
    }

    private static HttpRequest request() {
        return new MinimalHttpRequest("GET", "/", "", null, null);
    }

    @Test
    void beforeRunsForwardAfterRunsBackward() throws Exception {
        List<String> log = new ArrayList<>();
        MiddlewareChain chain = new MiddlewareChain();
        chain.add(new Recorder("M1", log));
        chain.add(new Recorder("M2", log));

        HttpRequest req = request();
        chain.runBefore(req);
        chain.runAfter(req, new HttpResponseImpl());

        assertEquals(List.of("M1.before", "M2.before", "M2.after", "M1.after"), log);
    }

    @Test
    void afterMayReplaceTheResponse() throws Exception {
        MiddlewareChain chain = new MiddlewareChain();
        chain.add(new IMiddleware() {
            @Override
            public HttpResponse after(HttpRequest req, HttpResponse res) {
                res.header("X-Outer", "saw-" + res.statusCode());
                return res;
            }
        });
        chain.add(new IMiddleware() {
            @Override
            public HttpResponse after(HttpRequest req, HttpResponse res) {
                return HttpResponseImpl.html(418, "teapot");
            }
        });

        HttpResponse out = chain.runAfter(request(), new HttpResponseImpl());
        assertEquals(418, out.statusCode());
        assertEquals("saw-418", out.header("X-Outer"));   // outer saw the inner replacement
    }

    @Test
    void failingHookStopsTheWalk() {
        List<String> log = new ArrayList<>();
        MiddlewareChain chain = new MiddlewareChain();
        chain.add(new Recorder("M1", log));
        chain.add(new IMiddleware() {
            @Override
            public void before(HttpRequest req) {
                throw new IllegalStateException("boom");
            }
        });
        chain.add(new Recorder("M3", log));

        Exception e = assertThrows(IllegalStateException.class, () -> chain.runBefore(request()));
        assertEquals("boom", e.getMessage());
        assertEquals(List.of("M1.before"), log);
    }

    @Test
    void nullFromAfterIsAnError() {
        MiddlewareChain chain = new MiddlewareChain();
        chain.add(new IMiddleware() {
            @Override
            public HttpResponse after(HttpRequest req, HttpResponse res) {
                return null;
            }
        });
        assertThrows(IllegalStateException.class, () -> chain.runAfter(request(), new HttpResponseImpl()));
    }

    @Test
    void frozenChainIsImmutable() {
        MiddlewareChain chain = new MiddlewareChain();
        chain.add(new IMiddleware() {});
        MiddlewareChain frozen = chain.freeze();
        assertEquals(1, frozen.size());
        assertThrows(UnsupportedOperationException.class, () -> frozen.add(new IMiddleware() {}));
        assertThrows(IllegalArgumentException.class, () -> chain.add(null));
    }
}
