package org.poridhi.api.interfaces;

import org.poridhi.api.interfaces.http.HttpRequest;
import org.poridhi.api.interfaces.http.HttpResponse;

/**
 * A hook pair wrapped around dispatch. {@code before} hooks run in registration
 * order, {@code after} hooks in reverse, so the first middleware added is the outermost.
 */
public interface IMiddleware {

    /** Called before routing. May attach attributes to the request. */
    default void before(HttpRequest req) throws Exception {
    }

    /** Called after the handler. Returns the response to pass outwards, possibly a new one. */
    default HttpResponse after(HttpRequest req, HttpResponse res) throws Exception {
        return res;
    }
}
