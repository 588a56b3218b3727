package org.poridhi.api.impl.middleware;

import org.poridhi.api.interfaces.IMiddleware;
import org.poridhi.api.interfaces.http.HttpRequest;
import org.poridhi.api.interfaces.http.HttpResponse;

/** Appends anti-sniffing and anti-framing headers to every routed response. */
public class SecurityHeadersMiddleware implements IMiddleware {

    @Override
    public HttpResponse after(HttpRequest req, HttpResponse res) {
        res.header("X-Content-Type-Options", "nosniff");
        res.header("X-Frame-Options", "DENY");
        return res;
    }
}
