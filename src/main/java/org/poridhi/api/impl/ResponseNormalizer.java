package org.poridhi.api.impl;

import org.poridhi.api.interfaces.HandlerResult;
import org.poridhi.api.interfaces.http.HttpResponse;

/** Turns whatever a handler returned into a response. */
public final class ResponseNormalizer {

    private ResponseNormalizer() {}

    /**
     * Text becomes a UTF-8 body, bytes are used as they are; both get 200 and
     * {@code Content-Type: text/html}. A full response passes through untouched.
     *
     * @throws IllegalStateException if the handler returned nothing
     */
    public static HttpResponse normalize(HandlerResult result) {
        if (result == null) {
            throw new IllegalStateException("handler returned no result");
        }
        if (result instanceof HandlerResult.FullResponse) {
            HttpResponse full = ((HandlerResult.FullResponse) result).response();
            if (full == null) throw new IllegalStateException("handler returned a null response");
            return full;
        }
        HttpResponseImpl res = new HttpResponseImpl();
        if (result instanceof HandlerResult.StringBody) {
            res.body(((HandlerResult.StringBody) result).text());
        } else if (result instanceof HandlerResult.ByteBody) {
            res.body(((HandlerResult.ByteBody) result).bytes());
        }
        return res;
    }
}
