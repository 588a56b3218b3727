package org.poridhi.api.interfaces;

import org.poridhi.api.interfaces.http.HttpResponse;

/**
 * What a handler may return: a text body, a byte body, or a complete response.
 * Text and byte bodies are wrapped into a 200 {@code text/html} response by the dispatcher.
 */
public sealed interface HandlerResult
        permits HandlerResult.StringBody, HandlerResult.ByteBody, HandlerResult.FullResponse {

    record StringBody(String text) implements HandlerResult {}

    record ByteBody(byte[] bytes) implements HandlerResult {}

    record FullResponse(HttpResponse response) implements HandlerResult {}

    static HandlerResult text(String text) {
        return new StringBody(text);
    }

    static HandlerResult bytes(byte[] bytes) {
        return new ByteBody(bytes);
    }

    static HandlerResult of(HttpResponse response) {
        return new FullResponse(response);
    }
}
