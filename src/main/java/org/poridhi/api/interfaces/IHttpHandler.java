package org.poridhi.api.interfaces;

import org.poridhi.api.interfaces.http.HttpRequest;

@FunctionalInterface
public interface IHttpHandler {
    HandlerResult handle(HttpRequest req) throws Exception;
}
