package org.poridhi.api.interfaces.http;

import java.util.Map;

/**
 * Raw call data handed to the dispatcher by a hosting runtime.
 * The query string is still undecoded; the path is already percent-decoded.
 */
public record InboundCall(String method,
                          String path,
                          String queryString,
                          Map<String, String> headers,
                          byte[] body) {

    public InboundCall {
        method = method == null ? "GET" : method;
        path = path == null ? "/" : path;
        queryString = queryString == null ? "" : queryString;
        headers = headers == null ? Map.of() : headers;
        body = body == null ? new byte[0] : body;
    }

    public static InboundCall of(String method, String path, String queryString) {
        return new InboundCall(method, path, queryString, Map.of(), new byte[0]);
    }
}
