package org.poridhi.api.interfaces.http;

import java.util.List;

/** Minimal response contract */
public interface HttpResponse {
    void status(int code, String reason);

    /** Appends a header; duplicates are kept. */
    void header(String name, String value);

    /** Replaces every header with this name by a single one. */
    void setHeader(String name, String value);

    void body(String text);
    void body(byte[] bytes);

    /** Serializes {@code data} as the JSON body and sets {@code Content-Type: application/json}. */
    HttpResponse json(Object data);

    int statusCode();
    String reason();

    /** e.g. {@code "200 OK"} */
    default String statusLine() {
        return statusCode() + " " + reason();
    }

    List<Header> headers();

    /** First value of the named header (case-insensitive), or {@code null}. */
    String header(String name);

    byte[] body();
}
