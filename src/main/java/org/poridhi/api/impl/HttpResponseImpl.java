package org.poridhi.api.impl;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.poridhi.api.interfaces.http.Header;
import org.poridhi.api.interfaces.http.HttpResponse;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class HttpResponseImpl implements HttpResponse {
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String TEXT_HTML = "text/html";
    public static final String APPLICATION_JSON = "application/json";

    private static final Gson gson = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    private int status = HttpStatus.OK;
    private String reason = "OK";
    private final List<Header> headers = new ArrayList<>();
    private byte[] body = new byte[0];

    /** 200 OK with {@code Content-Type: text/html} and an empty body. */
    public HttpResponseImpl() {
        headers.add(new Header(CONTENT_TYPE, TEXT_HTML));
    }

    public static HttpResponseImpl html(int code, String html) {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(code, HttpStatus.reason(code));
        res.body(html);
        return res;
    }

    @Override
    public void status(int code, String reason) {
        this.status = code;
        this.reason = reason == null ? HttpStatus.reason(code) : reason;
    }

    /** @throws IllegalArgumentException if {@code name} is null or blank */
    @Override
    public void header(String name, String value) {
        headers.add(checked(name, value));
    }

    @Override
    public void setHeader(String name, String value) {
        Header h = checked(name, value);
        headers.removeIf(old -> old.name().equalsIgnoreCase(name));
        headers.add(h);
    }

    private static Header checked(String name, String value) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("header name is blank");
        return new Header(name, value == null ? "" : value);
    }

    @Override
    public void body(String text) {
        this.body = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void body(byte[] bytes) {
        this.body = bytes == null ? new byte[0] : bytes;
    }

    @Override
    public HttpResponse json(Object data) {
        headers.clear();
        headers.add(new Header(CONTENT_TYPE, APPLICATION_JSON));
        body(gson.toJson(data));
        return this;
    }

    @Override public int statusCode() { return status; }
    @Override public String reason() { return reason; }
    @Override public List<Header> headers() { return headers; }

    @Override
    public String header(String name) {
        for (Header h : headers) {
            if (h.name().equalsIgnoreCase(name)) return h.value();
        }
        return null;
    }

    @Override public byte[] body() { return body; }

    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
