package org.poridhi.api.impl;

import org.poridhi.api.interfaces.http.HttpRequest;
import org.poridhi.api.interfaces.http.InboundCall;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class MinimalHttpRequest implements HttpRequest {
    private final String method;
    private final String path;
    private final String queryString;
    private final Map<String, List<String>> multiParams;
    private final Map<String, Object> params;
    private final Map<String, String> headers;
    private final byte[] body;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    public MinimalHttpRequest(String method, String path, String queryString,
                              Map<String, String> headers, byte[] body) {
        this.method = method;
        this.path = path;
        this.queryString = queryString == null ? "" : queryString;
        this.multiParams = QueryStringParser.parseMulti(this.queryString);
        this.params = QueryStringParser.flatten(multiParams);
        this.headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body == null ? new byte[0] : body.clone();
    }

    public static MinimalHttpRequest from(InboundCall call) {
        return new MinimalHttpRequest(call.method(), call.path(), call.queryString(),
                call.headers(), call.body());
    }

    @Override public String method(){ return method; }
    @Override public String path(){ return path; }
    @Override public String queryString(){ return queryString; }
    @Override public Map<String, Object> params(){ return params; }

    @Override
    public String param(String name) {
        List<String> values = multiParams.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    @Override
    public List<String> paramValues(String name) {
        List<String> values = multiParams.get(name);
        return values == null ? List.of() : List.copyOf(values);
    }

    @Override
    public String header(String name){
        if (name == null) return null;
        String v = headers.get(name);
        if (v != null) return v;
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    /** A copy; the request's own bytes never change. */
    @Override public byte[] body() { return body.clone(); }

    @Override
    public Object attribute(String name) {
        return name == null ? null : attributes.get(name);
    }

    @Override
    public void attribute(String name, Object value) {
        if (name == null) return;
        if (value == null) attributes.remove(name);
        else attributes.put(name, value);
    }

    @Override
    public String toString() {
        return method + " " + path + (queryString.isEmpty() ? "" : "?" + queryString);
    }
}
