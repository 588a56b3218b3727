package org.poridhi.api.impl;

import org.poridhi.api.interfaces.IHttpHandler;

import java.util.Set;

/** One route table entry: exact path, allowed methods, handler. */
final class Route {
    public final String path;
    public final Set<String> methods;   // upper-case, immutable
    public final IHttpHandler handler;

    Route(String path, Set<String> methods, IHttpHandler handler) {
        this.path = path;
        this.methods = Set.copyOf(methods);
        this.handler = handler;
    }

    boolean matches(String requestPath, String method) {
        return path.equals(requestPath) && methods.contains(method);
    }

    boolean sameKey(String otherPath, Set<String> otherMethods) {
        return path.equals(otherPath) && methods.equals(otherMethods);
    }
}
