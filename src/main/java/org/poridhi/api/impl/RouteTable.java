package org.poridhi.api.impl;

import org.poridhi.api.interfaces.IHttpHandler;
import org.poridhi.api.interfaces.IRouter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Route table keyed by (path, method set). Filled during startup, then frozen;
 * a frozen table is only read, so it is safe to share between request threads.
 */
public class RouteTable implements IRouter {

    public static final Set<String> DEFAULT_METHODS = Set.of("GET");

    private final List<Route> routes;
    private final boolean frozen;

    public RouteTable() {
        this(new ArrayList<>(), false);
    }

    private RouteTable(List<Route> routes, boolean frozen) {
        this.routes = routes;
        this.frozen = frozen;
    }

    public void register(String path, IHttpHandler handler) {
        register(path, handler, DEFAULT_METHODS);
    }

    @Override
    public void register(String path, IHttpHandler handler, Set<String> methods) {
        if (frozen) throw new IllegalStateException("route table is frozen, cannot add " + path);
        if (path == null || path.isBlank()) throw new IllegalArgumentException("route path is blank");
        if (handler == null) throw new IllegalArgumentException("no handler for " + path);
        if (methods == null || methods.isEmpty()) throw new IllegalArgumentException("no methods for " + path);

        Set<String> upper = new LinkedHashSet<>();
        for (String m : methods) {
            if (m == null || m.isBlank()) throw new IllegalArgumentException("blank method name for " + path);
            upper.add(m.trim().toUpperCase(Locale.ROOT));
        }

        Route route = new Route(path, upper, handler);
        for (int i = 0; i < routes.size(); i++) {
            if (routes.get(i).sameKey(path, route.methods)) {
                routes.set(i, route);
                return;
            }
        }
        routes.add(route);
    }

    @Override
    public Optional<IHttpHandler> resolve(String path, String method) {
        if (path == null || method == null) return Optional.empty();
        for (Route r : routes) {
            if (r.matches(path, method)) return Optional.of(r.handler);
        }
        return Optional.empty();
    }

    /** Read-only copy of this table. */
    public RouteTable freeze() {
        return new RouteTable(Collections.unmodifiableList(new ArrayList<>(routes)), true);
    }

    public boolean isFrozen() { return frozen; }

    public int size() { return routes.size(); }
}
