package org.poridhi.api.interfaces;

import java.util.Optional;
import java.util.Set;

public interface IRouter {

    /** Adds the route, or overwrites the one registered with the same path and method set. */
    void register(String path, IHttpHandler handler, Set<String> methods);

    /** Exact path match; the method must be in one of the path's registered sets. */
    Optional<IHttpHandler> resolve(String path, String method);
}
