package org.poridhi.api.impl;

import org.poridhi.api.impl.handlers.ErrorPages;
import org.poridhi.api.impl.handlers.StaticFileHandler;
import org.poridhi.api.interfaces.HandlerResult;
import org.poridhi.api.interfaces.IHttpHandler;
import org.poridhi.api.interfaces.IMiddleware;
import org.poridhi.api.interfaces.http.HttpRequest;
import org.poridhi.api.interfaces.http.HttpResponse;
import org.poridhi.api.interfaces.http.InboundCall;
import org.poridhi.domain.interfaces.IStaticFileResolver;
import org.poridhi.domain.interfaces.ITemplateRenderer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The dispatcher. Built once through {@link Builder}; after {@code build()} the
 * route table and middleware list never change, so one instance serves any
 * number of threads.
 * <p>
 * Per call: build the request, run {@code before} hooks, route, run the handler,
 * normalize its result, run {@code after} hooks in reverse. A miss ends in the
 * fixed 404 page and any exception in the 500 page; neither passes through the
 * {@code after} hooks. Nothing thrown inside a call escapes {@link #dispatch}.
 */
public final class WebFramework {

    /** Handler that also gets the framework, for {@link #renderTemplate}. */
    @FunctionalInterface
    public interface TemplatedHandler {
        HandlerResult handle(HttpRequest req, WebFramework app) throws Exception;
    }

    public static final String DEFAULT_BASE_TEMPLATE = "base.html";
    public static final String DEFAULT_TITLE = "My Framework";

    private final RouteTable routes;
    private final MiddlewareChain middleware;
    private final StaticFileHandler staticFiles;   // null when not configured
    private final ITemplateRenderer templates;     // null when not configured
    private final String baseTemplate;
    private final boolean escapeErrorMessages;

    private WebFramework(Builder b) {
        RouteTable table = new RouteTable();
        for (PendingRoute p : b.routes) {
            table.register(p.path, p.bind(this), p.methods);
        }
        this.routes = table.freeze();
        this.middleware = b.middleware.freeze();
        this.staticFiles = b.staticResolver == null ? null : new StaticFileHandler(b.staticResolver);
        this.templates = b.templates;
        this.baseTemplate = b.baseTemplate;
        this.escapeErrorMessages = b.escapeErrorMessages;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Handles one inbound call. Always returns a response. */
    public HttpResponse dispatch(InboundCall call) {
        HttpRequest req = MinimalHttpRequest.from(call);
        try {
            middleware.runBefore(req);

            Optional<IHttpHandler> handler = route(req);
            if (handler.isEmpty()) {
                System.out.println("[Dispatch] " + req + " -> 404");
                return ErrorPages.notFound();
            }

            HttpResponse res = ResponseNormalizer.normalize(handler.get().handle(req));
            return middleware.runAfter(req, res);
        } catch (Exception | Error e) {
            // Errors included, e.g. StackOverflowError from a recursive handler
            System.err.println("[Dispatch] " + req + " failed: " + ErrorPages.messageOf(e));
            return ErrorPages.serverError(e, escapeErrorMessages);
        }
    }

    private Optional<IHttpHandler> route(HttpRequest req) {
        if (staticFiles != null && staticFiles.handles(req.path())) {
            return Optional.of(staticFiles);
        }
        return routes.resolve(req.path(), req.method());
    }

    /**
     * Renders {@code templateName} with {@code context} and wraps the result in the
     * base layout, which receives {@code title} (from the context, else a default)
     * and {@code content}.
     */
    public String renderTemplate(String templateName, Map<String, ?> context) {
        if (templates == null) {
            throw new IllegalStateException("no template renderer configured");
        }
        Map<String, ?> ctx = context == null ? Map.of() : context;
        String content = templates.render(templateName, ctx);

        Map<String, Object> base = new HashMap<>();
        Object title = ctx.get("title");
        base.put("title", title == null ? DEFAULT_TITLE : title);
        base.put("content", content);
        return templates.render(baseTemplate, base);
    }

    public int routeCount() { return routes.size(); }

    public int middlewareCount() { return middleware.size(); }

    public boolean escapesErrorMessages() { return escapeErrorMessages; }

    /* ---------------------------- builder ---------------------------- */

    public static final class Builder {
        private final List<PendingRoute> routes = new ArrayList<>();
        private final MiddlewareChain middleware = new MiddlewareChain();
        private IStaticFileResolver staticResolver;
        private ITemplateRenderer templates;
        private String baseTemplate = DEFAULT_BASE_TEMPLATE;
        private boolean escapeErrorMessages;

        private Builder() {}

        /** GET route. */
        public Builder route(String path, IHttpHandler handler) {
            return route(path, handler, "GET");
        }

        public Builder route(String path, IHttpHandler handler, String... methods) {
            routes.add(new PendingRoute(path, methods(methods), handler, null));
            return this;
        }

        /** GET route whose handler can render templates. */
        public Builder route(String path, TemplatedHandler handler) {
            return route(path, handler, "GET");
        }

        public Builder route(String path, TemplatedHandler handler, String... methods) {
            routes.add(new PendingRoute(path, methods(methods), null, handler));
            return this;
        }

        /** Appends a middleware; the first one added is the outermost. */
        public Builder use(IMiddleware m) {
            middleware.add(m);
            return this;
        }

        public Builder staticFiles(IStaticFileResolver resolver) {
            this.staticResolver = resolver;
            return this;
        }

        public Builder templates(ITemplateRenderer renderer) {
            this.templates = renderer;
            return this;
        }

        public Builder baseTemplate(String name) {
            this.baseTemplate = name;
            return this;
        }

        /** HTML-escape exception messages in 500 pages. Off by default. */
        public Builder escapeErrorMessages(boolean escape) {
            this.escapeErrorMessages = escape;
            return this;
        }

        public WebFramework build() {
            return new WebFramework(this);
        }

        private static Set<String> methods(String... methods) {
            if (methods == null || methods.length == 0) return RouteTable.DEFAULT_METHODS;
            return new LinkedHashSet<>(Arrays.asList(methods));
        }
    }

    private static final class PendingRoute {
        final String path;
        final Set<String> methods;
        final IHttpHandler plain;
        final TemplatedHandler templated;

        PendingRoute(String path, Set<String> methods, IHttpHandler plain, TemplatedHandler templated) {
            if (plain == null && templated == null) {
                throw new IllegalArgumentException("no handler for " + path);
            }
            this.path = path;
            this.methods = methods;
            this.plain = plain;
            this.templated = templated;
        }

        IHttpHandler bind(WebFramework app) {
            if (plain != null) return plain;
            return req -> templated.handle(req, app);
        }
    }
}
