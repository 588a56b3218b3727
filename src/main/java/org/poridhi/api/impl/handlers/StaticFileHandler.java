package org.poridhi.api.impl.handlers;

import org.poridhi.api.impl.HttpResponseImpl;
import org.poridhi.api.interfaces.HandlerResult;
import org.poridhi.api.interfaces.IHttpHandler;
import org.poridhi.api.interfaces.http.HttpRequest;
import org.poridhi.domain.interfaces.IStaticFileResolver;
import org.poridhi.domain.model.StaticFile;

import java.util.Optional;

/** Answers requests under the resolver's URL prefix with file bytes, or the static 404 page. */
public class StaticFileHandler implements IHttpHandler {
    private final IStaticFileResolver resolver;

    public StaticFileHandler(IStaticFileResolver resolver) { this.resolver = resolver; }

    public boolean handles(String path) {
        return resolver.handles(path);
    }

    @Override
    public HandlerResult handle(HttpRequest req) {
        Optional<StaticFile> file = resolver.serve(req.path());
        if (file.isEmpty()) {
            return HandlerResult.of(ErrorPages.staticNotFound());
        }
        HttpResponseImpl res = new HttpResponseImpl();
        res.setHeader(HttpResponseImpl.CONTENT_TYPE, file.get().mimeType);
        res.body(file.get().data);
        return HandlerResult.of(res);
    }
}
