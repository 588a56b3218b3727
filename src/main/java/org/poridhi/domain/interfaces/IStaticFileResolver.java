package org.poridhi.domain.interfaces;

import org.poridhi.domain.model.StaticFile;

import java.util.Optional;

public interface IStaticFileResolver {

    /** URL prefix this resolver answers for, e.g. {@code /static/}. */
    String urlPrefix();

    Optional<StaticFile> serve(String path);

    default boolean handles(String path) {
        return path != null && path.startsWith(urlPrefix());
    }
}
