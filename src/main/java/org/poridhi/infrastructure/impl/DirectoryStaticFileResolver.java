package org.poridhi.infrastructure.impl;

import org.poridhi.domain.interfaces.IStaticFileResolver;
import org.poridhi.domain.model.StaticFile;
import org.poridhi.infrastructure.util.FileAssets;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Serves files from one directory under a URL prefix ({@code /static/} by default).
 * Paths that normalize to somewhere outside the directory are treated as missing.
 */
public class DirectoryStaticFileResolver implements IStaticFileResolver {

    public static final String DEFAULT_PREFIX = "/static/";
    public static final String FALLBACK_MIME = "application/octet-stream";

    private static final Map<String, String> MIME_BY_EXT = Map.ofEntries(
            Map.entry("css", "text/css"),
            Map.entry("html", "text/html"),
            Map.entry("htm", "text/html"),
            Map.entry("js", "text/javascript"),
            Map.entry("json", "application/json"),
            Map.entry("txt", "text/plain"),
            Map.entry("xml", "application/xml"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("png", "image/png"),
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("gif", "image/gif"),
            Map.entry("ico", "image/vnd.microsoft.icon"),
            Map.entry("webp", "image/webp"),
            Map.entry("woff", "font/woff"),
            Map.entry("woff2", "font/woff2"),
            Map.entry("pdf", "application/pdf")
    );

    private final Path root;
    private final String urlPrefix;

    public DirectoryStaticFileResolver(Path root) {
        this(root, DEFAULT_PREFIX);
    }

    public DirectoryStaticFileResolver(Path root, String urlPrefix) {
        this.root = root.toAbsolutePath().normalize();
        this.urlPrefix = urlPrefix;
    }

    /** Creates the directory and drops the bundled {@code style.css} into it if missing. */
    public DirectoryStaticFileResolver installDefaults() throws IOException {
        Files.createDirectories(root);
        if (FileAssets.installIfAbsent("/static/style.css", root.resolve("style.css"))) {
            System.out.println("[Static] installed default style.css in " + root);
        }
        return this;
    }

    @Override
    public String urlPrefix() { return urlPrefix; }

    public Path root() { return root; }

    @Override
    public Optional<StaticFile> serve(String path) {
        if (!handles(path)) return Optional.empty();
        String rel = path.substring(urlPrefix.length());
        if (rel.isEmpty()) return Optional.empty();

        Path file;
        try {
            file = root.resolve(rel);
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        if (!FileAssets.isInside(root, file) || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new StaticFile(Files.readAllBytes(file), guessMimeType(file)));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + file, e);
        }
    }

    /** MIME type by extension, then by the platform's detector, else octet-stream. */
    static String guessMimeType(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot >= 0) {
            String known = MIME_BY_EXT.get(name.substring(dot + 1).toLowerCase(Locale.ROOT));
            if (known != null) return known;
        }
        try {
            String probed = Files.probeContentType(file);
            return probed != null ? probed : FALLBACK_MIME;
        } catch (IOException e) {
            return FALLBACK_MIME;
        }
    }
}
