package org.poridhi.app;

import org.poridhi.api.impl.SocketHttpServer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Startup settings. Port comes from the first argument; everything else from
 * system properties ({@code -Dweb.staticDir=...}).
 */
public final class ServerConfig {

    public static final int DEFAULT_PORT = 8000;
    public static final int DEFAULT_MAX_BODY_BYTES = SocketHttpServer.DEFAULT_MAX_BODY_BYTES;
    public static final int DEFAULT_READ_TIMEOUT_MS = SocketHttpServer.DEFAULT_READ_TIMEOUT_MS;

    public final int port;
    public final String host;            // null = all interfaces
    public final Path staticDir;
    public final String staticPrefix;
    public final Path templateDir;
    public final boolean escapeErrors;
    public final long slowDelayMs;
    public final int maxBodyBytes;
    public final int readTimeoutMs;        // 0 = wait forever

    public ServerConfig(int port, String host, Path staticDir, String staticPrefix,
                        Path templateDir, boolean escapeErrors, long slowDelayMs) {
        this(port, host, staticDir, staticPrefix, templateDir, escapeErrors, slowDelayMs,
                DEFAULT_MAX_BODY_BYTES, DEFAULT_READ_TIMEOUT_MS);
    }

    public ServerConfig(int port, String host, Path staticDir, String staticPrefix,
                        Path templateDir, boolean escapeErrors, long slowDelayMs,
                        int maxBodyBytes, int readTimeoutMs) {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (staticPrefix == null || !staticPrefix.startsWith("/") || !staticPrefix.endsWith("/")) {
            throw new IllegalArgumentException("static prefix must start and end with '/': " + staticPrefix);
        }
        this.port = port;
        this.host = host;
        this.staticDir = staticDir;
        this.staticPrefix = staticPrefix;
        this.templateDir = templateDir;
        this.escapeErrors = escapeErrors;
        this.slowDelayMs = Math.max(0L, slowDelayMs);
        if (maxBodyBytes < 0) throw new IllegalArgumentException("max body size is negative: " + maxBodyBytes);
        if (readTimeoutMs < 0) throw new IllegalArgumentException("read timeout is negative: " + readTimeoutMs);
        this.maxBodyBytes = maxBodyBytes;
        this.readTimeoutMs = readTimeoutMs;
    }

    public static ServerConfig fromArgs(String[] args) {
        return fromArgs(args, System.getProperties());
    }

    public static ServerConfig fromArgs(String[] args, Properties props) {
        int port = (args != null && args.length > 0) ? Integer.parseInt(args[0].trim()) : DEFAULT_PORT;
        String host = props.getProperty("web.host");
        return new ServerConfig(
                port,
                host == null || host.isBlank() ? null : host.trim(),
                Paths.get(props.getProperty("web.staticDir", "static")),
                props.getProperty("web.staticPrefix", "/static/"),
                Paths.get(props.getProperty("web.templateDir", "templates")),
                Boolean.parseBoolean(props.getProperty("web.escapeErrors", "false")),
                Long.parseLong(props.getProperty("web.slowDelayMs", "2000").trim()),
                Integer.parseInt(props.getProperty("web.maxBodyBytes", String.valueOf(DEFAULT_MAX_BODY_BYTES)).trim()),
                Integer.parseInt(props.getProperty("web.readTimeoutMs", String.valueOf(DEFAULT_READ_TIMEOUT_MS)).trim()));
    }

    /** Same settings, different directories. Handy for tests. */
    public ServerConfig withDirs(Path staticDir, Path templateDir) {
        return new ServerConfig(port, host, staticDir, staticPrefix, templateDir, escapeErrors, slowDelayMs,
                maxBodyBytes, readTimeoutMs);
    }

    @Override
    public String toString() {
        return "port=" + port + " host=" + (host == null ? "*" : host) + " static=" + staticDir
                + " (" + staticPrefix + ") templates=" + templateDir + " escapeErrors=" + escapeErrors
                + " maxBody=" + maxBodyBytes + " readTimeoutMs=" + readTimeoutMs;
    }
}
