package org.poridhi.api.impl;

import org.poridhi.api.impl.handlers.ErrorPages;
import org.poridhi.api.interfaces.IHttpServer;
import org.poridhi.api.interfaces.http.HttpResponse;
import org.poridhi.api.interfaces.http.InboundCall;

import java.io.*;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Blocking HTTP/1.1 front end for a {@link WebFramework}: one acceptor thread,
 * one worker thread per connection, one request per connection.
 */
public class SocketHttpServer implements IHttpServer {

    public static final int DEFAULT_MAX_BODY_BYTES = 1024 * 1024;
    public static final int DEFAULT_READ_TIMEOUT_MS = 30_000;

    private static final int CHUNK_BYTES = 8192;
    private static final int DRAIN_TIMEOUT_MS = 200;
    private static final long DRAIN_LIMIT_BYTES = 64 * 1024;

    private final WebFramework app;
    private final String host;
    private final int maxBodyBytes;
    private final int readTimeoutMs;
    private final AtomicLong connections = new AtomicLong();
    private volatile ServerSocket server;
    private Thread acceptor;

    public SocketHttpServer(WebFramework app) {
        this(app, null);
    }

    /** @param host bind address, {@code null} for all interfaces */
    public SocketHttpServer(WebFramework app, String host) {
        this(app, host, DEFAULT_MAX_BODY_BYTES, DEFAULT_READ_TIMEOUT_MS);
    }

    /**
     * @param maxBodyBytes larger declared bodies are answered with 413 without being read
     * @param readTimeoutMs per-read socket timeout, {@code 0} for none
     */
    public SocketHttpServer(WebFramework app, String host, int maxBodyBytes, int readTimeoutMs) {
        if (maxBodyBytes < 0) throw new IllegalArgumentException("max body size is negative: " + maxBodyBytes);
        if (readTimeoutMs < 0) throw new IllegalArgumentException("read timeout is negative: " + readTimeoutMs);
        this.app = app;
        this.host = host;
        this.maxBodyBytes = maxBodyBytes;
        this.readTimeoutMs = readTimeoutMs;
    }

    @Override
    public synchronized void start(int port) throws IOException {
        if (server != null) throw new IllegalStateException("already started on port " + server.getLocalPort());
        ServerSocket ss = new ServerSocket();
        ss.setReuseAddress(true);
        ss.bind(host == null ? new InetSocketAddress(port) : new InetSocketAddress(InetAddress.getByName(host), port));
        server = ss;

        acceptor = new Thread(this::acceptLoop, "http-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        System.out.println("[Server] listening on port " + ss.getLocalPort());
    }

    @Override
    public int port() {
        ServerSocket ss = server;
        return ss == null ? -1 : ss.getLocalPort();
    }

    @Override
    public synchronized void close() throws IOException {
        ServerSocket ss = server;
        if (ss == null) return;
        server = null;
        ss.close();
        System.out.println("[Server] stopped");
    }

    private void acceptLoop() {
        ServerSocket ss = server;
        while (ss != null && !ss.isClosed()) {
            try {
                Socket client = ss.accept();
                Thread worker = new Thread(() -> handle(client), "http-worker-" + connections.incrementAndGet());
                worker.setDaemon(true);
                worker.start();
            } catch (SocketException closed) {
                // close() was called
                return;
            } catch (IOException e) {
                System.err.println("[Server] accept failed: " + e.getMessage());
            }
        }
    }

    /**
     * Reads one request from the socket, dispatches it and writes the answer.
     * The response is rendered to bytes before anything is sent, so a failure
     * while rendering still leaves room for a 500.
     */
    void handle(Socket client) {
        try (client;
             BufferedInputStream bin = new BufferedInputStream(client.getInputStream());
             OutputStream out = client.getOutputStream()) {

            if (readTimeoutMs > 0) client.setSoTimeout(readTimeoutMs);

            byte[] reply;
            try {
                reply = HttpResponseWriter.toBytes(readAndDispatch(bin, out));
            } catch (SocketTimeoutException te) {
                System.err.println("[Server] read timed out after " + readTimeoutMs + " ms");
                reply = HttpResponseWriter.toBytes(HttpResponseImpl.html(HttpStatus.REQUEST_TIMEOUT, "request timed out"));
            } catch (RuntimeException e) {
                System.err.println("[Server] error: " + ErrorPages.messageOf(e));
                reply = HttpResponseWriter.toBytes(ErrorPages.serverError(e, app.escapesErrorMessages()));
            }
            out.write(reply);
            out.flush();
            drainAfterReply(client, bin);

        } catch (SocketException se) {
            String msg = String.valueOf(se.getMessage()).toLowerCase(Locale.ROOT);
            if (!(msg.contains("connection reset") || msg.contains("broken pipe"))) {
                System.err.println("[Server] socket error: " + se.getMessage());
            }
        } catch (IOException e) {
            System.err.println("[Server] error: " + e.getMessage());
        } catch (Exception e) {
            System.err.println("[Server] error: " + e);
        }
    }

    private HttpResponse readAndDispatch(BufferedInputStream bin, OutputStream out) throws IOException {
        String start = readLineAscii(bin); // e.g., "GET /user?name=John HTTP/1.1"
        if (start == null || start.isEmpty()) {
            return HttpResponseImpl.html(HttpStatus.BAD_REQUEST, "empty request line");
        }
        String[] p = start.split(" ", 3);
        String method = p.length > 0 ? p[0] : "";
        String target = p.length > 1 ? p[1] : "/";

        Map<String, String> headers = new LinkedHashMap<>();
        String line;
        while ((line = readLineAscii(bin)) != null && !line.isEmpty()) {
            int idx = line.indexOf(':');
            if (idx > 0) {
                headers.put(line.substring(0, idx).trim().toLowerCase(Locale.ROOT), line.substring(idx + 1).trim());
            }
        }

        long length = contentLength(headers);
        if (length > maxBodyBytes) {
            System.err.println("[Server] " + method + " " + target + " rejected: body of " + length
                    + " bytes exceeds " + maxBodyBytes);
            return HttpResponseImpl.html(HttpStatus.PAYLOAD_TOO_LARGE,
                    "request body exceeds " + maxBodyBytes + " bytes");
        }

        String expect = headers.get("expect");
        if (expect != null && expect.equalsIgnoreCase("100-continue")) {
            OutputStreamWriter w100 = new OutputStreamWriter(out, StandardCharsets.US_ASCII);
            w100.write("HTTP/1.1 100 Continue\r\n\r\n");
            w100.flush();
        }

        byte[] body = readBody(bin, (int) length);
        return app.dispatch(toCall(method, target, headers, body));
    }

    /**
     * Half-closes our side and reads off whatever the client still sends, so
     * unread request bytes do not turn the close into a reset that eats the reply.
     */
    private static void drainAfterReply(Socket client, InputStream in) throws IOException {
        client.shutdownOutput();
        client.setSoTimeout(DRAIN_TIMEOUT_MS);
        byte[] scratch = new byte[4096];
        long drained = 0;
        try {
            int n;
            while (drained < DRAIN_LIMIT_BYTES && (n = in.read(scratch)) > 0) {
                drained += n;
            }
        } catch (SocketTimeoutException te) {
            // client kept its side open; the reply is already out
        }
    }

    /** Splits the request target into a decoded path and the raw query string. */
    static InboundCall toCall(String method, String target, Map<String, String> headers, byte[] body) {
        String rawPath = target;
        String query = "";
        int q = target.indexOf('?');
        if (q >= 0) {
            rawPath = target.substring(0, q);
            query = target.substring(q + 1);
        }
        if (rawPath.isEmpty()) rawPath = "/";
        return new InboundCall(method, QueryStringParser.decode(rawPath, false), query, headers, body);
    }

    /** Declared body length; 0 when absent, negative or unparseable. */
    static long contentLength(Map<String, String> headers) {
        try {
            return Math.max(0L, Long.parseLong(headers.getOrDefault("content-length", "0").trim()));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    /** Reads up to {@code len} bytes in chunks; a short stream yields a short body. */
    private static byte[] readBody(InputStream in, int len) throws IOException {
        ByteArrayOutputStream body = new ByteArrayOutputStream(Math.min(len, CHUNK_BYTES));
        byte[] chunk = new byte[CHUNK_BYTES];
        int remaining = len;
        while (remaining > 0) {
            int n = in.read(chunk, 0, Math.min(chunk.length, remaining));
            if (n < 0) break;
            body.write(chunk, 0, n);
            remaining -= n;
        }
        return body.toByteArray();
    }

    private static String readLineAscii(BufferedInputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int prev = -1, b;
        while ((b = in.read()) != -1) {
            if (prev == '\r' && b == '\n') {
                byte[] bytes = buf.toByteArray();
                int len = Math.max(0, bytes.length - 1);
                return new String(bytes, 0, len, StandardCharsets.ISO_8859_1);
            }
            buf.write(b);
            prev = b;
        }
        return (buf.size() == 0) ? null : buf.toString(StandardCharsets.ISO_8859_1);
    }
}
