package org.poridhi.api.impl;

import org.poridhi.api.interfaces.http.Header;
import org.poridhi.api.interfaces.http.HttpResponse;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

public final class HttpResponseWriter {

    private HttpResponseWriter() {}

    /**
     * Writes status line, headers and body as HTTP/1.1. Adds {@code Content-Length}
     * and {@code Connection: close} unless the response already carries them.
     */
    public static void write(OutputStream out, HttpResponse res) throws IOException {
        if (res.header("Connection") == null) {
            res.header("Connection", "close");
        }
        if (res.header("Content-Length") == null) {
            res.header("Content-Length", String.valueOf(res.body().length));
        }

        OutputStreamWriter w = new OutputStreamWriter(out, StandardCharsets.ISO_8859_1);

        w.write("HTTP/1.1 " + res.statusLine() + "\r\n");

        for (Header h : res.headers()) {
            w.write(h.name() + ": " + h.value() + "\r\n");
        }

        w.write("\r\n"); // end headers
        w.flush();

        out.write(res.body());
        out.flush();
    }

    /** The exact bytes {@link #write} would send. */
    public static byte[] toBytes(HttpResponse res) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        write(buf, res);
        return buf.toByteArray();
    }
}
