package org.poridhi.api.impl;

import org.poridhi.api.interfaces.HandlerResult;
import org.poridhi.api.interfaces.http.HttpResponse;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ResponseNormalizerTest {

    @Test
    void textBecomesUtf8Html() {
        HttpResponse res = ResponseNormalizer.normalize(HandlerResult.text("héllo"));
        assertEquals("200 OK", res.statusLine());
        assertEquals("text/html", res.header("Content-Type"));
        assertArrayEquals("héllo".getBytes(StandardCharsets.UTF_8), res.body());
    }

    @Test
    void bytesAreUsedAsIs() {
        byte[] raw = {0, 1, 2, (byte) 0xff};
        HttpResponse res = ResponseNormalizer.normalize(HandlerResult.bytes(raw));
        assertEquals(200, res.statusCode());
        assertEquals("text/html", res.header("Content-Type"));
        assertArrayEquals(raw, res.body());
    }

    @Test
    void fullResponsePassesThrough() {
        HttpResponseImpl mine = new HttpResponseImpl();
        mine.status(201, "Created");
        mine.setHeader("Content-Type", "text/plain");
        assertSame(mine, ResponseNormalizer.normalize(HandlerResult.of(mine)));
        assertEquals("text/plain", mine.header("Content-Type"));
    }

    @Test
    void nothingReturnedIsAnError() {
        assertThrows(IllegalStateException.class, () -> ResponseNormalizer.normalize(null));
        assertThrows(IllegalStateException.class, () -> ResponseNormalizer.normalize(HandlerResult.of(null)));
    }
}
