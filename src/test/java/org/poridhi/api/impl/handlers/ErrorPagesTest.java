package org.poridhi.api.impl.handlers;

import org.poridhi.api.impl.HttpResponseImpl;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorPagesTest {

    @Test
    void fixedPages() {
        HttpResponseImpl nf = ErrorPages.notFound();
        assertEquals("404 Not Found", nf.statusLine());
        assertEquals("text/html", nf.header("Content-Type"));
        assertEquals("<h1>404 - Page Not Found</h1>", nf.bodyText());

        assertEquals("<h1>404 Not Found</h1><p>Static file not found.</p>", ErrorPages.staticNotFound().bodyText());
    }

    @Test
    void serverErrorEmbedsMessage() {
        HttpResponseImpl res = ErrorPages.serverError(new RuntimeException("x & y"), false);
        assertEquals("500 Internal Server Error", res.statusLine());
        assertEquals("<h1>Error:</h1><p>x & y</p>", res.bodyText());

        HttpResponseImpl escaped = ErrorPages.serverError(new RuntimeException("x & y"), true);
        assertEquals("<h1>Error:</h1><p>x &amp; y</p>", escaped.bodyText());
    }

    @Test
    void escapeHtmlCoversQuotes() {
        assertEquals("&lt;a href=&quot;x&quot; title=&#x27;t&#x27;&gt;", ErrorPages.escapeHtml("<a href=\"x\" title='t'>"));
        assertEquals("plain", ErrorPages.escapeHtml("plain"));
    }

    @Test
    void messageFallsBackToClassName() {
        assertEquals("java.lang.IllegalStateException", ErrorPages.messageOf(new IllegalStateException()));
        assertEquals("m", ErrorPages.messageOf(new Exception("m")));
        assertEquals("", ErrorPages.messageOf(null));
    }
}
