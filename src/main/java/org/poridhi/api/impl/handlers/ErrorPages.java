package org.poridhi.api.impl.handlers;

import org.poridhi.api.impl.HttpResponseImpl;
import org.poridhi.api.impl.HttpStatus;

/**
 * Fixed bodies for the responses the framework produces on its own.
 * <p>
 * Exception messages go into the 500 body verbatim unless escaping is turned on.
 * Verbatim output reflects whatever the message contains back to the client.
 */
public final class ErrorPages {

    public static final String NOT_FOUND_BODY = "<h1>404 - Page Not Found</h1>";
    public static final String STATIC_NOT_FOUND_BODY = "<h1>404 Not Found</h1><p>Static file not found.</p>";

    private ErrorPages() {}

    public static HttpResponseImpl notFound() {
        return HttpResponseImpl.html(HttpStatus.NOT_FOUND, NOT_FOUND_BODY);
    }

    public static HttpResponseImpl staticNotFound() {
        return HttpResponseImpl.html(HttpStatus.NOT_FOUND, STATIC_NOT_FOUND_BODY);
    }

    public static HttpResponseImpl serverError(Throwable error, boolean escapeMessage) {
        String msg = messageOf(error);
        if (escapeMessage) msg = escapeHtml(msg);
        return HttpResponseImpl.html(HttpStatus.INTERNAL_SERVER_ERROR, "<h1>Error:</h1><p>" + msg + "</p>");
    }

    /** The exception's message, or its class name when it has none. */
    public static String messageOf(Throwable error) {
        if (error == null) return "";
        String msg = error.getMessage();
        return msg != null ? msg : error.getClass().getName();
    }

    public static String escapeHtml(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#x27;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
