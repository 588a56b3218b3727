package org.poridhi.app;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void defaults() {
        ServerConfig c = ServerConfig.fromArgs(new String[0], new Properties());
        assertEquals(8000, c.port);
        assertNull(c.host);
        assertEquals(Paths.get("static"), c.staticDir);
        assertEquals("/static/", c.staticPrefix);
        assertEquals(Paths.get("templates"), c.templateDir);
        assertFalse(c.escapeErrors);
        assertEquals(2000L, c.slowDelayMs);
        assertEquals(1024 * 1024, c.maxBodyBytes);
        assertEquals(30_000, c.readTimeoutMs);
    }

    @Test
    void argsAndProperties() {
        Properties p = new Properties();
        p.setProperty("web.host", "127.0.0.1");
        p.setProperty("web.staticDir", "/srv/www");
        p.setProperty("web.staticPrefix", "/assets/");
        p.setProperty("web.templateDir", "views");
        p.setProperty("web.escapeErrors", "true");
        p.setProperty("web.slowDelayMs", "10");
        p.setProperty("web.maxBodyBytes", "512");
        p.setProperty("web.readTimeoutMs", "0");

        ServerConfig c = ServerConfig.fromArgs(new String[]{"9090"}, p);
        assertEquals(9090, c.port);
        assertEquals("127.0.0.1", c.host);
        assertEquals(Paths.get("/srv/www"), c.staticDir);
        assertEquals("/assets/", c.staticPrefix);
        assertEquals(Paths.get("views"), c.templateDir);
        assertTrue(c.escapeErrors);
        assertEquals(10L, c.slowDelayMs);
        assertEquals(512, c.maxBodyBytes);
        assertEquals(0, c.readTimeoutMs);
        assertEquals(512, c.withDirs(Paths.get("a"), Paths.get("b")).maxBodyBytes);
    }

    @Test
    void rejectsBadValues() {
        assertThrows(NumberFormatException.class, () -> ServerConfig.fromArgs(new String[]{"http"}, new Properties()));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"70000"}, new Properties()));

        Properties p = new Properties();
        p.setProperty("web.staticPrefix", "static");
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[0], p));

        Properties negative = new Properties();
        negative.setProperty("web.maxBodyBytes", "-1");
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[0], negative));
    }
}
