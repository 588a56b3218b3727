package org.poridhi.infrastructure.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileTemplateEngineTest {

    @TempDir Path tmp;
    FileTemplateEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FileTemplateEngine(tmp);
    }

    private void write(String name, String content) throws IOException {
        Files.writeString(tmp.resolve(name), content, StandardCharsets.UTF_8);
    }

    @Test
    void substitutesVariables() throws IOException {
        write("hello.html", "<p>Hi {{ name }}, you are {{age}}.</p>");
        assertEquals("<p>Hi Ann, you are 30.</p>", engine.render("hello.html", Map.of("name", "Ann", "age", 30)));
    }

    @Test
    void missingKeyLeavesVisiblePlaceholder() {
        assertEquals("a {{ who }} b", engine.renderString("a {{who}} b", Map.of()));
        assertEquals("x {{ who }}", engine.renderString("x {{   who   }}", null));
    }

    @Test
    void nullValueRendersAsNull() {
        Map<String, Object> ctx = new HashMap<>();
        ctx.put("v", null);
        assertEquals("null", engine.renderString("{{ v }}", ctx));
    }

    @Test
    void expandsForLoops() {
        String tpl = "<ul>{% for user in users %}<li>{{ user }}</li>{% endfor %}</ul>";
        assertEquals("<ul><li>Alice</li><li>Bob</li></ul>",
                engine.renderString(tpl, Map.of("users", List.of("Alice", "Bob"))));
        assertEquals("<ul></ul>", engine.renderString(tpl, Map.of("users", List.of())));
    }

    @Test
    void loopsSpanLinesAndAcceptArrays() {
        String tpl = "{% for n in nums %}\n[{{ n }}]\n{% endfor %}";
        assertEquals("\n[1]\n\n[2]\n", engine.renderString(tpl, Map.of("nums", new Integer[]{1, 2})));
    }

    @Test
    void missingListBecomesComment() {
        assertEquals("<!-- List 'items' not found in context -->",
                engine.renderString("{% for i in items %}{{ i }}{% endfor %}", Map.of()));
    }

    @Test
    void replacementTextIsLiteral() {
        assertEquals("cost $1 \\o/", engine.renderString("cost {{ p }}", Map.of("p", "$1 \\o/")));
    }

    @Test
    void missingTemplateIsReportedInline() {
        assertEquals("<h1>Template Error</h1><p>Template 'nope.html' not found</p>", engine.render("nope.html", Map.of()));
        assertTrue(engine.render("../escape.html", Map.of()).contains("not found"));
    }

    @Test
    void bundledDefaultsRenderTogether() throws IOException {
        engine.installDefaults();
        for (String name : FileTemplateEngine.BUNDLED) {
            assertTrue(Files.exists(tmp.resolve(name)), name);
        }
        String users = engine.render("users.html", Map.of("users", List.of("Alice", "Bob", "Charlie"), "user_count", 3));
        assertTrue(users.contains("<li>Alice</li>"));
        assertTrue(users.contains("<li>Charlie</li>"));
        assertTrue(users.contains("Total: 3 users"));

        String page = engine.render("base.html", Map.of("title", "Users", "content", users));
        assertTrue(page.contains("<title>Users</title>"));
        assertTrue(page.contains("<li>Bob</li>"));
    }
}
