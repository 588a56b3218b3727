package org.poridhi.infrastructure.impl;

import org.poridhi.domain.interfaces.ITemplateRenderer;
import org.poridhi.infrastructure.util.FileAssets;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Template files with two constructs:
 * <ul>
 *   <li>{@code {{ name }}} replaced by the context value; an unknown name stays in the
 *       output as {@code {{ name }}}.</li>
 *   <li>{@code {% for item in items %}...{% endfor %}} repeats its body per element,
 *       replacing {@code {{ item }}}. An unknown list renders as an HTML comment.</li>
 * </ul>
 * Variables are substituted before loops are expanded.
 */
public class FileTemplateEngine implements ITemplateRenderer {

    public static final List<String> BUNDLED = List.of("base.html", "home.html", "users.html");

    private static final Pattern VARIABLE = Pattern.compile("\\{\\{\\s*([^}]+?)\\s*\\}\\}");
    private static final Pattern FOR_LOOP = Pattern.compile(
            "\\{%\\s*for\\s+(\\w+)\\s+in\\s+(\\w+)\\s*%\\}(.*?)\\{%\\s*endfor\\s*%\\}", Pattern.DOTALL);

    private final Path templateDir;

    public FileTemplateEngine(Path templateDir) {
        this.templateDir = templateDir.toAbsolutePath().normalize();
    }

    /** Creates the directory and installs the bundled templates that are not there yet. */
    public FileTemplateEngine installDefaults() throws IOException {
        Files.createDirectories(templateDir);
        for (String name : BUNDLED) {
            if (FileAssets.installIfAbsent("/templates/" + name, templateDir.resolve(name))) {
                System.out.println("[Templates] installed default " + name);
            }
        }
        return this;
    }

    public Path templateDir() { return templateDir; }

    @Override
    public String render(String templateName, Map<String, ?> context) {
        String source;
        try {
            Path file = templateDir.resolve(templateName);
            source = FileAssets.isInside(templateDir, file) ? FileAssets.readUtf8OrNull(file) : null;
        } catch (InvalidPathException e) {
            source = null;
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read template " + templateName, e);
        }
        if (source == null) {
            return "<h1>Template Error</h1><p>Template '" + templateName + "' not found</p>";
        }
        return renderString(source, context);
    }

    /** Applies variable substitution and loop expansion to {@code template}. */
    public String renderString(String template, Map<String, ?> context) {
        Map<String, ?> ctx = context == null ? Map.of() : context;

        String rendered = VARIABLE.matcher(template).replaceAll(m -> {
            String name = m.group(1).trim();
            Object value = ctx.get(name);
            String text = value != null || ctx.containsKey(name) ? String.valueOf(value) : placeholder(name);
            return Matcher.quoteReplacement(text);
        });

        return FOR_LOOP.matcher(rendered).replaceAll(m -> {
            String loopVar = m.group(1);
            String listVar = m.group(2);
            String body = m.group(3);
            if (!ctx.containsKey(listVar)) {
                return Matcher.quoteReplacement("<!-- List '" + listVar + "' not found in context -->");
            }
            StringBuilder out = new StringBuilder();
            String marker = placeholder(loopVar);
            for (Object item : items(ctx.get(listVar))) {
                out.append(body.replace(marker, String.valueOf(item)));
            }
            return Matcher.quoteReplacement(out.toString());
        });
    }

    private static String placeholder(String name) {
        return "{{ " + name + " }}";
    }

    private static Iterable<?> items(Object value) {
        if (value instanceof Iterable) return (Iterable<?>) value;
        if (value instanceof Object[]) return Arrays.asList((Object[]) value);
        List<Object> single = new ArrayList<>();
        if (value != null) single.add(value);
        return single;
    }
}
