package org.poridhi.app;

import org.poridhi.api.impl.HttpResponseImpl;
import org.poridhi.api.impl.SocketHttpServer;
import org.poridhi.api.impl.WebFramework;
import org.poridhi.api.impl.middleware.LoggingMiddleware;
import org.poridhi.api.impl.middleware.SecurityHeadersMiddleware;
import org.poridhi.api.interfaces.HandlerResult;
import org.poridhi.api.interfaces.IHttpServer;
import org.poridhi.api.interfaces.http.HttpRequest;
import org.poridhi.infrastructure.impl.DirectoryStaticFileResolver;
import org.poridhi.infrastructure.impl.FileTemplateEngine;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/** Demo site: builds the framework, registers the sample pages, serves them. */
public final class PoridhiApplication {

    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final List<String> USERS = List.of("Alice", "Bob", "Charlie");

    private PoridhiApplication() {}

    public static void main(String[] args) throws Exception {
        ServerConfig config = ServerConfig.fromArgs(args);
        System.out.println("[App] " + config);

        WebFramework app = createFramework(config);
        IHttpServer server = new SocketHttpServer(app, config.host, config.maxBodyBytes, config.readTimeoutMs);
        server.start(config.port);
        System.out.println("Poridhi framework running on http://localhost:" + server.port());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (Exception e) {
                System.err.println("[App] shutdown failed: " + e.getMessage());
            } finally {
                stopped.countDown();
            }
        }, "shutdown"));
        stopped.await();
    }

    /** Installs default assets if needed and wires every route and middleware. */
    public static WebFramework createFramework(ServerConfig config) throws IOException {
        DirectoryStaticFileResolver staticFiles =
                new DirectoryStaticFileResolver(config.staticDir, config.staticPrefix).installDefaults();
        FileTemplateEngine templates = new FileTemplateEngine(config.templateDir).installDefaults();

        return WebFramework.builder()
                .use(new LoggingMiddleware())
                .use(new SecurityHeadersMiddleware())
                .staticFiles(staticFiles)
                .templates(templates)
                .escapeErrorMessages(config.escapeErrors)
                .route("/", PoridhiApplication::home)
                .route("/users", PoridhiApplication::users)
                .route("/about", PoridhiApplication::about)
                .route("/user", PoridhiApplication::userInfo)
                .route("/api/data", PoridhiApplication::apiData)
                .route("/features", PoridhiApplication::features)
                .route("/contact", req -> HandlerResult.text("Contact Page"))
                .route("/test", req -> HandlerResult.text("<h1>Test Route</h1><p>Everything works.</p>"))
                .route("/json", req -> HandlerResult.of(new HttpResponseImpl().json(Map.of("message", "Hello JSON"))))
                .route("/echo", PoridhiApplication::echo, "GET", "POST")
                .route("/slow", req -> slowPage(config.slowDelayMs))
                .build();
    }

    /* ------------------------------ pages ------------------------------ */

    static HandlerResult home(HttpRequest req, WebFramework app) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("title", "Home Page");
        ctx.put("site_name", "Poridhi Framework");
        ctx.put("current_time", LocalDateTime.now().format(CLOCK));
        ctx.put("user_count", USERS.size());
        return HandlerResult.text(app.renderTemplate("home.html", ctx));
    }

    static HandlerResult users(HttpRequest req, WebFramework app) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("title", "Users");
        ctx.put("users", USERS);
        ctx.put("user_count", USERS.size());
        return HandlerResult.text(app.renderTemplate("users.html", ctx));
    }

    static HandlerResult about(HttpRequest req, WebFramework app) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("title", "About");
        ctx.put("site_name", "About Our Framework");
        ctx.put("current_time", "Built with Java!");
        ctx.put("user_count", 0);
        return HandlerResult.text(app.renderTemplate("home.html", ctx));
    }

    static HandlerResult userInfo(HttpRequest req) {
        String name = req.param("name");
        String age = req.param("age");
        return HandlerResult.text(
                "<h1>User Information</h1>\n" +
                "<p>Name: " + (name == null ? "Anonymous" : name) + "</p>\n" +
                "<p>Age: " + (age == null ? "Unknown" : age) + "</p>\n" +
                "<p><a href=\"/\">Back to home</a></p>");
    }

    static HandlerResult apiData(HttpRequest req) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", "Hello from our framework API!");
        data.put("method", req.method());
        data.put("path", req.path());
        data.put("params", req.params());
        return HandlerResult.of(new HttpResponseImpl().json(data));
    }

    static HandlerResult features(HttpRequest req) {
        return HandlerResult.text(
                "<!DOCTYPE html>\n" +
                "<html>\n" +
                "<head>\n" +
                "    <title>Features</title>\n" +
                "    <link rel=\"stylesheet\" href=\"/static/style.css\">\n" +
                "</head>\n" +
                "<body>\n" +
                "    <div class=\"container\">\n" +
                "        <div class=\"nav\">\n" +
                "            <a href=\"/\">Home</a>\n" +
                "            <a href=\"/features\">Features</a>\n" +
                "        </div>\n" +
                "        <h1>Framework Features</h1>\n" +
                "        <ul>\n" +
                "            <li>Routing with explicit registration</li>\n" +
                "            <li>Middleware support</li>\n" +
                "            <li>Static file serving</li>\n" +
                "            <li>Basic template rendering</li>\n" +
                "            <li>Request and response objects</li>\n" +
                "        </ul>\n" +
                "    </div>\n" +
                "</body>\n" +
                "</html>\n");
    }

    static HandlerResult echo(HttpRequest req) {
        return HandlerResult.text("<h1>Echo</h1><p>Method: " + req.method() + "</p><p>Body bytes: "
                + req.body().length + "</p>");
    }

    static HandlerResult slowPage(long delayMs) throws InterruptedException {
        Thread.sleep(delayMs);
        return HandlerResult.text("<h1>Slow Page</h1><p>This took " + (delayMs / 1000.0) + " seconds to load.</p>");
    }
}
