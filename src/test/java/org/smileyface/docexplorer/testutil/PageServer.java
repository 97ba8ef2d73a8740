package org.smileyface.docexplorer.testutil;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Lightweight in-memory HTTP server serving generated pages by path. Unknown paths answer 404.
 * Every requested path is recorded.
 */
public final class PageServer implements AutoCloseable {

    public static final String FILLER = "This paragraph exists so that the page carries enough readable text "
            + "to count as real documentation content rather than an empty application shell.";

    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final Map<String, Response> responses = new ConcurrentHashMap<>();
    private final List<String> requested = Collections.synchronizedList(new ArrayList<>());

    private PageServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/", new PageHandler());
        server.setExecutor(executor);
        server.start();
    }

    public static PageServer start() throws IOException {
        return new PageServer();
    }

    public PageServer page(String path, String html) {
        return respond(path, 200, "text/html; charset=UTF-8", html);
    }

    public PageServer respond(String path, int status, String contentType, String body) {
        responses.put(path, new Response(status, contentType, body, null));
        return this;
    }

    public PageServer redirect(String path, String targetPath) {
        responses.put(path, new Response(302, null, "", targetPath));
        return this;
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public String url(String path) {
        return "http://localhost:" + port() + path;
    }

    public List<String> requestedPaths() {
        synchronized (requested) {
            return List.copyOf(requested);
        }
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    // ----------------- page builders -----------------

    public static String html(String title, String... inner) {
        String head = title == null ? "<head></head>" : "<head><title>" + title + "</title></head>";
        return "<!doctype html><html>" + head + "<body>" + String.join("\n", inner) + "</body></html>";
    }

    /** A page with a main element holding enough text plus the given anchors. */
    public static String article(String title, String... anchors) {
        return html(title, "<main><h1>" + title + "</h1><p>" + FILLER + "</p>" + String.join("\n", anchors) + "</main>");
    }

    public static String link(String href, String text) {
        return "<a href='" + href + "'>" + text + "</a>";
    }

    private record Response(int status, String contentType, String body, String location) {
    }

    private class PageHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            requested.add(path);
            Response response = responses.get(path);
            if (response == null) {
                send(exchange, 404, "text/plain", "Not found");
                return;
            }
            if (response.location() != null) {
                exchange.getResponseHeaders().add("Location", response.location());
            }
            send(exchange, response.status(), response.contentType(), response.body());
        }

        private void send(HttpExchange ex, int code, String contentType, String body) throws IOException {
            if (contentType != null) {
                ex.getResponseHeaders().add("Content-Type", contentType);
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(code, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(bytes); }
        }
    }
}
