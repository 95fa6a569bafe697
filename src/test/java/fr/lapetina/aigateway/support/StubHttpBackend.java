package fr.lapetina.aigateway.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Local HTTP endpoint answering every request with one scripted response and recording the last request.
 */
public final class StubHttpBackend implements AutoCloseable {

    private final HttpServer server;

    private volatile int status = 200;
    private volatile String responseBody = "{}";
    private volatile Map<String, String> responseHeaders = Map.of();

    private volatile String lastMethod;
    private volatile String lastUri;
    private volatile String lastBody;
    private volatile Map<String, String> lastHeaders = Map.of();

    public StubHttpBackend() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    public StubHttpBackend respond(int status, String body) {
        return respond(status, body, Map.of());
    }

    public StubHttpBackend respond(int status, String body, Map<String, String> headers) {
        this.status = status;
        this.responseBody = body;
        this.responseHeaders = headers;
        return this;
    }

    private void handle(HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            lastBody = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        lastMethod = exchange.getRequestMethod();
        lastUri = exchange.getRequestURI().toString();
        Map<String, String> headers = new HashMap<>();
        exchange.getRequestHeaders().forEach((name, values) -> headers.put(name.toLowerCase(), values.get(0)));
        lastHeaders = headers;

        responseHeaders.forEach((name, value) -> exchange.getResponseHeaders().add(name, value));
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public String getLastMethod() {
        return lastMethod;
    }

    public String getLastUri() {
        return lastUri;
    }

    public String getLastBody() {
        return lastBody;
    }

    /**
     * Header of the last request, by lower-case name.
     */
    public String getLastHeader(String name) {
        return lastHeaders.get(name.toLowerCase());
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
