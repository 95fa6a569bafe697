package fr.lapetina.aigateway.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.aigateway.api.dto.ApiChatRequest;
import fr.lapetina.aigateway.api.dto.ApiRouteRequest;
import fr.lapetina.aigateway.domain.error.AllProvidersUnavailableException;
import fr.lapetina.aigateway.domain.error.GatewayException;
import fr.lapetina.aigateway.domain.error.ProviderException;
import fr.lapetina.aigateway.domain.model.CircuitState;
import fr.lapetina.aigateway.domain.model.ProviderHealth;
import fr.lapetina.aigateway.domain.strategy.StrategyFactory;
import fr.lapetina.aigateway.infrastructure.config.GatewayConfig;
import fr.lapetina.aigateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.aigateway.router.ChatCompletionResult;
import fr.lapetina.aigateway.router.ProviderRouter;
import fr.lapetina.aigateway.router.RouteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/route - Route a single prompt
 * - POST /v1/chat/completions - Route a conversation (OpenAI chat format)
 * - GET /health - Provider health and circuit states
 * - GET /stats - Router counters
 * - GET /budget - Budget consumption
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /admin/strategy - Current and available strategies
 * - POST /admin/strategy - Change load balancing strategy
 * - POST /admin/circuit/{id}/reset - Close a provider's circuit
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String REQUEST_ID_HEADER = "X-Request-ID";

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final ProviderRouter router;
    private final MetricsRegistry metricsRegistry;

    public HttpServer(
            GatewayConfig.ServerConfig config,
            ProviderRouter router,
            MetricsRegistry metricsRegistry,
            ObjectMapper objectMapper
    ) throws IOException {
        this.router = router;
        this.metricsRegistry = metricsRegistry;
        this.objectMapper = objectMapper;

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(config.getHost(), config.getPort()), config.getBacklog()
        );

        this.executor = Executors.newFixedThreadPool(config.getThreads(), new WorkerThreadFactory());
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/v1/route", new RouteHandler());
        server.createContext("/v1/chat/completions", new ChatCompletionHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/stats", exchange -> handleGet(exchange, router::getStats));
        server.createContext("/budget", exchange -> handleGet(exchange, router::getBudgetStatus));
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured on {}:{}", config.getHost(), getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdownNow();
        log.info("HTTP server stopped");
    }

    // ==================== COMPLETION HANDLERS ====================

    private class RouteHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            handleCompletion(exchange, requestId -> {
                ApiRouteRequest apiRequest = readBody(exchange, ApiRouteRequest.class);
                if (apiRequest.getRequestId() == null) {
                    apiRequest.setRequestId(requestId);
                }
                RouteResult result = router.route(apiRequest.getPrompt(), apiRequest.toRouteOptions());
                MDC.put("provider", result.provider());
                return result;
            });
        }
    }

    private class ChatCompletionHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            handleCompletion(exchange, requestId -> {
                ApiChatRequest apiRequest = readBody(exchange, ApiChatRequest.class);
                ChatCompletionResult result = router.createChatCompletion(apiRequest.toOptions());
                MDC.put("provider", result.provider());
                return result;
            });
        }
    }

    @FunctionalInterface
    private interface CompletionCall {
        Object call(String requestId) throws IOException;
    }

    private void handleCompletion(HttpExchange exchange, CompletionCall call) throws IOException {
        String requestId = exchange.getRequestHeaders().getFirst(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        MDC.put("requestId", requestId);
        try {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            exchange.getResponseHeaders().set(REQUEST_ID_HEADER, requestId);
            sendJson(exchange, 200, call.call(requestId));
        } catch (GatewayException e) {
            sendGatewayError(exchange, e);
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "Malformed JSON body: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, e.getMessage());
        } catch (IllegalStateException e) {
            sendError(exchange, 503, e.getMessage());
        } catch (Exception e) {
            log.error("Error handling completion request", e);
            sendError(exchange, 500, "Internal server error: " + e.getMessage());
        } finally {
            MDC.clear();
        }
    }

    /**
     * HTTP status for a routing failure.
     */
    static int statusFor(GatewayException e) {
        return switch (e.getErrorType()) {
            case VALIDATION -> 400;
            case BUDGET_EXCEEDED -> 402;
            case RATE_LIMIT, QUEUE_FULL -> 429;
            case AUTH, INVALID_RESPONSE -> 502;
            case ALL_PROVIDERS_UNAVAILABLE, PROVIDER_UNAVAILABLE, CIRCUIT_OPEN -> 503;
            case TIMEOUT -> 504;
        };
    }

    private void sendGatewayError(HttpExchange exchange, GatewayException e) throws IOException {
        int status = statusFor(e);
        log.warn("Request failed: status={}, errorType={}, error={}", status, e.getErrorType(), e.getMessage());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("type", e.getErrorType().name());
        if (e instanceof ProviderException pe) {
            body.put("provider", pe.getProviderId());
            body.put("attempts", pe.getAttempts());
        }
        if (e instanceof AllProvidersUnavailableException ae) {
            body.put("attemptedProviders", ae.getAttemptedProviders());
        }
        sendJson(exchange, status, body);
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            Map<String, ProviderHealth> providers = router.getProviderHealth();
            String status = determineOverallHealth(providers);

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", status);
            health.put("timestamp", System.currentTimeMillis());
            health.put("strategy", router.getStrategyName());
            health.put("providers", providers);

            sendJson(exchange, "DOWN".equals(status) ? 503 : 200, health);
        }

        private String determineOverallHealth(Map<String, ProviderHealth> providers) {
            long usable = providers.values().stream()
                    .filter(h -> h.healthy() && h.circuitState() != CircuitState.OPEN)
                    .count();
            if (usable == 0) {
                return "DOWN";
            } else if (usable < providers.size()) {
                return "DEGRADED";
            }
            return "UP";
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/admin/strategy") && "POST".equals(method)) {
                    handleChangeStrategy(exchange);
                } else if (path.equals("/admin/strategy") && "GET".equals(method)) {
                    handleGetStrategy(exchange);
                } else if (path.matches("/admin/circuit/[^/]+/reset") && "POST".equals(method)) {
                    handleResetCircuit(exchange, path);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Malformed JSON body: " + e.getOriginalMessage());
            } catch (Exception e) {
                log.error("Error in admin handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }

        private void handleChangeStrategy(HttpExchange exchange) throws IOException {
            @SuppressWarnings("unchecked")
            Map<String, String> request = readBody(exchange, Map.class);

            String strategyName = request != null ? request.get("strategy") : null;
            if (strategyName == null || strategyName.isBlank()) {
                sendError(exchange, 400, "Missing 'strategy' field");
                return;
            }

            try {
                router.setStrategy(strategyName);
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
                return;
            }
            sendJson(exchange, 200, Map.of(
                    "strategy", strategyName,
                    "message", "Strategy changed successfully"
            ));
        }

        private void handleGetStrategy(HttpExchange exchange) throws IOException {
            sendJson(exchange, 200, Map.of(
                    "current", router.getStrategyName(),
                    "available", StrategyFactory.getRegisteredNames()
            ));
        }

        private void handleResetCircuit(HttpExchange exchange, String path) throws IOException {
            // /admin/circuit/{id}/reset
            String providerId = path.split("/")[3];
            try {
                router.resetCircuitBreaker(providerId);
            } catch (IllegalArgumentException e) {
                sendError(exchange, 404, "Provider not found: " + providerId);
                return;
            }
            sendJson(exchange, 200, Map.of(
                    "provider", providerId,
                    "circuitState", router.getCircuitState(providerId).name()
            ));
        }
    }

    // ==================== HELPER METHODS ====================

    @FunctionalInterface
    private interface BodySupplier {
        Object get();
    }

    private void handleGet(HttpExchange exchange, BodySupplier body) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method Not Allowed");
            return;
        }
        try {
            sendJson(exchange, 200, body.get());
        } catch (RuntimeException e) {
            log.error("Error handling {}", exchange.getRequestURI().getPath(), e);
            sendError(exchange, 500, "Internal server error: " + e.getMessage());
        }
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            return objectMapper.readValue(is, type);
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", String.valueOf(message));
        sendJson(exchange, statusCode, error);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "http-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
