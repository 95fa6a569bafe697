package fr.lapetina.aigateway.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.aigateway.api.HttpServer;
import fr.lapetina.aigateway.domain.error.ErrorType;
import fr.lapetina.aigateway.domain.model.CircuitState;
import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.CompletionResult;
import fr.lapetina.aigateway.domain.model.ProviderProfile;
import fr.lapetina.aigateway.infrastructure.config.GatewayConfig;
import fr.lapetina.aigateway.router.ProviderRouter;
import fr.lapetina.aigateway.router.RouteResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of a router wired from test-gateway.yaml, with stub providers.
 *
 * The in-memory cache and ledger databases live for the whole JVM, so every test uses its own prompts.
 */
class GatewayIntegrationTest {

    private TestRouterFactory factory;
    private ProviderRouter router;

    @BeforeEach
    void setUp() {
        factory = TestRouterFactory.create();
        router = factory.getRouter();
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private static String uniquePrompt(String text) {
        return text + " " + UUID.randomUUID();
    }

    @Test
    @DisplayName("should wire every configured provider with its pricing")
    void shouldWireProviders() {
        assertThat(router.getProfiles()).extracting(ProviderProfile::getId).containsExactly("openai", "anthropic");
        assertThat(router.getStrategyName()).isEqualTo("round-robin");
        assertThat(router.getAvailableSlots("openai")).isEqualTo(4);
        assertThat(router.getProfiles().get(1).getWeight()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("should alternate providers with round-robin")
    void shouldAlternateProviders() {
        Set<String> providers = new HashSet<>();
        for (int i = 0; i < 4; i++) {
            providers.add(router.route(uniquePrompt("Hello " + i)).provider());
        }

        assertThat(providers).containsExactlyInAnyOrder("openai", "anthropic");
    }

    @Test
    @DisplayName("should price results from configured model pricing")
    void shouldPriceResults() {
        factory.stub("openai").alwaysFail(ErrorType.PROVIDER_UNAVAILABLE);

        CompletionResult result = router.complete(CompletionRequest.ofPrompt(uniquePrompt("Price me")));

        assertThat(result.provider()).isEqualTo("anthropic");
        // 100 input at 3.0/M plus 50 output at 15.0/M
        assertThat(result.cost()).isEqualByComparingTo("0.00105");
        assertThat(router.getBudgetStatus().daily().used()).isGreaterThanOrEqualTo(result.cost());
    }

    @Test
    @DisplayName("should serve a repeated prompt from cache")
    void shouldServeFromCache() {
        String prompt = uniquePrompt("Cache me");

        RouteResult first = router.route(prompt);
        RouteResult second = router.route(prompt);

        assertThat(first.cached()).isFalse();
        assertThat(second.cached()).isTrue();
        assertThat(second.response()).isEqualTo(first.response());
        assertThat(factory.stub("openai").getCallCount() + factory.stub("anthropic").getCallCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should open the circuit of a provider that keeps failing")
    void shouldOpenCircuit() {
        factory.stub("openai").alwaysFail(ErrorType.PROVIDER_UNAVAILABLE);

        for (int i = 0; i < 6; i++) {
            assertThat(router.route(uniquePrompt("Trip " + i)).provider()).isEqualTo("anthropic");
        }

        assertThat(router.getCircuitState("openai")).isEqualTo(CircuitState.OPEN);
        assertThat(router.getStats().circuitTrips()).isEqualTo(1);
    }

    @Test
    @DisplayName("should expose provider metrics")
    void shouldExposeMetrics() {
        router.route(uniquePrompt("Metrics"));

        String scrape = factory.getMetricsRegistry().scrape();

        assertThat(scrape).contains("test_gateway_circuit_state").contains("test_gateway_active_requests");
    }

    @Nested
    @DisplayName("over HTTP")
    class OverHttp {

        private HttpServer server;
        private HttpClient client;
        private ObjectMapper mapper;

        @BeforeEach
        void startServer() throws Exception {
            GatewayConfig.ServerConfig serverConfig = new GatewayConfig.ServerConfig();
            serverConfig.setHost("127.0.0.1");
            serverConfig.setPort(0);
            serverConfig.setThreads(2);
            mapper = factory.getObjectMapper();
            server = new HttpServer(serverConfig, router, factory.getMetricsRegistry(), mapper);
            server.start();
            client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
        }

        @AfterEach
        void stopServer() {
            server.close();
        }

        private HttpResponse<String> get(String path) throws Exception {
            return client.send(HttpRequest.newBuilder(uri(path)).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> post(String path, String body) throws Exception {
            return client.send(HttpRequest.newBuilder(uri(path))
                            .header("Content-Type", "application/json")
                            .header("X-Request-ID", "it-" + UUID.randomUUID())
                            .POST(HttpRequest.BodyPublishers.ofString(body))
                            .build(),
                    HttpResponse.BodyHandlers.ofString());
        }

        private URI uri(String path) {
            return URI.create("http://127.0.0.1:" + server.getPort() + path);
        }

        @Test
        @DisplayName("should route a prompt")
        void shouldRoutePrompt() throws Exception {
            HttpResponse<String> response = post("/v1/route",
                    "{\"prompt\":\"" + uniquePrompt("Route over http") + "\",\"provider\":\"anthropic\"}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("X-Request-ID")).hasValueSatisfying(id -> assertThat(id).startsWith("it-"));
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.get("provider").asText()).isEqualTo("anthropic");
            assertThat(body.get("response").asText()).isEqualTo("answer from anthropic");
            assertThat(body.get("tokens").get("output").asInt()).isEqualTo(50);
        }

        @Test
        @DisplayName("should route a chat conversation")
        void shouldRouteChat() throws Exception {
            HttpResponse<String> response = post("/v1/chat/completions",
                    "{\"messages\":[{\"role\":\"system\",\"content\":\"Be brief.\"},"
                            + "{\"role\":\"user\",\"content\":\"" + uniquePrompt("Chat") + "\"}],\"max_tokens\":64}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.get("content").asText()).startsWith("answer from ");
            assertThat(body.get("usage").get("inputTokens").asInt()).isEqualTo(100);
        }

        @Test
        @DisplayName("should answer 400 for an invalid request")
        void shouldRejectInvalidRequest() throws Exception {
            assertThat(post("/v1/route", "{\"prompt\":\"\"}").statusCode()).isEqualTo(400);
            assertThat(post("/v1/route", "{not json").statusCode()).isEqualTo(400);
            assertThat(post("/v1/route", "{\"prompt\":\"hi\",\"priority\":\"urgent\"}").statusCode()).isEqualTo(400);
            assertThat(get("/v1/route").statusCode()).isEqualTo(405);
        }

        @Test
        @DisplayName("should answer 503 with attempted providers when every provider fails")
        void shouldReportAllProvidersUnavailable() throws Exception {
            factory.stub("openai").alwaysFail(ErrorType.PROVIDER_UNAVAILABLE);
            factory.stub("anthropic").alwaysFail(ErrorType.TIMEOUT);

            HttpResponse<String> response = post("/v1/route", "{\"prompt\":\"" + uniquePrompt("Doomed") + "\"}");

            assertThat(response.statusCode()).isEqualTo(503);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.get("type").asText()).isEqualTo("ALL_PROVIDERS_UNAVAILABLE");
            assertThat(body.get("attemptedProviders")).hasSize(2);
        }

        @Test
        @DisplayName("should report health, stats and budget")
        void shouldReportStatus() throws Exception {
            HttpResponse<String> health = get("/health");
            assertThat(health.statusCode()).isEqualTo(200);
            assertThat(mapper.readTree(health.body()).get("status").asText()).isEqualTo("UP");

            post("/v1/route", "{\"prompt\":\"" + uniquePrompt("Count me") + "\"}");
            JsonNode stats = mapper.readTree(get("/stats").body());
            assertThat(stats.get("totalRequests").asLong()).isEqualTo(1);
            assertThat(stats.get("providers").has("openai")).isTrue();

            JsonNode budget = mapper.readTree(get("/budget").body());
            assertThat(budget.get("daily").get("limit").decimalValue()).isEqualByComparingTo("100");

            HttpResponse<String> metrics = get("/metrics");
            assertThat(metrics.statusCode()).isEqualTo(200);
            assertThat(metrics.body()).contains("test_gateway_");
        }

        @Test
        @DisplayName("should change strategy and reset circuits through admin endpoints")
        void shouldAdminister() throws Exception {
            HttpResponse<String> changed = post("/admin/strategy", "{\"strategy\":\"cost-based\"}");
            assertThat(changed.statusCode()).isEqualTo(200);
            assertThat(router.getStrategyName()).isEqualTo("cost-based");

            assertThat(post("/admin/strategy", "{\"strategy\":\"telepathic\"}").statusCode()).isEqualTo(400);
            assertThat(post("/admin/strategy", "{}").statusCode()).isEqualTo(400);

            JsonNode strategies = mapper.readTree(get("/admin/strategy").body());
            assertThat(strategies.get("current").asText()).isEqualTo("cost-based");
            assertThat(strategies.get("available")).hasSize(5);

            HttpResponse<String> reset = post("/admin/circuit/openai/reset", "");
            assertThat(reset.statusCode()).isEqualTo(200);
            assertThat(mapper.readTree(reset.body()).get("circuitState").asText()).isEqualTo("CLOSED");
            assertThat(post("/admin/circuit/nobody/reset", "").statusCode()).isEqualTo(404);
            assertThat(get("/admin/unknown").statusCode()).isEqualTo(404);
        }
    }
}
