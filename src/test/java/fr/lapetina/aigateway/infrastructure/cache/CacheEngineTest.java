package fr.lapetina.aigateway.infrastructure.cache;

import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.CompletionResult;
import fr.lapetina.aigateway.domain.model.TokenUsage;
import fr.lapetina.aigateway.infrastructure.json.ObjectMappers;
import fr.lapetina.aigateway.infrastructure.store.H2Database;
import fr.lapetina.aigateway.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class CacheEngineTest {

    private final RequestFingerprinter fingerprinter = new RequestFingerprinter(ObjectMappers.create());

    private MutableClock clock;
    private String url;
    private CacheEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-10T12:00:00Z");
        url = "jdbc:h2:mem:cache-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        engine = newEngine(true);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private CacheEngine newEngine(boolean similarity) {
        return CacheEngine.builder()
                .store(new CacheStore(H2Database.open(url), ObjectMappers.create()))
                .clock(clock)
                .memoryMaxSize(10)
                .memoryTtl(Duration.ofMinutes(5))
                .entryTtl(Duration.ofHours(1))
                .similarity(similarity, 0.85)
                .build();
    }

    private static CompletionResult result(String provider, String content) {
        return CompletionResult.fromProvider("req-1", provider, "gpt-4o", content,
                new TokenUsage(100, 50), 120, "stop").withCost(new BigDecimal("0.0012"));
    }

    private String put(CompletionRequest request, CompletionResult result) {
        String fingerprint = fingerprinter.fingerprint(request);
        engine.store(request, fingerprint, result);
        return fingerprint;
    }

    @Nested
    @DisplayName("exact tier")
    class ExactTier {

        @Test
        @DisplayName("should miss on an empty cache")
        void shouldMissWhenEmpty() {
            CompletionRequest request = CompletionRequest.ofPrompt("hello");

            assertThat(engine.lookup(request, fingerprinter.fingerprint(request))).isEmpty();
            assertThat(engine.getStats().misses()).isEqualTo(1);
        }

        @Test
        @DisplayName("should serve a stored response from memory")
        void shouldHitMemory() {
            CompletionRequest request = CompletionRequest.ofPrompt("hello");
            String fingerprint = put(request, result("openai", "hi there"));

            Optional<CacheHit> hit = engine.lookup(request, fingerprint);

            assertThat(hit).isPresent();
            assertThat(hit.get().tier()).isEqualTo(CacheTier.MEMORY);
            assertThat(hit.get().entry().response().content()).isEqualTo("hi there");
            assertThat(engine.getHitCount(fingerprint)).isEqualTo(1);
        }

        @Test
        @DisplayName("should serve from the persistent store after restart")
        void shouldSurviveRestart() {
            CompletionRequest request = CompletionRequest.ofPrompt("hello");
            String fingerprint = put(request, result("openai", "hi there"));
            engine.close();

            engine = newEngine(true);
            Optional<CacheHit> hit = engine.lookup(request, fingerprint);

            assertThat(hit).isPresent();
            assertThat(hit.get().tier()).isEqualTo(CacheTier.PERSISTENT);
            assertThat(hit.get().entry().response().cost()).isEqualByComparingTo("0.0012");
            assertThat(hit.get().entry().response().usage()).isEqualTo(new TokenUsage(100, 50));
        }

        @Test
        @DisplayName("should bound the memory tier and serve evicted entries from the store")
        void shouldBoundMemoryTier() {
            List<CompletionRequest> requests = new ArrayList<>();
            List<String> fingerprints = new ArrayList<>();
            for (int i = 0; i < 25; i++) {
                CompletionRequest request = CompletionRequest.ofPrompt("question number " + i);
                requests.add(request);
                fingerprints.add(put(request, result("openai", "answer " + i)));
            }

            engine.cleanupExpired();
            assertThat(engine.getStats().memorySize()).isLessThanOrEqualTo(10);
            assertThat(engine.getStats().persistentSize()).isEqualTo(25);

            int fromStore = 0;
            for (int i = 0; i < requests.size(); i++) {
                Optional<CacheHit> hit = engine.lookup(requests.get(i), fingerprints.get(i));
                assertThat(hit).isPresent();
                assertThat(hit.get().entry().response().content()).isEqualTo("answer " + i);
                if (hit.get().tier() == CacheTier.PERSISTENT) {
                    fromStore++;
                }
            }

            assertThat(fromStore).isGreaterThanOrEqualTo(15);
            engine.cleanupExpired();
            assertThat(engine.getStats().memorySize()).isLessThanOrEqualTo(10);
            assertThat(engine.getStats().misses()).isZero();
        }

        @Test
        @DisplayName("should not serve expired entries")
        void shouldExpire() {
            CompletionRequest request = CompletionRequest.ofPrompt("hello");
            String fingerprint = put(request, result("openai", "hi there"));

            clock.advance(Duration.ofHours(1));

            assertThat(engine.lookup(request, fingerprint)).isEmpty();
            assertThat(engine.cleanupExpired()).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep the first response written for a fingerprint")
        void shouldKeepFirstWriter() {
            CompletionRequest request = CompletionRequest.ofPrompt("hello");
            String fingerprint = fingerprinter.fingerprint(request);

            assertThat(engine.store(request, fingerprint, result("openai", "first"))).isTrue();
            assertThat(engine.store(request, fingerprint, result("anthropic", "second"))).isFalse();

            assertThat(engine.lookup(request, fingerprint).get().entry().response().content()).isEqualTo("first");
        }

        @Test
        @DisplayName("should never write back a cached result")
        void shouldSkipCachedResults() {
            CompletionRequest request = CompletionRequest.ofPrompt("hello");
            CompletionResult cached = result("openai", "hi").asCachedFor("req-2", 1);

            assertThat(engine.store(request, fingerprinter.fingerprint(request), cached)).isFalse();
            assertThat(engine.getStats().writes()).isZero();
        }

        @Test
        @DisplayName("should forget invalidated entries")
        void shouldInvalidate() {
            CompletionRequest request = CompletionRequest.ofPrompt("hello");
            String fingerprint = put(request, result("openai", "hi there"));

            engine.invalidate(fingerprint);

            assertThat(engine.lookup(request, fingerprint)).isEmpty();
        }
    }

    @Nested
    @DisplayName("similarity tier")
    class SimilarityTier {

        @Test
        @DisplayName("should serve a near-identical prompt")
        void shouldMatchSimilarPrompt() {
            put(CompletionRequest.ofPrompt("explain circuit breakers in distributed systems"),
                    result("openai", "a breaker stops calls"));
            CompletionRequest similar = CompletionRequest.ofPrompt("explain circuit breakers in distributed systems please");

            Optional<CacheHit> hit = engine.lookup(similar, fingerprinter.fingerprint(similar));

            assertThat(hit).isPresent();
            assertThat(hit.get().tier()).isEqualTo(CacheTier.SIMILARITY);
            assertThat(hit.get().similarity()).isGreaterThanOrEqualTo(0.85).isLessThan(1.0);
        }

        @Test
        @DisplayName("should miss an unrelated prompt")
        void shouldMissUnrelatedPrompt() {
            put(CompletionRequest.ofPrompt("explain circuit breakers in distributed systems"),
                    result("openai", "a breaker stops calls"));
            CompletionRequest unrelated = CompletionRequest.ofPrompt("how do I bake sourdough bread");

            assertThat(engine.lookup(unrelated, fingerprinter.fingerprint(unrelated))).isEmpty();
        }

        @Test
        @DisplayName("should only match within the same model scope")
        void shouldRespectScope() {
            put(CompletionRequest.ofPrompt("explain circuit breakers in distributed systems"),
                    result("openai", "a breaker stops calls"));
            CompletionRequest otherModel = CompletionRequest.ofPrompt("explain circuit breakers in distributed systems please")
                    .toBuilder().model("claude-4.5-sonnet-20250514").build();

            assertThat(engine.lookup(otherModel, fingerprinter.fingerprint(otherModel))).isEmpty();
        }

        @Test
        @DisplayName("should rebuild the index from the store on startup")
        void shouldReloadIndex() {
            put(CompletionRequest.ofPrompt("explain circuit breakers in distributed systems"),
                    result("openai", "a breaker stops calls"));
            engine.close();
            engine = newEngine(true);
            CompletionRequest similar = CompletionRequest.ofPrompt("explain circuit breakers in distributed systems please");

            assertThat(engine.lookup(similar, fingerprinter.fingerprint(similar)))
                    .hasValueSatisfying(hit -> assertThat(hit.tier()).isEqualTo(CacheTier.SIMILARITY));
        }

        @Test
        @DisplayName("should not match when the similarity tier is disabled")
        void shouldSkipWhenDisabled() {
            engine.close();
            engine = newEngine(false);
            put(CompletionRequest.ofPrompt("explain circuit breakers in distributed systems"),
                    result("openai", "a breaker stops calls"));
            CompletionRequest similar = CompletionRequest.ofPrompt("explain circuit breakers in distributed systems please");

            assertThat(engine.lookup(similar, fingerprinter.fingerprint(similar))).isEmpty();
        }
    }

    @Test
    @DisplayName("should report hit and miss counters")
    void shouldReportStats() {
        CompletionRequest request = CompletionRequest.ofPrompt("hello");
        String fingerprint = put(request, result("openai", "hi there"));
        engine.lookup(request, fingerprint);
        CompletionRequest other = CompletionRequest.ofPrompt("something else entirely");
        engine.lookup(other, fingerprinter.fingerprint(other));

        CacheStats stats = engine.getStats();

        assertThat(stats.memoryHits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.writes()).isEqualTo(1);
        assertThat(stats.persistentSize()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(0.5);
    }
}
