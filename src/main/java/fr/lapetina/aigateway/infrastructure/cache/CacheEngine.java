package fr.lapetina.aigateway.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.CompletionResult;
import fr.lapetina.aigateway.infrastructure.cache.CacheStore.IndexedEmbedding;
import fr.lapetina.aigateway.infrastructure.config.GatewayConfig;
import fr.lapetina.aigateway.infrastructure.json.ObjectMappers;
import fr.lapetina.aigateway.infrastructure.store.H2Database;
import fr.lapetina.aigateway.infrastructure.store.H2Database.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Two-tier response cache with exact and similarity lookup.
 *
 * <p>The H2 store is authoritative. The Caffeine memory tier and the embedding index are derived
 * from it: a write goes to the store first and only then to the derived tiers, so the memory tier
 * never holds an entry the store does not.
 *
 * <p>Lookup order:
 * <ol>
 *   <li>exact fingerprint in memory</li>
 *   <li>exact fingerprint in the store, promoted to memory on hit</li>
 *   <li>nearest unexpired entry of the same model scope whose cosine similarity reaches the
 *       threshold, when the similarity tier is enabled</li>
 * </ol>
 */
public final class CacheEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CacheEngine.class);

    private final CacheStore store;
    private final EmbeddingFunction embedder;
    private final Clock clock;
    private final Duration entryTtl;
    private final boolean similarityEnabled;
    private final double similarityThreshold;

    private final Cache<String, CacheEntry> memory;
    private final Map<String, IndexedEmbedding> embeddingIndex = new ConcurrentHashMap<>();

    private final AtomicLong memoryHits = new AtomicLong();
    private final AtomicLong persistentHits = new AtomicLong();
    private final AtomicLong similarityHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();

    private CacheEngine(Builder builder) {
        this.store = builder.store;
        this.embedder = builder.embedder;
        this.clock = builder.clock;
        this.entryTtl = builder.entryTtl;
        this.similarityEnabled = builder.similarityEnabled;
        this.similarityThreshold = builder.similarityThreshold;

        Clock ticking = builder.clock;
        this.memory = Caffeine.newBuilder()
                .maximumSize(builder.memoryMaxSize)
                .expireAfterWrite(builder.memoryTtl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(ticking.millis()))
                // Evict on the writing thread so the size bound holds once a write returns
                .executor(Runnable::run)
                .build();

        if (similarityEnabled) {
            for (IndexedEmbedding embedding : store.loadEmbeddings(clock.instant())) {
                embeddingIndex.put(embedding.fingerprint(), embedding);
            }
        }

        log.info("Cache engine initialized: memoryMaxSize={}, memoryTtl={}, entryTtl={}, similarityEnabled={}, threshold={}, indexed={}",
                builder.memoryMaxSize, builder.memoryTtl, entryTtl, similarityEnabled,
                similarityThreshold, embeddingIndex.size());
    }

    /**
     * Creates an engine from configuration, opening the persistent store.
     */
    public static CacheEngine create(GatewayConfig.CacheConfig config, Clock clock) {
        H2Database database = H2Database.open(config.getPersistent().getPath());
        return builder()
                .store(new CacheStore(database, ObjectMappers.create()))
                .embedder(new TermFrequencyEmbedder(config.getSimilarity().getDimensions()))
                .clock(clock)
                .memoryMaxSize(config.getMemory().getMaxSize())
                .memoryTtl(Duration.ofMillis(config.getMemory().getTtlMs()))
                .entryTtl(Duration.ofMillis(config.getPersistent().getTtlMs()))
                .similarity(config.getSimilarity().isEnabled(), config.getSimilarity().getThreshold())
                .build();
    }

    /**
     * Looks up a response for the request.
     *
     * A store failure is logged and reported as a miss; the cache never fails a request.
     */
    public Optional<CacheHit> lookup(CompletionRequest request, String fingerprint) {
        Instant now = clock.instant();
        try {
            CacheEntry cached = memory.getIfPresent(fingerprint);
            if (cached != null) {
                if (!cached.isExpired(now)) {
                    return Optional.of(hit(cached, CacheTier.MEMORY, 1.0, memoryHits));
                }
                memory.invalidate(fingerprint);
            }

            Optional<CacheEntry> stored = store.get(fingerprint);
            if (stored.isPresent() && !stored.get().isExpired(now)) {
                memory.put(fingerprint, stored.get());
                return Optional.of(hit(stored.get(), CacheTier.PERSISTENT, 1.0, persistentHits));
            }

            if (similarityEnabled) {
                Optional<CacheHit> similar = findSimilar(request, now);
                if (similar.isPresent()) {
                    return similar;
                }
            }
        } catch (StoreException e) {
            log.warn("Cache lookup failed, treating as miss: fingerprint={}, error={}", fingerprint, e.getMessage());
        }

        misses.incrementAndGet();
        log.debug("Cache miss: fingerprint={}", fingerprint);
        return Optional.empty();
    }

    private Optional<CacheHit> findSimilar(CompletionRequest request, Instant now) {
        String scope = RequestFingerprinter.scopeOf(request);
        float[] query = embedder.embed(RequestFingerprinter.embeddingText(request));

        IndexedEmbedding best = null;
        double bestSimilarity = -1.0;
        for (IndexedEmbedding candidate : embeddingIndex.values()) {
            if (!candidate.scope().equals(scope) || candidate.isExpired(now)) {
                continue;
            }
            double similarity = EmbeddingFunction.cosineSimilarity(query, candidate.vector());
            if (similarity > bestSimilarity) {
                best = candidate;
                bestSimilarity = similarity;
            }
        }
        if (best == null || bestSimilarity < similarityThreshold) {
            return Optional.empty();
        }

        CacheEntry entry = memory.getIfPresent(best.fingerprint());
        if (entry == null) {
            Optional<CacheEntry> stored = store.get(best.fingerprint());
            if (stored.isEmpty() || stored.get().isExpired(now)) {
                embeddingIndex.remove(best.fingerprint());
                return Optional.empty();
            }
            entry = stored.get();
            memory.put(entry.fingerprint(), entry);
        }
        return Optional.of(hit(entry, CacheTier.SIMILARITY, bestSimilarity, similarityHits));
    }

    private CacheHit hit(CacheEntry entry, CacheTier tier, double similarity, AtomicLong counter) {
        store.recordHit(entry.fingerprint());
        counter.incrementAndGet();
        log.debug("Cache hit: fingerprint={}, tier={}, similarity={}", entry.fingerprint(), tier.getName(), similarity);
        return new CacheHit(entry, tier, similarity);
    }

    /**
     * Stores a fresh provider response. Cached results are never written back.
     *
     * @return true if the response was written
     */
    public boolean store(CompletionRequest request, String fingerprint, CompletionResult result) {
        if (result.cached()) {
            return false;
        }
        Instant now = clock.instant();
        float[] embedding = similarityEnabled
                ? embedder.embed(RequestFingerprinter.embeddingText(request))
                : null;
        CacheEntry entry = new CacheEntry(fingerprint, RequestFingerprinter.scopeOf(request),
                embedding, result, now, now.plus(entryTtl));

        try {
            if (!store.putIfAbsentOrExpired(entry, now)) {
                // Keep the derived tiers on the entry that won
                store.get(fingerprint).ifPresent(existing -> memory.put(fingerprint, existing));
                log.debug("Cache entry already present: fingerprint={}", fingerprint);
                return false;
            }
        } catch (StoreException e) {
            log.warn("Cache write failed: fingerprint={}, error={}", fingerprint, e.getMessage());
            return false;
        }

        memory.put(fingerprint, entry);
        if (embedding != null) {
            embeddingIndex.put(fingerprint,
                    new IndexedEmbedding(fingerprint, entry.scope(), embedding, entry.expiresAt()));
        }
        writes.incrementAndGet();
        log.debug("Cache write: fingerprint={}, provider={}, expiresAt={}", fingerprint, result.provider(), entry.expiresAt());
        return true;
    }

    /**
     * Purges expired entries from every tier.
     *
     * @return number of rows deleted from the store
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        int deleted = store.deleteExpired(now);
        embeddingIndex.values().removeIf(embedding -> embedding.isExpired(now));
        memory.asMap().values().removeIf(entry -> entry.isExpired(now));
        memory.cleanUp();
        if (deleted > 0) {
            log.info("Expired cache entries purged: count={}", deleted);
        }
        return deleted;
    }

    public void invalidate(String fingerprint) {
        store.delete(fingerprint);
        memory.invalidate(fingerprint);
        embeddingIndex.remove(fingerprint);
    }

    public void clear() {
        int deleted = store.clear();
        memory.invalidateAll();
        embeddingIndex.clear();
        log.info("Cache cleared: deleted={}", deleted);
    }

    public CacheStats getStats() {
        long persistentSize;
        try {
            persistentSize = store.count();
        } catch (StoreException e) {
            log.warn("Cannot count persistent cache entries: {}", e.getMessage());
            persistentSize = -1;
        }
        return new CacheStats(
                memoryHits.get(),
                persistentHits.get(),
                similarityHits.get(),
                misses.get(),
                writes.get(),
                memory.estimatedSize(),
                persistentSize
        );
    }

    public long getHitCount(String fingerprint) {
        return store.getHitCount(fingerprint);
    }

    @Override
    public void close() {
        memory.invalidateAll();
        embeddingIndex.clear();
        store.close();
        log.info("Cache engine closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CacheStore store;
        private EmbeddingFunction embedder = new TermFrequencyEmbedder(512);
        private Clock clock = Clock.systemUTC();
        private int memoryMaxSize = 500;
        private Duration memoryTtl = Duration.ofHours(1);
        private Duration entryTtl = Duration.ofHours(24);
        private boolean similarityEnabled = true;
        private double similarityThreshold = 0.85;

        private Builder() {
        }

        public Builder store(CacheStore store) {
            this.store = store;
            return this;
        }

        public Builder embedder(EmbeddingFunction embedder) {
            this.embedder = embedder;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder memoryMaxSize(int memoryMaxSize) {
            this.memoryMaxSize = memoryMaxSize;
            return this;
        }

        public Builder memoryTtl(Duration memoryTtl) {
            this.memoryTtl = memoryTtl;
            return this;
        }

        public Builder entryTtl(Duration entryTtl) {
            this.entryTtl = entryTtl;
            return this;
        }

        public Builder similarity(boolean enabled, double threshold) {
            this.similarityEnabled = enabled;
            this.similarityThreshold = threshold;
            return this;
        }

        public CacheEngine build() {
            if (store == null) {
                throw new IllegalStateException("Cache store is required");
            }
            return new CacheEngine(this);
        }
    }
}
