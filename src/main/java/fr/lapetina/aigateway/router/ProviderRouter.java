package fr.lapetina.aigateway.router;

import fr.lapetina.aigateway.disruptor.RouterEventBus;
import fr.lapetina.aigateway.domain.error.AllProvidersUnavailableException;
import fr.lapetina.aigateway.domain.error.CircuitOpenException;
import fr.lapetina.aigateway.domain.error.ErrorType;
import fr.lapetina.aigateway.domain.error.GatewayException;
import fr.lapetina.aigateway.domain.error.InvalidRequestException;
import fr.lapetina.aigateway.domain.error.ProviderException;
import fr.lapetina.aigateway.domain.error.QueueFullException;
import fr.lapetina.aigateway.domain.error.QueueFullException.QueueFullReason;
import fr.lapetina.aigateway.domain.event.RouterEvent;
import fr.lapetina.aigateway.domain.event.RouterEventListener;
import fr.lapetina.aigateway.domain.event.RouterEventType;
import fr.lapetina.aigateway.domain.model.ChatMessage;
import fr.lapetina.aigateway.domain.model.CircuitState;
import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.CompletionResult;
import fr.lapetina.aigateway.domain.model.ProviderHealth;
import fr.lapetina.aigateway.domain.model.ProviderProfile;
import fr.lapetina.aigateway.domain.model.ProviderSnapshot;
import fr.lapetina.aigateway.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.aigateway.domain.strategy.StrategyFactory;
import fr.lapetina.aigateway.infrastructure.cache.CacheEngine;
import fr.lapetina.aigateway.infrastructure.cache.CacheHit;
import fr.lapetina.aigateway.infrastructure.cache.RequestFingerprinter;
import fr.lapetina.aigateway.infrastructure.config.GatewayConfig;
import fr.lapetina.aigateway.infrastructure.health.HealthMonitor;
import fr.lapetina.aigateway.infrastructure.health.ProviderRegistry;
import fr.lapetina.aigateway.infrastructure.health.ProviderRegistry.ProviderEntry;
import fr.lapetina.aigateway.infrastructure.json.ObjectMappers;
import fr.lapetina.aigateway.infrastructure.ledger.BudgetAlert;
import fr.lapetina.aigateway.infrastructure.ledger.BudgetMode;
import fr.lapetina.aigateway.infrastructure.ledger.BudgetPeriod;
import fr.lapetina.aigateway.infrastructure.ledger.BudgetStatus;
import fr.lapetina.aigateway.infrastructure.ledger.BudgetWindowStatus;
import fr.lapetina.aigateway.infrastructure.ledger.TokenTracker;
import fr.lapetina.aigateway.infrastructure.ledger.UsageRecord;
import fr.lapetina.aigateway.infrastructure.provider.ProviderAdapter;
import fr.lapetina.aigateway.infrastructure.provider.StreamSink;
import fr.lapetina.aigateway.infrastructure.resilience.CircuitBreaker;
import fr.lapetina.aigateway.infrastructure.resilience.ConcurrencyLimiter;
import fr.lapetina.aigateway.infrastructure.resilience.Deadline;
import fr.lapetina.aigateway.infrastructure.resilience.RetryCoordinator;
import fr.lapetina.aigateway.infrastructure.resilience.RetryPolicy;
import fr.lapetina.aigateway.infrastructure.resilience.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point of the gateway: routes completion requests across the registered providers.
 *
 * <p>Per request the router:
 * <ol>
 *   <li>answers from the cache when an exact or similar response is stored,</li>
 *   <li>joins an identical request already in flight instead of calling a provider again,</li>
 *   <li>orders the providers whose circuit accepts calls with the active strategy,</li>
 *   <li>checks the budget against the first candidate's estimated cost,</li>
 *   <li>dispatches to each candidate in turn through the retry coordinator, failing over on
 *       retryable exhaustion and stopping at once on a non-retryable error,</li>
 *   <li>on success records usage, reports to the breaker and writes the response through to the cache.</li>
 * </ol>
 *
 * <p>Every step publishes an event on the {@link RouterEventBus}. Events are observability only and
 * never influence routing.
 */
public final class ProviderRouter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderRouter.class);

    private static final Duration MAINTENANCE_INTERVAL = Duration.ofMinutes(10);

    private final RouterState state;
    private final RetryCoordinator retryCoordinator;
    private final HealthMonitor healthMonitor;
    private final CacheEngine cacheEngine;
    private final RequestFingerprinter fingerprinter;
    private final TokenTracker tokenTracker;
    private final RouterEventBus eventBus;
    private final Clock clock;
    private final Random random;

    private final boolean failoverEnabled;
    private final boolean loadBalancingEnabled;
    private final boolean healthCheckEnabled;
    private final int retentionDays;
    private final Duration requestDeadline;
    private final Duration drainTimeout;

    private final ConcurrentMap<String, CompletableFuture<CompletionResult>> inFlight = new ConcurrentHashMap<>();
    private final AtomicInteger activeRequests = new AtomicInteger();
    private final Object drainLock = new Object();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private volatile ScheduledExecutorService maintenance;

    private ProviderRouter(Builder builder) {
        GatewayConfig config = builder.config;
        this.clock = builder.clock;
        this.random = builder.random;
        this.cacheEngine = builder.cacheEngine;
        this.tokenTracker = builder.tokenTracker;
        this.eventBus = builder.eventBus;
        this.fingerprinter = new RequestFingerprinter(ObjectMappers.create());

        this.failoverEnabled = config.isEnableFailover();
        this.loadBalancingEnabled = config.isEnableLoadBalancing();
        this.healthCheckEnabled = config.getHealthCheck().isEnabled();
        this.retentionDays = config.getBudgets().getRetentionDays();
        this.requestDeadline = Duration.ofMillis(config.getRequest().getDeadlineMs());
        this.drainTimeout = Duration.ofMillis(config.getRequest().getDrainTimeoutMs());

        ProviderRegistry registry = new ProviderRegistry(config.getHealthCheck().getLatencyWindowSize());
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(config.getLoadBalancing().getQueueSize());
        for (Registration registration : builder.registrations) {
            ProviderProfile profile = registration.profile();
            CircuitBreaker breaker = createBreaker(profile.getId(), config, clock);
            breaker.setTransitionListener(this::onCircuitTransition);
            registry.register(registration.adapter(), profile, breaker);
            limiter.register(profile.getId(), profile.getMaxConcurrentRequests());
        }

        LoadBalancingStrategy strategy = StrategyFactory.createOrDefault(
                config.getStrategy(),
                random,
                StrategyFactory.create(StrategyFactory.DEFAULT_STRATEGY, random).orElseThrow()
        );
        this.state = new RouterState(registry, limiter, strategy);

        this.retryCoordinator = new RetryCoordinator(
                RetryPolicy.fromConfig(config.getRetry()),
                limiter,
                builder.sleeper,
                random,
                Duration.ofMillis(config.getRequest().getAttemptTimeoutMs()),
                Duration.ofMillis(config.getLoadBalancing().getTimeoutMs())
        );

        this.healthMonitor = new HealthMonitor(
                registry,
                limiter,
                Duration.ofMillis(config.getHealthCheck().getIntervalMs()),
                Duration.ofMillis(config.getHealthCheck().getTimeoutMs()),
                clock
        );
        healthMonitor.addListener(this::onHealthChecked);

        if (tokenTracker != null) {
            tokenTracker.addAlertListener(this::onBudgetAlert);
        }

        log.info("ProviderRouter created: providers={}, strategy={}, failover={}, cache={}, budget={}",
                registry.size(), strategy.getName(), failoverEnabled,
                cacheEngine != null, tokenTracker != null);
    }

    private static CircuitBreaker createBreaker(String providerId, GatewayConfig config, Clock clock) {
        GatewayConfig.CircuitBreakerConfig cb = config.getCircuitBreaker();
        // A disabled breaker is one that never trips
        int failureThreshold = config.isEnableCircuitBreaker() ? cb.getFailureThreshold() : Integer.MAX_VALUE;
        return new CircuitBreaker(
                providerId,
                failureThreshold,
                cb.getSuccessThreshold(),
                Duration.ofMillis(cb.getTimeoutMs()),
                cb.getHalfOpenRequests(),
                clock
        );
    }

    /**
     * Starts the event bus, the periodic health checks when enabled, and the maintenance task.
     */
    public ProviderRouter start() {
        if (!started.compareAndSet(false, true)) {
            return this;
        }
        eventBus.start();
        if (healthCheckEnabled) {
            healthMonitor.start();
        }
        if (cacheEngine != null || tokenTracker != null) {
            maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "router-maintenance");
                t.setDaemon(true);
                return t;
            });
            maintenance.scheduleAtFixedRate(this::runScheduledMaintenance,
                    MAINTENANCE_INTERVAL.toMillis(), MAINTENANCE_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("ProviderRouter started");
        return this;
    }

    // --- Public API ---

    /**
     * Routes a single prompt.
     *
     * @throws InvalidRequestException if the prompt or an option is invalid
     * @throws GatewayException        if the request could not be served
     */
    public RouteResult route(String prompt, RouteOptions options) {
        if (prompt == null || prompt.isBlank()) {
            throw new InvalidRequestException("Prompt is required");
        }
        RouteOptions opts = options != null ? options : RouteOptions.defaults();
        CompletionRequest request = buildRequest(() -> CompletionRequest.builder()
                .requestId(opts.getRequestId())
                .addMessage(ChatMessage.user(prompt))
                .model(opts.getModel())
                .provider(opts.getProvider())
                .maxTokens(opts.getMaxTokens())
                .temperature(opts.getTemperature())
                .priority(opts.getPriority())
                .createdAt(clock.instant())
                .build());
        return RouteResult.from(complete(request));
    }

    public RouteResult route(String prompt) {
        return route(prompt, RouteOptions.defaults());
    }

    /**
     * Routes a multi-turn conversation.
     *
     * @throws InvalidRequestException if no message is given or an option is invalid
     * @throws GatewayException        if the request could not be served
     */
    public ChatCompletionResult createChatCompletion(ChatCompletionOptions options) {
        Objects.requireNonNull(options, "Options are required");
        CompletionRequest request = buildRequest(() -> CompletionRequest.builder()
                .messages(options.getMessages())
                .model(options.getModel())
                .provider(options.getProvider())
                .maxTokens(options.getMaxTokens())
                .temperature(options.getTemperature())
                .priority(options.getPriority())
                .createdAt(clock.instant())
                .build());
        return ChatCompletionResult.from(complete(request));
    }

    /**
     * Routes a conversation, delivering the answer to {@code onChunk} as it is generated.
     *
     * Failover and retries only happen before the first chunk; once output was delivered a
     * failure is thrown as is. A cached answer is delivered as a single chunk. Identical requests
     * in flight are not shared with a streaming request.
     *
     * @throws InvalidRequestException if no message is given or an option is invalid
     * @throws GatewayException        if the request could not be served
     */
    public ChatCompletionResult createStreamingChatCompletion(ChatCompletionOptions options, Consumer<String> onChunk) {
        Objects.requireNonNull(options, "Options are required");
        Objects.requireNonNull(onChunk, "Chunk consumer is required");
        CompletionRequest request = buildRequest(() -> CompletionRequest.builder()
                .messages(options.getMessages())
                .model(options.getModel())
                .provider(options.getProvider())
                .maxTokens(options.getMaxTokens())
                .temperature(options.getTemperature())
                .priority(options.getPriority())
                .createdAt(clock.instant())
                .build());
        return ChatCompletionResult.from(complete(request, new StreamSink(onChunk)));
    }

    private static CompletionRequest buildRequest(Supplier<CompletionRequest> factory) {
        try {
            return factory.get();
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage(), e);
        }
    }

    /**
     * Routes a canonical request. Used by both public entry points and the HTTP layer.
     */
    public CompletionResult complete(CompletionRequest request) {
        return complete(request, null);
    }

    private CompletionResult complete(CompletionRequest request, StreamSink sink) {
        if (shutdown.get()) {
            throw new IllegalStateException("Router is shut down");
        }
        activeRequests.incrementAndGet();
        state.requestStarted();
        long startNanos = System.nanoTime();
        try {
            CompletionResult result = doComplete(request, startNanos, sink);
            state.requestSucceeded();
            publish(RouterEventType.REQUEST_COMPLETE, request.requestId(), result.provider(), attributes(
                    RouterEvent.MODEL, result.model(),
                    RouterEvent.LATENCY_MS, result.latencyMs(),
                    RouterEvent.CACHED, result.cached(),
                    RouterEvent.INPUT_TOKENS, result.usage().inputTokens(),
                    RouterEvent.OUTPUT_TOKENS, result.usage().outputTokens(),
                    RouterEvent.COST, result.cost()));
            return result;
        } catch (GatewayException e) {
            state.requestFailed();
            String providerId = e instanceof ProviderException pe ? pe.getProviderId() : null;
            publish(RouterEventType.REQUEST_FAILED, request.requestId(), providerId, attributes(
                    RouterEvent.ERROR_TYPE, e.getErrorType().name(),
                    RouterEvent.ERROR, e.getMessage(),
                    RouterEvent.LATENCY_MS, elapsedMs(startNanos)));
            log.warn("Request failed: requestId={}, errorType={}, error={}",
                    request.requestId(), e.getErrorType(), e.getMessage());
            throw e;
        } finally {
            if (activeRequests.decrementAndGet() == 0) {
                synchronized (drainLock) {
                    drainLock.notifyAll();
                }
            }
        }
    }

    /**
     * Last known health of every provider, in registration order.
     */
    public Map<String, ProviderHealth> getProviderHealth() {
        return healthMonitor.getProviderHealth();
    }

    /**
     * Runs one synchronous health check round.
     */
    public Map<String, ProviderHealth> checkHealth() {
        return healthMonitor.checkAll();
    }

    public RouterStats getStats() {
        return state.snapshot(eventBus.getDroppedEvents(), cacheEngine != null ? cacheEngine.getStats() : null);
    }

    /**
     * Budget consumption. Without a ledger every window reads as unlimited and unused.
     */
    public BudgetStatus getBudgetStatus() {
        if (tokenTracker != null) {
            return tokenTracker.getBudgetStatus();
        }
        return new BudgetStatus(
                unlimitedWindow(BudgetPeriod.DAILY),
                unlimitedWindow(BudgetPeriod.MONTHLY),
                BudgetMode.SOFT_WARN
        );
    }

    private static BudgetWindowStatus unlimitedWindow(BudgetPeriod period) {
        return new BudgetWindowStatus(period, BigDecimal.ZERO, null, null, 0.0, false, false);
    }

    public String getStrategyName() {
        return state.getStrategy().getName();
    }

    /**
     * Replaces the load balancing strategy. Takes effect for the next routing decision.
     *
     * @throws IllegalArgumentException if no strategy has that name
     */
    public void setStrategy(String name) {
        LoadBalancingStrategy newStrategy = StrategyFactory.create(name, random)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown strategy: " + name + ", available: " + StrategyFactory.getRegisteredNames()));
        LoadBalancingStrategy previous = state.swapStrategy(newStrategy);
        log.info("Load balancing strategy changed: from={}, to={}", previous.getName(), newStrategy.getName());
        publish(RouterEventType.STRATEGY_CHANGED, null, null, attributes(
                RouterEvent.FROM, previous.getName(),
                RouterEvent.TO, newStrategy.getName()));
    }

    /**
     * Forces a provider's circuit back to CLOSED.
     *
     * @throws IllegalArgumentException if the provider is unknown
     */
    public void resetCircuitBreaker(String providerId) {
        ProviderEntry entry = requireEntry(providerId);
        entry.getCircuitBreaker().reset();
        log.info("Circuit breaker reset: providerId={}", providerId);
    }

    /**
     * Replaces a provider's profile (weight, pricing, priority, concurrency, enabled flag).
     * Applies to the next request.
     *
     * @throws IllegalArgumentException if the provider is unknown
     */
    public void updateProfile(ProviderProfile profile) {
        Objects.requireNonNull(profile, "Profile is required");
        ProviderRegistry registry = state.getRegistry();
        registry.updateProfile(profile);
        state.getLimiter().register(profile.getId(), profile.getMaxConcurrentRequests());
        state.getStrategy().reset();
        log.info("Provider profile updated: {}", profile);
    }

    /**
     * @throws IllegalArgumentException if the provider is unknown
     */
    public CircuitState getCircuitState(String providerId) {
        return requireEntry(providerId).getCircuitBreaker().getState();
    }

    public int getAvailableSlots(String providerId) {
        return state.getLimiter().availableSlots(providerId);
    }

    public int getActiveRequests() {
        return activeRequests.get();
    }

    public void addListener(RouterEventListener listener) {
        eventBus.addListener(listener);
    }

    public void removeListener(RouterEventListener listener) {
        eventBus.removeListener(listener);
    }

    public List<ProviderProfile> getProfiles() {
        return state.getRegistry().getAll().stream().map(ProviderEntry::getProfile).toList();
    }

    /**
     * Purges expired cache entries and ledger rows past retention.
     */
    public void runMaintenance() {
        if (cacheEngine != null) {
            cacheEngine.cleanupExpired();
        }
        if (tokenTracker != null && retentionDays > 0) {
            tokenTracker.purgeOlderThan(Duration.ofDays(retentionDays));
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Stops accepting requests, waits up to the drain timeout for in-flight ones, then closes the
     * health monitor, the stores, the adapters and the event bus. Idempotent.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down ProviderRouter: activeRequests={}", activeRequests.get());
        awaitDrain();

        if (maintenance != null) {
            maintenance.shutdownNow();
        }
        healthMonitor.close();
        if (cacheEngine != null) {
            closeQuietly(cacheEngine, "cache engine");
        }
        if (tokenTracker != null) {
            closeQuietly(tokenTracker, "token tracker");
        }
        for (ProviderEntry entry : state.getRegistry().getAll()) {
            closeQuietly(entry.getAdapter(), "adapter " + entry.getId());
        }
        eventBus.close();
        log.info("ProviderRouter shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    // --- Request protocol ---

    private CompletionResult doComplete(CompletionRequest request, long startNanos, StreamSink sink) {
        Deadline deadline = Deadline.after(requestDeadline, clock);
        if (cacheEngine == null) {
            return dispatch(request, deadline, null, sink);
        }

        String fingerprint = fingerprinter.fingerprint(request);
        Optional<CacheHit> hit = cacheEngine.lookup(request, fingerprint);
        if (hit.isPresent()) {
            CompletionResult cached = serveFromCache(request, hit.get(), startNanos);
            if (sink != null) {
                sink.accept(cached.content());
            }
            return cached;
        }
        if (sink != null) {
            return dispatch(request, deadline, fingerprint, sink);
        }

        CompletableFuture<CompletionResult> own = new CompletableFuture<>();
        CompletableFuture<CompletionResult> leader = inFlight.putIfAbsent(fingerprint, own);
        if (leader != null) {
            return awaitLeader(request, leader, deadline, startNanos);
        }
        try {
            CompletionResult result = dispatch(request, deadline, fingerprint, null);
            own.complete(result);
            return result;
        } catch (RuntimeException e) {
            own.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(fingerprint, own);
        }
    }

    private CompletionResult serveFromCache(CompletionRequest request, CacheHit hit, long startNanos) {
        state.cacheHit();
        CompletionResult cached = hit.entry().response().asCachedFor(request.requestId(), elapsedMs(startNanos));
        publish(RouterEventType.CACHE_HIT, request.requestId(), cached.provider(), attributes(
                RouterEvent.TIER, hit.tier().getName(),
                RouterEvent.SIMILARITY, hit.similarity()));
        log.debug("Served from cache: requestId={}, tier={}, similarity={}",
                request.requestId(), hit.tier().getName(), hit.similarity());
        return cached;
    }

    private CompletionResult awaitLeader(
            CompletionRequest request,
            CompletableFuture<CompletionResult> leader,
            Deadline deadline,
            long startNanos
    ) {
        log.debug("Joining in-flight request: requestId={}", request.requestId());
        try {
            CompletionResult shared = leader.get(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS);
            return shared.asCachedFor(request.requestId(), elapsedMs(startNanos));
        } catch (ExecutionException e) {
            if (e.getCause() instanceof GatewayException ge) {
                throw ge;
            }
            throw new GatewayException(ErrorType.PROVIDER_UNAVAILABLE,
                    "Shared in-flight request failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new GatewayException(ErrorType.TIMEOUT,
                    "Request deadline exceeded while waiting for an identical in-flight request", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(ErrorType.TIMEOUT, "Interrupted while waiting for an identical in-flight request", e);
        }
    }

    private CompletionResult dispatch(CompletionRequest request, Deadline deadline, String fingerprint, StreamSink sink) {
        List<ProviderEntry> candidates = selectCandidates(request);
        publish(RouterEventType.ROUTING_DECISION, request.requestId(), null, attributes(
                RouterEvent.CANDIDATES, candidates.stream().map(ProviderEntry::getId).collect(Collectors.joining(",")),
                RouterEvent.STRATEGY, state.getStrategy().getName()));
        log.debug("Routing decision: requestId={}, candidates={}", request.requestId(),
                candidates.stream().map(ProviderEntry::getId).toList());

        if (candidates.isEmpty()) {
            throw new AllProvidersUnavailableException(List.of(), null);
        }

        boolean budgetWarning = false;
        if (tokenTracker != null) {
            BigDecimal estimate = candidates.get(0).getProfile().estimateCost(request);
            budgetWarning = tokenTracker.checkBudget(estimate, request.priority());
        }

        List<String> attempted = new ArrayList<>();
        GatewayException lastFailure = null;

        for (int i = 0; i < candidates.size(); i++) {
            ProviderEntry entry = candidates.get(i);
            String providerId = entry.getId();
            CircuitBreaker breaker = entry.getCircuitBreaker();

            if (deadline.isExpired()) {
                lastFailure = new ProviderException(providerId, ErrorType.TIMEOUT,
                        "Request deadline exceeded before trying provider");
                break;
            }
            Optional<CircuitBreaker.Permit> permit = breaker.tryAcquirePermission();
            if (permit.isEmpty()) {
                log.debug("Provider skipped, circuit not accepting calls: requestId={}, providerId={}, state={}",
                        request.requestId(), providerId, breaker.getState());
                lastFailure = new CircuitOpenException(providerId);
                continue;
            }

            attempted.add(providerId);
            state.providerAttempted(providerId);
            try {
                CompletionResult result = retryCoordinator.execute(entry.getAdapter(), request, deadline, sink);
                breaker.recordSuccess(permit.get());
                return onSuccess(request, entry, result, budgetWarning, fingerprint);
            } catch (QueueFullException e) {
                if (e.getReason() == QueueFullReason.WAIT_QUEUE_FULL) {
                    throw e;
                }
                log.warn("Provider skipped, no concurrency slot: requestId={}, providerId={}",
                        request.requestId(), providerId);
                lastFailure = e;
            } catch (ProviderException e) {
                breaker.recordFailure(permit.get());
                state.providerFailed(providerId);
                lastFailure = e;
                log.warn("Provider failed: requestId={}, providerId={}, errorType={}, attempts={}, error={}",
                        request.requestId(), providerId, e.getErrorType(), e.getAttempts(), e.getMessage());
                if (!e.isRetryable() || !failoverEnabled || (sink != null && sink.hasEmitted())) {
                    throw e;
                }
                if (i < candidates.size() - 1) {
                    state.failover();
                    publish(RouterEventType.FAILOVER, request.requestId(), providerId, attributes(
                            RouterEvent.FROM, providerId,
                            RouterEvent.TO, candidates.get(i + 1).getId(),
                            RouterEvent.ERROR_TYPE, e.getErrorType().name(),
                            RouterEvent.ATTEMPTS, e.getAttempts()));
                }
            } finally {
                // No-op once the outcome was recorded
                breaker.releasePermission(permit.get());
            }
        }

        throw new AllProvidersUnavailableException(attempted, lastFailure);
    }

    /**
     * Providers eligible for this request, most preferred first. An explicit provider override
     * is placed first; with failover disabled it is the only candidate.
     */
    private List<ProviderEntry> selectCandidates(CompletionRequest request) {
        ProviderRegistry registry = state.getRegistry();
        ProviderEntry override = null;
        if (request.hasProviderOverride()) {
            override = registry.get(request.provider())
                    .orElseThrow(() -> new InvalidRequestException("Unknown provider: " + request.provider()));
            boolean eligible = override.getProfile().isEnabled()
                    && override.getCircuitBreaker().isCallPermitted();
            if (!eligible && !failoverEnabled) {
                GatewayException cause = override.getProfile().isEnabled()
                        ? new CircuitOpenException(override.getId())
                        : new GatewayException(ErrorType.PROVIDER_UNAVAILABLE, "Provider disabled: " + override.getId());
                throw new AllProvidersUnavailableException(List.of(override.getId()), cause);
            }
            if (!failoverEnabled) {
                return List.of(override);
            }
        }

        List<ProviderSnapshot> eligible = new ArrayList<>();
        Map<String, ProviderEntry> byId = new LinkedHashMap<>();
        for (ProviderEntry entry : registry.getEnabled()) {
            if (entry.getCircuitBreaker().isCallPermitted()) {
                eligible.add(entry.snapshot());
                byId.put(entry.getId(), entry);
            }
        }

        List<ProviderSnapshot> ordered = loadBalancingEnabled
                ? state.getStrategy().order(eligible, request)
                : eligible;

        List<ProviderEntry> candidates = new ArrayList<>(ordered.size());
        if (override != null && byId.containsKey(override.getId())) {
            candidates.add(override);
        }
        for (ProviderSnapshot snapshot : ordered) {
            if (override == null || !snapshot.id().equals(override.getId())) {
                candidates.add(byId.get(snapshot.id()));
            }
        }
        if (!failoverEnabled && candidates.size() > 1) {
            return List.of(candidates.get(0));
        }
        return candidates;
    }

    private CompletionResult onSuccess(
            CompletionRequest request,
            ProviderEntry entry,
            CompletionResult providerResult,
            boolean budgetWarning,
            String fingerprint
    ) {
        String providerId = entry.getId();
        ProviderProfile profile = entry.getProfile();
        CompletionResult result = providerResult
                .withCost(TokenTracker.calculateCost(profile, providerResult.model(), providerResult.usage()))
                .withBudgetWarning(budgetWarning);

        entry.getLatencyWindow().record(result.latencyMs());
        state.providerSucceeded(providerId);

        if (tokenTracker != null) {
            try {
                if (tokenTracker.trackUsage(UsageRecord.of(result, clock.instant()))) {
                    publish(RouterEventType.USAGE_TRACKED, request.requestId(), providerId, attributes(
                            RouterEvent.MODEL, result.model(),
                            RouterEvent.INPUT_TOKENS, result.usage().inputTokens(),
                            RouterEvent.OUTPUT_TOKENS, result.usage().outputTokens(),
                            RouterEvent.COST, result.cost()));
                }
            } catch (RuntimeException e) {
                log.error("Failed to record usage: requestId={}, providerId={}", request.requestId(), providerId, e);
            }
        }

        if (cacheEngine != null && fingerprint != null) {
            cacheEngine.store(request, fingerprint, result);
        }

        log.debug("Request served: requestId={}, providerId={}, model={}, latencyMs={}, cost={}",
                request.requestId(), providerId, result.model(), result.latencyMs(), result.cost());
        return result;
    }

    // --- Listeners ---

    private void onCircuitTransition(String providerId, CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            state.circuitTripped();
        }
        publish(RouterEventType.CIRCUIT_STATE_CHANGED, null, providerId, attributes(
                RouterEvent.FROM, from.name(),
                RouterEvent.TO, to.name()));
    }

    private void onBudgetAlert(BudgetAlert alert) {
        log.warn("Budget alert: period={}, consumed={}, limit={}, threshold={}",
                alert.period().getName(), alert.consumed(), alert.limit(), alert.threshold());
        publish(RouterEventType.BUDGET_ALERT, null, null, attributes(
                RouterEvent.PERIOD, alert.period().getName(),
                RouterEvent.CONSUMED, alert.consumed(),
                RouterEvent.LIMIT, alert.limit()));
    }

    private void onHealthChecked(ProviderHealth health) {
        publish(RouterEventType.HEALTH_CHECKED, null, health.providerId(), attributes(
                RouterEvent.HEALTHY, health.healthy(),
                RouterEvent.LATENCY_MS, health.latencyMs(),
                RouterEvent.ERROR, health.lastError()));
    }

    // --- Helpers ---

    private void publish(RouterEventType type, String requestId, String providerId, Map<String, Object> data) {
        eventBus.publish(RouterEvent.of(type, clock.instant(), requestId, providerId, data));
    }

    /**
     * Builds event attributes from key/value pairs, skipping null values.
     */
    private static Map<String, Object> attributes(Object... keyValues) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                data.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return data;
    }

    private ProviderEntry requireEntry(String providerId) {
        return state.getRegistry().get(providerId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + providerId));
    }

    private void runScheduledMaintenance() {
        try {
            runMaintenance();
        } catch (RuntimeException e) {
            log.error("Maintenance run failed", e);
        }
    }

    private void awaitDrain() {
        long deadlineNanos = System.nanoTime() + drainTimeout.toNanos();
        synchronized (drainLock) {
            while (activeRequests.get() > 0) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
                if (remainingMs <= 0) {
                    log.warn("Drain timeout reached: activeRequests={}", activeRequests.get());
                    return;
                }
                try {
                    drainLock.wait(remainingMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while draining: activeRequests={}", activeRequests.get());
                    return;
                }
            }
        }
    }

    private static void closeQuietly(AutoCloseable closeable, String name) {
        try {
            closeable.close();
        } catch (Exception e) {
            log.warn("Error closing {}", name, e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    public static Builder builder() {
        return new Builder();
    }

    private record Registration(ProviderAdapter adapter, ProviderProfile profile) {
    }

    /**
     * Builder for ProviderRouter.
     */
    public static final class Builder {
        private GatewayConfig config = new GatewayConfig();
        private final List<Registration> registrations = new ArrayList<>();
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.SYSTEM;
        private Random random;
        private CacheEngine cacheEngine;
        private TokenTracker tokenTracker;
        private RouterEventBus eventBus;

        private Builder() {
        }

        public Builder config(GatewayConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Registers a provider. Registration order is the tie-breaker of every strategy.
         */
        public Builder adapter(ProviderAdapter adapter, ProviderProfile profile) {
            if (!adapter.getProviderId().equals(profile.getId())) {
                throw new IllegalArgumentException("Adapter " + adapter.getProviderId()
                        + " does not match profile " + profile.getId());
            }
            this.registrations.add(new Registration(adapter, profile));
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        /** Optional; without it every request goes to a provider. */
        public Builder cacheEngine(CacheEngine cacheEngine) {
            this.cacheEngine = cacheEngine;
            return this;
        }

        /** Optional; without it usage is not recorded and budgets are not enforced. */
        public Builder tokenTracker(TokenTracker tokenTracker) {
            this.tokenTracker = tokenTracker;
            return this;
        }

        public Builder eventBus(RouterEventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public ProviderRouter build() {
            Objects.requireNonNull(config, "Config is required");
            Objects.requireNonNull(eventBus, "Event bus is required");
            if (registrations.isEmpty()) {
                throw new IllegalStateException("At least one provider is required");
            }
            if (random == null) {
                Long seed = config.getLoadBalancing().getSeed();
                random = seed != null ? new Random(seed) : new Random();
            }
            return new ProviderRouter(this);
        }
    }
}
