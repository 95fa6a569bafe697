package fr.lapetina.aigateway.infrastructure.config;

import fr.lapetina.aigateway.domain.model.ProviderKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the gateway.
 * Designed to be populated from YAML.
 */
public class GatewayConfig {

    private String strategy = "cost-based";
    private boolean enableFailover = true;
    private boolean enableLoadBalancing = true;
    private boolean enableCircuitBreaker = true;

    private ServerConfig server = new ServerConfig();
    private List<ProviderConfig> providers = new ArrayList<>();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private RetryConfig retry = new RetryConfig();
    private LoadBalancingConfig loadBalancing = new LoadBalancingConfig();
    private RequestConfig request = new RequestConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private CacheConfig cache = new CacheConfig();
    private BudgetConfig budgets = new BudgetConfig();
    private EventsConfig events = new EventsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }

    public boolean isEnableFailover() { return enableFailover; }
    public void setEnableFailover(boolean enableFailover) { this.enableFailover = enableFailover; }

    public boolean isEnableLoadBalancing() { return enableLoadBalancing; }
    public void setEnableLoadBalancing(boolean enableLoadBalancing) { this.enableLoadBalancing = enableLoadBalancing; }

    public boolean isEnableCircuitBreaker() { return enableCircuitBreaker; }
    public void setEnableCircuitBreaker(boolean enableCircuitBreaker) { this.enableCircuitBreaker = enableCircuitBreaker; }

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public LoadBalancingConfig getLoadBalancing() { return loadBalancing; }
    public void setLoadBalancing(LoadBalancingConfig loadBalancing) { this.loadBalancing = loadBalancing; }

    public RequestConfig getRequest() { return request; }
    public void setRequest(RequestConfig request) { this.request = request; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public BudgetConfig getBudgets() { return budgets; }
    public void setBudgets(BudgetConfig budgets) { this.budgets = budgets; }

    public EventsConfig getEvents() { return events; }
    public void setEvents(EventsConfig events) { this.events = events; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private boolean enabled = true;
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int threads = 32;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * One backend provider.
     */
    public static class ProviderConfig {
        private String id;
        private String kind;
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl;
        private int priority = 100;
        private double weight = 1.0;
        private String defaultModel;
        private List<ModelConfig> models = new ArrayList<>();
        private int maxConcurrentRequests = 0;
        private long requestTimeoutMs = 0;

        // Vertex
        private String project;
        private String region = "us-central1";

        // Copilot (Azure OpenAI)
        private String deployment;
        private String apiVersion = "2024-06-01";

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getKind() { return kind; }
        public void setKind(String kind) { this.kind = kind; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public double getWeight() { return weight; }
        public void setWeight(double weight) { this.weight = weight; }

        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }

        public List<ModelConfig> getModels() { return models; }
        public void setModels(List<ModelConfig> models) { this.models = models; }

        /** 0 means use {@code loadBalancing.maxConcurrentRequests}. */
        public int getMaxConcurrentRequests() { return maxConcurrentRequests; }
        public void setMaxConcurrentRequests(int maxConcurrentRequests) { this.maxConcurrentRequests = maxConcurrentRequests; }

        /** 0 means use {@code request.attemptTimeoutMs}. */
        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public String getProject() { return project; }
        public void setProject(String project) { this.project = project; }

        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }

        public String getDeployment() { return deployment; }
        public void setDeployment(String deployment) { this.deployment = deployment; }

        public String getApiVersion() { return apiVersion; }
        public void setApiVersion(String apiVersion) { this.apiVersion = apiVersion; }

        /**
         * Returns the API key, resolving a {@code ${ENV_VAR}} reference from the environment.
         */
        public String resolveApiKey() {
            return EnvironmentResolver.resolve(apiKey);
        }

        public String resolveBaseUrl() {
            return EnvironmentResolver.resolve(baseUrl);
        }

        public String resolveProject() {
            return EnvironmentResolver.resolve(project);
        }

        /**
         * Returns the backend kind; defaults to the id when {@code kind} is omitted.
         */
        public ProviderKind resolveKind() {
            return ProviderKind.fromName(kind != null ? kind : id);
        }
    }

    /**
     * Pricing of one model, in USD per million tokens.
     */
    public static class ModelConfig {
        private String name;
        private double inputPerMillion;
        private double outputPerMillion;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public double getInputPerMillion() { return inputPerMillion; }
        public void setInputPerMillion(double inputPerMillion) { this.inputPerMillion = inputPerMillion; }

        public double getOutputPerMillion() { return outputPerMillion; }
        public void setOutputPerMillion(double outputPerMillion) { this.outputPerMillion = outputPerMillion; }
    }

    /**
     * Per-provider circuit breaker settings.
     */
    public static class CircuitBreakerConfig {
        private int failureThreshold = 5;
        private int successThreshold = 2;
        private long timeoutMs = 60_000;
        private int halfOpenRequests = 3;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public int getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(int successThreshold) { this.successThreshold = successThreshold; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getHalfOpenRequests() { return halfOpenRequests; }
        public void setHalfOpenRequests(int halfOpenRequests) { this.halfOpenRequests = halfOpenRequests; }
    }

    /**
     * Retry policy. {@code maxRetries} is the maximum number of attempts per provider per request.
     */
    public static class RetryConfig {
        private int maxRetries = 3;
        private long initialDelayMs = 1000;
        private long maxDelayMs = 10_000;
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.2;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getInitialDelayMs() { return initialDelayMs; }
        public void setInitialDelayMs(long initialDelayMs) { this.initialDelayMs = initialDelayMs; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }

        public double getJitterFactor() { return jitterFactor; }
        public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }
    }

    /**
     * Concurrency limits and the seed of randomized strategies.
     */
    public static class LoadBalancingConfig {
        private int maxConcurrentRequests = 10;
        private int queueSize = 100;
        private long timeoutMs = 120_000;
        private Long seed;

        public int getMaxConcurrentRequests() { return maxConcurrentRequests; }
        public void setMaxConcurrentRequests(int maxConcurrentRequests) { this.maxConcurrentRequests = maxConcurrentRequests; }

        public int getQueueSize() { return queueSize; }
        public void setQueueSize(int queueSize) { this.queueSize = queueSize; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public Long getSeed() { return seed; }
        public void setSeed(Long seed) { this.seed = seed; }
    }

    /**
     * Per-request time bounds.
     */
    public static class RequestConfig {
        private long deadlineMs = 120_000;
        private long attemptTimeoutMs = 60_000;
        private long connectTimeoutMs = 10_000;
        private long drainTimeoutMs = 30_000;

        public long getDeadlineMs() { return deadlineMs; }
        public void setDeadlineMs(long deadlineMs) { this.deadlineMs = deadlineMs; }

        public long getAttemptTimeoutMs() { return attemptTimeoutMs; }
        public void setAttemptTimeoutMs(long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getDrainTimeoutMs() { return drainTimeoutMs; }
        public void setDrainTimeoutMs(long drainTimeoutMs) { this.drainTimeoutMs = drainTimeoutMs; }
    }

    /**
     * Health monitoring configuration.
     */
    public static class HealthCheckConfig {
        private boolean enabled = true;
        private long intervalMs = 60_000;
        private long timeoutMs = 10_000;
        private int latencyWindowSize = 100;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getLatencyWindowSize() { return latencyWindowSize; }
        public void setLatencyWindowSize(int latencyWindowSize) { this.latencyWindowSize = latencyWindowSize; }
    }

    /**
     * Response cache configuration.
     */
    public static class CacheConfig {
        private boolean enabled = true;
        private MemoryTierConfig memory = new MemoryTierConfig();
        private PersistentTierConfig persistent = new PersistentTierConfig();
        private SimilarityConfig similarity = new SimilarityConfig();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public MemoryTierConfig getMemory() { return memory; }
        public void setMemory(MemoryTierConfig memory) { this.memory = memory; }

        public PersistentTierConfig getPersistent() { return persistent; }
        public void setPersistent(PersistentTierConfig persistent) { this.persistent = persistent; }

        public SimilarityConfig getSimilarity() { return similarity; }
        public void setSimilarity(SimilarityConfig similarity) { this.similarity = similarity; }
    }

    public static class MemoryTierConfig {
        private int maxSize = 500;
        private long ttlMs = 3_600_000;

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }

        public long getTtlMs() { return ttlMs; }
        public void setTtlMs(long ttlMs) { this.ttlMs = ttlMs; }
    }

    public static class PersistentTierConfig {
        /** File path of the H2 database, or a full {@code jdbc:h2:} URL. */
        private String path = "./data/gateway-cache";
        private long ttlMs = 86_400_000;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public long getTtlMs() { return ttlMs; }
        public void setTtlMs(long ttlMs) { this.ttlMs = ttlMs; }
    }

    public static class SimilarityConfig {
        private boolean enabled = true;
        private double threshold = 0.85;
        private int dimensions = 512;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }

        public int getDimensions() { return dimensions; }
        public void setDimensions(int dimensions) { this.dimensions = dimensions; }
    }

    /**
     * Spend limits in USD. A null limit means unlimited.
     */
    public static class BudgetConfig {
        private Double daily;
        private Double monthly;
        private double alertThreshold = 0.8;
        private String mode = "hard-stop";
        private String zone = "UTC";
        /** File path of the H2 ledger database, or a full {@code jdbc:h2:} URL. */
        private String ledgerPath = "./data/gateway-ledger";
        private int retentionDays = 90;

        public Double getDaily() { return daily; }
        public void setDaily(Double daily) { this.daily = daily; }

        public Double getMonthly() { return monthly; }
        public void setMonthly(Double monthly) { this.monthly = monthly; }

        public double getAlertThreshold() { return alertThreshold; }
        public void setAlertThreshold(double alertThreshold) { this.alertThreshold = alertThreshold; }

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }

        public String getZone() { return zone; }
        public void setZone(String zone) { this.zone = zone; }

        public String getLedgerPath() { return ledgerPath; }
        public void setLedgerPath(String ledgerPath) { this.ledgerPath = ledgerPath; }

        public int getRetentionDays() { return retentionDays; }
        public void setRetentionDays(int retentionDays) { this.retentionDays = retentionDays; }
    }

    /**
     * Event bus (Disruptor) configuration.
     */
    public static class EventsConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "ai_gateway";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
