package fr.lapetina.aigateway.infrastructure.config;

import fr.lapetina.aigateway.domain.strategy.StrategyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Configuration loader with hot-reload support.
 *
 * Supports:
 * - Loading from file system, then classpath
 * - Validation of the loaded tree
 * - File watching for automatic reload
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG = "gateway.yaml";

    private final AtomicReference<GatewayConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(GatewayConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public GatewayConfig load() {
        GatewayConfig config = validate(loadFromPath());
        GatewayConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private GatewayConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private GatewayConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private GatewayConfig parse(InputStream is, String source) {
        try {
            GatewayConfig config = yaml.load(is);
            return config != null ? config : new GatewayConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public GatewayConfig loadFromStream(InputStream inputStream) {
        GatewayConfig config = validate(parse(inputStream, "stream"));
        GatewayConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    /**
     * Returns the current configuration.
     */
    public GatewayConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Checks the cross-field rules SnakeYAML cannot express.
     *
     * @return the same configuration
     * @throws ConfigurationException on the first violated rule
     */
    public static GatewayConfig validate(GatewayConfig config) {
        if (StrategyFactory.create(config.getStrategy()).isEmpty()) {
            throw new ConfigurationException("Unknown strategy: " + config.getStrategy()
                    + ". Available: " + StrategyFactory.getRegisteredNames());
        }

        Set<String> ids = new HashSet<>();
        for (GatewayConfig.ProviderConfig provider : config.getProviders()) {
            if (provider.getId() == null || provider.getId().isBlank()) {
                throw new ConfigurationException("Provider without id");
            }
            if (!ids.add(provider.getId())) {
                throw new ConfigurationException("Duplicate provider id: " + provider.getId());
            }
            try {
                provider.resolveKind();
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Provider " + provider.getId() + ": " + e.getMessage(), e);
            }
            if (provider.getWeight() < 0) {
                throw new ConfigurationException("Provider " + provider.getId() + ": weight must be non-negative");
            }
        }

        GatewayConfig.CircuitBreakerConfig breaker = config.getCircuitBreaker();
        requirePositive(breaker.getFailureThreshold(), "circuitBreaker.failureThreshold");
        requirePositive(breaker.getSuccessThreshold(), "circuitBreaker.successThreshold");
        requirePositive(breaker.getHalfOpenRequests(), "circuitBreaker.halfOpenRequests");
        requirePositive(config.getRetry().getMaxRetries(), "retry.maxRetries");
        requirePositive(config.getLoadBalancing().getMaxConcurrentRequests(), "loadBalancing.maxConcurrentRequests");
        requirePositive(config.getRequest().getDeadlineMs(), "request.deadlineMs");

        if (config.getRetry().getBackoffMultiplier() < 1.0) {
            throw new ConfigurationException("retry.backoffMultiplier must be >= 1");
        }
        double alertThreshold = config.getBudgets().getAlertThreshold();
        if (alertThreshold <= 0 || alertThreshold > 1) {
            throw new ConfigurationException("budgets.alertThreshold must be within (0, 1]");
        }
        double similarity = config.getCache().getSimilarity().getThreshold();
        if (similarity <= 0 || similarity > 1) {
            throw new ConfigurationException("cache.similarity.threshold must be within (0, 1]");
        }
        int ringBufferSize = config.getEvents().getRingBufferSize();
        if (Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("events.ringBufferSize must be a power of 2");
        }
        return config;
    }

    private static void requirePositive(long value, String name) {
        if (value <= 0) {
            throw new ConfigurationException(name + " must be positive: " + value);
        }
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent == null) {
                parent = Paths.get(".");
            }
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed.equals(configPath.getFileName())) {
                    // Debounce - check if file actually changed
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload. Keeps the current configuration when the new one is invalid.
     */
    public GatewayConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    /**
     * Adds a listener for configuration changes.
     */
    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a configuration change listener.
     */
    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(GatewayConfig oldConfig, GatewayConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
