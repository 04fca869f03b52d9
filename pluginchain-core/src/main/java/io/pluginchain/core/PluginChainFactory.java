package io.pluginchain.core;

import io.pluginchain.core.chain.ChainBuilder;
import io.pluginchain.core.execution.ChainExecutor;
import io.pluginchain.core.execution.InlineExecutorService;
import io.pluginchain.core.execution.PluginPerformanceTracker;
import io.pluginchain.core.plugin.DefaultPluginRegistry;
import io.pluginchain.core.plugin.PluginRegistry;
import io.pluginchain.core.storage.ChainRunStore;
import io.pluginchain.core.storage.InMemoryChainRunStore;
import io.pluginchain.core.storage.RunArchive;
import io.pluginchain.core.suggest.SuggestionEngine;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Factory for creating fully wired {@link PluginChainEnvironment} instances.
///
/// ### Configuration sources
/// {@link #createEnvironment()} reads `pluginchain.properties` from the classpath when
/// present, then applies `pluginchain.*` system properties on top.
///
/// ### Threads
/// Unless single-threaded mode is configured, the environment owns:
/// - a fixed worker pool of `poolSize` threads that runs plugins
/// - a single-thread scheduler enforcing node timeouts
/// - a cached pool hosting control loops of asynchronously started runs
///
/// All threads are daemons named `pluginchain-*`.
///
/// @see PluginChainConfig for the configuration keys
public final class PluginChainFactory {

    private static final Logger logger = Logger.getLogger(PluginChainFactory.class.getName());

    /// Classpath resource read by {@link #createEnvironment()}.
    public static final String CONFIG_RESOURCE = "pluginchain.properties";

    private PluginChainFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment from classpath and system property configuration.
    ///
    /// @return new environment, never null
    /// @throws UncheckedIOException if the configuration resource cannot be read
    public static PluginChainEnvironment createEnvironment() {
        return createEnvironment(loadConfig());
    }

    /// Creates an environment with a fresh registry and no run archive.
    ///
    /// @param config configuration, not null
    /// @return new environment, never null
    public static PluginChainEnvironment createEnvironment(PluginChainConfig config) {
        return createEnvironment(config, new DefaultPluginRegistry(), null);
    }

    /// Creates an environment around an existing registry.
    ///
    /// @param config configuration, not null
    /// @param registry plugin registry, not null
    /// @param archive destination for cleaned-up runs, may be null
    /// @return new environment, never null
    public static PluginChainEnvironment createEnvironment(
            PluginChainConfig config, PluginRegistry registry, RunArchive archive) {
        List<ExecutorService> ownedPools = new ArrayList<>();
        ExecutorService workers;
        ScheduledExecutorService scheduler = null;
        ExecutorService control;
        if (config.isSingleThreaded()) {
            workers = new InlineExecutorService();
            control = workers;
        } else {
            workers = Executors.newFixedThreadPool(config.getPoolSize(), daemonThreads("pluginchain-worker"));
            scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("pluginchain-timeout"));
            control = Executors.newCachedThreadPool(daemonThreads("pluginchain-control"));
            ownedPools.add(workers);
            ownedPools.add(scheduler);
            ownedPools.add(control);
        }

        PluginPerformanceTracker tracker = new PluginPerformanceTracker(config.getHistorySize());
        ChainRunStore store = new InMemoryChainRunStore(archive, Clock.systemUTC());
        ChainBuilder chainBuilder = new ChainBuilder(registry);
        ChainExecutor executor = ChainExecutor.builder(registry)
                .store(store)
                .performanceTracker(tracker)
                .workers(workers)
                .scheduler(scheduler)
                .controlExecutor(control)
                .defaultNodeTimeout(config.getNodeTimeout())
                .adaptiveThreshold(config.getAdaptiveThreshold())
                .build();
        SuggestionEngine suggestionEngine = new SuggestionEngine(
                registry,
                chainBuilder,
                tracker,
                config.getMaxSuggestions(),
                config.getMaxGoalCandidates(),
                config.getMinScore());

        logger.info(
                "Created plugin chain environment (poolSize=" + config.getPoolSize()
                        + ", singleThreaded=" + config.isSingleThreaded() + ")");
        return new PluginChainEnvironment(
                config, registry, chainBuilder, executor, suggestionEngine, store, tracker, ownedPools);
    }

    /// Loads configuration from `pluginchain.properties` and `pluginchain.*` system properties.
    ///
    /// @return configuration, never null
    /// @throws UncheckedIOException if the configuration resource cannot be read
    public static PluginChainConfig loadConfig() {
        PluginChainConfig config = new PluginChainConfig();
        try (InputStream in = PluginChainFactory.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (in != null) {
                Properties properties = new Properties();
                properties.load(in);
                config.apply(properties);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + CONFIG_RESOURCE, e);
        }
        Properties overrides = new Properties();
        System.getProperties().forEach((key, value) -> {
            if (key.toString().startsWith(PluginChainConfig.PREFIX)) {
                overrides.setProperty(key.toString(), value.toString());
            }
        });
        config.apply(overrides);
        return config;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
