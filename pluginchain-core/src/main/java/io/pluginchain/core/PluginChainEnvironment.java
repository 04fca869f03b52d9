package io.pluginchain.core;

import io.pluginchain.core.chain.ChainBuilder;
import io.pluginchain.core.execution.ChainExecutor;
import io.pluginchain.core.execution.PluginPerformanceTracker;
import io.pluginchain.core.plugin.PluginRegistry;
import io.pluginchain.core.storage.ChainRunStore;
import io.pluginchain.core.suggest.SuggestionEngine;
import java.util.List;
import java.util.concurrent.ExecutorService;

/// Container holding every wired component of the plugin chain engine.
///
/// Created by {@link PluginChainFactory}. Owns the thread pools it was built with and
/// shuts them down on {@link #close()}.
///
/// ### Usage
/// {@snippet :
/// try (PluginChainEnvironment env = PluginChainFactory.createEnvironment()) {
///     env.getPluginRegistry().register(new SourcePlugin());
///     Chain chain = env.getChainBuilder().buildChain(Goal.of("data/raw"));
///     ChainRun run = env.getChainExecutor().runChain(chain, ExecutionMode.PARALLEL);
/// }
/// }
///
/// @implNote Thread-safe. All components are themselves thread-safe.
public final class PluginChainEnvironment implements AutoCloseable {

    private final PluginChainConfig config;
    private final PluginRegistry pluginRegistry;
    private final ChainBuilder chainBuilder;
    private final ChainExecutor chainExecutor;
    private final SuggestionEngine suggestionEngine;
    private final ChainRunStore runStore;
    private final PluginPerformanceTracker performanceTracker;
    private final List<ExecutorService> ownedPools;

    PluginChainEnvironment(
            PluginChainConfig config,
            PluginRegistry pluginRegistry,
            ChainBuilder chainBuilder,
            ChainExecutor chainExecutor,
            SuggestionEngine suggestionEngine,
            ChainRunStore runStore,
            PluginPerformanceTracker performanceTracker,
            List<ExecutorService> ownedPools) {
        this.config = config;
        this.pluginRegistry = pluginRegistry;
        this.chainBuilder = chainBuilder;
        this.chainExecutor = chainExecutor;
        this.suggestionEngine = suggestionEngine;
        this.runStore = runStore;
        this.performanceTracker = performanceTracker;
        this.ownedPools = List.copyOf(ownedPools);
    }

    public PluginChainConfig getConfig() {
        return config;
    }

    public PluginRegistry getPluginRegistry() {
        return pluginRegistry;
    }

    public ChainBuilder getChainBuilder() {
        return chainBuilder;
    }

    public ChainExecutor getChainExecutor() {
        return chainExecutor;
    }

    public SuggestionEngine getSuggestionEngine() {
        return suggestionEngine;
    }

    public ChainRunStore getRunStore() {
        return runStore;
    }

    public PluginPerformanceTracker getPerformanceTracker() {
        return performanceTracker;
    }

    @Override
    public void close() {
        ownedPools.forEach(ExecutorService::shutdown);
    }
}
