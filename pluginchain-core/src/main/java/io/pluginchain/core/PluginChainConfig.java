package io.pluginchain.core;

import io.pluginchain.core.execution.ChainExecutor;
import io.pluginchain.core.execution.PluginPerformanceTracker;
import io.pluginchain.core.suggest.SuggestionEngine;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;

/// Configuration options for the plugin chain environment.
///
/// Controls worker pool sizing, node timeouts, the adaptive promotion threshold,
/// performance history and suggestion limits. Use the {@link Builder} for fluent
/// configuration, {@link #fromProperties(Properties)} for `pluginchain.*` keys, or the
/// setters for mutable configuration.
///
/// ### Default Values
/// | Key | Default |
/// |-----|---------|
/// | `pluginchain.executor.pool-size` | `8` |
/// | `pluginchain.executor.node-timeout` | `PT5M` |
/// | `pluginchain.executor.adaptive-threshold` | `2` |
/// | `pluginchain.executor.single-threaded` | `false` |
/// | `pluginchain.performance.history-size` | `100` |
/// | `pluginchain.suggest.max-suggestions` | `5` |
/// | `pluginchain.suggest.max-goal-candidates` | `10` |
/// | `pluginchain.suggest.min-score` | `0.1` |
///
/// @implNote **Not thread-safe**. Configure before passing to {@link PluginChainFactory};
/// do not modify after environment creation.
///
/// @see PluginChainFactory#createEnvironment(PluginChainConfig)
public class PluginChainConfig {

    public static final String PREFIX = "pluginchain.";
    public static final String POOL_SIZE = "pluginchain.executor.pool-size";
    public static final String NODE_TIMEOUT = "pluginchain.executor.node-timeout";
    public static final String ADAPTIVE_THRESHOLD = "pluginchain.executor.adaptive-threshold";
    public static final String SINGLE_THREADED = "pluginchain.executor.single-threaded";
    public static final String HISTORY_SIZE = "pluginchain.performance.history-size";
    public static final String MAX_SUGGESTIONS = "pluginchain.suggest.max-suggestions";
    public static final String MAX_GOAL_CANDIDATES = "pluginchain.suggest.max-goal-candidates";
    public static final String MIN_SCORE = "pluginchain.suggest.min-score";

    private int poolSize = 8;
    private Duration nodeTimeout = ChainExecutor.DEFAULT_NODE_TIMEOUT;
    private int adaptiveThreshold = ChainExecutor.DEFAULT_ADAPTIVE_THRESHOLD;
    private boolean singleThreaded;
    private int historySize = PluginPerformanceTracker.DEFAULT_HISTORY_SIZE;
    private int maxSuggestions = SuggestionEngine.DEFAULT_MAX_SUGGESTIONS;
    private int maxGoalCandidates = SuggestionEngine.DEFAULT_MAX_GOAL_CANDIDATES;
    private double minScore = SuggestionEngine.DEFAULT_MIN_SCORE;

    /// Creates a configuration with default values.
    public PluginChainConfig() {}

    /// Creates a configuration from `pluginchain.*` properties; absent keys keep defaults.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a present value cannot be parsed
    public static PluginChainConfig fromProperties(Properties properties) {
        PluginChainConfig config = new PluginChainConfig();
        config.apply(properties);
        return config;
    }

    /// Overrides settings with any `pluginchain.*` keys present in the properties.
    ///
    /// @param properties source properties, not null
    /// @throws IllegalArgumentException if a present value cannot be parsed
    public void apply(Properties properties) {
        String value;
        if ((value = properties.getProperty(POOL_SIZE)) != null) {
            poolSize = parseInt(POOL_SIZE, value);
        }
        if ((value = properties.getProperty(NODE_TIMEOUT)) != null) {
            try {
                nodeTimeout = Duration.parse(value.trim());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(
                        NODE_TIMEOUT + " must be an ISO-8601 duration but was '" + value + "'", e);
            }
        }
        if ((value = properties.getProperty(ADAPTIVE_THRESHOLD)) != null) {
            adaptiveThreshold = parseInt(ADAPTIVE_THRESHOLD, value);
        }
        if ((value = properties.getProperty(SINGLE_THREADED)) != null) {
            singleThreaded = Boolean.parseBoolean(value.trim());
        }
        if ((value = properties.getProperty(HISTORY_SIZE)) != null) {
            historySize = parseInt(HISTORY_SIZE, value);
        }
        if ((value = properties.getProperty(MAX_SUGGESTIONS)) != null) {
            maxSuggestions = parseInt(MAX_SUGGESTIONS, value);
        }
        if ((value = properties.getProperty(MAX_GOAL_CANDIDATES)) != null) {
            maxGoalCandidates = parseInt(MAX_GOAL_CANDIDATES, value);
        }
        if ((value = properties.getProperty(MIN_SCORE)) != null) {
            try {
                minScore = Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        MIN_SCORE + " must be a number but was '" + value + "'", e);
            }
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer but was '" + value + "'", e);
        }
    }

    /// Returns the worker pool size for parallel node execution.
    ///
    /// @return number of worker threads
    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    /// Returns the timeout applied to nodes whose run options set none.
    ///
    /// @return default node timeout, never null
    public Duration getNodeTimeout() {
        return nodeTimeout;
    }

    public void setNodeTimeout(Duration nodeTimeout) {
        this.nodeTimeout = nodeTimeout;
    }

    /// Returns the ready-set size that promotes an `ADAPTIVE` run to a parallel wave.
    ///
    /// @return adaptive threshold
    public int getAdaptiveThreshold() {
        return adaptiveThreshold;
    }

    public void setAdaptiveThreshold(int adaptiveThreshold) {
        this.adaptiveThreshold = adaptiveThreshold;
    }

    /// Returns whether nodes run inline on the control thread instead of a pool.
    ///
    /// @return `true` for single-threaded simulation
    public boolean isSingleThreaded() {
        return singleThreaded;
    }

    public void setSingleThreaded(boolean singleThreaded) {
        this.singleThreaded = singleThreaded;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }

    public int getMaxSuggestions() {
        return maxSuggestions;
    }

    public void setMaxSuggestions(int maxSuggestions) {
        this.maxSuggestions = maxSuggestions;
    }

    public int getMaxGoalCandidates() {
        return maxGoalCandidates;
    }

    public void setMaxGoalCandidates(int maxGoalCandidates) {
        this.maxGoalCandidates = maxGoalCandidates;
    }

    public double getMinScore() {
        return minScore;
    }

    public void setMinScore(double minScore) {
        this.minScore = minScore;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link PluginChainConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final PluginChainConfig config = new PluginChainConfig();

        public Builder poolSize(int poolSize) {
            config.poolSize = poolSize;
            return this;
        }

        public Builder nodeTimeout(Duration nodeTimeout) {
            config.nodeTimeout = nodeTimeout;
            return this;
        }

        public Builder adaptiveThreshold(int adaptiveThreshold) {
            config.adaptiveThreshold = adaptiveThreshold;
            return this;
        }

        /// Enables single-threaded simulation: plugins run inline on the control thread
        /// and timeouts are checked after each plugin returns.
        ///
        /// @param singleThreaded `true` to run inline
        /// @return this builder for chaining, never null
        public Builder singleThreaded(boolean singleThreaded) {
            config.singleThreaded = singleThreaded;
            return this;
        }

        public Builder historySize(int historySize) {
            config.historySize = historySize;
            return this;
        }

        public Builder maxSuggestions(int maxSuggestions) {
            config.maxSuggestions = maxSuggestions;
            return this;
        }

        public Builder maxGoalCandidates(int maxGoalCandidates) {
            config.maxGoalCandidates = maxGoalCandidates;
            return this;
        }

        public Builder minScore(double minScore) {
            config.minScore = minScore;
            return this;
        }

        /// Builds and returns the configured instance.
        ///
        /// @return the configured instance, never null
        public PluginChainConfig build() {
            return config;
        }
    }
}
