package io.pluginchain.core.execution;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Records node execution durations per plugin and reports rolling statistics.
///
/// Keeps at most `historySize` samples per plugin; older samples are dropped first.
///
/// @implNote Thread-safe. Each plugin's window is guarded by its own deque monitor.
public final class PluginPerformanceTracker {

    /// Default number of samples kept per plugin.
    public static final int DEFAULT_HISTORY_SIZE = 100;

    private final int historySize;
    private final Map<String, Deque<Duration>> samples = new ConcurrentHashMap<>();

    public PluginPerformanceTracker() {
        this(DEFAULT_HISTORY_SIZE);
    }

    /// @param historySize samples kept per plugin, must be positive
    public PluginPerformanceTracker(int historySize) {
        if (historySize <= 0) {
            throw new IllegalArgumentException("historySize must be positive: " + historySize);
        }
        this.historySize = historySize;
    }

    /// Records one execution.
    ///
    /// @param pluginName plugin name, not null
    /// @param duration wall-clock execution time, not null
    public void record(String pluginName, Duration duration) {
        Objects.requireNonNull(pluginName, "pluginName must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
        Deque<Duration> window = samples.computeIfAbsent(pluginName, k -> new ArrayDeque<>());
        synchronized (window) {
            window.addLast(duration);
            while (window.size() > historySize) {
                window.removeFirst();
            }
        }
    }

    /// Returns statistics for a plugin.
    ///
    /// @param pluginName plugin name, not null
    /// @return statistics, or empty if the plugin has never run
    public Optional<PluginPerformance> statsFor(String pluginName) {
        Deque<Duration> window = samples.get(pluginName);
        if (window == null) {
            return Optional.empty();
        }
        List<Duration> copy;
        synchronized (window) {
            copy = List.copyOf(window);
        }
        if (copy.isEmpty()) {
            return Optional.empty();
        }
        Duration total = Duration.ZERO;
        Duration min = copy.get(0);
        Duration max = copy.get(0);
        for (Duration d : copy) {
            total = total.plus(d);
            min = d.compareTo(min) < 0 ? d : min;
            max = d.compareTo(max) > 0 ? d : max;
        }
        return Optional.of(new PluginPerformance(
                pluginName, copy.size(), total.dividedBy(copy.size()), min, max));
    }

    /// Returns the average duration of a plugin, or zero if it has never run.
    public Duration averageFor(String pluginName) {
        return statsFor(pluginName).map(PluginPerformance::average).orElse(Duration.ZERO);
    }

    /// Drops all history for a plugin.
    public void reset(String pluginName) {
        samples.remove(pluginName);
    }
}
