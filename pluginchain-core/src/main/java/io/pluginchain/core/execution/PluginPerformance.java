package io.pluginchain.core.execution;

import java.time.Duration;

/// Execution-time statistics of one plugin over its recent history.
///
/// @param pluginName plugin name
/// @param executionCount number of samples in the window
/// @param average mean duration
/// @param min shortest duration
/// @param max longest duration
public record PluginPerformance(
        String pluginName, int executionCount, Duration average, Duration min, Duration max) {}
