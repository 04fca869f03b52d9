package io.pluginchain.core.execution;

import java.time.Duration;
import java.util.Map;

/// Outcome of one node invocation, posted back to the run's control loop.
record NodeCompletion(
        String nodeId, Map<String, Object> output, ExecutionError error, Duration elapsed) {

    static NodeCompletion succeeded(String nodeId, Map<String, Object> output, Duration elapsed) {
        return new NodeCompletion(nodeId, output, null, elapsed);
    }

    static NodeCompletion failed(String nodeId, ExecutionError error, Duration elapsed) {
        return new NodeCompletion(nodeId, Map.of(), error, elapsed);
    }

    boolean succeeded() {
        return error == null;
    }

    boolean pluginRan() {
        return error == null || !ExecutionError.MISSING_PLUGIN.equals(error.code());
    }
}
