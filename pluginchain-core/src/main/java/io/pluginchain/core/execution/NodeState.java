package io.pluginchain.core.execution;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// Immutable state of one node at a point in time.
///
/// @param status current status, not null
/// @param output values keyed by output tag, never null (empty unless `SUCCEEDED`)
/// @param error failure or skip reason, null unless `FAILED` or `SKIPPED`
/// @param startedAt when the node started running, null if it never ran
/// @param endedAt when the node reached a terminal status, null while not terminal
public record NodeState(
        NodeStatus status,
        Map<String, Object> output,
        ExecutionError error,
        Instant startedAt,
        Instant endedAt) {

    public NodeState {
        Objects.requireNonNull(status, "status must not be null");
        output = output != null
                ? Collections.unmodifiableMap(new TreeMap<>(output))
                : Map.of();
    }

    public static NodeState pending() {
        return new NodeState(NodeStatus.PENDING, Map.of(), null, null, null);
    }

    public static NodeState running(Instant startedAt) {
        return new NodeState(NodeStatus.RUNNING, Map.of(), null, startedAt, null);
    }

    public static NodeState succeeded(Map<String, Object> output, Instant startedAt, Instant endedAt) {
        return new NodeState(NodeStatus.SUCCEEDED, output, null, startedAt, endedAt);
    }

    public static NodeState failed(ExecutionError error, Instant startedAt, Instant endedAt) {
        return new NodeState(NodeStatus.FAILED, Map.of(), error, startedAt, endedAt);
    }

    public static NodeState skipped(ExecutionError error, Instant at) {
        return new NodeState(NodeStatus.SKIPPED, Map.of(), error, null, at);
    }

    /// Compares status, output and error, ignoring timestamps.
    ///
    /// @param other state to compare with, not null
    /// @return true if both states describe the same outcome
    public boolean sameOutcomeAs(NodeState other) {
        return status == other.status
                && output.equals(other.output)
                && Objects.equals(error, other.error);
    }
}
