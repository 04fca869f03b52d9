package io.pluginchain.core.execution;

import java.util.Objects;

/// Structured error payload recorded in a {@link NodeState} or as a run's abort cause.
///
/// @param kind error classification, not null
/// @param code machine-readable code, not null
/// @param message human-readable detail, never null
public record ExecutionError(ErrorKind kind, String code, String message) {

    public static final String TIMEOUT = "TIMEOUT";
    public static final String INVALID_INPUT = "INVALID_INPUT";
    public static final String MISSING_OUTPUT = "MISSING_OUTPUT";
    public static final String MISSING_PLUGIN = "MISSING_PLUGIN";
    public static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";

    public ExecutionError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(code, "code must not be null");
        message = message != null ? message : "";
    }

    public static ExecutionError pluginFailure(String code, String message) {
        return new ExecutionError(ErrorKind.PLUGIN_EXECUTION_ERROR, code, message);
    }

    public static ExecutionError chainAborted(String failedNodeId) {
        return new ExecutionError(
                ErrorKind.CHAIN_ABORTED,
                ErrorKind.CHAIN_ABORTED.name(),
                "chain aborted after node '" + failedNodeId + "' failed");
    }

    public static ExecutionError upstreamFailed(String failedNodeId) {
        return new ExecutionError(
                ErrorKind.UPSTREAM_FAILED,
                ErrorKind.UPSTREAM_FAILED.name(),
                "upstream node '" + failedNodeId + "' failed");
    }

    public static ExecutionError cancelled(String reason) {
        return new ExecutionError(ErrorKind.CANCELLED, ErrorKind.CANCELLED.name(), reason);
    }
}
