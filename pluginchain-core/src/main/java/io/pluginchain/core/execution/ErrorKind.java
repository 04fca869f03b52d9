package io.pluginchain.core.execution;

/// Classification of an {@link ExecutionError}.
public enum ErrorKind {
    /// The plugin raised, timed out, rejected its input, or omitted a consumed output.
    PLUGIN_EXECUTION_ERROR,

    /// The node never ran because a fail-fast run aborted.
    CHAIN_ABORTED,

    /// The node never ran because a node it depends on failed.
    UPSTREAM_FAILED,

    /// The node never ran because the run was cancelled.
    CANCELLED
}
