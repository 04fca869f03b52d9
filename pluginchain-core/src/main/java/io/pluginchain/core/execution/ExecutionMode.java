package io.pluginchain.core.execution;

/// Concurrency policy for running a chain.
public enum ExecutionMode {
    /// One node at a time, in the chain's topological order.
    SEQUENTIAL,

    /// Every ready node is dispatched as soon as it becomes ready.
    PARALLEL,

    /// Sequential until the ready-set reaches the adaptive threshold, then that
    /// ready-set runs as one parallel wave.
    ADAPTIVE
}
