package io.pluginchain.core.execution;

/// Callbacks for chain run lifecycle events.
///
/// All methods default to no-ops. Callbacks run on the run's control thread, never on
/// a plugin worker thread; an exception thrown by a listener is logged and ignored.
///
/// @see ChainExecutor#addListener(ChainExecutionListener)
public interface ChainExecutionListener {

    /// Called once the run has moved to `RUNNING`, before any node starts.
    ///
    /// @param run the run, not null
    default void onRunStarted(ChainRun run) {}

    /// Called when a node is handed to the worker pool.
    ///
    /// @param run the run, not null
    /// @param nodeId the node that started, not null
    default void onNodeStarted(ChainRun run, String nodeId) {}

    /// Called when a node reaches a terminal status, including skips.
    ///
    /// @param run the run, not null
    /// @param nodeId the node, not null
    /// @param state the node's terminal state, not null
    default void onNodeCompleted(ChainRun run, String nodeId, NodeState state) {}

    /// Called after the run status became terminal.
    ///
    /// @param run the run, not null
    default void onRunCompleted(ChainRun run) {}
}
