package io.pluginchain.core.execution;

/// Aggregate status of a {@link ChainRun}.
public enum RunStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    PARTIAL_FAILURE,
    FAILED,
    CANCELLED;

    /// Returns whether the run has finished.
    ///
    /// @return true for every status except `PENDING` and `RUNNING`
    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
