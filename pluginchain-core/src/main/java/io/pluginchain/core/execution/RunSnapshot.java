package io.pluginchain.core.execution;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Immutable copy of a {@link ChainRun} for monitoring and archival.
///
/// @param runId run identifier
/// @param chainId id of the executed chain
/// @param mode execution mode
/// @param status run status at snapshot time
/// @param nodeStates node id to state, in chain execution order
/// @param startedAt when the run started, null if still pending
/// @param endedAt when the run finished, null while active
/// @param progress fraction of nodes in a terminal status, within `[0, 1]`
/// @param abortCause fail-fast abort cause, null if the run was not aborted
/// @param cancelReason cancellation reason, null if not cancelled
public record RunSnapshot(
        String runId,
        String chainId,
        ExecutionMode mode,
        RunStatus status,
        Map<String, NodeState> nodeStates,
        Instant startedAt,
        Instant endedAt,
        double progress,
        ExecutionError abortCause,
        String cancelReason) {

    public RunSnapshot {
        nodeStates = nodeStates != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(nodeStates))
                : Map.of();
    }
}
