package io.pluginchain.core.execution;

import io.pluginchain.core.chain.Chain;
import io.pluginchain.core.chain.ChainNode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Mutable execution record of one chain run.
///
/// Only the {@link ChainExecutor} driving the run mutates it; every mutator is
/// package-private. Monitoring callers read through {@link #snapshot()} or the
/// copying accessors, which never expose live internal state.
///
/// ### Lifecycle
/// ```
/// PENDING -> RUNNING -> SUCCEEDED | PARTIAL_FAILURE | FAILED | CANCELLED
/// ```
///
/// @implNote Thread-safe. All state is guarded by the instance monitor.
///
/// @see io.pluginchain.core.storage.ChainRunStore for storage lifetime
public final class ChainRun {

    private static final Logger logger = Logger.getLogger(ChainRun.class.getName());

    private final String runId;
    private final Chain chain;
    private final ExecutionMode mode;
    private final CancellationToken cancellationToken;
    private final Map<String, NodeState> nodeStates = new LinkedHashMap<>();
    private final List<AutoCloseable> resources = new ArrayList<>();
    private final CountDownLatch completion = new CountDownLatch(1);

    private RunStatus status = RunStatus.PENDING;
    private Instant startedAt;
    private Instant endedAt;
    private ExecutionError abortCause;

    /// Creates a pending run with every node `PENDING`.
    ///
    /// @param runId unique run identifier, not null
    /// @param chain chain to execute, not null
    /// @param mode execution mode, not null
    /// @param cancellationToken token shared with the caller, not null
    public ChainRun(String runId, Chain chain, ExecutionMode mode, CancellationToken cancellationToken) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.chain = Objects.requireNonNull(chain, "chain must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.cancellationToken =
                Objects.requireNonNull(cancellationToken, "cancellationToken must not be null");
        for (ChainNode node : chain.getNodes()) {
            nodeStates.put(node.id(), NodeState.pending());
        }
    }

    public String getRunId() {
        return runId;
    }

    public Chain getChain() {
        return chain;
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public synchronized RunStatus getStatus() {
        return status;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getEndedAt() {
        return endedAt;
    }

    /// Returns the fail-fast abort cause.
    ///
    /// @return abort cause, or null if the run was not aborted
    public synchronized ExecutionError getAbortCause() {
        return abortCause;
    }

    /// Returns a copy of all node states in execution order.
    ///
    /// @return unmodifiable copy, never null
    public synchronized Map<String, NodeState> getNodeStates() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(nodeStates));
    }

    /// Returns the state of one node.
    ///
    /// @param nodeId node identifier, not null
    /// @return current state, never null
    /// @throws IllegalArgumentException if the node is not part of the chain
    public synchronized NodeState nodeState(String nodeId) {
        NodeState state = nodeStates.get(nodeId);
        if (state == null) {
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        }
        return state;
    }

    /// Returns the fraction of nodes in a terminal status.
    ///
    /// @return progress within `[0, 1]`
    public synchronized double progress() {
        long terminal = nodeStates.values().stream().filter(s -> s.status().isTerminal()).count();
        return (double) terminal / nodeStates.size();
    }

    public synchronized boolean isActive() {
        return !status.isTerminal();
    }

    /// Returns an immutable copy of the whole run.
    ///
    /// @return snapshot, never null
    public synchronized RunSnapshot snapshot() {
        return new RunSnapshot(
                runId,
                chain.getId(),
                mode,
                status,
                nodeStates,
                startedAt,
                endedAt,
                progress(),
                abortCause,
                cancellationToken.getReason());
    }

    /// Requests cooperative cancellation.
    ///
    /// No node starts after this call; running nodes finish and are recorded.
    ///
    /// @param reason cancellation reason, not null
    /// @return true if this call fired the token
    public boolean cancel(String reason) {
        return cancellationToken.cancel(reason);
    }

    /// Waits for the run to reach a terminal status.
    ///
    /// @param timeout maximum wait, not null
    /// @return true if the run finished within the timeout
    /// @throws InterruptedException if the waiting thread is interrupted
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return completion.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /// Attaches a resource to close when the run is cleaned up.
    ///
    /// @param resource resource to close, not null
    public synchronized void registerResource(AutoCloseable resource) {
        resources.add(Objects.requireNonNull(resource, "resource must not be null"));
    }

    /// Closes every attached resource, most recently attached first.
    ///
    /// Failures are logged at WARNING and do not stop the remaining closes.
    ///
    /// @return number of resources released
    public int releaseResources() {
        List<AutoCloseable> toClose;
        synchronized (this) {
            toClose = new ArrayList<>(resources);
            resources.clear();
        }
        Collections.reverse(toClose);
        for (AutoCloseable resource : toClose) {
            try {
                resource.close();
            } catch (Exception e) {
                logger.log(Level.WARNING, "Failed to release resource for run " + runId, e);
            }
        }
        return toClose.size();
    }

    synchronized void markStarted(Instant at) {
        status = RunStatus.RUNNING;
        startedAt = at;
    }

    synchronized void markNodeRunning(String nodeId, Instant at) {
        requirePending(nodeId);
        nodeStates.put(nodeId, NodeState.running(at));
    }

    synchronized NodeState markNodeSucceeded(String nodeId, Map<String, Object> output, Instant at) {
        NodeState state = NodeState.succeeded(output, nodeStates.get(nodeId).startedAt(), at);
        nodeStates.put(nodeId, state);
        return state;
    }

    synchronized NodeState markNodeFailed(String nodeId, ExecutionError error, Instant at) {
        NodeState state = NodeState.failed(error, nodeStates.get(nodeId).startedAt(), at);
        nodeStates.put(nodeId, state);
        return state;
    }

    /// Skips a node if it is still pending.
    ///
    /// @return the new state, or null if the node had already left `PENDING`
    synchronized NodeState skipIfPending(String nodeId, ExecutionError reason, Instant at) {
        if (nodeStates.get(nodeId).status() != NodeStatus.PENDING) {
            return null;
        }
        NodeState state = NodeState.skipped(reason, at);
        nodeStates.put(nodeId, state);
        return state;
    }

    synchronized void markAborted(ExecutionError cause) {
        if (abortCause == null) {
            abortCause = cause;
        }
    }

    void complete(RunStatus finalStatus, Instant at) {
        synchronized (this) {
            status = finalStatus;
            endedAt = at;
        }
        completion.countDown();
    }

    private void requirePending(String nodeId) {
        NodeState state = nodeStates.get(nodeId);
        if (state == null || state.status() != NodeStatus.PENDING) {
            throw new IllegalStateException(
                    "Node " + nodeId + " cannot start from " + (state != null ? state.status() : "unknown"));
        }
    }

    @Override
    public String toString() {
        return "ChainRun{runId='" + runId + "', chain='" + chain.getId() + "', status=" + getStatus() + "}";
    }
}
