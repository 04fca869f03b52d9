package io.pluginchain.core.execution;

import io.pluginchain.core.chain.Chain;
import io.pluginchain.core.chain.ChainNode;
import io.pluginchain.core.exception.RunNotFoundException;
import io.pluginchain.core.plugin.PluginContext;
import io.pluginchain.core.plugin.PluginRegistry;
import io.pluginchain.core.storage.ChainRunStore;
import io.pluginchain.core.storage.InMemoryChainRunStore;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Drives plugin invocation for a {@link Chain} and aggregates a {@link ChainRun}.
///
/// ### Control loop
/// Each run has one control loop that owns all state transitions. The loop computes
/// the ready-set (pending nodes whose dependencies all `SUCCEEDED`), dispatches nodes
/// according to the {@link ExecutionMode}, then blocks on a completion queue until a
/// node finishes. It never waits on one specific node, so siblings proceed
/// independently.
///
/// | Mode | Dispatch rule |
/// |------|---------------|
/// | `SEQUENTIAL` | first ready node in topological order, only when nothing is in flight |
/// | `PARALLEL` | every ready node, recomputed on each completion |
/// | `ADAPTIVE` | when nothing is in flight: the whole ready-set as a wave if it has at least `adaptiveThreshold` nodes, else its first node |
///
/// ### Failure handling
/// Plugin faults never escape: exceptions, timeouts, rejected inputs, missing outputs
/// and missing implementations all become a `FAILED` node with an {@link ExecutionError}.
/// Without fail-fast, only the failed node's transitive dependents are skipped; with
/// fail-fast, every pending node is skipped and the run records an abort cause.
///
/// ### Cancellation
/// The run's {@link CancellationToken} is checked before every dispatch. Once fired,
/// no node starts; running nodes finish and are recorded; remaining pending nodes are
/// skipped and the run ends `CANCELLED`.
///
/// ### Final status
/// `CANCELLED` if the token fired, else `SUCCEEDED` if every node succeeded, else
/// `PARTIAL_FAILURE` if any node succeeded, else `FAILED`.
///
/// @implNote Thread-safe. Runs are independent; listeners are invoked on the control
/// thread of the run they observe. The executor does not own the thread pools it is
/// given; their lifecycle belongs to the caller.
///
/// @see ChainRun for the execution record
/// @see InlineExecutorService for single-threaded simulation
public class ChainExecutor {

    private static final Logger logger = Logger.getLogger(ChainExecutor.class.getName());

    /// Ready-set size that promotes an `ADAPTIVE` run to a parallel wave.
    public static final int DEFAULT_ADAPTIVE_THRESHOLD = 2;

    /// Timeout used when neither the run options nor the builder set one.
    public static final Duration DEFAULT_NODE_TIMEOUT = Duration.ofMinutes(5);

    private final PluginRegistry registry;
    private final ChainRunStore store;
    private final PluginPerformanceTracker tracker;
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService controlExecutor;
    private final Duration defaultNodeTimeout;
    private final int adaptiveThreshold;
    private final Clock clock;
    private final List<ChainExecutionListener> listeners = new CopyOnWriteArrayList<>();

    private ChainExecutor(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry must not be null");
        this.store = builder.store != null ? builder.store : new InMemoryChainRunStore();
        this.tracker = builder.tracker != null ? builder.tracker : new PluginPerformanceTracker();
        this.workers = builder.workers != null ? builder.workers : new InlineExecutorService();
        this.scheduler = builder.scheduler;
        this.controlExecutor =
                builder.controlExecutor != null ? builder.controlExecutor : new InlineExecutorService();
        this.defaultNodeTimeout = builder.defaultNodeTimeout;
        this.adaptiveThreshold = builder.adaptiveThreshold;
        this.clock = builder.clock;
    }

    /// Creates a builder for an executor over the given registry.
    ///
    /// @param registry registry resolving plugin implementations, not null
    /// @return new builder, never null
    public static Builder builder(PluginRegistry registry) {
        return new Builder(registry);
    }

    /// Registers a lifecycle listener for all subsequent runs.
    ///
    /// @param listener listener to add, not null
    public void addListener(ChainExecutionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(ChainExecutionListener listener) {
        listeners.remove(listener);
    }

    /// Runs a chain with default options, blocking until it finishes.
    ///
    /// @param chain chain to run, not null
    /// @param mode execution mode, not null
    /// @return the finished run, never null
    public ChainRun runChain(Chain chain, ExecutionMode mode) {
        return runChain(chain, mode, RunOptions.defaults());
    }

    /// Runs a chain on the calling thread, blocking until it finishes.
    ///
    /// Plugin failures are recorded in the returned run, never thrown.
    ///
    /// @param chain chain to run, not null
    /// @param mode execution mode, not null
    /// @param options run options, not null
    /// @return the finished run, never null
    /// @throws IllegalArgumentException if a seed input of the chain has no value
    public ChainRun runChain(Chain chain, ExecutionMode mode, RunOptions options) {
        RunDriver driver = prepare(chain, mode, options);
        driver.drive();
        return driver.run;
    }

    /// Starts a chain on the control executor and returns the live run immediately.
    ///
    /// @param chain chain to run, not null
    /// @param mode execution mode, not null
    /// @param options run options, not null
    /// @return the live run, never null; use {@link ChainRun#awaitCompletion} to wait
    /// @throws IllegalArgumentException if a seed input of the chain has no value
    /// @throws java.util.concurrent.RejectedExecutionException if the control executor
    ///         refuses the run
    public ChainRun startChain(Chain chain, ExecutionMode mode, RunOptions options) {
        RunDriver driver = prepare(chain, mode, options);
        controlExecutor.execute(driver::drive);
        return driver.run;
    }

    /// Cancels a stored run.
    ///
    /// @param runId run identifier, not null
    /// @param reason cancellation reason, not null
    /// @return true if this call fired the run's token
    /// @throws RunNotFoundException if the store holds no such run
    public boolean cancel(String runId, String reason) throws RunNotFoundException {
        ChainRun run = store.getOrThrow(runId);
        boolean fired = run.cancel(reason);
        if (fired) {
            logger.info("Cancellation requested for run " + runId + ": " + reason);
        }
        return fired;
    }

    public ChainRunStore getStore() {
        return store;
    }

    public PluginPerformanceTracker getPerformanceTracker() {
        return tracker;
    }

    public int getAdaptiveThreshold() {
        return adaptiveThreshold;
    }

    private RunDriver prepare(Chain chain, ExecutionMode mode, RunOptions options) {
        Objects.requireNonNull(chain, "chain must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(options, "options must not be null");
        for (String seed : chain.getGoal().seedInputs()) {
            boolean consumed = chain.getNodes().stream().anyMatch(n -> n.seedInputs().contains(seed));
            if (consumed && !options.seeds().containsKey(seed)) {
                throw new IllegalArgumentException("No value supplied for seed input '" + seed + "'");
            }
        }
        ChainRun run = new ChainRun(
                "run-" + UUID.randomUUID(), chain, mode, options.cancellationToken());
        store.put(run);
        return new RunDriver(run, options);
    }

    /// Control loop state for a single run. Confined to the run's control thread.
    private final class RunDriver {
        private final ChainRun run;
        private final Chain chain;
        private final RunOptions options;
        private final Duration timeout;
        private final Map<String, Set<String>> requiredOutputs;
        private final Map<String, Map<String, Object>> outputs = new HashMap<>();
        private final BlockingQueue<NodeCompletion> completions = new LinkedBlockingQueue<>();
        private int inFlight;
        private boolean aborted;

        RunDriver(ChainRun run, RunOptions options) {
            this.run = run;
            this.chain = run.getChain();
            this.options = options;
            this.timeout = options.perNodeTimeout() != null ? options.perNodeTimeout() : defaultNodeTimeout;
            this.requiredOutputs = requiredOutputsByNode(chain);
        }

        void drive() {
            run.markStarted(clock.instant());
            logger.info(
                    "Starting run " + run.getRunId() + " of chain " + chain.getId() + " in "
                            + run.getMode() + " mode");
            notifyListeners(l -> l.onRunStarted(run));

            boolean interrupted = false;
            try {
                while (true) {
                    if (!aborted && !run.getCancellationToken().isCancelled()) {
                        dispatchReady();
                    }
                    if (inFlight == 0) {
                        break;
                    }
                    try {
                        handle(completions.take());
                    } catch (InterruptedException e) {
                        interrupted = true;
                        run.cancel("control thread interrupted");
                    }
                }
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Control loop of run " + run.getRunId() + " failed", e);
                abandon(e);
            } finally {
                finish();
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        /// Fails every node still running and skips the pending ones after a control loop fault.
        private void abandon(RuntimeException fault) {
            aborted = true;
            ExecutionError cause = ExecutionError.pluginFailure(
                    ExecutionError.UNEXPECTED_ERROR,
                    "Run aborted: " + fault.getClass().getSimpleName() + ": " + fault.getMessage());
            run.markAborted(cause);
            for (ChainNode node : chain.getNodes()) {
                if (run.getNodeStates().get(node.id()).status() == NodeStatus.RUNNING) {
                    NodeState failed = run.markNodeFailed(node.id(), cause, clock.instant());
                    notifyListeners(l -> l.onNodeCompleted(run, node.id(), failed));
                } else {
                    skip(node.id(), cause);
                }
            }
        }

        private void dispatchReady() {
            List<ChainNode> ready = readyNodes();
            if (ready.isEmpty()) {
                return;
            }
            switch (run.getMode()) {
                case SEQUENTIAL -> {
                    if (inFlight == 0) {
                        dispatch(ready.get(0));
                    }
                }
                case PARALLEL -> ready.forEach(this::dispatch);
                case ADAPTIVE -> {
                    if (inFlight > 0) {
                        return;
                    }
                    if (ready.size() >= adaptiveThreshold) {
                        logger.fine(
                                "Run " + run.getRunId() + ": parallel wave of " + ready.size()
                                        + " nodes " + ready.stream().map(ChainNode::id).toList());
                        ready.forEach(this::dispatch);
                    } else {
                        dispatch(ready.get(0));
                    }
                }
            }
        }

        private List<ChainNode> readyNodes() {
            Map<String, NodeState> states = run.getNodeStates();
            List<ChainNode> ready = new ArrayList<>();
            for (ChainNode node : chain.getNodes()) {
                if (states.get(node.id()).status() != NodeStatus.PENDING) {
                    continue;
                }
                boolean satisfied = node.dependencies().stream()
                        .allMatch(dep -> states.get(dep).status() == NodeStatus.SUCCEEDED);
                if (satisfied) {
                    ready.add(node);
                }
            }
            return ready;
        }

        private void dispatch(ChainNode node) {
            if (run.getCancellationToken().isCancelled() || aborted) {
                return;
            }
            run.markNodeRunning(node.id(), clock.instant());
            inFlight++;
            notifyListeners(l -> l.onNodeStarted(run, node.id()));

            PluginContext context = new PluginContext(
                    run.getRunId(),
                    chain.getId(),
                    node.id(),
                    options.attributes(),
                    run.getCancellationToken()::isCancelled,
                    run::registerResource);
            NodeInvocation invocation = new NodeInvocation(
                    node,
                    registry.getPlugin(node.pluginName()).orElse(null),
                    inputsFor(node),
                    context,
                    requiredOutputs.getOrDefault(node.id(), Set.of()),
                    timeout,
                    completions::add);
            invocation.start(workers, scheduler);
        }

        private Map<String, Object> inputsFor(ChainNode node) {
            Map<String, Object> inputs = new HashMap<>();
            node.resolvedInputs()
                    .forEach((tag, producer) -> inputs.put(tag, outputs.get(producer).get(tag)));
            for (String seed : node.seedInputs()) {
                inputs.put(seed, options.seeds().get(seed));
            }
            return Collections.unmodifiableMap(inputs);
        }

        private void handle(NodeCompletion completion) {
            inFlight--;
            String nodeId = completion.nodeId();
            ChainNode node = chain.node(nodeId).orElseThrow();
            if (completion.pluginRan()) {
                tracker.record(node.pluginName(), completion.elapsed());
            }

            if (completion.succeeded()) {
                outputs.put(nodeId, completion.output());
                NodeState state = run.markNodeSucceeded(nodeId, completion.output(), clock.instant());
                notifyListeners(l -> l.onNodeCompleted(run, nodeId, state));
                return;
            }

            ExecutionError error = completion.error();
            logger.warning(
                    "Node " + nodeId + " of run " + run.getRunId() + " failed: " + error.code() + " "
                            + error.message());
            NodeState failed = run.markNodeFailed(nodeId, error, clock.instant());
            notifyListeners(l -> l.onNodeCompleted(run, nodeId, failed));

            if (options.failFast()) {
                aborted = true;
                ExecutionError cause = ExecutionError.chainAborted(nodeId);
                run.markAborted(cause);
                chain.getNodes().forEach(n -> skip(n.id(), cause));
            } else {
                ExecutionError cause = ExecutionError.upstreamFailed(nodeId);
                chain.transitiveDependentsOf(nodeId).forEach(id -> skip(id, cause));
            }
        }

        private void skip(String nodeId, ExecutionError reason) {
            NodeState state = run.skipIfPending(nodeId, reason, clock.instant());
            if (state != null) {
                notifyListeners(l -> l.onNodeCompleted(run, nodeId, state));
            }
        }

        private void finish() {
            RunStatus status;
            CancellationToken token = run.getCancellationToken();
            if (token.isCancelled()) {
                ExecutionError cause = ExecutionError.cancelled(token.getReason());
                chain.getNodes().forEach(n -> skip(n.id(), cause));
                status = RunStatus.CANCELLED;
            } else {
                status = aggregate(run.getNodeStates());
            }
            run.complete(status, clock.instant());
            logger.info("Run " + run.getRunId() + " completed with status " + status);
            notifyListeners(l -> l.onRunCompleted(run));
        }

        private void notifyListeners(Consumer<ChainExecutionListener> event) {
            for (ChainExecutionListener listener : listeners) {
                try {
                    event.accept(listener);
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Execution listener failed for run " + run.getRunId(), e);
                }
            }
        }
    }

    static RunStatus aggregate(Map<String, NodeState> states) {
        boolean allSucceeded = states.values().stream()
                .allMatch(s -> s.status() == NodeStatus.SUCCEEDED);
        if (allSucceeded) {
            return RunStatus.SUCCEEDED;
        }
        boolean anySucceeded = states.values().stream()
                .anyMatch(s -> s.status() == NodeStatus.SUCCEEDED);
        return anySucceeded ? RunStatus.PARTIAL_FAILURE : RunStatus.FAILED;
    }

    private static Map<String, Set<String>> requiredOutputsByNode(Chain chain) {
        Map<String, Set<String>> required = new HashMap<>();
        for (ChainNode node : chain.getNodes()) {
            node.resolvedInputs().forEach(
                    (tag, producer) -> required.computeIfAbsent(producer, k -> new TreeSet<>()).add(tag));
        }
        required.computeIfAbsent(chain.getGoalNodeId(), k -> new TreeSet<>())
                .add(chain.getGoal().requiredOutputTag());
        return required;
    }

    /// Fluent builder for {@link ChainExecutor}.
    ///
    /// ### Defaults
    /// - worker pool and control executor: {@link InlineExecutorService}
    /// - scheduler: none (timeouts checked after the plugin returns)
    /// - store: {@link InMemoryChainRunStore}
    /// - node timeout: {@link #DEFAULT_NODE_TIMEOUT}
    /// - adaptive threshold: {@link #DEFAULT_ADAPTIVE_THRESHOLD}
    public static final class Builder {
        private final PluginRegistry registry;
        private ChainRunStore store;
        private PluginPerformanceTracker tracker;
        private ExecutorService workers;
        private ScheduledExecutorService scheduler;
        private ExecutorService controlExecutor;
        private Duration defaultNodeTimeout = DEFAULT_NODE_TIMEOUT;
        private int adaptiveThreshold = DEFAULT_ADAPTIVE_THRESHOLD;
        private Clock clock = Clock.systemUTC();

        private Builder(PluginRegistry registry) {
            this.registry = registry;
        }

        public Builder store(ChainRunStore store) {
            this.store = store;
            return this;
        }

        public Builder performanceTracker(PluginPerformanceTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        /// Sets the bounded pool that runs plugins.
        ///
        /// @param workers worker pool, not null
        /// @return this builder for chaining
        public Builder workers(ExecutorService workers) {
            this.workers = workers;
            return this;
        }

        /// Sets the scheduler that enforces node timeouts while plugins run.
        ///
        /// @param scheduler timeout scheduler, may be null
        /// @return this builder for chaining
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /// Sets the executor that hosts control loops of runs started with
        /// {@link ChainExecutor#startChain}. Must not be the worker pool.
        ///
        /// @param controlExecutor control executor, not null
        /// @return this builder for chaining
        public Builder controlExecutor(ExecutorService controlExecutor) {
            this.controlExecutor = controlExecutor;
            return this;
        }

        public Builder defaultNodeTimeout(Duration defaultNodeTimeout) {
            Objects.requireNonNull(defaultNodeTimeout, "defaultNodeTimeout must not be null");
            if (defaultNodeTimeout.isNegative() || defaultNodeTimeout.isZero()) {
                throw new IllegalArgumentException("defaultNodeTimeout must be positive");
            }
            this.defaultNodeTimeout = defaultNodeTimeout;
            return this;
        }

        /// Sets the ready-set size at which `ADAPTIVE` runs dispatch a parallel wave.
        ///
        /// @param adaptiveThreshold threshold, at least 1
        /// @return this builder for chaining
        public Builder adaptiveThreshold(int adaptiveThreshold) {
            if (adaptiveThreshold < 1) {
                throw new IllegalArgumentException("adaptiveThreshold must be at least 1");
            }
            this.adaptiveThreshold = adaptiveThreshold;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public ChainExecutor build() {
            return new ChainExecutor(this);
        }
    }
}
