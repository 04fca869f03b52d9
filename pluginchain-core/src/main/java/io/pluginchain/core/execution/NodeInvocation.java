package io.pluginchain.core.execution;

import io.pluginchain.core.chain.ChainNode;
import io.pluginchain.core.plugin.Plugin;
import io.pluginchain.core.plugin.PluginContext;
import io.pluginchain.core.plugin.PluginException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Runs one plugin under a timeout and reports exactly one {@link NodeCompletion}.
///
/// The plugin runs on the worker pool. When a scheduler is available, a watchdog
/// settles the node as `TIMEOUT` once the timeout elapses and interrupts the worker.
/// Without a scheduler (single-threaded mode) the timeout is checked after the plugin
/// returns. Whichever side settles first wins; the other outcome is dropped.
final class NodeInvocation implements Runnable {

    private static final Logger logger = Logger.getLogger(NodeInvocation.class.getName());

    private final ChainNode node;
    private final Plugin plugin;
    private final Map<String, Object> inputs;
    private final PluginContext context;
    private final Set<String> requiredOutputs;
    private final Duration timeout;
    private final Consumer<NodeCompletion> sink;
    private final AtomicBoolean settled = new AtomicBoolean();
    private volatile Future<?> watchdog;

    NodeInvocation(
            ChainNode node,
            Plugin plugin,
            Map<String, Object> inputs,
            PluginContext context,
            Set<String> requiredOutputs,
            Duration timeout,
            Consumer<NodeCompletion> sink) {
        this.node = node;
        this.plugin = plugin;
        this.inputs = inputs;
        this.context = context;
        this.requiredOutputs = requiredOutputs;
        this.timeout = timeout;
        this.sink = sink;
    }

    void start(ExecutorService workers, ScheduledExecutorService scheduler) {
        Future<?> task;
        try {
            task = workers.submit(this);
        } catch (RejectedExecutionException e) {
            settle(NodeCompletion.failed(
                    node.id(),
                    ExecutionError.pluginFailure(
                            ExecutionError.UNEXPECTED_ERROR, "Worker pool rejected node: " + e.getMessage()),
                    Duration.ZERO));
            return;
        }
        if (scheduler == null || settled.get()) {
            return;
        }
        try {
            watchdog = scheduler.schedule(() -> expire(task), timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "No timeout watchdog for node " + node.id(), e);
            return;
        }
        if (settled.get()) {
            watchdog.cancel(false);
        }
    }

    @Override
    public void run() {
        long start = System.nanoTime();
        NodeCompletion outcome;
        try {
            outcome = invoke(start);
        } catch (PluginException e) {
            outcome = failure(e.getCode(), e.getMessage(), start);
        } catch (Exception e) {
            outcome = failure(
                    ExecutionError.UNEXPECTED_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage(),
                    start);
        } catch (Error e) {
            settle(failure(ExecutionError.UNEXPECTED_ERROR, e.toString(), start));
            throw e;
        }
        if (outcome.succeeded() && outcome.elapsed().compareTo(timeout) > 0) {
            outcome = failure(ExecutionError.TIMEOUT, "Node exceeded timeout of " + timeout, start);
        }
        settle(outcome);
    }

    private NodeCompletion invoke(long start) throws PluginException {
        if (plugin == null) {
            return failure(
                    ExecutionError.MISSING_PLUGIN,
                    "No implementation registered for plugin " + node.pluginName(),
                    start);
        }
        if (!plugin.validateInput(inputs)) {
            return failure(
                    ExecutionError.INVALID_INPUT,
                    "Plugin " + node.pluginName() + " rejected inputs " + inputs.keySet(),
                    start);
        }
        Map<String, Object> output = plugin.execute(inputs, context);
        if (output != null && output.keySet().stream().anyMatch(Objects::isNull)) {
            return failure(
                    ExecutionError.UNEXPECTED_ERROR,
                    "Plugin " + node.pluginName() + " returned an output with a null tag",
                    start);
        }
        // copied here so a misbehaving map fails the node instead of the control loop
        Map<String, Object> result = output != null ? new TreeMap<>(output) : Map.of();
        Set<String> missing = new TreeSet<>(requiredOutputs);
        missing.removeAll(result.keySet());
        if (!missing.isEmpty()) {
            return failure(
                    ExecutionError.MISSING_OUTPUT,
                    "Plugin " + node.pluginName() + " did not produce " + missing,
                    start);
        }
        return NodeCompletion.succeeded(node.id(), result, elapsedSince(start));
    }

    private void expire(Future<?> task) {
        ExecutionError error = ExecutionError.pluginFailure(
                ExecutionError.TIMEOUT, "Node exceeded timeout of " + timeout);
        if (settle(NodeCompletion.failed(node.id(), error, timeout))) {
            task.cancel(true);
        }
    }

    private boolean settle(NodeCompletion completion) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        Future<?> pending = watchdog;
        if (pending != null) {
            pending.cancel(false);
        }
        sink.accept(completion);
        return true;
    }

    private NodeCompletion failure(String code, String message, long start) {
        return NodeCompletion.failed(
                node.id(), ExecutionError.pluginFailure(code, message), elapsedSince(start));
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
