package io.pluginchain.core.execution;

import static io.pluginchain.core.TestPlugins.failing;
import static io.pluginchain.core.TestPlugins.plugin;
import static io.pluginchain.core.TestPlugins.source;
import static io.pluginchain.core.TestPlugins.wrapping;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import io.pluginchain.core.TestPlugins;
import io.pluginchain.core.chain.Chain;
import io.pluginchain.core.chain.ChainBuilder;
import io.pluginchain.core.chain.Goal;
import io.pluginchain.core.exception.RunNotFoundException;
import io.pluginchain.core.plugin.DefaultPluginRegistry;
import io.pluginchain.core.plugin.IoSpec;
import io.pluginchain.core.plugin.Plugin;
import io.pluginchain.core.plugin.PluginContext;
import io.pluginchain.core.plugin.PluginDescriptor;
import io.pluginchain.core.plugin.PluginException;
import io.pluginchain.core.plugin.PluginRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ChainExecutorTest {

    private PluginRegistry registry;
    private ChainBuilder chainBuilder;
    private ExecutorService workers;
    private ScheduledExecutorService scheduler;
    private ExecutorService control;

    @BeforeEach
    void setUp() {
        registry = new DefaultPluginRegistry();
        chainBuilder = new ChainBuilder(registry);
        workers = Executors.newFixedThreadPool(4);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        control = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        scheduler.shutdownNow();
        control.shutdownNow();
    }

    private ChainExecutor inlineExecutor() {
        return ChainExecutor.builder(registry).build();
    }

    private ChainExecutor threadedExecutor() {
        return ChainExecutor.builder(registry)
                .workers(workers)
                .scheduler(scheduler)
                .controlExecutor(control)
                .build();
    }

    private ChainExecutor executorFor(ExecutionMode mode) {
        return mode == ExecutionMode.SEQUENTIAL ? inlineExecutor() : threadedExecutor();
    }

    private Chain build(String goalTag) throws Exception {
        return chainBuilder.buildChain(Goal.of(goalTag));
    }

    /// Source -> {Left, Right} -> Merge producing "summary".
    private void registerDiamond(Plugin left) {
        registry.register(source("Source", "raw", "r"));
        registry.register(left);
        registry.register(wrapping("Right", "raw", "right", "right"));
        registry.register(plugin("Merge", Set.of("left", "right"), Set.of("summary"),
                (in, ctx) -> Map.of("summary", in.get("left") + "+" + in.get("right"))));
    }

    @Nested
    class Scenarios {

        @Test
        void shouldRunPipelineSequentially() throws Exception {
            TestPlugins.registerPipeline(registry);

            ChainRun run = inlineExecutor().runChain(build("report"), ExecutionMode.SEQUENTIAL);

            assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
            assertThat(run.nodeState("Analyze").output()).containsEntry("report", "report(clean(raw))");
            assertThat(run.progress()).isEqualTo(1.0);
            assertThat(run.getStartedAt()).isNotNull();
            assertThat(run.getEndedAt()).isNotNull();
            assertThat(run.isActive()).isFalse();
        }

        @Test
        void shouldIsolateFailingTransform() throws Exception {
            registry.register(source("Source", "data/raw", "raw"));
            registry.register(failing("Transform", Set.of("data/raw"), "data/clean", "BROKEN"));
            registry.register(wrapping("Analyze", "data/clean", "report", "report"));

            ChainRun run = inlineExecutor().runChain(build("report"), ExecutionMode.SEQUENTIAL);

            assertThat(run.getStatus()).isEqualTo(RunStatus.PARTIAL_FAILURE);
            assertThat(run.nodeState("Source").status()).isEqualTo(NodeStatus.SUCCEEDED);
            NodeState transform = run.nodeState("Transform");
            assertThat(transform.status()).isEqualTo(NodeStatus.FAILED);
            assertThat(transform.error())
                    .isEqualTo(ExecutionError.pluginFailure("BROKEN", "Transform failed"));
            NodeState analyze = run.nodeState("Analyze");
            assertThat(analyze.status()).isEqualTo(NodeStatus.SKIPPED);
            assertThat(analyze.error().kind()).isEqualTo(ErrorKind.UPSTREAM_FAILED);
        }

        @Test
        void shouldFailRunWhenNothingSucceeds() throws Exception {
            registry.register(failing("Only", Set.of(), "report", "DOWN"));

            ChainRun run = inlineExecutor().runChain(build("report"), ExecutionMode.SEQUENTIAL);

            assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        }
    }

    @Nested
    class FailureHandling {

        @ParameterizedTest
        @EnumSource(ExecutionMode.class)
        void shouldSkipOnlyDependentsOfFailedNode(ExecutionMode mode) throws Exception {
            registerDiamond(failing("Left", Set.of("raw"), "left", "LEFT_DOWN"));

            ChainRun run = executorFor(mode).runChain(build("summary"), mode);

            assertThat(run.getStatus()).isEqualTo(RunStatus.PARTIAL_FAILURE);
            assertThat(run.nodeState("Source").status()).isEqualTo(NodeStatus.SUCCEEDED);
            assertThat(run.nodeState("Right").status()).isEqualTo(NodeStatus.SUCCEEDED);
            assertThat(run.nodeState("Left").status()).isEqualTo(NodeStatus.FAILED);
            assertThat(run.nodeState("Merge").status()).isEqualTo(NodeStatus.SKIPPED);
            assertThat(run.getAbortCause()).isNull();
        }

        @Test
        void shouldAbortPendingNodesWhenFailFast() throws Exception {
            registerDiamond(failing("Left", Set.of("raw"), "left", "LEFT_DOWN"));
            RunOptions options = RunOptions.builder().failFast(true).build();

            ChainRun run = inlineExecutor().runChain(build("summary"), ExecutionMode.SEQUENTIAL, options);

            assertThat(run.nodeState("Right").status()).isEqualTo(NodeStatus.SKIPPED);
            assertThat(run.nodeState("Right").error().kind()).isEqualTo(ErrorKind.CHAIN_ABORTED);
            assertThat(run.nodeState("Merge").error().kind()).isEqualTo(ErrorKind.CHAIN_ABORTED);
            assertThat(run.getAbortCause()).isEqualTo(ExecutionError.chainAborted("Left"));
            assertThat(run.getStatus()).isEqualTo(RunStatus.PARTIAL_FAILURE);
        }

        @Test
        void shouldRecordUnexpectedRuntimeException() throws Exception {
            registry.register(plugin("Crash", Set.of(), Set.of("report"), (in, ctx) -> {
                throw new IllegalStateException("boom");
            }));

            ChainRun run = inlineExecutor().runChain(build("report"), ExecutionMode.SEQUENTIAL);

            ExecutionError error = run.nodeState("Crash").error();
            assertThat(error.code()).isEqualTo(ExecutionError.UNEXPECTED_ERROR);
            assertThat(error.message()).contains("IllegalStateException", "boom");
        }

        @Test
        void shouldFailNodeReturningNullTag() throws Exception {
            registry.register(plugin("Source", Set.of(), Set.of("data/raw"), (in, ctx) -> {
                Map<String, Object> output = new HashMap<>();
                output.put("data/raw", "raw");
                output.put(null, "junk");
                return output;
            }));
            registry.register(wrapping("Transform", "data/raw", "report", "t"));
            ChainExecutor executor = inlineExecutor();

            ChainRun run = executor.runChain(build("report"), ExecutionMode.SEQUENTIAL);

            assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
            assertThat(run.nodeState("Source").status()).isEqualTo(NodeStatus.FAILED);
            assertThat(run.nodeState("Source").error().code()).isEqualTo(ExecutionError.UNEXPECTED_ERROR);
            assertThat(run.nodeState("Source").error().message()).contains("null tag");
            assertThat(run.nodeState("Transform").status()).isEqualTo(NodeStatus.SKIPPED);
            assertThat(executor.getStore().listActive()).isEmpty();
        }

        @Test
        void shouldSettleRunWhenControlLoopFails() throws Exception {
            TestPlugins.registerPipeline(registry);
            PluginPerformanceTracker tracker = mock(PluginPerformanceTracker.class);
            doThrow(new IllegalStateException("history unavailable"))
                    .when(tracker).record(anyString(), any(Duration.class));
            ChainExecutor executor = ChainExecutor.builder(registry).performanceTracker(tracker).build();

            ChainRun run = executor.runChain(build("report"), ExecutionMode.SEQUENTIAL);

            assertThat(run.awaitCompletion(Duration.ZERO)).isTrue();
            assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
            assertThat(run.nodeState("Source").status()).isEqualTo(NodeStatus.FAILED);
            assertThat(run.nodeState("Transform").status()).isEqualTo(NodeStatus.SKIPPED);
            assertThat(run.nodeState("Analyze").status()).isEqualTo(NodeStatus.SKIPPED);
            assertThat(run.getAbortCause().code()).isEqualTo(ExecutionError.UNEXPECTED_ERROR);
            assertThat(run.getAbortCause().message()).contains("history unavailable");
            assertThat(executor.getStore().listActive()).isEmpty();
        }

        @Test
        void shouldFailNodeWhenConsumedOutputIsMissing() throws Exception {
            registry.register(plugin("Source", Set.of(), Set.of("data/raw"), (in, ctx) -> Map.of()));
            registry.register(wrapping("Transform", "data/raw", "report", "t"));

            ChainRun run = inlineExecutor().runChain(build("report"), ExecutionMode.SEQUENTIAL);

            assertThat(run.nodeState("Source").error().code()).isEqualTo(ExecutionError.MISSING_OUTPUT);
            assertThat(run.nodeState("Transform").status()).isEqualTo(NodeStatus.SKIPPED);
        }

        @Test
        void shouldFailNodeWithoutImplementation() throws Exception {
            registry.register(PluginDescriptor.builder("Planner").outputs("report").build());

            ChainRun run = inlineExecutor().runChain(build("report"), ExecutionMode.SEQUENTIAL);

            assertThat(run.nodeState("Planner").error().code()).isEqualTo(ExecutionError.MISSING_PLUGIN);
            assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        }

        @Test
        void shouldFailNodeRejectingItsInput() throws Exception {
            registry.register(source("Source", "data/raw", ""));
            registry.register(new Plugin() {
                @Override
                public String name() {
                    return "Strict";
                }

                @Override
                public IoSpec getIoSpec() {
                    return IoSpec.of(Set.of("data/raw"), Set.of("report"));
                }

                @Override
                public boolean validateInput(Map<String, Object> inputs) {
                    return !"".equals(inputs.get("data/raw"));
                }

                @Override
                public Map<String, Object> execute(Map<String, Object> inputs, PluginContext context) {
                    throw new AssertionError("must not run");
                }
            });

            ChainRun run = inlineExecutor().runChain(build("report"), ExecutionMode.SEQUENTIAL);

            assertThat(run.nodeState("Strict").error().code()).isEqualTo(ExecutionError.INVALID_INPUT);
        }

        @Test
        void shouldKeepRunningWhenListenerThrows() throws Exception {
            TestPlugins.registerPipeline(registry);
            ChainExecutor executor = inlineExecutor();
            executor.addListener(new ChainExecutionListener() {
                @Override
                public void onNodeStarted(ChainRun run, String nodeId) {
                    throw new IllegalStateException("listener bug");
                }
            });

            ChainRun run = executor.runChain(build("report"), ExecutionMode.SEQUENTIAL);

            assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        }
    }

    @Nested
    class Concurrency {

        @Test
        void shouldProduceSameNodeStatesInEveryMode() throws Exception {
            registerDiamond(wrapping("Left", "raw", "left", "left"));
            Chain chain = build("summary");

            ChainRun inline = inlineExecutor().runChain(chain, ExecutionMode.SEQUENTIAL);
            ChainRun parallel = threadedExecutor().runChain(chain, ExecutionMode.PARALLEL);
            ChainRun adaptive = threadedExecutor().runChain(chain, ExecutionMode.ADAPTIVE);
            ChainRun simulated = inlineExecutor().runChain(chain, ExecutionMode.PARALLEL);

            for (String nodeId : chain.executionOrder()) {
                NodeState expected = inline.nodeState(nodeId);
                assertThat(parallel.nodeState(nodeId).sameOutcomeAs(expected)).as(nodeId).isTrue();
                assertThat(adaptive.nodeState(nodeId).sameOutcomeAs(expected)).as(nodeId).isTrue();
                assertThat(simulated.nodeState(nodeId).sameOutcomeAs(expected)).as(nodeId).isTrue();
            }
            assertThat(parallel.nodeState("Merge").output()).containsEntry("summary", "left(r)+right(r)");
        }

        @Test
        void shouldRunReadySiblingsTogetherInAdaptiveWave() throws Exception {
            CyclicBarrier bothRunning = new CyclicBarrier(2);
            registry.register(source("Source", "raw", "r"));
            registry.register(plugin("Left", Set.of("raw"), Set.of("left"), (in, ctx) -> meet(bothRunning, "left")));
            registry.register(plugin("Right", Set.of("raw"), Set.of("right"), (in, ctx) -> meet(bothRunning, "right")));
            registry.register(plugin("Merge", Set.of("left", "right"), Set.of("summary"),
                    (in, ctx) -> Map.of("summary", "done")));

            ChainRun run = threadedExecutor().runChain(build("summary"), ExecutionMode.ADAPTIVE);

            assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        }

        @Test
        void shouldNeverOverlapNodesInSequentialMode() throws Exception {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger maxRunning = new AtomicInteger();
            TestPlugins.Body tracking = (in, ctx) -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                sleep(20);
                running.decrementAndGet();
                return Map.of();
            };
            registry.register(plugin("Source", Set.of(), Set.of("raw"), (in, ctx) -> {
                tracking.apply(in, ctx);
                return Map.of("raw", 1);
            }));
            registry.register(plugin("Left", Set.of("raw"), Set.of("left"), (in, ctx) -> {
                tracking.apply(in, ctx);
                return Map.of("left", 1);
            }));
            registry.register(plugin("Right", Set.of("raw"), Set.of("right"), (in, ctx) -> {
                tracking.apply(in, ctx);
                return Map.of("right", 1);
            }));
            registry.register(plugin("Merge", Set.of("left", "right"), Set.of("summary"),
                    (in, ctx) -> Map.of("summary", 2)));

            ChainRun run = threadedExecutor().runChain(build("summary"), ExecutionMode.SEQUENTIAL);

            assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
            assertThat(maxRunning).hasValue(1);
        }

        @Test
        void shouldStartNodesOnlyAfterDependenciesFinish() throws Exception {
            registerDiamond(wrapping("Left", "raw", "left", "left"));
            List<String> events = Collections.synchronizedList(new ArrayList<>());
            ChainExecutor executor = threadedExecutor();
            executor.addListener(new ChainExecutionListener() {
                @Override
                public void onNodeStarted(ChainRun run, String nodeId) {
                    events.add("start:" + nodeId);
                }

                @Override
                public void onNodeCompleted(ChainRun run, String nodeId, NodeState state) {
                    events.add("end:" + nodeId);
                }
            });

            executor.runChain(build("summary"), ExecutionMode.PARALLEL);

            assertThat(events.indexOf("start:Merge"))
                    .isGreaterThan(events.indexOf("end:Left"))
                    .isGreaterThan(events.indexOf("end:Right"));
            assertThat(events.indexOf("start:Left")).isGreaterThan(events.indexOf("end:Source"));
        }
    }

    @Nested
    class CancellationAndTimeouts {

        @Test
        void shouldStopStartingNodesOnceCancelled() throws Exception {
            CancellationToken token = new CancellationToken();
            registry.register(plugin("Source", Set.of(), Set.of("data/raw"), (in, ctx) -> {
                token.cancel("user stop");
                return Map.of("data/raw", "raw");
            }));
            registry.register(wrapping("Transform", "data/raw", "data/clean", "clean"));
            registry.register(wrapping("Analyze", "data/clean", "report", "report"));
            List<String> startedAfterCancel = new ArrayList<>();
            ChainExecutor executor = inlineExecutor();
            executor.addListener(new ChainExecutionListener() {
                @Override
                public void onNodeStarted(ChainRun run, String nodeId) {
                    if (token.isCancelled()) {
                        startedAfterCancel.add(nodeId);
                    }
                }
            });

            ChainRun run = executor.runChain(build("report"), ExecutionMode.SEQUENTIAL,
                    RunOptions.builder().cancellationToken(token).build());

            assertThat(run.getStatus()).isEqualTo(RunStatus.CANCELLED);
            assertThat(startedAfterCancel).isEmpty();
            assertThat(run.nodeState("Source").status()).isEqualTo(NodeStatus.SUCCEEDED);
            assertThat(run.nodeState("Transform").error()).isEqualTo(ExecutionError.cancelled("user stop"));
            assertThat(run.snapshot().cancelReason()).isEqualTo("user stop");
        }

        @Test
        void shouldLetRunningNodeFinishAfterCancelById() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            AtomicBoolean sawCancellation = new AtomicBoolean();
            registry.register(plugin("Source", Set.of(), Set.of("data/raw"), (in, ctx) -> {
                entered.countDown();
                await(release);
                sawCancellation.set(ctx.isCancellationRequested());
                return Map.of("data/raw", "raw");
            }));
            registry.register(wrapping("Transform", "data/raw", "data/clean", "clean"));
            registry.register(wrapping("Analyze", "data/clean", "report", "report"));
            ChainExecutor executor = threadedExecutor();

            ChainRun run = executor.startChain(build("report"), ExecutionMode.PARALLEL, RunOptions.defaults());
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(executor.getStore().listActive()).contains(run);
            assertThat(executor.cancel(run.getRunId(), "shutdown")).isTrue();
            release.countDown();

            assertThat(run.awaitCompletion(Duration.ofSeconds(5))).isTrue();
            assertThat(run.getStatus()).isEqualTo(RunStatus.CANCELLED);
            assertThat(run.nodeState("Source").status()).isEqualTo(NodeStatus.SUCCEEDED);
            assertThat(run.nodeState("Transform").status()).isEqualTo(NodeStatus.SKIPPED);
            assertThat(sawCancellation).isTrue();
        }

        @Test
        void shouldRejectCancelOfUnknownRun() {
            assertThatThrownBy(() -> inlineExecutor().cancel("run-missing", "x"))
                    .isInstanceOf(RunNotFoundException.class);
        }

        @Test
        void shouldTimeOutHangingNodeWithWatchdog() throws Exception {
            registry.register(plugin("Slow", Set.of(), Set.of("report"), (in, ctx) -> {
                sleep(10_000);
                return Map.of("report", "late");
            }));
            RunOptions options = RunOptions.builder().perNodeTimeout(Duration.ofMillis(100)).build();

            ChainRun run = threadedExecutor().runChain(build("report"), ExecutionMode.PARALLEL, options);

            assertThat(run.nodeState("Slow").status()).isEqualTo(NodeStatus.FAILED);
            assertThat(run.nodeState("Slow").error().code()).isEqualTo(ExecutionError.TIMEOUT);
        }

        @Test
        void shouldTimeOutSlowNodeInSingleThreadedMode() throws Exception {
            registry.register(plugin("Slow", Set.of(), Set.of("report"), (in, ctx) -> {
                sleep(50);
                return Map.of("report", "late");
            }));
            RunOptions options = RunOptions.builder().perNodeTimeout(Duration.ofMillis(5)).build();

            ChainRun run = inlineExecutor().runChain(build("report"), ExecutionMode.SEQUENTIAL, options);

            assertThat(run.nodeState("Slow").error().code()).isEqualTo(ExecutionError.TIMEOUT);
        }
    }

    @Nested
    class Inputs {

        @Test
        void shouldPassSeedValuesToConsumers() throws Exception {
            TestPlugins.registerPipeline(registry);
            Chain chain = chainBuilder.buildChain(Goal.of("report", "data/raw"));

            ChainRun run = inlineExecutor().runChain(chain, ExecutionMode.SEQUENTIAL,
                    RunOptions.builder().seed("data/raw", "seeded").build());

            assertThat(run.nodeState("Analyze").output()).containsEntry("report", "report(clean(seeded))");
        }

        @Test
        void shouldRejectMissingSeedValueBeforeRunning() throws Exception {
            TestPlugins.registerPipeline(registry);
            Chain chain = chainBuilder.buildChain(Goal.of("report", "data/raw"));
            ChainExecutor executor = inlineExecutor();

            assertThatThrownBy(() -> executor.runChain(chain, ExecutionMode.SEQUENTIAL))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("data/raw");
            assertThat(executor.getStore().size()).isZero();
        }

        @Test
        void shouldExposeContextAndRecordPerformance() throws Exception {
            List<String> seen = new ArrayList<>();
            registry.register(plugin("Probe", Set.of(), Set.of("report"), (in, ctx) -> {
                seen.add(ctx.getNodeId() + "@" + ctx.getChainId() + ":" + ctx.getAttribute("tenant"));
                return Map.of("report", ctx.getRunId());
            }));
            Chain chain = build("report");
            ChainExecutor executor = inlineExecutor();

            ChainRun run = executor.runChain(chain, ExecutionMode.SEQUENTIAL,
                    RunOptions.builder().attribute("tenant", "acme").build());

            assertThat(seen).containsExactly("Probe@" + chain.getId() + ":acme");
            assertThat(run.nodeState("Probe").output()).containsEntry("report", run.getRunId());
            assertThat(executor.getPerformanceTracker().statsFor("Probe"))
                    .hasValueSatisfying(p -> assertThat(p.executionCount()).isEqualTo(1));
        }

        @Test
        void shouldStoreRunAndReleaseAttachedResourcesOnCleanup() throws Exception {
            AtomicBoolean closed = new AtomicBoolean();
            registry.register(plugin("Holder", Set.of(), Set.of("report"), (in, ctx) -> {
                ctx.attachResource(() -> closed.set(true));
                return Map.of("report", "ok");
            }));
            ChainExecutor executor = inlineExecutor();

            ChainRun run = executor.runChain(build("report"), ExecutionMode.SEQUENTIAL);

            assertThat(executor.getStore().get(run.getRunId())).containsSame(run);
            assertThat(closed).isFalse();
            assertThat(executor.getStore().cleanup(run.getRunId())).isTrue();
            assertThat(closed).isTrue();
        }
    }

    private static Map<String, Object> meet(CyclicBarrier barrier, String tag) throws PluginException {
        try {
            barrier.await(5, TimeUnit.SECONDS);
            return Map.of(tag, tag);
        } catch (Exception e) {
            throw new PluginException("NOT_CONCURRENT", "sibling never arrived", e);
        }
    }

    private static void await(CountDownLatch latch) throws PluginException {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new PluginException("STUCK", "latch not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PluginException("INTERRUPTED", "interrupted");
        }
    }

    private static void sleep(long millis) throws PluginException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PluginException("INTERRUPTED", "interrupted");
        }
    }
}
