package io.pluginchain.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pluginchain.core.chain.Chain;
import io.pluginchain.core.chain.ChainBuilder;
import io.pluginchain.core.chain.Goal;
import io.pluginchain.core.execution.ChainExecutor;
import io.pluginchain.core.execution.ChainRun;
import io.pluginchain.core.execution.ErrorKind;
import io.pluginchain.core.execution.ExecutionMode;
import io.pluginchain.core.execution.NodeStatus;
import io.pluginchain.core.execution.RunSnapshot;
import io.pluginchain.core.execution.RunStatus;
import io.pluginchain.core.plugin.DefaultPluginRegistry;
import io.pluginchain.core.plugin.IoSpec;
import io.pluginchain.core.plugin.Plugin;
import io.pluginchain.core.plugin.PluginContext;
import io.pluginchain.core.plugin.PluginException;
import io.pluginchain.core.plugin.PluginRegistry;
import io.pluginchain.core.storage.InMemoryChainRunStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileRunArchiveTest {

    private static Plugin plugin(String name, Set<String> in, String out, boolean fail) {
        return new Plugin() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public IoSpec getIoSpec() {
                return IoSpec.of(in, Set.of(out));
            }

            @Override
            public Map<String, Object> execute(Map<String, Object> inputs, PluginContext context)
                    throws PluginException {
                if (fail) {
                    throw new PluginException("BROKEN", name + " failed");
                }
                return Map.of(out, name);
            }
        };
    }

    @Test
    void cleanup_writesSnapshotThatReadsBack(@TempDir Path dir) throws Exception {
        PluginRegistry registry = new DefaultPluginRegistry();
        registry.register(plugin("Source", Set.of(), "data/raw", false));
        registry.register(plugin("Transform", Set.of("data/raw"), "data/clean", true));
        registry.register(plugin("Analyze", Set.of("data/clean"), "report", false));
        Chain chain = new ChainBuilder(registry).buildChain(Goal.of("report"));
        JsonFileRunArchive archive = new JsonFileRunArchive(dir.resolve("runs"));
        InMemoryChainRunStore store = new InMemoryChainRunStore(archive, Clock.systemUTC());
        ChainRun run = ChainExecutor.builder(registry).store(store).build()
                .runChain(chain, ExecutionMode.SEQUENTIAL);

        store.cleanup(run.getRunId());

        assertThat(Files.exists(dir.resolve("runs").resolve(run.getRunId() + ".json"))).isTrue();
        RunSnapshot restored = archive.read(run.getRunId()).orElseThrow();
        assertThat(restored.status()).isEqualTo(RunStatus.PARTIAL_FAILURE);
        assertThat(restored.chainId()).isEqualTo(chain.getId());
        assertThat(restored.startedAt()).isEqualTo(run.getStartedAt());
        assertThat(restored.nodeStates().keySet()).containsExactly("Source", "Transform", "Analyze");
        assertThat(restored.nodeStates().get("Source").output()).containsEntry("data/raw", "Source");
        assertThat(restored.nodeStates().get("Transform").error().code()).isEqualTo("BROKEN");
        assertThat(restored.nodeStates().get("Analyze").status()).isEqualTo(NodeStatus.SKIPPED);
        assertThat(restored.nodeStates().get("Analyze").error().kind()).isEqualTo(ErrorKind.UPSTREAM_FAILED);
    }

    @Test
    void read_returnsEmptyForUnknownRun(@TempDir Path dir) throws Exception {
        assertThat(new JsonFileRunArchive(dir).read("run-unknown")).isEmpty();
    }

    @Test
    void read_rejectsPathTraversal(@TempDir Path dir) {
        assertThatThrownBy(() -> new JsonFileRunArchive(dir).read("../etc/passwd"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
