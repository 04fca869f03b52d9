package io.pluginchain.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pluginchain.core.plugin.DefaultPluginRegistry;
import io.pluginchain.core.plugin.PluginDescriptor;
import io.pluginchain.core.plugin.PluginRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DescriptorManifestTest {

    private static final String MANIFEST = """
            {
              "plugins": [
                {"name": "Source", "outputTypes": ["data/raw"]},
                {
                  "name": "Transform",
                  "inputTypes": ["data/raw"],
                  "outputTypes": ["data/clean"],
                  "collaboratesWith": ["Source"],
                  "chainPriority": 0.8,
                  "autoChain": false,
                  "description": "Cleans raw data",
                  "category": "etl"
                }
              ]
            }
            """;

    @Test
    void parse_appliesDefaultsForOmittedFields() {
        PluginDescriptor source = DescriptorManifest.parse(MANIFEST).plugins().get(0);

        assertThat(source.name()).isEqualTo("Source");
        assertThat(source.inputTypes()).isEmpty();
        assertThat(source.autoChain()).isTrue();
        assertThat(source.chainPriority()).isEqualTo(PluginDescriptor.DEFAULT_PRIORITY);
        assertThat(source.category()).isEqualTo(PluginDescriptor.DEFAULT_CATEGORY);
    }

    @Test
    void parse_readsAllDeclaredFields() {
        PluginDescriptor transform = DescriptorManifest.parse(MANIFEST).plugins().get(1);

        assertThat(transform.inputTypes()).containsExactly("data/raw");
        assertThat(transform.collaboratesWith()).containsExactly("Source");
        assertThat(transform.chainPriority()).isEqualTo(0.8);
        assertThat(transform.autoChain()).isFalse();
        assertThat(transform.description()).isEqualTo("Cleans raw data");
        assertThat(transform.category()).isEqualTo("etl");
    }

    @Test
    void parse_rejectsDescriptorWithoutOutputs() {
        String json = "{\"plugins\": [{\"name\": \"Sink\", \"inputTypes\": [\"x\"]}]}";

        assertThatThrownBy(() -> DescriptorManifest.parse(json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Sink");
    }

    @Test
    void parse_rejectsDescriptorWithoutName() {
        assertThatThrownBy(() -> DescriptorManifest.parse("{\"plugins\": [{\"outputTypes\": [\"x\"]}]}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name");
    }

    @Test
    void read_registersDescriptorsFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("plugins.json");
        Files.writeString(file, MANIFEST);
        PluginRegistry registry = new DefaultPluginRegistry();

        DescriptorManifest.read(file).registerAll(registry);

        assertThat(registry.list()).extracting(PluginDescriptor::name).containsExactly("Source", "Transform");
        assertThat(registry.getPlugin("Transform")).isEmpty();
    }

    @Test
    void toJson_isReadBack() {
        DescriptorManifest manifest = DescriptorManifest.parse(MANIFEST);

        assertThat(DescriptorManifest.parse(manifest.toJson())).isEqualTo(manifest);
    }
}
