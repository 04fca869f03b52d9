package io.pluginchain.core;

import io.pluginchain.core.plugin.IoSpec;
import io.pluginchain.core.plugin.Plugin;
import io.pluginchain.core.plugin.PluginContext;
import io.pluginchain.core.plugin.PluginDescriptor;
import io.pluginchain.core.plugin.PluginException;
import io.pluginchain.core.plugin.PluginRegistry;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/// Small plugin implementations shared by tests.
public final class TestPlugins {

    private TestPlugins() {}

    @FunctionalInterface
    public interface Body {
        Map<String, Object> apply(Map<String, Object> inputs, PluginContext context)
                throws PluginException;
    }

    public static final class SimplePlugin implements Plugin {
        private final String name;
        private final IoSpec spec;
        private final Body body;

        public SimplePlugin(String name, Set<String> inputs, Set<String> outputs, Body body) {
            this.name = name;
            this.spec = IoSpec.of(inputs, outputs);
            this.body = body;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public IoSpec getIoSpec() {
            return spec;
        }

        @Override
        public Map<String, Object> execute(Map<String, Object> inputs, PluginContext context)
                throws PluginException {
            return body.apply(inputs, context);
        }
    }

    public static Plugin plugin(String name, Set<String> inputs, Set<String> outputs, Body body) {
        return new SimplePlugin(name, inputs, outputs, body);
    }

    /// Source producing a constant value.
    public static Plugin source(String name, String tag, Object value) {
        return plugin(name, Set.of(), Set.of(tag), (in, ctx) -> Map.of(tag, value));
    }

    /// Single-input plugin applying `fn` to its input.
    public static Plugin mapping(String name, String in, String out, UnaryOperator<Object> fn) {
        return plugin(name, Set.of(in), Set.of(out), (inputs, ctx) -> Map.of(out, fn.apply(inputs.get(in))));
    }

    /// Plugin wrapping its input as `label(input)`.
    public static Plugin wrapping(String name, String in, String out, String label) {
        return mapping(name, in, out, v -> label + "(" + v + ")");
    }

    public static Plugin failing(String name, Set<String> inputs, String out, String code) {
        return plugin(name, inputs, Set.of(out), (in, ctx) -> {
            throw new PluginException(code, name + " failed");
        });
    }

    /// Registers the three-stage pipeline Source -> Transform -> Analyze.
    public static void registerPipeline(PluginRegistry registry) {
        registry.register(source("Source", "data/raw", "raw"));
        registry.register(wrapping("Transform", "data/raw", "data/clean", "clean"));
        registry.register(wrapping("Analyze", "data/clean", "report", "report"));
    }

    public static PluginDescriptor descriptor(String name, Set<String> inputs, Set<String> outputs) {
        return PluginDescriptor.builder(name).inputs(inputs).outputs(outputs).build();
    }
}
