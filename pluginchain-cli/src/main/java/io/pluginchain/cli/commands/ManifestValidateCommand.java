package io.pluginchain.cli.commands;

import io.pluginchain.core.plugin.PluginDescriptor;
import io.pluginchain.serialization.DescriptorManifest;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import picocli.CommandLine;

/// CLI command that checks a descriptor manifest before it is used for planning.
///
/// Reports:
/// - duplicate plugin names (fatal, the registry would reject them)
/// - input tags no plugin in the manifest produces
/// - collaborators that name unknown plugins
/// - plugins excluded from automatic chaining
///
/// ### Usage
/// ```bash
/// pluginchain validate [-m plugins.json]
/// ```
@CommandLine.Command(name = "validate", description = "Validate a plugin descriptor manifest")
class ManifestValidateCommand extends ChainCommand {

    @Override
    protected void execute() {
        try {
            DescriptorManifest manifest = readManifest();
            List<PluginDescriptor> plugins = manifest.plugins();

            Set<String> names = new HashSet<>();
            Set<String> duplicates = new TreeSet<>();
            Set<String> produced = new HashSet<>();
            for (PluginDescriptor plugin : plugins) {
                if (!names.add(plugin.name())) {
                    duplicates.add(plugin.name());
                }
                produced.addAll(plugin.outputTypes());
            }

            if (!duplicates.isEmpty()) {
                printFailure("Duplicate plugin names: " + String.join(", ", duplicates));
                return;
            }

            System.out.println(" " + styles().success("[OK]") + " Manifest is valid!");
            System.out.println("   Plugins: " + plugins.size());
            System.out.println("   Output tags: " + produced.size());

            List<String> warnings = new ArrayList<>();
            List<String> manualOnly = new ArrayList<>();
            for (PluginDescriptor plugin : plugins) {
                Set<String> unsatisfied = new TreeSet<>(plugin.inputTypes());
                unsatisfied.removeAll(produced);
                if (!unsatisfied.isEmpty()) {
                    warnings.add(plugin.name() + " needs " + unsatisfied + " which no plugin produces");
                }
                Set<String> unknown = new TreeSet<>(plugin.collaboratesWith());
                unknown.removeAll(names);
                if (!unknown.isEmpty()) {
                    warnings.add(plugin.name() + " collaborates with unknown plugins " + unknown);
                }
                if (!plugin.autoChain()) {
                    manualOnly.add(plugin.name());
                }
            }
            for (String warning : warnings) {
                printWarning(warning);
            }
            if (!manualOnly.isEmpty()) {
                System.out.println(
                        "   Not auto-chained (used only as sole producer): " + String.join(", ", manualOnly));
            }
        } catch (Exception e) {
            printFailure("Validation failed: " + e.getMessage());
        }
    }
}
