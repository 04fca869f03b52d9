package io.pluginchain.cli.commands;

import io.pluginchain.cli.ui.AnsiStyles;
import io.pluginchain.core.PluginChainEnvironment;
import io.pluginchain.core.plugin.PluginRegistry;
import io.pluginchain.serialization.DescriptorManifest;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Path;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine.Option;

/// Base class for commands working on a plugin descriptor manifest.
///
/// ### Manifest Resolution
/// Priority order for the manifest file:
/// 1. CLI option `-m` / `--manifest`
/// 2. Config property `pluginchain.cli.manifest`
/// 3. `plugins.json` in the current directory
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see ChainPlanCommand
/// @see ChainSuggestCommand
/// @see ManifestValidateCommand
public abstract class ChainCommand implements Runnable {

    private static final String[] BANNER = {
        "",
        "       _             _",
        "  _ __| |_  _ __ _(_)_ _    __| |_  __ _(_)_ _",
        " | '_ \\ | || / _` | | ' \\  / _| ' \\/ _` | | ' \\",
        " | .__/_|\\_,_\\__, |_|_||_| \\__|_||_\\__,_|_|_||_|",
        " |_|         |___/",
        "",
        " Plugin Chain Orchestration",
        ""
    };

    @Option(
            names = {"-m", "--manifest"},
            description = "JSON plugin descriptor manifest")
    protected Path manifestPath;

    @Option(names = "--no-color", description = "Disable ANSI colors")
    protected boolean noColor;

    @Inject
    @ConfigProperty(name = "pluginchain.cli.manifest", defaultValue = "plugins.json")
    String defaultManifest;

    @Inject
    @ConfigProperty(name = "pluginchain.cli.color", defaultValue = "true")
    boolean colorEnabled;

    @Inject PluginChainEnvironment environment;

    @Override
    public final void run() {
        if (showBanner()) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        execute();
    }

    protected abstract void execute();

    /// Whether the banner precedes the command output. Machine-readable output turns it off.
    protected boolean showBanner() {
        return true;
    }

    protected boolean useColor() {
        return colorEnabled && !noColor;
    }

    protected AnsiStyles styles() {
        return AnsiStyles.of(useColor());
    }

    /// Prints a `[FAIL]` line to stderr.
    protected void printFailure(String message) {
        System.err.println(" " + styles().error("[FAIL]") + " " + message);
    }

    protected void printWarning(String message) {
        System.out.println(" " + styles().warn("[WARN]") + " " + message);
    }

    /// Returns the effective manifest path.
    ///
    /// @return manifest path, never null
    protected Path resolveManifestPath() {
        if (manifestPath != null) {
            return manifestPath;
        }
        if (defaultManifest != null && !defaultManifest.isBlank()) {
            return Path.of(defaultManifest);
        }
        return Path.of("plugins.json");
    }

    /// Reads the manifest without registering anything.
    ///
    /// @return parsed manifest, never null
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if the file is not a valid manifest
    protected DescriptorManifest readManifest() throws IOException {
        return DescriptorManifest.read(resolveManifestPath());
    }

    /// Reads the manifest and registers its descriptors in the environment's registry.
    ///
    /// @return the registry holding the manifest's plugins, never null
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if the file is not a valid manifest
    /// @throws io.pluginchain.core.exception.DuplicatePluginException if a name repeats
    protected PluginRegistry loadManifest() throws IOException {
        PluginRegistry registry = environment.getPluginRegistry();
        readManifest().registerAll(registry);
        return registry;
    }
}
