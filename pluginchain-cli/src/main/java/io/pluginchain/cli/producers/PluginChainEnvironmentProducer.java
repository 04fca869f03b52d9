package io.pluginchain.cli.producers;

import io.pluginchain.core.PluginChainConfig;
import io.pluginchain.core.PluginChainEnvironment;
import io.pluginchain.core.PluginChainFactory;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.Properties;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.Config;

/// CDI producer for the plugin chain environment used by the commands.
///
/// Every `pluginchain.*` key of the Quarkus configuration (application.properties,
/// system properties, environment variables) is copied into a {@link PluginChainConfig},
/// so the CLI accepts exactly the keys the library documents.
///
/// ### CLI defaults
/// | Property | Default | Description |
/// |----------|---------|-------------|
/// | `pluginchain.executor.single-threaded` | `true` | the CLI never runs chains, so no pools are started |
/// | `pluginchain.suggest.max-suggestions` | `5` | upper bound for `suggest --limit` |
///
/// @implNote Application-scoped. The environment is closed on shutdown.
@ApplicationScoped
public class PluginChainEnvironmentProducer {

    private static final Logger logger =
            Logger.getLogger(PluginChainEnvironmentProducer.class.getName());

    private PluginChainEnvironment environment;

    @Inject Config config;

    /// Produces the environment singleton.
    ///
    /// @return configured environment, never null
    /// @throws IllegalArgumentException if a `pluginchain.*` value cannot be parsed
    @Produces
    @Singleton
    public PluginChainEnvironment pluginChainEnvironment() {
        environment = PluginChainFactory.createEnvironment(
                PluginChainConfig.fromProperties(extractPluginChainProperties()));
        logger.fine("Configured plugin chain environment for the command line");
        return environment;
    }

    /// Copies `pluginchain.*` entries from the Quarkus configuration.
    Properties extractPluginChainProperties() {
        Properties properties = new Properties();
        for (String propertyName : config.getPropertyNames()) {
            if (propertyName.startsWith(PluginChainConfig.PREFIX)) {
                config.getOptionalValue(propertyName, String.class)
                        .ifPresent(value -> properties.setProperty(propertyName, value));
            }
        }
        return properties;
    }

    @PreDestroy
    public void cleanup() {
        if (environment != null) {
            environment.close();
        }
    }
}
