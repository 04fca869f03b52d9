package io.pluginchain.core.chain;

import io.pluginchain.core.plugin.PluginDescriptor;
import io.pluginchain.core.plugin.PluginRegistry;
import io.pluginchain.core.plugin.ProducerOrdering;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/// Builds an acyclic {@link Chain} backwards from a goal's required output tag.
///
/// ### Algorithm
/// Starting at the goal tag, each unresolved tag is handed to the best eligible
/// producer among the candidates; that producer's input tags are then resolved the
/// same way, except tags the goal seeds. Producers are ranked by
/// {@link ProducerOrdering} relative to the plugins selected so far, so a plugin that
/// collaborates with an already chosen one wins over a higher-priority stranger.
///
/// ### Selection rules
/// - A tag with a single candidate producer uses it even if `autoChain` is false
/// - A tag with several candidates only considers `autoChain` producers
/// - A plugin yields at most one node (id = plugin name); choosing it again for a
///   second tag reuses its node
/// - There is no backtracking: the first ranked producer is final
///
/// ### Failures
/// - {@link NoViableChainException} when a tag has no eligible producer
/// - {@link CyclicDependencyException} when a tag, or the chosen producer, is already
///   on the current resolution path
///
/// No partial chain is returned on failure.
///
/// @implNote Thread-safe. Each call keeps its state in a private resolution object.
///
/// @see Chain for the produced graph
public class ChainBuilder {

    private static final Logger logger = Logger.getLogger(ChainBuilder.class.getName());

    private final PluginRegistry registry;

    /// Creates a builder that only accepts explicit candidate lists.
    public ChainBuilder() {
        this(null);
    }

    /// Creates a builder that can use every registered plugin as a candidate.
    ///
    /// @param registry registry supplying candidates to {@link #buildChain(Goal)}, may be null
    public ChainBuilder(PluginRegistry registry) {
        this.registry = registry;
    }

    /// Builds a chain considering every plugin in the registry.
    ///
    /// @param goal goal to resolve, not null
    /// @return validated chain, never null
    /// @throws ChainBuildException if no acyclic chain resolves the goal
    /// @throws IllegalStateException if this builder has no registry
    public Chain buildChain(Goal goal) throws ChainBuildException {
        if (registry == null) {
            throw new IllegalStateException("No registry configured; pass candidates explicitly");
        }
        return buildChain(goal, registry.list());
    }

    /// Builds a chain from an explicit candidate set.
    ///
    /// @param goal goal to resolve, not null
    /// @param candidates plugins the builder may select, not null
    /// @return validated chain, never null
    /// @throws ChainBuildException if no acyclic chain resolves the goal
    /// @throws IllegalArgumentException if the goal tag is itself seeded, or two candidates
    ///         share a name
    public Chain buildChain(Goal goal, Collection<PluginDescriptor> candidates)
            throws ChainBuildException {
        Objects.requireNonNull(goal, "goal must not be null");
        Objects.requireNonNull(candidates, "candidates must not be null");
        if (goal.isSeeded(goal.requiredOutputTag())) {
            throw new IllegalArgumentException(
                    "Goal tag '" + goal.requiredOutputTag() + "' is already a seed input");
        }

        Resolution resolution = new Resolution(goal, candidates);
        String goalNodeId = resolution.resolve(goal.requiredOutputTag());

        Chain.Builder builder = Chain.builder().goal(goal).goalNodeId(goalNodeId);
        resolution.selected.values().forEach(draft -> builder.node(draft.toNode()));
        builder.metadata(
                new ChainMetadata(ChainMetadata.CHAIN_BUILDER, resolution.selected.size()));
        Chain chain = builder.build();

        logger.info(
                "Built chain " + chain.getId() + " for goal '" + goal.requiredOutputTag()
                        + "' with " + chain.size() + " nodes: " + chain.executionOrder());
        return chain;
    }

    private static final class Resolution {
        private final Goal goal;
        private final Map<String, List<PluginDescriptor>> producersByTag = new HashMap<>();
        private final Map<String, String> resolverByTag = new HashMap<>();
        private final Map<String, NodeDraft> selected = new LinkedHashMap<>();
        private final Set<String> inProgress = new HashSet<>();
        private final Deque<String> tagPath = new ArrayDeque<>();

        Resolution(Goal goal, Collection<PluginDescriptor> candidates) {
            this.goal = goal;
            Set<String> names = new HashSet<>();
            for (PluginDescriptor descriptor : candidates) {
                if (!names.add(descriptor.name())) {
                    throw new IllegalArgumentException(
                            "Duplicate candidate plugin: " + descriptor.name());
                }
                for (String tag : descriptor.outputTypes()) {
                    producersByTag.computeIfAbsent(tag, k -> new ArrayList<>()).add(descriptor);
                }
            }
        }

        String resolve(String tag) throws ChainBuildException {
            if (tagPath.contains(tag)) {
                throw new CyclicDependencyException(cycleThrough(tag));
            }
            String existing = resolverByTag.get(tag);
            if (existing != null) {
                return existing;
            }

            PluginDescriptor chosen = choose(tag);
            if (inProgress.contains(chosen.name())) {
                throw new CyclicDependencyException(cycleThrough(tag));
            }
            if (selected.containsKey(chosen.name())) {
                logger.fine("Reusing node " + chosen.name() + " for tag '" + tag + "'");
                resolverByTag.put(tag, chosen.name());
                return chosen.name();
            }

            NodeDraft draft = new NodeDraft(chosen);
            selected.put(chosen.name(), draft);
            inProgress.add(chosen.name());
            tagPath.push(tag);
            for (String input : chosen.inputTypes()) {
                if (goal.isSeeded(input)) {
                    draft.seeds.add(input);
                    continue;
                }
                String producer = resolve(input);
                String previous = draft.inputs.putIfAbsent(input, producer);
                if (previous != null && !previous.equals(producer)) {
                    throw new AmbiguousFanInException(chosen.name(), input, previous, producer);
                }
            }
            tagPath.pop();
            inProgress.remove(chosen.name());
            resolverByTag.put(tag, chosen.name());
            return chosen.name();
        }

        private PluginDescriptor choose(String tag) throws NoViableChainException {
            List<PluginDescriptor> producers = producersByTag.getOrDefault(tag, List.of());
            if (producers.isEmpty()) {
                throw new NoViableChainException(tag, pathTo(tag), "no producer");
            }
            List<PluginDescriptor> ranked = new ArrayList<>(producers);
            ranked.sort(ProducerOrdering.relativeTo(selected.keySet()));
            if (ranked.size() > 1) {
                ranked.removeIf(d -> !d.autoChain());
                if (ranked.isEmpty()) {
                    throw new NoViableChainException(
                            tag, pathTo(tag), "only non-auto-chain producers");
                }
            }
            PluginDescriptor chosen = ranked.get(0);
            logger.fine(
                    "Selected " + chosen.name() + " for tag '" + tag + "' among "
                            + ranked.stream().map(PluginDescriptor::name).toList());
            return chosen;
        }

        private List<String> pathTo(String tag) {
            List<String> path = new ArrayList<>();
            tagPath.descendingIterator().forEachRemaining(path::add);
            path.add(tag);
            return path;
        }

        private List<String> cycleThrough(String tag) {
            List<String> path = pathTo(tag);
            int start = path.indexOf(tag);
            return start >= 0 && start < path.size() - 1 ? path.subList(start, path.size()) : path;
        }
    }

    private static final class NodeDraft {
        private final PluginDescriptor descriptor;
        private final Map<String, String> inputs = new TreeMap<>();
        private final Set<String> seeds = new TreeSet<>();

        NodeDraft(PluginDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        ChainNode toNode() {
            return new ChainNode(
                    descriptor.name(), descriptor.name(), inputs, seeds, descriptor.outputTypes());
        }
    }
}
