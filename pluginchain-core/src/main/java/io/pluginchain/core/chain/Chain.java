package io.pluginchain.core.chain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/// Immutable, validated, acyclic graph of plugin invocations resolving a goal.
///
/// Nodes are always held in canonical topological order: producers before consumers,
/// ties broken by node id ascending. This order is the execution order for sequential
/// runs. Edges are derived from each node's `resolvedInputs`, so they cannot disagree
/// with the nodes.
///
/// ### Validation
/// The builder rejects:
/// - duplicate node ids, or a goal node that does not produce the goal tag
/// - an input resolved to a missing node, or to a node that does not output that tag
/// - seed inputs that the goal does not declare
/// - explicit edges that claim the same consumer input twice ({@link AmbiguousFanInException})
/// - any cycle
///
/// ### Identity
/// Unless given explicitly, the id is derived from a SHA-256 digest of the canonical
/// form, so two chains with the same goal and nodes share an id and serialize
/// identically.
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see ChainBuilder for automatic construction
public final class Chain {

    private final String id;
    private final Goal goal;
    private final String goalNodeId;
    private final List<ChainNode> nodes;
    private final List<ChainEdge> edges;
    private final ChainMetadata metadata;
    private final Map<String, ChainNode> nodesById;
    private final Map<String, Set<String>> dependents;

    private Chain(Builder builder) {
        this.goal = Objects.requireNonNull(builder.goal, "Chain goal required");
        this.goalNodeId = Objects.requireNonNull(builder.goalNodeId, "Goal node required");
        if (builder.nodes.isEmpty()) {
            throw new IllegalStateException("Chain must contain at least one node");
        }
        this.nodesById = Collections.unmodifiableMap(new HashMap<>(builder.nodes));

        validateNodes();
        this.edges = deriveEdges(nodesById.values());
        if (builder.edges != null) {
            checkExplicitEdges(builder.edges);
        }
        this.nodes = List.copyOf(topologicalOrder());
        this.dependents = indexDependents();
        this.metadata = builder.metadata != null
                ? builder.metadata
                : new ChainMetadata(ChainMetadata.CHAIN_BUILDER, distinctPlugins());
        this.id = builder.id != null ? builder.id : "chain-" + digest(canonicalForm());
    }

    private void validateNodes() {
        ChainNode goalNode = nodesById.get(goalNodeId);
        if (goalNode == null) {
            throw new IllegalStateException("Goal node '" + goalNodeId + "' not found in chain");
        }
        if (!goalNode.outputTypes().contains(goal.requiredOutputTag())) {
            throw new IllegalStateException(
                    "Goal node '" + goalNodeId + "' does not produce '"
                            + goal.requiredOutputTag() + "'");
        }
        for (ChainNode node : nodesById.values()) {
            for (Map.Entry<String, String> input : node.resolvedInputs().entrySet()) {
                ChainNode producer = nodesById.get(input.getValue());
                if (producer == null) {
                    throw new IllegalStateException(
                            "Node '" + node.id() + "' input '" + input.getKey()
                                    + "' references unknown node '" + input.getValue() + "'");
                }
                if (!producer.outputTypes().contains(input.getKey())) {
                    throw new IllegalStateException(
                            "Node '" + producer.id() + "' does not output '" + input.getKey()
                                    + "' required by '" + node.id() + "'");
                }
            }
            for (String seed : node.seedInputs()) {
                if (!goal.isSeeded(seed)) {
                    throw new IllegalStateException(
                            "Node '" + node.id() + "' expects undeclared seed input '" + seed + "'");
                }
            }
        }
    }

    private static List<ChainEdge> deriveEdges(Collection<ChainNode> nodes) {
        List<ChainEdge> derived = new ArrayList<>();
        for (ChainNode node : nodes) {
            node.resolvedInputs()
                    .forEach((tag, producer) -> derived.add(new ChainEdge(producer, node.id(), tag)));
        }
        derived.sort(ChainEdge.CANONICAL_ORDER);
        return List.copyOf(derived);
    }

    private void checkExplicitEdges(List<ChainEdge> explicit) {
        Map<String, String> claimed = new HashMap<>();
        for (ChainEdge edge : explicit) {
            String key = edge.consumerId() + "\u0000" + edge.tag();
            String previous = claimed.putIfAbsent(key, edge.producerId());
            if (previous != null) {
                throw new AmbiguousFanInException(
                        edge.consumerId(), edge.tag(), previous, edge.producerId());
            }
        }
        if (!new HashSet<>(explicit).equals(new HashSet<>(edges))) {
            throw new IllegalStateException(
                    "Edges " + explicit + " do not match node inputs " + edges);
        }
    }

    private List<ChainNode> topologicalOrder() {
        Map<String, Integer> remaining = new HashMap<>();
        Map<String, List<String>> consumers = new HashMap<>();
        for (ChainNode node : nodesById.values()) {
            Set<String> deps = node.dependencies();
            remaining.put(node.id(), deps.size());
            for (String dep : deps) {
                consumers.computeIfAbsent(dep, k -> new ArrayList<>()).add(node.id());
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>();
        remaining.forEach((nodeId, count) -> {
            if (count == 0) {
                ready.add(nodeId);
            }
        });

        List<ChainNode> ordered = new ArrayList<>(nodesById.size());
        while (!ready.isEmpty()) {
            String nodeId = ready.poll();
            ordered.add(nodesById.get(nodeId));
            for (String consumer : consumers.getOrDefault(nodeId, List.of())) {
                if (remaining.merge(consumer, -1, Integer::sum) == 0) {
                    ready.add(consumer);
                }
            }
        }
        if (ordered.size() != nodesById.size()) {
            throw new IllegalStateException("Chain contains a cycle");
        }
        return ordered;
    }

    private Map<String, Set<String>> indexDependents() {
        Map<String, Set<String>> index = new HashMap<>();
        for (ChainNode node : nodes) {
            index.put(node.id(), new TreeSet<>());
        }
        for (ChainEdge edge : edges) {
            index.get(edge.producerId()).add(edge.consumerId());
        }
        index.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        return Collections.unmodifiableMap(index);
    }

    private int distinctPlugins() {
        Set<String> plugins = new HashSet<>();
        nodesById.values().forEach(n -> plugins.add(n.pluginName()));
        return plugins.size();
    }

    /// Returns the canonical text form the chain id is derived from.
    ///
    /// @return stable string covering goal, nodes and inputs, never null
    public String canonicalForm() {
        StringBuilder sb = new StringBuilder();
        sb.append("goal=").append(goal.requiredOutputTag())
                .append(";seeds=").append(goal.seedInputs())
                .append(";goalNode=").append(goalNodeId);
        for (ChainNode node : nodes) {
            sb.append(";node=").append(node.id())
                    .append('|').append(node.pluginName())
                    .append('|').append(node.resolvedInputs())
                    .append('|').append(node.seedInputs())
                    .append('|').append(node.outputTypes());
        }
        return sb.toString();
    }

    private static String digest(String text) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256")
                    .digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /// Returns the chain identifier.
    ///
    /// @return content-derived or explicitly assigned id, never null
    public String getId() {
        return id;
    }

    public Goal getGoal() {
        return goal;
    }

    /// Returns the id of the node that produces the goal tag.
    ///
    /// @return goal node id, never null
    public String getGoalNodeId() {
        return goalNodeId;
    }

    /// Returns the nodes in canonical topological order.
    ///
    /// @return unmodifiable list, never empty
    public List<ChainNode> getNodes() {
        return nodes;
    }

    /// Returns every producer-to-consumer edge in canonical order.
    ///
    /// @return unmodifiable list, never null
    public List<ChainEdge> getEdges() {
        return edges;
    }

    public ChainMetadata getMetadata() {
        return metadata;
    }

    /// Looks up a node by id.
    ///
    /// @param nodeId node identifier, not null
    /// @return the node, or empty if not part of this chain
    public Optional<ChainNode> node(String nodeId) {
        return Optional.ofNullable(nodesById.get(nodeId));
    }

    /// Returns the node ids in execution order.
    ///
    /// @return unmodifiable list of ids, never null
    public List<String> executionOrder() {
        return nodes.stream().map(ChainNode::id).toList();
    }

    /// Returns the nodes that consume an output of the given node directly.
    ///
    /// @param nodeId producer node id, not null
    /// @return sorted set of consumer ids, empty if none or unknown
    public Set<String> dependentsOf(String nodeId) {
        return dependents.getOrDefault(nodeId, Set.of());
    }

    /// Returns every node that depends on the given node, directly or transitively.
    ///
    /// @param nodeId producer node id, not null
    /// @return sorted set of node ids excluding `nodeId`, never null
    public Set<String> transitiveDependentsOf(String nodeId) {
        Set<String> seen = new TreeSet<>();
        Deque<String> work = new ArrayDeque<>(dependentsOf(nodeId));
        while (!work.isEmpty()) {
            String next = work.pop();
            if (seen.add(next)) {
                work.addAll(dependentsOf(next));
            }
        }
        return Collections.unmodifiableSet(seen);
    }

    /// Returns the number of nodes.
    ///
    /// @return node count, always positive
    public int size() {
        return nodes.size();
    }

    /// Creates a builder for manual chain assembly.
    ///
    /// @return new builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link Chain}.
    ///
    /// @implNote **Not thread-safe**.
    public static final class Builder {
        private String id;
        private Goal goal;
        private String goalNodeId;
        private final Map<String, ChainNode> nodes = new LinkedHashMap<>();
        private List<ChainEdge> edges;
        private ChainMetadata metadata;

        private Builder() {}

        /// Sets an explicit id; omit to derive one from the chain contents.
        ///
        /// @param id chain identifier, may be null
        /// @return this builder for chaining
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder goal(Goal goal) {
            this.goal = goal;
            return this;
        }

        public Builder goalNodeId(String goalNodeId) {
            this.goalNodeId = goalNodeId;
            return this;
        }

        /// Replaces all nodes.
        ///
        /// @param nodes nodes in any order, not null
        /// @return this builder for chaining
        public Builder nodes(List<ChainNode> nodes) {
            this.nodes.clear();
            nodes.forEach(this::node);
            return this;
        }

        /// Adds a node.
        ///
        /// @param node node to add, not null
        /// @return this builder for chaining
        /// @throws IllegalStateException if a node with the same id was added already
        public Builder node(ChainNode node) {
            Objects.requireNonNull(node, "node must not be null");
            if (nodes.putIfAbsent(node.id(), node) != null) {
                throw new IllegalStateException("Duplicate node id: " + node.id());
            }
            return this;
        }

        /// Declares edges to be checked against the node inputs.
        ///
        /// @param edges explicit edges, may be null to skip the check
        /// @return this builder for chaining
        public Builder edges(List<ChainEdge> edges) {
            this.edges = edges != null ? List.copyOf(edges) : null;
            return this;
        }

        public Builder metadata(ChainMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        /// Builds and validates the chain.
        ///
        /// @return immutable chain, never null
        /// @throws NullPointerException if goal or goal node id is missing
        /// @throws AmbiguousFanInException if explicit edges claim one input twice
        /// @throws IllegalStateException if any other structural check fails
        public Chain build() {
            return new Chain(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Chain chain)) return false;
        return id.equals(chain.id) && canonicalForm().equals(chain.canonicalForm());
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Chain{id='" + id + "', goal='" + goal.requiredOutputTag() + "', nodes="
                + executionOrder() + "}";
    }
}
