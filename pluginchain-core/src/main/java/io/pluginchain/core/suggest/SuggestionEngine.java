package io.pluginchain.core.suggest;

import io.pluginchain.core.chain.Chain;
import io.pluginchain.core.chain.ChainBuildException;
import io.pluginchain.core.chain.ChainBuilder;
import io.pluginchain.core.chain.ChainNode;
import io.pluginchain.core.chain.Goal;
import io.pluginchain.core.execution.PluginPerformanceTracker;
import io.pluginchain.core.plugin.PluginDescriptor;
import io.pluginchain.core.plugin.PluginRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Ranks candidate chains for a free-text goal without executing anything.
///
/// ### Process
/// 1. Score every registered plugin with the injected {@link RelevanceScorer}
/// 2. Keep plugins scoring at least `minScore`, best first, up to `maxGoalCandidates`
/// 3. For each kept plugin and each of its output tags not already available, dry-build
///    a chain with that plugin forced as the tag's producer
/// 4. Drop goals that cannot be built and chains already proposed
/// 5. Rank by mean node relevance descending, then fewer nodes, then confidence
///    descending, then chain id
///
/// @implNote Thread-safe. The engine keeps no per-request state.
///
/// @see ChainSuggestion for the result shape
public class SuggestionEngine {

    private static final Logger logger = Logger.getLogger(SuggestionEngine.class.getName());

    public static final int DEFAULT_MAX_SUGGESTIONS = 5;
    public static final int DEFAULT_MAX_GOAL_CANDIDATES = 10;
    public static final double DEFAULT_MIN_SCORE = 0.1;

    private static final Comparator<ChainSuggestion> RANKING =
            Comparator.comparingDouble(ChainSuggestion::aggregateScore).reversed()
                    .thenComparingInt(s -> s.chainSketch().size())
                    .thenComparing(Comparator.comparingDouble(ChainSuggestion::confidence).reversed())
                    .thenComparing(s -> s.chainSketch().getId());

    private final PluginRegistry registry;
    private final ChainBuilder chainBuilder;
    private final PluginPerformanceTracker tracker;
    private final int maxSuggestions;
    private final int maxGoalCandidates;
    private final double minScore;

    /// Creates an engine with default limits.
    ///
    /// @param registry registry to draw plugins from, not null
    /// @param chainBuilder builder used for dry builds, not null
    /// @param tracker source of duration estimates, not null
    public SuggestionEngine(
            PluginRegistry registry, ChainBuilder chainBuilder, PluginPerformanceTracker tracker) {
        this(registry, chainBuilder, tracker,
                DEFAULT_MAX_SUGGESTIONS, DEFAULT_MAX_GOAL_CANDIDATES, DEFAULT_MIN_SCORE);
    }

    /// Creates an engine.
    ///
    /// @param registry registry to draw plugins from, not null
    /// @param chainBuilder builder used for dry builds, not null
    /// @param tracker source of duration estimates, not null
    /// @param maxSuggestions maximum suggestions returned, positive
    /// @param maxGoalCandidates maximum plugins turned into candidate goals, positive
    /// @param minScore minimum relevance for a candidate goal, within `[0, 1]`
    public SuggestionEngine(
            PluginRegistry registry,
            ChainBuilder chainBuilder,
            PluginPerformanceTracker tracker,
            int maxSuggestions,
            int maxGoalCandidates,
            double minScore) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.chainBuilder = Objects.requireNonNull(chainBuilder, "chainBuilder must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        if (maxSuggestions < 1 || maxGoalCandidates < 1) {
            throw new IllegalArgumentException("Suggestion limits must be positive");
        }
        if (minScore < 0.0 || minScore > 1.0) {
            throw new IllegalArgumentException("minScore must be within [0, 1]: " + minScore);
        }
        this.maxSuggestions = maxSuggestions;
        this.maxGoalCandidates = maxGoalCandidates;
        this.minScore = minScore;
    }

    /// Suggests chains for a goal.
    ///
    /// @param goalText free-text goal, not null
    /// @param context caller context, not null
    /// @param scorer relevance scorer, not null
    /// @return ranked suggestions, never null (empty if nothing could be built)
    /// @throws IllegalArgumentException if the scorer returns a value outside `[0, 1]`
    public List<ChainSuggestion> suggestChains(
            String goalText, SuggestionContext context, RelevanceScorer scorer) {
        Objects.requireNonNull(goalText, "goalText must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(scorer, "scorer must not be null");

        List<PluginDescriptor> pool = registry.list(d -> !context.excludedPlugins().contains(d.name()));
        Map<String, Double> scores = new HashMap<>();
        Map<String, PluginDescriptor> byName = new HashMap<>();
        for (PluginDescriptor descriptor : pool) {
            double score = scorer.score(goalText, descriptor);
            if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
                throw new IllegalArgumentException(
                        "Relevance of " + descriptor.name() + " must be within [0, 1] but was " + score);
            }
            scores.put(descriptor.name(), score);
            byName.put(descriptor.name(), descriptor);
        }

        List<PluginDescriptor> goalCandidates = pool.stream()
                .filter(d -> scores.get(d.name()) >= minScore)
                .sorted(Comparator.comparingDouble((PluginDescriptor d) -> scores.get(d.name()))
                        .reversed()
                        .thenComparing(PluginDescriptor::name))
                .limit(maxGoalCandidates)
                .toList();

        Map<String, ChainSuggestion> unique = new LinkedHashMap<>();
        for (PluginDescriptor candidate : goalCandidates) {
            for (String tag : candidate.outputTypes()) {
                if (context.availableInputs().contains(tag)) {
                    continue;
                }
                Goal goal = Goal.of(tag, context.availableInputs());
                List<PluginDescriptor> candidates = pool.stream()
                        .filter(d -> d == candidate || !d.produces(tag))
                        .toList();
                Chain chain;
                try {
                    chain = chainBuilder.buildChain(goal, candidates);
                } catch (ChainBuildException e) {
                    logger.fine("Skipping goal '" + tag + "' via " + candidate.name() + ": "
                            + e.getMessage());
                    continue;
                }
                unique.putIfAbsent(chain.getId(), toSuggestion(goalText, chain, scores, byName, scorer));
            }
        }

        List<ChainSuggestion> ranked = new ArrayList<>(unique.values());
        ranked.sort(RANKING);
        return List.copyOf(ranked.subList(0, Math.min(maxSuggestions, ranked.size())));
    }

    private ChainSuggestion toSuggestion(
            String goalText,
            Chain chain,
            Map<String, Double> scores,
            Map<String, PluginDescriptor> byName,
            RelevanceScorer scorer) {
        ChainNode goalNode = chain.node(chain.getGoalNodeId()).orElseThrow();
        double confidence = scores.get(goalNode.pluginName());

        double total = 0.0;
        Duration estimate = Duration.ZERO;
        List<String> rationale = new ArrayList<>();
        rationale.add(String.format(Locale.ROOT, "%s produces '%s' (relevance %.2f)",
                goalNode.pluginName(), chain.getGoal().requiredOutputTag(), confidence));
        rationale.addAll(scorer.explain(goalText, byName.get(goalNode.pluginName())));
        for (ChainNode node : chain.getNodes()) {
            double score = scores.get(node.pluginName());
            total += score;
            estimate = estimate.plus(tracker.averageFor(node.pluginName()));
            if (!node.id().equals(goalNode.id())) {
                rationale.add(String.format(Locale.ROOT, "%s supplies %s (relevance %.2f)",
                        node.pluginName(), node.outputTypes(), score));
            }
        }
        return new ChainSuggestion(chain, confidence, total / chain.size(), rationale, estimate);
    }
}
