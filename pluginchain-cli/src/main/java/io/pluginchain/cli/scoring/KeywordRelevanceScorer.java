package io.pluginchain.cli.scoring;

import io.pluginchain.core.plugin.PluginDescriptor;
import io.pluginchain.core.suggest.RelevanceScorer;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/// Keyword-overlap {@link RelevanceScorer} for the command line.
///
/// The goal text is split into lowercase keywords (stop words and words shorter than three
/// letters dropped). A plugin's vocabulary is its name split at camel-case boundaries, its
/// input and output tags split at `/`, `_`, `-` and `.`, its description and its category.
/// The score is the fraction of goal keywords found in the vocabulary. Two words match when
/// they are equal or when the shorter one, at least four letters long, prefixes the other.
///
/// @implNote Thread-safe. Stateless.
@ApplicationScoped
public class KeywordRelevanceScorer implements RelevanceScorer {

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "from", "into", "that", "this", "then", "them",
            "our", "your", "my", "all", "any", "some", "please", "want", "need", "can", "get");

    @Override
    public double score(String goalText, PluginDescriptor descriptor) {
        Set<String> keywords = keywords(goalText);
        if (keywords.isEmpty()) {
            return 0.0;
        }
        return (double) matches(keywords, vocabulary(descriptor)).size() / keywords.size();
    }

    @Override
    public List<String> explain(String goalText, PluginDescriptor descriptor) {
        Set<String> matched = matches(keywords(goalText), vocabulary(descriptor));
        if (matched.isEmpty()) {
            return List.of();
        }
        return List.of("matched keywords " + String.join(", ", matched));
    }

    private static Set<String> matches(Set<String> keywords, Set<String> vocabulary) {
        Set<String> matched = new TreeSet<>();
        for (String keyword : keywords) {
            for (String word : vocabulary) {
                if (sameWord(keyword, word)) {
                    matched.add(keyword);
                    break;
                }
            }
        }
        return matched;
    }

    private static boolean sameWord(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        return shorter.length() >= 4 && longer.startsWith(shorter);
    }

    static Set<String> keywords(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String word : words(text)) {
            if (word.length() >= 3 && !STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    static Set<String> vocabulary(PluginDescriptor descriptor) {
        Set<String> vocabulary = new LinkedHashSet<>();
        vocabulary.addAll(words(descriptor.name().replaceAll("([a-z0-9])([A-Z])", "$1 $2")));
        descriptor.inputTypes().forEach(tag -> vocabulary.addAll(words(tag)));
        descriptor.outputTypes().forEach(tag -> vocabulary.addAll(words(tag)));
        vocabulary.addAll(words(descriptor.description()));
        vocabulary.addAll(words(descriptor.category()));
        return vocabulary;
    }

    private static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        for (String part : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (!part.isEmpty()) {
                words.add(part);
            }
        }
        return words;
    }
}
