package de.conciso.plantdiag.service;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reconciles free-text symptom wording with canonical symptom names.
 *
 * <p>{@link #matches(String, String)} is symmetric but not transitive. Use it as a
 * pairwise test only, never to group symptoms.</p>
 */
@Component
public class SymptomMatcher {

    static final Set<String> STOP_WORDS = Set.of("on", "the", "of", "in", "at", "with", "and", "or", "a", "an");

    static final Map<String, List<String>> KEYWORD_SYNONYMS = keywordSynonyms();

    static final double MIN_WORD_OVERLAP = 0.5;

    private static final Pattern EDGES = Pattern.compile("^[\\s.,;:!?]+|[\\s.,;:!?]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Ausgewertet in dieser Reihenfolge, erster Treffer gewinnt.
    private final List<BiPredicate<String, String>> rules = List.of(
            String::equals,
            (a, b) -> a.contains(b) || b.contains(a),
            this::wordOverlap,
            this::sharesKeyword
    );

    public String normalize(String text) {
        if (text == null) return "";
        String trimmed = EDGES.matcher(text).replaceAll("");
        return WHITESPACE.matcher(trimmed).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    public boolean matches(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        // An empty side would be a substring of everything.
        if (left.isEmpty() || right.isEmpty()) return false;
        for (BiPredicate<String, String> rule : rules) {
            if (rule.test(left, right)) return true;
        }
        return false;
    }

    /** True if {@code candidate} fuzzily matches any entry of {@code pool}. */
    public boolean matchesAny(String candidate, Iterable<String> pool) {
        for (String other : pool) {
            if (matches(candidate, other)) return true;
        }
        return false;
    }

    // --- rules ---

    boolean wordOverlap(String a, String b) {
        Set<String> left = contentWords(a);
        Set<String> right = contentWords(b);
        if (left.isEmpty() || right.isEmpty()) return false;

        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        return (double) intersection.size() / union.size() > MIN_WORD_OVERLAP;
    }

    boolean sharesKeyword(String a, String b) {
        for (Map.Entry<String, List<String>> entry : KEYWORD_SYNONYMS.entrySet()) {
            if (mentions(a, entry.getKey(), entry.getValue()) && mentions(b, entry.getKey(), entry.getValue())) {
                return true;
            }
        }
        return false;
    }

    private static boolean mentions(String text, String keyword, List<String> synonyms) {
        return text.contains(keyword) || synonyms.stream().anyMatch(text::contains);
    }

    private static Set<String> contentWords(String text) {
        return Arrays.stream(text.split(" "))
                .filter(w -> !w.isEmpty() && !STOP_WORDS.contains(w))
                .collect(Collectors.toSet());
    }

    private static Map<String, List<String>> keywordSynonyms() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("yellow", List.of("yellowing", "chlorosis"));
        table.put("brown", List.of("browning", "necrosis"));
        table.put("wilt", List.of("wilting", "drooping"));
        table.put("spot", List.of("spots", "lesions", "patches"));
        table.put("dry", List.of("drying", "dried", "dessication"));
        table.put("rot", List.of("rotting", "decay", "decomposition"));
        table.put("stunt", List.of("stunted", "stunting", "dwarf"));
        return Collections.unmodifiableMap(table);
    }
}
