package de.conciso.plantdiag.conversation;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

@Component
public class QuestionFormatter {

    static final String OPEN_PROMPT = "Please describe any other symptoms you observe.";

    private record Rule(Predicate<String> applies, String template) {}

    private static final List<Rule> RULES = List.of(
            new Rule(containsAny("soil", "ground", "environment"), "Do you observe %s around the plant?"),
            new Rule(containsAny("stress", "condition", "temperature"), "Is the plant showing signs of %s?"),
            new Rule(s -> s.startsWith("dry") || s.startsWith("wet"), "Are there %s conditions affecting the plant?")
    );

    private static final String DEFAULT_TEMPLATE = "Do you observe %s on the plant?";

    public String format(String symptom) {
        if (symptom == null || symptom.isBlank()) return OPEN_PROMPT;
        String s = symptom.trim().toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.applies().test(s)) return String.format(rule.template(), s);
        }
        return String.format(DEFAULT_TEMPLATE, s);
    }

    private static Predicate<String> containsAny(String... words) {
        return s -> {
            for (String w : words) {
                if (s.contains(w)) return true;
            }
            return false;
        };
    }
}
