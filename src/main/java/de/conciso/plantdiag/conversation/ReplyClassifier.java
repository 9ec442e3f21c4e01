package de.conciso.plantdiag.conversation;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Classifies a follow-up reply by keyword table. Entries are checked in table
 * order; a keyword hits if it occurs anywhere in the lower-cased reply.
 */
@Component
public class ReplyClassifier {

    public static final Map<ReplyType, List<String>> DEFAULT_KEYWORDS = defaultKeywords();

    private final Map<ReplyType, List<String>> keywords;

    @Autowired
    public ReplyClassifier() {
        this(DEFAULT_KEYWORDS);
    }

    public ReplyClassifier(Map<ReplyType, List<String>> keywords) {
        this.keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    public ReplyType classify(String reply) {
        String lower = reply == null ? "" : reply.trim().toLowerCase(Locale.ROOT);
        if (lower.isEmpty()) return ReplyType.NEW_SYMPTOM;
        for (Map.Entry<ReplyType, List<String>> entry : keywords.entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) {
                return entry.getKey();
            }
        }
        return ReplyType.NEW_SYMPTOM;
    }

    private static Map<ReplyType, List<String>> defaultKeywords() {
        Map<ReplyType, List<String>> table = new LinkedHashMap<>();
        table.put(ReplyType.CONFIRMED, List.of("yes", "y", "yeah", "definitely", "observed"));
        table.put(ReplyType.DENIED, List.of("no", "n", "nope", "not", "never", "absent"));
        return Collections.unmodifiableMap(table);
    }
}
