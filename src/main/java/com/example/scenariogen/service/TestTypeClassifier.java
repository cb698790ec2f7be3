package com.example.scenariogen.service;

import com.example.scenariogen.model.TestType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword heuristic that assigns a {@link TestType} to a scenario.
 * <p>
 * Keyword sets are checked in declaration order and the first set with a
 * substring hit wins, so "security" beats "performance" beats "usability"
 * beats "integration". No hit means {@link TestType#FUNCTIONAL}.
 */
@Component
public class TestTypeClassifier {

    private static final Map<TestType, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put(TestType.SECURITY,
                List.of("security", "auth", "authentication", "authorization", "permission"));
        KEYWORDS.put(TestType.PERFORMANCE,
                List.of("performance", "load", "stress", "speed", "response time"));
        KEYWORDS.put(TestType.USABILITY,
                List.of("usability", "user experience", "ux", "ui", "interface"));
        KEYWORDS.put(TestType.INTEGRATION,
                List.of("integration", "api", "webhook", "communication"));
    }

    /**
     * Classifies a scenario from its title and description. Null parts count as empty.
     */
    public TestType classify(String title, String description) {
        String text = ((description != null ? description : "") + " "
                + (title != null ? title : "")).toLowerCase(Locale.ROOT);

        for (Map.Entry<TestType, List<String>> entry : KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(text::contains)) {
                return entry.getKey();
            }
        }
        return TestType.FUNCTIONAL;
    }
}
