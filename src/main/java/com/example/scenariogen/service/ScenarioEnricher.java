package com.example.scenariogen.service;

import com.example.scenariogen.model.Coverage;
import com.example.scenariogen.model.RequirementSet;
import com.example.scenariogen.model.Scenario;
import com.example.scenariogen.model.ScenarioDraft;
import com.example.scenariogen.model.TestType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns model drafts into enriched scenarios.
 * <p>
 * Per draft, in order:
 * <ol>
 *   <li>Priority filter: drop drafts whose priority differs from the requested one</li>
 *   <li>Focus tagging: caller keywords found in description + title</li>
 *   <li>Coverage: comma separated related requirements over the requirement count</li>
 *   <li>ID canonicalization: {@code TS-} prefix</li>
 *   <li>Test type classification</li>
 *   <li>Description cleanup: markdown markers removed, whitespace collapsed</li>
 * </ol>
 * Malformed drafts never fail the run: missing fields are treated as empty.
 * All scenarios of one run share the same timestamp. Draft order is preserved.
 */
@Service
public class ScenarioEnricher {

    private static final Logger log = LoggerFactory.getLogger(ScenarioEnricher.class);

    static final String ID_PREFIX = "TS-";

    private static final Pattern MARKDOWN_MARKERS = Pattern.compile("[*#`]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final TestTypeClassifier testTypeClassifier;
    private final Clock clock;

    public ScenarioEnricher(TestTypeClassifier testTypeClassifier, Clock clock) {
        this.testTypeClassifier = testTypeClassifier;
        this.clock = clock;
    }

    /**
     * Enriches the drafts of one generation call.
     *
     * @param drafts        drafts in model order
     * @param requirements  requirement set the drafts were generated from
     * @param priorityFocus keep only this priority (case-insensitive); null or blank keeps all
     * @param customFocus   keyword phrases to tag; may be null
     * @return enriched scenarios, filtered by priority, in draft order
     */
    public List<Scenario> enrich(List<ScenarioDraft> drafts, RequirementSet requirements,
                                 String priorityFocus, List<String> customFocus) {
        if (drafts == null || drafts.isEmpty()) return List.of();

        Instant timestamp = Instant.now(clock);
        int totalRequirements = requirements != null ? requirements.totalRequirements() : 0;
        String wantedPriority = priorityFocus != null && !priorityFocus.isBlank()
                ? foldCase(priorityFocus)
                : null;

        List<Scenario> enriched = new ArrayList<>(drafts.size());
        int dropped = 0;
        for (ScenarioDraft draft : drafts) {
            if (draft == null) {
                dropped++;
                continue;
            }
            if (wantedPriority != null
                    && (draft.priority() == null || !wantedPriority.equals(foldCase(draft.priority())))) {
                dropped++;
                continue;
            }

            TestType testType = testTypeClassifier.classify(draft.title(), draft.description());
            enriched.add(new Scenario(
                    canonicalId(draft.id()),
                    draft.title(),
                    normalizeDescription(draft.description()),
                    draft.relatedRequirements(),
                    draft.priority(),
                    timestamp,
                    focusAreas(draft.title(), draft.description(), customFocus),
                    coverage(draft.relatedRequirements(), totalRequirements),
                    testType
            ));
        }

        log.info("ScenarioEnricher: {} scenarios enriched, {} dropped (priority focus: {})",
                enriched.size(), dropped, wantedPriority != null ? wantedPriority : "none");
        return enriched;
    }

    /**
     * Focus phrases contained (case-insensitively) in description + title,
     * in the caller's order and casing, without duplicates.
     */
    static List<String> focusAreas(String title, String description, List<String> customFocus) {
        if (customFocus == null || customFocus.isEmpty()) return List.of();

        String text = foldCase((description != null ? description : "") + " "
                + (title != null ? title : ""));
        Set<String> matched = new LinkedHashSet<>();
        for (String focus : customFocus) {
            if (focus != null && !focus.isEmpty() && text.contains(foldCase(focus))) {
                matched.add(focus);
            }
        }
        return List.copyOf(matched);
    }

    /**
     * Coverage claimed by a comma separated list of requirement ids.
     * Ids are not checked against the requirement set.
     */
    static Coverage coverage(String relatedRequirements, int totalRequirements) {
        if (relatedRequirements == null) return Coverage.none();

        List<String> covered = Arrays.stream(relatedRequirements.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
        double percentage = totalRequirements > 0
                ? 100.0 * covered.size() / totalRequirements
                : 0.0;
        return new Coverage(covered, percentage);
    }

    static String canonicalId(String id) {
        if (id == null || id.startsWith(ID_PREFIX)) return id;
        return ID_PREFIX + id;
    }

    static String normalizeDescription(String description) {
        if (description == null) return null;
        String unmarked = MARKDOWN_MARKERS.matcher(description).replaceAll("");
        return WHITESPACE.matcher(unmarked).replaceAll(" ").strip();
    }

    private static String foldCase(String s) {
        return s.strip().toLowerCase(Locale.ROOT);
    }
}
