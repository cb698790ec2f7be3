package com.example.scenariogen.service;

import com.example.scenariogen.model.ScenarioDraft;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Parses a model completion into {@link ScenarioDraft}s.
 * <p>
 * Two shapes are understood:
 * <ul>
 *   <li>Labelled lines ({@code Test Scenario ID: ...}, {@code Title: ...}, ...), possibly
 *       decorated with markdown bullets, headings or emphasis</li>
 *   <li>A JSON array of scenario objects, or an object with a {@code scenarios} array,
 *       optionally inside a code fence</li>
 * </ul>
 * Never throws: content that cannot be understood yields no drafts.
 */
@Component
public class ScenarioResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ScenarioResponseParser.class);

    /** Lenient ObjectMapper that tolerates trailing commas, comments, and single quotes. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build();

    private static final Pattern CODE_FENCE =
            Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private static final Pattern FIELD_LINE = Pattern.compile(
            "^[\\s>#*_\\-]*(?:\\d+[.)]\\s*)?[*_]*"
                    + "(test\\s+scenario\\s+id|scenario\\s+id|id|title|description"
                    + "|related\\s+requirements?(?:\\s+ids?)?|requirements?(?:\\s+ids?)?|priority)"
                    + "[*_]*\\s*:[*_]*\\s*(.*)$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DECORATION = Pattern.compile("^(#.*|[-*_=]{3,})$");

    public List<ScenarioDraft> parse(String completion) {
        if (completion == null || completion.isBlank()) return List.of();

        String jsonCandidate = unfence(completion).strip();
        if (jsonCandidate.startsWith("[") || jsonCandidate.startsWith("{")) {
            List<ScenarioDraft> fromJson = parseJson(jsonCandidate);
            if (fromJson != null) {
                log.debug("ScenarioResponseParser: {} drafts parsed from JSON", fromJson.size());
                return fromJson;
            }
        } else {
            List<ScenarioDraft> embedded = parseEmbeddedJson(jsonCandidate);
            if (!embedded.isEmpty()) {
                log.debug("ScenarioResponseParser: {} drafts parsed from JSON after leading text", embedded.size());
                return embedded;
            }
        }

        List<ScenarioDraft> drafts = parseLabelledLines(completion);
        log.debug("ScenarioResponseParser: {} drafts parsed from labelled lines", drafts.size());
        return drafts;
    }

    // ═══════════════════════════════════════════════════
    // Labelled lines
    // ═══════════════════════════════════════════════════

    private List<ScenarioDraft> parseLabelledLines(String completion) {
        List<ScenarioDraft> drafts = new ArrayList<>();
        DraftBuilder current = null;
        String openField = null;

        for (String rawLine : completion.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) continue;

            Matcher matcher = FIELD_LINE.matcher(line);
            if (matcher.matches()) {
                String field = canonicalField(matcher.group(1));
                String value = cleanValue(matcher.group(2));
                if ("id".equals(field)) {
                    closeDraft(current, drafts);
                    current = new DraftBuilder();
                } else if (current == null) {
                    current = new DraftBuilder();
                }
                current.set(field, value);
                openField = field;
            } else if (DECORATION.matcher(line).matches()) {
                openField = null;
            } else if ("id".equals(openField) && current != null && current.id == null) {
                // id label with its value on the following line
                current.set("id", cleanValue(line));
                openField = null;
            } else if ("description".equals(openField) && current != null) {
                current.appendDescription(line);
            }
        }

        closeDraft(current, drafts);
        return drafts;
    }

    private static void closeDraft(DraftBuilder draft, List<ScenarioDraft> drafts) {
        if (draft == null) return;
        if (draft.id != null) {
            drafts.add(draft.build());
        } else {
            log.debug("ScenarioResponseParser: dropping scenario without id (title: {})", draft.title);
        }
    }

    private static String canonicalField(String label) {
        String normalized = label.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return switch (normalized) {
            case "test scenario id", "scenario id", "id" -> "id";
            case "title" -> "title";
            case "description" -> "description";
            case "priority" -> "priority";
            default -> "related_requirements";
        };
    }

    private static String cleanValue(String value) {
        return value.replaceAll("^[*_\\s]+|[*_\\s]+$", "");
    }

    private static final class DraftBuilder {
        private String id;
        private String title;
        private String description;
        private String relatedRequirements;
        private String priority;

        void set(String field, String value) {
            String v = value.isEmpty() ? null : value;
            switch (field) {
                case "id" -> id = v;
                case "title" -> title = v;
                case "description" -> description = v;
                case "priority" -> priority = v;
                default -> relatedRequirements = v;
            }
        }

        void appendDescription(String line) {
            description = description == null ? line : description + " " + line;
        }

        ScenarioDraft build() {
            return new ScenarioDraft(id, title, description, relatedRequirements, priority);
        }
    }

    // ═══════════════════════════════════════════════════
    // JSON
    // ═══════════════════════════════════════════════════

    private static String unfence(String completion) {
        Matcher fence = CODE_FENCE.matcher(completion);
        return fence.find() ? fence.group(1) : completion;
    }

    /**
     * JSON preceded by prose: parsing starts at the first '[' and then at the first '{'.
     * Content after the JSON value is ignored.
     */
    private List<ScenarioDraft> parseEmbeddedJson(String text) {
        int array = text.indexOf('[');
        int object = text.indexOf('{');
        for (int start : new int[]{Math.min(array, object), Math.max(array, object)}) {
            if (start < 0) continue;
            List<ScenarioDraft> drafts = parseJson(text.substring(start));
            if (drafts != null && !drafts.isEmpty()) return drafts;
        }
        return List.of();
    }

    /** Returns null when the text is not usable JSON, so the caller can fall back. */
    private List<ScenarioDraft> parseJson(String json) {
        JsonNode root;
        try {
            root = LENIENT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("ScenarioResponseParser: completion is not valid JSON ({})", e.getOriginalMessage());
            return null;
        }

        JsonNode items;
        if (root.isArray()) {
            items = root;
        } else if (root.isObject() && root.path("scenarios").isArray()) {
            items = root.get("scenarios");
        } else if (root.isObject()) {
            items = LENIENT_MAPPER.createArrayNode().add(root);
        } else {
            return null;
        }

        List<ScenarioDraft> drafts = new ArrayList<>();
        for (JsonNode item : items) {
            if (!item.isObject() || item.isEmpty()) continue;
            drafts.add(new ScenarioDraft(
                    text(item, "id", "scenario_id", "scenarioId"),
                    text(item, "title"),
                    text(item, "description"),
                    text(item, "related_requirements", "relatedRequirements", "requirements"),
                    text(item, "priority")
            ));
        }
        return drafts;
    }

    private static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) continue;
            if (value.isArray()) {
                return StreamSupport.stream(value.spliterator(), false)
                        .map(JsonNode::asText)
                        .collect(Collectors.joining(", "));
            }
            if (value.isValueNode()) {
                return value.asText();
            }
        }
        return null;
    }
}
