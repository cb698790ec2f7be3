package com.example.scenariogen.ingestion;

import com.example.scenariogen.exception.IngestionException;
import com.example.scenariogen.model.Requirement;
import com.example.scenariogen.model.RequirementSet;
import com.example.scenariogen.model.UserStory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts requirements from a Jira JSON export.
 * <p>
 * Accepts a search export ({@code {"issues": [...]}}) or a single issue. Every issue
 * becomes one requirement keyed by the issue key; its description, either plain text
 * or Atlassian Document Format, contributes user stories and acceptance criteria.
 */
@Service
public class JiraExportExtractor implements IssueExportRequirementSource {

    private static final Logger log = LoggerFactory.getLogger(JiraExportExtractor.class);

    /** ADF node types that end a line of text. */
    private static final Set<String> BLOCK_TYPES =
            Set.of("paragraph", "heading", "bulletList", "orderedList", "hardBreak");

    private final RequirementTextExtractor textExtractor;

    public JiraExportExtractor(RequirementTextExtractor textExtractor) {
        this.textExtractor = textExtractor;
    }

    @Override
    public RequirementSet extract(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new IngestionException("Issue export payload must be a JSON object");
        }

        JsonNode issues = payload.has("issues")
                ? payload.get("issues")
                : JsonNodeFactory.instance.arrayNode().add(payload);
        if (!issues.isArray()) {
            throw new IngestionException("Issue export 'issues' must be an array");
        }

        List<Requirement> requirements = new ArrayList<>();
        List<UserStory> stories = new ArrayList<>();
        List<String> criteria = new ArrayList<>();
        Set<String> usedIds = new HashSet<>();
        StringBuilder rawText = new StringBuilder();

        for (JsonNode issue : issues) {
            if (!issue.isObject()) {
                log.warn("JiraExportExtractor: skipping non-object issue entry");
                continue;
            }
            String key = issue.path("key").asText("").strip();
            JsonNode fields = issue.path("fields");
            String summary = fields.path("summary").asText("").strip();
            String description = descriptionText(fields.get("description")).strip();

            if (summary.isEmpty() && description.isEmpty()) {
                log.warn("JiraExportExtractor: skipping issue '{}' without summary or description", key);
                continue;
            }

            String id = key.isEmpty() || usedIds.contains(key)
                    ? generatedId(requirements.size() + 1, usedIds)
                    : key;
            usedIds.add(id);

            String text = summary.isEmpty() ? firstLine(description) : summary;
            requirements.add(new Requirement(id, text, textExtractor.classify(summary + " " + description)));
            stories.addAll(textExtractor.extractUserStories(description));
            criteria.addAll(textExtractor.extractAcceptanceCriteria(description));

            rawText.append(id).append(": ").append(text).append('\n');
            if (!description.isEmpty()) {
                rawText.append(description).append('\n');
            }
            rawText.append('\n');
        }

        if (requirements.isEmpty()) {
            throw new IngestionException("Issue export contains no usable issues");
        }

        log.info("JiraExportExtractor: {} issues, {} user stories, {} acceptance criteria",
                requirements.size(), stories.size(), criteria.size());
        return new RequirementSet("jira", rawText.toString().strip(), requirements, stories, criteria);
    }

    /** Plain-text description, flattening Atlassian Document Format when needed. */
    static String descriptionText(JsonNode description) {
        if (description == null || description.isNull() || description.isMissingNode()) return "";
        if (description.isTextual()) return description.asText();

        StringBuilder sb = new StringBuilder();
        appendAdf(description, sb);
        return sb.toString();
    }

    private static void appendAdf(JsonNode node, StringBuilder sb) {
        String type = node.path("type").asText("");
        if (node.path("text").isTextual()) {
            sb.append(node.get("text").asText());
        }

        JsonNode content = node.path("content");
        int index = 1;
        for (JsonNode child : content) {
            if ("orderedList".equals(type)) {
                sb.append(index++).append(". ");
            } else if ("bulletList".equals(type)) {
                sb.append("- ");
            }
            appendAdf(child, sb);
        }

        if (BLOCK_TYPES.contains(type)) {
            sb.append('\n');
        }
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline >= 0 ? text.substring(0, newline).strip() : text;
    }

    private static String generatedId(int start, Set<String> usedIds) {
        int n = start;
        while (usedIds.contains("ISSUE-" + n)) n++;
        return "ISSUE-" + n;
    }
}
