package com.example.scenariogen.ingestion;

import com.example.scenariogen.exception.IngestionException;
import com.example.scenariogen.model.Requirement;
import com.example.scenariogen.model.RequirementSet;
import com.example.scenariogen.model.UserStory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based requirement extraction from plain text.
 * <p>
 * Recognizes user stories ("As a ..., I want ... so that ..."), numbered and bulleted
 * requirement lines, "shall" statements and acceptance criteria listed after an
 * {@code Acceptance Criteria:} or {@code AC:} label.
 */
@Service
public class RequirementTextExtractor implements TextRequirementSource {

    private static final Logger log = LoggerFactory.getLogger(RequirementTextExtractor.class);

    private static final Pattern USER_STORY = Pattern.compile(
            "\\bAs\\s+an?\\s+(.+?),?\\s+I\\s+want\\s+(?:to\\s+)?(.+?),?\\s+so\\s+that\\s+(.+?)(?=\\.\\s|\\.\\z|\\n\\s*\\n|\\z)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern NUMBERED = Pattern.compile("^(\\d+)[.)]\\s*(\\D.*)$");
    private static final Pattern BULLETED = Pattern.compile("^[•*\\-]\\s+(.+)$");
    private static final Pattern SHALL = Pattern.compile("\\bshall\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern ACCEPTANCE_CRITERIA = Pattern.compile(
            "(?:\\bAcceptance\\s+Criteria|\\bAC)\\s*:\\s*(.*?)(?=\\n\\s*\\n|\\z)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    /** Keywords that usually mark a non-functional requirement. */
    private static final Pattern NON_FUNCTIONAL = Pattern.compile(
            "\\b(?:performance|security|availability|reliability|maintainability|scalability"
                    + "|usability|portability|response time|throughput|secure|load|stress|recovery"
                    + "|audit|log|backup|restore|compliance)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final int MIN_LISTED_LENGTH = 6;
    private static final int MIN_SHALL_LENGTH = 11;

    @Override
    public RequirementSet extract(String text) {
        return extract(text, "text");
    }

    /**
     * Extracts a requirement set, tagging it with the given source type.
     *
     * @throws IngestionException if the text is null or blank
     */
    public RequirementSet extract(String text, String source) {
        if (text == null || text.isBlank()) {
            throw new IngestionException("No requirements text provided");
        }

        List<UserStory> stories = extractUserStories(text);
        List<Requirement> requirements = extractRequirements(text);
        List<String> criteria = extractAcceptanceCriteria(text);

        log.info("RequirementTextExtractor: {} requirements, {} user stories, {} acceptance criteria ({})",
                requirements.size(), stories.size(), criteria.size(), source);
        return new RequirementSet(source, text, requirements, stories, criteria);
    }

    public List<UserStory> extractUserStories(String text) {
        if (text == null || text.isBlank()) return List.of();

        List<UserStory> stories = new ArrayList<>();
        Matcher matcher = USER_STORY.matcher(text);
        while (matcher.find()) {
            stories.add(new UserStory(
                    collapse(matcher.group(1)),
                    collapse(matcher.group(2)),
                    collapse(matcher.group(3)),
                    collapse(matcher.group(0))
            ));
        }
        return stories;
    }

    public List<String> extractAcceptanceCriteria(String text) {
        if (text == null || text.isBlank()) return List.of();

        List<String> criteria = new ArrayList<>();
        Matcher matcher = ACCEPTANCE_CRITERIA.matcher(text);
        while (matcher.find()) {
            criteria.addAll(listItems(matcher.group(1)));
        }
        return criteria;
    }

    public Requirement.Type classify(String text) {
        return text != null && NON_FUNCTIONAL.matcher(text).find()
                ? Requirement.Type.NON_FUNCTIONAL
                : Requirement.Type.FUNCTIONAL;
    }

    /**
     * Numbered lines keep their number as id; bullets and "shall" statements get REQ-n.
     * Ids stay unique and repeated texts are skipped.
     */
    private List<Requirement> extractRequirements(String text) {
        List<Requirement> requirements = new ArrayList<>();
        Set<String> usedIds = new HashSet<>();
        Set<String> seenTexts = new HashSet<>();

        for (String rawLine : text.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) continue;

            String candidateId = null;
            String requirementText;
            int minLength;

            Matcher numbered = NUMBERED.matcher(line);
            Matcher bulleted = BULLETED.matcher(line);
            if (numbered.matches()) {
                candidateId = numbered.group(1);
                requirementText = numbered.group(2).strip();
                minLength = MIN_LISTED_LENGTH;
            } else if (bulleted.matches()) {
                requirementText = bulleted.group(1).strip();
                minLength = MIN_LISTED_LENGTH;
            } else if (SHALL.matcher(line).find()) {
                requirementText = line;
                minLength = MIN_SHALL_LENGTH;
            } else {
                continue;
            }

            if (requirementText.length() < minLength || !seenTexts.add(requirementText)) continue;

            String id = candidateId != null && !usedIds.contains(candidateId)
                    ? candidateId
                    : nextGeneratedId(requirements.size() + 1, usedIds);
            usedIds.add(id);
            requirements.add(new Requirement(id, requirementText, classify(requirementText)));
        }
        return requirements;
    }

    private static String nextGeneratedId(int start, Set<String> usedIds) {
        int n = start;
        while (usedIds.contains("REQ-" + n)) n++;
        return "REQ-" + n;
    }

    /** Numbered items first, then bullets, then any non-empty lines. */
    private static List<String> listItems(String block) {
        List<String> numbered = new ArrayList<>();
        List<String> bulleted = new ArrayList<>();
        List<String> lines = new ArrayList<>();

        for (String rawLine : block.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) continue;
            lines.add(line);
            Matcher n = NUMBERED.matcher(line);
            if (n.matches()) {
                numbered.add(n.group(2).strip());
                continue;
            }
            Matcher b = BULLETED.matcher(line);
            if (b.matches()) bulleted.add(b.group(1).strip());
        }

        if (!numbered.isEmpty()) return numbered;
        if (!bulleted.isEmpty()) return bulleted;
        return lines;
    }

    private static String collapse(String s) {
        return WHITESPACE.matcher(s).replaceAll(" ").strip();
    }
}
