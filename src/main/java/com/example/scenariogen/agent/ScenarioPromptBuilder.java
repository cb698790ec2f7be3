package com.example.scenariogen.agent;

import com.example.scenariogen.model.DetailLevel;
import com.example.scenariogen.model.Requirement;
import com.example.scenariogen.model.RequirementSet;
import com.example.scenariogen.model.UserStory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the system and user prompts for scenario generation.
 */
@Component
public class ScenarioPromptBuilder {

    /** Raw text sent when nothing structured was extracted. */
    static final int MAX_RAW_TEXT_CHARS = 2000;

    static final String SYSTEM_PROMPT = """
            You are an expert test engineer specialized in converting software requirements into \
            comprehensive test scenarios. Your task is to analyze the provided requirements and create \
            detailed, testable scenarios that would verify the system works as expected.

            Focus on:
            1. Full coverage of functional and non-functional requirements
            2. Edge cases and exception paths
            3. Realistic user workflows
            4. Clear, measurable outcomes
            5. Scenarios that can be further broken down into specific test cases

            Format each test scenario with:
            - Test Scenario ID (TS-XXX-YY format)
            - Title (concise description)
            - Description (detailed explanation)
            - Related requirements (if provided in the input)
            - Priority (High/Medium/Low based on business impact)
            """;

    private static final String OUTPUT_FORMAT = """
            Format each test scenario as follows:

            Test Scenario ID: TS-XXX-YY (where XXX relates to the requirement/story ID if available)
            Title: [Brief descriptive title]
            Description: [Detailed description explaining what needs to be tested]
            Related Requirements: [Comma separated requirement IDs]
            Priority: [High/Medium/Low]

            Ensure each scenario is testable and has clear pass/fail criteria.""";

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String userPrompt(RequirementSet requirements, int numScenarios, DetailLevel detailLevel) {
        StringBuilder prompt = new StringBuilder()
                .append("Please create ").append(numScenarios).append(" test scenarios with ")
                .append(detailLevel.label())
                .append(" level of detail based on the following requirements:\n\n");

        List<UserStory> stories = requirements.userStories();
        if (!stories.isEmpty()) {
            prompt.append("USER STORIES:\n");
            for (int i = 0; i < stories.size(); i++) {
                UserStory story = stories.get(i);
                prompt.append(i + 1).append(". As a ").append(orDefault(story.role(), "user"))
                        .append(", I want ").append(orDefault(story.goal(), ""))
                        .append(" so that ").append(orDefault(story.benefit(), ""))
                        .append('\n');
            }
            prompt.append('\n');
        }

        List<Requirement> reqs = requirements.requirements();
        if (!reqs.isEmpty()) {
            prompt.append("REQUIREMENTS:\n");
            for (int i = 0; i < reqs.size(); i++) {
                Requirement req = reqs.get(i);
                prompt.append(orDefault(req.id(), "REQ-" + (i + 1))).append(": ")
                        .append(orDefault(req.text(), ""));
                if (req.type() != null) {
                    prompt.append(" [Type: ").append(req.type().label()).append(']');
                }
                prompt.append('\n');
            }
            prompt.append('\n');
        }

        List<String> criteria = requirements.acceptanceCriteria();
        if (!criteria.isEmpty()) {
            prompt.append("ACCEPTANCE CRITERIA:\n");
            for (int i = 0; i < criteria.size(); i++) {
                prompt.append(i + 1).append(". ").append(criteria.get(i)).append('\n');
            }
            prompt.append('\n');
        }

        if (requirements.isUnstructured() && !requirements.rawText().isBlank()) {
            String raw = requirements.rawText();
            prompt.append("REQUIREMENTS TEXT:\n")
                    .append(raw, 0, Math.min(raw.length(), MAX_RAW_TEXT_CHARS))
                    .append("\n\n");
        }

        prompt.append(detailInstruction(detailLevel)).append("\n\n");
        prompt.append(OUTPUT_FORMAT);
        return prompt.toString();
    }

    private static String detailInstruction(DetailLevel detailLevel) {
        return switch (detailLevel) {
            case LOW -> "Create basic test scenarios covering the main functionality. Keep descriptions brief.";
            case HIGH -> "Create comprehensive test scenarios with detailed descriptions. "
                    + "Cover edge cases, negative testing, and all possible user workflows.";
            case MEDIUM -> "Create balanced test scenarios covering key functionality and common edge cases. "
                    + "Include clear descriptions.";
        };
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
