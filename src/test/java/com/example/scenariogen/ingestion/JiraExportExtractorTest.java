package com.example.scenariogen.ingestion;

import com.example.scenariogen.exception.IngestionException;
import com.example.scenariogen.model.Requirement;
import com.example.scenariogen.model.RequirementSet;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link JiraExportExtractor}.
 */
class JiraExportExtractorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JiraExportExtractor extractor = new JiraExportExtractor(new RequirementTextExtractor());

    private static final String SEARCH_EXPORT = """
            {
              "issues": [
                {
                  "key": "PROJ-1",
                  "fields": {
                    "summary": "Password reset",
                    "description": "As a customer, I want to reset my password so that I can regain access.\\n\\nAcceptance Criteria:\\n- Reset link is emailed\\n- Link expires after 24 hours"
                  }
                },
                {
                  "key": "PROJ-2",
                  "fields": {
                    "summary": "Export monthly report",
                    "description": {
                      "type": "doc",
                      "version": 1,
                      "content": [
                        {"type": "paragraph", "content": [{"type": "text", "text": "Acceptance Criteria:"}]},
                        {"type": "bulletList", "content": [
                          {"type": "listItem", "content": [
                            {"type": "paragraph", "content": [{"type": "text", "text": "Report exports as CSV"}]}
                          ]},
                          {"type": "listItem", "content": [
                            {"type": "paragraph", "content": [{"type": "text", "text": "Totals match the ledger"}]}
                          ]}
                        ]}
                      ]
                    }
                  }
                }
              ]
            }
            """;

    @Test
    @DisplayName("search export yields one requirement per issue plus stories and criteria")
    void extractsSearchExport() throws Exception {
        RequirementSet set = extractor.extract(mapper.readTree(SEARCH_EXPORT));

        assertEquals("jira", set.source());
        assertEquals(List.of("PROJ-1", "PROJ-2"), set.requirements().stream().map(Requirement::id).toList());
        assertEquals("Password reset", set.requirements().get(0).text());

        assertEquals(1, set.userStories().size());
        assertEquals("customer", set.userStories().get(0).role());
        assertEquals("reset my password", set.userStories().get(0).goal());

        assertEquals(List.of("Reset link is emailed", "Link expires after 24 hours",
                "Report exports as CSV", "Totals match the ledger"), set.acceptanceCriteria());
        assertTrue(set.rawText().startsWith("PROJ-1: Password reset"));
    }

    @Test
    @DisplayName("a single issue object is accepted")
    void singleIssue() throws Exception {
        JsonNode issue = mapper.readTree("{\"key\": \"ABC-7\", \"fields\": {\"summary\": \"Add dark mode\"}}");

        RequirementSet set = extractor.extract(issue);

        assertEquals(1, set.totalRequirements());
        assertEquals("ABC-7", set.requirements().get(0).id());
    }

    @Test
    @DisplayName("missing or repeated keys get generated ids; missing summary uses the first description line")
    void generatedIds() throws Exception {
        JsonNode payload = mapper.readTree("""
                {"issues": [
                  {"fields": {"description": "Invoices can be voided\\nOnly drafts qualify"}},
                  {"key": "ISSUE-1", "fields": {"summary": "Duplicate of a generated id"}},
                  {"key": "X-1", "fields": {}}
                ]}
                """);

        RequirementSet set = extractor.extract(payload);

        assertEquals(2, set.totalRequirements());
        assertEquals("ISSUE-1", set.requirements().get(0).id());
        assertEquals("Invoices can be voided", set.requirements().get(0).text());
        assertEquals("ISSUE-2", set.requirements().get(1).id());
    }

    @Test
    @DisplayName("ordered ADF lists are numbered when flattened")
    void flattensOrderedList() throws Exception {
        JsonNode adf = mapper.readTree("""
                {"type": "doc", "content": [
                  {"type": "orderedList", "content": [
                    {"type": "listItem", "content": [{"type": "paragraph", "content": [{"type": "text", "text": "first"}]}]},
                    {"type": "listItem", "content": [{"type": "paragraph", "content": [{"type": "text", "text": "second"}]}]}
                  ]}
                ]}
                """);

        assertEquals("1. first\n2. second\n\n", JiraExportExtractor.descriptionText(adf));
    }

    @Test
    @DisplayName("exports without usable issues are ingestion failures")
    void unusableExports() throws Exception {
        assertThrows(IngestionException.class, () -> extractor.extract(mapper.readTree("{\"issues\": []}")));
        assertThrows(IngestionException.class, () -> extractor.extract(mapper.readTree("[1, 2]")));
        assertThrows(IngestionException.class, () -> extractor.extract(mapper.readTree("{\"issues\": 3}")));
        assertThrows(IngestionException.class, () -> extractor.extract(null));
    }
}
