package com.example.scenariogen.ingestion;

import com.example.scenariogen.config.ScenarioProperties;
import com.example.scenariogen.exception.IngestionException;
import com.example.scenariogen.model.RequirementSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extracts requirements from documents on disk.
 * <p>
 * Plain-text formats are read locally. PDF and Office documents are sent to the
 * extraction service, which returns their text. Either way the text then goes
 * through {@link RequirementTextExtractor}.
 */
@Service
public class DocumentRequirementExtractor implements DocumentRequirementSource {

    private static final Logger log = LoggerFactory.getLogger(DocumentRequirementExtractor.class);

    private static final Set<String> LOCAL_TYPES = Set.of("txt", "text", "md", "json");
    private static final Set<String> REMOTE_TYPES = Set.of("pdf", "docx", "doc", "xlsx", "xls");

    private final RestClient restClient;
    private final RequirementTextExtractor textExtractor;

    @Autowired
    public DocumentRequirementExtractor(ScenarioProperties properties, RequirementTextExtractor textExtractor) {
        this(extractionClient(properties), textExtractor);
    }

    DocumentRequirementExtractor(RestClient restClient, RequirementTextExtractor textExtractor) {
        this.restClient = restClient;
        this.textExtractor = textExtractor;
    }

    private static RestClient extractionClient(ScenarioProperties properties) {
        // Large scanned PDFs can take minutes to extract
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Duration.ofSeconds(30));
        factory.setReadTimeout(Duration.ofMinutes(5));

        return RestClient.builder()
                .baseUrl(properties.extractionService().baseUrl())
                .requestFactory(factory)
                .build();
    }

    @Override
    public RequirementSet extract(Path path) {
        if (path == null) {
            throw new IngestionException("Document path is required");
        }
        if (!Files.isRegularFile(path)) {
            throw new IngestionException("Document not found: " + path);
        }

        String type = documentType(path);
        log.info("Extracting requirements from '{}' ({})", path.getFileName(), type);

        String text;
        if (LOCAL_TYPES.contains(type)) {
            text = readLocal(path);
        } else if (REMOTE_TYPES.contains(type)) {
            text = extractRemotely(path);
        } else {
            throw new IngestionException("Unsupported document type '" + type + "': " + path.getFileName());
        }

        try {
            return textExtractor.extract(text, type);
        } catch (IngestionException e) {
            throw new IngestionException("No requirements text in " + path.getFileName(), e);
        }
    }

    private String readLocal(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IngestionException("Unable to read document " + path + ": " + e.getMessage(), e);
        }
    }

    private String extractRemotely(Path path) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new FileSystemResource(path));
        body.add("mode", "full");

        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> response = restClient.post()
                    .uri("/extract")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(body)
                    .retrieve()
                    .body(Map.class);

            if (response != null && Boolean.TRUE.equals(response.get("success"))
                    && response.get("text") instanceof String text) {
                log.info("Extraction service returned {} characters for '{}'", text.length(), path.getFileName());
                return text;
            }

            String error = response != null ? response.toString() : "null response from service";
            throw new IngestionException("Document extraction failed for " + path.getFileName() + ": " + error);

        } catch (RestClientException e) {
            throw new IngestionException(
                    "Document extraction service unreachable. Ensure it is running at the configured "
                            + "base URL. Details: " + e.getMessage(), e);
        }
    }

    private static String documentType(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
