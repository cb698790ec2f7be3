package com.example.scenariogen.service;

import com.example.scenariogen.model.GenerationResult;
import com.example.scenariogen.model.Scenario;
import com.example.scenariogen.model.ScenarioGenerationResponse;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the final {@link GenerationResult} from enriched scenarios and the client response.
 * The client's metadata map is copied, never modified.
 */
@Component
public class ResultAssembler {

    public static final String PRIORITY_FOCUS = "priority_focus";
    public static final String CUSTOM_FOCUS = "custom_focus";

    public GenerationResult assemble(List<Scenario> scenarios, ScenarioGenerationResponse response,
                                     String priorityFocus, List<String> customFocus) {
        Map<String, Object> metadata = new LinkedHashMap<>(response.metadata());
        metadata.put(PRIORITY_FOCUS, priorityFocus);
        metadata.put(CUSTOM_FOCUS, customFocus != null ? Collections.unmodifiableList(new ArrayList<>(customFocus)) : null);

        return new GenerationResult(
                List.copyOf(scenarios),
                Collections.unmodifiableMap(metadata),
                response.rawLlmResponse()
        );
    }
}
