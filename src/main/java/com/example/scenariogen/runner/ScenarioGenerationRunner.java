package com.example.scenariogen.runner;

import com.example.scenariogen.model.GenerationOptions;
import com.example.scenariogen.model.GenerationResult;
import com.example.scenariogen.orchestrator.ScenarioOrchestrator;
import com.example.scenariogen.service.GenerationResultWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry point.
 * <p>
 * Inert unless {@code --requirements=<path>} is given. Optional arguments:
 * {@code --num-scenarios}, {@code --detail-level}, {@code --priority}, {@code --focus=a,b}.
 * The result is written as a JSON artifact under the configured output directory.
 */
@Component
public class ScenarioGenerationRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ScenarioGenerationRunner.class);

    static final String REQUIREMENTS = "requirements";
    static final String NUM_SCENARIOS = "num-scenarios";
    static final String DETAIL_LEVEL = "detail-level";
    static final String PRIORITY = "priority";
    static final String FOCUS = "focus";

    private final ScenarioOrchestrator orchestrator;
    private final GenerationResultWriter writer;

    public ScenarioGenerationRunner(ScenarioOrchestrator orchestrator, GenerationResultWriter writer) {
        this.orchestrator = orchestrator;
        this.writer = writer;
    }

    @Override
    public void run(ApplicationArguments args) {
        String requirements = single(args, REQUIREMENTS);
        if (requirements == null) {
            log.debug("No --{} argument, nothing to generate", REQUIREMENTS);
            return;
        }

        GenerationOptions options = optionsFrom(args);
        GenerationResult result = orchestrator.fromDocument(Path.of(requirements), options);
        Path output = writer.write(result);
        log.info("Generated {} scenarios from '{}' -> {}", result.scenarios().size(), requirements, output);
    }

    static GenerationOptions optionsFrom(ApplicationArguments args) {
        String count = single(args, NUM_SCENARIOS);
        Integer numScenarios;
        try {
            numScenarios = count != null ? Integer.valueOf(count.strip()) : null;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + NUM_SCENARIOS + " must be an integer, got '" + count + "'", e);
        }

        String focus = single(args, FOCUS);
        List<String> customFocus = focus != null
                ? Arrays.stream(focus.split(",")).map(String::strip).filter(s -> !s.isEmpty()).toList()
                : null;

        return new GenerationOptions(numScenarios, single(args, DETAIL_LEVEL), single(args, PRIORITY), customFocus);
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values != null && !values.isEmpty() ? values.get(values.size() - 1) : null;
    }
}
