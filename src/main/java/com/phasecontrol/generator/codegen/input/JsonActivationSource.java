package com.phasecontrol.generator.codegen.input;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasecontrol.generator.codegen.model.Activation;

/**
 * Reads activation rows from a JSON array:
 *
 * <pre>
 * [ {"phaseInstanceId": 1, "stepIndex": 2, "stepName": "Fill",
 *    "deviceClassCode": 0, "qualifierCode": 0, "tag": "XV101"}, ... ]
 * </pre>
 *
 * Missing or null codes read as 0; a missing or null tag marks a placeholder row.
 */
public class JsonActivationSource implements ActivationSource {
    private static final Logger log = LoggerFactory.getLogger(JsonActivationSource.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;

    public JsonActivationSource(Path file) {
        this.file = file;
    }

    @Override
    public List<Activation> fetchActivations(Integer phaseInstanceId) throws IOException {
        List<Activation> activations;
        try (InputStream in = Files.newInputStream(file)) {
            activations = parse(MAPPER.readTree(in));
        }

        List<Activation> result = activations.stream()
                .filter(a -> phaseInstanceId == null || phaseInstanceId.equals(a.getPhaseInstanceId()))
                .sorted(Comparator.comparingInt(Activation::getStepIndex))
                .toList();

        long tagged = result.stream().filter(Activation::hasActivation).count();
        if (phaseInstanceId != null) {
            log.info("{} activations found in {} rows (phase instance {})", tagged, result.size(), phaseInstanceId);
        } else {
            log.info("{} activations found in {} rows", tagged, result.size());
        }
        return result;
    }

    static List<Activation> parse(JsonNode root) throws IOException {
        if (root == null || !root.isArray()) {
            throw new IOException("Activation file must contain a JSON array");
        }
        List<Activation> activations = new ArrayList<>();
        int row = 0;
        for (JsonNode node : root) {
            row++;
            if (!node.hasNonNull("stepIndex")) {
                throw new IOException("Row " + row + ": stepIndex is required");
            }
            activations.add(Activation.builder()
                    .phaseInstanceId(node.hasNonNull("phaseInstanceId") ? node.get("phaseInstanceId").asInt() : null)
                    .stepIndex(node.get("stepIndex").asInt())
                    .stepName(node.path("stepName").asText(""))
                    .deviceClassCode(node.path("deviceClassCode").asInt(0))
                    .qualifierCode(node.path("qualifierCode").asInt(0))
                    .tag(node.hasNonNull("tag") ? node.get("tag").asText() : null)
                    .build());
        }
        return activations;
    }
}
