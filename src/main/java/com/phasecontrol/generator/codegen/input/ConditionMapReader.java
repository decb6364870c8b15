package com.phasecontrol.generator.codegen.input;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasecontrol.generator.codegen.model.ConditionLiteral;
import com.phasecontrol.generator.codegen.model.ConditionMap;
import com.phasecontrol.generator.codegen.model.ConditionSpec;

/**
 * Reads per-activation custom conditions:
 *
 * <pre>
 * { "3": { "XV101.activate": { "expression": "X1 OR X2",
 *          "literals": [ {"label": "X1", "tag": "LS101", "negated": false}, ... ] } } }
 * </pre>
 *
 * Step keys are strings in JSON and become integers. {@code conditions} is accepted
 * as an alias of {@code literals}.
 */
public class ConditionMapReader {

    private final ObjectMapper mapper = new ObjectMapper();

    public ConditionMap read(Path file) throws IOException {
        return read(Files.readString(file));
    }

    public ConditionMap read(String json) throws IOException {
        JsonNode root = mapper.readTree(json);
        if (root == null || root.isNull() || root.isMissingNode()) {
            return ConditionMap.empty();
        }
        if (!root.isObject()) {
            throw new IOException("Condition file must contain a JSON object keyed by step index");
        }

        Map<Integer, Map<String, ConditionSpec>> byStep = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> steps = root.fields();
        while (steps.hasNext()) {
            Map.Entry<String, JsonNode> step = steps.next();
            int stepIndex = parseStepIndex(step.getKey());
            Map<String, ConditionSpec> specs = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> tags = step.getValue().fields();
            while (tags.hasNext()) {
                Map.Entry<String, JsonNode> tag = tags.next();
                specs.put(tag.getKey(), toSpec(tag.getValue()));
            }
            byStep.put(stepIndex, specs);
        }
        return ConditionMap.of(byStep);
    }

    private static ConditionSpec toSpec(JsonNode node) {
        ConditionSpec.ConditionSpecBuilder builder = ConditionSpec.builder();
        if (node.hasNonNull("expression")) {
            builder.expression(node.get("expression").asText());
        }
        JsonNode literals = node.has("literals") ? node.get("literals") : node.path("conditions");
        for (JsonNode literal : literals) {
            builder.literal(ConditionLiteral.builder()
                    .label(literal.path("label").asText("X1"))
                    .tag(literal.path("tag").asText(""))
                    .negated(literal.path("negated").asBoolean(false))
                    .build());
        }
        return builder.build();
    }

    private static int parseStepIndex(String key) throws IOException {
        try {
            return Integer.parseInt(key.trim());
        } catch (NumberFormatException e) {
            throw new IOException("Condition step key is not a number: " + key, e);
        }
    }
}
