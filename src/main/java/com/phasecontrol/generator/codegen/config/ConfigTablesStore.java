package com.phasecontrol.generator.codegen.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phasecontrol.generator.codegen.util.FileWriteUtil;

/**
 * Loads and saves {@link ConfigTables} as a JSON document with the top-level keys
 * {@code type_mapping}, {@code suffix_mapping} and {@code pid_type_mapping}.
 */
public class ConfigTablesStore {
    private static final Logger log = LoggerFactory.getLogger(ConfigTablesStore.class);

    public static final String TYPE_MAPPING = "type_mapping";
    public static final String SUFFIX_MAPPING = "suffix_mapping";
    public static final String PID_TYPE_MAPPING = "pid_type_mapping";

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Loads the tables from {@code configFile}. A missing file is created from the
     * built-in defaults; an unreadable one is reported and the defaults are used.
     */
    public ConfigTables loadOrCreate(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            ConfigTables defaults = ConfigTables.defaults();
            save(defaults, configFile);
            return defaults;
        }
        try {
            ConfigTables tables = read(Files.readString(configFile));
            log.info("Configuration loaded from {}", configFile);
            return tables;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load configuration from {}: {}. Using defaults.", configFile, e.getMessage());
            return ConfigTables.defaults();
        }
    }

    /**
     * Parses a configuration document. Tables missing from the document keep their
     * built-in defaults.
     */
    public ConfigTables read(String json) throws IOException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Configuration root must be a JSON object");
        }
        ConfigTables defaults = ConfigTables.defaults();

        ConfigTables.ConfigTablesBuilder builder = ConfigTables.builder();
        builder.deviceTypeNames(root.has(TYPE_MAPPING)
                ? readTable(root.get(TYPE_MAPPING), TYPE_MAPPING, JsonNode::asText)
                : defaults.getDeviceTypeNames());
        builder.suffixRules(root.has(SUFFIX_MAPPING)
                ? readTable(root.get(SUFFIX_MAPPING), SUFFIX_MAPPING, ConfigTablesStore::toSuffixEntry)
                : defaults.getSuffixRules());
        builder.qualifierNames(root.has(PID_TYPE_MAPPING)
                ? readTable(root.get(PID_TYPE_MAPPING), PID_TYPE_MAPPING, JsonNode::asText)
                : defaults.getQualifierNames());
        return builder.build();
    }

    public void save(ConfigTables tables, Path configFile) throws IOException {
        FileWriteUtil.safeWriteString(configFile, write(tables));
        log.info("Configuration saved to {}", configFile);
    }

    public String write(ConfigTables tables) throws IOException {
        ObjectNode root = mapper.createObjectNode();

        ObjectNode types = root.putObject(TYPE_MAPPING);
        tables.getDeviceTypeNames().forEach((code, name) -> types.put(String.valueOf(code), name));

        ObjectNode suffixes = root.putObject(SUFFIX_MAPPING);
        tables.getSuffixRules().forEach((code, entry) -> {
            String key = String.valueOf(code);
            if (entry instanceof PlainSuffix plain) {
                suffixes.put(key, plain.getText());
            } else if (entry instanceof QualifierSuffix variants) {
                ObjectNode node = suffixes.putObject(key);
                if (variants.getMatchingKey() != null) {
                    node.put(variants.getMatchingKey(), variants.getMatchingVariant());
                }
                node.put(QualifierSuffix.OTHER_KEY, variants.getOtherVariant());
            }
        });

        ObjectNode qualifiers = root.putObject(PID_TYPE_MAPPING);
        tables.getQualifierNames().forEach((code, name) -> qualifiers.put(String.valueOf(code), name));

        return mapper.writeValueAsString(root);
    }

    private static <T> Map<Integer, T> readTable(JsonNode node, String tableName, Function<JsonNode, T> valueReader) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("'" + tableName + "' must be a JSON object");
        }
        Map<Integer, T> table = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Integer code = parseCode(field.getKey());
            if (code == null) {
                log.warn("Ignoring non-numeric key '{}' in {}", field.getKey(), tableName);
                continue;
            }
            T value = valueReader.apply(field.getValue());
            if (value == null) {
                log.warn("Ignoring unsupported value for key '{}' in {}", field.getKey(), tableName);
                continue;
            }
            table.put(code, value);
        }
        return table;
    }

    private static SuffixEntry toSuffixEntry(JsonNode value) {
        if (value.isTextual()) {
            return PlainSuffix.of(value.asText());
        }
        if (!value.isObject()) {
            return null;
        }
        Integer qualifierCode = null;
        String matching = "";
        Iterator<String> names = value.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (name.startsWith(QualifierSuffix.KEY_PREFIX) && !name.equals(QualifierSuffix.OTHER_KEY)) {
                Integer code = parseCode(name.substring(QualifierSuffix.KEY_PREFIX.length()));
                if (code != null) {
                    qualifierCode = code;
                    matching = value.get(name).asText("");
                }
            }
        }
        String other = value.path(QualifierSuffix.OTHER_KEY).asText("");
        return QualifierSuffix.of(qualifierCode, matching, other);
    }

    private static Integer parseCode(String raw) {
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
