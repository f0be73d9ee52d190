package com.kbase.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes item files: YAML front matter between {@code ---} lines, a blank line, then the body.
 *
 * <p>Integers come back as {@code Long}. For the list keys a plain string is split on commas, which is how
 * older files stored them.</p>
 */
public final class MarkdownCodec {

    public static final String DELIMITER = "---";

    static final Set<String> LIST_KEYS = Set.of("tags", "related", "related_tasks", "related_documents");

    private static final Pattern FRONT_MATTER = Pattern.compile("^---\\r?\\n(.*?)^---[ \\t]*(?:\\r?\\n|\\z)",
        Pattern.DOTALL | Pattern.MULTILINE);
    private static final Pattern KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final ObjectMapper yamlMapper = new ObjectMapper(YAMLFactory.builder()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
        .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
        .build());

    private MarkdownCodec() {
    }

    public static String encode(Map<String, Object> metadata, String body) {
        StringBuilder out = new StringBuilder();
        out.append(DELIMITER).append('\n');
        if (metadata != null && !metadata.isEmpty()) {
            for (String key : metadata.keySet()) {
                if (key == null || !KEY.matcher(key).matches()) {
                    throw new IllegalArgumentException("Invalid metadata key: " + key);
                }
            }
            try {
                out.append(yamlMapper.writeValueAsString(metadata));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        }
        out.append(DELIMITER).append('\n');
        out.append('\n');
        if (body != null) {
            out.append(body);
        }
        return out.toString();
    }

    /**
     * Text without a complete front matter block is all body. A block that is not valid YAML is read one
     * {@code key: value} line at a time.
     */
    public static StoredDocument decode(String id, String text) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (text == null) {
            return new StoredDocument(id, metadata, "");
        }
        Matcher matcher = FRONT_MATTER.matcher(text);
        if (!matcher.lookingAt()) {
            return new StoredDocument(id, metadata, text);
        }

        String header = matcher.group(1);
        try {
            readInto(yamlMapper.readTree(header), metadata);
        } catch (JsonProcessingException e) {
            metadata.clear();
            readLineByLine(header, metadata);
        }

        String body = text.substring(matcher.end());
        if (body.startsWith("\r\n")) {
            body = body.substring(2);
        } else if (body.startsWith("\n")) {
            body = body.substring(1);
        }
        return new StoredDocument(id, metadata, body);
    }

    private static void readInto(JsonNode root, Map<String, Object> metadata) {
        if (root == null || !root.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            metadata.put(field.getKey(), toValue(field.getKey(), field.getValue()));
        }
    }

    private static void readLineByLine(String header, Map<String, Object> metadata) {
        for (String line : header.split("\\r?\\n")) {
            int colon = line.indexOf(':');
            if (colon <= 0 || line.startsWith(" ") || line.startsWith("#")) {
                continue;
            }
            String key = line.substring(0, colon).trim();
            String raw = line.substring(colon + 1).trim();
            JsonNode value;
            try {
                value = raw.isEmpty() ? null : yamlMapper.readTree(raw);
            } catch (JsonProcessingException e) {
                value = null;
            }
            if (!raw.isEmpty() && (value == null || value.isObject())) {
                // "Plan: phase two" is a mapping to YAML, but here it is the whole value
                value = yamlMapper.getNodeFactory().textNode(raw);
            }
            metadata.put(key, toValue(key, value));
        }
    }

    private static Object toValue(String key, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>();
            for (JsonNode element : node) {
                Object value = toValue(null, element);
                if (value != null) {
                    values.add(value);
                }
            }
            return values;
        }
        if (node.isTextual() && LIST_KEYS.contains(key)) {
            return splitList(node.asText());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isContainerNode()) {
            return yamlMapper.convertValue(node, Object.class);
        }
        return node.asText();
    }

    private static List<Object> splitList(String value) {
        List<Object> values = new ArrayList<>();
        for (String part : value.split(",")) {
            String cleaned = part.trim();
            if (!cleaned.isEmpty()) {
                values.add(cleaned);
            }
        }
        return values;
    }
}
