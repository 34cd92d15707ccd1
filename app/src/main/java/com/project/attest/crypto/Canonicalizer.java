package com.project.attest.crypto;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Byte-stable serialization of structured metadata.
 *
 * Rules:
 * - object keys sorted by their exact text ({@link String#compareTo}), recursively
 * - numbers in one normalized form: integers as plain digits, decimals without trailing zeros
 *   and without exponent, integral decimals printed as integers, negative zero as {@code 0}
 * - no whitespace at all
 * - strings JSON-escaped and encoded as UTF-8
 *
 * Anything that has no JSON meaning (binary nodes, raw objects, NaN, infinities, lone
 * surrogates, map keys that are not strings) is rejected with a {@link CanonicalizationException}.
 */
public final class Canonicalizer {

    private static final int MAX_ABS_SCALE = 1000;

    private final ObjectMapper mapper;

    public Canonicalizer() {
        this.mapper = JsonMapper.builder()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY)
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                .enable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .addModule(new JavaTimeModule())
                .addModule(new SimpleModule("string-keys-only").addKeySerializer(Object.class, new StringKeySerializer()))
                .build();
    }

    public byte[] canonicalize(Object metadata) {
        return canonicalizeToString(metadata).getBytes(StandardCharsets.UTF_8);
    }

    public String canonicalizeToString(Object metadata) {
        JsonNode tree = toTree(metadata);
        StringBuilder out = new StringBuilder(128);
        write(tree, "$", out);
        return out.toString();
    }

    /**
     * Canonical form of a JSON document given as text. Formatting and key order of the input
     * are irrelevant; duplicate keys are rejected.
     */
    public byte[] canonicalizeJson(String json) {
        return canonicalize(parse(json.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Reads JSON bytes into a tree without losing decimal precision.
     */
    public JsonNode parse(byte[] json) {
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new CanonicalizationException("$", "Empty JSON document");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new CanonicalizationException("$", "Malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CanonicalizationException("$", "Unreadable JSON: " + e.getMessage(), e);
        }
    }

    public JsonNode toTree(Object metadata) {
        if (metadata == null) {
            throw new CanonicalizationException("$", "Metadata must not be null");
        }
        if (metadata instanceof JsonNode node) {
            return node;
        }
        checkKeys(metadata, "$", Collections.newSetFromMap(new IdentityHashMap<>()));
        try {
            JsonNode node = mapper.valueToTree(metadata);
            if (node == null) {
                throw new CanonicalizationException("$", "Metadata serialized to nothing");
            }
            return node;
        } catch (IllegalArgumentException e) {
            if (e instanceof CanonicalizationException ce) {
                throw ce;
            }
            throw new CanonicalizationException("$",
                    "Metadata of type " + metadata.getClass().getName() + " is not serializable: " + e.getMessage(), e);
        }
    }

    /**
     * Walks maps, collections and arrays so that a non-string key is reported with its path
     * instead of being turned into text, where {@code 1} and {@code "1"} would collide.
     */
    private static void checkKeys(Object value, String path, Set<Object> visiting) {
        if (!(value instanceof Map<?, ?>) && !(value instanceof Collection<?>) && !(value instanceof Object[])) {
            return;
        }
        if (!visiting.add(value)) {
            throw new CanonicalizationException(path, "Metadata contains a reference cycle");
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Object key = entry.getKey();
                if (!(key instanceof String name)) {
                    throw new CanonicalizationException(path, "Object keys must be strings, found "
                            + (key == null ? "null" : key.getClass().getSimpleName() + " " + key));
                }
                checkKeys(entry.getValue(), path + "." + name, visiting);
            }
        } else if (value instanceof Collection<?> collection) {
            int i = 0;
            for (Object element : collection) {
                checkKeys(element, path + "[" + i++ + "]", visiting);
            }
        } else {
            Object[] array = (Object[]) value;
            for (int i = 0; i < array.length; i++) {
                checkKeys(array[i], path + "[" + i + "]", visiting);
            }
        }
        visiting.remove(value);
    }

    /**
     * Map keys nested inside beans never reach {@link #checkKeys}; this refuses them during serialization.
     */
    private static final class StringKeySerializer extends JsonSerializer<Object> {
        @Override
        public void serialize(Object key, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            if (!(key instanceof String name)) {
                throw JsonMappingException.from(gen, "Object keys must be strings, found "
                        + key.getClass().getSimpleName() + " " + key);
            }
            gen.writeFieldName(name);
        }
    }

    private void write(JsonNode node, String path, StringBuilder out) {
        switch (node.getNodeType()) {
            case OBJECT -> {
                List<String> names = new ArrayList<>(node.size());
                Iterator<String> it = node.fieldNames();
                while (it.hasNext()) {
                    names.add(it.next());
                }
                names.sort(null);
                out.append('{');
                for (int i = 0; i < names.size(); i++) {
                    if (i > 0) {
                        out.append(',');
                    }
                    String name = names.get(i);
                    String childPath = path + "." + name;
                    writeString(name, childPath, out);
                    out.append(':');
                    write(node.get(name), childPath, out);
                }
                out.append('}');
            }
            case ARRAY -> {
                out.append('[');
                for (int i = 0; i < node.size(); i++) {
                    if (i > 0) {
                        out.append(',');
                    }
                    write(node.get(i), path + "[" + i + "]", out);
                }
                out.append(']');
            }
            case STRING -> writeString(node.textValue(), path, out);
            case NUMBER -> out.append(normalizeNumber(node, path));
            case BOOLEAN -> out.append(node.booleanValue() ? "true" : "false");
            case NULL -> out.append("null");
            default -> throw new CanonicalizationException(path,
                    "Value of node type " + node.getNodeType() + " has no canonical JSON form");
        }
    }

    private static void writeString(String value, String path, StringBuilder out) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= value.length() || !Character.isLowSurrogate(value.charAt(i + 1))) {
                    throw new CanonicalizationException(path, "Unpaired surrogate in string");
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                throw new CanonicalizationException(path, "Unpaired surrogate in string");
            }
        }
        out.append('"');
        JsonStringEncoder.getInstance().quoteAsString(value, out);
        out.append('"');
    }

    static String normalizeNumber(JsonNode node, String path) {
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue().toString();
        }
        if (node.isDouble() || node.isFloat()) {
            double d = node.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new CanonicalizationException(path, "NaN and infinite numbers are not allowed");
            }
        }
        BigDecimal value = node.decimalValue();
        if (value.signum() == 0) {
            return "0";
        }
        BigDecimal stripped = value.stripTrailingZeros();
        if (Math.abs(stripped.scale()) > MAX_ABS_SCALE) {
            throw new CanonicalizationException(path, "Number exponent out of supported range");
        }
        if (stripped.scale() <= 0) {
            return stripped.toBigIntegerExact().toString();
        }
        return stripped.toPlainString();
    }
}
