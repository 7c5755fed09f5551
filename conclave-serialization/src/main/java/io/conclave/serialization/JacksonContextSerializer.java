package io.conclave.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.conclave.core.handoff.ContextSerializer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/// {@link ContextSerializer} backed by Jackson.
///
/// Writes compact JSON in an envelope that records the Java type of every number JSON
/// cannot tell apart on its own:
///
/// ```json
/// {"context":{"attempts":3,"startedAt":1718000000000},"types":{"/startedAt":"long"}}
/// ```
///
/// Keys of `types` are JSON pointers into `context`; the field is omitted when every
/// number is an `Integer` or a finite `Double`. Big numbers travel as strings so that
/// their scale survives. Contexts may only hold strings, numbers, booleans, nulls, lists
/// and maps with string keys; anything else is rejected on {@link #serialize}.
///
/// Registered under `META-INF/services` so that
/// `ConclaveFactory.discoverContextSerializer()` finds it whenever this module is on the
/// classpath.
///
/// @implNote Thread-safe.
public final class JacksonContextSerializer implements ContextSerializer {

    static final String CONTEXT = "context";
    static final String TYPES = "types";

    private final ObjectMapper mapper;

    public JacksonContextSerializer() {
        this(ConclaveJson.createMapper().disable(SerializationFeature.INDENT_OUTPUT));
    }

    public JacksonContextSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String serialize(Map<String, Object> context) {
        if (context == null) {
            throw new IllegalArgumentException("Failed to serialize context: context is null");
        }
        Map<String, String> types = new TreeMap<>();
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(CONTEXT, encode("", context, types));
        if (!types.isEmpty()) {
            document.put(TYPES, types);
        }
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize context: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public Map<String, Object> deserialize(String text) {
        JsonNode document;
        try {
            document = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize context: " + e.getOriginalMessage(), e);
        }
        if (document == null || !document.isObject() || !document.path(CONTEXT).isObject()) {
            throw new IllegalArgumentException(
                    "Failed to deserialize context: expected an object with a \""
                            + CONTEXT
                            + "\" object");
        }

        Map<String, String> types = new HashMap<>();
        JsonNode typeNode = document.path(TYPES);
        Iterator<Map.Entry<String, JsonNode>> fields = typeNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            types.put(field.getKey(), field.getValue().asText());
        }
        return decodeObject("", document.get(CONTEXT), types);
    }

    private static Object encode(String pointer, Object value, Map<String, String> types) {
        if (value == null
                || value instanceof String
                || value instanceof Boolean
                || value instanceof Integer) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw unsupported(pointer, "non-string key " + entry.getKey());
                }
                copy.put(key, encode(child(pointer, key), entry.getValue(), types));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                copy.add(encode(child(pointer, Integer.toString(i)), list.get(i), types));
            }
            return copy;
        }
        if (value instanceof Double number && Double.isFinite(number)) {
            return value;
        }
        NumericType type = NumericType.of(value);
        if (type == null) {
            throw unsupported(pointer, value.getClass().getName());
        }
        types.put(pointer, type.wireName);
        return type.encode((Number) value);
    }

    private static Map<String, Object> decodeObject(
            String pointer, JsonNode node, Map<String, String> types) {
        Map<String, Object> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            map.put(
                    field.getKey(),
                    decode(child(pointer, field.getKey()), field.getValue(), types));
        }
        return map;
    }

    private static Object decode(String pointer, JsonNode node, Map<String, String> types) {
        String tag = types.get(pointer);
        if (tag != null) {
            return NumericType.fromWireName(tag, pointer).decode(node, pointer);
        }
        if (node.isObject()) {
            return decodeObject(pointer, node, types);
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            for (int i = 0; i < node.size(); i++) {
                list.add(decode(child(pointer, Integer.toString(i)), node.get(i), types));
            }
            return list;
        }
        if (node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isInt()) {
            return node.intValue();
        }
        if (node.isLong()) {
            return node.longValue();
        }
        if (node.isBigInteger()) {
            return node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        throw malformed(pointer, "unexpected " + node.getNodeType());
    }

    // RFC 6901 escaping
    private static String child(String pointer, String token) {
        return pointer + "/" + token.replace("~", "~0").replace("/", "~1");
    }

    private static IllegalArgumentException unsupported(String pointer, String what) {
        return new IllegalArgumentException(
                "Failed to serialize context: unsupported value at \""
                        + pointer
                        + "\": "
                        + what);
    }

    private static IllegalArgumentException malformed(String pointer, String what) {
        return new IllegalArgumentException(
                "Failed to deserialize context: " + what + " at \"" + pointer + "\"");
    }

    private enum NumericType {
        LONG("long", Long.class),
        SHORT("short", Short.class),
        BYTE("byte", Byte.class),
        FLOAT("float", Float.class),
        DOUBLE("double", Double.class),
        BIG_INTEGER("big-integer", BigInteger.class),
        BIG_DECIMAL("big-decimal", BigDecimal.class);

        private final String wireName;
        private final Class<? extends Number> javaType;

        NumericType(String wireName, Class<? extends Number> javaType) {
            this.wireName = wireName;
            this.javaType = javaType;
        }

        static NumericType of(Object value) {
            for (NumericType type : values()) {
                if (type.javaType == value.getClass()) {
                    return type;
                }
            }
            return null;
        }

        static NumericType fromWireName(String wireName, String pointer) {
            for (NumericType type : values()) {
                if (type.wireName.equals(wireName)) {
                    return type;
                }
            }
            throw malformed(pointer, "unknown numeric type \"" + wireName + "\"");
        }

        /// Big and non-finite numbers are written as strings.
        Object encode(Number value) {
            return switch (this) {
                case BIG_INTEGER, BIG_DECIMAL, DOUBLE -> value.toString();
                case FLOAT -> Float.isFinite(value.floatValue()) ? value : value.toString();
                default -> value;
            };
        }

        Number decode(JsonNode node, String pointer) {
            try {
                return switch (this) {
                    case LONG -> Long.valueOf(integral(node, pointer).longValue());
                    case SHORT -> Short.valueOf(integral(node, pointer).shortValue());
                    case BYTE -> Byte.valueOf((byte) integral(node, pointer).intValue());
                    case FLOAT -> node.isTextual()
                            ? Float.valueOf(node.textValue())
                            : Float.valueOf(numeric(node, pointer).floatValue());
                    case DOUBLE -> Double.valueOf(text(node, pointer));
                    case BIG_INTEGER -> new BigInteger(text(node, pointer));
                    case BIG_DECIMAL -> new BigDecimal(text(node, pointer));
                };
            } catch (NumberFormatException e) {
                throw malformed(pointer, "invalid " + wireName + " \"" + node.asText() + "\"");
            }
        }

        private JsonNode integral(JsonNode node, String pointer) {
            if (!node.isIntegralNumber()) {
                throw malformed(pointer, "expected an integer for " + wireName);
            }
            return node;
        }

        private JsonNode numeric(JsonNode node, String pointer) {
            if (!node.isNumber()) {
                throw malformed(pointer, "expected a number for " + wireName);
            }
            return node;
        }

        private String text(JsonNode node, String pointer) {
            if (!node.isTextual()) {
                throw malformed(pointer, "expected a string for " + wireName);
            }
            return node.textValue();
        }
    }
}
