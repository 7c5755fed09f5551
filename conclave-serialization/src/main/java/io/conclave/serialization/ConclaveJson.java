package io.conclave.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.conclave.core.agent.Agent;
import io.conclave.core.event.CoordinationEvent;
import io.conclave.core.handoff.ContextSerializer;
import io.conclave.core.workflow.WorkflowDefinition;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/// JSON facade for workflow definitions, agent rosters, contexts and coordination events.
///
/// Wraps a pre-configured Jackson `ObjectMapper` with {@link ConclaveJacksonModule} and
/// `JavaTimeModule` registered. Use the static convenience methods for one-off conversions,
/// or {@link #createMapper()} to obtain a mapper for custom use.
///
/// ### Contracts
/// - **Precondition**: all `*FromJson` methods require well-formed JSON
/// - **Postcondition**: definitions survive a `definitionToJson` / `definitionFromJson` trip
///   with equal nodes and edges
///
/// @implNote Thread-safe. The shared mapper is configured once and never mutated.
/// @see ConclaveJacksonModule for the registered serializers
public final class ConclaveJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final ObjectMapper COMPACT =
            createMapper().disable(SerializationFeature.INDENT_OUTPUT);

    private static final TypeReference<List<Agent>> AGENT_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> CONTEXT = new TypeReference<>() {};

    private ConclaveJson() {}

    /// Creates a new `ObjectMapper` configured for coordination types.
    ///
    /// Configuration applied:
    /// - {@link ConclaveJacksonModule}: node, edge and event serializers plus mixins
    /// - `JavaTimeModule`: ISO-8601 date/time support
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled: forward-compatible parsing
    /// - `WRITE_DATES_AS_TIMESTAMPS` disabled: human-readable dates
    /// - `INDENT_OUTPUT` enabled: pretty-printed output
    ///
    /// @return a new mapper instance, never null
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ConclaveJacksonModule());
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    /// Returns the {@link ContextSerializer} used for handoffs.
    ///
    /// @return new serializer, never null
    public static ContextSerializer contextSerializer() {
        return new JacksonContextSerializer();
    }

    /// Writes a context as a plain compact JSON object.
    ///
    /// Unlike {@link #contextSerializer()} no type information is kept, so a `Long` that
    /// fits an `int` reads back as an `Integer`.
    ///
    /// @throws IllegalArgumentException if a value cannot be written
    public static String contextToJson(Map<String, Object> context) {
        try {
            return COMPACT.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize context: " + e.getOriginalMessage(), e);
        }
    }

    /// Parses a plain JSON object into a mutable context.
    ///
    /// @throws IllegalArgumentException if the JSON is malformed or not an object
    public static Map<String, Object> contextFromJson(String json) {
        try {
            Map<String, Object> context = MAPPER.readValue(json, CONTEXT);
            if (context == null) {
                throw new IllegalArgumentException("Context must be a JSON object, got null");
            }
            return context;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize context: " + e.getOriginalMessage(), e);
        }
    }

    /// @throws IllegalArgumentException if the definition cannot be written
    public static String definitionToJson(WorkflowDefinition definition) {
        try {
            return MAPPER.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize workflow definition: " + e.getMessage(), e);
        }
    }

    /// Parses a workflow definition.
    ///
    /// @param json the JSON document, not null
    /// @return the definition, never null. Not yet validated, see
    ///     `WorkflowGraphValidator`
    /// @throws IllegalArgumentException if the JSON is malformed, names an unknown node kind
    ///     or agent type, or lacks required fields
    public static WorkflowDefinition definitionFromJson(String json) {
        try {
            return MAPPER.readValue(json, WorkflowDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize workflow definition: " + e.getOriginalMessage(), e);
        }
    }

    /// Parses an agent roster.
    ///
    /// Accepts either a bare JSON array or an object with an `"agents"` array.
    ///
    /// @throws IllegalArgumentException if the JSON is malformed or an agent is invalid
    public static List<Agent> agentsFromJson(String json) {
        try {
            JsonNode root = MAPPER.readTree(json);
            JsonNode agents = root.isObject() ? root.get("agents") : root;
            if (agents == null || !agents.isArray()) {
                throw new IllegalArgumentException(
                        "Agent roster must be an array or an object with an \"agents\" array");
            }
            return MAPPER.readValue(MAPPER.treeAsTokens(agents), AGENT_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize agent roster: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to read agent roster: " + e.getMessage(), e);
        }
    }

    /// @throws IllegalArgumentException if an agent cannot be written
    public static String agentsToJson(List<Agent> agents) {
        try {
            return MAPPER.writeValueAsString(agents);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize agent roster: " + e.getMessage(), e);
        }
    }

    /// Writes an event envelope: `{"id", "type", "timestamp", "source", "payload"}`.
    ///
    /// @throws IllegalArgumentException if the payload cannot be written
    public static String eventToJson(CoordinationEvent<?> event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize event: " + e.getMessage(), e);
        }
    }

    /// @throws IllegalArgumentException if the JSON is malformed or the event type unknown
    public static CoordinationEvent<?> eventFromJson(String json) {
        try {
            return MAPPER.readValue(json, CoordinationEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize event: " + e.getOriginalMessage(), e);
        }
    }
}
