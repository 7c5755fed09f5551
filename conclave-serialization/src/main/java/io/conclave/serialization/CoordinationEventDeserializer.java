package io.conclave.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.conclave.core.event.CoordinationEvent;
import io.conclave.core.event.EventPayload;
import io.conclave.core.event.EventType;
import java.io.IOException;
import java.io.Serial;
import java.util.Optional;

/// Reads an event envelope, resolving the payload record from the `"type"` wire name.
///
/// @implNote Package-private. Registered by {@link ConclaveJacksonModule}.
/// @see CoordinationEventSerializer for the inverse operation
class CoordinationEventDeserializer extends StdDeserializer<CoordinationEvent<?>> {

    @Serial private static final long serialVersionUID = 8810297035174459206L;

    CoordinationEventDeserializer() {
        super(CoordinationEvent.class);
    }

    @Override
    public CoordinationEvent<?> deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectCodec codec = p.getCodec();
        JsonNode root = codec.readTree(p);

        String wireName = root.path("type").asText(null);
        Optional<EventType> type = EventType.fromWireName(wireName);
        if (type.isEmpty()) {
            return ctxt.reportInputMismatch(
                    CoordinationEvent.class, "Unknown event type: " + wireName);
        }
        JsonNode payloadNode = root.get("payload");
        if (payloadNode == null || payloadNode.isNull()) {
            return ctxt.reportInputMismatch(
                    CoordinationEvent.class, "Event " + wireName + " has no payload");
        }

        EventPayload payload = codec.treeToValue(payloadNode, type.get().payloadType());
        return new CoordinationEvent<>(
                root.path("id").asText(),
                root.path("timestamp").asLong(),
                root.path("source").asText(),
                payload);
    }
}
