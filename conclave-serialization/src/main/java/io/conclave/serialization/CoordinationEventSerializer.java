package io.conclave.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.conclave.core.event.CoordinationEvent;
import java.io.IOException;
import java.io.Serial;

/// Writes a {@link CoordinationEvent} as an envelope:
/// `{"id", "type", "timestamp", "source", "payload"}` where `type` is the event wire name
/// such as `task.routed`.
///
/// @implNote Package-private. Registered by {@link ConclaveJacksonModule}.
/// @see CoordinationEventDeserializer for the inverse operation
class CoordinationEventSerializer extends StdSerializer<CoordinationEvent<?>> {

    @Serial private static final long serialVersionUID = -3390125000737409961L;

    CoordinationEventSerializer() {
        super(CoordinationEvent.class, false);
    }

    @Override
    public void serialize(
            CoordinationEvent<?> event, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", event.id());
        gen.writeStringField("type", event.type().wireName());
        gen.writeNumberField("timestamp", event.timestamp());
        gen.writeStringField("source", event.source());
        provider.defaultSerializeField("payload", event.payload(), gen);
        gen.writeEndObject();
    }
}
