package io.conclave.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.conclave.core.workflow.GraphEdge;
import java.io.IOException;
import java.io.Serial;

/// Reads a {@link GraphEdge}, deriving the id `source->target` when none is given.
///
/// @implNote Package-private. Registered by {@link ConclaveJacksonModule}. Edges are
/// written by Jackson's default record handling.
class GraphEdgeDeserializer extends StdDeserializer<GraphEdge> {

    @Serial private static final long serialVersionUID = 6645205380160255837L;

    GraphEdgeDeserializer() {
        super(GraphEdge.class);
    }

    @Override
    public GraphEdge deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        JsonNode source = root.get("source");
        JsonNode target = root.get("target");
        if (source == null || target == null || source.isNull() || target.isNull()) {
            return ctxt.reportInputMismatch(
                    GraphEdge.class, "Edge requires \"source\" and \"target\": " + root);
        }
        JsonNode id = root.get("id");
        if (id == null || id.isNull()) {
            return GraphEdge.of(source.asText(), target.asText());
        }
        return new GraphEdge(id.asText(), source.asText(), target.asText());
    }
}
