package io.conclave.core.handoff;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/// Test serializer that parks contexts in memory and writes a token in their place.
///
/// A context holding the key {@link #UNSERIALIZABLE} is rejected.
public class TokenContextSerializer implements ContextSerializer {

    public static final String UNSERIALIZABLE = "__unserializable";

    private final Map<String, Map<String, Object>> parked = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public String serialize(Map<String, Object> context) {
        if (context.containsKey(UNSERIALIZABLE)) {
            throw new IllegalArgumentException("Value of " + UNSERIALIZABLE + " cannot be written");
        }
        String token = "context-token-" + sequence.incrementAndGet() + "-" + context.keySet();
        parked.put(token, new LinkedHashMap<>(context));
        return token;
    }

    @Override
    public Map<String, Object> deserialize(String text) {
        Map<String, Object> context = parked.get(text);
        if (context == null) {
            throw new IllegalArgumentException("Unknown context token: " + text);
        }
        return new LinkedHashMap<>(context);
    }
}
