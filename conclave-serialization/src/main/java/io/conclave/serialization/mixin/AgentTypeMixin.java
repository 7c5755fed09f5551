package io.conclave.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.conclave.core.agent.AgentType;

/// Jackson mixin mapping {@link AgentType} to its lowercase wire name.
public abstract class AgentTypeMixin {

    @JsonValue
    abstract String wireName();

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static AgentType fromWireName(String value) {
        return AgentType.fromWireName(value);
    }
}
