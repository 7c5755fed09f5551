package io.conclave.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.conclave.core.agent.Agent;

/// Jackson mixin for {@link Agent}.
///
/// The record components map one to one to JSON fields. The derived `atCapacity` flag is
/// not written, and is ignored if present on input.
@JsonIgnoreProperties(value = {"atCapacity"}, ignoreUnknown = true)
public abstract class AgentMixin {}
