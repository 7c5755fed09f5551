package io.conclave.core.voting;

import java.util.Objects;

/// Choice offered in a voting session.
///
/// @param id identifier, unique within its session, not null
/// @param label display text, defaults to the id
/// @param value optional machine-readable value attached to the option, may be null
public record VoteOption(String id, String label, String value) {

    public VoteOption {
        Objects.requireNonNull(id, "id must not be null");
        label = label != null ? label : id;
    }

    public static VoteOption of(String id) {
        return new VoteOption(id, id, null);
    }

    public static VoteOption of(String id, String label) {
        return new VoteOption(id, label, null);
    }
}
