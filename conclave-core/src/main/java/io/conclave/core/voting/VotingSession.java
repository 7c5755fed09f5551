package io.conclave.core.voting;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Read-only snapshot of a voting session.
///
/// @param id session identifier
/// @param topic what is being decided
/// @param options offered choices, in creation order
/// @param quorum minimum number of cast votes for a valid outcome
/// @param votes agent id to option id, one entry per agent, in first-vote order
/// @param status lifecycle state at snapshot time
/// @param createdAt creation time
public record VotingSession(
        String id,
        String topic,
        List<VoteOption> options,
        int quorum,
        Map<String, String> votes,
        SessionStatus status,
        Instant createdAt) {

    public VotingSession {
        options = List.copyOf(options);
        votes = Collections.unmodifiableMap(new LinkedHashMap<>(votes));
    }

    public boolean isOpen() {
        return status == SessionStatus.OPEN;
    }
}
