package io.conclave.core.voting;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Outcome of a closed voting session. Computed once, immutable afterward.
///
/// ### Contracts
/// - **Invariant**: `consensusReached` implies `votesCast >= quorum`
/// - **Invariant**: `winningOption` is present exactly when `consensusReached` is true
///
/// @param sessionId session the result belongs to, not null
/// @param winningOption winning option, null when no consensus was reached
/// @param consensusReached whether the algorithm produced a valid decision
/// @param tally option id to vote total (weighted for weighted majority), in option order
/// @param votesCast number of distinct agents that voted
/// @param quorum quorum the session was created with
/// @param algorithm rule used to decide, not null
/// @param confidence leading option's share of the total, 0 when nobody voted
/// @param details one-line explanation, never null
/// @param closedAt close time, not null
public record VoteResult(
        String sessionId,
        VoteOption winningOption,
        boolean consensusReached,
        Map<String, Double> tally,
        int votesCast,
        int quorum,
        VotingAlgorithm algorithm,
        double confidence,
        String details,
        Instant closedAt) {

    public VoteResult {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(algorithm, "algorithm must not be null");
        Objects.requireNonNull(closedAt, "closedAt must not be null");
        tally = Collections.unmodifiableMap(new LinkedHashMap<>(tally));
        details = details != null ? details : "";
    }

    public Optional<VoteOption> winner() {
        return Optional.ofNullable(winningOption);
    }

    public boolean hasWinner() {
        return winningOption != null;
    }
}
