package io.conclave.core.voting;

import java.util.Arrays;

/// Rule used to turn a tally into a decision when a session closes.
///
/// - **SIMPLE_MAJORITY**: the option with the most votes wins; a tie for first place
///   yields no consensus
/// - **WEIGHTED_MAJORITY**: as simple majority, but each vote counts with the casting
///   agent's expertise weight
/// - **SUPERMAJORITY**: the leading option must hold at least the threshold share of
///   cast votes
/// - **UNANIMOUS**: every cast vote must be for the same option
public enum VotingAlgorithm {
    SIMPLE_MAJORITY("simple-majority"),
    WEIGHTED_MAJORITY("weighted-majority"),
    SUPERMAJORITY("supermajority"),
    UNANIMOUS("unanimous");

    private final String wireName;

    VotingAlgorithm(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static VotingAlgorithm fromWireName(String value) {
        return Arrays.stream(values())
                .filter(a -> a.wireName.equalsIgnoreCase(value) || a.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(
                        () -> new IllegalArgumentException("Unknown voting algorithm: " + value));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
