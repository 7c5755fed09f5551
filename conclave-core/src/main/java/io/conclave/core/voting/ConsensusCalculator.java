package io.conclave.core.voting;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import java.util.logging.Logger;

/// Computes a {@link VoteResult} from the votes of one session.
///
/// Stateless. The quorum rule is applied last and overrides every algorithm: with fewer
/// than `quorum` votes cast, `consensusReached` is false whatever the tally looks like.
///
/// ### Tie Handling
/// When two or more options share the highest total, no option leads and no consensus
/// is reached under any algorithm.
///
/// @see VotingAlgorithm
public class ConsensusCalculator {

    private static final Logger logger = Logger.getLogger(ConsensusCalculator.class.getName());

    /// Default leading share required by {@link VotingAlgorithm#SUPERMAJORITY}.
    public static final double DEFAULT_SUPERMAJORITY_THRESHOLD = 0.6;

    private static final double EPSILON = 1e-9;

    /// Evaluates a session.
    ///
    /// @param sessionId session identifier, not null
    /// @param options options in creation order, not null
    /// @param votes agent id to option id, not null
    /// @param quorum minimum cast votes for a valid outcome
    /// @param algorithm decision rule, not null
    /// @param threshold leading share for supermajority; ignored by other algorithms
    /// @param weightOf voting weight of an agent id, used by weighted majority only
    /// @return immutable result, never null
    public VoteResult evaluate(
            String sessionId,
            List<VoteOption> options,
            Map<String, String> votes,
            int quorum,
            VotingAlgorithm algorithm,
            double threshold,
            ToDoubleFunction<String> weightOf) {

        boolean weighted = algorithm == VotingAlgorithm.WEIGHTED_MAJORITY;
        Map<String, Double> tally = new LinkedHashMap<>();
        options.forEach(o -> tally.put(o.id(), 0.0));
        votes.forEach(
                (agentId, optionId) ->
                        tally.merge(
                                optionId,
                                weighted ? weightOf.applyAsDouble(agentId) : 1.0,
                                Double::sum));

        double total = tally.values().stream().mapToDouble(Double::doubleValue).sum();
        double top = tally.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        List<String> leaders =
                tally.entrySet().stream()
                        .filter(e -> e.getValue() > 0 && Math.abs(e.getValue() - top) < EPSILON)
                        .map(Map.Entry::getKey)
                        .toList();
        String leader = leaders.size() == 1 ? leaders.get(0) : null;
        double share = total > 0 ? top / total : 0.0;

        boolean decided =
                switch (algorithm) {
                    case SIMPLE_MAJORITY, WEIGHTED_MAJORITY -> leader != null;
                    case SUPERMAJORITY -> leader != null && share + EPSILON >= threshold;
                    case UNANIMOUS -> leader != null && Math.abs(top - total) < EPSILON;
                };
        boolean quorumMet = votes.size() >= quorum;
        boolean consensus = decided && quorumMet;

        VoteOption winner =
                consensus
                        ? options.stream()
                                .filter(o -> o.id().equals(leader))
                                .findFirst()
                                .orElse(null)
                        : null;

        String details =
                describe(algorithm, leaders, share, threshold, votes.size(), quorum, decided);
        logger.fine("Session " + sessionId + ": " + details);

        return new VoteResult(
                sessionId,
                winner,
                consensus,
                tally,
                votes.size(),
                quorum,
                algorithm,
                share,
                details,
                Instant.now());
    }

    private static String describe(
            VotingAlgorithm algorithm,
            List<String> leaders,
            double share,
            double threshold,
            int cast,
            int quorum,
            boolean decided) {
        if (cast < quorum) {
            return "Quorum not met: " + cast + " of " + quorum + " required votes cast";
        }
        if (leaders.isEmpty()) {
            return "No votes cast";
        }
        if (leaders.size() > 1) {
            return "Tie between " + String.join(", ", leaders);
        }
        String share100 = String.format(Locale.ROOT, "%.1f%%", share * 100);
        if (!decided) {
            return switch (algorithm) {
                case SUPERMAJORITY ->
                        leaders.get(0)
                                + " leads with "
                                + share100
                                + ", below threshold "
                                + String.format(Locale.ROOT, "%.1f%%", threshold * 100);
                default -> leaders.get(0) + " leads with " + share100 + " but votes are split";
            };
        }
        return leaders.get(0) + " wins by " + algorithm + " with " + share100;
    }
}
