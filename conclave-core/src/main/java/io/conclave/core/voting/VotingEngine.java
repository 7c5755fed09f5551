package io.conclave.core.voting;

import io.conclave.core.agent.Agent;
import io.conclave.core.agent.AgentRegistry;
import io.conclave.core.event.EventBus;
import io.conclave.core.event.EventPayload;
import io.conclave.core.exception.ValidationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Logger;

/// Quorum-based decisions among registered agents.
///
/// A session is created open, accepts votes (last vote per agent wins) and closes exactly
/// once. Closing computes a {@link VoteResult} with {@link ConsensusCalculator}, caches it,
/// and returns the cached instance on every later call.
///
/// ### Contracts
/// - **Precondition**: options are non-empty with unique ids
/// - **Postcondition**: `closeVotingSession` returns the same instance on repeated calls
/// - **Invariant**: `consensusReached` is false whenever fewer than `quorum` votes were cast
///
/// ### Ordering
/// Votes and the close transition of a session run under the session's monitor and publish
/// their events before releasing it, so `vote.session.created`, `vote.cast` and
/// `vote.session.closed` of one session reach subscribers in order.
///
/// @implNote Thread-safe. Sessions live in a {@link ConcurrentHashMap}; each session is
/// guarded by its own lock, so unrelated sessions never contend.
///
/// @see ConsensusCalculator for tallying rules
public class VotingEngine {

    private static final Logger logger = Logger.getLogger(VotingEngine.class.getName());
    private static final String SOURCE = "voting-engine";

    private final AgentRegistry registry;
    private final EventBus eventBus;
    private final ConsensusCalculator calculator;
    private final double defaultSupermajorityThreshold;
    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();

    public VotingEngine(AgentRegistry registry, EventBus eventBus) {
        this(registry, eventBus, ConsensusCalculator.DEFAULT_SUPERMAJORITY_THRESHOLD);
    }

    /// Creates an engine.
    ///
    /// @param registry shared agent registry used for quorum defaults and vote weights, not null
    /// @param eventBus bus for vote events, not null
    /// @param defaultSupermajorityThreshold threshold used when a close call supplies none
    public VotingEngine(
            AgentRegistry registry, EventBus eventBus, double defaultSupermajorityThreshold) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.calculator = new ConsensusCalculator();
        validateThreshold(defaultSupermajorityThreshold);
        this.defaultSupermajorityThreshold = defaultSupermajorityThreshold;
    }

    public Agent registerAgent(Agent agent) {
        return registry.register(agent);
    }

    public boolean unregisterAgent(String agentId) {
        return registry.unregister(agentId);
    }

    /// Opens a session with the default quorum.
    ///
    /// @see #createVotingSession(String, List, Integer)
    public String createVotingSession(String topic, List<VoteOption> options) {
        return createVotingSession(topic, options, null);
    }

    /// Opens a voting session.
    ///
    /// The default quorum is a strict majority of the agents registered at creation time:
    /// `registered / 2 + 1`. It is fixed when the session is created.
    ///
    /// @apiNote **Side effects**:
    /// - Stores a new open session
    /// - Publishes `vote.session.created`
    ///
    /// @param topic what is being decided, not null
    /// @param options choices in display order, not empty, ids unique
    /// @param quorum minimum cast votes, or null for the default
    /// @return new session id, never null
    /// @throws ValidationException if options are empty or duplicated, or quorum < 1
    public String createVotingSession(String topic, List<VoteOption> options, Integer quorum) {
        Objects.requireNonNull(topic, "topic must not be null");
        if (options == null || options.isEmpty()) {
            throw new ValidationException("Voting session requires at least one option");
        }
        Set<String> seen = new HashSet<>();
        for (VoteOption option : options) {
            if (!seen.add(option.id())) {
                throw new ValidationException("Duplicate option id: " + option.id());
            }
        }
        if (quorum != null && quorum < 1) {
            throw new ValidationException("Quorum must be >= 1, got " + quorum);
        }

        int effectiveQuorum = quorum != null ? quorum : registry.size() / 2 + 1;
        String sessionId = newSessionId(topic);
        SessionState state =
                new SessionState(sessionId, topic, List.copyOf(options), effectiveQuorum);

        synchronized (state) {
            sessions.put(sessionId, state);
            logger.info(
                    "Created voting session "
                            + sessionId
                            + " with "
                            + options.size()
                            + " options, quorum "
                            + effectiveQuorum);
            eventBus.publish(
                    SOURCE,
                    new EventPayload.VoteSessionCreated(
                            sessionId,
                            topic,
                            options.stream().map(VoteOption::id).toList(),
                            effectiveQuorum));
        }
        return sessionId;
    }

    /// Records an agent's vote, replacing any earlier vote from the same agent.
    ///
    /// Agents need not be registered to vote; unregistered voters count with weight 1. The
    /// weight is fixed when the vote is cast, so later registry changes do not alter it.
    ///
    /// @param sessionId session identifier
    /// @param agentId voting agent, not null
    /// @param optionId chosen option
    /// @return `false` with no state change if the session is unknown or closed or the
    ///     option does not exist, `true` otherwise
    public boolean castVote(String sessionId, String agentId, String optionId) {
        Objects.requireNonNull(agentId, "agentId must not be null");
        SessionState state = sessionId != null ? sessions.get(sessionId) : null;
        if (state == null) {
            logger.warning("Vote rejected, unknown session: " + sessionId);
            return false;
        }

        synchronized (state) {
            if (state.result != null) {
                logger.warning("Vote rejected, session closed: " + sessionId);
                return false;
            }
            if (state.options.stream().noneMatch(o -> o.id().equals(optionId))) {
                logger.warning("Vote rejected, unknown option " + optionId + " in " + sessionId);
                return false;
            }
            String previous = state.votes.put(agentId, optionId);
            state.weights.put(agentId, weightOf(agentId));
            logger.fine("Agent " + agentId + " voted " + optionId + " in " + sessionId);
            eventBus.publish(
                    SOURCE,
                    new EventPayload.VoteCast(sessionId, agentId, optionId, previous != null));
            return true;
        }
    }

    /// Closes a session by simple majority.
    ///
    /// @see #closeVotingSession(String, VotingAlgorithm, Double)
    public VoteResult closeVotingSession(String sessionId) {
        return closeVotingSession(sessionId, null, null);
    }

    /// Closes a session and returns its result.
    ///
    /// The first call computes and caches the result; later calls return the cached
    /// instance unchanged, whatever algorithm or threshold they pass.
    ///
    /// @apiNote **Side effects**:
    /// - Transitions the session to {@link SessionStatus#CLOSED} on the first call
    /// - Publishes `vote.session.closed` on the first call only
    ///
    /// @param sessionId session identifier, not null
    /// @param algorithm decision rule, or null for {@link VotingAlgorithm#SIMPLE_MAJORITY}
    /// @param threshold supermajority share in (0, 1], or null for the configured default
    /// @return the session result, never null
    /// @throws ValidationException if the session is unknown or the threshold is out of range
    public VoteResult closeVotingSession(
            String sessionId, VotingAlgorithm algorithm, Double threshold) {
        SessionState state = requireSession(sessionId);
        VotingAlgorithm effectiveAlgorithm =
                algorithm != null ? algorithm : VotingAlgorithm.SIMPLE_MAJORITY;
        double effectiveThreshold = threshold != null ? threshold : defaultSupermajorityThreshold;
        validateThreshold(effectiveThreshold);

        synchronized (state) {
            if (state.result != null) {
                logger.fine("Session " + sessionId + " already closed, returning cached result");
                return state.result;
            }

            VoteResult result =
                    calculator.evaluate(
                            sessionId,
                            state.options,
                            state.votes,
                            state.quorum,
                            effectiveAlgorithm,
                            effectiveThreshold,
                            state::weightAtCast);
            state.result = result;

            logger.info(
                    "Closed voting session "
                            + sessionId
                            + ": "
                            + (result.consensusReached()
                                    ? "winner " + result.winningOption().id()
                                    : "no consensus")
                            + " ("
                            + result.details()
                            + ")");
            eventBus.publish(
                    SOURCE,
                    new EventPayload.VoteSessionClosed(
                            sessionId,
                            result.hasWinner() ? result.winningOption().id() : null,
                            result.consensusReached(),
                            result.tally()));
            return result;
        }
    }

    /// Returns a snapshot of a session.
    ///
    /// @param sessionId session identifier
    /// @return snapshot, or empty if unknown
    public Optional<VotingSession> getVotingSession(String sessionId) {
        SessionState state = sessionId != null ? sessions.get(sessionId) : null;
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return Optional.of(state.snapshot());
        }
    }

    /// Returns snapshots of all sessions, oldest first.
    public List<VotingSession> getAllVotingSessions() {
        List<VotingSession> snapshots = new ArrayList<>();
        for (SessionState state : sessions.values()) {
            synchronized (state) {
                snapshots.add(state.snapshot());
            }
        }
        snapshots.sort(
                Comparator.comparing(VotingSession::createdAt)
                        .thenComparing(VotingSession::id));
        return snapshots;
    }

    /// Returns the voting weight of an agent: half its expertise count, at least 1.
    ///
    /// @param agentId agent identifier
    /// @return weight >= 1
    public double weightOf(String agentId) {
        return registry.getAgent(agentId)
                .map(a -> Math.max(1.0, a.expertise().size() / 2.0))
                .orElse(1.0);
    }

    private SessionState requireSession(String sessionId) {
        SessionState state = sessionId != null ? sessions.get(sessionId) : null;
        if (state == null) {
            throw new ValidationException("Voting session not found: " + sessionId);
        }
        return state;
    }

    private static void validateThreshold(double threshold) {
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new ValidationException("Threshold must be in (0, 1], got " + threshold);
        }
    }

    private static String newSessionId(String topic) {
        String slug = topic.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        if (slug.length() > 24) {
            slug = slug.substring(0, 24);
        }
        return "vote_"
                + slug
                + "_"
                + System.currentTimeMillis()
                + "_"
                + Integer.toString(ThreadLocalRandom.current().nextInt(1 << 24), 36);
    }

    private static final class SessionState {
        private final String id;
        private final String topic;
        private final List<VoteOption> options;
        private final int quorum;
        private final Instant createdAt = Instant.now();
        private final Map<String, String> votes = new LinkedHashMap<>();
        private final Map<String, Double> weights = new HashMap<>();
        private VoteResult result;

        private SessionState(String id, String topic, List<VoteOption> options, int quorum) {
            this.id = id;
            this.topic = topic;
            this.options = options;
            this.quorum = quorum;
        }

        private double weightAtCast(String agentId) {
            return weights.getOrDefault(agentId, 1.0);
        }

        private VotingSession snapshot() {
            return new VotingSession(
                    id,
                    topic,
                    options,
                    quorum,
                    votes,
                    result != null ? SessionStatus.CLOSED : SessionStatus.OPEN,
                    createdAt);
        }
    }
}
