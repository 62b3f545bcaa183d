package com.flagship.wager_engine.game;

import com.flagship.wager_engine.exception.InvalidPhaseException;
import com.flagship.wager_engine.ledger.PlayerAddress;
import com.flagship.wager_engine.verification.ExpectedTransfer;
import com.flagship.wager_engine.verification.TransactionVerifier;
import com.flagship.wager_engine.verification.VerificationOutcome;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives the rounds of one timed game.
 *
 * Exactly one instance per game type owns the current round, its open bets and the result
 * history. Phase changes happen only when a {@link RoundTimer} fires. The in-memory phase is
 * what clients see; the persisted round phase is what registration and settlement check, so a
 * late action that slips past the in-memory phase is still rejected by the store.
 */
@Slf4j
public abstract class RoundScheduler {

    private static final int MAX_RESOLUTION_ATTEMPTS = 3;
    private static final int HISTORY_FEED_SIZE = 10;

    protected final GameType gameType;
    protected final BetRegistry betRegistry;
    protected final RoundPersistenceService roundPersistenceService;
    protected final SettlementEngine settlementEngine;
    protected final OutcomeGenerator outcomeGenerator;
    protected final TransactionVerifier verifier;
    protected final RoundTimer timer;
    protected final RoundBroadcaster broadcaster;
    protected final RoundHistory history;

    /** Guards the in-memory phase and the timer handles. */
    protected final Object monitor = new Object();

    protected volatile Round currentRound;
    protected volatile RoundPhase phase = RoundPhase.IDLE;
    protected final Map<String, Bet> openBets = new ConcurrentHashMap<>();

    protected RoundScheduler(GameType gameType, RoundServices services, int historyCapacity) {
        this.gameType = gameType;
        this.betRegistry = services.getBetRegistry();
        this.roundPersistenceService = services.getRoundPersistenceService();
        this.settlementEngine = services.getSettlementEngine();
        this.outcomeGenerator = services.getOutcomeGenerator();
        this.verifier = services.getVerifier();
        this.timer = services.getTimer();
        this.broadcaster = services.getBroadcaster();
        this.history = new RoundHistory(historyCapacity);
    }

    /**
     * Registers a player's bet on the round currently accepting bets.
     *
     * A proof, when given, is verified against the house address before anything is locked.
     *
     * @param target game specific target, validated by {@link #normalizeTarget(BigDecimal)}
     * @param proof optional external payment proof
     */
    public Bet join(String address, BigDecimal amount, BigDecimal target, String proof) {
        String player = PlayerAddress.normalize(address);
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Bet amount must be positive");
        }
        BigDecimal effectiveTarget = normalizeTarget(target);

        String effectiveProof = proof == null || proof.isBlank() ? null : proof.trim();
        boolean verified = false;
        if (effectiveProof != null) {
            String house = verifier.getHouseAddress().isEmpty() ? null : verifier.getHouseAddress();
            verified = verifier.submit(effectiveProof, new ExpectedTransfer(player, house, amount))
                == VerificationOutcome.CONFIRMED;
        }

        UUID roundId = roundForRegistration();
        Bet bet = betRegistry.register(roundId, player, amount, effectiveTarget, effectiveProof, verified);
        openBets.put(player, bet);
        broadcaster.broadcast(gameType, "bet", BetView.from(bet));
        return bet;
    }

    /**
     * Cashes out the player's open bet at the current multiplier.
     */
    public Settlement cashout(String address) {
        throw new InvalidPhaseException(gameType + " bets cannot be cashed out early");
    }

    /**
     * Id of the round new bets go to.
     *
     * @throws InvalidPhaseException if no round is accepting bets
     */
    protected abstract UUID roundForRegistration();

    /**
     * Validates and defaults the client supplied target.
     */
    protected abstract BigDecimal normalizeTarget(BigDecimal target);

    /**
     * Multiplier to report while the round runs, null for games without one.
     */
    protected BigDecimal currentMultiplier() {
        return null;
    }

    public GameType getGameType() {
        return gameType;
    }

    public RoundPhase currentPhase() {
        return phase;
    }

    public Optional<Round> currentRound() {
        return Optional.ofNullable(currentRound);
    }

    public RoundStatus status() {
        Round round = currentRound;
        return new RoundStatus(gameType, phase, round != null ? round.getId() : null,
            currentMultiplier(), openBets.size());
    }

    public List<RoundHistoryEntry> history(int limit) {
        return history.recent(limit);
    }

    public List<BetView> openBets() {
        List<BetView> views = new ArrayList<>();
        openBets.values().forEach(bet -> views.add(BetView.from(bet)));
        return views;
    }

    /**
     * Resolves the round in the store, records it in the history and tells the clients.
     * Bets that could not be settled stay open and are retried after {@code retryDelay}.
     */
    protected ResolutionReport resolve(Round round, BigDecimal result, SettlementRule rule, Duration retryDelay) {
        ResolutionReport report = tryResolve(round.getId(), result, rule, retryDelay, 1);
        BigDecimal finalResult = report != null ? report.getResult() : result;

        history.record(new RoundHistoryEntry(round.getId(), finalResult, Instant.now()));
        openBets.clear();
        broadcaster.broadcast(gameType, "resolved", Map.of("roundId", round.getId(), "result", finalResult));
        broadcaster.broadcast(gameType, "history", history.recent(HISTORY_FEED_SIZE));
        return report;
    }

    private ResolutionReport tryResolve(UUID roundId, BigDecimal result, SettlementRule rule,
                                        Duration retryDelay, int attempt) {
        try {
            ResolutionReport report = settlementEngine.resolveRound(roundId, result, rule);
            if (report.getFailed() > 0) {
                scheduleRetry(roundId, result, rule, retryDelay, attempt);
            }
            return report;
        } catch (RuntimeException e) {
            log.error("Resolution of {} round {} failed (attempt {})", gameType, roundId, attempt, e);
            scheduleRetry(roundId, result, rule, retryDelay, attempt);
            return null;
        }
    }

    private void scheduleRetry(UUID roundId, BigDecimal result, SettlementRule rule, Duration retryDelay, int attempt) {
        if (attempt >= MAX_RESOLUTION_ATTEMPTS) {
            log.error("Giving up on resolving {} round {} after {} attempts, open bets need manual settlement",
                gameType, roundId, attempt);
            return;
        }
        timer.after(retryDelay, () -> tryResolve(roundId, result, rule, retryDelay, attempt + 1));
    }

    protected void publishStatus() {
        broadcaster.broadcast(gameType, "status", status());
    }
}
