package com.flagship.wager_engine.game.crash;

import com.flagship.wager_engine.exception.InvalidPhaseException;
import com.flagship.wager_engine.exception.RoundAlreadyResolvedException;
import com.flagship.wager_engine.exception.WagerException;
import com.flagship.wager_engine.game.Bet;
import com.flagship.wager_engine.game.BetStatus;
import com.flagship.wager_engine.game.GameType;
import com.flagship.wager_engine.game.Round;
import com.flagship.wager_engine.game.RoundPhase;
import com.flagship.wager_engine.game.RoundScheduler;
import com.flagship.wager_engine.game.RoundServices;
import com.flagship.wager_engine.game.RoundTimer;
import com.flagship.wager_engine.game.Settlement;
import com.flagship.wager_engine.game.SettlementRule;
import com.flagship.wager_engine.ledger.PlayerAddress;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Crash game: IDLE -> COUNTDOWN -> RUNNING -> RESOLVED -> IDLE.
 *
 * The first join while IDLE opens a round and starts the countdown. While RUNNING the
 * multiplier grows by a fixed increment every tick until it reaches the crash point drawn
 * when the round opened. Players cash out at the multiplier of the last tick; a bet with a
 * target above 1 is cashed out at its target by the tick that reaches it. Bets still open
 * when the multiplier crashes are lost.
 */
@Component
@Slf4j
public class CrashRoundScheduler extends RoundScheduler {

    private static final BigDecimal START_MULTIPLIER = new BigDecimal("1.00");

    private final Duration countdown;
    private final Duration tick;
    private final Duration cooldown;
    private final BigDecimal tickIncrement;

    private volatile BigDecimal multiplier = START_MULTIPLIER;
    private BigDecimal crashPoint;
    private RoundTimer.TimerHandle phaseTimer;
    private RoundTimer.TimerHandle tickTimer;

    public CrashRoundScheduler(RoundServices services,
                               @Value("${game.history.capacity:100}") int historyCapacity,
                               @Value("${game.crash.countdown-ms:5000}") long countdownMs,
                               @Value("${game.crash.tick-ms:100}") long tickMs,
                               @Value("${game.crash.tick-increment:0.01}") BigDecimal tickIncrement,
                               @Value("${game.crash.cooldown-ms:5000}") long cooldownMs) {
        super(GameType.CRASH, services, historyCapacity);
        this.countdown = Duration.ofMillis(countdownMs);
        this.tick = Duration.ofMillis(tickMs);
        this.cooldown = Duration.ofMillis(cooldownMs);
        this.tickIncrement = tickIncrement;
    }

    @Override
    protected UUID roundForRegistration() {
        synchronized (monitor) {
            if (phase == RoundPhase.IDLE) {
                openRound();
            }
            if (phase != RoundPhase.COUNTDOWN) {
                throw new InvalidPhaseException("Crash round is " + phase + ", bets are accepted during the countdown only");
            }
            return currentRound.getId();
        }
    }

    @Override
    protected BigDecimal normalizeTarget(BigDecimal target) {
        if (target == null) {
            return null;
        }
        if (target.compareTo(BigDecimal.ONE) < 0) {
            throw new IllegalArgumentException("Auto cashout target must be at least 1: " + target);
        }
        return target.setScale(2, RoundingMode.DOWN);
    }

    @Override
    protected BigDecimal currentMultiplier() {
        return phase == RoundPhase.RUNNING || phase == RoundPhase.RESOLVED ? multiplier : null;
    }

    /**
     * Cashes out the player's open bet at the multiplier of the last tick.
     *
     * @throws RoundAlreadyResolvedException if the round already crashed
     * @throws InvalidPhaseException if no round is running or the player holds no open bet
     */
    @Override
    public Settlement cashout(String address) {
        String player = PlayerAddress.normalize(address);
        Round round = currentRound;
        if (round == null) {
            throw new InvalidPhaseException("No crash round is in progress");
        }
        if (phase == RoundPhase.RESOLVED) {
            throw new RoundAlreadyResolvedException("Round " + round.getId() + " already crashed");
        }
        Bet bet = openBets.get(player);
        if (bet == null) {
            bet = betRegistry.findBet(round.getId(), player)
                .filter(b -> b.getStatus() == BetStatus.OPEN)
                .orElseThrow(() -> new InvalidPhaseException("No open bet on the current round"));
        }

        Settlement settlement = settlementEngine.cashout(bet.getId(), multiplier);
        cashedOut(bet, settlement);
        return settlement;
    }

    private void openRound() {
        currentRound = roundPersistenceService.open(GameType.CRASH);
        crashPoint = outcomeGenerator.crashPoint();
        multiplier = START_MULTIPLIER;
        phase = RoundPhase.COUNTDOWN;
        openBets.clear();
        phaseTimer = timer.after(countdown, this::startRunning);
        log.info("Crash round {} opened, countdown {}ms", currentRound.getId(), countdown.toMillis());
        publishStatus();
    }

    void startRunning() {
        synchronized (monitor) {
            if (phase != RoundPhase.COUNTDOWN) {
                return;
            }
            Round round = currentRound;
            if (!roundPersistenceService.advance(round, RoundPhase.COUNTDOWN, RoundPhase.RUNNING)) {
                log.warn("Round {} was no longer in COUNTDOWN", round.getId());
            }
            currentRound = new Round(round.getId(), round.getGameType(), RoundPhase.RUNNING, null,
                round.getOpenedAt(), null);
            phase = RoundPhase.RUNNING;
            tickTimer = timer.every(tick, this::tick);
            log.info("Crash round {} running with {} bets", round.getId(), openBets.size());
        }
        publishStatus();
    }

    void tick() {
        BigDecimal next;
        BigDecimal crashAt;
        synchronized (monitor) {
            if (phase != RoundPhase.RUNNING) {
                return;
            }
            next = multiplier.add(tickIncrement);
            crashAt = crashPoint;
            if (next.compareTo(crashAt) >= 0) {
                phase = RoundPhase.RESOLVED;
                tickTimer.cancel();
            } else {
                multiplier = next;
            }
        }

        if (next.compareTo(crashAt) >= 0) {
            crash(crashAt);
            return;
        }
        log.debug("Crash tick {}", next);
        broadcaster.broadcast(GameType.CRASH, "tick", Map.of("multiplier", next));
        autoCashout(next, false);
    }

    private void crash(BigDecimal crashAt) {
        Round round = currentRound;
        autoCashout(crashAt, true);
        resolve(round, crashAt, SettlementRule.allLose(), cooldown);
        multiplier = crashAt;
        log.info("Crash round {} crashed at {}", round.getId(), crashAt);

        synchronized (monitor) {
            phaseTimer = timer.after(cooldown, this::reset);
        }
        publishStatus();
    }

    void reset() {
        synchronized (monitor) {
            if (phase != RoundPhase.RESOLVED) {
                return;
            }
            phase = RoundPhase.IDLE;
            currentRound = null;
            crashPoint = null;
            multiplier = START_MULTIPLIER;
        }
        publishStatus();
    }

    /**
     * Cashes out every open bet whose target was reached. At the crash only targets strictly
     * below the crash point count.
     */
    private void autoCashout(BigDecimal reached, boolean crashing) {
        List<Bet> due = new ArrayList<>();
        for (Bet bet : openBets.values()) {
            BigDecimal target = bet.getTarget();
            if (target == null || target.compareTo(BigDecimal.ONE) <= 0) {
                continue;
            }
            int cmp = target.compareTo(reached);
            if (crashing ? cmp < 0 : cmp <= 0) {
                due.add(bet);
            }
        }

        for (Bet bet : due) {
            try {
                cashedOut(bet, settlementEngine.cashout(bet.getId(), bet.getTarget()));
            } catch (WagerException e) {
                openBets.remove(bet.getAddress());
                log.info("Auto cashout of bet {} skipped: {}", bet.getId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Auto cashout of bet {} failed, it stays open", bet.getId(), e);
            }
        }
    }

    private void cashedOut(Bet bet, Settlement settlement) {
        openBets.remove(bet.getAddress());
        broadcaster.broadcast(GameType.CRASH, "cashed-out", Map.of(
            "address", bet.getAddress(),
            "betId", settlement.getBetId(),
            "multiplier", settlement.getMultiplier(),
            "winAmount", settlement.getWinAmount()));
    }

    @PreDestroy
    public void stop() {
        synchronized (monitor) {
            if (phaseTimer != null) {
                phaseTimer.cancel();
            }
            if (tickTimer != null) {
                tickTimer.cancel();
            }
        }
    }
}
