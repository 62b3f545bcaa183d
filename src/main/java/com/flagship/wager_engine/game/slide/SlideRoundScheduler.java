package com.flagship.wager_engine.game.slide;

import com.flagship.wager_engine.exception.InvalidPhaseException;
import com.flagship.wager_engine.game.GameType;
import com.flagship.wager_engine.game.OutcomeGenerator;
import com.flagship.wager_engine.game.Round;
import com.flagship.wager_engine.game.RoundPhase;
import com.flagship.wager_engine.game.RoundScheduler;
import com.flagship.wager_engine.game.RoundServices;
import com.flagship.wager_engine.game.RoundTimer;
import com.flagship.wager_engine.game.SettlementRule;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.UUID;

/**
 * Slide game: IDLE -> COUNTDOWN -> BETTING -> RESOLVED -> IDLE, looping on its own whether
 * or not anyone plays.
 *
 * Bets are accepted during BETTING only. At resolution a result is drawn; a bet wins when the
 * result reaches its target and pays {@code amount * result}.
 */
@Component
@Slf4j
public class SlideRoundScheduler extends RoundScheduler {

    public static final BigDecimal DEFAULT_TARGET = OutcomeGenerator.MIN_MULTIPLIER;

    private final Duration countdown;
    private final Duration betting;
    private final Duration cooldown;
    private final boolean autostart;

    private boolean started;
    private volatile BigDecimal lastResult;
    private RoundTimer.TimerHandle phaseTimer;

    public SlideRoundScheduler(RoundServices services,
                               @Value("${game.history.capacity:100}") int historyCapacity,
                               @Value("${game.slide.countdown-ms:5000}") long countdownMs,
                               @Value("${game.slide.betting-ms:10000}") long bettingMs,
                               @Value("${game.slide.cooldown-ms:5000}") long cooldownMs,
                               @Value("${game.schedulers.enabled:true}") boolean autostart) {
        super(GameType.SLIDE, services, historyCapacity);
        this.countdown = Duration.ofMillis(countdownMs);
        this.betting = Duration.ofMillis(bettingMs);
        this.cooldown = Duration.ofMillis(cooldownMs);
        this.autostart = autostart;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (autostart) {
            start();
        } else {
            log.info("Slide round loop not started (game.schedulers.enabled=false)");
        }
    }

    /**
     * Starts the round loop. Has no effect if it is already running.
     */
    public void start() {
        synchronized (monitor) {
            if (started) {
                return;
            }
            started = true;
        }
        log.info("Starting slide round loop");
        openRound();
    }

    @PreDestroy
    public void stop() {
        synchronized (monitor) {
            started = false;
            if (phaseTimer != null) {
                phaseTimer.cancel();
            }
        }
    }

    @Override
    protected UUID roundForRegistration() {
        Round round = currentRound;
        if (phase != RoundPhase.BETTING || round == null) {
            throw new InvalidPhaseException("Slide round is " + phase + ", bets are accepted during betting only");
        }
        return round.getId();
    }

    @Override
    protected BigDecimal normalizeTarget(BigDecimal target) {
        if (target == null) {
            return DEFAULT_TARGET;
        }
        if (target.compareTo(OutcomeGenerator.MIN_MULTIPLIER) < 0
            || target.compareTo(OutcomeGenerator.MAX_SLIDE_MULTIPLIER) > 0) {
            throw new IllegalArgumentException(String.format("Slide target must be between %s and %s: %s",
                OutcomeGenerator.MIN_MULTIPLIER, OutcomeGenerator.MAX_SLIDE_MULTIPLIER, target));
        }
        return target.setScale(2, RoundingMode.DOWN);
    }

    @Override
    protected BigDecimal currentMultiplier() {
        return phase == RoundPhase.RESOLVED ? lastResult : null;
    }

    void openRound() {
        synchronized (monitor) {
            if (!started) {
                return;
            }
            try {
                currentRound = roundPersistenceService.open(GameType.SLIDE);
            } catch (RuntimeException e) {
                log.error("Could not open slide round, retrying in {}ms", cooldown.toMillis(), e);
                phaseTimer = timer.after(cooldown, this::openRound);
                return;
            }
            phase = RoundPhase.COUNTDOWN;
            openBets.clear();
            phaseTimer = timer.after(countdown, this::openBetting);
            log.info("Slide round {} opened, countdown {}ms", currentRound.getId(), countdown.toMillis());
        }
        publishStatus();
    }

    void openBetting() {
        synchronized (monitor) {
            if (!started || phase != RoundPhase.COUNTDOWN) {
                return;
            }
            Round round = currentRound;
            roundPersistenceService.advance(round, RoundPhase.COUNTDOWN, RoundPhase.BETTING);
            currentRound = new Round(round.getId(), round.getGameType(), RoundPhase.BETTING, null,
                round.getOpenedAt(), null);
            phase = RoundPhase.BETTING;
            phaseTimer = timer.after(betting, this::finishRound);
            log.info("Slide round {} accepting bets for {}ms", round.getId(), betting.toMillis());
        }
        publishStatus();
    }

    void finishRound() {
        Round round;
        synchronized (monitor) {
            if (!started || phase != RoundPhase.BETTING) {
                return;
            }
            phase = RoundPhase.RESOLVED;
            round = currentRound;
        }

        BigDecimal result = outcomeGenerator.slideResult();
        resolve(round, result, SettlementRule.outcomeReachesTarget(DEFAULT_TARGET), cooldown);
        lastResult = result;
        log.info("Slide round {} resolved at {}", round.getId(), result);

        synchronized (monitor) {
            if (started) {
                phaseTimer = timer.after(cooldown, this::nextRound);
            }
        }
        publishStatus();
    }

    void nextRound() {
        synchronized (monitor) {
            if (!started) {
                return;
            }
            phase = RoundPhase.IDLE;
            currentRound = null;
        }
        openRound();
    }
}
