package com.flagship.wager_engine.game.mines;

import com.flagship.wager_engine.exception.InvalidPhaseException;
import com.flagship.wager_engine.exception.ResourceNotFoundException;
import com.flagship.wager_engine.game.Bet;
import com.flagship.wager_engine.game.BetRegistry;
import com.flagship.wager_engine.game.GameType;
import com.flagship.wager_engine.game.OutcomeGenerator;
import com.flagship.wager_engine.game.Round;
import com.flagship.wager_engine.game.RoundPersistenceService;
import com.flagship.wager_engine.game.RoundPhase;
import com.flagship.wager_engine.game.Settlement;
import com.flagship.wager_engine.game.SettlementEngine;
import com.flagship.wager_engine.game.SettlementRule;
import com.flagship.wager_engine.ledger.LedgerService;
import com.flagship.wager_engine.ledger.PlayerAddress;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * Mine-field sessions: CREATED -> IN_PROGRESS -> RESOLVED.
 *
 * The mine layout is drawn when the session is created and never changes. Each safe reveal
 * raises the payout multiplier; hitting a mine loses the stake, cashing out pays
 * {@code amount * multiplier}. Revealing every safe cell cashes out automatically.
 *
 * A session holds exactly one bet, so its resolution runs inside the request's transaction.
 * Creation serializes on the player row, so a player never holds two sessions.
 * Reveals and cashouts of one session serialize on the session row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MinesSessionService {

    private static final BigDecimal MINE_HIT = BigDecimal.ZERO;

    private final BetRegistry betRegistry;
    private final LedgerService ledgerService;
    private final RoundPersistenceService roundPersistenceService;
    private final SettlementEngine settlementEngine;
    private final OutcomeGenerator outcomeGenerator;
    private final MineSessionRepository sessionRepository;

    /**
     * Locks the stake and creates a session with a hidden layout of {@code mines} mines.
     *
     * @throws InvalidPhaseException if the player already has an active session
     */
    @Transactional
    public MineSessionView create(String address, BigDecimal amount, int mines) {
        String player = PlayerAddress.normalize(address);
        if (mines < 1 || mines >= MinePayout.CELLS) {
            throw new IllegalArgumentException("Mines must be between 1 and " + (MinePayout.CELLS - 1) + ": " + mines);
        }
        ledgerService.lockPlayer(player);
        if (betRegistry.findOpenBet(player, GameType.MINES).isPresent()) {
            throw new InvalidPhaseException("Player already has an active mines session");
        }

        Round round = roundPersistenceService.open(GameType.MINES);
        Bet bet = betRegistry.register(round.getId(), player, amount, null, null, false);
        MineSession session = MineSession.create(round.getId(), outcomeGenerator.mineLayout(mines));
        sessionRepository.save(MineSessionEntity.fromDomain(session));

        log.info("Mines session {} created: mines={}, amount={}", round.getId(), mines, amount);
        return view(round.getPhase(), bet, session, null, null);
    }

    /**
     * Reveals one cell.
     *
     * @throws IllegalArgumentException if the point is off the board or already revealed
     * @throws InvalidPhaseException if the session is finished
     */
    @Transactional
    public MineSessionView reveal(UUID sessionId, int point) {
        MineSession.checkPoint(point);
        MineSessionEntity entity = lockSession(sessionId);
        MineSession session = entity.toDomain();
        Round round = activeRound(sessionId);
        Bet bet = stakeOf(sessionId);

        if (session.isMine(point)) {
            settlementEngine.resolveRound(sessionId, MINE_HIT, SettlementRule.allLose());
            log.info("Mines session {} hit a mine at {} after {} safe reveals", sessionId, point, session.safeRevealed());
            return view(RoundPhase.RESOLVED, refreshed(bet), session, point, null);
        }

        MineSession next = session.reveal(point);
        entity.updateFromDomain(next);
        sessionRepository.saveAndFlush(entity);
        if (round.getPhase() == RoundPhase.CREATED) {
            roundPersistenceService.advance(round, RoundPhase.CREATED, RoundPhase.IN_PROGRESS);
        }

        if (next.isCleared()) {
            BigDecimal multiplier = next.multiplier();
            Settlement settlement = settlementEngine.cashout(bet.getId(), multiplier);
            settlementEngine.resolveRound(sessionId, multiplier, SettlementRule.allLose());
            log.info("Mines session {} cleared, paid {}", sessionId, settlement.getWinAmount());
            return view(RoundPhase.RESOLVED, refreshed(bet), next, null, settlement.getWinAmount());
        }
        return view(RoundPhase.IN_PROGRESS, bet, next, null, null);
    }

    /**
     * Cashes out at the current multiplier. At least one cell must have been revealed.
     */
    @Transactional
    public MineSessionView cashout(UUID sessionId) {
        MineSession session = lockSession(sessionId).toDomain();
        Round round = activeRound(sessionId);
        if (round.getPhase() == RoundPhase.CREATED) {
            throw new InvalidPhaseException("Reveal at least one cell before cashing out");
        }
        Bet bet = stakeOf(sessionId);

        BigDecimal multiplier = session.multiplier();
        Settlement settlement = settlementEngine.cashout(bet.getId(), multiplier);
        settlementEngine.resolveRound(sessionId, multiplier, SettlementRule.allLose());

        log.info("Mines session {} cashed out at {} for {}", sessionId, multiplier, settlement.getWinAmount());
        return view(RoundPhase.RESOLVED, refreshed(bet), session, null, settlement.getWinAmount());
    }

    /**
     * The player's active session.
     *
     * @throws ResourceNotFoundException if the player has none
     */
    @Transactional(readOnly = true)
    public MineSessionView status(String address) {
        Bet bet = betRegistry.findOpenBet(address, GameType.MINES)
            .orElseThrow(() -> new ResourceNotFoundException("No active mines session"));
        MineSession session = sessionRepository.findById(bet.getRoundId())
            .map(MineSessionEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Mines session not found: " + bet.getRoundId()));
        Round round = roundPersistenceService.findById(bet.getRoundId())
            .orElseThrow(() -> new ResourceNotFoundException("Round not found: " + bet.getRoundId()));
        return view(round.getPhase(), bet, session, null, null);
    }

    private MineSessionEntity lockSession(UUID sessionId) {
        return sessionRepository.findForUpdate(sessionId)
            .orElseThrow(() -> new ResourceNotFoundException("Mines session not found: " + sessionId));
    }

    private Round activeRound(UUID sessionId) {
        Round round = roundPersistenceService.findById(sessionId)
            .orElseThrow(() -> new ResourceNotFoundException("Round not found: " + sessionId));
        if (round.isResolved()) {
            throw new InvalidPhaseException("Mines session " + sessionId + " is already finished");
        }
        return round;
    }

    private Bet stakeOf(UUID sessionId) {
        return betRegistry.bets(sessionId).stream()
            .findFirst()
            .orElseThrow(() -> new ResourceNotFoundException("No bet on mines session " + sessionId));
    }

    private Bet refreshed(Bet bet) {
        return betRegistry.findById(bet.getId()).orElse(bet);
    }

    private static MineSessionView view(RoundPhase phase, Bet bet, MineSession session,
                                        Integer hitPoint, BigDecimal winAmount) {
        boolean finished = phase == RoundPhase.RESOLVED;
        BigDecimal multiplier = session.multiplier();
        return MineSessionView.builder()
            .sessionId(session.getRoundId())
            .betId(bet.getId())
            .address(bet.getAddress())
            .amount(bet.getAmount())
            .mines(session.getMineCount())
            .phase(phase)
            .status(bet.getStatus())
            .revealed(session.getRevealed())
            .multiplier(multiplier)
            .potentialWin(finished ? null : bet.getAmount().multiply(multiplier).setScale(8, RoundingMode.DOWN))
            .winAmount(winAmount)
            .hitPoint(hitPoint)
            .mineCells(finished ? session.getMineCells() : null)
            .build();
    }
}
