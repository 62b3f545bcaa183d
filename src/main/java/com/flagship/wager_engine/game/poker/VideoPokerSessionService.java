package com.flagship.wager_engine.game.poker;

import com.flagship.wager_engine.exception.InvalidPhaseException;
import com.flagship.wager_engine.exception.ResourceNotFoundException;
import com.flagship.wager_engine.game.Bet;
import com.flagship.wager_engine.game.BetRegistry;
import com.flagship.wager_engine.game.GameType;
import com.flagship.wager_engine.game.OutcomeGenerator;
import com.flagship.wager_engine.game.ResolutionReport;
import com.flagship.wager_engine.game.Round;
import com.flagship.wager_engine.game.RoundPersistenceService;
import com.flagship.wager_engine.game.RoundPhase;
import com.flagship.wager_engine.game.SettlementEngine;
import com.flagship.wager_engine.game.SettlementRule;
import com.flagship.wager_engine.ledger.LedgerService;
import com.flagship.wager_engine.ledger.PlayerAddress;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Five-card draw sessions (jacks or better).
 *
 * {@link #init} locks the stake and deals five cards; {@link #draw} replaces the cards that
 * are not held, ranks the hand and settles the bet at the paytable multiplier.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VideoPokerSessionService {

    private final BetRegistry betRegistry;
    private final LedgerService ledgerService;
    private final RoundPersistenceService roundPersistenceService;
    private final SettlementEngine settlementEngine;
    private final OutcomeGenerator outcomeGenerator;
    private final PokerSessionRepository sessionRepository;

    @Transactional
    public PokerSessionView init(String address, BigDecimal amount) {
        String player = PlayerAddress.normalize(address);
        ledgerService.lockPlayer(player);
        if (betRegistry.findOpenBet(player, GameType.VIDEO_POKER).isPresent()) {
            throw new InvalidPhaseException("Player already has an active video poker session");
        }

        Round round = roundPersistenceService.open(GameType.VIDEO_POKER);
        Bet bet = betRegistry.register(round.getId(), player, amount, null, null, false);
        PokerSession session = PokerSession.deal(round.getId(), outcomeGenerator.shuffledDeck());
        sessionRepository.save(PokerSessionEntity.fromDomain(session));
        roundPersistenceService.advance(round, RoundPhase.CREATED, RoundPhase.IN_PROGRESS);

        log.info("Video poker session {} dealt {} for {}", round.getId(), session.getHand(), amount);
        return view(RoundPhase.IN_PROGRESS, bet, session, null);
    }

    /**
     * @param held one flag per card, true keeps the card
     * @throws InvalidPhaseException if the session was already drawn
     */
    @Transactional
    public PokerSessionView draw(UUID sessionId, List<Boolean> held) {
        PokerSessionEntity entity = sessionRepository.findForUpdate(sessionId)
            .orElseThrow(() -> new ResourceNotFoundException("Video poker session not found: " + sessionId));
        PokerSession session = entity.toDomain();
        Round round = roundPersistenceService.findById(sessionId)
            .orElseThrow(() -> new ResourceNotFoundException("Round not found: " + sessionId));
        if (round.isResolved() || session.isDrawn()) {
            throw new InvalidPhaseException("Video poker session " + sessionId + " is already finished");
        }

        PokerSession drawn = session.draw(held);
        entity.updateFromDomain(drawn);
        sessionRepository.saveAndFlush(entity);

        BigDecimal multiplier = drawn.getHandRank().getMultiplier();
        ResolutionReport report = settlementEngine.resolveRound(sessionId, multiplier, SettlementRule.outcomeIsMultiplier());
        Bet settled = betRegistry.bets(sessionId).stream()
            .findFirst()
            .orElseThrow(() -> new ResourceNotFoundException("No bet on video poker session " + sessionId));

        log.info("Video poker session {} drew {} ({}), won={}",
            sessionId, drawn.getHand(), drawn.getHandRank(), report.getWon());
        return view(RoundPhase.RESOLVED, settled, drawn, settled.getPayout());
    }

    /**
     * The player's session still waiting for its draw.
     */
    @Transactional(readOnly = true)
    public PokerSessionView fetch(String address) {
        Bet bet = betRegistry.findOpenBet(address, GameType.VIDEO_POKER)
            .orElseThrow(() -> new ResourceNotFoundException("No active video poker session"));
        PokerSession session = sessionRepository.findById(bet.getRoundId())
            .map(PokerSessionEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Video poker session not found: " + bet.getRoundId()));
        return view(RoundPhase.IN_PROGRESS, bet, session, null);
    }

    private static PokerSessionView view(RoundPhase phase, Bet bet, PokerSession session, BigDecimal winAmount) {
        return PokerSessionView.builder()
            .sessionId(session.getRoundId())
            .betId(bet.getId())
            .address(bet.getAddress())
            .amount(bet.getAmount())
            .phase(phase)
            .status(bet.getStatus())
            .hand(session.getHand())
            .held(session.getHeld())
            .handRank(session.getHandRank())
            .multiplier(session.isDrawn() ? session.getHandRank().getMultiplier() : null)
            .winAmount(winAmount)
            .build();
    }
}
