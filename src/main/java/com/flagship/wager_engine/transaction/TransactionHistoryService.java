package com.flagship.wager_engine.transaction;

import com.flagship.wager_engine.game.GameType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Read-only queries over a player's transactions and settled bets.
 */
@Service
@RequiredArgsConstructor
public class TransactionHistoryService {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    private final JdbcTemplate jdbcTemplate;

    /**
     * Lists transactions, newest first, optionally filtered by type and game.
     *
     * @throws IllegalArgumentException if limit is outside 1..100 or offset is negative
     */
    @Transactional(readOnly = true)
    public List<TransactionView> history(String address, int limit, int offset,
                                         TransactionType type, GameType gameType) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative");
        }

        StringBuilder sql = new StringBuilder(
            "SELECT id, type, status, amount, win_amount, game_type, external_proof, bet_id, created_at " +
            "FROM ledger_transactions WHERE address = ?");
        List<Object> args = new ArrayList<>();
        args.add(address);
        if (type != null) {
            sql.append(" AND type = ?");
            args.add(type.name());
        }
        if (gameType != null) {
            sql.append(" AND game_type = ?");
            args.add(gameType.name());
        }
        sql.append(" ORDER BY created_at DESC LIMIT ? OFFSET ?");
        args.add(limit);
        args.add(offset);

        return jdbcTemplate.query(sql.toString(), transactionRowMapper(), args.toArray());
    }

    /**
     * Computes statistics over the player's settled bets.
     */
    @Transactional(readOnly = true)
    public TransactionStatistics statistics(String address) {
        return jdbcTemplate.queryForObject(
            "SELECT COUNT(*) AS total_bets, " +
            "  COUNT(*) FILTER (WHERE status IN ('WON', 'CASHED_OUT')) AS wins, " +
            "  COUNT(*) FILTER (WHERE status = 'LOST') AS losses, " +
            "  COALESCE(SUM(amount), 0) AS total_wagered, " +
            "  COALESCE(SUM(payout), 0) AS total_won, " +
            "  COALESCE(MAX(payout - amount) FILTER (WHERE status IN ('WON', 'CASHED_OUT')), 0) AS biggest_win, " +
            "  COALESCE(MAX(amount) FILTER (WHERE status = 'LOST'), 0) AS biggest_loss " +
            "FROM bets WHERE address = ? AND status <> 'OPEN'",
            (rs, rowNum) -> {
                long totalBets = rs.getLong("total_bets");
                long wins = rs.getLong("wins");
                BigDecimal wagered = rs.getBigDecimal("total_wagered");
                BigDecimal won = rs.getBigDecimal("total_won");
                return TransactionStatistics.builder()
                    .totalBets(totalBets)
                    .wins(wins)
                    .losses(rs.getLong("losses"))
                    .totalWagered(wagered)
                    .totalWon(won)
                    .netProfit(won.subtract(wagered))
                    .winRate(totalBets == 0 ? BigDecimal.ZERO
                        : BigDecimal.valueOf(wins * 100).divide(BigDecimal.valueOf(totalBets), 2, RoundingMode.HALF_UP))
                    .averageBet(totalBets == 0 ? BigDecimal.ZERO
                        : wagered.divide(BigDecimal.valueOf(totalBets), 8, RoundingMode.HALF_UP))
                    .biggestWin(rs.getBigDecimal("biggest_win"))
                    .biggestLoss(rs.getBigDecimal("biggest_loss"))
                    .build();
            },
            address
        );
    }

    private RowMapper<TransactionView> transactionRowMapper() {
        return (rs, rowNum) -> {
            String betId = rs.getString("bet_id");
            return new TransactionView(
                UUID.fromString(rs.getString("id")),
                TransactionType.valueOf(rs.getString("type")),
                TransactionStatus.valueOf(rs.getString("status")),
                rs.getBigDecimal("amount"),
                rs.getBigDecimal("win_amount"),
                rs.getString("game_type"),
                rs.getString("external_proof"),
                betId != null ? UUID.fromString(betId) : null,
                rs.getTimestamp("created_at").toInstant()
            );
        };
    }
}
