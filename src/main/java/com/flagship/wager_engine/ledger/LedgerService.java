package com.flagship.wager_engine.ledger;

import com.flagship.wager_engine.exception.InsufficientFundsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Per-player balance store with locked-balance semantics.
 *
 * Every adjustment is a single conditional UPDATE, so balance and locked balance move
 * together and the row never observably violates {@code 0 <= locked_balance <= balance}.
 * The same invariant is declared as CHECK constraints on the users table.
 *
 * Callers compose adjustments inside their own transaction (default REQUIRED propagation),
 * e.g. settlement applies the balance change together with the bet and transaction records.
 *
 * JDBC is used directly so that the database, not the persistence context, decides
 * whether a conditional adjustment applies.
 */
@Service
@Slf4j
public class LedgerService {

    private static final String SELECT_USER =
        "SELECT address, balance, locked_balance FROM users WHERE address = ?";

    private final JdbcTemplate jdbcTemplate;

    public LedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates the player row on first reference. Never deletes or resets an existing row.
     */
    @Transactional
    public void ensureUser(String address) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO users (address, balance, locked_balance, created_at, updated_at) " +
            "VALUES (?, 0, 0, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP) ON CONFLICT (address) DO NOTHING",
            address
        );
        if (inserted > 0) {
            log.info("Created ledger user: address={}", address);
        }
    }

    /**
     * Creates the player if needed and holds its row lock until the caller's transaction ends,
     * so per-player check-then-act sequences run one at a time.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lockPlayer(String address) {
        ensureUser(address);
        jdbcTemplate.queryForObject("SELECT address FROM users WHERE address = ? FOR UPDATE", String.class, address);
    }

    /**
     * Returns the balance snapshot, creating the player if it has never been seen.
     */
    @Transactional
    public BalanceSnapshot getBalance(String address) {
        ensureUser(address);
        return jdbcTemplate.queryForObject(SELECT_USER, balanceRowMapper(), address);
    }

    /**
     * Reserves {@code amount} of the available balance.
     *
     * @throws InsufficientFundsException if {@code balance - lockedBalance < amount}; nothing is locked
     */
    @Transactional
    public void lock(String address, BigDecimal amount) {
        requirePositive(amount);
        int updated = jdbcTemplate.update(
            "UPDATE users SET locked_balance = locked_balance + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE address = ? AND balance - locked_balance >= ?",
            amount, address, amount
        );
        if (updated == 0) {
            throw new InsufficientFundsException(
                String.format("Insufficient available balance for %s: requested %s", address, amount.toPlainString()));
        }
        log.debug("Locked {} for {}", amount, address);
    }

    /**
     * Releases a previously locked amount without touching the balance.
     */
    @Transactional
    public void unlock(String address, BigDecimal amount) {
        requirePositive(amount);
        int updated = jdbcTemplate.update(
            "UPDATE users SET locked_balance = locked_balance - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE address = ? AND locked_balance >= ?",
            amount, address, amount
        );
        if (updated == 0) {
            throw new IllegalStateException(
                String.format("Cannot unlock %s for %s: locked balance is lower", amount.toPlainString(), address));
        }
        log.debug("Unlocked {} for {}", amount, address);
    }

    /**
     * Adds {@code amount} to the balance.
     */
    @Transactional
    public void credit(String address, BigDecimal amount) {
        requirePositive(amount);
        ensureUser(address);
        jdbcTemplate.update(
            "UPDATE users SET balance = balance + ?, updated_at = CURRENT_TIMESTAMP WHERE address = ?",
            amount, address
        );
        log.debug("Credited {} to {}", amount, address);
    }

    /**
     * Removes {@code amount} from the unlocked part of the balance.
     *
     * @throws InsufficientFundsException if the debit would leave less than the locked balance
     */
    @Transactional
    public void debit(String address, BigDecimal amount) {
        requirePositive(amount);
        int updated = jdbcTemplate.update(
            "UPDATE users SET balance = balance - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE address = ? AND balance - ? >= locked_balance",
            amount, address, amount
        );
        if (updated == 0) {
            throw new InsufficientFundsException(
                String.format("Insufficient available balance for %s: debit of %s", address, amount.toPlainString()));
        }
        log.debug("Debited {} from {}", amount, address);
    }

    /**
     * Settles a locked stake in one adjustment: releases {@code stake} from the locked balance,
     * removes it from the balance and credits {@code payout}.
     *
     * A losing bet or a completed withdrawal uses a zero payout. A winning bet nets
     * {@code payout - stake} on the balance.
     */
    @Transactional
    public void settleLocked(String address, BigDecimal stake, BigDecimal payout) {
        requirePositive(stake);
        if (payout.signum() < 0) {
            throw new IllegalArgumentException("Payout cannot be negative: " + payout);
        }
        int updated = jdbcTemplate.update(
            "UPDATE users SET locked_balance = locked_balance - ?, balance = balance - ? + ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE address = ? AND locked_balance >= ?",
            stake, stake, payout, address, stake
        );
        if (updated == 0) {
            throw new IllegalStateException(
                String.format("Cannot settle stake %s for %s: locked balance is lower", stake.toPlainString(), address));
        }
        log.debug("Settled stake {} with payout {} for {}", stake, payout, address);
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
    }

    private RowMapper<BalanceSnapshot> balanceRowMapper() {
        return (rs, rowNum) -> new BalanceSnapshot(
            rs.getString("address"),
            rs.getBigDecimal("balance"),
            rs.getBigDecimal("locked_balance")
        );
    }
}
