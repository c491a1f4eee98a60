package com.marginledger.balance;

import com.marginledger.asset.AssetLedger;
import com.marginledger.event.BalanceEvent;
import com.marginledger.event.BalanceEventType;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.InsufficientFundsException;
import com.marginledger.ledger.LedgerTransaction;
import com.marginledger.ledger.LedgerTransactionManager;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Accrued commission per account and the pool ("pnl bank") that pays trader profits and
 * absorbs trader losses.
 *
 * <p>Commission credits and pool credits/debits are internal reallocations of value that
 * is already in custody; only {@link #fundPool} and {@link #withdrawCommission} move value
 * across the boundary, through the {@link AssetLedger}.
 */
@Component
public class BalanceBook {

    private static final Logger log = LoggerFactory.getLogger(BalanceBook.class);

    private final LedgerTransactionManager ledgerTransactionManager;
    private final AssetLedger assetLedger;

    private final Map<String, BigDecimal> accruedCommissions = new HashMap<>();
    private BigDecimal poolBalance = BigDecimal.ZERO;

    public BalanceBook(LedgerTransactionManager ledgerTransactionManager, AssetLedger assetLedger) {
        this.ledgerTransactionManager = ledgerTransactionManager;
        this.assetLedger = assetLedger;
    }

    // ---- Transactions ----

    /**
     * Deposits {@code amount} from {@code caller} and credits it to the pool.
     */
    public BigDecimal fundPool(String caller, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw BusinessException.invalidParameter("Pool funding amount must be positive");
        }
        BigDecimal balance = ledgerTransactionManager.execute("fundPool", transaction -> {
            assetLedger.deposit(transaction, caller, amount);
            adjustPool(transaction, amount);
            transaction.publish(new BalanceEvent(this, BalanceEventType.POOL_FUNDED, caller, amount, poolBalance));
            return poolBalance;
        });
        log.info("Pool funded by {} with {} (pool {})", caller, amount, balance);
        return balance;
    }

    /**
     * Releases the caller's whole accrued commission balance to the caller.
     *
     * @return the amount withdrawn
     */
    public BigDecimal withdrawCommission(String caller) {
        BigDecimal withdrawn = ledgerTransactionManager.execute("withdrawCommission", transaction -> {
            BigDecimal accrued = getAccruedCommission(caller);
            if (accrued.signum() <= 0) {
                throw new InsufficientFundsException(
                        "No accrued commission to withdraw for " + caller, accrued, BigDecimal.ZERO);
            }
            adjustCommission(transaction, caller, accrued.negate());
            transaction.publish(
                    new BalanceEvent(this, BalanceEventType.COMMISSION_WITHDRAWN, caller, accrued, BigDecimal.ZERO));
            assetLedger.release(caller, accrued);
            return accrued;
        });
        log.info("Commission of {} withdrawn by {}", withdrawn, caller);
        return withdrawn;
    }

    // ---- Internal reallocations ----

    public void creditCommission(LedgerTransaction transaction, String account, BigDecimal amount) {
        if (amount.signum() == 0) {
            return;
        }
        adjustCommission(transaction, account, amount);
        transaction.publish(new BalanceEvent(
                this, BalanceEventType.COMMISSION_ACCRUED, account, amount, getAccruedCommission(account)));
    }

    public void creditPool(LedgerTransaction transaction, BigDecimal amount) {
        if (amount.signum() == 0) {
            return;
        }
        adjustPool(transaction, amount);
        transaction.publish(new BalanceEvent(this, BalanceEventType.POOL_CREDITED, null, amount, poolBalance));
    }

    public void debitPool(LedgerTransaction transaction, BigDecimal amount) {
        if (amount.signum() == 0) {
            return;
        }
        requirePoolCovers(amount);
        adjustPool(transaction, amount.negate());
        transaction.publish(new BalanceEvent(this, BalanceEventType.POOL_DEBITED, null, amount, poolBalance));
    }

    public void requirePoolCovers(BigDecimal amount) {
        if (poolBalance.compareTo(amount) < 0) {
            throw new InsufficientFundsException("Pool balance cannot cover trader profit", poolBalance, amount);
        }
    }

    // ---- Queries ----

    public BigDecimal getAccruedCommission(String account) {
        return accruedCommissions.getOrDefault(account, BigDecimal.ZERO);
    }

    public BigDecimal getTotalAccruedCommission() {
        return accruedCommissions.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getPoolBalance() {
        return poolBalance;
    }

    private void adjustCommission(LedgerTransaction transaction, String account, BigDecimal delta) {
        BigDecimal previous = getAccruedCommission(account);
        setCommission(account, previous.add(delta));
        transaction.onRollback(() -> setCommission(account, previous));
    }

    private void setCommission(String account, BigDecimal value) {
        if (value.signum() == 0) {
            accruedCommissions.remove(account);
        } else {
            accruedCommissions.put(account, value);
        }
    }

    private void adjustPool(LedgerTransaction transaction, BigDecimal delta) {
        BigDecimal previous = poolBalance;
        poolBalance = poolBalance.add(delta);
        transaction.onRollback(() -> poolBalance = previous);
    }
}
