package com.marginledger.asset;

import com.marginledger.config.LedgerProperties;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.TransferFailedException;
import com.marginledger.ledger.LedgerTransaction;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Custody primitive: the single place where value crosses the ledger boundary.
 *
 * <p>Keeps a running {@code custodiedValue} (deposits minus releases). That figure is the
 * left-hand side of the conservation check; every other book only reallocates value
 * that is already in custody.
 *
 * <p>Callers order their steps so that {@link #deposit} is the last fallible step of an
 * inbound transaction and {@link #release} the last step of an outbound one. A deposit
 * still registers a refund compensation, which runs only if a later step of the same
 * transaction fails.
 */
@Component
public class AssetLedger {

    private static final Logger log = LoggerFactory.getLogger(AssetLedger.class);

    private final ValueTransferGateway valueTransferGateway;
    private final String custodyAccount;

    private BigDecimal custodiedValue = BigDecimal.ZERO;

    public AssetLedger(ValueTransferGateway valueTransferGateway, LedgerProperties ledgerProperties) {
        this.valueTransferGateway = valueTransferGateway;
        this.custodyAccount = ledgerProperties.getCustodyAccount();
    }

    /**
     * Pulls {@code amount} from {@code from} into custody.
     *
     * @throws BusinessException if {@code from} is the custody account itself
     * @throws TransferFailedException if the gateway denies or fails the transfer
     */
    public void deposit(LedgerTransaction transaction, String from, BigDecimal amount) {
        requirePositive(amount);
        requireExternal(from);
        boolean transferred = invoke(() -> valueTransferGateway.pull(from, custodyAccount, amount), from, amount);
        if (!transferred) {
            throw new TransferFailedException("Deposit denied for account " + from, from, amount);
        }
        custodiedValue = custodiedValue.add(amount);
        transaction.onRollback(() -> refund(from, amount));
        log.debug("Deposited {} from {} (custody {})", amount, from, custodiedValue);
    }

    /**
     * Pushes {@code amount} out of custody to {@code to}.
     *
     * @throws BusinessException if {@code to} is the custody account itself
     * @throws TransferFailedException if the gateway denies or fails the transfer
     */
    public void release(String to, BigDecimal amount) {
        requirePositive(amount);
        requireExternal(to);
        boolean transferred = invoke(() -> valueTransferGateway.push(custodyAccount, to, amount), to, amount);
        if (!transferred) {
            throw new TransferFailedException("Release denied for account " + to, to, amount);
        }
        custodiedValue = custodiedValue.subtract(amount);
        log.debug("Released {} to {} (custody {})", amount, to, custodiedValue);
    }

    public BigDecimal getCustodiedValue() {
        return custodiedValue;
    }

    private void refund(String account, BigDecimal amount) {
        if (!valueTransferGateway.push(custodyAccount, account, amount)) {
            throw new TransferFailedException("Refund of rolled-back deposit denied for " + account, account, amount);
        }
        custodiedValue = custodiedValue.subtract(amount);
        log.warn("Refunded rolled-back deposit of {} to {}", amount, account);
    }

    private boolean invoke(TransferCall call, String account, BigDecimal amount) {
        try {
            return call.transfer();
        } catch (RuntimeException e) {
            throw new TransferFailedException("Transfer error for account " + account, account, amount, e);
        }
    }

    /** A transfer between custody and itself moves nothing and must not change the books. */
    private void requireExternal(String account) {
        if (account == null || account.equals(custodyAccount)) {
            throw BusinessException.invalidParameter("Custody account cannot be a transfer counterparty");
        }
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw BusinessException.invalidParameter("Transfer amount must be positive");
        }
    }

    @FunctionalInterface
    private interface TransferCall {
        boolean transfer();
    }
}
