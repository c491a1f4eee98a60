package com.marginledger.asset;

import java.math.BigDecimal;

/**
 * External fungible-asset transfer primitive. Only {@link AssetLedger} may call it.
 *
 * <p>Implementations report denial (insufficient balance or allowance) by returning
 * {@code false}. The ledger treats a {@code false} result, or any exception, as a hard
 * failure that aborts the enclosing transaction; it never retries.
 */
public interface ValueTransferGateway {

    /**
     * Moves {@code amount} from {@code from} into {@code to} (the custody wallet).
     *
     * @return true if the transfer happened, false if it was denied
     */
    boolean pull(String from, String to, BigDecimal amount);

    /**
     * Moves {@code amount} out of {@code from} (the custody wallet) to {@code to}.
     *
     * @return true if the transfer happened, false if it was denied
     */
    boolean push(String from, String to, BigDecimal amount);
}
