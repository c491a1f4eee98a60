package com.marginledger.asset;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * In-memory wallet book standing in for the on-chain / custodial transfer primitive.
 *
 * <p>Wallets start empty and are funded with {@link #credit} (paper-trading faucet).
 * A pull or push is denied when the paying wallet holds less than the amount.
 * Every wallet mutation (transfer, credit, reset) synchronizes on this gateway, so a
 * credit can never land between a transfer's balance check and its debit.
 */
@Service
public class SimulatedValueTransferGateway implements ValueTransferGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatedValueTransferGateway.class);

    private final Map<String, BigDecimal> wallets = new ConcurrentHashMap<>();

    @Override
    public boolean pull(String from, String to, BigDecimal amount) {
        return move(from, to, amount);
    }

    @Override
    public boolean push(String from, String to, BigDecimal amount) {
        return move(from, to, amount);
    }

    /**
     * Mints value into a wallet. Only for simulation; a real gateway has no equivalent.
     */
    public synchronized BigDecimal credit(String account, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Credit amount must be positive");
        }
        BigDecimal balance = wallets.merge(account, amount, BigDecimal::add);
        log.debug("Simulated wallet {} credited {} (balance {})", account, amount, balance);
        return balance;
    }

    public BigDecimal balanceOf(String account) {
        return wallets.getOrDefault(account, BigDecimal.ZERO);
    }

    public synchronized void reset() {
        wallets.clear();
    }

    private synchronized boolean move(String from, String to, BigDecimal amount) {
        BigDecimal available = balanceOf(from);
        if (available.compareTo(amount) < 0) {
            log.debug("Simulated transfer denied: {} -> {} amount={} available={}", from, to, amount, available);
            return false;
        }
        wallets.put(from, available.subtract(amount));
        wallets.merge(to, amount, BigDecimal::add);
        return true;
    }
}
