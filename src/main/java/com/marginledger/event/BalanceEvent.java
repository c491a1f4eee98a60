package com.marginledger.event;

import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every committed change of an accrued-commission balance or of the pool.
 * {@code account} is null for pool events.
 */
public class BalanceEvent extends ApplicationEvent {

    private final BalanceEventType eventType;
    private final String account;
    private final BigDecimal amount;
    private final BigDecimal balanceAfter;

    public BalanceEvent(
            Object source, BalanceEventType eventType, String account, BigDecimal amount, BigDecimal balanceAfter) {
        super(source);
        this.eventType = eventType;
        this.account = account;
        this.amount = amount;
        this.balanceAfter = balanceAfter;
    }

    public BalanceEventType getEventType() {
        return eventType;
    }

    public String getAccount() {
        return account;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public BigDecimal getBalanceAfter() {
        return balanceAfter;
    }
}
