package com.marginledger.service;

import com.marginledger.domain.model.LedgerSnapshot;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically verifies that custodied value equals
 * order margin + order commission + position margin + accrued commission + pool.
 *
 * <p>The check is read-only: a violation is logged at error level and counted, never repaired.
 */
@Service
public class LedgerConservationAuditor {

    private static final Logger log = LoggerFactory.getLogger(LedgerConservationAuditor.class);

    private final LedgerQueryService ledgerQueryService;

    private volatile LedgerSnapshot lastSnapshot;
    private final AtomicLong violationCount = new AtomicLong();

    public LedgerConservationAuditor(LedgerQueryService ledgerQueryService) {
        this.ledgerQueryService = ledgerQueryService;
    }

    @Scheduled(
            fixedDelayString = "${ledger.audit.conservation-check-interval-ms:60000}",
            initialDelayString = "${ledger.audit.conservation-check-interval-ms:60000}")
    public void scheduledCheck() {
        check();
    }

    /**
     * Takes a snapshot and reports whether the ledger is balanced.
     */
    public LedgerSnapshot check() {
        LedgerSnapshot snapshot = ledgerQueryService.snapshot();
        lastSnapshot = snapshot;
        if (!snapshot.isBalanced()) {
            violationCount.incrementAndGet();
            log.error(
                    "Conservation violated: custodied={} accounted={} (orderMargin={} orderCommission={} "
                            + "positionMargin={} accruedCommission={} pool={})",
                    snapshot.getCustodiedValue(),
                    snapshot.getAccountedValue(),
                    snapshot.getOrderMargin(),
                    snapshot.getOrderCommission(),
                    snapshot.getPositionMargin(),
                    snapshot.getAccruedCommission(),
                    snapshot.getPoolBalance());
        } else {
            log.debug(
                    "Conservation check passed: custodied={} orders={} positions={} triggers={}",
                    snapshot.getCustodiedValue(),
                    snapshot.getLiveOrders(),
                    snapshot.getLivePositions(),
                    snapshot.getLiveTriggers());
        }
        return snapshot;
    }

    /** Null until the first check has run. */
    public LedgerSnapshot getLastSnapshot() {
        return lastSnapshot;
    }

    public long getViolationCount() {
        return violationCount.get();
    }
}
