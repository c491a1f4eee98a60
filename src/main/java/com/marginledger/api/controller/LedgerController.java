package com.marginledger.api.controller;

import com.marginledger.api.ApiHeaders;
import com.marginledger.api.dto.request.AmountRequest;
import com.marginledger.api.dto.response.BalanceResponse;
import com.marginledger.balance.BalanceBook;
import com.marginledger.domain.model.LedgerSnapshot;
import com.marginledger.service.LedgerConservationAuditor;
import com.marginledger.service.LedgerQueryService;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the pool, accrued commission and the conservation snapshot.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/ledger/pool -- pool balance</li>
 *   <li>POST /api/ledger/pool/fund -- deposit value from the caller into the pool</li>
 *   <li>GET /api/ledger/commissions/{account} -- accrued commission of an account</li>
 *   <li>POST /api/ledger/commissions/withdraw -- release the caller's accrued commission</li>
 *   <li>GET /api/ledger/snapshot -- custodied value and its decomposition</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/ledger")
public class LedgerController {

    private final BalanceBook balanceBook;
    private final LedgerQueryService ledgerQueryService;
    private final LedgerConservationAuditor ledgerConservationAuditor;

    public LedgerController(
            BalanceBook balanceBook,
            LedgerQueryService ledgerQueryService,
            LedgerConservationAuditor ledgerConservationAuditor) {
        this.balanceBook = balanceBook;
        this.ledgerQueryService = ledgerQueryService;
        this.ledgerConservationAuditor = ledgerConservationAuditor;
    }

    @GetMapping("/pool")
    public BalanceResponse getPool() {
        return BalanceResponse.builder()
                .balance(ledgerQueryService.getPoolBalance())
                .build();
    }

    @PostMapping("/pool/fund")
    public BalanceResponse fundPool(
            @RequestHeader(ApiHeaders.CALLER) String caller, @RequestBody @Valid AmountRequest request) {
        BigDecimal balance = balanceBook.fundPool(caller, request.getAmount());
        return BalanceResponse.builder().balance(balance).build();
    }

    @GetMapping("/commissions/{account}")
    public BalanceResponse getAccruedCommission(@PathVariable String account) {
        return BalanceResponse.builder()
                .account(account)
                .balance(ledgerQueryService.getAccruedCommission(account))
                .build();
    }

    /**
     * Returns the amount released to the caller.
     */
    @PostMapping("/commissions/withdraw")
    public BalanceResponse withdrawCommission(@RequestHeader(ApiHeaders.CALLER) String caller) {
        BigDecimal withdrawn = balanceBook.withdrawCommission(caller);
        return BalanceResponse.builder().account(caller).balance(withdrawn).build();
    }

    @GetMapping("/snapshot")
    public LedgerSnapshot getSnapshot() {
        return ledgerConservationAuditor.check();
    }
}
