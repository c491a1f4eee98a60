package com.marginledger.api.controller;

import com.marginledger.api.dto.request.AmountRequest;
import com.marginledger.api.dto.response.BalanceResponse;
import com.marginledger.asset.SimulatedValueTransferGateway;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Simulated wallet endpoints for paper trading. Crediting mints value outside the ledger;
 * it never touches custody.
 */
@RestController
@RequestMapping("/api/wallets")
public class WalletController {

    private static final Logger log = LoggerFactory.getLogger(WalletController.class);

    private final SimulatedValueTransferGateway simulatedValueTransferGateway;

    public WalletController(SimulatedValueTransferGateway simulatedValueTransferGateway) {
        this.simulatedValueTransferGateway = simulatedValueTransferGateway;
    }

    @GetMapping("/{account}")
    public BalanceResponse getWallet(@PathVariable String account) {
        return BalanceResponse.builder()
                .account(account)
                .balance(simulatedValueTransferGateway.balanceOf(account))
                .build();
    }

    @PostMapping("/{account}/credit")
    public BalanceResponse credit(@PathVariable String account, @RequestBody @Valid AmountRequest request) {
        log.info("Simulated wallet {} credited with {}", account, request.getAmount());
        return BalanceResponse.builder()
                .account(account)
                .balance(simulatedValueTransferGateway.credit(account, request.getAmount()))
                .build();
    }
}
