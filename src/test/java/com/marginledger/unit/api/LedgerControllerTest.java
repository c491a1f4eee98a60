package com.marginledger.unit.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.marginledger.api.controller.LedgerController;
import com.marginledger.balance.BalanceBook;
import com.marginledger.domain.model.LedgerSnapshot;
import com.marginledger.exception.GlobalExceptionHandler;
import com.marginledger.exception.InsufficientFundsException;
import com.marginledger.service.LedgerConservationAuditor;
import com.marginledger.service.LedgerQueryService;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for LedgerController: pool funding, commission withdrawal and the snapshot.
 */
class LedgerControllerTest {

    private MockMvc mockMvc;

    @Mock
    private BalanceBook balanceBook;

    @Mock
    private LedgerQueryService ledgerQueryService;

    @Mock
    private LedgerConservationAuditor ledgerConservationAuditor;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        LedgerController controller =
                new LedgerController(balanceBook, ledgerQueryService, ledgerConservationAuditor);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void getPool_returnsBalance() throws Exception {
        when(ledgerQueryService.getPoolBalance()).thenReturn(new BigDecimal("5000"));

        mockMvc.perform(get("/api/ledger/pool"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(5000));
    }

    @Test
    void fundPool_usesCallerAsSource() throws Exception {
        when(balanceBook.fundPool(eq("treasury"), any(BigDecimal.class))).thenReturn(new BigDecimal("5000"));

        mockMvc.perform(post("/api/ledger/pool/fund")
                        .header("X-Account", "treasury")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"amount":5000}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(5000));

        verify(balanceBook).fundPool(eq("treasury"), any(BigDecimal.class));
    }

    @Test
    void fundPool_zeroAmount_returns400() throws Exception {
        mockMvc.perform(post("/api/ledger/pool/fund")
                        .header("X-Account", "treasury")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"amount":0}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.details.amount").exists());
    }

    @Test
    void getAccruedCommission_returnsAccountBalance() throws Exception {
        when(ledgerQueryService.getAccruedCommission("fee-receiver")).thenReturn(new BigDecimal("20"));

        mockMvc.perform(get("/api/ledger/commissions/fee-receiver"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.account").value("fee-receiver"))
                .andExpect(jsonPath("$.balance").value(20));
    }

    @Test
    void withdrawCommission_returnsReleasedAmount() throws Exception {
        when(balanceBook.withdrawCommission("fee-receiver")).thenReturn(new BigDecimal("20"));

        mockMvc.perform(post("/api/ledger/commissions/withdraw").header("X-Account", "fee-receiver"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.account").value("fee-receiver"))
                .andExpect(jsonPath("$.balance").value(20));
    }

    @Test
    void withdrawCommission_nothingAccrued_returns422() throws Exception {
        when(balanceBook.withdrawCommission("bob"))
                .thenThrow(new InsufficientFundsException("No accrued commission", BigDecimal.ZERO, BigDecimal.ZERO));

        mockMvc.perform(post("/api/ledger/commissions/withdraw").header("X-Account", "bob"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("INSUFFICIENT_FUNDS"));
    }

    @Test
    void getSnapshot_runsConservationCheck() throws Exception {
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
                .custodiedValue(new BigDecimal("6010"))
                .orderMargin(BigDecimal.ZERO)
                .orderCommission(BigDecimal.ZERO)
                .positionMargin(new BigDecimal("1000"))
                .accruedCommission(new BigDecimal("10"))
                .poolBalance(new BigDecimal("5000"))
                .livePositions(1)
                .liveTriggers(1)
                .build();
        when(ledgerConservationAuditor.check()).thenReturn(snapshot);

        mockMvc.perform(get("/api/ledger/snapshot"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.custodiedValue").value(6010))
                .andExpect(jsonPath("$.accountedValue").value(6010))
                .andExpect(jsonPath("$.balanced").value(true))
                .andExpect(jsonPath("$.livePositions").value(1));

        verify(ledgerConservationAuditor).check();
    }
}
