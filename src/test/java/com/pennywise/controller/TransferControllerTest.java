package com.pennywise.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pennywise.domain.Account;
import com.pennywise.domain.Transfer;
import com.pennywise.domain.User;
import com.pennywise.dto.SalaryRequest;
import com.pennywise.dto.TransferRequest;
import com.pennywise.exception.ConcurrencyTimeoutException;
import com.pennywise.exception.InsufficientFundsException;
import com.pennywise.exception.LedgerValidationException;
import com.pennywise.exception.ResourceNotFoundException;
import com.pennywise.service.ReportService;
import com.pennywise.service.SalaryService;
import com.pennywise.service.TransferService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Controller slice tests, HTTP contract verification.
 * No database. No full Spring context.
 */
@WebMvcTest(TransferController.class)
class TransferControllerTest {

    @Autowired MockMvc      mockMvc;
    @Autowired ObjectMapper objectMapper;

    @MockBean TransferService transferService;
    @MockBean SalaryService   salaryService;
    @MockBean ReportService   reportService;

    private User    stubUser;
    private Account checking;
    private Account savings;
    private Account external;

    @BeforeEach
    void setUp() throws Exception {
        Instant now = Instant.parse("2024-03-15T10:00:00Z");
        stubUser = new User("alice", null, "hash", now);
        setId(stubUser, 1L);
        checking = Account.regular(stubUser, "Checking", now);
        setId(checking, 1L);
        savings = Account.regular(stubUser, "Savings", now);
        setId(savings, 2L);
        external = Account.system(stubUser, "External (System)", now);
        setId(external, 9L);
    }

    private void setId(Object entity, Long id) throws Exception {
        var f = entity.getClass().getDeclaredField("id");
        f.setAccessible(true);
        f.set(entity, id);
    }

    private RequestPostProcessor asAlice() {
        return authentication(new UsernamePasswordAuthenticationToken(
                stubUser, null, List.of(new SimpleGrantedAuthority("ROLE_USER"))));
    }

    private Transfer stubTransfer(Account from, Account to, String amount) throws Exception {
        var transfer = new Transfer(stubUser, from, to, new BigDecimal(amount), Instant.parse("2024-03-15T10:00:00Z"));
        setId(transfer, 50L);
        return transfer;
    }

    // ── create → 201 ─────────────────────────────────────────────────────────

    @Test @DisplayName("POST /transfers → 201 with both sides")
    void createTransfer() throws Exception {
        when(transferService.create(1L, 1L, 2L, new BigDecimal("300.00")))
            .thenReturn(stubTransfer(checking, savings, "300.00"));

        mockMvc.perform(post("/transfers").with(asAlice()).with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new TransferRequest(1L, 2L, new BigDecimal("300.00")))))
               .andExpect(status().isCreated())
               .andExpect(jsonPath("$.id").value(50))
               .andExpect(jsonPath("$.fromAccount").value("Checking"))
               .andExpect(jsonPath("$.toAccountId").value(2))
               .andExpect(jsonPath("$.amount").value(300.00))
               .andExpect(jsonPath("$.systemOrigin").value(false));
    }

    // ── bad input → 400 ──────────────────────────────────────────────────────

    @Test @DisplayName("POST /transfers without amount → 400 field map")
    void createMissingAmount() throws Exception {
        mockMvc.perform(post("/transfers").with(asAlice()).with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new TransferRequest(1L, 2L, null))))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.amount").value("Amount is required"));
        verifyNoInteractions(transferService);
    }

    @Test @DisplayName("POST /transfers with three decimals → 400")
    void createFractionalCents() throws Exception {
        mockMvc.perform(post("/transfers").with(asAlice()).with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fromAccountId\":1,\"toAccountId\":2,\"amount\":10.001}"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.amount").exists());
    }

    @Test @DisplayName("POST /transfers same account → 400 VALIDATION_ERROR")
    void createSameAccount() throws Exception {
        when(transferService.create(anyLong(), anyLong(), anyLong(), any()))
            .thenThrow(new LedgerValidationException("toAccountId", "From and to accounts must differ"));

        mockMvc.perform(post("/transfers").with(asAlice()).with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new TransferRequest(1L, 1L, BigDecimal.TEN))))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    // ── domain rejections → 409 / 503 ──────────────────────────────────────

    @Test @DisplayName("POST /transfers insufficient funds → 409 INSUFFICIENT_FUNDS")
    void createInsufficientFunds() throws Exception {
        when(transferService.create(anyLong(), anyLong(), anyLong(), any()))
            .thenThrow(new InsufficientFundsException(1L, new BigDecimal("10.00"), new BigDecimal("300.00")));

        mockMvc.perform(post("/transfers").with(asAlice()).with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new TransferRequest(1L, 2L, new BigDecimal("300.00")))))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.error").value("INSUFFICIENT_FUNDS"));
    }

    @Test @DisplayName("PATCH /transfers/{id} lock timeout → 503 CONCURRENCY_TIMEOUT")
    void updateLockTimeout() throws Exception {
        when(transferService.update(anyLong(), anyLong(), any(), any(), any()))
            .thenThrow(new ConcurrencyTimeoutException("Could not lock accounts [1, 2], retry the request", null));

        mockMvc.perform(patch("/transfers/50").with(asAlice()).with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":20.00}"))
               .andExpect(status().isServiceUnavailable())
               .andExpect(jsonPath("$.error").value("CONCURRENCY_TIMEOUT"));
    }

    // ── update / delete ──────────────────────────────────────────────────────

    @Test @DisplayName("PUT /transfers/{id} with only amount → nulls passed for the sides")
    void partialUpdate() throws Exception {
        when(transferService.update(1L, 50L, null, null, new BigDecimal("20.00")))
            .thenReturn(stubTransfer(checking, savings, "20.00"));

        mockMvc.perform(put("/transfers/50").with(asAlice()).with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":20.00}"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.amount").value(20.00));
    }

    @Test @DisplayName("DELETE /transfers/{id} → 204")
    void deleteTransfer() throws Exception {
        mockMvc.perform(delete("/transfers/50").with(asAlice()).with(csrf()))
               .andExpect(status().isNoContent());
        verify(transferService).delete(1L, 50L);
    }

    @Test @DisplayName("GET /transfers/{id} of another user → 404")
    void getNotFound() throws Exception {
        when(transferService.getTransfer(1L, 99L)).thenThrow(new ResourceNotFoundException("Transfer", 99L));

        mockMvc.perform(get("/transfers/99").with(asAlice()))
               .andExpect(status().isNotFound())
               .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    // ── salary / totals ──────────────────────────────────────────────────────

    @Test @DisplayName("POST /transfers/salary → 201 with systemOrigin")
    void salary() throws Exception {
        when(salaryService.depositSalary(1L, 1L, new BigDecimal("3000.00")))
            .thenReturn(stubTransfer(external, checking, "3000.00"));

        mockMvc.perform(post("/transfers/salary").with(asAlice()).with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new SalaryRequest(1L, new BigDecimal("3000.00")))))
               .andExpect(status().isCreated())
               .andExpect(jsonPath("$.systemOrigin").value(true))
               .andExpect(jsonPath("$.toAccount").value("Checking"));
    }

    @Test @DisplayName("GET /transfers/total → 200 with total")
    void total() throws Exception {
        when(reportService.transferTotal(1L, "2024-01", null, 1L, null)).thenReturn(new BigDecimal("200.00"));

        mockMvc.perform(get("/transfers/total").with(asAlice())
                .param("start", "2024-01")
                .param("fromAccountId", "1"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.total").value(200.00));
    }

    @Test @DisplayName("GET /transfers with a non-numeric id → 400")
    void badPathVariable() throws Exception {
        mockMvc.perform(get("/transfers/abc").with(asAlice()))
               .andExpect(status().isBadRequest());
    }

    // ── unauthenticated → 401 ────────────────────────────────────────────────

    @Test @DisplayName("GET /transfers without authentication → 401")
    void unauthenticated() throws Exception {
        mockMvc.perform(get("/transfers"))
               .andExpect(status().isUnauthorized());
    }
}
