package com.pennywise.service;

import com.pennywise.domain.Account;
import com.pennywise.domain.Income;
import com.pennywise.domain.User;
import com.pennywise.exception.LedgerValidationException;
import com.pennywise.exception.ResourceNotFoundException;
import com.pennywise.repository.IncomeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Optional;

import static com.pennywise.service.Fixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IncomeServiceTest {

    @Mock IncomeRepository incomeRepository;
    @Mock AccountService   accountService;

    IncomeService service;

    private Account checking;
    private Account savings;

    @BeforeEach
    void setUp() {
        service  = new IncomeService(incomeRepository, accountService, Clock.fixed(NOW, ZoneOffset.UTC));
        User user = user(1L);
        checking = account(1L, user, "Checking", "0.00");
        savings  = account(2L, user, "Savings", "0.00");
    }

    @Test @DisplayName("create → credits the account")
    void createCredits() {
        when(accountService.resolveRegularAccount(1L, 1L, "accountId")).thenReturn(checking);
        when(incomeRepository.save(any(Income.class))).thenAnswer(inv -> inv.getArgument(0));

        Income income = service.create(1L, 1L, new BigDecimal("200"), "bonus");

        assertThat(income.getAmount()).isEqualTo(new BigDecimal("200.00"));
        verify(accountService).applyEffect(BalanceEffect.single(1L, new BigDecimal("200.00")));
    }

    @Test @DisplayName("reassigning 200 from A to B → A -200, B +200")
    void reassign() {
        Income stored = income(7L, checking, "200.00");
        when(incomeRepository.findByIdAndUserIdForUpdate(7L, 1L)).thenReturn(Optional.of(stored));
        when(accountService.resolveRegularAccount(1L, 2L, "accountId")).thenReturn(savings);
        when(incomeRepository.save(stored)).thenReturn(stored);

        service.update(1L, 7L, 2L, null, null);

        BalanceEffect expected = BalanceEffect.single(1L, new BigDecimal("-200.00"))
                .plus(BalanceEffect.single(2L, new BigDecimal("200.00")));
        verify(accountService).applyEffect(expected);
    }

    @Test @DisplayName("lowering the amount → debit of the difference")
    void lowerAmount() {
        Income stored = income(7L, checking, "200.00");
        when(incomeRepository.findByIdAndUserIdForUpdate(7L, 1L)).thenReturn(Optional.of(stored));
        when(incomeRepository.save(stored)).thenReturn(stored);

        service.update(1L, 7L, null, new BigDecimal("120.00"), null);

        verify(accountService).applyEffect(BalanceEffect.single(1L, new BigDecimal("-80.00")));
    }

    @Test @DisplayName("delete → withdraws the amount, then removes the row")
    void deleteWithdraws() {
        Income stored = income(7L, checking, "200.00");
        when(incomeRepository.findByIdAndUserIdForUpdate(7L, 1L)).thenReturn(Optional.of(stored));

        service.delete(1L, 7L);

        verify(accountService).applyEffect(BalanceEffect.single(1L, new BigDecimal("-200.00")));
        verify(incomeRepository).delete(stored);
    }

    @Test @DisplayName("system account target → validation from account resolution")
    void systemAccountRejected() {
        when(accountService.resolveRegularAccount(1L, 9L, "accountId"))
                .thenThrow(new LedgerValidationException("accountId", "System account cannot be used here: 9"));

        assertThatThrownBy(() -> service.create(1L, 9L, BigDecimal.TEN, null))
                .isInstanceOf(LedgerValidationException.class);
        verify(incomeRepository, never()).save(any());
    }

    @Test @DisplayName("unknown income → not found")
    void notFound() {
        when(incomeRepository.findByIdAndUserId(8L, 1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getIncome(1L, 8L))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
