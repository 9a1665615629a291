package com.pennywise.service;

import com.pennywise.domain.Account;
import com.pennywise.domain.User;
import com.pennywise.exception.ConcurrencyTimeoutException;
import com.pennywise.exception.LedgerValidationException;
import com.pennywise.exception.ResourceNotFoundException;
import com.pennywise.repository.AccountRepository;
import com.pennywise.repository.ExpenseRepository;
import com.pennywise.repository.IncomeRepository;
import com.pennywise.repository.TransferRepository;
import com.pennywise.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.PessimisticLockingFailureException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.pennywise.service.Fixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    @Mock AccountRepository  accountRepository;
    @Mock UserRepository     userRepository;
    @Mock ExpenseRepository  expenseRepository;
    @Mock IncomeRepository   incomeRepository;
    @Mock TransferRepository transferRepository;

    AccountService service;

    private User    user;
    private Account checking;
    private Account savings;

    @BeforeEach
    void setUp() {
        service  = new AccountService(accountRepository, userRepository, expenseRepository,
                incomeRepository, transferRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        user     = user(1L);
        checking = account(1L, user, "Checking", "100.00");
        savings  = account(2L, user, "Savings", "50.00");
    }

    @Nested @DisplayName("management")
    class ManagementTests {

        @Test @DisplayName("new account starts at zero")
        void createZeroBalance() {
            when(accountRepository.existsByUserIdAndNameAndSystemFalse(1L, "Wallet")).thenReturn(false);
            when(userRepository.findById(1L)).thenReturn(Optional.of(user));
            when(accountRepository.save(any(Account.class))).thenAnswer(inv -> inv.getArgument(0));

            Account account = service.createAccount(1L, " Wallet ");

            assertThat(account.getName()).isEqualTo("Wallet");
            assertThat(account.getBalance()).isEqualByComparingTo("0.00");
            assertThat(account.isSystem()).isFalse();
        }

        @Test @DisplayName("duplicate name → validation")
        void duplicateName() {
            when(accountRepository.existsByUserIdAndNameAndSystemFalse(1L, "Checking")).thenReturn(true);

            assertThatThrownBy(() -> service.createAccount(1L, "Checking"))
                    .isInstanceOf(LedgerValidationException.class);
        }

        @Test @DisplayName("account with entries cannot be deleted")
        void deleteReferenced() {
            when(accountRepository.findByIdAndUserIdAndSystemFalse(1L, 1L)).thenReturn(Optional.of(checking));
            when(expenseRepository.existsByAccountId(1L)).thenReturn(false);
            when(incomeRepository.existsByAccountId(1L)).thenReturn(false);
            when(transferRepository.existsByFromAccountIdOrToAccountId(1L, 1L)).thenReturn(true);

            assertThatThrownBy(() -> service.deleteAccount(1L, 1L))
                    .isInstanceOf(LedgerValidationException.class);
            verify(accountRepository, never()).delete(any());
        }

        @Test @DisplayName("system or foreign account is not found through getAccount")
        void hiddenAccounts() {
            when(accountRepository.findByIdAndUserIdAndSystemFalse(9L, 1L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.getAccount(1L, 9L))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test @DisplayName("referenced account of another user → validation")
        void foreignReference() {
            Account foreign = account(5L, user(2L), "Other", "0.00");
            when(accountRepository.findById(5L)).thenReturn(Optional.of(foreign));

            assertThatThrownBy(() -> service.resolveOwnedAccount(1L, 5L, "accountId"))
                    .isInstanceOf(LedgerValidationException.class)
                    .hasFieldOrPropertyWithValue("field", "accountId");
        }

        @Test @DisplayName("system account cannot carry expenses or incomes")
        void regularOnly() {
            Account external = systemAccount(9L, user);
            when(accountRepository.findById(9L)).thenReturn(Optional.of(external));

            assertThatThrownBy(() -> service.resolveRegularAccount(1L, 9L, "accountId"))
                    .isInstanceOf(LedgerValidationException.class);
        }
    }

    @Nested @DisplayName("balance primitives")
    class PrimitiveTests {

        @Test @DisplayName("applyEffect → one relative update per account, ascending id")
        void applyEffectInOrder() {
            when(accountRepository.adjustBalance(any(), any())).thenReturn(1);

            service.applyEffect(BalanceEffect.transfer(2L, 1L, new BigDecimal("25.00")));

            InOrder inOrder = inOrder(accountRepository);
            inOrder.verify(accountRepository).adjustBalance(1L, new BigDecimal("25.00"));
            inOrder.verify(accountRepository).adjustBalance(2L, new BigDecimal("-25.00"));
        }

        @Test @DisplayName("zero delta → no statement")
        void zeroDeltaSkipped() {
            service.adjustBalance(1L, new BigDecimal("0.00"));
            verifyNoInteractions(accountRepository);
        }

        @Test @DisplayName("update touching no row → not found")
        void missingRow() {
            when(accountRepository.adjustBalance(7L, BigDecimal.ONE)).thenReturn(0);

            assertThatThrownBy(() -> service.adjustBalance(7L, BigDecimal.ONE))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test @DisplayName("lockAccounts deduplicates and sorts ids before locking")
        void lockSorted() {
            when(accountRepository.findAllByIdForUpdate(Set.of(1L, 2L))).thenReturn(List.of(checking, savings));

            Map<Long, Account> locked = service.lockAccounts(List.of(2L, 1L, 2L));

            assertThat(locked.keySet()).containsExactly(1L, 2L);
            verify(accountRepository).findAllByIdForUpdate(argThat(ids -> List.copyOf(ids).equals(List.of(1L, 2L))));
        }

        @Test @DisplayName("lock timeout → ConcurrencyTimeoutException")
        void lockTimeout() {
            when(accountRepository.findAllByIdForUpdate(any()))
                    .thenThrow(new PessimisticLockingFailureException("timeout"));

            assertThatThrownBy(() -> service.lockAccounts(List.of(1L, 2L)))
                    .isInstanceOf(ConcurrencyTimeoutException.class)
                    .hasCauseInstanceOf(PessimisticLockingFailureException.class);
        }

        @Test @DisplayName("locking a missing account → not found")
        void lockMissing() {
            when(accountRepository.findAllByIdForUpdate(any())).thenReturn(List.of(checking));

            assertThatThrownBy(() -> service.lockAccounts(List.of(1L, 3L)))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested @DisplayName("reconcile()")
    class ReconcileTests {

        @Test @DisplayName("cached balance equal to ledger sum → consistent")
        void consistent() {
            when(accountRepository.findByIdAndUserIdAndSystemFalse(1L, 1L)).thenReturn(Optional.of(checking));
            when(accountRepository.findBalanceById(1L)).thenReturn(Optional.of(new BigDecimal("100.00")));
            when(incomeRepository.sumAmountByAccountId(1L)).thenReturn(new BigDecimal("300.00"));
            when(transferRepository.sumAmountByToAccountId(1L)).thenReturn(null);
            when(expenseRepository.sumAmountByAccountId(1L)).thenReturn(new BigDecimal("150.00"));
            when(transferRepository.sumAmountByFromAccountId(1L)).thenReturn(new BigDecimal("50.00"));

            AccountService.Reconciliation result = service.reconcile(1L, 1L);

            assertThat(result.ledgerBalance()).isEqualTo(new BigDecimal("100.00"));
            assertThat(result.consistent()).isTrue();
        }

        @Test @DisplayName("drift is reported, not repaired")
        void drift() {
            when(accountRepository.findByIdAndUserIdAndSystemFalse(2L, 1L)).thenReturn(Optional.of(savings));
            when(accountRepository.findBalanceById(2L)).thenReturn(Optional.of(new BigDecimal("50.00")));

            AccountService.Reconciliation result = service.reconcile(1L, 2L);

            assertThat(result.ledgerBalance()).isEqualTo(new BigDecimal("0.00"));
            assertThat(result.consistent()).isFalse();
            verify(accountRepository, never()).adjustBalance(any(), any());
        }
    }
}
