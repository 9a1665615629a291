package com.pennywise.service;

import com.pennywise.domain.Account;
import com.pennywise.domain.Category;
import com.pennywise.domain.Expense;
import com.pennywise.domain.Income;
import com.pennywise.domain.Transfer;
import com.pennywise.domain.User;
import com.pennywise.dto.ReportResponses.AccountCashflow;
import com.pennywise.dto.ReportResponses.CategoryTotal;
import com.pennywise.dto.ReportResponses.MonthlyCashflow;
import com.pennywise.dto.ReportResponses.Summary;
import com.pennywise.exception.LedgerValidationException;
import com.pennywise.repository.AccountRepository;
import com.pennywise.repository.ExpenseRepository;
import com.pennywise.repository.IncomeRepository;
import com.pennywise.repository.TransferRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static com.pennywise.service.Fixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReportServiceTest {

    private static final Instant JAN = Instant.parse("2024-01-10T12:00:00Z");
    private static final Instant FEB = Instant.parse("2024-02-20T12:00:00Z");

    @Mock ExpenseRepository  expenseRepository;
    @Mock IncomeRepository   incomeRepository;
    @Mock TransferRepository transferRepository;
    @Mock AccountRepository  accountRepository;

    ReportService service;

    private Account  checking;
    private Account  savings;
    private Account  external;
    private Category food;
    private Category rent;

    @BeforeEach
    void setUp() {
        service  = new ReportService(expenseRepository, incomeRepository, transferRepository, accountRepository,
                Clock.fixed(NOW, ZoneOffset.UTC), "UTC");
        User user = user(1L);
        checking = account(1L, user, "Checking", "2470.00");
        savings  = account(2L, user, "Savings", "300.00");
        external = systemAccount(9L, user);
        food     = category(10L, user, "Food");
        rent     = category(11L, user, "Rent");
    }

    private Expense expenseAt(Long id, Account account, Category category, String amount, Instant at) {
        Expense expense = expense(id, account, category, amount);
        setField(expense, "createdAt", at);
        return expense;
    }

    private Income incomeAt(Long id, Account account, String amount, Instant at) {
        Income income = income(id, account, amount);
        setField(income, "createdAt", at);
        return income;
    }

    private void ledger() {
        lenient().when(expenseRepository.findByUserIdAndCreatedAtBetween(eq(1L), any(), any())).thenReturn(List.of(
                expenseAt(1L, checking, rent, "500.00", JAN),
                expenseAt(2L, checking, food, "30.00", JAN),
                expenseAt(3L, savings, food, "20.00", FEB)));
        lenient().when(incomeRepository.findByUserIdAndCreatedAtBetween(eq(1L), any(), any())).thenReturn(List.of(
                incomeAt(1L, savings, "100.00", JAN)));
        lenient().when(transferRepository.findByUserIdAndCreatedAtBetween(eq(1L), any(), any())).thenReturn(List.of(
                transferAt(1L, external, checking, "3000.00", JAN),
                transferAt(2L, checking, savings, "200.00", FEB)));
    }

    @Nested @DisplayName("monthlyCashflow()")
    class CashflowTests {

        @Test @DisplayName("salary counts as income, internal transfers do not, months ascend")
        void totalsPerMonth() {
            ledger();

            List<MonthlyCashflow> months = service.monthlyCashflow(1L, null, null, null, null);

            assertThat(months).extracting(MonthlyCashflow::month)
                    .containsExactly(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1));
            MonthlyCashflow jan = months.get(0);
            assertThat(jan.income()).isEqualByComparingTo("3100.00");
            assertThat(jan.expense()).isEqualByComparingTo("530.00");
            assertThat(jan.net()).isEqualByComparingTo("2570.00");
            assertThat(jan.byAccount()).isNull();
            assertThat(jan.byCategory()).isNull();
            MonthlyCashflow feb = months.get(1);
            assertThat(feb.income()).isEqualByComparingTo("0.00");
            assertThat(feb.net()).isEqualByComparingTo("-20.00");
        }

        @Test @DisplayName("by=account → per-account rows sorted by name, salary on its to-account")
        void byAccount() {
            ledger();

            MonthlyCashflow jan = service.monthlyCashflow(1L, "2024-01", "2024-01", null, "account").get(0);

            assertThat(jan.byAccount()).extracting(AccountCashflow::account).containsExactly("Checking", "Savings");
            AccountCashflow checkingRow = jan.byAccount().get(0);
            assertThat(checkingRow.income()).isEqualByComparingTo("3000.00");
            assertThat(checkingRow.expense()).isEqualByComparingTo("530.00");
            assertThat(checkingRow.byCategory()).isNull();
        }

        @Test @DisplayName("by=account_category → category totals nested in each account")
        void byAccountCategory() {
            ledger();

            MonthlyCashflow jan = service.monthlyCashflow(1L, null, null, null, "ACCOUNT_CATEGORY").get(0);

            assertThat(jan.byAccount().get(0).byCategory())
                    .extracting(CategoryTotal::category).containsExactly("Food", "Rent");
        }

        @Test @DisplayName("by=category → expense totals per category, no account rows")
        void byCategory() {
            ledger();

            MonthlyCashflow jan = service.monthlyCashflow(1L, null, null, null, "category").get(0);

            assertThat(jan.byAccount()).isNull();
            assertThat(jan.byCategory()).extracting(CategoryTotal::total)
                    .usingElementComparator(BigDecimal::compareTo)
                    .containsExactly(new BigDecimal("30.00"), new BigDecimal("500.00"));
        }

        @Test @DisplayName("account filter → only that account's flows")
        void accountFilter() {
            ledger();

            List<MonthlyCashflow> months = service.monthlyCashflow(1L, null, null, 2L, null);

            assertThat(months).hasSize(2);
            assertThat(months.get(0).income()).isEqualByComparingTo("100.00");
            assertThat(months.get(0).expense()).isEqualByComparingTo("0.00");
            assertThat(months.get(1).expense()).isEqualByComparingTo("20.00");
        }

        @Test @DisplayName("unknown breakdown → validation, no query")
        void unknownBreakdown() {
            assertThatThrownBy(() -> service.monthlyCashflow(1L, null, null, null, "week"))
                    .isInstanceOf(LedgerValidationException.class)
                    .hasFieldOrPropertyWithValue("field", "by");
            verifyNoInteractions(expenseRepository, incomeRepository, transferRepository);
        }
    }

    @Test @DisplayName("totalsByCategory → sorted by category name")
    void totalsByCategory() {
        ledger();

        List<CategoryTotal> totals = service.totalsByCategory(1L, null, null, null);

        assertThat(totals).extracting(CategoryTotal::category).containsExactly("Food", "Rent");
        assertThat(totals.get(0).total()).isEqualByComparingTo("50.00");
        assertThat(totals.get(1).total()).isEqualByComparingTo("500.00");
    }

    @Test @DisplayName("transferTotal → filtered by from and to account")
    void transferTotal() {
        ledger();

        assertThat(service.transferTotal(1L, null, null, null, null)).isEqualByComparingTo("3200.00");
        assertThat(service.transferTotal(1L, null, null, 1L, null)).isEqualByComparingTo("200.00");
        assertThat(service.transferTotal(1L, null, null, null, 1L)).isEqualByComparingTo("3000.00");
    }

    @Test @DisplayName("incomeTotal → plain incomes only, optional account filter")
    void incomeTotal() {
        ledger();

        assertThat(service.incomeTotal(1L, null, null, null)).isEqualByComparingTo("100.00");
        assertThat(service.incomeTotal(1L, null, null, savings.getId())).isEqualByComparingTo("100.00");
        assertThat(service.incomeTotal(1L, null, null, checking.getId())).isEqualByComparingTo("0.00");
    }

    @Test @DisplayName("start after end → validation before any query")
    void invalidPeriod() {
        assertThatThrownBy(() -> service.incomeTotal(1L, "2024-03-01", "2024-02-01", null))
                .isInstanceOf(LedgerValidationException.class);
        verifyNoInteractions(incomeRepository);
    }

    @Test @DisplayName("summary without bounds → current month, balances of regular accounts")
    void summaryDefaultsToCurrentMonth() {
        when(incomeRepository.findByUserIdAndCreatedAtBetween(
                1L, Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-31T23:59:59.999999Z")))
                .thenReturn(List.of(incomeAt(5L, checking, "50.00", NOW)));
        when(transferRepository.findByUserIdAndCreatedAtBetween(eq(1L), any(), any()))
                .thenReturn(List.of(transferAt(6L, external, checking, "1000.00", NOW)));
        when(expenseRepository.findByUserIdAndCreatedAtBetween(eq(1L), any(), any()))
                .thenReturn(List.of(expenseAt(7L, checking, food, "80.00", NOW)));
        when(accountRepository.findByUserIdAndSystemFalseOrderByNameAsc(1L)).thenReturn(List.of(checking, savings));

        Summary summary = service.summary(1L, null, null, null);

        assertThat(summary.period().start()).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(summary.period().end()).isEqualTo(LocalDate.of(2024, 3, 31));
        assertThat(summary.totals().income()).isEqualByComparingTo("50.00");
        assertThat(summary.totals().transfersIn()).isEqualByComparingTo("1000.00");
        assertThat(summary.totals().incomeIncludingTransfers()).isEqualByComparingTo("1050.00");
        assertThat(summary.totals().expense()).isEqualByComparingTo("80.00");
        assertThat(summary.totals().net()).isEqualByComparingTo("970.00");
        assertThat(summary.balances().totalBalance()).isEqualByComparingTo("2770.00");
        assertThat(summary.balances().byAccount()).hasSize(2);
    }
}
