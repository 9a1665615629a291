package com.pennywise.service;

import com.pennywise.domain.Account;
import com.pennywise.domain.Category;
import com.pennywise.domain.Expense;
import com.pennywise.domain.Income;
import com.pennywise.domain.Transfer;
import com.pennywise.dto.ReportResponses.AccountBalance;
import com.pennywise.dto.ReportResponses.AccountCashflow;
import com.pennywise.dto.ReportResponses.Balances;
import com.pennywise.dto.ReportResponses.CategoryTotal;
import com.pennywise.dto.ReportResponses.MonthlyCashflow;
import com.pennywise.dto.ReportResponses.Period;
import com.pennywise.dto.ReportResponses.Summary;
import com.pennywise.dto.ReportResponses.Totals;
import com.pennywise.exception.LedgerValidationException;
import com.pennywise.repository.AccountRepository;
import com.pennywise.repository.ExpenseRepository;
import com.pennywise.repository.IncomeRepository;
import com.pennywise.repository.TransferRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Read-only aggregations over a user's entries.
 *
 * Entries are fetched per period with one query per entry type and grouped in
 * memory. "Income" in cash-flow reports includes transfers whose from-account is
 * the system account (salary deposits); transfers between regular accounts are
 * internal moves and count neither as income nor as expense.
 *
 * Nothing here writes, and nothing here is consulted by the mutation paths.
 */
@Service
@Transactional(readOnly = true)
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    private static final Comparator<Account> ACCOUNT_ORDER =
            Comparator.comparing(Account::getName).thenComparing(Account::getId);

    private static final Comparator<Category> CATEGORY_ORDER =
            Comparator.comparing(Category::getName).thenComparing(Category::getId);

    /**
     * Monthly cash-flow breakdown selected by the {@code by} parameter.
     */
    public enum Breakdown {
        NONE, ACCOUNT, CATEGORY, ACCOUNT_CATEGORY;

        public static Breakdown parse(String by) {
            if (by == null || by.isBlank()) {
                return NONE;
            }
            switch (by.strip().toLowerCase()) {
                case "account":
                    return ACCOUNT;
                case "category":
                    return CATEGORY;
                case "account_category":
                    return ACCOUNT_CATEGORY;
                default:
                    throw new LedgerValidationException("by",
                            "by must be one of account, category, account_category. Got: " + by);
            }
        }
    }

    private final ExpenseRepository expenseRepository;
    private final IncomeRepository incomeRepository;
    private final TransferRepository transferRepository;
    private final AccountRepository accountRepository;
    private final Clock clock;
    private final ZoneId zone;

    public ReportService(ExpenseRepository expenseRepository,
                         IncomeRepository incomeRepository,
                         TransferRepository transferRepository,
                         AccountRepository accountRepository,
                         Clock clock,
                         @Value("${pennywise.reporting.zone:UTC}") String zone) {
        this.expenseRepository = expenseRepository;
        this.incomeRepository = incomeRepository;
        this.transferRepository = transferRepository;
        this.accountRepository = accountRepository;
        this.clock = clock;
        this.zone = ZoneId.of(zone);
    }

    /**
     * Expense totals per category, sorted by category name.
     */
    public List<CategoryTotal> totalsByCategory(Long userId, String start, String end, Long accountId) {
        ReportPeriod period = ReportPeriod.parse(start, end, zone);
        return categoryTotals(expenses(userId, period, accountId));
    }

    public BigDecimal incomeTotal(Long userId, String start, String end, Long accountId) {
        ReportPeriod period = ReportPeriod.parse(start, end, zone);
        return sum(incomes(userId, period, accountId).stream().map(Income::getAmount).collect(Collectors.toList()));
    }

    /**
     * Total moved by transfers, optionally restricted to a from- and/or to-account.
     */
    public BigDecimal transferTotal(Long userId, String start, String end, Long fromAccountId, Long toAccountId) {
        ReportPeriod period = ReportPeriod.parse(start, end, zone);
        List<BigDecimal> amounts = transfers(userId, period).stream()
                .filter(t -> fromAccountId == null || fromAccountId.equals(t.getFromAccount().getId()))
                .filter(t -> toAccountId == null || toAccountId.equals(t.getToAccount().getId()))
                .map(Transfer::getAmount)
                .collect(Collectors.toList());
        return sum(amounts);
    }

    /**
     * Income versus expense per calendar month, oldest first.
     *
     * @param accountId optional filter; salary deposits match on their to-account
     * @param by        none, account, category or account_category
     */
    public List<MonthlyCashflow> monthlyCashflow(Long userId, String start, String end, Long accountId, String by) {
        Breakdown breakdown = Breakdown.parse(by);
        ReportPeriod period = ReportPeriod.parse(start, end, zone);
        log.debug("Monthly cash flow - userId={}, period={}, accountId={}, by={}", userId, period, accountId, breakdown);

        Map<LocalDate, List<Flow>> byMonth = flows(userId, period, accountId).stream()
                .collect(Collectors.groupingBy(Flow::month, TreeMap::new, Collectors.toList()));

        List<MonthlyCashflow> result = new ArrayList<>();
        byMonth.forEach((month, flows) -> {
            BigDecimal income = sumOf(flows, Flow::income);
            BigDecimal expense = sumOf(flows, Flow::isExpense);
            List<AccountCashflow> accounts = null;
            List<CategoryTotal> categories = null;
            if (breakdown == Breakdown.ACCOUNT || breakdown == Breakdown.ACCOUNT_CATEGORY) {
                accounts = accountCashflows(flows, breakdown == Breakdown.ACCOUNT_CATEGORY);
            } else if (breakdown == Breakdown.CATEGORY) {
                categories = flowCategoryTotals(flows);
            }
            result.add(new MonthlyCashflow(month, income, expense, income.subtract(expense), accounts, categories));
        });
        return result;
    }

    /**
     * Dashboard: period totals plus current balances of all regular accounts.
     * With no bounds given the period is the current month.
     */
    public Summary summary(Long userId, String start, String end, Long accountId) {
        ReportPeriod period = (isBlank(start) && isBlank(end))
                ? ReportPeriod.month(YearMonth.now(clock.withZone(zone)), zone)
                : ReportPeriod.parse(start, end, zone);

        BigDecimal income = sum(incomes(userId, period, accountId).stream()
                .map(Income::getAmount).collect(Collectors.toList()));
        BigDecimal transfersIn = sum(salaryTransfers(userId, period, accountId).stream()
                .map(Transfer::getAmount).collect(Collectors.toList()));
        BigDecimal expense = sum(expenses(userId, period, accountId).stream()
                .map(Expense::getAmount).collect(Collectors.toList()));
        BigDecimal incomeInclTransfers = income.add(transfersIn);

        List<AccountBalance> balances = accountRepository.findByUserIdAndSystemFalseOrderByNameAsc(userId).stream()
                .map(a -> new AccountBalance(a.getId(), a.getName(), a.getBalance()))
                .collect(Collectors.toList());
        BigDecimal totalBalance = sum(balances.stream().map(AccountBalance::balance).collect(Collectors.toList()));

        return new Summary(
                new Period(period.getStartDate(), period.getEndDate(), accountId),
                new Totals(income, transfersIn, incomeInclTransfers, expense, incomeInclTransfers.subtract(expense)),
                new Balances(totalBalance, balances));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // HELPERS
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * One cash movement in a month: an income, a salary deposit or an expense.
     */
    private record Flow(LocalDate month, Account account, Category category, BigDecimal amount, boolean income) {

        boolean isExpense() {
            return !income;
        }
    }

    private List<Flow> flows(Long userId, ReportPeriod period, Long accountId) {
        List<Flow> flows = new ArrayList<>();
        for (Income i : incomes(userId, period, accountId)) {
            flows.add(new Flow(monthOf(i.getCreatedAt()), i.getAccount(), null, i.getAmount(), true));
        }
        for (Transfer t : salaryTransfers(userId, period, accountId)) {
            flows.add(new Flow(monthOf(t.getCreatedAt()), t.getToAccount(), null, t.getAmount(), true));
        }
        for (Expense e : expenses(userId, period, accountId)) {
            flows.add(new Flow(monthOf(e.getCreatedAt()), e.getAccount(), e.getCategory(), e.getAmount(), false));
        }
        return flows;
    }

    private List<AccountCashflow> accountCashflows(List<Flow> flows, boolean withCategories) {
        Map<Account, List<Flow>> perAccount = flows.stream()
                .collect(Collectors.groupingBy(Flow::account, () -> new TreeMap<>(ACCOUNT_ORDER), Collectors.toList()));

        List<AccountCashflow> result = new ArrayList<>();
        perAccount.forEach((account, accountFlows) -> {
            BigDecimal income = sumOf(accountFlows, Flow::income);
            BigDecimal expense = sumOf(accountFlows, Flow::isExpense);
            result.add(new AccountCashflow(
                    account.getId(),
                    account.getName(),
                    income,
                    expense,
                    income.subtract(expense),
                    withCategories ? flowCategoryTotals(accountFlows) : null));
        });
        return result;
    }

    private List<CategoryTotal> flowCategoryTotals(List<Flow> flows) {
        Map<Category, BigDecimal> totals = flows.stream()
                .filter(Flow::isExpense)
                .collect(Collectors.groupingBy(Flow::category, () -> new TreeMap<>(CATEGORY_ORDER),
                        Collectors.reducing(ZERO, Flow::amount, BigDecimal::add)));
        return toCategoryTotals(totals);
    }

    private List<CategoryTotal> categoryTotals(List<Expense> expenses) {
        Map<Category, BigDecimal> totals = expenses.stream()
                .collect(Collectors.groupingBy(Expense::getCategory, () -> new TreeMap<>(CATEGORY_ORDER),
                        Collectors.reducing(ZERO, Expense::getAmount, BigDecimal::add)));
        return toCategoryTotals(totals);
    }

    private static List<CategoryTotal> toCategoryTotals(Map<Category, BigDecimal> totals) {
        List<CategoryTotal> result = new ArrayList<>();
        totals.forEach((category, total) -> result.add(new CategoryTotal(category.getId(), category.getName(), total)));
        return result;
    }

    private List<Expense> expenses(Long userId, ReportPeriod period, Long accountId) {
        return expenseRepository.findByUserIdAndCreatedAtBetween(userId, period.getFrom(), period.getTo()).stream()
                .filter(e -> accountId == null || accountId.equals(e.getAccount().getId()))
                .collect(Collectors.toList());
    }

    private List<Income> incomes(Long userId, ReportPeriod period, Long accountId) {
        return incomeRepository.findByUserIdAndCreatedAtBetween(userId, period.getFrom(), period.getTo()).stream()
                .filter(i -> accountId == null || accountId.equals(i.getAccount().getId()))
                .collect(Collectors.toList());
    }

    private List<Transfer> transfers(Long userId, ReportPeriod period) {
        return transferRepository.findByUserIdAndCreatedAtBetween(userId, period.getFrom(), period.getTo());
    }

    /**
     * Transfers out of the system account, matched on their to-account.
     */
    private List<Transfer> salaryTransfers(Long userId, ReportPeriod period, Long accountId) {
        return transfers(userId, period).stream()
                .filter(Transfer::isFromSystem)
                .filter(t -> accountId == null || accountId.equals(t.getToAccount().getId()))
                .collect(Collectors.toList());
    }

    private LocalDate monthOf(Instant instant) {
        return instant.atZone(zone).toLocalDate().withDayOfMonth(1);
    }

    private static BigDecimal sumOf(List<Flow> flows, Predicate<Flow> filter) {
        return sum(flows.stream().filter(filter).map(Flow::amount).collect(Collectors.toList()));
    }

    private static BigDecimal sum(List<BigDecimal> amounts) {
        return amounts.stream().reduce(ZERO, BigDecimal::add);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
