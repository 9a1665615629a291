package com.pennywise.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Read-only report payloads. Amounts are serialized with two decimals.
 */
public final class ReportResponses {

    private ReportResponses() {
    }

    public record CategoryTotal(Long categoryId, String category, BigDecimal total) {}

    public record Total(BigDecimal total) {}

    /**
     * One calendar month. Only the breakdown that was asked for is present.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MonthlyCashflow(
            LocalDate month,
            BigDecimal income,
            BigDecimal expense,
            BigDecimal net,
            List<AccountCashflow> byAccount,
            List<CategoryTotal> byCategory) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AccountCashflow(
            Long accountId,
            String account,
            BigDecimal income,
            BigDecimal expense,
            BigDecimal net,
            List<CategoryTotal> byCategory) {}

    public record Summary(Period period, Totals totals, Balances balances) {}

    public record Period(LocalDate start, LocalDate end, Long accountId) {}

    public record Totals(
            BigDecimal income,
            BigDecimal transfersIn,
            BigDecimal incomeIncludingTransfers,
            BigDecimal expense,
            BigDecimal net) {}

    public record Balances(BigDecimal totalBalance, List<AccountBalance> byAccount) {}

    public record AccountBalance(Long accountId, String account, BigDecimal balance) {}
}
