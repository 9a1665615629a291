package com.pennywise.controller;

import com.pennywise.domain.User;
import com.pennywise.dto.ApiResponses;
import com.pennywise.dto.ExpenseRequest;
import com.pennywise.dto.OnCreate;
import com.pennywise.dto.ReportResponses;
import com.pennywise.service.ExpenseService;
import com.pennywise.service.ReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.groups.Default;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for expenses and expense reports.
 *
 * Every mutation moves the account balance in the same transaction
 * (ExpenseService). PUT and PATCH are both partial: omitted fields keep
 * their stored value.
 *
 * HTTP CONTRACT SUMMARY:
 * GET        /expenses                      → 200
 * POST       /expenses                      → 201 | 400 | 404
 * GET        /expenses/{id}                 → 200 | 404
 * PUT/PATCH  /expenses/{id}                 → 200 | 400 | 404
 * DELETE     /expenses/{id}                 → 204 | 404
 * GET        /expenses/totals-by-category   → 200 | 400
 * GET        /expenses/monthly-cashflow     → 200 | 400
 */
@RestController
@RequestMapping("/expenses")
@Tag(name = "Expenses", description = "Expenses and spending reports")
public class ExpenseController {

    private final ExpenseService expenseService;
    private final ReportService reportService;

    public ExpenseController(ExpenseService expenseService, ReportService reportService) {
        this.expenseService = expenseService;
        this.reportService = reportService;
    }

    @GetMapping
    @Operation(summary = "List expenses", description = "Newest first")
    public ResponseEntity<List<ApiResponses.ExpenseResponse>> listExpenses(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(expenseService.listExpenses(user.getId())
                .stream()
                .map(ApiResponses.ExpenseResponse::new)
                .collect(Collectors.toList()));
    }

    @PostMapping
    @Operation(summary = "Create expense", description = "Debits the account by the amount")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "Expense recorded"),
        @ApiResponse(responseCode = "400", description = "Invalid amount, foreign or system account, foreign category"),
        @ApiResponse(responseCode = "404", description = "Account or category not found")
    })
    public ResponseEntity<ApiResponses.ExpenseResponse> createExpense(
            @Validated({Default.class, OnCreate.class}) @RequestBody ExpenseRequest request,
            @AuthenticationPrincipal User user) {
        var expense = expenseService.create(user.getId(), request.getAccountId(), request.getCategoryId(),
                request.getAmount(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiResponses.ExpenseResponse(expense));
    }

    @GetMapping("/{expenseId}")
    @Operation(summary = "Get expense")
    public ResponseEntity<ApiResponses.ExpenseResponse> getExpense(
            @Parameter(description = "Expense ID") @PathVariable Long expenseId,
            @AuthenticationPrincipal User user) {
        return ResponseEntity.ok(new ApiResponses.ExpenseResponse(expenseService.getExpense(user.getId(), expenseId)));
    }

    @RequestMapping(value = "/{expenseId}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    @Operation(summary = "Update expense",
               description = "Moving to another account refunds the old one and debits the new one")
    public ResponseEntity<ApiResponses.ExpenseResponse> updateExpense(
            @Parameter(description = "Expense ID") @PathVariable Long expenseId,
            @Valid @RequestBody ExpenseRequest request,
            @AuthenticationPrincipal User user) {
        var expense = expenseService.update(user.getId(), expenseId, request.getAccountId(), request.getCategoryId(),
                request.getAmount(), request.getDescription());
        return ResponseEntity.ok(new ApiResponses.ExpenseResponse(expense));
    }

    @DeleteMapping("/{expenseId}")
    @Operation(summary = "Delete expense", description = "Refunds the amount to the account")
    public ResponseEntity<Void> deleteExpense(
            @Parameter(description = "Expense ID") @PathVariable Long expenseId,
            @AuthenticationPrincipal User user) {
        expenseService.delete(user.getId(), expenseId);
        return ResponseEntity.noContent().build();
    }

    // ─────────────────────────────────────────────────────────────────────────
    // REPORTS
    // ─────────────────────────────────────────────────────────────────────────

    @GetMapping("/totals-by-category")
    @Operation(summary = "Expense totals by category",
               description = "start/end accept YYYY-MM or YYYY-MM-DD, both inclusive")
    public ResponseEntity<List<ReportResponses.CategoryTotal>> totalsByCategory(
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end,
            @RequestParam(required = false) Long accountId,
            @AuthenticationPrincipal User user) {
        return ResponseEntity.ok(reportService.totalsByCategory(user.getId(), start, end, accountId));
    }

    @GetMapping("/monthly-cashflow")
    @Operation(summary = "Monthly cash flow",
               description = "Income (including salary deposits) versus expense per month. "
                       + "by = account | category | account_category")
    public ResponseEntity<List<ReportResponses.MonthlyCashflow>> monthlyCashflow(
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end,
            @RequestParam(required = false) Long accountId,
            @RequestParam(required = false) String by,
            @AuthenticationPrincipal User user) {
        return ResponseEntity.ok(reportService.monthlyCashflow(user.getId(), start, end, accountId, by));
    }
}
