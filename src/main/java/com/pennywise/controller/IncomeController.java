package com.pennywise.controller;

import com.pennywise.domain.User;
import com.pennywise.dto.ApiResponses;
import com.pennywise.dto.IncomeRequest;
import com.pennywise.dto.OnCreate;
import com.pennywise.dto.ReportResponses;
import com.pennywise.service.IncomeService;
import com.pennywise.service.ReportService;
import io.swagger.v3.oas.annotations.Operation;
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
 * REST controller for incomes. Same contract as {@link ExpenseController},
 * plus GET /incomes/total.
 */
@RestController
@RequestMapping("/incomes")
@Tag(name = "Incomes", description = "Incomes")
public class IncomeController {

    private final IncomeService incomeService;
    private final ReportService reportService;

    public IncomeController(IncomeService incomeService, ReportService reportService) {
        this.incomeService = incomeService;
        this.reportService = reportService;
    }

    @GetMapping
    @Operation(summary = "List incomes")
    public ResponseEntity<List<ApiResponses.IncomeResponse>> listIncomes(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(incomeService.listIncomes(user.getId())
                .stream()
                .map(ApiResponses.IncomeResponse::new)
                .collect(Collectors.toList()));
    }

    @PostMapping
    @Operation(summary = "Create income", description = "Credits the account by the amount")
    public ResponseEntity<ApiResponses.IncomeResponse> createIncome(
            @Validated({Default.class, OnCreate.class}) @RequestBody IncomeRequest request,
            @AuthenticationPrincipal User user) {
        var income = incomeService.create(user.getId(), request.getAccountId(), request.getAmount(),
                request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiResponses.IncomeResponse(income));
    }

    @GetMapping("/{incomeId}")
    @Operation(summary = "Get income")
    public ResponseEntity<ApiResponses.IncomeResponse> getIncome(
            @PathVariable Long incomeId,
            @AuthenticationPrincipal User user) {
        return ResponseEntity.ok(new ApiResponses.IncomeResponse(incomeService.getIncome(user.getId(), incomeId)));
    }

    @RequestMapping(value = "/{incomeId}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    @Operation(summary = "Update income")
    public ResponseEntity<ApiResponses.IncomeResponse> updateIncome(
            @PathVariable Long incomeId,
            @Valid @RequestBody IncomeRequest request,
            @AuthenticationPrincipal User user) {
        var income = incomeService.update(user.getId(), incomeId, request.getAccountId(), request.getAmount(),
                request.getDescription());
        return ResponseEntity.ok(new ApiResponses.IncomeResponse(income));
    }

    @DeleteMapping("/{incomeId}")
    @Operation(summary = "Delete income", description = "Withdraws the amount from the account again")
    public ResponseEntity<Void> deleteIncome(
            @PathVariable Long incomeId,
            @AuthenticationPrincipal User user) {
        incomeService.delete(user.getId(), incomeId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/total")
    @Operation(summary = "Income total", description = "start/end accept YYYY-MM or YYYY-MM-DD")
    public ResponseEntity<ReportResponses.Total> total(
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end,
            @RequestParam(required = false) Long accountId,
            @AuthenticationPrincipal User user) {
        return ResponseEntity.ok(new ReportResponses.Total(
                reportService.incomeTotal(user.getId(), start, end, accountId)));
    }
}
