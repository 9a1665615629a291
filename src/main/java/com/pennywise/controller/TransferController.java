package com.pennywise.controller;

import com.pennywise.domain.User;
import com.pennywise.dto.ApiResponses;
import com.pennywise.dto.OnCreate;
import com.pennywise.dto.RandomSalaryRequest;
import com.pennywise.dto.ReportResponses;
import com.pennywise.dto.SalaryRequest;
import com.pennywise.dto.TransferRequest;
import com.pennywise.service.ReportService;
import com.pennywise.service.SalaryService;
import com.pennywise.service.TransferService;
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
 * REST controller for transfers and salary deposits.
 *
 * RULES:
 * - No business logic: pure delegation to TransferService and SalaryService
 * - Locking, funds checks and reversal all happen in TransferService
 * - The system account is reachable only through the salary endpoints
 *
 * HTTP CONTRACT SUMMARY:
 * GET        /transfers                 → 200
 * POST       /transfers                 → 201 | 400 | 404 | 409 (insufficient funds) | 503 (lock timeout)
 * GET        /transfers/{id}            → 200 | 404
 * PUT/PATCH  /transfers/{id}            → 200 | 400 | 404 | 409 | 503
 * DELETE     /transfers/{id}            → 204 | 404 | 503
 * GET        /transfers/total           → 200 | 400
 * POST       /transfers/salary          → 201 | 400 | 404
 * POST       /transfers/salary/random   → 201 | 400 | 404
 */
@RestController
@RequestMapping("/transfers")
@Tag(name = "Transfers", description = "Transfers between accounts and salary deposits")
public class TransferController {

    private final TransferService transferService;
    private final SalaryService salaryService;
    private final ReportService reportService;

    public TransferController(TransferService transferService,
                              SalaryService salaryService,
                              ReportService reportService) {
        this.transferService = transferService;
        this.salaryService = salaryService;
        this.reportService = reportService;
    }

    @GetMapping
    @Operation(summary = "List transfers")
    public ResponseEntity<List<ApiResponses.TransferResponse>> listTransfers(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(transferService.listTransfers(user.getId())
                .stream()
                .map(ApiResponses.TransferResponse::new)
                .collect(Collectors.toList()));
    }

    @PostMapping
    @Operation(summary = "Create transfer",
               description = "Atomically debit the from-account and credit the to-account")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "Transfer complete"),
        @ApiResponse(responseCode = "400", description = "Invalid amount, same account, foreign or system account"),
        @ApiResponse(responseCode = "409", description = "Insufficient funds"),
        @ApiResponse(responseCode = "503", description = "Accounts busy, retry")
    })
    public ResponseEntity<ApiResponses.TransferResponse> createTransfer(
            @Validated({Default.class, OnCreate.class}) @RequestBody TransferRequest request,
            @AuthenticationPrincipal User user) {
        var transfer = transferService.create(user.getId(), request.getFromAccountId(), request.getToAccountId(),
                request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiResponses.TransferResponse(transfer));
    }

    @GetMapping("/{transferId}")
    @Operation(summary = "Get transfer")
    public ResponseEntity<ApiResponses.TransferResponse> getTransfer(
            @Parameter(description = "Transfer ID") @PathVariable Long transferId,
            @AuthenticationPrincipal User user) {
        return ResponseEntity.ok(new ApiResponses.TransferResponse(transferService.getTransfer(user.getId(), transferId)));
    }

    @RequestMapping(value = "/{transferId}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    @Operation(summary = "Update transfer",
               description = "Reverses the stored transfer, checks funds, applies the new one. "
                       + "On 409 both balances are unchanged.")
    public ResponseEntity<ApiResponses.TransferResponse> updateTransfer(
            @Parameter(description = "Transfer ID") @PathVariable Long transferId,
            @Valid @RequestBody TransferRequest request,
            @AuthenticationPrincipal User user) {
        var transfer = transferService.update(user.getId(), transferId, request.getFromAccountId(),
                request.getToAccountId(), request.getAmount());
        return ResponseEntity.ok(new ApiResponses.TransferResponse(transfer));
    }

    @DeleteMapping("/{transferId}")
    @Operation(summary = "Delete transfer", description = "Restores both balances")
    public ResponseEntity<Void> deleteTransfer(
            @Parameter(description = "Transfer ID") @PathVariable Long transferId,
            @AuthenticationPrincipal User user) {
        transferService.delete(user.getId(), transferId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/total")
    @Operation(summary = "Transfer total", description = "Optionally restricted to a from- and/or to-account")
    public ResponseEntity<ReportResponses.Total> total(
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end,
            @RequestParam(required = false) Long fromAccountId,
            @RequestParam(required = false) Long toAccountId,
            @AuthenticationPrincipal User user) {
        return ResponseEntity.ok(new ReportResponses.Total(
                reportService.transferTotal(user.getId(), start, end, fromAccountId, toAccountId)));
    }

    @PostMapping("/salary")
    @Operation(summary = "Deposit salary", description = "Transfer from the hidden external account")
    public ResponseEntity<ApiResponses.TransferResponse> depositSalary(
            @Valid @RequestBody SalaryRequest request,
            @AuthenticationPrincipal User user) {
        var transfer = salaryService.depositSalary(user.getId(), request.accountId(), request.amount());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiResponses.TransferResponse(transfer));
    }

    @PostMapping("/salary/random")
    @Operation(summary = "Deposit random salary", description = "Amount drawn uniformly from [min, max]")
    public ResponseEntity<ApiResponses.TransferResponse> depositRandomSalary(
            @Valid @RequestBody RandomSalaryRequest request,
            @AuthenticationPrincipal User user) {
        var transfer = salaryService.depositRandomSalary(user.getId(), request.accountId(), request.min(), request.max());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiResponses.TransferResponse(transfer));
    }
}
