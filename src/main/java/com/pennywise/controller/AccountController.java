package com.pennywise.controller;

import com.pennywise.domain.User;
import com.pennywise.dto.ApiResponses;
import com.pennywise.dto.NameRequest;
import com.pennywise.service.AccountService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for the caller's accounts.
 *
 * RULES:
 * - No business logic: pure delegation to AccountService
 * - Balances are read-only here; they move only through entries
 * - System accounts never appear (list) and answer 404 (direct access)
 *
 * HTTP CONTRACT SUMMARY:
 * GET    /accounts                         → 200
 * POST   /accounts                         → 201 | 400
 * GET    /accounts/{id}                    → 200 | 404
 * PATCH  /accounts/{id}                    → 200 | 400 | 404
 * DELETE /accounts/{id}                    → 204 | 400 (still referenced) | 404
 * GET    /accounts/{id}/reconciliation     → 200 | 404
 */
@RestController
@RequestMapping("/accounts")
@Tag(name = "Accounts", description = "Accounts and their cached balances")
public class AccountController {

    private final AccountService accountService;

    public AccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    @GetMapping
    @Operation(summary = "List accounts", description = "Regular accounts of the caller, sorted by name")
    public ResponseEntity<List<ApiResponses.AccountResponse>> listAccounts(@AuthenticationPrincipal User user) {
        List<ApiResponses.AccountResponse> responses = accountService.listAccounts(user.getId())
                .stream()
                .map(ApiResponses.AccountResponse::new)
                .collect(Collectors.toList());
        return ResponseEntity.ok(responses);
    }

    @PostMapping
    @Operation(summary = "Create account", description = "New account with a zero balance")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "Account created"),
        @ApiResponse(responseCode = "400", description = "Blank or duplicate name")
    })
    public ResponseEntity<ApiResponses.AccountResponse> createAccount(
            @Valid @RequestBody NameRequest request,
            @AuthenticationPrincipal User user) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new ApiResponses.AccountResponse(accountService.createAccount(user.getId(), request.getName())));
    }

    @GetMapping("/{accountId}")
    @Operation(summary = "Get account")
    public ResponseEntity<ApiResponses.AccountResponse> getAccount(
            @Parameter(description = "Account ID") @PathVariable Long accountId,
            @AuthenticationPrincipal User user) {
        return ResponseEntity.ok(new ApiResponses.AccountResponse(accountService.getAccount(user.getId(), accountId)));
    }

    @PatchMapping("/{accountId}")
    @Operation(summary = "Rename account")
    public ResponseEntity<ApiResponses.AccountResponse> renameAccount(
            @Parameter(description = "Account ID") @PathVariable Long accountId,
            @Valid @RequestBody NameRequest request,
            @AuthenticationPrincipal User user) {
        return ResponseEntity.ok(new ApiResponses.AccountResponse(
                accountService.renameAccount(user.getId(), accountId, request.getName())));
    }

    @DeleteMapping("/{accountId}")
    @Operation(summary = "Delete account", description = "Only accounts without expenses, incomes or transfers")
    public ResponseEntity<Void> deleteAccount(
            @Parameter(description = "Account ID") @PathVariable Long accountId,
            @AuthenticationPrincipal User user) {
        accountService.deleteAccount(user.getId(), accountId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{accountId}/reconciliation")
    @Operation(summary = "Reconcile account",
               description = "Compare the cached balance with the sum of the account's entries")
    public ResponseEntity<ApiResponses.ReconciliationResponse> reconcile(
            @Parameter(description = "Account ID") @PathVariable Long accountId,
            @AuthenticationPrincipal User user) {
        return ResponseEntity.ok(new ApiResponses.ReconciliationResponse(
                accountService.reconcile(user.getId(), accountId)));
    }
}
