package com.pennywise.controller;

import com.pennywise.domain.User;
import com.pennywise.dto.ReportResponses;
import com.pennywise.service.ReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Dashboard summary. Without start/end the current month is reported.
 */
@RestController
@Tag(name = "Summary", description = "Dashboard totals and balances")
public class SummaryController {

    private final ReportService reportService;

    public SummaryController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/summary")
    @Operation(summary = "Summary",
               description = "Income, salary deposits, expense and net for the period, plus current balances")
    public ResponseEntity<ReportResponses.Summary> summary(
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end,
            @RequestParam(required = false) Long accountId,
            @AuthenticationPrincipal User user) {
        return ResponseEntity.ok(reportService.summary(user.getId(), start, end, accountId));
    }
}
