package com.riskguardian.coordinator.controller;

import com.riskguardian.common.exception.InvalidPortfolioException;
import com.riskguardian.coordinator.model.AnalysisOutcome;
import com.riskguardian.coordinator.model.AnalysisReport;
import com.riskguardian.coordinator.model.AnalyzeRequest;
import com.riskguardian.coordinator.report.ReportRenderer;
import com.riskguardian.coordinator.service.RiskCoordinator;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/risk")
public class RiskAnalysisController {

    private final RiskCoordinator riskCoordinator;
    private final ReportRenderer reportRenderer;

    public RiskAnalysisController(RiskCoordinator riskCoordinator, ReportRenderer reportRenderer) {
        this.riskCoordinator = riskCoordinator;
        this.reportRenderer  = reportRenderer;
    }

    /** 200 with the report (possibly degraded), 503 with the failure causes. */
    @PostMapping("/analyze")
    public Mono<ResponseEntity<AnalysisOutcome>> analyze(@RequestBody AnalyzeRequest request) {
        return riskCoordinator.analyze(request)
            .map(outcome -> ResponseEntity.status(statusOf(outcome)).body(outcome));
    }

    @PostMapping(value = "/analyze/text", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<String>> analyzeAsText(@RequestBody AnalyzeRequest request) {
        return riskCoordinator.analyze(request)
            .map(outcome -> ResponseEntity.status(statusOf(outcome)).body(reportRenderer.render(outcome)));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(InvalidPortfolioException.class)
    public ResponseEntity<String> invalidPortfolio(InvalidPortfolioException e) {
        return ResponseEntity.badRequest().body(e.getMessage());
    }

    private static HttpStatus statusOf(AnalysisOutcome outcome) {
        return outcome instanceof AnalysisReport ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
    }
}
