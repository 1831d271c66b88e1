package com.microfinance.api;

import com.microfinance.api.dto.MetricEventRequest;
import com.microfinance.api.dto.RecalculationResult;
import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.MetricName;
import com.microfinance.domain.model.MetricTotal;
import com.microfinance.domain.service.IdentityResolver;
import com.microfinance.domain.service.MetricEventService;
import com.microfinance.domain.service.MetricsRecalculationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Metric event store: manual entries, summaries and the loan-derived rebuild.
 */
@Slf4j
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final MetricEventService metricEventService;
    private final MetricsRecalculationService metricsRecalculationService;
    private final IdentityResolver identityResolver;

    @PostMapping
    public ResponseEntity<Map<String, Object>> recordEvents(@Valid @RequestBody MetricEventRequest request,
                                                            @RequestHeader(value = LoanController.USER_HEADER, required = false) String userEmail) {
        List<MetricEventRequest> entries = request.getEntries() != null && !request.getEntries().isEmpty()
                ? request.getEntries()
                : Collections.singletonList(request);
        int stored = metricEventService.recordManual(entries, identityResolver.resolve(userEmail));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "count", stored));
    }

    @GetMapping("/summary")
    public ResponseEntity<List<MetricTotal>> summary(
            @RequestParam(required = false) List<String> metrics,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(required = false) String branchCode,
            @RequestParam(required = false) String loanOfficerName,
            @RequestParam(required = false) Currency currency) {
        List<MetricName> selected = new ArrayList<>();
        if (metrics != null) {
            for (String metric : metrics) {
                if (metric != null && !metric.isBlank()) {
                    selected.add(MetricName.fromWireName(metric));
                }
            }
        }
        return ResponseEntity.ok(metricEventService.summarize(selected, dateFrom, dateTo, branchCode, loanOfficerName, currency));
    }

    @PostMapping("/recalculate")
    public ResponseEntity<RecalculationResult> recalculate(@RequestHeader(value = LoanController.USER_HEADER, required = false) String userEmail) {
        log.info("Metrics recalculation requested by {}", userEmail);
        return ResponseEntity.ok(metricsRecalculationService.recalculate(identityResolver.resolve(userEmail)));
    }
}
