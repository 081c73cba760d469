package com.wpanther.multisigcoordinator.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.wpanther.multisigcoordinator.dto.CoordinatorMetricsResponse;
import com.wpanther.multisigcoordinator.service.CoordinatorMetricsService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Controller for retrieving coordinator counts
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
@Slf4j
public class MetricsController {

    private final CoordinatorMetricsService metricsService;

    @GetMapping
    public ResponseEntity<CoordinatorMetricsResponse> getMetrics() {
        log.debug("Fetching coordinator metrics");
        return ResponseEntity.ok(metricsService.calculateMetrics());
    }
}
