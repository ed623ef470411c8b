package com.filterbench.controller;

import com.filterbench.dto.StrategyMetricsDto;
import com.filterbench.engine.StrategyType;
import com.filterbench.service.BenchmarkService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * REST controller for the per-strategy timing history.
 *
 * Endpoints:
 * GET /api/metrics : mean time, samples, speedup and efficiency per strategy
 * DELETE /api/metrics : clear the history
 */
@RestController
@RequestMapping("/api/metrics")
public class MetricsController {

    private final BenchmarkService benchmarkService;

    public MetricsController(BenchmarkService benchmarkService) {
        this.benchmarkService = benchmarkService;
    }

    @GetMapping
    public ResponseEntity<List<StrategyMetricsDto>> getMetrics() {
        Map<StrategyType, Double> averages = benchmarkService.compare();
        List<StrategyMetricsDto> metrics = new ArrayList<>();

        for (StrategyType type : StrategyType.values()) {
            List<Double> history = benchmarkService.history(type);
            StrategyMetricsDto dto = new StrategyMetricsDto();
            dto.setStrategy(type.getLabel());
            dto.setSamples(history.size());
            dto.setHistory(history);
            dto.setAverageSeconds(averages.getOrDefault(type, 0.0));

            OptionalInt workers = benchmarkService.lastWorkerCount(type);
            if (workers.isPresent()) {
                dto.setWorkers(workers.getAsInt());
            }
            if (type.isParallel()) {
                OptionalDouble speedup = benchmarkService.speedup(type);
                if (speedup.isPresent()) {
                    dto.setSpeedup(speedup.getAsDouble());
                    if (workers.isPresent()) {
                        dto.setEfficiency(BenchmarkService.efficiency(speedup.getAsDouble(), workers.getAsInt()));
                    }
                }
            }
            metrics.add(dto);
        }
        return ResponseEntity.ok(metrics);
    }

    @DeleteMapping
    public ResponseEntity<Map<String, String>> resetMetrics() {
        benchmarkService.reset();
        return ResponseEntity.ok(Map.of("status", "cleared", "message", "Timing history cleared."));
    }
}
