package com.filterbench.controller;

import com.filterbench.dto.ComparisonReport;
import com.filterbench.dto.RunReport;
import com.filterbench.dto.RunRequest;
import com.filterbench.dto.RunStatusDto;
import com.filterbench.service.ProcessingService;
import com.filterbench.service.ProcessingService.RunProgressEvent;
import org.springframework.context.event.EventListener;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * REST controller for filter runs and their live progress.
 *
 * Endpoints:
 * POST /api/runs : start one strategy over the given images
 * POST /api/runs/compare : Sequential vs one parallel strategy, or ALL
 * GET /api/runs/status : live processed/error/active counters
 * GET /api/runs/last : report of the last finished run
 * GET /api/runs/comparison : report of the last finished comparison
 * GET /api/runs/progress : SSE stream of per-image results
 */
@RestController
@RequestMapping("/api/runs")
public class RunController {

    private final ProcessingService processingService;

    // Active SSE clients subscribed to progress events
    private final List<SseEmitter> sseClients = new CopyOnWriteArrayList<>();

    public RunController(ProcessingService processingService) {
        this.processingService = processingService;
    }

    /**
     * Starts a run asynchronously.
     * Body: { "paths": [...], "filter": "Blur", "strategy": "ThreadPool", "workers": 4 }
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> startRun(@RequestBody RunRequest request) {
        try {
            processingService.submitRun(request);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("status", "ALREADY_RUNNING", "message", e.getMessage()));
        }
        return ResponseEntity.accepted()
                .body(Map.of("status", "STARTED", "message",
                        "Run started. Subscribe to /api/runs/progress for updates."));
    }

    /**
     * Starts a Sequential-vs-parallel comparison asynchronously.
     * Body as for /api/runs; "strategy" is a parallel strategy or "ALL".
     */
    @PostMapping("/compare")
    public ResponseEntity<Map<String, String>> startComparison(@RequestBody RunRequest request) {
        try {
            processingService.submitComparison(request);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("status", "ALREADY_RUNNING", "message", e.getMessage()));
        }
        return ResponseEntity.accepted()
                .body(Map.of("status", "STARTED", "message",
                        "Comparison started. GET /api/runs/comparison when it completes."));
    }

    @GetMapping("/status")
    public ResponseEntity<RunStatusDto> getStatus() {
        return ResponseEntity.ok(processingService.status());
    }

    @GetMapping("/last")
    public ResponseEntity<RunReport> getLastRun() {
        RunReport report = processingService.getLastReport();
        return report != null ? ResponseEntity.ok(report) : ResponseEntity.noContent().build();
    }

    @GetMapping("/comparison")
    public ResponseEntity<ComparisonReport> getLastComparison() {
        ComparisonReport report = processingService.getLastComparison();
        return report != null ? ResponseEntity.ok(report) : ResponseEntity.noContent().build();
    }

    /**
     * SSE endpoint streaming one event per processed image plus run completion.
     */
    @GetMapping(value = "/progress", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamProgress() {
        SseEmitter emitter = new SseEmitter(600_000L); // 10-minute timeout
        sseClients.add(emitter);

        emitter.onCompletion(() -> sseClients.remove(emitter));
        emitter.onTimeout(() -> sseClients.remove(emitter));
        emitter.onError(e -> sseClients.remove(emitter));

        try {
            emitter.send(SseEmitter.event().name("status").data(processingService.status()));
        } catch (IOException e) {
            sseClients.remove(emitter);
        }
        return emitter;
    }

    /**
     * Receives RunProgressEvents from ProcessingService and broadcasts them to
     * all connected SSE clients.
     */
    @EventListener
    public void onRunProgress(RunProgressEvent event) {
        if (sseClients.isEmpty())
            return;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", event.getType());
        data.put("strategy", event.getStrategy() != null ? event.getStrategy().getLabel() : "");
        data.put("message", event.getMessage() != null ? event.getMessage() : "");
        data.put("processed", event.getProcessed());
        data.put("errors", event.getErrors());
        data.put("total", event.getTotal());
        if (event.getResult() != null) {
            data.put("result", event.getResult());
        }

        String name = RunProgressEvent.TYPE_RESULT.equals(event.getType()) ? "result" : "complete";
        List<SseEmitter> dead = new CopyOnWriteArrayList<>();
        for (SseEmitter emitter : sseClients) {
            try {
                emitter.send(SseEmitter.event().name(name).data(data));
            } catch (IOException e) {
                dead.add(emitter);
            }
        }
        sseClients.removeAll(dead);
    }
}
