package com.tony.hockeyAnalytics.controller;

import com.tony.hockeyAnalytics.model.PredictionRecord;
import com.tony.hockeyAnalytics.model.PredictionResult;
import com.tony.hockeyAnalytics.model.dto.DashboardStats;
import com.tony.hockeyAnalytics.model.dto.PredictionRequest;
import com.tony.hockeyAnalytics.service.GameProcessingService;
import com.tony.hockeyAnalytics.service.OnlineLearningService;
import com.tony.hockeyAnalytics.service.PredictionEngineService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/v1/predictions")
@RequiredArgsConstructor
public class PredictionController {

    private final PredictionEngineService predictionEngine;
    private final GameProcessingService processingService;
    private final OnlineLearningService learning;

    // Simulation sans enregistrement
    @GetMapping("/predict")
    public ResponseEntity<PredictionResult> predict(
            @RequestParam String away,
            @RequestParam String home,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(predictionEngine.predict(away, home, date));
    }

    @PostMapping
    public ResponseEntity<PredictionRecord> recordPrediction(@Valid @RequestBody PredictionRequest request) {
        PredictionRecord record = processingService.predictAndRecord(
                request.gameId(), request.gameDate(), request.awayTeam(), request.homeTeam());
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }

    @PutMapping("/{gameId}/outcome")
    public ResponseEntity<PredictionRecord> recordOutcome(@PathVariable String gameId, @RequestParam String winner) {
        return ResponseEntity.ok(learning.recordOutcome(gameId, winner));
    }

    @GetMapping("/dashboard")
    public ResponseEntity<DashboardStats> getDashboard() {
        return ResponseEntity.ok(learning.getDashboardStats());
    }
}
