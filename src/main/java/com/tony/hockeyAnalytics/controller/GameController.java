package com.tony.hockeyAnalytics.controller;

import com.tony.hockeyAnalytics.model.GameEvent;
import com.tony.hockeyAnalytics.model.GameMetrics;
import com.tony.hockeyAnalytics.model.dto.BatchReport;
import com.tony.hockeyAnalytics.model.dto.GameData;
import com.tony.hockeyAnalytics.service.GameProcessingService;
import com.tony.hockeyAnalytics.service.PlayByPlayCsvReader;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.StringReader;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/games")
@RequiredArgsConstructor
public class GameController {

    private final GameProcessingService processingService;
    private final PlayByPlayCsvReader csvReader;

    // Calcul seul, sans toucher aux profils
    @PostMapping("/metrics")
    public ResponseEntity<Map<String, Object>> computeMetrics(@RequestBody GameData game) {
        return ResponseEntity.ok(processingService.computeMetrics(game).toFlatMap());
    }

    @PostMapping(value = "/metrics/csv", consumes = "text/csv")
    public ResponseEntity<Map<String, Object>> computeMetricsFromCsv(
            @RequestBody String csv,
            @RequestParam String gameId,
            @RequestParam Long homeTeamId,
            @RequestParam Long awayTeamId,
            @RequestParam String homeAbbrev,
            @RequestParam String awayAbbrev,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        List<GameEvent> events = csvReader.read(new StringReader(csv));
        GameData game = GameData.builder()
                .gameId(gameId)
                .gameDate(date)
                .homeTeamId(homeTeamId)
                .awayTeamId(awayTeamId)
                .homeAbbrev(homeAbbrev)
                .awayAbbrev(awayAbbrev)
                .events(events)
                .build();
        return ResponseEntity.ok(processingService.computeMetrics(game).toFlatMap());
    }

    @PostMapping("/process")
    public ResponseEntity<Map<String, Object>> processGame(@RequestBody GameData game) {
        GameMetrics metrics = processingService.processCompletedGame(game);
        return ResponseEntity.ok(metrics.toFlatMap());
    }

    @PostMapping("/process/batch")
    public ResponseEntity<BatchReport> processBatch(@RequestBody List<GameData> games) {
        return ResponseEntity.ok(processingService.processBatch(games));
    }
}
