package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.exception.GameDataException;
import com.tony.hockeyAnalytics.model.CompositeScores;
import com.tony.hockeyAnalytics.model.GameMetrics;
import com.tony.hockeyAnalytics.model.PredictionRecord;
import com.tony.hockeyAnalytics.model.PredictionResult;
import com.tony.hockeyAnalytics.model.Venue;
import com.tony.hockeyAnalytics.model.dto.BatchReport;
import com.tony.hockeyAnalytics.model.dto.GameData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pipeline d'un match terminé : tout est calculé avant la moindre écriture,
 * donc un match en échec ne modifie aucun profil.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameProcessingService {

    private final GameDataValidator validator;
    private final PeriodAggregator aggregator;
    private final CompositeScoreCalculator compositeCalculator;
    private final TeamPerformanceStore store;
    private final SituationalAdjustmentService situations;
    private final PredictionEngineService predictionEngine;
    private final OnlineLearningService learning;

    /** Calcul pur : aucune lecture ni écriture des profils. */
    public GameMetrics computeMetrics(GameData game) {
        validator.validate(game);
        return aggregator.aggregate(game);
    }

    public GameMetrics processCompletedGame(GameData game) {
        long start = System.currentTimeMillis();

        // 1. Calcul complet (peut lever GameDataException, rien n'est encore modifié)
        GameMetrics metrics = computeMetrics(game);
        CompositeScores awayScores = compositeCalculator.compute(metrics.getAway());
        CompositeScores homeScores = compositeCalculator.compute(metrics.getHome());

        // 2. Écritures persistées qui peuvent échouer, avant toute modification des profils
        situations.recordResult(game);
        String winner = game.winnerAbbrev();
        if (winner != null && learning.findByGameId(game.getGameId()).isPresent()) {
            learning.recordOutcome(game.getGameId(), winner);
        }

        // 3. Profils en dernier : un match en échec n'y laisse aucune trace
        store.appendGame(game.getAwayAbbrev(), Venue.AWAY, awayScores, game.getGameDate());
        store.appendGame(game.getHomeAbbrev(), Venue.HOME, homeScores, game.getGameDate());
        store.flush();

        log.info("🏒 Match {} traité : {} @ {} ({} tirs, {} ms)", game.getGameId(), game.getAwayAbbrev(),
                game.getHomeAbbrev(), metrics.getShots().size(), System.currentTimeMillis() - start);
        return metrics;
    }

    /** Un match en échec est ignoré et journalisé ; le lot continue. */
    public BatchReport processBatch(List<GameData> games) {
        List<String> processed = new ArrayList<>();
        Map<String, String> skipped = new LinkedHashMap<>();

        for (GameData game : games) {
            String gameId = game != null ? game.getGameId() : null;
            try {
                processCompletedGame(game);
                processed.add(gameId);
            } catch (GameDataException e) {
                log.warn("⚠️ Match {} ignoré : {}", gameId, e.getMessage());
                skipped.put(String.valueOf(gameId), e.getMessage());
            } catch (RuntimeException e) {
                log.error("❌ Erreur inattendue sur le match {}", gameId, e);
                skipped.put(String.valueOf(gameId), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        log.info("✅ Lot terminé : {} traités, {} ignorés", processed.size(), skipped.size());
        return new BatchReport(processed, skipped);
    }

    /** Prédit un match à venir et enregistre la prédiction (une seule par match). */
    public PredictionRecord predictAndRecord(String gameId, LocalDate gameDate, String awayTeam, String homeTeam) {
        return learning.findByGameId(gameId).orElseGet(() -> {
            PredictionResult result = predictionEngine.predict(awayTeam, homeTeam, gameDate);
            return learning.addPrediction(gameId, gameDate, result, null);
        });
    }
}
