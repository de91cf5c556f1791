package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.config.PredictionProperties;
import com.tony.hockeyAnalytics.exception.ResourceNotFoundException;
import com.tony.hockeyAnalytics.model.CompositeWeights;
import com.tony.hockeyAnalytics.model.ConfidenceTier;
import com.tony.hockeyAnalytics.model.ModelState;
import com.tony.hockeyAnalytics.model.PredictionRecord;
import com.tony.hockeyAnalytics.model.PredictionResult;
import com.tony.hockeyAnalytics.model.TeamCode;
import com.tony.hockeyAnalytics.model.dto.DashboardStats;
import com.tony.hockeyAnalytics.repository.PredictionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Optional;

/**
 * Boucle d'apprentissage : enregistre les prédictions, les amende avec le résultat réel,
 * tient la précision à jour et déclenche la ré-estimation des poids tous les N matchs.
 * Seul endroit où les paramètres dérivés du modèle changent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OnlineLearningService {

    private final PredictionRecordRepository repository;
    private final ModelStateService modelState;
    private final WeightRefitService refitService;
    private final PredictionEvaluationService evaluationService;
    private final PredictionProperties props;
    private final Clock clock;

    @Transactional
    public PredictionRecord addPrediction(String gameId, LocalDate gameDate, PredictionResult result, String actualWinner) {
        Optional<PredictionRecord> existing = repository.findByGameId(gameId);
        if (existing.isPresent()) {
            log.debug("Prédiction déjà enregistrée pour le match {}", gameId);
            return applyOutcome(existing.get(), actualWinner);
        }

        PredictionRecord record = PredictionRecord.builder()
                .gameId(gameId)
                .gameDate(gameDate)
                .awayTeam(TeamCode.normalize(result.getAwayTeam()))
                .homeTeam(TeamCode.normalize(result.getHomeTeam()))
                .awayProbability(result.getAwayWinProbability())
                .homeProbability(result.getHomeWinProbability())
                .predictedWinner(result.getPredictedWinner())
                .confidence(result.getConfidence())
                .confidenceTier(result.getConfidenceTier())
                .awayCompositeScore(result.getAwayCompositeScore())
                .homeCompositeScore(result.getHomeCompositeScore())
                .awayMetrics(new EnumMap<>(result.getAwayMetrics().toMap()))
                .homeMetrics(new EnumMap<>(result.getHomeMetrics().toMap()))
                .createdAt(LocalDateTime.now(clock))
                .build();
        PredictionRecord saved = repository.save(record);
        log.info("📝 Prédiction {} enregistrée : {} ({} %)", gameId, result.getPredictedWinner(),
                String.format("%.1f", Math.max(result.getAwayWinProbability(), result.getHomeWinProbability())));
        return applyOutcome(saved, actualWinner);
    }

    @Transactional
    public PredictionRecord recordOutcome(String gameId, String actualWinner) {
        PredictionRecord record = repository.findByGameId(gameId)
                .orElseThrow(() -> new ResourceNotFoundException("Prédiction", gameId));
        return applyOutcome(record, actualWinner);
    }

    public Optional<PredictionRecord> findByGameId(String gameId) {
        return repository.findByGameId(gameId);
    }

    /** Ré-estimation forcée, hors cycle. */
    @Transactional
    public CompositeWeights refitNow() {
        ModelState state = modelState.getState();
        refit(state);
        modelState.save(state);
        return modelState.weightsOf(state);
    }

    public DashboardStats getDashboardStats() {
        ModelState state = modelState.getState();
        return new DashboardStats(
                repository.count(),
                repository.countByActualWinnerIsNotNull(),
                round(state.getAccuracy() * 100.0),
                round(state.getHighConfidenceAccuracy() * 100.0),
                repository.findAverageBrierScore());
    }

    // Un résultat n'est appliqué qu'une fois ; sans vainqueur la prédiction reste ouverte
    private PredictionRecord applyOutcome(PredictionRecord record, String winnerCode) {
        if (winnerCode == null || winnerCode.isBlank()) return record;
        String actualWinner = TeamCode.normalize(winnerCode);
        if (!actualWinner.equals(record.getAwayTeam()) && !actualWinner.equals(record.getHomeTeam())) {
            throw new IllegalArgumentException(String.format("Vainqueur %s inconnu pour le match %s (%s @ %s)",
                    winnerCode, record.getGameId(), record.getAwayTeam(), record.getHomeTeam()));
        }
        if (record.isCompleted()) {
            log.debug("Résultat déjà connu pour le match {}", record.getGameId());
            return record;
        }

        evaluationService.evaluatePrediction(record, actualWinner);
        PredictionRecord saved = repository.save(record);

        ModelState state = modelState.getState();
        boolean correct = Boolean.TRUE.equals(record.getCorrect());
        state.setTotalGames(state.getTotalGames() + 1);
        if (correct) state.setCorrectPredictions(state.getCorrectPredictions() + 1);
        state.setAccuracy((double) state.getCorrectPredictions() / state.getTotalGames());
        if (record.getConfidenceTier() == ConfidenceTier.HIGH) {
            state.setHighConfidenceGames(state.getHighConfidenceGames() + 1);
            if (correct) state.setHighConfidenceCorrect(state.getHighConfidenceCorrect() + 1);
        }
        state.setGamesSinceRefit(state.getGamesSinceRefit() + 1);

        if (state.getGamesSinceRefit() >= props.getRefitInterval()) {
            refit(state);
        }
        modelState.save(state);

        log.info("{} Match {} : prédit {}, vainqueur {} (précision {} %)", correct ? "✅" : "❌",
                record.getGameId(), record.getPredictedWinner(), actualWinner, round(state.getAccuracy() * 100.0));
        return saved;
    }

    private void refit(ModelState state) {
        CompositeWeights updated = refitService.refit(modelState.weightsOf(state),
                repository.findByActualWinnerIsNotNullOrderByGameDateAsc());
        state.setWeights(new EnumMap<>(updated.asMap()));
        state.setGamesSinceRefit(0);
        state.setLastRefitAt(LocalDateTime.now(clock));
    }

    private double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
