package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.config.PredictionProperties;
import com.tony.hockeyAnalytics.model.CompositeWeights;
import com.tony.hockeyAnalytics.model.ConfidenceTier;
import com.tony.hockeyAnalytics.model.PredictionResult;
import com.tony.hockeyAnalytics.model.TeamCode;
import com.tony.hockeyAnalytics.model.TeamProfileSummary;
import com.tony.hockeyAnalytics.model.Venue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Prédicteur composite : profils glissants pondérés, ajustements de situation,
 * normalisation en probabilités et confiance.
 * Une équipe sans historique reçoit le profil neutre : jamais d'erreur.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PredictionEngineService {

    private static final double LOW_CONFIDENCE = 0.1;

    private final TeamPerformanceStore store;
    private final SituationalAdjustmentService situations;
    private final ModelStateService modelState;
    private final PredictionProperties props;

    public PredictionResult predict(String awayCode, String homeCode, LocalDate gameDate) {
        String awayTeam = TeamCode.normalize(awayCode);
        String homeTeam = TeamCode.normalize(homeCode);
        log.info("🔮 Prédiction : {} @ {}", awayTeam, homeTeam);

        // 1. Profils (défaut neutre si aucun match)
        TeamProfileSummary away = store.getProfile(awayTeam, Venue.AWAY);
        TeamProfileSummary home = store.getProfile(homeTeam, Venue.HOME);

        // 2. Score composite de base
        CompositeWeights weights = modelState.currentWeights();
        double awayScore = weights.score(away.getAverages());
        double homeScore = weights.score(home.getAverages());

        // 3. Ajustements de situation
        double homeIce = situations.homeIceAdvantage(homeTeam) * props.getHomeIceScale();
        double h2h = situations.headToHeadAdvantage(awayTeam, homeTeam) * props.getHeadToHeadScale();
        double awayRest = situations.restAdjustment(awayTeam, gameDate) * props.getRestScale();
        double homeRest = situations.restAdjustment(homeTeam, gameDate) * props.getRestScale();

        awayScore = Math.max(0.0, awayScore + h2h + awayRest);
        homeScore = Math.max(0.0, homeScore + homeIce - h2h + homeRest);

        // 4. Normalisation (somme = 100)
        double total = awayScore + homeScore;
        double awayProb;
        double homeProb;
        double confidence;
        if (total <= 0.0) {
            awayProb = 50.0;
            homeProb = 50.0;
            confidence = LOW_CONFIDENCE;
        } else {
            awayProb = awayScore / total * 100.0;
            homeProb = 100.0 - awayProb;
            confidence = confidence(away, home, awayScore, homeScore);
        }

        return PredictionResult.builder()
                .awayTeam(awayTeam)
                .homeTeam(homeTeam)
                .awayWinProbability(awayProb)
                .homeWinProbability(homeProb)
                .predictedWinner(awayProb > homeProb ? awayTeam : homeTeam)
                .confidence(confidence)
                .confidenceTier(tierOf(confidence))
                .awayCompositeScore(awayScore)
                .homeCompositeScore(homeScore)
                .homeIceAdjustment(homeIce)
                .headToHeadAdjustment(h2h)
                .awayRestAdjustment(awayRest)
                .homeRestAdjustment(homeRest)
                .awayMetrics(away.getAverages())
                .homeMetrics(home.getAverages())
                .build();
    }

    /**
     * Mélange pondéré : qualité des données, écart des scores, volume du profil le plus mince
     * et régularité des métriques. Borné à [0, 1].
     */
    double confidence(TeamProfileSummary away, TeamProfileSummary home, double awayScore, double homeScore) {
        double dataQuality = (away.getConfidence() + home.getConfidence()) / 2.0;
        double separation = Math.min(1.0, Math.abs(awayScore - homeScore) / Math.max(Math.max(awayScore, homeScore), 1.0));
        double volume = gamesPlayedConfidence(Math.min(away.getGamesPlayed(), home.getGamesPlayed()));
        double consistency = (away.getConsistency() + home.getConsistency()) / 2.0;

        double blended = props.getDataQualityWeight() * dataQuality
                + props.getSeparationWeight() * separation
                + props.getGamesPlayedWeight() * volume
                + props.getConsistencyWeight() * consistency;
        return Math.max(0.0, Math.min(1.0, blended));
    }

    double gamesPlayedConfidence(int gamesPlayed) {
        if (gamesPlayed <= 0) return 0.1;
        if (gamesPlayed < 3) return 0.3;
        if (gamesPlayed < 10) return 0.5 + (gamesPlayed - 3) * 0.05;
        return 0.85;
    }

    public ConfidenceTier tierOf(double confidence) {
        if (confidence >= props.getHighConfidenceThreshold()) return ConfidenceTier.HIGH;
        if (confidence >= props.getMediumConfidenceThreshold()) return ConfidenceTier.MEDIUM;
        return ConfidenceTier.LOW;
    }
}
