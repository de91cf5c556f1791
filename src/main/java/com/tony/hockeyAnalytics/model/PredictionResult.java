package com.tony.hockeyAnalytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Sortie du prédicteur pour un match, avant persistance.
 */
@Value
@Builder(toBuilder = true)
public class PredictionResult {
    String awayTeam;
    String homeTeam;

    double awayWinProbability; // en %
    double homeWinProbability; // en %
    String predictedWinner;

    double confidence;
    ConfidenceTier confidenceTier;

    // Scores composites après ajustements
    double awayCompositeScore;
    double homeCompositeScore;

    // Détail des ajustements (unités de score)
    double homeIceAdjustment;
    double headToHeadAdjustment;
    double awayRestAdjustment;
    double homeRestAdjustment;

    CompositeScores awayMetrics;
    CompositeScores homeMetrics;
}
