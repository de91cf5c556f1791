package com.tony.hockeyAnalytics.config;

import com.tony.hockeyAnalytics.model.CompositeMetric;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "prediction")
@Data
public class PredictionProperties {

    // --- 1. Pondération composite (somme = 1) ---
    private Map<CompositeMetric, Double> defaultWeights = canonicalWeights();

    // --- 2. Paliers de confiance ---
    private double highConfidenceThreshold = 0.65;
    private double mediumConfidenceThreshold = 0.55;

    // Mélange des sources de confiance
    private double dataQualityWeight = 0.4;
    private double separationWeight = 0.3;
    private double gamesPlayedWeight = 0.2;
    private double consistencyWeight = 0.1;

    // --- 3. Ajustements de situation ---
    private double defaultHomeIceAdvantage = 0.05;
    private int minHomeGamesForLearnedAdvantage = 5;
    private double homeIceScale = 100.0;
    private double headToHeadScale = 50.0;
    private double restScale = 100.0;
    private double backToBackPenalty = -0.02;
    private double wellRestedBonus = 0.01;

    // --- 4. Profils glissants ---
    private int profileCap = 25;
    private int confidenceHorizonGames = 15;

    // --- 5. Ré-estimation des poids ---
    private int refitInterval = 25;
    private int refitMinSamples = 10;
    private double refitBlend = 0.5;
    private double refitWeightFloor = 0.02;

    private static Map<CompositeMetric, Double> canonicalWeights() {
        Map<CompositeMetric, Double> weights = new EnumMap<>(CompositeMetric.class);
        weights.put(CompositeMetric.PRESSURE, 0.25);
        weights.put(CompositeMetric.POSSESSION, 0.20);
        weights.put(CompositeMetric.MOMENTUM, 0.15);
        weights.put(CompositeMetric.TERRITORIAL, 0.15);
        weights.put(CompositeMetric.XG, 0.15);
        weights.put(CompositeMetric.HDC, 0.10);
        return weights;
    }
}
