package com.tony.hockeyAnalytics.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * État appris du modèle (ligne unique) : poids courants et compteurs de précision.
 */
@Entity
@Data
@NoArgsConstructor
@Table(name = "model_state")
public class ModelState {
    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id = SINGLETON_ID;

    @Convert(converter = MetricValuesConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<CompositeMetric, Double> weights = new EnumMap<>(CompositeMetric.class);

    private int totalGames = 0;
    private int correctPredictions = 0;
    private double accuracy = 0.0;

    private int highConfidenceGames = 0;
    private int highConfidenceCorrect = 0;

    private int gamesSinceRefit = 0;
    private LocalDateTime lastRefitAt;

    public double getHighConfidenceAccuracy() {
        return highConfidenceGames == 0 ? 0.0 : (double) highConfidenceCorrect / highConfidenceGames;
    }
}
