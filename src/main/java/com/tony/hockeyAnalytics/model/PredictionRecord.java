package com.tony.hockeyAnalytics.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Une prédiction par match. Seuls les champs de résultat sont renseignés après coup.
 */
@Entity
@Table(name = "prediction_record")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String gameId;

    private LocalDate gameDate;
    private String awayTeam;
    private String homeTeam;

    private double awayProbability;
    private double homeProbability;
    private String predictedWinner;
    private double confidence;

    @Enumerated(EnumType.STRING)
    private ConfidenceTier confidenceTier;

    private double awayCompositeScore;
    private double homeCompositeScore;

    @Convert(converter = MetricValuesConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<CompositeMetric, Double> awayMetrics;

    @Convert(converter = MetricValuesConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<CompositeMetric, Double> homeMetrics;

    private LocalDateTime createdAt;

    // --- Résultat (amendé une seule fois) ---
    @Setter
    private String actualWinner;
    @Setter
    private Boolean correct;
    @Setter
    private Double brierScore;

    public boolean isCompleted() {
        return actualWinner != null;
    }

    public boolean isHomeWin() {
        return homeTeam != null && homeTeam.equals(actualWinner);
    }
}
