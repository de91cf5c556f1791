package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.config.PredictionProperties;
import com.tony.hockeyAnalytics.model.CompositeMetric;
import com.tony.hockeyAnalytics.model.CompositeWeights;
import com.tony.hockeyAnalytics.model.PredictionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ré-estimation grossière des poids composites à partir de l'historique des résultats :
 * chaque métrique est pondérée par sa corrélation avec la victoire à domicile.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WeightRefitService {

    private final PredictionProperties props;

    public CompositeWeights refit(CompositeWeights current, List<PredictionRecord> history) {
        List<PredictionRecord> usable = history.stream()
                .filter(PredictionRecord::isCompleted)
                .filter(r -> r.getAwayMetrics() != null && r.getHomeMetrics() != null)
                .toList();

        if (usable.size() < props.getRefitMinSamples()) {
            log.info("⏸️ Ré-estimation ignorée : {} matchs exploitables (minimum {})",
                    usable.size(), props.getRefitMinSamples());
            return current;
        }

        double[] outcomes = usable.stream().mapToDouble(r -> r.isHomeWin() ? 1.0 : 0.0).toArray();
        Map<CompositeMetric, Double> raw = new EnumMap<>(CompositeMetric.class);
        for (CompositeMetric metric : CompositeMetric.values()) {
            double[] diffs = usable.stream()
                    .mapToDouble(r -> valueOf(r.getHomeMetrics(), metric) - valueOf(r.getAwayMetrics(), metric))
                    .toArray();
            double r = correlation(diffs, outcomes);
            raw.put(metric, Math.max(r, props.getRefitWeightFloor()));
            log.debug("Corrélation {} : {}", metric, r);
        }
        CompositeWeights fitted = CompositeWeights.normalize(raw);

        // Mélange avec les poids actuels pour éviter les sauts brusques
        double blend = props.getRefitBlend();
        Map<CompositeMetric, Double> mixed = new EnumMap<>(CompositeMetric.class);
        for (CompositeMetric metric : CompositeMetric.values()) {
            mixed.put(metric, (1.0 - blend) * current.get(metric) + blend * fitted.get(metric));
        }
        CompositeWeights result = CompositeWeights.normalize(mixed);
        log.info("⚖️ Poids ré-estimés sur {} matchs : {}", usable.size(), result.asMap());
        return result;
    }

    // Corrélation non définie (série constante) = 0
    private double correlation(double[] x, double[] y) {
        double r = new PearsonsCorrelation().correlation(x, y);
        return Double.isFinite(r) ? r : 0.0;
    }

    private double valueOf(Map<CompositeMetric, Double> metrics, CompositeMetric metric) {
        return metrics.getOrDefault(metric, metric.getNeutralValue());
    }
}
