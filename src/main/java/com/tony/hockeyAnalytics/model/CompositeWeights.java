package com.tony.hockeyAnalytics.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Pondération convexe des métriques composites. Toujours complète et de somme 1.
 */
public final class CompositeWeights {

    private static final double TOLERANCE = 1e-6;

    private final Map<CompositeMetric, Double> weights;

    private CompositeWeights(Map<CompositeMetric, Double> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    /** Valide une pondération déjà normalisée. */
    public static CompositeWeights of(Map<CompositeMetric, Double> raw) {
        Map<CompositeMetric, Double> copy = new EnumMap<>(CompositeMetric.class);
        double sum = 0.0;
        for (CompositeMetric metric : CompositeMetric.values()) {
            Double w = raw.get(metric);
            if (w == null || w < 0 || !Double.isFinite(w)) {
                throw new IllegalArgumentException("Poids invalide pour " + metric + " : " + w);
            }
            copy.put(metric, w);
            sum += w;
        }
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("La somme des poids doit valoir 1.0 (actuel : " + sum + ")");
        }
        return new CompositeWeights(copy);
    }

    /** Ramène des poids positifs quelconques à une somme de 1. */
    public static CompositeWeights normalize(Map<CompositeMetric, Double> raw) {
        double sum = 0.0;
        for (CompositeMetric metric : CompositeMetric.values()) {
            Double w = raw.get(metric);
            if (w == null || w < 0 || !Double.isFinite(w)) {
                throw new IllegalArgumentException("Poids invalide pour " + metric + " : " + w);
            }
            sum += w;
        }
        if (sum <= 0) {
            throw new IllegalArgumentException("Impossible de normaliser des poids tous nuls");
        }
        Map<CompositeMetric, Double> normalized = new EnumMap<>(CompositeMetric.class);
        for (CompositeMetric metric : CompositeMetric.values()) {
            normalized.put(metric, raw.get(metric) / sum);
        }
        return new CompositeWeights(normalized);
    }

    public double get(CompositeMetric metric) {
        return weights.get(metric);
    }

    public double sum() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public double score(CompositeScores scores) {
        double total = 0.0;
        for (CompositeMetric metric : CompositeMetric.values()) {
            total += weights.get(metric) * scores.value(metric);
        }
        return total;
    }

    public Map<CompositeMetric, Double> asMap() {
        return weights;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CompositeWeights other && weights.equals(other.weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "CompositeWeights" + weights;
    }
}
