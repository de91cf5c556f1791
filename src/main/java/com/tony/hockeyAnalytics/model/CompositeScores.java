package com.tony.hockeyAnalytics.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Les six métriques composites d'un match, ou leur moyenne glissante pour un profil.
 */
public record CompositeScores(double pressure, double possession, double momentum,
                              double territorial, double xg, double hdc) {

    public static CompositeScores neutral() {
        return fromMap(Map.of());
    }

    /** Une métrique absente prend sa valeur neutre. */
    public static CompositeScores fromMap(Map<CompositeMetric, Double> values) {
        return new CompositeScores(
                values.getOrDefault(CompositeMetric.PRESSURE, CompositeMetric.PRESSURE.getNeutralValue()),
                values.getOrDefault(CompositeMetric.POSSESSION, CompositeMetric.POSSESSION.getNeutralValue()),
                values.getOrDefault(CompositeMetric.MOMENTUM, CompositeMetric.MOMENTUM.getNeutralValue()),
                values.getOrDefault(CompositeMetric.TERRITORIAL, CompositeMetric.TERRITORIAL.getNeutralValue()),
                values.getOrDefault(CompositeMetric.XG, CompositeMetric.XG.getNeutralValue()),
                values.getOrDefault(CompositeMetric.HDC, CompositeMetric.HDC.getNeutralValue()));
    }

    public double value(CompositeMetric metric) {
        return switch (metric) {
            case PRESSURE -> pressure;
            case POSSESSION -> possession;
            case MOMENTUM -> momentum;
            case TERRITORIAL -> territorial;
            case XG -> xg;
            case HDC -> hdc;
        };
    }

    public Map<CompositeMetric, Double> toMap() {
        Map<CompositeMetric, Double> map = new EnumMap<>(CompositeMetric.class);
        for (CompositeMetric metric : CompositeMetric.values()) {
            map.put(metric, value(metric));
        }
        return map;
    }
}
