package com.tony.hockeyAnalytics.model;

/**
 * Métriques composites d'un match. La valeur neutre sert de profil par défaut
 * quand une équipe n'a aucun historique.
 */
public enum CompositeMetric {
    PRESSURE(50.0),
    POSSESSION(50.0),
    MOMENTUM(50.0),
    TERRITORIAL(50.0),
    XG(2.5),
    HDC(5.0);

    private final double neutralValue;

    CompositeMetric(double neutralValue) {
        this.neutralValue = neutralValue;
    }

    public double getNeutralValue() {
        return neutralValue;
    }
}
