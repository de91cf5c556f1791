package com.tony.hockeyAnalytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Résultat du classement rush / forecheck-cycle, avec les indicateurs qui l'ont produit.
 */
@Value
@Builder
public class ShotOrigin {
    PlayType playType;
    double rushScore;
    boolean quickTransition;
    boolean zoneEntry;
    double forecheckScore;
    double cycleScore;
    boolean forecheck;
    boolean sustainedPressure;
}
