package com.tony.hockeyAnalytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Valeur dérivée d'un tir, calculée une seule fois.
 * {@code zoneOfOrigin} est nul quand le tir n'a pas de position.
 */
@Value
@Builder
public class ShotRecord {
    int eventIndex;
    Long teamId;
    int period;
    EventType eventType;
    double xg;
    double gameScoreDelta;
    Zone zoneOfOrigin;
    PlayType playType;
    boolean highDanger;
    String strength;
}
