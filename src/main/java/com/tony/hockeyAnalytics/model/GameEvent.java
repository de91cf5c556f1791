package com.tony.hockeyAnalytics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Une action de jeu telle que livrée par le flux amont. Jamais modifiée par le moteur.
 * Les coordonnées sont exprimées dans le repère d'attaque de l'équipe qui agit
 * (but adverse en (89, 0)). Une mise au jeu appartient à l'équipe qui la gagne.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GameEvent {

    private static final int DEFAULT_PENALTY_MINUTES = 2;

    EventType type;
    Long teamId;
    int period;
    String periodType;
    String timeInPeriod;
    Double x;
    Double y;
    String shotType;
    String situationCode;
    Integer penaltyMinutes;

    Long playerId;
    Long assist1PlayerId;
    Long assist2PlayerId;
    // Perdant de la mise au jeu ou joueur qui provoque la pénalité
    Long opposingPlayerId;

    /** Une position (0, 0) est traitée comme absente. */
    @JsonIgnore
    public boolean hasLocation() {
        if (x == null || y == null) return false;
        return x != 0.0 || y != 0.0;
    }

    @JsonIgnore
    public PeriodType getEffectivePeriodType() {
        return PeriodType.fromCode(periodType, period);
    }

    @JsonIgnore
    public int getPenaltyMinutesOrDefault() {
        return penaltyMinutes != null ? penaltyMinutes : DEFAULT_PENALTY_MINUTES;
    }

    /** Secondes écoulées dans la période ("MM:SS"), -1 si illisible. */
    @JsonIgnore
    public int getElapsedSeconds() {
        if (timeInPeriod == null) return -1;
        String[] parts = timeInPeriod.trim().split(":");
        if (parts.length != 2) return -1;
        try {
            return Integer.parseInt(parts[0]) * 60 + Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
