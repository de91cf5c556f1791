package com.tony.hockeyAnalytics.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Ensemble fermé des types d'événements gérés par le moteur.
 * Les codes correspondent aux libellés du flux play-by-play.
 */
public enum EventType {
    GOAL("goal"),
    SHOT_ON_GOAL("shot-on-goal"),
    MISSED_SHOT("missed-shot"),
    BLOCKED_SHOT("blocked-shot"),
    FACEOFF("faceoff"),
    HIT("hit"),
    GIVEAWAY("giveaway"),
    TAKEAWAY("takeaway"),
    PENALTY("penalty"),
    PASS("pass");

    private final String code;

    EventType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<EventType> fromCode(String code) {
        if (code == null) return Optional.empty();
        String normalized = code.trim().toLowerCase();
        return Arrays.stream(values()).filter(t -> t.code.equals(normalized)).findFirst();
    }

    /** Tentative de tir (Corsi) : but, tir cadré, raté ou bloqué. */
    public boolean isShotAttempt() {
        return switch (this) {
            case GOAL, SHOT_ON_GOAL, MISSED_SHOT, BLOCKED_SHOT -> true;
            case FACEOFF, HIT, GIVEAWAY, TAKEAWAY, PENALTY, PASS -> false;
        };
    }

    /** Tir qui atteint le gardien (les buts comptent comme tirs). */
    public boolean isOnGoal() {
        return switch (this) {
            case GOAL, SHOT_ON_GOAL -> true;
            case MISSED_SHOT, BLOCKED_SHOT, FACEOFF, HIT, GIVEAWAY, TAKEAWAY, PENALTY, PASS -> false;
        };
    }
}
