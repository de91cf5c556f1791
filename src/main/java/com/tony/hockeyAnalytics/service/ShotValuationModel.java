package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.config.AnalyticsProperties;
import com.tony.hockeyAnalytics.model.EventType;
import com.tony.hockeyAnalytics.model.GameEvent;
import com.tony.hockeyAnalytics.model.StrengthState;
import com.tony.hockeyAnalytics.model.Zone;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Modèle d'expected goals par distance, angle, zone, type de tir et issue,
 * corrigé par le contexte (supériorité numérique, score, rebond).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShotValuationModel {

    public static final double MAX_XG = 0.95;

    // --- GÉOMÉTRIE DU BUT ---
    private static final double GOAL_X = 89.0;
    private static final double POST_HALF_WIDTH = 3.0;
    private static final double POST_SEPARATION = 2 * POST_HALF_WIDTH;

    // --- BANDES DE DISTANCE (base xG) ---
    private static final double[] DISTANCE_LIMITS = {10.0, 20.0, 35.0, 50.0};
    private static final double[] DISTANCE_BASE_XG = {0.25, 0.15, 0.08, 0.04, 0.02};

    // --- ZONE ---
    private static final double SLOT_MULTIPLIER = 1.5;
    private static final double NEAR_OZ_MULTIPLIER = 1.2;
    private static final double FAR_OZ_MULTIPLIER = 0.8;
    private static final double NZ_MULTIPLIER = 0.3;
    private static final double DZ_MULTIPLIER = 0.1;

    private static final Map<String, Double> SHOT_TYPE_MULTIPLIERS = Map.ofEntries(
            Map.entry("tip-in", 1.3), Map.entry("tip", 1.3), Map.entry("deflection", 1.3),
            Map.entry("deflected", 1.3), Map.entry("backhand", 1.3),
            Map.entry("wrist", 1.0), Map.entry("snap", 1.0),
            Map.entry("slap", 0.9), Map.entry("slapshot", 0.9),
            Map.entry("wrap-around", 1.1), Map.entry("wrap", 1.1),
            Map.entry("one-timer", 1.2), Map.entry("onetime", 1.2));

    // Point de vue du tireur, 5v5 = référence
    private static final Map<String, Double> STRENGTH_MULTIPLIERS = Map.of(
            "5v5", 1.0, "5v4", 1.45, "5v3", 2.10, "4v5", 0.55, "3v5", 0.35,
            "4v4", 1.05, "4v3", 1.55, "3v4", 0.60, "3v3", 1.15);

    private static final double REBOUND_MULTIPLIER = 2.13;

    private final AnalyticsProperties properties;

    /** Contexte de jeu au moment du tir. */
    public record ShotContext(StrengthState strength, int scoreDifferential, boolean rebound) {
        public static final ShotContext NEUTRAL = new ShotContext(StrengthState.EVEN, 0, false);
    }

    public ShotContext contextFor(GameEvent shot, List<GameEvent> preceding, boolean home, int scoreDifferential) {
        StrengthState strength = StrengthState.fromSituationCode(shot.getSituationCode(), home);
        return new ShotContext(strength, scoreDifferential, isRebound(shot, preceding));
    }

    public double expectedGoals(GameEvent shot) {
        return expectedGoals(shot, ShotContext.NEUTRAL);
    }

    public double expectedGoals(GameEvent shot, ShotContext context) {
        double x = shot.hasLocation() ? shot.getX() : 0.0;
        double y = shot.hasLocation() ? shot.getY() : 0.0;

        double xg = baseXg(distanceToGoal(x, y))
                * angleMultiplier(shotAngle(x, y))
                * zoneMultiplier(shot)
                * shotTypeMultiplier(shot.getShotType())
                * eventTypeMultiplier(shot.getType())
                * strengthMultiplier(context.strength())
                * scoreStateMultiplier(context.scoreDifferential())
                * (context.rebound() ? REBOUND_MULTIPLIER : 1.0);

        return Math.max(0.0, Math.min(xg, MAX_XG));
    }

    public double distanceToGoal(double x, double y) {
        return Math.hypot(GOAL_X - x, y);
    }

    /** Angle (degrés) sous lequel le tireur voit les deux poteaux. */
    public double shotAngle(double x, double y) {
        double toNearPost = Math.hypot(GOAL_X - x, y - POST_HALF_WIDTH);
        double toFarPost = Math.hypot(GOAL_X - x, y + POST_HALF_WIDTH);
        if (toNearPost == 0.0 || toFarPost == 0.0) return 0.0;

        double cos = (toNearPost * toNearPost + toFarPost * toFarPost - POST_SEPARATION * POST_SEPARATION)
                / (2 * toNearPost * toFarPost);
        return Math.toDegrees(Math.acos(Math.max(-1.0, Math.min(1.0, cos))));
    }

    public double baseXg(double distance) {
        for (int i = 0; i < DISTANCE_LIMITS.length; i++) {
            if (distance <= DISTANCE_LIMITS[i]) return DISTANCE_BASE_XG[i];
        }
        return DISTANCE_BASE_XG[DISTANCE_BASE_XG.length - 1];
    }

    public double angleMultiplier(double angle) {
        if (angle > 45) return 0.3;
        if (angle > 30) return 0.5;
        if (angle > 15) return 0.8;
        return 1.0;
    }

    public double zoneMultiplier(GameEvent shot) {
        if (!shot.hasLocation()) {
            log.debug("Tir sans position, multiplicateur de zone neutre");
            return 1.0;
        }
        double x = shot.getX();
        double absY = Math.abs(shot.getY());
        Zone zone = x > 25 ? Zone.OFFENSIVE : (x < -25 ? Zone.DEFENSIVE : Zone.NEUTRAL);
        return switch (zone) {
            case OFFENSIVE -> {
                if (x > 75 && absY < 15) yield SLOT_MULTIPLIER;
                if (x > 60 && absY < 25) yield NEAR_OZ_MULTIPLIER;
                yield FAR_OZ_MULTIPLIER;
            }
            case NEUTRAL -> NZ_MULTIPLIER;
            case DEFENSIVE -> DZ_MULTIPLIER;
        };
    }

    /** Enclave (slot) : la zone la plus dangereuse. */
    public boolean isHighDanger(GameEvent shot) {
        return shot.getType().isShotAttempt() && shot.hasLocation()
                && shot.getX() > 75 && Math.abs(shot.getY()) < 15;
    }

    public double shotTypeMultiplier(String shotType) {
        if (shotType == null || shotType.isBlank()) return 1.0;
        Double multiplier = SHOT_TYPE_MULTIPLIERS.get(shotType.trim().toLowerCase());
        if (multiplier == null) {
            log.debug("Type de tir inconnu '{}', multiplicateur 1.0", shotType);
            return 1.0;
        }
        return multiplier;
    }

    public double eventTypeMultiplier(EventType type) {
        return switch (type) {
            case GOAL, SHOT_ON_GOAL -> 1.0;
            case MISSED_SHOT -> 0.7;
            case BLOCKED_SHOT -> 0.5;
            case FACEOFF, HIT, GIVEAWAY, TAKEAWAY, PENALTY, PASS ->
                    throw new IllegalArgumentException("Pas une tentative de tir : " + type);
        };
    }

    public double strengthMultiplier(StrengthState strength) {
        return STRENGTH_MULTIPLIERS.getOrDefault(strength.label(), 1.0);
    }

    /** Écart de score du point de vue du tireur, égalité = 1.0. */
    public double scoreStateMultiplier(int differential) {
        if (differential <= -3) return 0.98;
        if (differential == -2) return 1.02;
        if (differential == -1) return 1.01;
        if (differential == 0) return 1.0;
        if (differential == 1) return 1.06;
        return 1.14;
    }

    // Tentative de la même équipe, même période, dans la fenêtre de rebond
    private boolean isRebound(GameEvent shot, List<GameEvent> preceding) {
        int shotTime = shot.getElapsedSeconds();
        if (shotTime < 0) return false;
        for (int i = preceding.size() - 1; i >= 0; i--) {
            GameEvent previous = preceding.get(i);
            if (previous.getPeriod() != shot.getPeriod()) return false;
            int previousTime = previous.getElapsedSeconds();
            if (previousTime < 0) continue;
            if (shotTime - previousTime > properties.getReboundWindowSeconds()) return false;
            if (previous.getType().isShotAttempt() && Objects.equals(previous.getTeamId(), shot.getTeamId())) {
                return true;
            }
        }
        return false;
    }
}
