package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.model.EventType;
import com.tony.hockeyAnalytics.model.GameEvent;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Game Score : pondération linéaire fixe des actions individuelles.
 */
@Service
public class GameScoreCalculator {

    public static final double GOAL = 0.75;
    public static final double PRIMARY_ASSIST = 0.70;
    public static final double SECONDARY_ASSIST = 0.55;
    public static final double SHOT_ON_GOAL = 0.075;
    public static final double BLOCKED_SHOT = 0.05;
    public static final double PENALTY_DRAWN = 0.15;
    public static final double PENALTY_TAKEN = -0.15;
    public static final double FACEOFF_WIN = 0.01;
    public static final double FACEOFF_LOSS = -0.01;
    public static final double HIT = 0.15;
    public static final double TAKEAWAY = 0.15;
    public static final double GIVEAWAY = -0.15;

    /** Contribution de l'équipe qui agit (joueurs adverses exclus). */
    public double teamDelta(GameEvent event) {
        return switch (event.getType()) {
            case GOAL -> GOAL
                    + (event.getAssist1PlayerId() != null ? PRIMARY_ASSIST : 0.0)
                    + (event.getAssist2PlayerId() != null ? SECONDARY_ASSIST : 0.0);
            case SHOT_ON_GOAL -> SHOT_ON_GOAL;
            case PENALTY -> PENALTY_TAKEN;
            case FACEOFF -> FACEOFF_WIN;
            case HIT -> HIT;
            case TAKEAWAY -> TAKEAWAY;
            case GIVEAWAY -> GIVEAWAY;
            case MISSED_SHOT, BLOCKED_SHOT, PASS -> 0.0;
        };
    }

    /** Contribution de l'équipe adverse : le contre d'un tir revient à l'équipe qui bloque. */
    public double opponentDelta(GameEvent event) {
        return event.getType() == EventType.BLOCKED_SHOT ? BLOCKED_SHOT : 0.0;
    }

    /**
     * Contributions par joueur, y compris le joueur adverse impliqué
     * (perdant de la mise au jeu, joueur qui provoque la pénalité, joueur qui bloque le tir).
     */
    public Map<Long, Double> playerContributions(GameEvent event) {
        Map<Long, Double> contributions = new LinkedHashMap<>();
        switch (event.getType()) {
            case GOAL -> {
                add(contributions, event.getPlayerId(), GOAL);
                add(contributions, event.getAssist1PlayerId(), PRIMARY_ASSIST);
                add(contributions, event.getAssist2PlayerId(), SECONDARY_ASSIST);
            }
            case SHOT_ON_GOAL -> add(contributions, event.getPlayerId(), SHOT_ON_GOAL);
            case BLOCKED_SHOT -> add(contributions, event.getOpposingPlayerId(), BLOCKED_SHOT);
            case PENALTY -> {
                add(contributions, event.getPlayerId(), PENALTY_TAKEN);
                add(contributions, event.getOpposingPlayerId(), PENALTY_DRAWN);
            }
            case FACEOFF -> {
                add(contributions, event.getPlayerId(), FACEOFF_WIN);
                add(contributions, event.getOpposingPlayerId(), FACEOFF_LOSS);
            }
            case HIT -> add(contributions, event.getPlayerId(), HIT);
            case TAKEAWAY -> add(contributions, event.getPlayerId(), TAKEAWAY);
            case GIVEAWAY -> add(contributions, event.getPlayerId(), GIVEAWAY);
            case MISSED_SHOT, PASS -> { }
        }
        return contributions;
    }

    private void add(Map<Long, Double> contributions, Long playerId, double value) {
        if (playerId != null) contributions.merge(playerId, value, Double::sum);
    }
}
