package com.tony.hockeyAnalytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Totaux d'une équipe sur une période, figés après le passage sur les événements.
 */
@Value
@Builder(toBuilder = true)
public class PeriodMetrics {
    String label;
    int goals;
    int shots;
    int missedShots;
    int blockedShots;
    int corsiFor;
    int corsiAgainst;
    double corsiPct;
    int faceoffWins;
    int faceoffLosses;
    double faceoffPct;
    int powerPlayGoals;
    int powerPlayAttempts;
    int hits;
    int giveaways;
    int takeaways;
    int penaltyMinutes;
    double xg;
    double gameScore;
    int highDangerChances;

    // --- Possession / zones ---
    int nzTurnovers;
    int nzTurnoversToShots;
    int ozOriginatingShots;
    int nzOriginatingShots;
    int dzOriginatingShots;
    int rushShots;
    int forecheckCycleShots;

    public int getLocatedShots() {
        return ozOriginatingShots + nzOriginatingShots + dzOriginatingShots;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("goals", goals);
        map.put("shots", shots);
        map.put("missed_shots", missedShots);
        map.put("blocked_shots", blockedShots);
        map.put("corsi_for", corsiFor);
        map.put("corsi_against", corsiAgainst);
        map.put("corsi_pct", corsiPct);
        map.put("faceoff_wins", faceoffWins);
        map.put("faceoff_losses", faceoffLosses);
        map.put("faceoff_pct", faceoffPct);
        map.put("pp_goals", powerPlayGoals);
        map.put("pp_attempts", powerPlayAttempts);
        map.put("hits", hits);
        map.put("giveaways", giveaways);
        map.put("takeaways", takeaways);
        map.put("pim", penaltyMinutes);
        map.put("xg", xg);
        map.put("game_score", gameScore);
        map.put("hdc", highDangerChances);
        map.put("nz_turnovers", nzTurnovers);
        map.put("nz_turnovers_to_shots", nzTurnoversToShots);
        map.put("oz_originating_shots", ozOriginatingShots);
        map.put("nz_originating_shots", nzOriginatingShots);
        map.put("dz_originating_shots", dzOriginatingShots);
        map.put("rush_shots", rushShots);
        map.put("forecheck_cycle_shots", forecheckCycleShots);
        return map;
    }
}
