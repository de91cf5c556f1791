package com.tony.hockeyAnalytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class TeamGameMetrics {
    Long teamId;
    String teamAbbrev;
    Venue venue;
    // P1, P2, P3 dans l'ordre
    List<PeriodMetrics> regulation;
    // Prolongations et tirs au but, jamais moyennés avec le temps réglementaire
    List<PeriodMetrics> extraPeriods;
    PeriodMetrics totals;
    Map<Long, Double> playerGameScores;

    public PeriodMetrics period(int number) {
        return regulation.get(number - 1);
    }

    public Map<String, Object> toFlatMap(String prefix) {
        Map<String, Object> flat = new LinkedHashMap<>();
        for (PeriodMetrics pm : regulation) {
            pm.toMap().forEach((k, v) -> flat.put(prefix + k + "_" + pm.getLabel(), v));
        }
        for (PeriodMetrics pm : extraPeriods) {
            pm.toMap().forEach((k, v) -> flat.put(prefix + k + "_" + pm.getLabel(), v));
        }
        totals.toMap().forEach((k, v) -> flat.put(prefix + k + "_total", v));
        playerGameScores.forEach((player, score) -> flat.put(prefix + "game_score_player_" + player, score));
        return flat;
    }
}
