package com.tony.hockeyAnalytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sortie complète d'un match : métriques des deux équipes et valeur de chaque tir.
 */
@Value
@Builder
public class GameMetrics {
    String gameId;
    TeamGameMetrics away;
    TeamGameMetrics home;
    List<ShotRecord> shots;

    public TeamGameMetrics forVenue(Venue venue) {
        return venue == Venue.HOME ? home : away;
    }

    /** Map plate {metric} -> valeur, directement sérialisable. */
    public Map<String, Object> toFlatMap() {
        Map<String, Object> flat = new LinkedHashMap<>();
        flat.put("game_id", gameId);
        flat.put("away_team", away.getTeamAbbrev());
        flat.put("home_team", home.getTeamAbbrev());
        flat.putAll(away.toFlatMap("away_"));
        flat.putAll(home.toFlatMap("home_"));
        flat.put("shot_count", shots.size());
        return flat;
    }
}
