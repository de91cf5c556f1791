package com.tony.hockeyAnalytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Photographie immuable d'un profil équipe / lieu au moment de la lecture.
 */
@Value
@Builder
public class TeamProfileSummary {
    String team;
    Venue venue;
    CompositeScores averages;
    Map<CompositeMetric, List<Double>> rollingLists;
    int gamesPlayed;
    double confidence;
    // 1 - coefficient de variation moyen, 0.5 sans historique
    double consistency;
    boolean defaultProfile;
}
