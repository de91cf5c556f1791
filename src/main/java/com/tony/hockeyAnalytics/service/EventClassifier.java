package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.config.AnalyticsProperties;
import com.tony.hockeyAnalytics.model.EventType;
import com.tony.hockeyAnalytics.model.GameEvent;
import com.tony.hockeyAnalytics.model.PlayType;
import com.tony.hockeyAnalytics.model.ShotOrigin;
import com.tony.hockeyAnalytics.model.Zone;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Zone de glace d'un événement et origine (rush ou forecheck/cycle) d'un tir.
 * Les pondérations des indicateurs constituent la politique de classement.
 */
@Service
@RequiredArgsConstructor
public class EventClassifier {

    // Lignes bleues à +/- 25 pieds du centre
    private static final double BLUE_LINE = 25.0;

    // --- INDICATEURS RUSH ---
    private static final double RUSH_TAKEAWAY = 2.0;
    private static final double RUSH_OPPONENT_GIVEAWAY = 1.0;
    private static final double RUSH_BLOCKED_AGAINST = 1.0;
    private static final double RUSH_OZ_FACEOFF_WIN = 1.0;
    private static final double RUSH_NZ_FACEOFF_WIN = 0.5;
    private static final double RUSH_NZ_PASS = 0.5;
    private static final double RUSH_SHOT_ATTEMPT = 0.3;
    private static final double RUSH_THRESHOLD = 3.0;
    private static final double RUSH_ZONE_ENTRY_THRESHOLD = 2.0;

    // --- INDICATEURS FORECHECK / CYCLE ---
    private static final double FC_OZ_TAKEAWAY = 3.0;
    private static final double FC_OZ_HIT = 1.0;
    private static final double FC_DZ_GIVEAWAY_AGAINST = 2.0;
    private static final double CYCLE_OZ_PASS = 1.0;
    private static final double CYCLE_OZ_SHOT = 0.5;
    private static final double CYCLE_OZ_FACEOFF_WIN = 1.0;

    private final AnalyticsProperties properties;

    /** Partition exhaustive : chaque x appartient à une seule zone. */
    public Zone zoneOf(double x, double y) {
        if (x > BLUE_LINE) return Zone.OFFENSIVE;
        if (x < -BLUE_LINE) return Zone.DEFENSIVE;
        return Zone.NEUTRAL;
    }

    public Optional<Zone> zoneOf(GameEvent event) {
        if (!event.hasLocation()) return Optional.empty();
        return Optional.of(zoneOf(event.getX(), event.getY()));
    }

    /**
     * @param shot      la tentative de tir à classer
     * @param preceding tous les événements du match qui précèdent le tir, dans l'ordre
     */
    public ShotOrigin classifyShotOrigin(GameEvent shot, List<GameEvent> preceding) {
        Long team = shot.getTeamId();

        // 1. Rush : fenêtre courte
        double rushScore = 0.0;
        boolean quickTransition = false;
        boolean zoneEntry = false;
        for (GameEvent e : window(preceding, shot.getPeriod(), properties.getRushLookback())) {
            boolean own = Objects.equals(e.getTeamId(), team);
            Optional<Zone> zone = zoneOf(e);
            switch (e.getType()) {
                case TAKEAWAY -> {
                    if (own) {
                        rushScore += RUSH_TAKEAWAY;
                        quickTransition = true;
                    }
                }
                case GIVEAWAY -> {
                    if (!own) rushScore += RUSH_OPPONENT_GIVEAWAY;
                }
                case BLOCKED_SHOT -> {
                    if (!own) rushScore += RUSH_BLOCKED_AGAINST;
                    else rushScore += RUSH_SHOT_ATTEMPT;
                }
                case FACEOFF -> {
                    if (own && zone.isPresent()) {
                        if (zone.get() == Zone.OFFENSIVE) {
                            rushScore += RUSH_OZ_FACEOFF_WIN;
                            zoneEntry = true;
                        } else if (zone.get() == Zone.NEUTRAL) {
                            rushScore += RUSH_NZ_FACEOFF_WIN;
                        }
                    }
                }
                case PASS -> {
                    if (own && zone.orElse(null) == Zone.NEUTRAL) rushScore += RUSH_NZ_PASS;
                }
                case GOAL, SHOT_ON_GOAL, MISSED_SHOT -> {
                    if (own) rushScore += RUSH_SHOT_ATTEMPT;
                }
                case HIT, PENALTY -> { }
            }
        }
        boolean rush = (quickTransition && zoneEntry)
                || rushScore >= RUSH_THRESHOLD
                || (zoneEntry && rushScore >= RUSH_ZONE_ENTRY_THRESHOLD);

        // 2. Forecheck / cycle : fenêtre longue
        double forecheckScore = 0.0;
        double cycleScore = 0.0;
        boolean forecheck = false;
        boolean sustainedPressure = false;
        for (GameEvent e : window(preceding, shot.getPeriod(), properties.getForecheckLookback())) {
            boolean own = Objects.equals(e.getTeamId(), team);
            Zone zone = zoneOf(e).orElse(null);
            // Les événements adverses sont dans le repère de l'adversaire
            if (!own) {
                if (e.getType() == EventType.GIVEAWAY && zone == Zone.DEFENSIVE) {
                    forecheckScore += FC_DZ_GIVEAWAY_AGAINST;
                    forecheck = true;
                }
                continue;
            }
            if (zone != Zone.OFFENSIVE) continue;
            switch (e.getType()) {
                case TAKEAWAY -> {
                    forecheckScore += FC_OZ_TAKEAWAY;
                    forecheck = true;
                }
                case HIT -> forecheckScore += FC_OZ_HIT;
                case PASS -> {
                    cycleScore += CYCLE_OZ_PASS;
                    sustainedPressure = true;
                }
                case GOAL, SHOT_ON_GOAL, MISSED_SHOT, BLOCKED_SHOT -> cycleScore += CYCLE_OZ_SHOT;
                case FACEOFF -> cycleScore += CYCLE_OZ_FACEOFF_WIN;
                case GIVEAWAY, PENALTY -> { }
            }
        }

        // Pas de troisième catégorie : tout tir non-rush est forecheck/cycle
        return ShotOrigin.builder()
                .playType(rush ? PlayType.RUSH : PlayType.FORECHECK_CYCLE)
                .rushScore(rushScore)
                .quickTransition(quickTransition)
                .zoneEntry(zoneEntry)
                .forecheckScore(forecheckScore)
                .cycleScore(cycleScore)
                .forecheck(forecheck)
                .sustainedPressure(sustainedPressure)
                .build();
    }

    // Les N derniers événements avant le tir, limités à sa période
    private List<GameEvent> window(List<GameEvent> preceding, int period, int size) {
        int from = Math.max(0, preceding.size() - size);
        return preceding.subList(from, preceding.size()).stream()
                .filter(e -> e.getPeriod() == period)
                .toList();
    }
}
