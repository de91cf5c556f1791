package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.config.AnalyticsProperties;
import com.tony.hockeyAnalytics.model.EventType;
import com.tony.hockeyAnalytics.model.GameEvent;
import com.tony.hockeyAnalytics.model.PlayType;
import com.tony.hockeyAnalytics.model.ShotRecord;
import com.tony.hockeyAnalytics.model.Zone;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Métriques secondaires de possession : revirements en zone neutre convertis en tirs,
 * zone d'origine des tirs cadrés, tirs en rush vs forecheck/cycle.
 */
@Service
@RequiredArgsConstructor
public class ZonePossessionAnalyzer {

    private final EventClassifier classifier;
    private final AnalyticsProperties properties;

    /** Un suivi par match, alimenté dans l'ordre des événements. */
    public Tracker newTracker() {
        return new Tracker();
    }

    @Getter
    public static class ZoneCounters {
        private int nzTurnovers;
        private int nzTurnoversToShots;
        private int ozOriginatingShots;
        private int nzOriginatingShots;
        private int dzOriginatingShots;
        private int rushShots;
        private int forecheckCycleShots;
    }

    private record Turnover(Long teamId, int period, double x, double y, int elapsedSeconds) {}

    public class Tracker {
        private final Map<String, ZoneCounters> counters = new HashMap<>();
        private final List<Turnover> openTurnovers = new ArrayList<>();

        /**
         * @param shot valeur du tir si l'événement est une tentative, sinon null
         */
        public void accept(GameEvent event, String periodLabel, ShotRecord shot) {
            if (event.getType() == EventType.GIVEAWAY) {
                recordTurnover(event, periodLabel);
                return;
            }
            if (shot == null || !event.getType().isOnGoal() || !event.hasLocation()) return;

            ZoneCounters own = countersFor(event.getTeamId(), periodLabel);
            switch (shot.getZoneOfOrigin()) {
                case OFFENSIVE -> own.ozOriginatingShots++;
                case NEUTRAL -> own.nzOriginatingShots++;
                case DEFENSIVE -> own.dzOriginatingShots++;
            }
            if (shot.getPlayType() == PlayType.RUSH) own.rushShots++;
            else own.forecheckCycleShots++;

            attributeToTurnover(event, periodLabel);
        }

        public ZoneCounters countersFor(Long teamId, String periodLabel) {
            return counters.computeIfAbsent(teamId + ":" + periodLabel, k -> new ZoneCounters());
        }

        private void recordTurnover(GameEvent giveaway, String periodLabel) {
            if (!giveaway.hasLocation()) return;
            if (classifier.zoneOf(giveaway.getX(), giveaway.getY()) != Zone.NEUTRAL) return;
            countersFor(giveaway.getTeamId(), periodLabel).nzTurnovers++;
            openTurnovers.add(new Turnover(giveaway.getTeamId(), giveaway.getPeriod(),
                    giveaway.getX(), giveaway.getY(), giveaway.getElapsedSeconds()));
        }

        // Proxy spatial : le tir adverse doit partir près du lieu du revirement.
        // Chaque revirement n'est converti qu'une fois.
        private void attributeToTurnover(GameEvent shot, String periodLabel) {
            for (int i = openTurnovers.size() - 1; i >= 0; i--) {
                Turnover turnover = openTurnovers.get(i);
                if (turnover.period() != shot.getPeriod() || Objects.equals(turnover.teamId(), shot.getTeamId())) {
                    continue;
                }
                // Repère du tireur = repère du revirement retourné
                double distance = Math.hypot(shot.getX() + turnover.x(), shot.getY() + turnover.y());
                if (distance >= properties.getTurnoverRadius() || !withinTimeWindow(turnover, shot)) continue;

                countersFor(turnover.teamId(), periodLabel).nzTurnoversToShots++;
                openTurnovers.remove(i);
                return;
            }
        }

        private boolean withinTimeWindow(Turnover turnover, GameEvent shot) {
            int window = properties.getTurnoverTimeWindowSeconds();
            if (window <= 0) return true;
            int shotTime = shot.getElapsedSeconds();
            if (shotTime < 0 || turnover.elapsedSeconds() < 0) return false;
            int delta = shotTime - turnover.elapsedSeconds();
            return delta >= 0 && delta <= window;
        }
    }
}
