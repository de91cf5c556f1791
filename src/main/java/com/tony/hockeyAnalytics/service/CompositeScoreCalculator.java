package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.model.CompositeScores;
import com.tony.hockeyAnalytics.model.PeriodMetrics;
import com.tony.hockeyAnalytics.model.TeamGameMetrics;
import org.springframework.stereotype.Service;

/**
 * Réduit les métriques d'un match aux six valeurs composites ajoutées au profil de l'équipe.
 * Calculé sur le temps réglementaire uniquement.
 */
@Service
public class CompositeScoreCalculator {

    private static final double NEUTRAL = 50.0;

    public CompositeScores compute(TeamGameMetrics metrics) {
        PeriodMetrics totals = metrics.getTotals();

        double pressure = totals.getCorsiPct();
        double possession = (totals.getFaceoffPct() + takeawayShare(totals)) / 2.0;
        double territorial = totals.getLocatedShots() == 0
                ? NEUTRAL
                : totals.getOzOriginatingShots() * 100.0 / totals.getLocatedShots();

        return new CompositeScores(pressure, possession, momentum(metrics), territorial,
                totals.getXg(), totals.getHighDangerChances());
    }

    // 50 = stable ; > 50 si l'équipe a fini plus fort qu'elle n'a commencé
    private double momentum(TeamGameMetrics metrics) {
        int goals = metrics.getTotals().getGoals();
        if (goals == 0) return NEUTRAL;
        int delta = metrics.period(3).getGoals() - metrics.period(1).getGoals();
        return NEUTRAL + NEUTRAL * delta / goals;
    }

    private double takeawayShare(PeriodMetrics totals) {
        int turnovers = totals.getTakeaways() + totals.getGiveaways();
        if (turnovers == 0) return NEUTRAL;
        return totals.getTakeaways() * 100.0 / turnovers;
    }
}
