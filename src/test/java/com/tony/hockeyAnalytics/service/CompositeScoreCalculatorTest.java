package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.model.CompositeScores;
import com.tony.hockeyAnalytics.model.PeriodMetrics;
import com.tony.hockeyAnalytics.model.TeamGameMetrics;
import com.tony.hockeyAnalytics.model.Venue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CompositeScoreCalculatorTest {

    private final CompositeScoreCalculator calculator = new CompositeScoreCalculator();

    @Test
    @DisplayName("Calcule les six métriques composites depuis les totaux")
    void computesCompositeScores() {
        PeriodMetrics p1 = PeriodMetrics.builder().label("p1").goals(1).build();
        PeriodMetrics p2 = PeriodMetrics.builder().label("p2").goals(0).build();
        PeriodMetrics p3 = PeriodMetrics.builder().label("p3").goals(3).build();
        PeriodMetrics totals = PeriodMetrics.builder().label("total")
                .goals(4)
                .corsiPct(60.0)
                .faceoffPct(40.0)
                .takeaways(3).giveaways(1)
                .ozOriginatingShots(15).nzOriginatingShots(4).dzOriginatingShots(1)
                .xg(3.2)
                .highDangerChances(7)
                .build();

        CompositeScores scores = calculator.compute(team(List.of(p1, p2, p3), totals));

        assertThat(scores.pressure()).isEqualTo(60.0);
        assertThat(scores.possession()).isEqualTo(57.5);   // (40 + 75) / 2
        assertThat(scores.momentum()).isEqualTo(75.0);     // 50 + 50 * (3 - 1) / 4
        assertThat(scores.territorial()).isEqualTo(75.0);  // 15 / 20
        assertThat(scores.xg()).isEqualTo(3.2);
        assertThat(scores.hdc()).isEqualTo(7.0);
    }

    @Test
    @DisplayName("Match vide : valeurs neutres, jamais de division par zéro")
    void emptyGameGivesNeutralValues() {
        PeriodMetrics empty = PeriodMetrics.builder().label("p").corsiPct(50.0).faceoffPct(50.0).build();

        CompositeScores scores = calculator.compute(team(List.of(empty, empty, empty), empty));

        assertThat(scores.pressure()).isEqualTo(50.0);
        assertThat(scores.possession()).isEqualTo(50.0);
        assertThat(scores.momentum()).isEqualTo(50.0);
        assertThat(scores.territorial()).isEqualTo(50.0);
        assertThat(scores.xg()).isZero();
    }

    private static TeamGameMetrics team(List<PeriodMetrics> regulation, PeriodMetrics totals) {
        return TeamGameMetrics.builder()
                .teamId(1L)
                .teamAbbrev("MTL")
                .venue(Venue.HOME)
                .regulation(regulation)
                .extraPeriods(List.of())
                .totals(totals)
                .playerGameScores(Map.of())
                .build();
    }
}
