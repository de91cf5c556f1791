package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.config.AnalyticsProperties;
import com.tony.hockeyAnalytics.model.EventType;
import com.tony.hockeyAnalytics.model.GameEvent;
import com.tony.hockeyAnalytics.model.GameMetrics;
import com.tony.hockeyAnalytics.model.PeriodMetrics;
import com.tony.hockeyAnalytics.model.ShotRecord;
import com.tony.hockeyAnalytics.model.TeamGameMetrics;
import com.tony.hockeyAnalytics.model.dto.GameData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PeriodAggregatorTest {

    private static final long HOME = 100L;
    private static final long AWAY = 200L;

    private PeriodAggregator aggregator;

    @BeforeEach
    void setUp() {
        AnalyticsProperties properties = new AnalyticsProperties();
        EventClassifier classifier = new EventClassifier(properties);
        aggregator = new PeriodAggregator(classifier, new ShotValuationModel(properties),
                new GameScoreCalculator(), new ZonePossessionAnalyzer(classifier, properties));
    }

    @Test
    @DisplayName("Sans tir ni mise au jeu, Corsi% et mises au jeu% valent 50")
    void noShotsGivesNeutralPercentages() {
        GameMetrics metrics = aggregator.aggregate(game(List.of(
                event(EventType.HIT, HOME, 1, 10.0, 5.0),
                event(EventType.HIT, AWAY, 1, -10.0, 5.0))));

        PeriodMetrics p1 = metrics.getHome().period(1);
        assertThat(p1.getCorsiPct()).isEqualTo(50.0);
        assertThat(p1.getFaceoffPct()).isEqualTo(50.0);
        assertThat(p1.getHits()).isEqualTo(1);
        assertThat(metrics.getAway().period(2).getCorsiPct()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Corsi : buts, tirs cadrés, ratés et bloqués contre ceux de l'adversaire")
    void corsiCountsAllAttempts() {
        GameMetrics metrics = aggregator.aggregate(game(List.of(
                event(EventType.SHOT_ON_GOAL, HOME, 1, 60.0, 10.0),
                event(EventType.MISSED_SHOT, HOME, 1, 50.0, -20.0),
                event(EventType.GOAL, HOME, 1, 80.0, 5.0),
                event(EventType.BLOCKED_SHOT, AWAY, 1, 55.0, 0.0))));

        PeriodMetrics home = metrics.getHome().period(1);
        PeriodMetrics away = metrics.getAway().period(1);
        assertThat(home.getCorsiFor()).isEqualTo(3);
        assertThat(home.getCorsiAgainst()).isEqualTo(1);
        assertThat(home.getCorsiPct()).isEqualTo(75.0);
        assertThat(away.getCorsiPct()).isEqualTo(25.0);
        assertThat(home.getShots()).isEqualTo(2);
        assertThat(home.getGoals()).isEqualTo(1);
        // Le tir bloqué de l'extérieur est un contre à domicile
        assertThat(home.getBlockedShots()).isEqualTo(1);
        assertThat(away.getBlockedShots()).isZero();
    }

    @Test
    @DisplayName("Mises au jeu : l'événement appartient au gagnant")
    void faceoffPercentage() {
        GameMetrics metrics = aggregator.aggregate(game(List.of(
                event(EventType.FACEOFF, HOME, 1, 0.0, 0.0),
                event(EventType.FACEOFF, HOME, 1, 69.0, 22.0),
                event(EventType.FACEOFF, AWAY, 1, 69.0, -22.0))));

        assertThat(metrics.getHome().period(1).getFaceoffPct()).isCloseTo(66.667, within(0.001));
        assertThat(metrics.getAway().period(1).getFaceoffLosses()).isEqualTo(2);
    }

    @Test
    @DisplayName("Une pénalité donne une supériorité à l'adversaire et des minutes au fautif")
    void penaltyGivesPowerPlayAttemptToOpponent() {
        GameMetrics metrics = aggregator.aggregate(game(List.of(
                event(EventType.PENALTY, AWAY, 2, 10.0, 0.0).toBuilder().penaltyMinutes(4).build(),
                event(EventType.PENALTY, AWAY, 2, 10.0, 0.0))));

        assertThat(metrics.getAway().period(2).getPenaltyMinutes()).isEqualTo(6);
        assertThat(metrics.getAway().period(2).getPowerPlayAttempts()).isZero();
        assertThat(metrics.getHome().period(2).getPowerPlayAttempts()).isEqualTo(2);
        assertThat(metrics.getHome().period(2).getPenaltyMinutes()).isZero();
    }

    @Test
    @DisplayName("But en supériorité numérique d'après le code de situation")
    void powerPlayGoal() {
        GameMetrics metrics = aggregator.aggregate(game(List.of(
                event(EventType.GOAL, HOME, 3, 85.0, 4.0).toBuilder().situationCode("1451").build(),
                event(EventType.GOAL, AWAY, 3, 85.0, 4.0).toBuilder().situationCode("1551").build())));

        assertThat(metrics.getHome().period(3).getPowerPlayGoals()).isEqualTo(1);
        assertThat(metrics.getAway().period(3).getPowerPlayGoals()).isZero();
    }

    @Test
    @DisplayName("Les événements d'équipes inconnues sont ignorés")
    void unknownTeamsAreIgnored() {
        GameMetrics metrics = aggregator.aggregate(game(List.of(
                event(EventType.SHOT_ON_GOAL, 999L, 1, 60.0, 0.0),
                event(EventType.HIT, HOME, 1, 10.0, 0.0))));

        assertThat(metrics.getShots()).isEmpty();
        assertThat(metrics.getHome().getTotals().getCorsiFor()).isZero();
        assertThat(metrics.getAway().getTotals().getCorsiFor()).isZero();
    }

    @Test
    @DisplayName("La prolongation est suivie à part, hors totaux réglementaires")
    void overtimeIsTrackedSeparately() {
        GameMetrics metrics = aggregator.aggregate(game(List.of(
                event(EventType.SHOT_ON_GOAL, HOME, 1, 60.0, 0.0),
                event(EventType.GOAL, HOME, 4, 80.0, 2.0))));

        TeamGameMetrics home = metrics.getHome();
        assertThat(home.getTotals().getGoals()).isZero();
        assertThat(home.getTotals().getShots()).isEqualTo(1);
        assertThat(home.getExtraPeriods()).extracting(PeriodMetrics::getLabel).containsExactly("ot1");
        assertThat(home.getExtraPeriods().get(0).getGoals()).isEqualTo(1);
        assertThat(metrics.getAway().getExtraPeriods()).extracting(PeriodMetrics::getLabel).containsExactly("ot1");
    }

    @Test
    @DisplayName("Les totaux sont la somme des trois périodes")
    void totalsAreSumOfPeriods() {
        GameMetrics metrics = aggregator.aggregate(game(List.of(
                event(EventType.SHOT_ON_GOAL, HOME, 1, 60.0, 0.0),
                event(EventType.SHOT_ON_GOAL, HOME, 2, 70.0, 5.0),
                event(EventType.MISSED_SHOT, AWAY, 2, 40.0, 10.0),
                event(EventType.SHOT_ON_GOAL, HOME, 3, 80.0, -5.0),
                event(EventType.TAKEAWAY, HOME, 3, 0.0, 10.0))));

        TeamGameMetrics home = metrics.getHome();
        double periodXg = home.getRegulation().stream().mapToDouble(PeriodMetrics::getXg).sum();
        double shotXg = metrics.getShots().stream().filter(s -> s.getTeamId() == HOME).mapToDouble(ShotRecord::getXg).sum();

        assertThat(home.getTotals().getShots()).isEqualTo(3);
        assertThat(home.getTotals().getTakeaways()).isEqualTo(1);
        assertThat(home.getTotals().getCorsiPct()).isEqualTo(75.0);
        assertThat(home.getTotals().getXg()).isCloseTo(periodXg, within(1e-12));
        assertThat(periodXg).isCloseTo(shotXg, within(1e-12));
    }

    @Test
    @DisplayName("Game Score par période et par joueur")
    void gameScorePerPeriodAndPlayer() {
        GameMetrics metrics = aggregator.aggregate(game(List.of(
                event(EventType.GOAL, HOME, 1, 80.0, 5.0).toBuilder().playerId(1L).assist1PlayerId(2L).assist2PlayerId(3L).build(),
                event(EventType.FACEOFF, HOME, 1, 0.0, 0.0).toBuilder().playerId(1L).opposingPlayerId(50L).build())));

        assertThat(metrics.getHome().period(1).getGameScore()).isCloseTo(2.01, within(1e-9));
        assertThat(metrics.getHome().getPlayerGameScores()).containsEntry(2L, 0.70);
        assertThat(metrics.getHome().getPlayerGameScores().get(1L)).isCloseTo(0.76, within(1e-9));
        // Le perdant de la mise au jeu est rattaché à l'autre équipe
        assertThat(metrics.getAway().getPlayerGameScores()).containsEntry(50L, -0.01);
        assertThat(metrics.getAway().period(1).getGameScore()).isZero();
    }

    @Test
    @DisplayName("Revirement en zone neutre suivi d'un tir adverse à proximité")
    void neutralZoneTurnoverConvertedToShot() {
        GameMetrics metrics = aggregator.aggregate(game(List.of(
                event(EventType.GIVEAWAY, AWAY, 1, 10.0, 5.0),
                event(EventType.SHOT_ON_GOAL, HOME, 1, 30.0, 0.0),
                event(EventType.SHOT_ON_GOAL, HOME, 1, 30.0, 0.0))));

        PeriodMetrics away = metrics.getAway().period(1);
        PeriodMetrics home = metrics.getHome().period(1);
        assertThat(away.getNzTurnovers()).isEqualTo(1);
        // Un revirement n'est converti qu'une fois
        assertThat(away.getNzTurnoversToShots()).isEqualTo(1);
        assertThat(home.getNzTurnoversToShots()).isZero();
        assertThat(home.getOzOriginatingShots()).isEqualTo(2);
    }

    @Test
    @DisplayName("Un tir lointain n'est pas attribué au revirement")
    void distantShotIsNotAttributed() {
        GameMetrics metrics = aggregator.aggregate(game(List.of(
                event(EventType.GIVEAWAY, AWAY, 1, 20.0, 5.0),
                event(EventType.SHOT_ON_GOAL, HOME, 1, 80.0, 0.0))));

        assertThat(metrics.getAway().period(1).getNzTurnovers()).isEqualTo(1);
        assertThat(metrics.getAway().period(1).getNzTurnoversToShots()).isZero();
    }

    @Test
    @DisplayName("Rush et forecheck ne comptent que les tirs cadrés localisés")
    void playTypeCountersUseLocatedShotsOnGoal() {
        GameMetrics metrics = aggregator.aggregate(game(List.of(
                event(EventType.TAKEAWAY, HOME, 1, -10.0, 0.0),
                event(EventType.FACEOFF, HOME, 1, 69.0, 22.0),
                event(EventType.SHOT_ON_GOAL, HOME, 1, 70.0, 10.0),
                event(EventType.SHOT_ON_GOAL, HOME, 1, null, null),
                event(EventType.MISSED_SHOT, HOME, 1, 75.0, 0.0))));

        PeriodMetrics home = metrics.getHome().period(1);
        assertThat(home.getRushShots()).isEqualTo(1);
        assertThat(home.getForecheckCycleShots()).isZero();
        assertThat(home.getLocatedShots()).isEqualTo(1);
        assertThat(home.getShots()).isEqualTo(2);
    }

    @Test
    @DisplayName("Tir bloqué : tentative pour le tireur, contre et Game Score pour l'équipe qui bloque")
    void blockedShotCreditsBlocker() {
        GameMetrics metrics = aggregator.aggregate(game(List.of(
                event(EventType.BLOCKED_SHOT, HOME, 2, 55.0, 10.0).toBuilder().playerId(11L).opposingPlayerId(77L).build())));

        PeriodMetrics home = metrics.getHome().period(2);
        PeriodMetrics away = metrics.getAway().period(2);
        assertThat(home.getCorsiFor()).isEqualTo(1);
        assertThat(away.getCorsiAgainst()).isEqualTo(1);
        assertThat(home.getBlockedShots()).isZero();
        assertThat(away.getBlockedShots()).isEqualTo(1);
        assertThat(home.getGameScore()).isZero();
        assertThat(away.getGameScore()).isCloseTo(0.05, within(1e-9));
        assertThat(metrics.getHome().getPlayerGameScores()).doesNotContainKey(11L);
        assertThat(metrics.getAway().getPlayerGameScores()).containsEntry(77L, 0.05);
        assertThat(metrics.getAway().getTotals().getBlockedShots()).isEqualTo(1);
    }

    @Test
    @DisplayName("Deux passages sur la même liste donnent exactement les mêmes métriques")
    void aggregationIsIdempotent() {
        GameData game = game(List.of(
                event(EventType.FACEOFF, HOME, 1, 0.0, 0.0),
                event(EventType.TAKEAWAY, AWAY, 1, -5.0, 3.0),
                event(EventType.SHOT_ON_GOAL, AWAY, 1, 45.0, 12.0),
                event(EventType.GIVEAWAY, HOME, 2, 5.0, -8.0),
                event(EventType.GOAL, AWAY, 2, 82.0, 4.0).toBuilder().shotType("tip-in").build(),
                event(EventType.PENALTY, HOME, 3, 30.0, 0.0),
                event(EventType.BLOCKED_SHOT, AWAY, 3, 50.0, 20.0).toBuilder().situationCode("1541").build()));

        GameMetrics first = aggregator.aggregate(game);
        GameMetrics second = aggregator.aggregate(game);

        assertThat(second).isEqualTo(first);
        assertThat(second.toFlatMap()).isEqualTo(first.toFlatMap());
    }

    @Test
    @DisplayName("La sortie à plat est préfixée par le lieu et suffixée par la période")
    void flatMapKeys() {
        GameMetrics metrics = aggregator.aggregate(game(List.of(event(EventType.HIT, HOME, 1, 10.0, 0.0))));

        Map<String, Object> flat = metrics.toFlatMap();

        assertThat(flat).containsEntry("home_hits_p1", 1)
                .containsEntry("away_hits_p1", 0)
                .containsEntry("home_corsi_pct_total", 50.0)
                .containsKeys("home_xg_p3", "away_nz_turnovers_to_shots_total", "game_id");
    }

    private static GameData game(List<GameEvent> events) {
        return GameData.builder()
                .gameId("2025020001")
                .gameDate(LocalDate.of(2025, 10, 8))
                .homeTeamId(HOME)
                .awayTeamId(AWAY)
                .homeAbbrev("MTL")
                .awayAbbrev("TOR")
                .homeScore(3)
                .awayScore(2)
                .events(events)
                .build();
    }

    private static GameEvent event(EventType type, long team, int period, Double x, Double y) {
        return GameEvent.builder().type(type).teamId(team).period(period).x(x).y(y).build();
    }
}
