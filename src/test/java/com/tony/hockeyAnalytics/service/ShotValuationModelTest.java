package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.config.AnalyticsProperties;
import com.tony.hockeyAnalytics.model.EventType;
import com.tony.hockeyAnalytics.model.GameEvent;
import com.tony.hockeyAnalytics.model.StrengthState;
import com.tony.hockeyAnalytics.service.ShotValuationModel.ShotContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ShotValuationModelTest {

    private ShotValuationModel model;

    @BeforeEach
    void setUp() {
        model = new ShotValuationModel(new AnalyticsProperties());
    }

    @Test
    @DisplayName("Tir du poignet cadré dans l'enclave, près et de face : 0.25 x 1.5 = 0.375")
    void slotWristShotOnGoal() {
        GameEvent shot = shot(EventType.SHOT_ON_GOAL, 88.0, 9.0, "wrist");

        assertThat(model.distanceToGoal(88.0, 9.0)).isLessThanOrEqualTo(10.0);
        assertThat(model.shotAngle(88.0, 9.0)).isLessThanOrEqualTo(15.0);
        assertThat(model.expectedGoals(shot)).isCloseTo(0.375, within(1e-9));
    }

    @Test
    @DisplayName("Le contexte neutre (5v5, égalité, pas de rebond) ne change rien")
    void neutralContextKeepsBaseValue() {
        GameEvent shot = shot(EventType.SHOT_ON_GOAL, 88.0, 9.0, "wrist").toBuilder().situationCode("1551").build();

        ShotContext context = model.contextFor(shot, List.of(), true, 0);

        assertThat(context.strength()).isEqualTo(StrengthState.EVEN);
        assertThat(context.rebound()).isFalse();
        assertThat(model.expectedGoals(shot, context)).isCloseTo(0.375, within(1e-9));
    }

    @Test
    @DisplayName("xG toujours dans [0, 0.95]")
    void expectedGoalsAlwaysBounded() {
        String[] types = {"wrist", "slap", "tip-in", "backhand", "wrap-around", "one-timer", "knuckle", null};
        EventType[] events = {EventType.GOAL, EventType.SHOT_ON_GOAL, EventType.MISSED_SHOT, EventType.BLOCKED_SHOT};
        ShotContext extreme = new ShotContext(new StrengthState(5, 3), 2, true);

        for (double x = -99; x <= 99; x += 3) {
            for (double y = -42; y <= 42; y += 3) {
                for (String type : types) {
                    for (EventType eventType : events) {
                        GameEvent shot = shot(eventType, x, y, type);
                        assertThat(model.expectedGoals(shot)).isBetween(0.0, 0.95);
                        assertThat(model.expectedGoals(shot, extreme)).isBetween(0.0, 0.95);
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Le produit est plafonné à 0.95")
    void valueIsClampedAtMaximum() {
        GameEvent tip = shot(EventType.SHOT_ON_GOAL, 88.0, 9.0, "tip-in");
        ShotContext context = new ShotContext(new StrengthState(5, 3), 0, true);

        assertThat(model.expectedGoals(tip, context)).isEqualTo(ShotValuationModel.MAX_XG);
    }

    @Test
    @DisplayName("Les buts utilisent le même modèle (pas de 1.0 forcé)")
    void goalsAreValuedLikeShots() {
        GameEvent goal = shot(EventType.GOAL, 88.0, 9.0, "wrist");
        assertThat(model.expectedGoals(goal)).isCloseTo(0.375, within(1e-9));
    }

    @Test
    @DisplayName("Tir raté 0.7x, tir bloqué 0.5x")
    void eventTypeMultipliers() {
        assertThat(model.expectedGoals(shot(EventType.MISSED_SHOT, 88.0, 9.0, "wrist"))).isCloseTo(0.2625, within(1e-9));
        assertThat(model.expectedGoals(shot(EventType.BLOCKED_SHOT, 88.0, 9.0, "wrist"))).isCloseTo(0.1875, within(1e-9));
    }

    @Test
    @DisplayName("Bandes de distance")
    void distanceBands() {
        assertThat(model.baseXg(10.0)).isEqualTo(0.25);
        assertThat(model.baseXg(10.01)).isEqualTo(0.15);
        assertThat(model.baseXg(35.0)).isEqualTo(0.08);
        assertThat(model.baseXg(50.0)).isEqualTo(0.04);
        assertThat(model.baseXg(50.1)).isEqualTo(0.02);
    }

    @Test
    @DisplayName("Multiplicateurs d'angle")
    void angleMultipliers() {
        assertThat(model.angleMultiplier(15.0)).isEqualTo(1.0);
        assertThat(model.angleMultiplier(20.0)).isEqualTo(0.8);
        assertThat(model.angleMultiplier(45.0)).isEqualTo(0.5);
        assertThat(model.angleMultiplier(60.0)).isEqualTo(0.3);
    }

    @Test
    @DisplayName("Type de tir inconnu ou absent : multiplicateur 1.0")
    void unknownShotTypeIsNeutral() {
        assertThat(model.shotTypeMultiplier("knuckle-puck")).isEqualTo(1.0);
        assertThat(model.shotTypeMultiplier(null)).isEqualTo(1.0);
        assertThat(model.shotTypeMultiplier("Slap")).isEqualTo(0.9);
        assertThat(model.shotTypeMultiplier("backhand")).isEqualTo(1.3);
    }

    @Test
    @DisplayName("Zones : enclave 1.5, zone offensive proche 1.2 / lointaine 0.8, neutre 0.3, défensive 0.1")
    void zoneMultipliers() {
        assertThat(model.zoneMultiplier(shot(EventType.SHOT_ON_GOAL, 80.0, 10.0, null))).isEqualTo(1.5);
        assertThat(model.zoneMultiplier(shot(EventType.SHOT_ON_GOAL, 65.0, 20.0, null))).isEqualTo(1.2);
        assertThat(model.zoneMultiplier(shot(EventType.SHOT_ON_GOAL, 40.0, 30.0, null))).isEqualTo(0.8);
        assertThat(model.zoneMultiplier(shot(EventType.SHOT_ON_GOAL, 0.0, 30.0, null))).isEqualTo(0.3);
        assertThat(model.zoneMultiplier(shot(EventType.SHOT_ON_GOAL, -60.0, 0.0, null))).isEqualTo(0.1);
    }

    @Test
    @DisplayName("Tir sans position : évalué depuis le centre, zone neutre 1.0")
    void shotWithoutLocationUsesCenterIce() {
        GameEvent shot = shot(EventType.SHOT_ON_GOAL, null, null, "wrist");
        assertThat(model.zoneMultiplier(shot)).isEqualTo(1.0);
        assertThat(model.expectedGoals(shot)).isCloseTo(0.02, within(1e-9));
    }

    @Test
    @DisplayName("Supériorité numérique lue depuis le code de situation, côté tireur")
    void powerPlayFromSituationCode() {
        // 4 patineurs à l'extérieur, 5 à domicile
        GameEvent shot = shot(EventType.SHOT_ON_GOAL, 88.0, 9.0, "wrist").toBuilder().situationCode("1451").build();

        ShotContext home = model.contextFor(shot, List.of(), true, 0);
        ShotContext away = model.contextFor(shot, List.of(), false, 0);

        assertThat(home.strength().label()).isEqualTo("5v4");
        assertThat(away.strength().label()).isEqualTo("4v5");
        assertThat(model.expectedGoals(shot, home)).isCloseTo(0.375 * 1.45, within(1e-9));
        assertThat(model.expectedGoals(shot, away)).isCloseTo(0.375 * 0.55, within(1e-9));
    }

    @Test
    @DisplayName("Rebond : tentative de la même équipe moins de 3 secondes avant")
    void reboundDetection() {
        GameEvent first = shot(EventType.SHOT_ON_GOAL, 80.0, 5.0, "wrist").toBuilder().timeInPeriod("10:00").build();
        GameEvent rebound = shot(EventType.SHOT_ON_GOAL, 85.0, 2.0, "wrist").toBuilder().timeInPeriod("10:02").build();
        GameEvent late = rebound.toBuilder().timeInPeriod("10:05").build();

        assertThat(model.contextFor(rebound, List.of(first), true, 0).rebound()).isTrue();
        assertThat(model.contextFor(late, List.of(first), true, 0).rebound()).isFalse();
    }

    @Test
    @DisplayName("État du score : mener augmente la valeur, égalité neutre")
    void scoreStateMultiplier() {
        assertThat(model.scoreStateMultiplier(0)).isEqualTo(1.0);
        assertThat(model.scoreStateMultiplier(1)).isGreaterThan(1.0);
        assertThat(model.scoreStateMultiplier(-5)).isEqualTo(0.98);
    }

    private static GameEvent shot(EventType type, Double x, Double y, String shotType) {
        return GameEvent.builder().type(type).teamId(1L).period(1).x(x).y(y).shotType(shotType).build();
    }
}
