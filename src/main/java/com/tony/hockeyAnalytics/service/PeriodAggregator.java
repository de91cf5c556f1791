package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.model.GameEvent;
import com.tony.hockeyAnalytics.model.GameMetrics;
import com.tony.hockeyAnalytics.model.PeriodMetrics;
import com.tony.hockeyAnalytics.model.PeriodType;
import com.tony.hockeyAnalytics.model.ShotOrigin;
import com.tony.hockeyAnalytics.model.ShotRecord;
import com.tony.hockeyAnalytics.model.TeamGameMetrics;
import com.tony.hockeyAnalytics.model.Venue;
import com.tony.hockeyAnalytics.model.dto.GameData;
import com.tony.hockeyAnalytics.service.ShotValuationModel.ShotContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.ToIntFunction;

/**
 * Passage séquentiel unique sur les événements d'un match : classement, valorisation
 * des tirs et cumul des compteurs par équipe et par période.
 * Aucun accès au stockage des profils : deux appels sur la même liste donnent le même résultat.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PeriodAggregator {

    private static final List<String> REGULATION_LABELS = List.of("p1", "p2", "p3");
    private static final double NEUTRAL_PCT = 50.0;

    private final EventClassifier classifier;
    private final ShotValuationModel shotModel;
    private final GameScoreCalculator gameScoreCalculator;
    private final ZonePossessionAnalyzer zoneAnalyzer;

    public GameMetrics aggregate(GameData game) {
        List<GameEvent> events = game.getEvents();
        Map<Long, Map<String, PeriodCounter>> counters = new HashMap<>();
        Map<Long, Map<Long, Double>> playerScores = new HashMap<>();
        counters.put(game.getHomeTeamId(), new HashMap<>());
        counters.put(game.getAwayTeamId(), new HashMap<>());
        playerScores.put(game.getHomeTeamId(), new LinkedHashMap<>());
        playerScores.put(game.getAwayTeamId(), new LinkedHashMap<>());

        ZonePossessionAnalyzer.Tracker tracker = zoneAnalyzer.newTracker();
        List<ShotRecord> shots = new ArrayList<>();
        int homeGoals = 0;
        int awayGoals = 0;
        int ignored = 0;

        for (int i = 0; i < events.size(); i++) {
            GameEvent event = events.get(i);
            Long teamId = event.getTeamId();
            if (!game.isKnownTeam(teamId)) {
                ignored++;
                continue;
            }
            boolean home = game.isHome(teamId);
            String label = periodLabel(event);
            PeriodCounter counter = counterFor(counters, teamId, label);

            ShotRecord shot = null;
            ShotContext context = null;
            if (event.getType().isShotAttempt()) {
                List<GameEvent> preceding = events.subList(0, i);
                int differential = home ? homeGoals - awayGoals : awayGoals - homeGoals;
                context = shotModel.contextFor(event, preceding, home, differential);
                ShotOrigin origin = classifier.classifyShotOrigin(event, preceding);
                shot = ShotRecord.builder()
                        .eventIndex(i)
                        .teamId(teamId)
                        .period(event.getPeriod())
                        .eventType(event.getType())
                        .xg(shotModel.expectedGoals(event, context))
                        .gameScoreDelta(gameScoreCalculator.teamDelta(event))
                        .zoneOfOrigin(classifier.zoneOf(event).orElse(null))
                        .playType(origin.getPlayType())
                        .highDanger(shotModel.isHighDanger(event))
                        .strength(context.strength().label())
                        .build();
                shots.add(shot);
                counter.xg += shot.getXg();
                if (shot.isHighDanger()) counter.highDangerChances++;
            }

            switch (event.getType()) {
                case GOAL -> {
                    counter.goals++;
                    counter.shots++;
                    counter.corsiFor++;
                    if (context.strength().isPowerPlay()) counter.powerPlayGoals++;
                    if (event.getEffectivePeriodType() != PeriodType.SHOOTOUT) {
                        if (home) homeGoals++;
                        else awayGoals++;
                    }
                }
                case SHOT_ON_GOAL -> {
                    counter.shots++;
                    counter.corsiFor++;
                }
                case MISSED_SHOT -> {
                    counter.missedShots++;
                    counter.corsiFor++;
                }
                case BLOCKED_SHOT -> {
                    // Tentative pour le tireur, contre pour l'équipe qui bloque
                    counter.corsiFor++;
                    counterFor(counters, game.opponentOf(teamId), label).blockedShots++;
                }
                case FACEOFF -> counter.faceoffWins++;
                case HIT -> counter.hits++;
                case GIVEAWAY -> counter.giveaways++;
                case TAKEAWAY -> counter.takeaways++;
                case PENALTY -> {
                    counter.penaltyMinutes += event.getPenaltyMinutesOrDefault();
                    // L'adversaire obtient une supériorité
                    counterFor(counters, game.opponentOf(teamId), label).powerPlayAttempts++;
                }
                case PASS -> { }
            }
            counter.gameScore += gameScoreCalculator.teamDelta(event);
            double opponentDelta = gameScoreCalculator.opponentDelta(event);
            if (opponentDelta != 0.0) counterFor(counters, game.opponentOf(teamId), label).gameScore += opponentDelta;

            Long opponent = game.opponentOf(teamId);
            Long opposingPlayer = event.getOpposingPlayerId();
            gameScoreCalculator.playerContributions(event).forEach((player, value) -> {
                Long playerTeam = player.equals(opposingPlayer) ? opponent : teamId;
                playerScores.get(playerTeam).merge(player, value, Double::sum);
            });

            tracker.accept(event, label, shot);
        }

        if (ignored > 0) {
            log.debug("Match {} : {} événements d'équipes inconnues ignorés", game.getGameId(), ignored);
        }

        TreeSet<String> extraLabels = new TreeSet<>(Comparator.comparing(PeriodAggregator::labelOrder));
        counters.values().forEach(byLabel -> byLabel.keySet().stream()
                .filter(l -> !REGULATION_LABELS.contains(l))
                .forEach(extraLabels::add));

        return GameMetrics.builder()
                .gameId(game.getGameId())
                .away(buildTeam(game, Venue.AWAY, counters, tracker, extraLabels, playerScores))
                .home(buildTeam(game, Venue.HOME, counters, tracker, extraLabels, playerScores))
                .shots(Collections.unmodifiableList(shots))
                .build();
    }

    /** p1..p3 en temps réglementaire, ot1, ot2... en prolongation, so aux tirs au but. */
    public String periodLabel(GameEvent event) {
        PeriodType type = event.getEffectivePeriodType();
        if (type == PeriodType.SHOOTOUT) return "so";
        if (type == PeriodType.REGULATION && event.getPeriod() <= 3) return "p" + event.getPeriod();
        return "ot" + Math.max(1, event.getPeriod() - 3);
    }

    private TeamGameMetrics buildTeam(GameData game, Venue venue, Map<Long, Map<String, PeriodCounter>> counters,
                                      ZonePossessionAnalyzer.Tracker tracker, TreeSet<String> extraLabels,
                                      Map<Long, Map<Long, Double>> playerScores) {
        Long teamId = venue == Venue.HOME ? game.getHomeTeamId() : game.getAwayTeamId();
        Long opponentId = game.opponentOf(teamId);

        List<PeriodMetrics> regulation = new ArrayList<>();
        PeriodCounter ownTotal = new PeriodCounter();
        PeriodCounter opponentTotal = new PeriodCounter();
        for (String label : REGULATION_LABELS) {
            PeriodCounter own = counterFor(counters, teamId, label);
            PeriodCounter opponent = counterFor(counters, opponentId, label);
            regulation.add(toMetrics(label, own, opponent, tracker.countersFor(teamId, label)));
            ownTotal.add(own);
            opponentTotal.add(opponent);
        }

        List<PeriodMetrics> extra = new ArrayList<>();
        for (String label : extraLabels) {
            extra.add(toMetrics(label, counterFor(counters, teamId, label), counterFor(counters, opponentId, label),
                    tracker.countersFor(teamId, label)));
        }

        PeriodMetrics totals = toMetrics("total", ownTotal, opponentTotal, null).toBuilder()
                .nzTurnovers(sumZone(regulation, PeriodMetrics::getNzTurnovers))
                .nzTurnoversToShots(sumZone(regulation, PeriodMetrics::getNzTurnoversToShots))
                .ozOriginatingShots(sumZone(regulation, PeriodMetrics::getOzOriginatingShots))
                .nzOriginatingShots(sumZone(regulation, PeriodMetrics::getNzOriginatingShots))
                .dzOriginatingShots(sumZone(regulation, PeriodMetrics::getDzOriginatingShots))
                .rushShots(sumZone(regulation, PeriodMetrics::getRushShots))
                .forecheckCycleShots(sumZone(regulation, PeriodMetrics::getForecheckCycleShots))
                .build();

        return TeamGameMetrics.builder()
                .teamId(teamId)
                .teamAbbrev(venue == Venue.HOME ? game.getHomeAbbrev() : game.getAwayAbbrev())
                .venue(venue)
                .regulation(Collections.unmodifiableList(regulation))
                .extraPeriods(Collections.unmodifiableList(extra))
                .totals(totals)
                .playerGameScores(Collections.unmodifiableMap(playerScores.get(teamId)))
                .build();
    }

    private PeriodMetrics toMetrics(String label, PeriodCounter own, PeriodCounter opponent,
                                    ZonePossessionAnalyzer.ZoneCounters zone) {
        PeriodMetrics.PeriodMetricsBuilder builder = PeriodMetrics.builder()
                .label(label)
                .goals(own.goals)
                .shots(own.shots)
                .missedShots(own.missedShots)
                .blockedShots(own.blockedShots)
                .corsiFor(own.corsiFor)
                .corsiAgainst(opponent.corsiFor)
                .corsiPct(percentage(own.corsiFor, opponent.corsiFor))
                .faceoffWins(own.faceoffWins)
                .faceoffLosses(opponent.faceoffWins)
                .faceoffPct(percentage(own.faceoffWins, opponent.faceoffWins))
                .powerPlayGoals(own.powerPlayGoals)
                .powerPlayAttempts(own.powerPlayAttempts)
                .hits(own.hits)
                .giveaways(own.giveaways)
                .takeaways(own.takeaways)
                .penaltyMinutes(own.penaltyMinutes)
                .xg(own.xg)
                .gameScore(own.gameScore)
                .highDangerChances(own.highDangerChances);
        if (zone != null) {
            builder.nzTurnovers(zone.getNzTurnovers())
                    .nzTurnoversToShots(zone.getNzTurnoversToShots())
                    .ozOriginatingShots(zone.getOzOriginatingShots())
                    .nzOriginatingShots(zone.getNzOriginatingShots())
                    .dzOriginatingShots(zone.getDzOriginatingShots())
                    .rushShots(zone.getRushShots())
                    .forecheckCycleShots(zone.getForecheckCycleShots());
        }
        return builder.build();
    }

    /** for / (for + against), 50.0 si aucun événement. */
    public static double percentage(int forCount, int againstCount) {
        int total = forCount + againstCount;
        if (total == 0) return NEUTRAL_PCT;
        return forCount * 100.0 / total;
    }

    private static int sumZone(List<PeriodMetrics> periods, ToIntFunction<PeriodMetrics> getter) {
        return periods.stream().mapToInt(getter).sum();
    }

    private static PeriodCounter counterFor(Map<Long, Map<String, PeriodCounter>> counters, Long teamId, String label) {
        return counters.get(teamId).computeIfAbsent(label, l -> new PeriodCounter());
    }

    private static int labelOrder(String label) {
        if (label.equals("so")) return Integer.MAX_VALUE;
        return Integer.parseInt(label.substring(2));
    }

    // Compteurs mutables, uniquement pendant le passage
    private static class PeriodCounter {
        int goals;
        int shots;
        int missedShots;
        int blockedShots;
        int corsiFor;
        int faceoffWins;
        int powerPlayGoals;
        int powerPlayAttempts;
        int hits;
        int giveaways;
        int takeaways;
        int penaltyMinutes;
        double xg;
        double gameScore;
        int highDangerChances;

        void add(PeriodCounter other) {
            goals += other.goals;
            shots += other.shots;
            missedShots += other.missedShots;
            blockedShots += other.blockedShots;
            corsiFor += other.corsiFor;
            faceoffWins += other.faceoffWins;
            powerPlayGoals += other.powerPlayGoals;
            powerPlayAttempts += other.powerPlayAttempts;
            hits += other.hits;
            giveaways += other.giveaways;
            takeaways += other.takeaways;
            penaltyMinutes += other.penaltyMinutes;
            xg += other.xg;
            gameScore += other.gameScore;
            highDangerChances += other.highDangerChances;
        }
    }
}
