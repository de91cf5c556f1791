package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.config.PredictionProperties;
import com.tony.hockeyAnalytics.model.HeadToHeadRecord;
import com.tony.hockeyAnalytics.model.TeamCode;
import com.tony.hockeyAnalytics.model.TeamSituation;
import com.tony.hockeyAnalytics.model.dto.GameData;
import com.tony.hockeyAnalytics.repository.HeadToHeadRecordRepository;
import com.tony.hockeyAnalytics.repository.TeamSituationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Ajustements de situation : avantage de la glace, confrontations directes, repos.
 * Les valeurs retournées sont brutes ; le prédicteur les convertit en unités de score.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SituationalAdjustmentService {

    private final TeamSituationRepository situationRepository;
    private final HeadToHeadRecordRepository headToHeadRepository;
    private final PredictionProperties properties;

    /** Défaut fixe tant que l'échantillon à domicile est trop petit. */
    public double homeIceAdvantage(String homeTeam) {
        return situationRepository.findByTeamAbbrev(TeamCode.normalize(homeTeam))
                .filter(s -> s.getHomeGames() >= properties.getMinHomeGamesForLearnedAdvantage())
                .map(s -> Math.max(0.0, s.getHomeWinPct() - 0.5))
                .orElse(properties.getDefaultHomeIceAdvantage());
    }

    /** Dans [-1, 1], positif si l'équipe extérieure domine la confrontation. */
    public double headToHeadAdvantage(String awayTeam, String homeTeam) {
        String away = TeamCode.normalize(awayTeam);
        String home = TeamCode.normalize(homeTeam);
        return headToHeadRepository.findByMatchupKey(HeadToHeadRecord.keyOf(away, home))
                .filter(r -> r.getTotalGames() > 0)
                .map(r -> ((double) r.winsOf(away) / r.getTotalGames() - 0.5) * 2.0)
                .orElse(0.0);
    }

    /** Back-to-back : pénalité ; 2 jours : neutre ; 3 jours et plus : bonus. */
    public double restAdjustment(String team, LocalDate gameDate) {
        if (gameDate == null) return 0.0;
        return situationRepository.findByTeamAbbrev(TeamCode.normalize(team))
                .map(TeamSituation::getLastGameDate)
                .map(last -> restAdjustmentForDays(ChronoUnit.DAYS.between(last, gameDate)))
                .orElse(0.0);
    }

    public double restAdjustmentForDays(long daysOfRest) {
        if (daysOfRest <= 0) return 0.0;
        if (daysOfRest == 1) return properties.getBackToBackPenalty();
        if (daysOfRest == 2) return 0.0;
        return properties.getWellRestedBonus();
    }

    /** Met à jour confrontations, bilan à domicile et date du dernier match. */
    @Transactional
    public void recordResult(GameData game) {
        String winner = TeamCode.normalize(game.winnerAbbrev());
        String home = TeamCode.normalize(game.getHomeAbbrev());
        String away = TeamCode.normalize(game.getAwayAbbrev());

        TeamSituation homeSituation = situationRepository.findByTeamAbbrev(home).orElseGet(() -> new TeamSituation(home));
        TeamSituation awaySituation = situationRepository.findByTeamAbbrev(away).orElseGet(() -> new TeamSituation(away));
        if (winner != null) {
            homeSituation.setHomeGames(homeSituation.getHomeGames() + 1);
            if (winner.equals(home)) homeSituation.setHomeWins(homeSituation.getHomeWins() + 1);

            HeadToHeadRecord h2h = headToHeadRepository.findByMatchupKey(HeadToHeadRecord.keyOf(away, home))
                    .orElseGet(() -> new HeadToHeadRecord(away, home));
            h2h.recordWin(winner);
            headToHeadRepository.save(h2h);
        }
        updateLastGame(homeSituation, game.getGameDate());
        updateLastGame(awaySituation, game.getGameDate());
        situationRepository.save(homeSituation);
        situationRepository.save(awaySituation);
        log.debug("Situation mise à jour : {} @ {} (vainqueur {})", away, home, winner);
    }

    private void updateLastGame(TeamSituation situation, LocalDate gameDate) {
        if (gameDate == null) return;
        if (situation.getLastGameDate() == null || gameDate.isAfter(situation.getLastGameDate())) {
            situation.setLastGameDate(gameDate);
        }
    }
}
