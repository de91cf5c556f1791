package com.tony.hockeyAnalytics.model.dto;

import com.tony.hockeyAnalytics.model.GameEvent;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * Contrat d'entrée fourni par le collaborateur amont : identité des équipes,
 * score final et liste ordonnée des événements.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GameData {
    String gameId;
    LocalDate gameDate;
    Long homeTeamId;
    Long awayTeamId;
    String homeAbbrev;
    String awayAbbrev;
    Integer homeScore;
    Integer awayScore;
    List<GameEvent> events;

    public boolean isKnownTeam(Long teamId) {
        return teamId != null && (teamId.equals(homeTeamId) || teamId.equals(awayTeamId));
    }

    public boolean isHome(Long teamId) {
        return teamId != null && teamId.equals(homeTeamId);
    }

    public Long opponentOf(Long teamId) {
        return isHome(teamId) ? awayTeamId : homeTeamId;
    }

    /** Abréviation du vainqueur, null si le score final manque ou est nul. */
    public String winnerAbbrev() {
        if (homeScore == null || awayScore == null || homeScore.equals(awayScore)) return null;
        return homeScore > awayScore ? homeAbbrev : awayAbbrev;
    }
}
