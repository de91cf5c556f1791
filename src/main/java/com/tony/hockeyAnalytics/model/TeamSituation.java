package com.tony.hockeyAnalytics.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * Historique de situation d'une équipe : bilan à domicile et date du dernier match.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "team_situation")
public class TeamSituation {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String teamAbbrev;

    private int homeGames = 0;
    private int homeWins = 0;
    private LocalDate lastGameDate;

    public TeamSituation(String teamAbbrev) {
        this.teamAbbrev = TeamCode.normalize(teamAbbrev);
    }

    public double getHomeWinPct() {
        return homeGames == 0 ? 0.0 : (double) homeWins / homeGames;
    }
}
