package com.tony.hockeyAnalytics.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Bilan des confrontations entre deux équipes, clé ordonnée alphabétiquement.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "head_to_head")
public class HeadToHeadRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String matchupKey;

    private String firstTeam;
    private String secondTeam;
    private int firstTeamWins = 0;
    private int secondTeamWins = 0;

    public HeadToHeadRecord(String teamA, String teamB) {
        String a = TeamCode.normalize(teamA);
        String b = TeamCode.normalize(teamB);
        this.firstTeam = a.compareTo(b) <= 0 ? a : b;
        this.secondTeam = a.compareTo(b) <= 0 ? b : a;
        this.matchupKey = keyOf(a, b);
    }

    public static String keyOf(String teamA, String teamB) {
        String a = TeamCode.normalize(teamA);
        String b = TeamCode.normalize(teamB);
        return a.compareTo(b) <= 0 ? a + "_" + b : b + "_" + a;
    }

    public int getTotalGames() {
        return firstTeamWins + secondTeamWins;
    }

    public void recordWin(String winner) {
        String code = TeamCode.normalize(winner);
        if (firstTeam.equals(code)) firstTeamWins++;
        else if (secondTeam.equals(code)) secondTeamWins++;
    }

    public int winsOf(String team) {
        String code = TeamCode.normalize(team);
        if (firstTeam.equals(code)) return firstTeamWins;
        if (secondTeam.equals(code)) return secondTeamWins;
        return 0;
    }
}
