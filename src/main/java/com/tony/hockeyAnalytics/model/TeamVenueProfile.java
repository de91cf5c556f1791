package com.tony.hockeyAnalytics.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Historique glissant des métriques composites d'une équipe, à domicile ou à l'extérieur.
 * Les listes sont ordonnées de la plus ancienne à la plus récente.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "team_venue_profile", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"team_abbrev", "venue"})
})
public class TeamVenueProfile {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "team_abbrev", nullable = false)
    private String teamAbbrev;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Venue venue;

    @Convert(converter = MetricHistoryConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<CompositeMetric, List<Double>> rollingMetrics = new EnumMap<>(CompositeMetric.class);

    @Column(nullable = false)
    private int gamesPlayed = 0;

    private LocalDate lastGameDate;

    public TeamVenueProfile(String teamAbbrev, Venue venue) {
        this.teamAbbrev = teamAbbrev;
        this.venue = venue;
    }

    /**
     * Ajoute les valeurs d'un match en fin de liste puis évince par l'avant
     * tant que la liste dépasse {@code cap}.
     */
    public void append(CompositeScores scores, LocalDate gameDate, int cap) {
        for (CompositeMetric metric : CompositeMetric.values()) {
            List<Double> values = rollingMetrics.computeIfAbsent(metric, m -> new ArrayList<>());
            values.add(scores.value(metric));
            while (values.size() > cap) {
                values.remove(0);
            }
        }
        gamesPlayed++;
        if (gameDate != null) lastGameDate = gameDate;
    }

    public List<Double> history(CompositeMetric metric) {
        return rollingMetrics.getOrDefault(metric, List.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TeamVenueProfile)) return false;
        return id != null && id.equals(((TeamVenueProfile) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
