package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.config.PredictionProperties;
import com.tony.hockeyAnalytics.model.CompositeMetric;
import com.tony.hockeyAnalytics.model.CompositeScores;
import com.tony.hockeyAnalytics.model.TeamCode;
import com.tony.hockeyAnalytics.model.TeamProfileSummary;
import com.tony.hockeyAnalytics.model.TeamVenueProfile;
import com.tony.hockeyAnalytics.model.Venue;
import com.tony.hockeyAnalytics.repository.TeamVenueProfileRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Profils glissants par (équipe, lieu), tenus en mémoire et persistés par lot.
 * <p>
 * Chargement complet au démarrage, écriture des profils modifiés à l'arrêt et après
 * chaque match traité. Un verrou par clé sérialise les ajouts d'une même équipe ;
 * deux équipes différentes ne se bloquent jamais.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TeamPerformanceStore {

    private static final double DEFAULT_CONFIDENCE = 0.1;
    private static final double DEFAULT_CONSISTENCY = 0.5;

    private final TeamVenueProfileRepository repository;
    private final PredictionProperties properties;

    private final Map<ProfileKey, TeamVenueProfile> profiles = new ConcurrentHashMap<>();
    private final Map<ProfileKey, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<ProfileKey> dirty = ConcurrentHashMap.newKeySet();

    private record ProfileKey(String team, Venue venue) {
        static ProfileKey of(String team, Venue venue) {
            return new ProfileKey(TeamCode.normalize(team), venue);
        }
    }

    @PostConstruct
    public void load() {
        List<TeamVenueProfile> stored = repository.findAll();
        stored.forEach(p -> profiles.put(ProfileKey.of(p.getTeamAbbrev(), p.getVenue()), p));
        log.info("📂 {} profils équipe/lieu chargés", stored.size());
    }

    @PreDestroy
    public void flush() {
        int saved = 0;
        for (ProfileKey key : new ArrayList<>(dirty)) {
            try {
                withLock(key, () -> {
                    TeamVenueProfile profile = profiles.get(key);
                    if (profile != null) repository.save(profile);
                    dirty.remove(key);
                    return null;
                });
                saved++;
            } catch (RuntimeException e) {
                // Reste marqué modifié pour la prochaine écriture
                log.error("❌ Sauvegarde du profil {} {} impossible", key.team(), key.venue(), e);
            }
        }
        if (saved > 0) log.info("💾 {} profils sauvegardés", saved);
    }

    public TeamProfileSummary getProfile(String team, Venue venue) {
        ProfileKey key = ProfileKey.of(team, venue);
        return withLock(key, () -> {
            TeamVenueProfile profile = profiles.get(key);
            return profile == null ? defaultProfile(key) : summarize(key, profile);
        });
    }

    /** Ajoute les valeurs d'un match terminé ; les plus anciennes sont évincées au-delà du plafond. */
    public TeamProfileSummary appendGame(String team, Venue venue, CompositeScores scores, LocalDate gameDate) {
        ProfileKey key = ProfileKey.of(team, venue);
        return withLock(key, () -> {
            TeamVenueProfile profile = profiles.computeIfAbsent(key, k -> new TeamVenueProfile(k.team(), k.venue()));
            profile.append(scores, gameDate, properties.getProfileCap());
            dirty.add(key);
            return summarize(key, profile);
        });
    }

    /** Réinitialisation explicite : seule suppression possible d'un profil. */
    public void reset(String team) {
        for (Venue venue : Venue.values()) {
            ProfileKey key = ProfileKey.of(team, venue);
            withLock(key, () -> {
                profiles.remove(key);
                dirty.remove(key);
                return null;
            });
        }
        repository.deleteAll(repository.findByTeamAbbrev(TeamCode.normalize(team)));
        log.info("🗑️ Profils de {} réinitialisés", team);
    }

    /** Croissante avec l'historique, plafonnée à 1. */
    public double confidence(int gamesPlayed) {
        double raw = (double) gamesPlayed / properties.getConfidenceHorizonGames();
        return Math.max(DEFAULT_CONFIDENCE, Math.min(1.0, raw));
    }

    private <T> T withLock(ProfileKey key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private TeamProfileSummary defaultProfile(ProfileKey key) {
        return TeamProfileSummary.builder()
                .team(key.team())
                .venue(key.venue())
                .averages(CompositeScores.neutral())
                .rollingLists(Map.of())
                .gamesPlayed(0)
                .confidence(DEFAULT_CONFIDENCE)
                .consistency(DEFAULT_CONSISTENCY)
                .defaultProfile(true)
                .build();
    }

    private TeamProfileSummary summarize(ProfileKey key, TeamVenueProfile profile) {
        Map<CompositeMetric, List<Double>> lists = new EnumMap<>(CompositeMetric.class);
        Map<CompositeMetric, Double> averages = new EnumMap<>(CompositeMetric.class);
        double cvSum = 0.0;
        int cvCount = 0;

        for (CompositeMetric metric : CompositeMetric.values()) {
            List<Double> history = List.copyOf(profile.history(metric));
            lists.put(metric, history);
            if (history.isEmpty()) continue;

            DescriptiveStatistics stats = new DescriptiveStatistics();
            history.forEach(stats::addValue);
            averages.put(metric, stats.getMean());
            if (history.size() >= 2 && stats.getMean() != 0.0) {
                cvSum += stats.getStandardDeviation() / Math.abs(stats.getMean());
                cvCount++;
            }
        }

        double consistency = cvCount == 0 ? DEFAULT_CONSISTENCY : 1.0 - Math.min(1.0, cvSum / cvCount);
        return TeamProfileSummary.builder()
                .team(key.team())
                .venue(key.venue())
                .averages(CompositeScores.fromMap(averages))
                .rollingLists(lists)
                .gamesPlayed(profile.getGamesPlayed())
                .confidence(confidence(profile.getGamesPlayed()))
                .consistency(consistency)
                .defaultProfile(false)
                .build();
    }
}
