package com.tony.hockeyAnalytics.repository;

import com.tony.hockeyAnalytics.model.TeamSituation;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface TeamSituationRepository extends JpaRepository<TeamSituation, Long> {
    Optional<TeamSituation> findByTeamAbbrev(String teamAbbrev);
}
