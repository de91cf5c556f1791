package com.tony.hockeyAnalytics.repository;

import com.tony.hockeyAnalytics.model.TeamVenueProfile;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TeamVenueProfileRepository extends JpaRepository<TeamVenueProfile, Long> {
    List<TeamVenueProfile> findByTeamAbbrev(String teamAbbrev);
}
