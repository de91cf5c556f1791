package com.tony.hockeyAnalytics.controller;

import com.tony.hockeyAnalytics.model.TeamProfileSummary;
import com.tony.hockeyAnalytics.model.Venue;
import com.tony.hockeyAnalytics.service.TeamPerformanceStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/profiles")
@RequiredArgsConstructor
public class ProfileController {

    private final TeamPerformanceStore store;

    @GetMapping("/{team}/{venue}")
    public ResponseEntity<TeamProfileSummary> getProfile(@PathVariable String team, @PathVariable String venue) {
        return ResponseEntity.ok(store.getProfile(team, Venue.valueOf(venue.toUpperCase())));
    }

    @DeleteMapping("/{team}")
    public ResponseEntity<Void> resetTeam(@PathVariable String team) {
        store.reset(team);
        return ResponseEntity.noContent().build();
    }
}
