package com.tony.hockeyAnalytics.controller;

import com.tony.hockeyAnalytics.model.CompositeMetric;
import com.tony.hockeyAnalytics.service.ModelStateService;
import com.tony.hockeyAnalytics.service.OnlineLearningService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final ModelStateService modelState;
    private final OnlineLearningService learning;

    @GetMapping("/weights")
    public ResponseEntity<Map<CompositeMetric, Double>> getWeights() {
        return ResponseEntity.ok(modelState.currentWeights().asMap());
    }

    @PostMapping("/refit")
    public ResponseEntity<Map<CompositeMetric, Double>> refit() {
        log.info("🚀 Ré-estimation manuelle des poids");
        return ResponseEntity.ok(learning.refitNow().asMap());
    }
}
