package com.tony.hockeyAnalytics.model.dto;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class DashboardStats {
    private long totalPredictions;
    private long completedPredictions;
    private double globalAccuracy; // % réussite global
    private double highConfidenceAccuracy; // % réussite sur le palier HIGH
    private Double averageBrierScore;
}
