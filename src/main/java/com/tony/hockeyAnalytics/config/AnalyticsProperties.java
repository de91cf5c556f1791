package com.tony.hockeyAnalytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "analytics")
@Data
public class AnalyticsProperties {
    // Fenêtres de recherche du classement rush / forecheck (en événements)
    private int rushLookback = 5;
    private int forecheckLookback = 8;

    // Attribution des tirs après revirement en zone neutre
    private double turnoverRadius = 50.0;
    // 0 = pas de contrôle temporel, seulement la distance
    private int turnoverTimeWindowSeconds = 0;

    private int reboundWindowSeconds = 3;
}
