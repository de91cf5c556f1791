package com.tony.hockeyAnalytics.model;

public enum ConfidenceTier {
    HIGH,
    MEDIUM,
    LOW
}
