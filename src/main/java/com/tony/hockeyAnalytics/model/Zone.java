package com.tony.hockeyAnalytics.model;

public enum Zone {
    OFFENSIVE,
    NEUTRAL,
    DEFENSIVE
}
