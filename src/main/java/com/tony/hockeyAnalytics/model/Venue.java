package com.tony.hockeyAnalytics.model;

public enum Venue {
    HOME,
    AWAY
}
