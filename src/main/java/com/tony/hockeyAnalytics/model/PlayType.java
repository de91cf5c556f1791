package com.tony.hockeyAnalytics.model;

public enum PlayType {
    RUSH,
    FORECHECK_CYCLE
}
