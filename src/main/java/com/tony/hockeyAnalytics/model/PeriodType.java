package com.tony.hockeyAnalytics.model;

public enum PeriodType {
    REGULATION,
    OVERTIME,
    SHOOTOUT;

    public static PeriodType fromCode(String code, int period) {
        if (code != null) {
            switch (code.trim().toUpperCase()) {
                case "REG": return REGULATION;
                case "OT": return OVERTIME;
                case "SO": return SHOOTOUT;
                default: break;
            }
        }
        return period <= 3 ? REGULATION : OVERTIME;
    }
}
