package com.tony.hockeyAnalytics.model;

import java.util.Locale;

/**
 * Forme canonique d'une abréviation d'équipe ("tor " -> "TOR"), appliquée à l'entrée de chaque service.
 */
public final class TeamCode {

    private TeamCode() {
    }

    public static String normalize(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }
}
