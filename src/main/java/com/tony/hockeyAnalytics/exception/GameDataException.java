package com.tony.hockeyAnalytics.exception;

/**
 * Données de match inexploitables : le match entier est ignoré.
 */
public class GameDataException extends RuntimeException {
    private final String gameId;

    public GameDataException(String gameId, String message) {
        super(message);
        this.gameId = gameId;
    }

    public String getGameId() {
        return gameId;
    }
}
