package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.exception.GameDataException;
import com.tony.hockeyAnalytics.model.GameEvent;
import com.tony.hockeyAnalytics.model.dto.GameData;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Contrôle structurel d'un match avant tout calcul. Une donnée manquante mais tolérée
 * (coordonnées, type de tir, événement d'une équipe inconnue) ne fait pas échouer.
 */
@Component
public class GameDataValidator {

    public void validate(GameData game) {
        if (game == null) throw new GameDataException(null, "Match absent");
        String id = game.getGameId();
        if (id == null || id.isBlank()) throw new GameDataException(id, "Identifiant de match manquant");
        if (game.getHomeTeamId() == null || game.getAwayTeamId() == null) {
            throw new GameDataException(id, "Identifiants d'équipes manquants");
        }
        if (game.getHomeTeamId().equals(game.getAwayTeamId())) {
            throw new GameDataException(id, "Les deux équipes ont le même identifiant");
        }
        if (isBlank(game.getHomeAbbrev()) || isBlank(game.getAwayAbbrev())) {
            throw new GameDataException(id, "Abréviations d'équipes manquantes");
        }

        List<GameEvent> events = game.getEvents();
        if (events == null || events.isEmpty()) throw new GameDataException(id, "Liste d'événements absente ou vide");
        for (int i = 0; i < events.size(); i++) {
            GameEvent event = events.get(i);
            if (event == null || event.getType() == null) {
                throw new GameDataException(id, "Événement #" + i + " sans type");
            }
            if (event.getPeriod() < 1) {
                throw new GameDataException(id, "Événement #" + i + " avec une période invalide : " + event.getPeriod());
            }
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
