package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.model.PredictionRecord;
import com.tony.hockeyAnalytics.model.TeamCode;
import org.springframework.stereotype.Service;

@Service
public class PredictionEvaluationService {

    /**
     * Renseigne le résultat réel d'une prédiction : vainqueur, justesse et Brier Score.
     */
    public void evaluatePrediction(PredictionRecord record, String winnerCode) {
        String actualWinner = TeamCode.normalize(winnerCode);
        record.setActualWinner(actualWinner);

        // 1. Juste si le vainqueur prédit est le vainqueur réel
        record.setCorrect(actualWinner.equals(TeamCode.normalize(record.getPredictedWinner())));

        // 2. Brier Score sur les deux issues possibles
        // Probabilités stockées en % (ex: 55.0)
        double pHome = record.getHomeProbability() / 100.0;
        double pAway = record.getAwayProbability() / 100.0;
        double homeWin = record.isHomeWin() ? 1.0 : 0.0;

        double brier = Math.pow(pHome - homeWin, 2) + Math.pow(pAway - (1.0 - homeWin), 2);

        // Varie de 0 (parfait) à 2 (tout faux)
        record.setBrierScore(Math.round(brier * 1000.0) / 1000.0);
    }
}
