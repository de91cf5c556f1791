package com.tony.hockeyAnalytics.service;

import com.tony.hockeyAnalytics.config.PredictionProperties;
import com.tony.hockeyAnalytics.model.CompositeWeights;
import com.tony.hockeyAnalytics.model.ModelState;
import com.tony.hockeyAnalytics.repository.ModelStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;

/**
 * Accès à l'état appris du modèle (poids et compteurs), initialisé depuis la configuration.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelStateService {

    private final ModelStateRepository repository;
    private final PredictionProperties properties;

    public ModelState getState() {
        return repository.findById(ModelState.SINGLETON_ID).orElseGet(this::initialState);
    }

    public ModelState save(ModelState state) {
        return repository.save(state);
    }

    public CompositeWeights defaultWeights() {
        return CompositeWeights.normalize(properties.getDefaultWeights());
    }

    /** Poids courants ; retombe sur la configuration si l'état stocké est incomplet ou invalide. */
    public CompositeWeights currentWeights() {
        return weightsOf(getState());
    }

    public CompositeWeights weightsOf(ModelState state) {
        try {
            return CompositeWeights.of(state.getWeights());
        } catch (IllegalArgumentException e) {
            log.warn("⚠️ Poids stockés invalides ({}), retour aux poids par défaut", e.getMessage());
            return defaultWeights();
        }
    }

    private ModelState initialState() {
        ModelState state = new ModelState();
        state.setWeights(new EnumMap<>(defaultWeights().asMap()));
        return state;
    }
}
