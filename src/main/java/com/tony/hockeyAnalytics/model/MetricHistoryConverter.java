package com.tony.hockeyAnalytics.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Stocke les listes glissantes d'un profil en JSON (ordre d'insertion conservé).
 */
@Converter
public class MetricHistoryConverter implements AttributeConverter<Map<CompositeMetric, List<Double>>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<CompositeMetric, List<Double>>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(Map<CompositeMetric, List<Double>> attribute) {
        if (attribute == null) return null;
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Sérialisation de l'historique impossible", e);
        }
    }

    @Override
    public Map<CompositeMetric, List<Double>> convertToEntityAttribute(String dbData) {
        Map<CompositeMetric, List<Double>> history = new EnumMap<>(CompositeMetric.class);
        if (dbData == null || dbData.isBlank()) return history;
        try {
            MAPPER.readValue(dbData, TYPE).forEach((metric, values) -> history.put(metric, new ArrayList<>(values)));
            return history;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Historique de profil illisible", e);
        }
    }
}
