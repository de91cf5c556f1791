package com.tony.hockeyAnalytics.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.EnumMap;
import java.util.Map;

@Converter
public class MetricValuesConverter implements AttributeConverter<Map<CompositeMetric, Double>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<CompositeMetric, Double>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(Map<CompositeMetric, Double> attribute) {
        if (attribute == null) return null;
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Sérialisation des métriques impossible", e);
        }
    }

    @Override
    public Map<CompositeMetric, Double> convertToEntityAttribute(String dbData) {
        Map<CompositeMetric, Double> values = new EnumMap<>(CompositeMetric.class);
        if (dbData == null || dbData.isBlank()) return values;
        try {
            values.putAll(MAPPER.readValue(dbData, TYPE));
            return values;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Métriques illisibles", e);
        }
    }
}
