package com.tony.hockeyAnalytics.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record PredictionRequest(
        @NotBlank(message = "L'identifiant du match est requis") String gameId,
        @NotNull(message = "La date du match est requise") LocalDate gameDate,
        @NotBlank(message = "L'équipe extérieure est requise") String awayTeam,
        @NotBlank(message = "L'équipe à domicile est requise") String homeTeam
) {}
