package com.tony.hockeyAnalytics.repository;

import com.tony.hockeyAnalytics.model.PredictionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface PredictionRecordRepository extends JpaRepository<PredictionRecord, Long> {
    Optional<PredictionRecord> findByGameId(String gameId);

    // Historique complet des matchs dont le résultat est connu, du plus ancien au plus récent
    List<PredictionRecord> findByActualWinnerIsNotNullOrderByGameDateAsc();

    long countByActualWinnerIsNotNull();

    @Query("SELECT AVG(p.brierScore) FROM PredictionRecord p WHERE p.brierScore IS NOT NULL")
    Double findAverageBrierScore();
}
