package com.tony.hockeyAnalytics.repository;

import com.tony.hockeyAnalytics.model.HeadToHeadRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface HeadToHeadRecordRepository extends JpaRepository<HeadToHeadRecord, Long> {
    Optional<HeadToHeadRecord> findByMatchupKey(String matchupKey);
}
