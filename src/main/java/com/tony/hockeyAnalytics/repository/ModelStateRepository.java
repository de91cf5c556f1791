package com.tony.hockeyAnalytics.repository;

import com.tony.hockeyAnalytics.model.ModelState;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ModelStateRepository extends JpaRepository<ModelState, Long> {
}
