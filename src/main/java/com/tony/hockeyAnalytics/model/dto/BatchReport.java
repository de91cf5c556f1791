package com.tony.hockeyAnalytics.model.dto;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class BatchReport {
    List<String> processedGameIds;
    // gameId -> raison du rejet
    Map<String, String> skippedGames;

    public int getProcessedCount() {
        return processedGameIds.size();
    }

    public int getSkippedCount() {
        return skippedGames.size();
    }
}
