package com.tony.hockeyAnalytics.service;

import com.opencsv.bean.CsvBindByName;
import com.opencsv.bean.CsvToBeanBuilder;
import com.tony.hockeyAnalytics.model.EventType;
import com.tony.hockeyAnalytics.model.GameEvent;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lecture d'un fichier play-by-play CSV en événements ordonnés.
 * Les lignes dont le type d'événement n'est pas géré sont écartées.
 */
@Service
@Slf4j
public class PlayByPlayCsvReader {

    public List<GameEvent> read(Reader reader) {
        List<PlayByPlayRow> rows = new CsvToBeanBuilder<PlayByPlayRow>(reader)
                .withType(PlayByPlayRow.class).withSeparator(',').withIgnoreLeadingWhiteSpace(true).build().parse();

        List<GameEvent> events = new ArrayList<>();
        int dropped = 0;
        for (PlayByPlayRow row : rows) {
            Optional<EventType> type = EventType.fromCode(row.getEventType());
            if (type.isEmpty()) {
                dropped++;
                log.debug("Type d'événement non géré ignoré : {}", row.getEventType());
                continue;
            }
            events.add(GameEvent.builder()
                    .type(type.get())
                    .teamId(row.getTeamId())
                    .period(row.getPeriod() != null ? row.getPeriod() : 0)
                    .periodType(row.getPeriodType())
                    .timeInPeriod(row.getTimeInPeriod())
                    .x(row.getX())
                    .y(row.getY())
                    .shotType(row.getShotType())
                    .situationCode(row.getSituationCode())
                    .penaltyMinutes(row.getPenaltyMinutes())
                    .playerId(row.getPlayerId())
                    .assist1PlayerId(row.getAssist1PlayerId())
                    .assist2PlayerId(row.getAssist2PlayerId())
                    .opposingPlayerId(row.getOpposingPlayerId())
                    .build());
        }
        log.info("📥 {} événements lus ({} lignes ignorées)", events.size(), dropped);
        return events;
    }

    @Data
    public static class PlayByPlayRow {
        @CsvBindByName(column = "period") private Integer period;
        @CsvBindByName(column = "periodType") private String periodType;
        @CsvBindByName(column = "timeInPeriod") private String timeInPeriod;
        @CsvBindByName(column = "eventType") private String eventType;
        @CsvBindByName(column = "teamId") private Long teamId;
        @CsvBindByName(column = "x") private Double x;
        @CsvBindByName(column = "y") private Double y;
        @CsvBindByName(column = "shotType") private String shotType;
        @CsvBindByName(column = "situationCode") private String situationCode;
        @CsvBindByName(column = "penaltyMinutes") private Integer penaltyMinutes;
        @CsvBindByName(column = "playerId") private Long playerId;
        @CsvBindByName(column = "assist1PlayerId") private Long assist1PlayerId;
        @CsvBindByName(column = "assist2PlayerId") private Long assist2PlayerId;
        @CsvBindByName(column = "opposingPlayerId") private Long opposingPlayerId;
    }
}
