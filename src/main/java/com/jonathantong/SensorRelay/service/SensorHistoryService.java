package com.jonathantong.SensorRelay.service;

import com.jonathantong.SensorRelay.model.ChangeEvent;
import com.jonathantong.SensorRelay.model.SensorReading;
import com.jonathantong.SensorRelay.util.ValueDecoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the most recent stored states of watched entities straight from the database
 */
@Service
public class SensorHistoryService {

    private static final Logger logger = LoggerFactory.getLogger(SensorHistoryService.class);

    private static final String LATEST_STATES_SQL = """
            SELECT s.state, s.last_updated_ts
            FROM states s
            JOIN states_meta sm ON s.metadata_id = sm.metadata_id
            WHERE sm.entity_id = ?
            ORDER BY s.last_updated_ts DESC
            LIMIT ?
            """;

    private final JdbcTemplate sourceJdbcTemplate;
    private final WatchedEntities watchedEntities;
    private final Clock clock;

    @Autowired
    public SensorHistoryService(JdbcTemplate sourceJdbcTemplate, WatchedEntities watchedEntities, Clock clock) {
        this.sourceJdbcTemplate = sourceJdbcTemplate;
        this.watchedEntities = watchedEntities;
        this.clock = clock;
    }

    /**
     * Latest values of every watched entity, newest first.
     * Database errors propagate as {@link org.springframework.dao.DataAccessException}.
     */
    public Map<String, List<SensorReading>> latestReadings(int limit) {
        Map<String, List<SensorReading>> results = new LinkedHashMap<>();

        for (String entityId : watchedEntities.getEntityIds()) {
            List<SensorReading> values = new ArrayList<>();
            for (ChangeEvent event : latestEvents(entityId, limit)) {
                values.add(new SensorReading(event.getState(), event.getDateHeure()));
            }
            logger.debug("{}: {} rows found", entityId, values.size());
            results.put(entityId, values);
        }

        return results;
    }

    /**
     * Latest values of one entity as wire events, newest first
     */
    public List<ChangeEvent> latestEvents(String entityId, int limit) {
        List<Map<String, Object>> rows = sourceJdbcTemplate.queryForList(LATEST_STATES_SQL, entityId, limit);

        List<ChangeEvent> events = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            String state = ValueDecoding.decodeText(row.get("state"));
            Instant observedAt = ValueDecoding.toInstant(row.get("last_updated_ts"));
            events.add(new ChangeEvent(entityId, state, observedAt != null ? observedAt : clock.instant()));
        }
        return events;
    }
}
