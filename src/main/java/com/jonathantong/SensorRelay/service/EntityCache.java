package com.jonathantong.SensorRelay.service;

import com.jonathantong.SensorRelay.util.ValueDecoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory view of the states_meta table: metadata_id to entity_id.
 * Read and written by the binlog reader while other threads may read it.
 */
@Service
public class EntityCache {

    private static final Logger logger = LoggerFactory.getLogger(EntityCache.class);

    private static final String LOAD_SQL = "SELECT metadata_id, entity_id FROM states_meta";

    private final JdbcTemplate sourceJdbcTemplate;

    private final Map<Long, String> entities = new ConcurrentHashMap<>();

    @Autowired
    public EntityCache(JdbcTemplate sourceJdbcTemplate) {
        this.sourceJdbcTemplate = sourceJdbcTemplate;
    }

    /**
     * Rebuild the cache from a full scan of states_meta.
     * A failed scan is logged and leaves the current entries untouched.
     *
     * @return the scanned entries, empty when the scan failed
     */
    public Map<Long, String> load() {
        logger.info("Loading entity metadata from states_meta...");

        List<Map<String, Object>> rows;
        try {
            rows = sourceJdbcTemplate.queryForList(LOAD_SQL);
        } catch (DataAccessException e) {
            logger.error("Failed to load entity metadata, continuing with {} cached entries: {}",
                    entities.size(), e.getMessage());
            return Map.of();
        }

        Map<Long, String> loaded = new HashMap<>();
        for (Map<String, Object> row : rows) {
            Long metadataId = ValueDecoding.toLong(row.get("metadata_id"));
            String entityId = ValueDecoding.decodeText(row.get("entity_id"));
            if (metadataId != null && entityId != null) {
                loaded.put(metadataId, entityId);
            }
        }

        entities.putAll(loaded);
        entities.keySet().retainAll(loaded.keySet());

        logger.info("Loaded {} entities into the metadata cache", loaded.size());
        return loaded;
    }

    public void update(long metadataId, String entityId) {
        entities.put(metadataId, entityId);
    }

    public Optional<String> resolve(long metadataId) {
        return Optional.ofNullable(entities.get(metadataId));
    }

    public int size() {
        return entities.size();
    }
}
