package com.jonathantong.SensorRelay.service;

import com.jonathantong.SensorRelay.model.TableMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service for looking up the column layout of watched tables
 */
@Service
public class TableSchemaService {

    private static final Logger logger = LoggerFactory.getLogger(TableSchemaService.class);

    private final JdbcTemplate sourceJdbcTemplate;

    // Cache for table metadata to avoid repeated information_schema queries
    private final Map<String, TableMetadata> tableMetadataCache = new ConcurrentHashMap<>();

    @Autowired
    public TableSchemaService(JdbcTemplate sourceJdbcTemplate) {
        this.sourceJdbcTemplate = sourceJdbcTemplate;
    }

    /**
     * Get the column layout of a table, loading it on first use
     *
     * @throws IllegalStateException when the table does not exist in the schema
     */
    public TableMetadata getTableMetadata(String schema, String tableName) {
        return tableMetadataCache.computeIfAbsent(schema + "." + tableName,
                key -> loadTableMetadata(schema, tableName));
    }

    /**
     * Drop cached layouts; a reconnect may follow a schema migration
     */
    public void invalidate() {
        tableMetadataCache.clear();
    }

    private TableMetadata loadTableMetadata(String schema, String tableName) {
        String sql = """
            SELECT column_name
            FROM information_schema.columns
            WHERE table_schema = ? AND table_name = ?
            ORDER BY ordinal_position
            """;

        List<String> columns = sourceJdbcTemplate.queryForList(sql, String.class, schema, tableName);
        TableMetadata metadata = new TableMetadata(tableName, columns);

        if (!metadata.hasColumns()) {
            throw new IllegalStateException("No column information found for table " + schema + "." + tableName);
        }

        logger.debug("Loaded layout for {}.{}: {}", schema, tableName, columns);
        return metadata;
    }
}
