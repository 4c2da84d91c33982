package com.jonathantong.SensorRelay.consumer;

import com.github.shyiko.mysql.binlog.event.Event;
import com.github.shyiko.mysql.binlog.event.EventHeader;
import com.github.shyiko.mysql.binlog.event.EventType;
import com.github.shyiko.mysql.binlog.event.TableMapEventData;
import com.github.shyiko.mysql.binlog.event.WriteRowsEventData;
import com.jonathantong.SensorRelay.model.ChangeEvent;
import com.jonathantong.SensorRelay.model.TableMetadata;
import com.jonathantong.SensorRelay.service.EntityCache;
import com.jonathantong.SensorRelay.service.WatchedEntities;
import com.jonathantong.SensorRelay.util.ValueDecoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Clock;
import java.time.Instant;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Turns the binlog events of one session into accepted entity changes.
 * Not thread-safe: one instance per session, driven by the reading thread.
 */
public class RowEventProcessor {

    private static final Logger logger = LoggerFactory.getLogger(RowEventProcessor.class);

    public static final String STATES_TABLE = "states";
    public static final String STATES_META_TABLE = "states_meta";

    private final String schema;
    private final TableMetadata statesLayout;
    private final TableMetadata statesMetaLayout;
    private final EntityCache entityCache;
    private final WatchedEntities watchedEntities;
    private final Clock clock;
    private final Consumer<ChangeEvent> emit;

    // binlog table id -> watched table name, as announced by TABLE_MAP events
    private final Map<Long, String> watchedTableIds = new HashMap<>();

    public RowEventProcessor(
            String schema,
            TableMetadata statesLayout,
            TableMetadata statesMetaLayout,
            EntityCache entityCache,
            WatchedEntities watchedEntities,
            Clock clock,
            Consumer<ChangeEvent> emit) {
        this.schema = schema;
        this.statesLayout = statesLayout;
        this.statesMetaLayout = statesMetaLayout;
        this.entityCache = entityCache;
        this.watchedEntities = watchedEntities;
        this.clock = clock;
        this.emit = emit;
    }

    /**
     * Handle one binlog event. Never throws: a bad event is logged and skipped.
     */
    public void onEvent(Event event) {
        try {
            EventHeader header = event.getHeader();
            EventType eventType = header.getEventType();

            if (eventType == EventType.TABLE_MAP) {
                TableMapEventData tableMap = event.getData();
                handleTableMap(tableMap);
            } else if (EventType.isWrite(eventType)) {
                WriteRowsEventData writeRows = event.getData();
                handleWriteRows(writeRows);
            }
        } catch (Exception e) {
            logger.warn("Skipping binlog event: {}", e.getMessage(), e);
        }
    }

    private void handleTableMap(TableMapEventData tableMap) {
        String table = tableMap.getTable();
        boolean watchedTable = STATES_TABLE.equals(table) || STATES_META_TABLE.equals(table);

        if (watchedTable && inSchema(tableMap.getDatabase())) {
            watchedTableIds.put(tableMap.getTableId(), table);
        } else {
            // Table ids are reassigned after DDL, so drop stale bindings
            watchedTableIds.remove(tableMap.getTableId());
        }
    }

    private boolean inSchema(String database) {
        return schema == null || schema.isEmpty() || schema.equalsIgnoreCase(database);
    }

    private void handleWriteRows(WriteRowsEventData writeRows) {
        String table = watchedTableIds.get(writeRows.getTableId());
        if (table == null || writeRows.getRows() == null) {
            return;
        }

        boolean metaTable = STATES_META_TABLE.equals(table);
        TableMetadata layout = metaTable ? statesMetaLayout : statesLayout;

        for (Serializable[] row : writeRows.getRows()) {
            try {
                Map<String, Serializable> values = toColumnMap(layout, writeRows.getIncludedColumns(), row);
                if (metaTable) {
                    handleRegistration(values);
                } else {
                    handleStateChange(values);
                }
            } catch (Exception e) {
                logger.warn("Skipping row of table {}: {}", table, e.getMessage());
            }
        }
    }

    private void handleRegistration(Map<String, Serializable> values) {
        Long metadataId = ValueDecoding.toLong(values.get("metadata_id"));
        String entityId = ValueDecoding.decodeText(values.get("entity_id"));

        if (metadataId != null && entityId != null && !entityId.isEmpty()) {
            entityCache.update(metadataId, entityId);
            logger.info("New entity registered: {} -> {}", metadataId, entityId);
        }
    }

    private void handleStateChange(Map<String, Serializable> values) {
        Long metadataId = ValueDecoding.toLong(values.get("metadata_id"));
        if (metadataId == null) {
            logger.debug("State row without metadata_id, skipping");
            return;
        }

        String state = ValueDecoding.decodeText(values.get("state"));
        String entityId = entityCache.resolve(metadataId).orElse(null);

        if (entityId == null) {
            logger.info("State change for Unknown_ID_{}: {}", metadataId, state);
            return;
        }

        if (!watchedEntities.contains(entityId)) {
            logger.debug("State change for {}: {}", entityId, state);
            return;
        }

        Instant observedAt = ValueDecoding.toInstant(values.get("last_updated_ts"));
        ChangeEvent event = new ChangeEvent(entityId, state, observedAt != null ? observedAt : clock.instant());

        logger.info("Watched entity {} changed: {}", entityId, state);
        emit.accept(event);
    }

    /**
     * Map positional row values to column names. A row only carries the columns set in
     * {@code includedColumns}, in ordinal order.
     */
    static Map<String, Serializable> toColumnMap(TableMetadata layout, BitSet includedColumns, Serializable[] row) {
        Map<String, Serializable> values = new HashMap<>();

        if (includedColumns == null) {
            for (int i = 0; i < row.length; i++) {
                putColumn(values, layout.columnAt(i), row[i]);
            }
            return values;
        }

        int valueIndex = 0;
        for (int column = includedColumns.nextSetBit(0);
             column >= 0 && valueIndex < row.length;
             column = includedColumns.nextSetBit(column + 1)) {
            putColumn(values, layout.columnAt(column), row[valueIndex++]);
        }
        return values;
    }

    private static void putColumn(Map<String, Serializable> values, String column, Serializable value) {
        if (column != null) {
            values.put(column, value);
        }
    }
}
