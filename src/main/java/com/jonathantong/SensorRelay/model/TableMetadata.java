package com.jonathantong.SensorRelay.model;

import java.util.List;

/**
 * Column layout of a watched table, in ordinal order.
 * Binlog rows carry positional values only, so this is what maps them back to column names.
 */
public class TableMetadata {

    private final String tableName;
    private final List<String> columnNames;

    public TableMetadata(String tableName, List<String> columnNames) {
        this.tableName = tableName;
        this.columnNames = List.copyOf(columnNames);
    }

    public boolean hasColumns() {
        return !columnNames.isEmpty();
    }

    /**
     * Column name at a zero-based ordinal position, or null when the table has fewer columns
     */
    public String columnAt(int position) {
        return position >= 0 && position < columnNames.size() ? columnNames.get(position) : null;
    }

    @Override
    public String toString() {
        return "TableMetadata{" +
                "tableName='" + tableName + '\'' +
                ", columnNames=" + columnNames +
                '}';
    }
}
