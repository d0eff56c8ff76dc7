package com.company.placeholder.query;

import com.company.placeholder.domain.TabularResult;

import java.util.List;
import java.util.Map;

/**
 * Reduces raw rows to the shape a placeholder renders as.
 */
public final class ResultUnpacker {

    private ResultUnpacker() {
    }

    /**
     * No rows: empty. One row with one column: the cell. One row with several columns: the row.
     * More than one row: the whole row set.
     */
    public static TabularResult unpack(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return TabularResult.empty();
        }
        if (rows.size() > 1) {
            return TabularResult.rowSet(rows);
        }

        Map<String, Object> row = rows.get(0);
        if (row.size() == 1) {
            return TabularResult.scalar(row.values().iterator().next());
        }
        return TabularResult.row(row);
    }
}
