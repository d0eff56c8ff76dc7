package com.company.placeholder.query;

import com.company.placeholder.domain.TabularResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultUnpackerTest {

    @Test
    @DisplayName("[{count: 5}] → 5")
    void singleCell() {
        TabularResult result = ResultUnpacker.unpack(List.of(Map.of("count", 5)));

        assertEquals(TabularResult.Shape.SCALAR, result.getShape());
        assertEquals(5, result.toValue());
    }

    @Test
    @DisplayName("[{a: 1, b: 2}] → the row")
    void singleRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("a", 1);
        row.put("b", 2);

        TabularResult result = ResultUnpacker.unpack(List.of(row));

        assertEquals(TabularResult.Shape.ROW, result.getShape());
        assertEquals(row, result.toValue());
        assertEquals(List.of("a", "b"), List.copyOf(((TabularResult.Row) result).getFields().keySet()));
    }

    @Test
    @DisplayName("[] and null → empty")
    void empty() {
        assertEquals(TabularResult.Shape.EMPTY, ResultUnpacker.unpack(List.of()).getShape());
        assertNull(ResultUnpacker.unpack(List.of()).toValue());
        assertEquals(TabularResult.Shape.EMPTY, ResultUnpacker.unpack(null).getShape());
    }

    @Test
    @DisplayName("[{x: 1}, {x: 2}] → both rows")
    void rowSet() {
        List<Map<String, Object>> rows = List.of(Map.of("x", 1), Map.of("x", 2));

        TabularResult result = ResultUnpacker.unpack(rows);

        assertEquals(TabularResult.Shape.ROW_SET, result.getShape());
        assertEquals(rows, result.toValue());
        assertEquals(2, ((TabularResult.RowSet) result).size());
    }

    @Test
    @DisplayName("a single NULL cell is a scalar holding null")
    void nullCell() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("total", null);

        TabularResult result = ResultUnpacker.unpack(List.of(row));

        assertEquals(TabularResult.Shape.SCALAR, result.getShape());
        assertNull(result.toValue());
    }
}
