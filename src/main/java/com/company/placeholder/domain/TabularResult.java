package com.company.placeholder.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape of a query result after unpacking: nothing, a single cell, a single row or a row set.
 */
public abstract class TabularResult {

    public enum Shape {
        EMPTY,
        SCALAR,
        ROW,
        ROW_SET
    }

    private TabularResult() {
    }

    public abstract Shape getShape();

    /**
     * Plain Java value: null, the cell value, a field map or a list of field maps
     */
    public abstract Object toValue();

    public static TabularResult empty() {
        return Empty.INSTANCE;
    }

    public static TabularResult scalar(Object value) {
        return new Scalar(value);
    }

    public static TabularResult row(Map<String, Object> fields) {
        return new Row(fields);
    }

    public static TabularResult rowSet(List<Map<String, Object>> rows) {
        return new RowSet(rows);
    }

    @ToString
    public static final class Empty extends TabularResult {
        private static final Empty INSTANCE = new Empty();

        @Override
        public Shape getShape() {
            return Shape.EMPTY;
        }

        @Override
        public Object toValue() {
            return null;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Scalar extends TabularResult {
        private final Object value;

        private Scalar(Object value) {
            this.value = value;
        }

        @Override
        public Shape getShape() {
            return Shape.SCALAR;
        }

        @Override
        public Object toValue() {
            return value;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Row extends TabularResult {
        private final Map<String, Object> fields;

        private Row(Map<String, Object> fields) {
            this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public Shape getShape() {
            return Shape.ROW;
        }

        @Override
        public Object toValue() {
            return fields;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class RowSet extends TabularResult {
        private final List<Map<String, Object>> rows;

        private RowSet(List<Map<String, Object>> rows) {
            this.rows = List.copyOf(rows);
        }

        @Override
        public Shape getShape() {
            return Shape.ROW_SET;
        }

        @Override
        public Object toValue() {
            return rows;
        }

        public int size() {
            return rows.size();
        }
    }
}
