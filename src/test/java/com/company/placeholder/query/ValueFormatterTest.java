package com.company.placeholder.query;

import com.company.placeholder.domain.DisplayName;
import com.company.placeholder.domain.TabularResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValueFormatterTest {

    @Test
    @org.junit.jupiter.api.DisplayName("销售额占比 with 42.5 → \"42.5%\"")
    void percentageName() {
        assertEquals("42.5%", ValueFormatter.format(DisplayName.of("销售额占比"), TabularResult.scalar(42.5)));
    }

    @Test
    @org.junit.jupiter.api.DisplayName("chart names keep the raw number")
    void chartNameUnchanged() {
        assertEquals(42.5, ValueFormatter.format(DisplayName.of("销售额占比图表"), TabularResult.scalar(42.5)));
    }

    @Test
    @org.junit.jupiter.api.DisplayName("百分比 also marks a percentage; decimals keep their scale")
    void percentSynonym() {
        assertEquals("12.50%", ValueFormatter.format(DisplayName.of("退货百分比"),
                TabularResult.scalar(new BigDecimal("12.50"))));
    }

    @Test
    @org.junit.jupiter.api.DisplayName("non-numeric values pass through")
    void nonNumeric() {
        assertEquals("n/a", ValueFormatter.format(DisplayName.of("销售额占比"), TabularResult.scalar("n/a")));

        Map<String, Object> row = Map.of("share", 1);
        assertEquals(row, ValueFormatter.format(DisplayName.of("销售额占比"), TabularResult.row(row)));
    }

    @Test
    @org.junit.jupiter.api.DisplayName("plain names leave numbers alone")
    void plainName() {
        assertEquals(100L, ValueFormatter.format(DisplayName.of("订单总数"), TabularResult.scalar(100L)));
    }
}
