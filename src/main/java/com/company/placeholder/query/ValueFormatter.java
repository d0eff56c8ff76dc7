package com.company.placeholder.query;

import com.company.placeholder.domain.DisplayName;
import com.company.placeholder.domain.TabularResult;

import java.math.BigDecimal;

public final class ValueFormatter {

    private ValueFormatter() {
    }

    /**
     * Percentage-type names render numeric scalars as "value%"; everything else passes through
     */
    public static Object format(DisplayName name, TabularResult result) {
        Object value = result.toValue();
        if (name.formatsAsPercentage() && value instanceof Number) {
            return renderNumber((Number) value) + "%";
        }
        return value;
    }

    static String renderNumber(Number number) {
        if (number instanceof BigDecimal) {
            return ((BigDecimal) number).toPlainString();
        }
        return number.toString();
    }
}
