package com.company.placeholder.template;

import com.company.placeholder.exception.MissingTemplateParameterException;
import lombok.Value;

import java.util.List;

/**
 * Filled SQL plus the tokens that stayed unfilled because no parameter matched.
 */
@Value
public class FillResult {
    String sql;
    List<String> missingKeys;

    public boolean isComplete() {
        return missingKeys.isEmpty();
    }

    public String requireComplete() {
        if (!isComplete()) {
            throw new MissingTemplateParameterException(missingKeys);
        }
        return sql;
    }
}
