package com.company.placeholder.query;

import com.company.placeholder.exception.QueryExecutionException;

import java.util.List;
import java.util.Map;

/**
 * Executes filled SQL against one report data source. Possibly slow, possibly failing;
 * connection handling and retries belong to the implementation.
 */
public interface QueryRunner {

    String getDataSourceId();

    /**
     * @return rows as column-name to value maps, in result order
     * @throws QueryExecutionException when the statement cannot be executed
     */
    List<Map<String, Object>> execute(String sql);
}
