package com.company.placeholder.query;

import com.company.placeholder.exception.QueryExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
@Slf4j
public class JdbcQueryRunner implements QueryRunner {

    private final JdbcTemplate jdbcTemplate;
    private final String dataSourceId;

    @Override
    public String getDataSourceId() {
        return dataSourceId;
    }

    @Override
    public List<Map<String, Object>> execute(String sql) {
        long start = System.currentTimeMillis();
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql);
            log.debug("Query on {} returned {} row(s) in {}ms",
                    dataSourceId, rows.size(), System.currentTimeMillis() - start);
            return rows;
        } catch (DataAccessException e) {
            throw new QueryExecutionException(
                    "Query on data source " + dataSourceId + " failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
