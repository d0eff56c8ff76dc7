package com.company.placeholder.query;

import com.company.placeholder.exception.QueryExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcQueryRunnerTest {

    private EmbeddedDatabase database;
    private JdbcQueryRunner runner;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .build();
        JdbcTemplate jdbcTemplate = new JdbcTemplate(database);
        jdbcTemplate.execute("CREATE TABLE sales (region VARCHAR(10), amount INT)");
        jdbcTemplate.update("INSERT INTO sales VALUES ('east', 10), ('west', 20)");
        runner = new JdbcQueryRunner(jdbcTemplate, "reports");
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    @DisplayName("rows come back as column maps in result order")
    void returnsRows() {
        List<Map<String, Object>> rows = runner.execute("SELECT region, amount FROM sales ORDER BY amount");

        assertEquals(2, rows.size());
        assertEquals("east", rows.get(0).get("region"));
        assertEquals(20, rows.get(1).get("amount"));
        assertEquals("reports", runner.getDataSourceId());
    }

    @Test
    @DisplayName("database errors become QueryExecutionException")
    void wrapsErrors() {
        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> runner.execute("SELECT missing_column FROM sales"));
        assertTrue(e.getMessage().contains("reports"));
    }
}
