package com.company.placeholder.support;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Fresh in-memory cache table per instance.
 */
public class CacheTestDatabase implements AutoCloseable {

    private final EmbeddedDatabase database;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public CacheTestDatabase() {
        this.database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .addScript("classpath:schema-h2.sql")
                .build();
        this.jdbcTemplate = new JdbcTemplate(database);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(database));
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    public TransactionTemplate transactionTemplate() {
        return transactionTemplate;
    }

    public int count(String whereClause, Object... args) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM placeholder_cache_entries WHERE " + whereClause, Integer.class, args);
        return count != null ? count : 0;
    }

    @Override
    public void close() {
        database.shutdown();
    }
}
