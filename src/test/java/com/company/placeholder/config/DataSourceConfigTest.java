package com.company.placeholder.config;

import com.company.placeholder.query.QueryRunner;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PlaceholderConfig.class, DataSourceConfig.class)
            .withPropertyValues(
                    "spring.datasource.url=jdbc:h2:mem:config-cache;DB_CLOSE_DELAY=-1",
                    "spring.datasource.hikari.pool-name=placeholder-cache",
                    "spring.datasource.hikari.maximum-pool-size=3",
                    "placeholder.query.data-source-id=warehouse",
                    "placeholder.query.datasource.url=jdbc:h2:mem:config-report;DB_CLOSE_DELAY=-1",
                    "placeholder.query.datasource.hikari.pool-name=placeholder-report",
                    "placeholder.query.datasource.hikari.maximum-pool-size=2",
                    "placeholder.query.datasource.hikari.read-only=true");

    @Test
    @DisplayName("each pool binds its own hikari block")
    void poolsBindHikariSettings() {
        contextRunner.run(context -> {
            HikariDataSource cache = context.getBean("cacheDataSource", HikariDataSource.class);
            HikariDataSource report = context.getBean("reportDataSource", HikariDataSource.class);

            assertEquals("placeholder-cache", cache.getPoolName());
            assertEquals(3, cache.getMaximumPoolSize());
            assertFalse(cache.isReadOnly());
            assertEquals("jdbc:h2:mem:config-cache;DB_CLOSE_DELAY=-1", cache.getJdbcUrl());

            assertEquals("placeholder-report", report.getPoolName());
            assertEquals(2, report.getMaximumPoolSize());
            assertTrue(report.isReadOnly());
            assertEquals("jdbc:h2:mem:config-report;DB_CLOSE_DELAY=-1", report.getJdbcUrl());
        });
    }

    @Test
    @DisplayName("the primary JdbcTemplate uses the cache pool, the query runner the report pool")
    void templatesAreWiredToTheirPools() {
        contextRunner.run(context -> {
            assertSame(context.getBean("cacheDataSource"), context.getBean(JdbcTemplate.class).getDataSource());
            assertSame(context.getBean("reportDataSource"),
                    context.getBean("reportJdbcTemplate", JdbcTemplate.class).getDataSource());
            assertEquals(60, context.getBean("reportJdbcTemplate", JdbcTemplate.class).getQueryTimeout());
            assertEquals("warehouse", context.getBean(QueryRunner.class).getDataSourceId());
        });
    }
}
