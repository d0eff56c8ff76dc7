package com.company.placeholder.config;

import com.company.placeholder.query.JdbcQueryRunner;
import com.company.placeholder.query.QueryRunner;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Two data sources: the primary one holds the cache table, the report one
 * is where filled placeholder SQL runs. Each pool takes its settings from the
 * {@code hikari} block under its own prefix.
 */
@Configuration
public class DataSourceConfig {

    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource")
    public DataSourceProperties cacheDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariDataSource cacheDataSource(DataSourceProperties cacheDataSourceProperties) {
        return cacheDataSourceProperties.initializeDataSourceBuilder()
                .type(HikariDataSource.class)
                .build();
    }

    @Bean
    @Primary
    public JdbcTemplate jdbcTemplate(HikariDataSource cacheDataSource) {
        return new JdbcTemplate(cacheDataSource);
    }

    @Bean
    @ConfigurationProperties("placeholder.query.datasource")
    public DataSourceProperties reportDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @ConfigurationProperties("placeholder.query.datasource.hikari")
    public HikariDataSource reportDataSource(
            @Qualifier("reportDataSourceProperties") DataSourceProperties reportDataSourceProperties) {
        return reportDataSourceProperties.initializeDataSourceBuilder()
                .type(HikariDataSource.class)
                .build();
    }

    @Bean
    public JdbcTemplate reportJdbcTemplate(@Qualifier("reportDataSource") HikariDataSource reportDataSource) {
        JdbcTemplate template = new JdbcTemplate(reportDataSource);
        template.setQueryTimeout(60);
        return template;
    }

    @Bean
    public QueryRunner queryRunner(@Qualifier("reportJdbcTemplate") JdbcTemplate reportJdbcTemplate,
                                   PlaceholderProperties properties) {
        return new JdbcQueryRunner(reportJdbcTemplate, properties.getQuery().getDataSourceId());
    }
}
