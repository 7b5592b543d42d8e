package com.medlake.telegram.service;

import com.medlake.telegram.config.PipelineProperties;
import com.medlake.telegram.config.StorageDialect;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.util.UUID;

/**
 * Private in-memory database per test, in PostgreSQL compatibility mode.
 */
final class H2TestDatabase {

    final JdbcTemplate jdbcTemplate;
    final DataSourceTransactionManager transactionManager;
    final RawStorageSchema schema;

    H2TestDatabase(PipelineProperties properties) {
        properties.getStorage().setDialect(StorageDialect.H2);
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:test_" + UUID.randomUUID().toString().replace("-", "")
                        + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1", "sa", "");
        dataSource.setDriverClassName("org.h2.Driver");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionManager = new DataSourceTransactionManager(dataSource);
        this.schema = new RawStorageSchema(jdbcTemplate, properties);
    }

    int count(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count != null ? count : 0;
    }

    void shutdown() {
        jdbcTemplate.execute("SHUTDOWN");
    }
}
