package com.datalake.storage.table;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * JDBC connection pool for the relational table store (MariaDB).
 *
 * The pool is created lazily-failing: the service starts and serves file
 * collections even when the database is down.
 */
@Configuration
public class RelationalStoreConfig {
    private static final Logger logger = LoggerFactory.getLogger(RelationalStoreConfig.class);

    @Value("${datalake.storage.relational.url:jdbc:mariadb://localhost:3306/datalake}")
    private String url;

    @Value("${datalake.storage.relational.username:datalake}")
    private String username;

    @Value("${datalake.storage.relational.password:}")
    private String password;

    @Value("${datalake.storage.relational.pool-size:10}")
    private int poolSize;

    @Value("${datalake.storage.relational.query-timeout-seconds:30}")
    private int queryTimeoutSeconds;

    /**
     * Create the relational DataSource with connection pooling
     */
    @Bean(name = "relationalDataSource", destroyMethod = "close")
    public HikariDataSource relationalDataSource() {
        HikariConfig config = new HikariConfig();
        config.setPoolName("datalake-relational");
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);

        // Connection pool settings
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(10000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);
        // Do not fail startup when the database is unreachable
        config.setInitializationFailTimeout(-1);
        config.setReadOnly(true);

        HikariDataSource dataSource = new HikariDataSource(config);
        logger.info("Relational DataSource initialized: {} (pool size {})", url, poolSize);
        return dataSource;
    }

    /**
     * Create JdbcTemplate for relational table reads
     */
    @Bean(name = "relationalJdbcTemplate")
    public JdbcTemplate relationalJdbcTemplate(@Qualifier("relationalDataSource") HikariDataSource relationalDataSource) {
        JdbcTemplate template = new JdbcTemplate(relationalDataSource);
        template.setQueryTimeout(queryTimeoutSeconds);
        return template;
    }
}
