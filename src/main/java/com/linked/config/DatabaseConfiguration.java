package com.linked.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;

/**
 * Builds the single storage handle. Every connection gets foreign keys (for click cascade),
 * WAL journaling and a busy timeout so concurrent writers wait instead of failing.
 */
@Slf4j
@Configuration
public class DatabaseConfiguration {

    static final int BUSY_TIMEOUT_MILLIS = 5000;

    @Bean
    public DataSource dataSource(LinkedProperties properties) {
        log.info("opening database at {}", properties.getDbPath());
        return sqliteDataSource(properties.getDbPath());
    }

    public static DataSource sqliteDataSource(String dbPath) {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);

        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + dbPath);
        return dataSource;
    }
}
