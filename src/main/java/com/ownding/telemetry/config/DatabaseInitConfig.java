package com.ownding.telemetry.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class DatabaseInitConfig {

    private static final String SERIES_INDEX = "idx_sensor_sample_series";

    private static final Logger log = LoggerFactory.getLogger(DatabaseInitConfig.class);
    private final JdbcClient jdbcClient;

    public DatabaseInitConfig(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    @PostConstruct
    public void verifySchema() {
        try {
            String journalMode = jdbcClient.sql("PRAGMA journal_mode=WAL;").query(String.class).single();
            log.info("sqlite journal_mode={}", journalMode);
        } catch (Exception ex) {
            log.warn("SQLite journal_mode init failed: {}", ex.getMessage());
        }

        // Ranking must be an index range scan per series, never a table scan.
        boolean indexed = jdbcClient.sql("""
                        SELECT COUNT(*)
                        FROM sqlite_master
                        WHERE type = 'index' AND name = :name
                        """)
                .param("name", SERIES_INDEX)
                .query(Integer.class)
                .single() > 0;
        if (!indexed) {
            log.error("series index {} is missing, retention ranking will scan sensor_sample", SERIES_INDEX);
        }
    }

    @Scheduled(fixedDelayString = "${app.retention.wal-checkpoint-interval-ms:600000}")
    public void walCheckpoint() {
        try {
            jdbcClient.sql("PRAGMA wal_checkpoint(TRUNCATE);").query().listOfRows();
        } catch (Exception ex) {
            log.debug("WAL checkpoint failed: {}", ex.getMessage());
        }
    }
}
