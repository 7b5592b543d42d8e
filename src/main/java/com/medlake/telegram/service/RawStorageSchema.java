package com.medlake.telegram.service;

import com.medlake.telegram.config.PipelineProperties;
import com.medlake.telegram.config.StorageDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Owns the DDL of the raw schema. The tables are the fixed input contract of the downstream modeling
 * layer, so names and key columns must not drift.
 */
@Service
public class RawStorageSchema {

    private static final Logger logger = LoggerFactory.getLogger(RawStorageSchema.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    public static final String MESSAGES_TABLE = "raw_telegram_messages";
    public static final String DETECTIONS_TABLE = "raw_yolo_detections";
    public static final String PROCESSED_ASSETS_TABLE = "processed_media_assets";

    private final JdbcTemplate jdbcTemplate;
    private final String schema;
    private final StorageDialect dialect;

    // Cached after the first successful run; if the schema is dropped at runtime, restart the app.
    private volatile boolean ensured;

    public RawStorageSchema(JdbcTemplate jdbcTemplate, PipelineProperties properties) {
        String configured = properties.getStorage().getSchema();
        if (configured == null || !IDENTIFIER.matcher(configured).matches()) {
            throw new IllegalArgumentException("Invalid storage schema name: " + configured);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.schema = configured;
        this.dialect = properties.getStorage().getDialect();
    }

    public StorageDialect dialect() {
        return dialect;
    }

    public String messagesTable() {
        return schema + "." + MESSAGES_TABLE;
    }

    public String detectionsTable() {
        return schema + "." + DETECTIONS_TABLE;
    }

    public String processedAssetsTable() {
        return schema + "." + PROCESSED_ASSETS_TABLE;
    }

    /**
     * Creates the schema and its tables when missing. Safe to call before every batch.
     *
     * @throws org.springframework.dao.DataAccessException when storage cannot be reached
     */
    public void ensureSchema() {
        if (ensured) {
            return;
        }
        synchronized (this) {
            if (ensured) {
                return;
            }
            for (String statement : ddl()) {
                jdbcTemplate.execute(statement);
            }
            ensured = true;
            logger.info("Raw storage schema '{}' is ready ({})", schema, dialect);
        }
    }

    List<String> ddl() {
        String json = dialect.jsonColumnType();
        return List.of(
                "CREATE SCHEMA IF NOT EXISTS " + schema,
                "CREATE TABLE IF NOT EXISTS " + messagesTable() + " ("
                        + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                        + "message_id BIGINT NOT NULL, "
                        + "channel_username VARCHAR(255) NOT NULL, "
                        + "message_data " + json + " NOT NULL, "
                        + "scraped_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP, "
                        + "CONSTRAINT uq_raw_telegram_messages_key UNIQUE (message_id, channel_username))",
                "CREATE TABLE IF NOT EXISTS " + detectionsTable() + " ("
                        + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                        + "message_id BIGINT NOT NULL, "
                        + "image_filename VARCHAR(512) NOT NULL, "
                        + "detected_object_class VARCHAR(255) NOT NULL, "
                        + "confidence DOUBLE PRECISION NOT NULL, "
                        + "bounding_box " + json + ", "
                        + "detection_timestamp TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP, "
                        + "CONSTRAINT uq_raw_yolo_detections_key "
                        + "UNIQUE (message_id, image_filename, detected_object_class, confidence))",
                "CREATE TABLE IF NOT EXISTS " + processedAssetsTable() + " ("
                        + "image_filename VARCHAR(512) PRIMARY KEY, "
                        + "message_id BIGINT NOT NULL, "
                        + "detection_count INTEGER NOT NULL, "
                        + "model_name VARCHAR(255), "
                        + "processed_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP)");
    }
}
