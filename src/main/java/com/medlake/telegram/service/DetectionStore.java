package com.medlake.telegram.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medlake.telegram.model.DetectedObject;
import com.medlake.telegram.model.MediaAssetName;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;

/**
 * JDBC access to {@code raw_yolo_detections} and the processed-asset ledger.
 */
@Service
public class DetectionStore {

    private final JdbcTemplate jdbcTemplate;
    private final RawStorageSchema schema;
    private final ObjectMapper objectMapper;

    public DetectionStore(JdbcTemplate jdbcTemplate, RawStorageSchema schema, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.schema = schema;
        this.objectMapper = objectMapper;
    }

    public boolean hasDetections(MediaAssetName asset) {
        Integer found = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + schema.detectionsTable() + " WHERE message_id = ? AND image_filename = ?",
                Integer.class, asset.messageId(), asset.fileName());
        return found != null && found > 0;
    }

    public boolean isRecordedAsProcessed(String imageFilename) {
        Integer found = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + schema.processedAssetsTable() + " WHERE image_filename = ?",
                Integer.class, imageFilename);
        return found != null && found > 0;
    }

    /**
     * @return true when the detection was new
     */
    public boolean insertDetection(MediaAssetName asset, DetectedObject detection) {
        String sql = "INSERT INTO " + schema.detectionsTable()
                + " (message_id, image_filename, detected_object_class, confidence, bounding_box) VALUES (?, ?, ?, ?, "
                + schema.dialect().jsonBindExpression() + ") ON CONFLICT DO NOTHING";
        return jdbcTemplate.update(sql, asset.messageId(), asset.fileName(), detection.label(),
                detection.confidence(), toJson(detection)) == 1;
    }

    public void recordProcessed(MediaAssetName asset, int detectionCount, String modelName) {
        jdbcTemplate.update("INSERT INTO " + schema.processedAssetsTable()
                        + " (image_filename, message_id, detection_count, model_name) VALUES (?, ?, ?, ?)"
                        + " ON CONFLICT DO NOTHING",
                asset.fileName(), asset.messageId(), detectionCount, modelName);
    }

    private String toJson(DetectedObject detection) {
        try {
            return objectMapper.writeValueAsString(detection.box().toList());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
