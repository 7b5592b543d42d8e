package com.medlake.telegram.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

@Getter
@Entity
@Immutable
@Table(name = "raw_yolo_detections")
public class RawYoloDetection {

    @Id
    @Column(updatable = false, nullable = false)
    private Long id;

    @Column(name = "message_id", nullable = false)
    private Long messageId;

    @Column(name = "image_filename", nullable = false)
    private String imageFilename;

    @Column(name = "detected_object_class", nullable = false)
    private String detectedObjectClass;

    @Column(name = "confidence", nullable = false)
    private Double confidence;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "bounding_box", columnDefinition = "jsonb")
    private String boundingBox;

    @Column(name = "detection_timestamp")
    private OffsetDateTime detectionTimestamp;

    protected RawYoloDetection() {}
}
