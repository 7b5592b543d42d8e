package com.medlake.telegram.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import org.hibernate.annotations.Immutable;

import java.time.OffsetDateTime;

/**
 * Ledger entry for an asset that went through the detector, including assets with no findings.
 */
@Getter
@Entity
@Immutable
@Table(name = "processed_media_assets")
public class ProcessedMediaAsset {

    @Id
    @Column(name = "image_filename", nullable = false, updatable = false)
    private String imageFilename;

    @Column(name = "message_id", nullable = false)
    private Long messageId;

    @Column(name = "detection_count", nullable = false)
    private Integer detectionCount;

    @Column(name = "model_name")
    private String modelName;

    @Column(name = "processed_at")
    private OffsetDateTime processedAt;

    protected ProcessedMediaAsset() {}
}
