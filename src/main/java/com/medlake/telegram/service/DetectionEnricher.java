package com.medlake.telegram.service;

import com.medlake.telegram.config.PipelineProperties;
import com.medlake.telegram.dto.AssetEnrichmentResult;
import com.medlake.telegram.dto.EnrichmentRunSummary;
import com.medlake.telegram.model.DetectedObject;
import com.medlake.telegram.model.MediaAssetName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the object detector over downloaded media and binds every finding back to its message through
 * the asset filename. Each asset commits on its own, so an interrupted run keeps the assets it finished.
 */
@Service
public class DetectionEnricher {

    private static final Logger logger = LoggerFactory.getLogger(DetectionEnricher.class);

    private final MediaAssetStore mediaAssetStore;
    private final ObjectDetector detector;
    private final DetectionStore detectionStore;
    private final RawStorageSchema schema;
    private final TransactionTemplate transactionTemplate;
    private final boolean rememberEmptyAssets;

    public DetectionEnricher(MediaAssetStore mediaAssetStore,
                             ObjectDetector detector,
                             DetectionStore detectionStore,
                             RawStorageSchema schema,
                             PlatformTransactionManager transactionManager,
                             PipelineProperties properties) {
        this.mediaAssetStore = mediaAssetStore;
        this.detector = detector;
        this.detectionStore = detectionStore;
        this.schema = schema;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.rememberEmptyAssets = properties.getEnricher().isRememberEmptyAssets();
    }

    /**
     * @throws org.springframework.dao.DataAccessException when the schema cannot be ensured
     * @throws IOException                                 when the assets directory cannot be listed
     */
    public EnrichmentRunSummary enrichAll() throws IOException {
        schema.ensureSchema();
        List<Path> assets = mediaAssetStore.listAssets();
        logger.info("Enrichment run over {} assets with model {}", assets.size(), detector.modelName());

        List<AssetEnrichmentResult> results = new ArrayList<>(assets.size());
        for (Path asset : assets) {
            results.add(enrich(asset));
        }
        EnrichmentRunSummary summary = new EnrichmentRunSummary(detector.modelName(), List.copyOf(results));
        logger.info("Enrichment run finished: seen={} enriched={} already processed={} unparseable={} failed={} detections inserted={}",
                summary.assetsSeen(), summary.assetsEnriched(), summary.assetsAlreadyProcessed(),
                summary.assetsUnparseable(), summary.assetsFailed(), summary.detectionsInserted());
        return summary;
    }

    AssetEnrichmentResult enrich(Path asset) {
        String filename = asset.getFileName().toString();
        Optional<MediaAssetName> parsed = MediaAssetName.parse(filename);
        if (parsed.isEmpty()) {
            logger.warn("Cannot recover message id from asset name '{}'; skipping", filename);
            return AssetEnrichmentResult.skipped(filename, AssetEnrichmentResult.Status.UNPARSEABLE_NAME);
        }
        MediaAssetName name = parsed.get();

        try {
            if (isAlreadyProcessed(name)) {
                logger.debug("Asset {} already processed", filename);
                return AssetEnrichmentResult.skipped(filename, AssetEnrichmentResult.Status.ALREADY_PROCESSED);
            }
        } catch (RuntimeException e) {
            logger.error("Could not check processing state of {}: {}", filename, e.getMessage(), e);
            return AssetEnrichmentResult.failed(filename, e.getMessage());
        }

        List<DetectedObject> detections;
        try {
            detections = detector.detect(asset);
        } catch (IOException | RuntimeException e) {
            logger.error("Detection failed for {}: {}", filename, e.getMessage(), e);
            return AssetEnrichmentResult.failed(filename, e.getMessage());
        }

        try {
            Integer inserted = transactionTemplate.execute(status -> persist(name, detections));
            int insertedCount = inserted != null ? inserted : 0;
            if (detections.isEmpty()) {
                logger.info("No objects detected in {} (message {})", filename, name.messageId());
            } else {
                logger.info("Stored {} of {} detections for {} (message {})",
                        insertedCount, detections.size(), filename, name.messageId());
            }
            return AssetEnrichmentResult.enriched(filename, detections.size(), insertedCount);
        } catch (RuntimeException e) {
            logger.error("Storing detections for {} failed; rolled back: {}", filename, e.getMessage(), e);
            return AssetEnrichmentResult.failed(filename, e.getMessage());
        }
    }

    private boolean isAlreadyProcessed(MediaAssetName name) {
        if (detectionStore.hasDetections(name)) {
            return true;
        }
        return rememberEmptyAssets && detectionStore.isRecordedAsProcessed(name.fileName());
    }

    private int persist(MediaAssetName name, List<DetectedObject> detections) {
        int inserted = 0;
        for (DetectedObject detection : detections) {
            if (detectionStore.insertDetection(name, detection)) {
                inserted++;
            }
        }
        if (rememberEmptyAssets) {
            detectionStore.recordProcessed(name, detections.size(), detector.modelName());
        }
        return inserted;
    }
}
