package com.medlake.telegram.service;

import com.google.common.util.concurrent.RateLimiter;
import com.medlake.telegram.config.PipelineProperties;
import com.medlake.telegram.model.BoundingBox;
import com.medlake.telegram.model.DetectedObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.rekognition.RekognitionClient;
import software.amazon.awssdk.services.rekognition.model.DetectLabelsRequest;
import software.amazon.awssdk.services.rekognition.model.DetectLabelsResponse;
import software.amazon.awssdk.services.rekognition.model.Image;
import software.amazon.awssdk.services.rekognition.model.Instance;
import software.amazon.awssdk.services.rekognition.model.Label;
import software.amazon.awssdk.services.rekognition.model.RekognitionException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * {@link ObjectDetector} on AWS Rekognition {@code DetectLabels}. Only labels with located instances
 * become detections; boxes are in relative image coordinates (0..1).
 */
@SuppressWarnings("UnstableApiUsage")
public class RekognitionObjectDetector implements ObjectDetector {

    private static final Logger logger = LoggerFactory.getLogger(RekognitionObjectDetector.class);

    static final String MODEL_NAME = "aws-rekognition-detect-labels";

    private final RekognitionClient rekognitionClient;
    private final PipelineProperties.Detection settings;
    private final RateLimiter detectionRateLimiter;

    public RekognitionObjectDetector(RekognitionClient rekognitionClient,
                                     PipelineProperties.Detection settings,
                                     RateLimiter detectionRateLimiter) {
        this.rekognitionClient = rekognitionClient;
        this.settings = settings;
        this.detectionRateLimiter = detectionRateLimiter;
    }

    @Override
    public String modelName() {
        return MODEL_NAME;
    }

    @Override
    public List<DetectedObject> detect(Path image) throws IOException {
        DetectLabelsRequest request = DetectLabelsRequest.builder()
                .image(Image.builder().bytes(SdkBytes.fromByteArray(Files.readAllBytes(image))).build())
                .maxLabels(settings.getMaxLabels())
                .minConfidence((float) (settings.getMinConfidence() * 100))
                .build();
        detectionRateLimiter.acquire();
        DetectLabelsResponse response;
        try {
            response = invokeWithRetry(request, image);
        } catch (ThrottledException te) {
            throw te;
        } catch (RekognitionException e) {
            String message = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            logger.error("Rekognition error for {}: {}", image.getFileName(), message, e);
            throw new IOException("Rekognition DetectLabels failed for " + image.getFileName(), e);
        }

        List<DetectedObject> findings = new ArrayList<>();
        for (Label label : response.labels()) {
            for (Instance instance : label.instances()) {
                software.amazon.awssdk.services.rekognition.model.BoundingBox box = instance.boundingBox();
                if (box == null) {
                    continue;
                }
                Float instanceConfidence = instance.confidence() != null ? instance.confidence() : label.confidence();
                double confidence = instanceConfidence != null ? instanceConfidence / 100.0 : 0.0;
                if (confidence < settings.getMinConfidence()) {
                    continue;
                }
                findings.add(new DetectedObject(label.name(), confidence, new BoundingBox(
                        box.left(), box.top(), box.left() + box.width(), box.top() + box.height())));
            }
        }
        logger.debug("Rekognition found {} objects in {}", findings.size(), image.getFileName());
        return findings;
    }

    /**
     * Calls DetectLabels with exponential backoff on throttling, surfacing exhaustion as
     * {@link ThrottledException}. Other errors propagate immediately.
     */
    private DetectLabelsResponse invokeWithRetry(DetectLabelsRequest request, Path image) {
        final int maxAttempts = Math.max(1, settings.getMaxAttempts());
        final long baseBackoffMs = settings.getBaseBackoff().toMillis();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return rekognitionClient.detectLabels(request);
            } catch (RekognitionException e) {
                if (!isThrottled(e)) {
                    throw e;
                }
                if (attempt == maxAttempts) {
                    logger.warn("Rekognition throttled after {} attempts for {}; giving up.", maxAttempts, image.getFileName());
                    throw new ThrottledException("Rekognition throttling after retries", e);
                }
                long jitter = ThreadLocalRandom.current().nextLong(50, 200);
                long sleepMs = (long) Math.min(10_000, baseBackoffMs * Math.pow(2, attempt - 1) + jitter);
                logger.warn("Rekognition throttled (attempt {}/{}). Backing off for {} ms.", attempt, maxAttempts, sleepMs);
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ThrottledException("Interrupted during backoff", ie);
                }
            }
        }
        throw new IllegalStateException("Unreachable");
    }

    private static boolean isThrottled(RekognitionException e) {
        String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
        return e.statusCode() == 429
                || "ThrottlingException".equalsIgnoreCase(code)
                || "ProvisionedThroughputExceededException".equalsIgnoreCase(code);
    }
}
