package com.medlake.telegram.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import com.medlake.telegram.config.PipelineProperties;
import com.medlake.telegram.model.BoundingBox;
import com.medlake.telegram.model.DetectedObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ObjectDetector} backed by a self-hosted YOLO inference server. The server answers
 * {@code POST /predict} with {@code {"detections": [{"class_name", "confidence", "xyxy"}]}}, boxes in pixels.
 */
@SuppressWarnings("UnstableApiUsage")
public class HttpObjectDetector implements ObjectDetector {

    private static final Logger logger = LoggerFactory.getLogger(HttpObjectDetector.class);

    private final RestClient restClient;
    private final PipelineProperties.Detection settings;
    private final ObjectMapper objectMapper;
    private final RateLimiter detectionRateLimiter;

    public HttpObjectDetector(RestClient restClient,
                              PipelineProperties.Detection settings,
                              ObjectMapper objectMapper,
                              RateLimiter detectionRateLimiter) {
        this.restClient = restClient;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.detectionRateLimiter = detectionRateLimiter;
    }

    @Override
    public String modelName() {
        return settings.getModelName();
    }

    @Override
    public List<DetectedObject> detect(Path image) throws IOException {
        byte[] bytes = Files.readAllBytes(image);
        detectionRateLimiter.acquire();
        String body;
        try {
            body = restClient.post()
                    .uri(uriBuilder -> uriBuilder.path("/predict")
                            .queryParam("model", settings.getModelName())
                            .queryParam("conf", settings.getMinConfidence())
                            .build())
                    .contentType(MediaType.APPLICATION_OCTET_STREAM)
                    .body(bytes)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new ThrottledException("Inference server throttled " + image.getFileName(), e);
            }
            throw new IOException("Inference server returned HTTP " + e.getStatusCode().value()
                    + " for " + image.getFileName(), e);
        } catch (RestClientException e) {
            throw new IOException("Inference call failed for " + image.getFileName() + ": " + e.getMessage(), e);
        }
        return parse(body, image);
    }

    private List<DetectedObject> parse(String body, Path image) throws IOException {
        JsonNode root;
        try {
            root = body == null ? null : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IOException("Unparseable inference response for " + image.getFileName(), e);
        }
        if (root == null || !root.path("detections").isArray()) {
            throw new IOException("Inference response for " + image.getFileName() + " has no 'detections' array");
        }
        List<DetectedObject> findings = new ArrayList<>();
        for (JsonNode detection : root.get("detections")) {
            String label = detection.path("class_name").asText("");
            double confidence = detection.path("confidence").asDouble(-1);
            JsonNode xyxy = detection.path("xyxy");
            if (label.isBlank() || confidence < 0 || !xyxy.isArray() || xyxy.size() != 4) {
                logger.warn("Ignoring incomplete detection for {}: {}", image.getFileName(), detection);
                continue;
            }
            if (confidence < settings.getMinConfidence()) {
                continue;
            }
            findings.add(new DetectedObject(label, confidence, new BoundingBox(
                    xyxy.get(0).asDouble(), xyxy.get(1).asDouble(), xyxy.get(2).asDouble(), xyxy.get(3).asDouble())));
        }
        logger.debug("Inference server found {} objects in {}", findings.size(), image.getFileName());
        return findings;
    }
}
