package com.medlake.telegram.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import com.medlake.telegram.service.HttpObjectDetector;
import com.medlake.telegram.service.ObjectDetector;
import com.medlake.telegram.service.RekognitionObjectDetector;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.rekognition.RekognitionClient;

@Configuration
public class DetectionClientConfiguration {

    @Value("${aws.region:us-east-1}")
    private String awsRegion;

    @Bean
    @ConditionalOnProperty(name = "app.detection.provider", havingValue = "rekognition", matchIfMissing = true)
    public RekognitionClient rekognitionClient() {
        return RekognitionClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .retryPolicy(RetryPolicy.none()) // throttling is retried by the detector itself
                        .build())
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "app.detection.provider", havingValue = "rekognition", matchIfMissing = true)
    @SuppressWarnings("UnstableApiUsage")
    public ObjectDetector rekognitionObjectDetector(RekognitionClient rekognitionClient,
                                                    PipelineProperties properties,
                                                    @Qualifier("detectionRateLimiter") RateLimiter detectionRateLimiter) {
        return new RekognitionObjectDetector(rekognitionClient, properties.getDetection(), detectionRateLimiter);
    }

    @Bean
    @ConditionalOnProperty(name = "app.detection.provider", havingValue = "http")
    @SuppressWarnings("UnstableApiUsage")
    public ObjectDetector httpObjectDetector(RestClient.Builder builder,
                                             PipelineProperties properties,
                                             ObjectMapper objectMapper,
                                             @Qualifier("detectionRateLimiter") RateLimiter detectionRateLimiter) {
        PipelineProperties.Detection detection = properties.getDetection();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) detection.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) detection.getReadTimeout().toMillis());
        RestClient client = builder.clone()
                .baseUrl(detection.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
        return new HttpObjectDetector(client, detection, objectMapper, detectionRateLimiter);
    }
}
