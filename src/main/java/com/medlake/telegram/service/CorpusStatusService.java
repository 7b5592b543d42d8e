package com.medlake.telegram.service;

import com.medlake.telegram.dto.CorpusStatusResponse;
import com.medlake.telegram.repository.ProcessedMediaAssetRepository;
import com.medlake.telegram.repository.RawTelegramMessageRepository;
import com.medlake.telegram.repository.RawYoloDetectionRepository;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only counts over the raw tables, for run summaries and the operations endpoint.
 */
@Service
public class CorpusStatusService {

    private final RawTelegramMessageRepository messageRepository;
    private final RawYoloDetectionRepository detectionRepository;
    private final ProcessedMediaAssetRepository processedAssetRepository;
    private final RawStorageSchema schema;

    public CorpusStatusService(RawTelegramMessageRepository messageRepository,
                               RawYoloDetectionRepository detectionRepository,
                               ProcessedMediaAssetRepository processedAssetRepository,
                               RawStorageSchema schema) {
        this.messageRepository = messageRepository;
        this.detectionRepository = detectionRepository;
        this.processedAssetRepository = processedAssetRepository;
        this.schema = schema;
    }

    /**
     * Counts are taken one query at a time and may straddle a concurrent load.
     */
    public CorpusStatusResponse currentStatus() {
        schema.ensureSchema();
        Map<String, Long> perChannel = new LinkedHashMap<>();
        for (Object[] row : messageRepository.countPerChannel()) {
            perChannel.put((String) row[0], ((Number) row[1]).longValue());
        }
        return new CorpusStatusResponse(
                messageRepository.count(),
                perChannel,
                detectionRepository.count(),
                detectionRepository.countDistinctImageFilenames(),
                processedAssetRepository.count(),
                processedAssetRepository.countByDetectionCount(0));
    }

    public long messageCount(String channel) {
        schema.ensureSchema();
        return messageRepository.countByChannelUsername(channel);
    }
}
