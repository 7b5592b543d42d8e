package com.medlake.telegram.dto;

import java.util.Map;

/**
 * Row counts of the raw tables.
 *
 * @param messagesPerChannel loaded messages keyed by channel handle, in channel order
 */
public record CorpusStatusResponse(
        long totalMessages,
        Map<String, Long> messagesPerChannel,
        long totalDetections,
        long assetsWithDetections,
        long assetsProcessed,
        long assetsWithoutFindings
) {
}
