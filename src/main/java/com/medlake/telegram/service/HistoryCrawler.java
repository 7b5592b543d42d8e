package com.medlake.telegram.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.medlake.telegram.config.PipelineProperties;
import com.medlake.telegram.model.ChannelCrawlResult;
import com.medlake.telegram.model.HistoryMessage;
import com.medlake.telegram.model.HistoryPage;
import com.medlake.telegram.model.MediaAssetName;
import com.medlake.telegram.model.MediaReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks one channel's history backward from the newest message until the lookback window closes or
 * the source runs out of messages.
 */
@Service
public class HistoryCrawler {

    private static final Logger logger = LoggerFactory.getLogger(HistoryCrawler.class);

    public static final String CHANNEL_FIELD = "channel_username";
    public static final String IMAGE_PATH_FIELD = "image_download_path";

    private final MessageHistorySource source;
    private final RecordNormalizer normalizer;
    private final MediaAssetStore mediaAssetStore;
    private final PipelineProperties.Crawler settings;
    private final Clock clock;

    public HistoryCrawler(MessageHistorySource source,
                          RecordNormalizer normalizer,
                          MediaAssetStore mediaAssetStore,
                          PipelineProperties properties,
                          Clock clock) {
        this.source = source;
        this.normalizer = normalizer;
        this.mediaAssetStore = mediaAssetStore;
        this.settings = properties.getCrawler();
        this.clock = clock;
    }

    /**
     * Crawls one channel.
     *
     * @return normalized records, newest first, with crawl statistics
     * @throws HistorySourceException when a page cannot be fetched after all retries
     */
    public ChannelCrawlResult crawl(String channel) {
        int pageSize = Math.max(1, settings.getPageSize());
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(settings.getLookback());
        logger.info("Crawling @{} back to {} (page size {})", channel, cutoff, pageSize);

        List<ObjectNode> records = new ArrayList<>();
        Counters counters = new Counters();
        long offsetId = 0;

        while (true) {
            HistoryPage page = fetchWithRetry(channel, offsetId, pageSize);
            counters.pages++;
            if (page.isEmpty()) {
                logger.debug("@{}: empty page at offset {}, history exhausted", channel, offsetId);
                break;
            }
            if (page.itemsUnusable() > 0) {
                counters.unusable += page.itemsUnusable();
                logger.warn("@{}: {} of {} items at offset {} had no usable id or date",
                        channel, page.itemsUnusable(), page.itemsReturned(), offsetId);
            }

            List<HistoryMessage> messages = page.messages();
            boolean windowClosed = false;
            for (int i = 0; i < messages.size(); i++) {
                HistoryMessage message = messages.get(i);
                if (message.date().isBefore(cutoff)) {
                    counters.discarded += messages.size() - i;
                    windowClosed = true;
                    break;
                }
                records.add(toRecord(channel, message, counters));
            }
            if (windowClosed) {
                logger.debug("@{}: reached lookback boundary {}", channel, cutoff);
                break;
            }
            if (page.itemsReturned() < pageSize) {
                break;
            }

            Long nextOffset = page.oldestItemId();
            if (nextOffset == null) {
                logger.warn("@{}: no item at offset {} carried an id; stopping crawl", channel, offsetId);
                break;
            }
            if (offsetId != 0 && nextOffset >= offsetId) {
                logger.warn("@{}: history cursor did not move backward ({} -> {}); stopping crawl",
                        channel, offsetId, nextOffset);
                break;
            }
            offsetId = nextOffset;
        }

        logger.info("Crawled @{}: {} messages over {} pages, {} outside window, {} unusable, media downloaded={} reused={} failed={}",
                channel, records.size(), counters.pages, counters.discarded, counters.unusable,
                counters.downloaded, counters.reused, counters.mediaFailed);
        return new ChannelCrawlResult(channel, records, counters.pages, counters.discarded, counters.unusable,
                counters.downloaded, counters.reused, counters.mediaFailed);
    }

    private ObjectNode toRecord(String channel, HistoryMessage message, Counters counters) {
        ObjectNode record = normalizer.normalize(message.payload());
        record.put("id", message.id());
        record.put("date", message.date().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        record.put(CHANNEL_FIELD, channel);

        Optional<MediaReference> photo = message.photo();
        if (photo.isPresent()) {
            try {
                MediaAssetName name = MediaAssetName.of(channel, message.id(), photo.get().mediaId());
                MediaAssetStore.Stored stored =
                        mediaAssetStore.ensurePresent(name, () -> source.downloadMedia(channel, message));
                if (stored.downloaded()) {
                    counters.downloaded++;
                } else {
                    counters.reused++;
                }
                record.put(IMAGE_PATH_FIELD, stored.path().toString());
            } catch (IOException | HistorySourceException | IllegalArgumentException e) {
                counters.mediaFailed++;
                logger.warn("@{}: could not store photo of message {}: {}", channel, message.id(), e.getMessage());
            }
        }
        return record;
    }

    private HistoryPage fetchWithRetry(String channel, long offsetId, int pageSize) {
        int maxAttempts = Math.max(1, settings.getMaxFetchAttempts());
        Duration backoff = settings.getRetryBackoff();
        for (int attempt = 1; ; attempt++) {
            try {
                return source.fetchPage(channel, offsetId, pageSize);
            } catch (SourceAuthenticationException e) {
                throw e;
            } catch (HistorySourceException e) {
                if (attempt >= maxAttempts) {
                    logger.error("@{}: page at offset {} failed after {} attempts", channel, offsetId, attempt);
                    throw e;
                }
                long sleepMs = backoff.toMillis() * (1L << (attempt - 1));
                logger.warn("@{}: page fetch failed (attempt {}/{}), retrying in {} ms: {}",
                        channel, attempt, maxAttempts, sleepMs, e.getMessage());
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new HistorySourceException("Interrupted during backoff", ie);
                }
            }
        }
    }

    private static final class Counters {
        int pages;
        int discarded;
        int unusable;
        int downloaded;
        int reused;
        int mediaFailed;
    }
}
