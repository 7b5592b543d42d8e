package com.medlake.telegram.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Output of one channel crawl: normalized records, newest first, plus crawl statistics.
 */
public record ChannelCrawlResult(
        String channel,
        List<ObjectNode> records,
        int pagesFetched,
        int discardedOutsideWindow,
        int itemsUnusable,
        int mediaDownloaded,
        int mediaReused,
        int mediaFailed
) {
}
