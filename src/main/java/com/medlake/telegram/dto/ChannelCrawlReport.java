package com.medlake.telegram.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.medlake.telegram.model.ChannelCrawlResult;

import java.nio.file.Path;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChannelCrawlReport(
        String channel,
        Status status,
        int messagesCaptured,
        int pagesFetched,
        int discardedOutsideWindow,
        int itemsUnusable,
        int mediaDownloaded,
        int mediaReused,
        int mediaFailed,
        String batchPath,
        String error
) {

    public enum Status { WRITTEN, EMPTY, FAILED }

    public static ChannelCrawlReport of(ChannelCrawlResult result, Path batchPath) {
        return new ChannelCrawlReport(
                result.channel(),
                batchPath != null ? Status.WRITTEN : Status.EMPTY,
                result.records().size(),
                result.pagesFetched(),
                result.discardedOutsideWindow(),
                result.itemsUnusable(),
                result.mediaDownloaded(),
                result.mediaReused(),
                result.mediaFailed(),
                batchPath != null ? batchPath.toString() : null,
                null);
    }

    public static ChannelCrawlReport failed(String channel, String error) {
        return new ChannelCrawlReport(channel, Status.FAILED, 0, 0, 0, 0, 0, 0, 0, null, error);
    }
}
