package com.medlake.telegram.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

public record CrawlRunSummary(LocalDate runDate, List<ChannelCrawlReport> channels) {

    public long countByStatus(ChannelCrawlReport.Status status) {
        return channels.stream().filter(c -> c.status() == status).count();
    }

    @JsonProperty
    public int totalMessagesCaptured() {
        return channels.stream().mapToInt(ChannelCrawlReport::messagesCaptured).sum();
    }

    @JsonProperty
    public int totalMediaFailed() {
        return channels.stream().mapToInt(ChannelCrawlReport::mediaFailed).sum();
    }
}
