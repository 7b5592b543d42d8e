package com.medlake.telegram.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record EnrichmentRunSummary(String modelName, List<AssetEnrichmentResult> assets) {

    @JsonProperty
    public int assetsSeen() {
        return assets.size();
    }

    @JsonProperty
    public long assetsEnriched() {
        return count(AssetEnrichmentResult.Status.ENRICHED);
    }

    @JsonProperty
    public long assetsAlreadyProcessed() {
        return count(AssetEnrichmentResult.Status.ALREADY_PROCESSED);
    }

    @JsonProperty
    public long assetsUnparseable() {
        return count(AssetEnrichmentResult.Status.UNPARSEABLE_NAME);
    }

    @JsonProperty
    public long assetsFailed() {
        return count(AssetEnrichmentResult.Status.FAILED);
    }

    @JsonProperty
    public int detectionsInserted() {
        return assets.stream().mapToInt(AssetEnrichmentResult::detectionsInserted).sum();
    }

    private long count(AssetEnrichmentResult.Status status) {
        return assets.stream().filter(a -> a.status() == status).count();
    }
}
