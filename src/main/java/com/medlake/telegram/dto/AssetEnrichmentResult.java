package com.medlake.telegram.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssetEnrichmentResult(
        String filename,
        Status status,
        int detectionsFound,
        int detectionsInserted,
        String error
) {

    public enum Status { ENRICHED, ALREADY_PROCESSED, UNPARSEABLE_NAME, FAILED }

    public static AssetEnrichmentResult enriched(String filename, int found, int inserted) {
        return new AssetEnrichmentResult(filename, Status.ENRICHED, found, inserted, null);
    }

    public static AssetEnrichmentResult skipped(String filename, Status status) {
        return new AssetEnrichmentResult(filename, status, 0, 0, null);
    }

    public static AssetEnrichmentResult failed(String filename, String error) {
        return new AssetEnrichmentResult(filename, Status.FAILED, 0, 0, error);
    }
}
