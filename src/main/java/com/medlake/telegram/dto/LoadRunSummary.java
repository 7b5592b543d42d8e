package com.medlake.telegram.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LoadRunSummary(List<BatchLoadReport> batches) {

    @JsonProperty
    public int filesProcessed() {
        return batches.size();
    }

    @JsonProperty
    public long filesFailed() {
        return batches.stream().filter(b -> b.status() == BatchLoadReport.Status.FAILED).count();
    }

    @JsonProperty
    public int recordsSeen() {
        return batches.stream().mapToInt(BatchLoadReport::recordsSeen).sum();
    }

    @JsonProperty
    public int recordsInserted() {
        return batches.stream().mapToInt(BatchLoadReport::inserted).sum();
    }

    @JsonProperty
    public int recordsDuplicate() {
        return batches.stream().mapToInt(BatchLoadReport::duplicates).sum();
    }

    @JsonProperty
    public int recordsMalformed() {
        return batches.stream().mapToInt(BatchLoadReport::malformed).sum();
    }
}
