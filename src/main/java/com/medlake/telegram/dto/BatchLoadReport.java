package com.medlake.telegram.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of applying one batch unit. For a FAILED batch nothing was committed, whatever the counters
 * reached before the failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchLoadReport(
        String file,
        Status status,
        int recordsSeen,
        int inserted,
        int duplicates,
        int malformed,
        String error
) {

    public enum Status { LOADED, EMPTY, FAILED }

    public static BatchLoadReport loaded(String file, int seen, int inserted, int duplicates, int malformed) {
        return new BatchLoadReport(file, Status.LOADED, seen, inserted, duplicates, malformed, null);
    }

    public static BatchLoadReport empty(String file) {
        return new BatchLoadReport(file, Status.EMPTY, 0, 0, 0, 0, null);
    }

    public static BatchLoadReport failed(String file, int seen, String error) {
        return new BatchLoadReport(file, Status.FAILED, seen, 0, 0, 0, error);
    }
}
