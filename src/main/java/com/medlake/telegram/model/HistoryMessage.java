package com.medlake.telegram.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * One message item returned by a history page.
 *
 * @param id      message identifier, unique within its channel
 * @param date    publication time of the message
 * @param payload full message tree as delivered by the source; may still contain binary nodes
 * @param media   photo or document attachment, or {@code null}
 */
public record HistoryMessage(long id, OffsetDateTime date, ObjectNode payload, MediaReference media) {

    public Optional<MediaReference> photo() {
        return media != null && media.isPhoto() ? Optional.of(media) : Optional.empty();
    }
}
