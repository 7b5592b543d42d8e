package com.medlake.telegram.model;

/**
 * Media attached to a history message, as advertised by the source.
 *
 * @param kind    source type tag of the attachment, e.g. {@code MessageMediaPhoto}
 * @param mediaId source identifier of the photo or document
 */
public record MediaReference(String kind, long mediaId) {

    public static final String PHOTO_KIND = "MessageMediaPhoto";

    public boolean isPhoto() {
        return PHOTO_KIND.equals(kind);
    }
}
