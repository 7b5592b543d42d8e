package com.medlake.telegram.model;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Filename encoding of a downloaded media asset. The name alone carries the asset's provenance, so it is
 * a durable contract between the crawler that writes the file and the enricher that correlates it.
 *
 * <p>Format {@value #FORMAT_VERSION}: {@code <channel>_<messageId>_<mediaId>.<ext>}. Channel handles may
 * themselves contain underscores, so decoding reads the two numeric tokens from the right.</p>
 */
public final class MediaAssetName {

    public static final String FORMAT_VERSION = "v1";
    public static final String DEFAULT_EXTENSION = "jpg";

    private static final Pattern CHANNEL_PATTERN = Pattern.compile("[A-Za-z0-9_]+");
    private static final Pattern V1_PATTERN = Pattern.compile(
            "^([A-Za-z0-9_]+)_(-?\\d{1,19})_(-?\\d{1,19})\\.(jpg|jpeg|png|gif)$",
            Pattern.CASE_INSENSITIVE);

    private final String channel;
    private final long messageId;
    private final long mediaId;
    private final String extension;

    private MediaAssetName(String channel, long messageId, long mediaId, String extension) {
        this.channel = channel;
        this.messageId = messageId;
        this.mediaId = mediaId;
        this.extension = extension;
    }

    /**
     * Builds the name of a photo asset.
     *
     * @throws IllegalArgumentException if the channel handle cannot be encoded losslessly
     */
    public static MediaAssetName of(String channel, long messageId, long mediaId) {
        if (channel == null || !CHANNEL_PATTERN.matcher(channel).matches()) {
            throw new IllegalArgumentException("Channel handle is not encodable in an asset name: " + channel);
        }
        return new MediaAssetName(channel, messageId, mediaId, DEFAULT_EXTENSION);
    }

    /**
     * Decodes a filename written by any crawler using format {@value #FORMAT_VERSION}. The extension keeps
     * its case, so {@link #fileName()} reproduces the input exactly.
     *
     * @return the decoded name, or empty when the filename does not follow the encoding
     */
    public static Optional<MediaAssetName> parse(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher matcher = V1_PATTERN.matcher(fileName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            long messageId = Long.parseLong(matcher.group(2));
            long mediaId = Long.parseLong(matcher.group(3));
            MediaAssetName name = new MediaAssetName(matcher.group(1), messageId, mediaId, matcher.group(4));
            // leading zeros or "-0" are not produced by the encoder
            return name.fileName().equals(fileName) ? Optional.of(name) : Optional.empty();
        } catch (NumberFormatException e) {
            // 19 digits can still overflow a long
            return Optional.empty();
        }
    }

    public String fileName() {
        return channel + "_" + messageId + "_" + mediaId + "." + extension;
    }

    public String channel() {
        return channel;
    }

    public long messageId() {
        return messageId;
    }

    public long mediaId() {
        return mediaId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MediaAssetName that)) return false;
        return messageId == that.messageId
                && mediaId == that.mediaId
                && channel.equals(that.channel)
                && extension.equals(that.extension);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channel, messageId, mediaId, extension);
    }

    @Override
    public String toString() {
        return fileName();
    }
}
