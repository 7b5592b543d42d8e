package com.medlake.telegram.service;

import com.medlake.telegram.model.HistoryMessage;
import com.medlake.telegram.model.HistoryPage;

/**
 * Paginated access to a channel's message history, newest first.
 */
public interface MessageHistorySource {

    /**
     * Authenticates the session.
     *
     * @throws SourceAuthenticationException when the credentials are rejected
     */
    void connect();

    /**
     * Returns up to {@code limit} items strictly older than {@code offsetId}, newest first.
     * An offset of 0 starts from the newest message.
     */
    HistoryPage fetchPage(String channel, long offsetId, int limit);

    byte[] downloadMedia(String channel, HistoryMessage message);
}
