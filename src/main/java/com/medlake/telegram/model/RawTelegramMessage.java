package com.medlake.telegram.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

/**
 * Read view of one loaded message. Rows are only ever written through the loader's insert-or-skip path.
 */
@Getter
@Entity
@Immutable
@Table(name = "raw_telegram_messages")
public class RawTelegramMessage {

    @Id
    @Column(updatable = false, nullable = false)
    private Long id;

    @Column(name = "message_id", nullable = false)
    private Long messageId;

    @Column(name = "channel_username", nullable = false)
    private String channelUsername;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "message_data", nullable = false, columnDefinition = "jsonb")
    private String messageData; // Store as JSON string

    @Column(name = "scraped_at")
    private OffsetDateTime scrapedAt;

    /**
     * Default constructor for JPA.
     */
    protected RawTelegramMessage() {}
}
