package com.medlake.telegram.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BinaryNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.RateLimiter;
import com.medlake.telegram.config.PipelineProperties;
import com.medlake.telegram.model.HistoryMessage;
import com.medlake.telegram.model.HistoryPage;
import com.medlake.telegram.model.MediaReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * {@link MessageHistorySource} backed by an HTTP gateway in front of the Telegram MTProto API.
 *
 * <p>The gateway returns messages as Telethon {@code to_dict()} trees in which raw byte fields are
 * tagged as {@code {"_": "bytes", "base64": "..."}}; those are decoded back to binary nodes here so the
 * crawler sees the same shape the client library produced.</p>
 */
@Service
@SuppressWarnings("UnstableApiUsage")
public class HttpMessageHistorySource implements MessageHistorySource {

    private static final Logger logger = LoggerFactory.getLogger(HttpMessageHistorySource.class);

    static final String API_ID_HEADER = "X-Api-Id";
    static final String API_HASH_HEADER = "X-Api-Hash";
    static final String SESSION_HEADER = "X-Session";

    private static final String TYPE_FIELD = "_";
    private static final String BYTES_TYPE = "bytes";

    private final RestClient restClient;
    private final PipelineProperties.Telegram telegram;
    private final ObjectMapper objectMapper;
    private final RateLimiter historyRateLimiter;

    public HttpMessageHistorySource(@Qualifier("telegramGatewayClient") RestClient restClient,
                                    PipelineProperties properties,
                                    ObjectMapper objectMapper,
                                    @Qualifier("historyRateLimiter") RateLimiter historyRateLimiter) {
        this.restClient = restClient;
        this.telegram = properties.getTelegram();
        this.objectMapper = objectMapper;
        this.historyRateLimiter = historyRateLimiter;
    }

    @Override
    public void connect() {
        if (!StringUtils.hasText(telegram.getApiId()) || !StringUtils.hasText(telegram.getApiHash())) {
            throw new SourceAuthenticationException(
                    "Telegram API credentials are not configured (TELEGRAM_API_ID / TELEGRAM_API_HASH).");
        }
        try {
            restClient.get()
                    .uri("/session")
                    .headers(this::applyCredentials)
                    .retrieve()
                    .toBodilessEntity();
            logger.info("Connected to Telegram gateway as session '{}'.", telegram.getSessionName());
        } catch (RestClientResponseException e) {
            if (isAuthFailure(e)) {
                throw new SourceAuthenticationException("Telegram gateway rejected the session credentials (HTTP "
                        + e.getStatusCode().value() + ").", e);
            }
            throw new HistorySourceException("Telegram gateway session check failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new HistorySourceException("Telegram gateway unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public HistoryPage fetchPage(String channel, long offsetId, int limit) {
        historyRateLimiter.acquire();
        String body;
        try {
            body = restClient.get()
                    .uri("/channels/{channel}/messages?offset_id={offsetId}&limit={limit}", channel, offsetId, limit)
                    .headers(this::applyCredentials)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw translate("fetch history page of @" + channel + " at offset " + offsetId, e);
        } catch (RestClientException e) {
            throw new HistorySourceException("Failed to fetch history page of @" + channel + ": " + e.getMessage(), e);
        }
        return parsePage(channel, body);
    }

    @Override
    public byte[] downloadMedia(String channel, HistoryMessage message) {
        historyRateLimiter.acquire();
        byte[] bytes;
        try {
            bytes = restClient.get()
                    .uri("/channels/{channel}/messages/{id}/media", channel, message.id())
                    .headers(this::applyCredentials)
                    .retrieve()
                    .body(byte[].class);
        } catch (RestClientResponseException e) {
            throw translate("download media of @" + channel + "/" + message.id(), e);
        } catch (RestClientException e) {
            throw new HistorySourceException("Failed to download media of @" + channel + "/" + message.id()
                    + ": " + e.getMessage(), e);
        }
        if (bytes == null || bytes.length == 0) {
            throw new HistorySourceException("Gateway returned no media bytes for @" + channel + "/" + message.id());
        }
        return bytes;
    }

    HistoryPage parsePage(String channel, String body) {
        if (!StringUtils.hasText(body)) {
            return HistoryPage.of(List.of());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new HistorySourceException("Unparseable history page for @" + channel + ": " + e.getOriginalMessage(), e);
        }
        JsonNode messages = root.path("messages");
        if (!messages.isArray()) {
            throw new HistorySourceException("History page for @" + channel + " has no 'messages' array.");
        }
        List<HistoryMessage> page = new ArrayList<>(messages.size());
        Long oldestId = null;
        for (JsonNode item : messages) {
            if (!item.isObject()) {
                logger.warn("Skipping non-object history item in @{}: {}", channel, item.getNodeType());
                continue;
            }
            ObjectNode payload = (ObjectNode) decodeBytes(item);
            JsonNode idNode = payload.get("id");
            OffsetDateTime date = parseDate(payload.get("date"));
            if (idNode != null && idNode.canConvertToLong() && (oldestId == null || idNode.asLong() < oldestId)) {
                oldestId = idNode.asLong();
            }
            if (idNode == null || !idNode.canConvertToLong() || date == null) {
                logger.warn("Skipping history item without usable id/date in @{}: id={}, date={}",
                        channel, idNode, payload.get("date"));
                continue;
            }
            page.add(new HistoryMessage(idNode.asLong(), date, payload, mediaOf(payload)));
        }
        return new HistoryPage(List.copyOf(page), messages.size(), oldestId);
    }

    private JsonNode decodeBytes(JsonNode node) {
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            if (BYTES_TYPE.equals(object.path(TYPE_FIELD).asText(null)) && object.path("base64").isTextual()) {
                try {
                    return BinaryNode.valueOf(Base64.getDecoder().decode(object.get("base64").asText()));
                } catch (IllegalArgumentException e) {
                    logger.debug("Leaving malformed bytes tag as-is: {}", e.getMessage());
                    return object;
                }
            }
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                field.setValue(decodeBytes(field.getValue()));
            }
            return object;
        }
        if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                array.set(i, decodeBytes(array.get(i)));
            }
        }
        return node;
    }

    private static MediaReference mediaOf(ObjectNode payload) {
        JsonNode media = payload.get("media");
        if (media == null || !media.isObject()) {
            return null;
        }
        String kind = media.path(TYPE_FIELD).asText("");
        JsonNode id = MediaReference.PHOTO_KIND.equals(kind)
                ? media.path("photo").path("id")
                : media.path("document").path("id");
        if (!id.canConvertToLong()) {
            return null;
        }
        return new MediaReference(kind, id.asLong());
    }

    private static OffsetDateTime parseDate(JsonNode date) {
        if (date == null || date.isNull()) {
            return null;
        }
        if (date.isNumber()) {
            return OffsetDateTime.ofInstant(Instant.ofEpochSecond(date.asLong()), ZoneOffset.UTC);
        }
        try {
            return OffsetDateTime.parse(date.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private void applyCredentials(HttpHeaders headers) {
        if (telegram.getApiId() != null) {
            headers.set(API_ID_HEADER, telegram.getApiId());
        }
        if (telegram.getApiHash() != null) {
            headers.set(API_HASH_HEADER, telegram.getApiHash());
        }
        headers.set(SESSION_HEADER, telegram.getSessionName());
    }

    private static boolean isAuthFailure(RestClientResponseException e) {
        int status = e.getStatusCode().value();
        return status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value();
    }

    private static HistorySourceException translate(String action, RestClientResponseException e) {
        if (isAuthFailure(e)) {
            return new SourceAuthenticationException("Telegram gateway refused to " + action
                    + " (HTTP " + e.getStatusCode().value() + ").", e);
        }
        return new HistorySourceException("Failed to " + action + ": HTTP " + e.getStatusCode().value(), e);
    }
}
