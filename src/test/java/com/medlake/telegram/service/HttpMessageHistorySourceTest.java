package com.medlake.telegram.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import com.medlake.telegram.config.PipelineProperties;
import com.medlake.telegram.model.HistoryMessage;
import com.medlake.telegram.model.HistoryPage;
import com.medlake.telegram.model.MediaReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@SuppressWarnings("UnstableApiUsage")
class HttpMessageHistorySourceTest {

    private static final String BASE = "http://gateway.test";

    private MockRestServiceServer server;
    private PipelineProperties properties;
    private HttpMessageHistorySource source;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        properties = new PipelineProperties();
        properties.getTelegram().setApiId("12345");
        properties.getTelegram().setApiHash("abcdef");
        source = new HttpMessageHistorySource(builder.build(), properties, new ObjectMapper(),
                RateLimiter.create(Double.MAX_VALUE));
    }

    @Test
    void connectSendsCredentials() {
        server.expect(requestTo(BASE + "/session"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("X-Api-Id", "12345"))
                .andExpect(header("X-Api-Hash", "abcdef"))
                .andExpect(header("X-Session", "telegram_scraper_session"))
                .andRespond(withSuccess());

        source.connect();

        server.verify();
    }

    @Test
    void rejectedCredentialsAreFatal() {
        server.expect(requestTo(BASE + "/session")).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> source.connect()).isInstanceOf(SourceAuthenticationException.class);
    }

    @Test
    void missingCredentialsFailWithoutCallingTheGateway() {
        properties.getTelegram().setApiHash("");

        assertThatThrownBy(() -> source.connect()).isInstanceOf(SourceAuthenticationException.class);
        server.verify();
    }

    @Test
    void parsesPageDecodesBytesAndFindsPhotos() {
        String fileReference = Base64.getEncoder().encodeToString(new byte[]{1, 2, 3});
        String body = "{\"messages\": ["
                + "{\"_\": \"Message\", \"id\": 205, \"date\": \"2025-07-01T09:30:00+00:00\", \"message\": \"Amoxicillin in stock\","
                + " \"media\": {\"_\": \"MessageMediaPhoto\", \"photo\": {\"_\": \"Photo\", \"id\": 5551,"
                + " \"file_reference\": {\"_\": \"bytes\", \"base64\": \"" + fileReference + "\"}}}},"
                + "{\"_\": \"Message\", \"id\": 204, \"date\": 1751355000, \"message\": \"no media\"},"
                + "{\"_\": \"MessageService\", \"date\": \"2025-07-01T08:00:00+00:00\"},"
                + "{\"_\": \"Message\", \"id\": 203, \"date\": null}"
                + "]}";
        server.expect(requestTo(BASE + "/channels/tikvahpharma/messages?offset_id=0&limit=100"))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        HistoryPage result = source.fetchPage("tikvahpharma", 0, 100);

        assertThat(result.itemsReturned()).isEqualTo(4);
        assertThat(result.oldestItemId()).isEqualTo(203L);
        List<HistoryMessage> page = result.messages();
        assertThat(page).extracting(HistoryMessage::id).containsExactly(205L, 204L);
        HistoryMessage first = page.get(0);
        assertThat(first.date()).isEqualTo(OffsetDateTime.parse("2025-07-01T09:30:00Z"));
        assertThat(first.photo()).contains(new MediaReference(MediaReference.PHOTO_KIND, 5551L));
        assertThat(first.payload().get("media").get("photo").get("file_reference").isBinary()).isTrue();
        assertThat(page.get(1).photo()).isEmpty();
        assertThat(page.get(1).date().toEpochSecond()).isEqualTo(1751355000L);
    }

    @Test
    void serverErrorsBecomeHistorySourceExceptions() {
        server.expect(requestTo(BASE + "/channels/chemed/messages?offset_id=10&limit=5"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> source.fetchPage("chemed", 10, 5))
                .isInstanceOf(HistorySourceException.class)
                .isNotInstanceOf(SourceAuthenticationException.class);
    }

    @Test
    void downloadsMediaBytes() {
        server.expect(requestTo(BASE + "/channels/chemed/messages/42/media"))
                .andRespond(withSuccess(new byte[]{9, 8, 7}, MediaType.IMAGE_JPEG));
        HistoryMessage message = new HistoryMessage(42, OffsetDateTime.parse("2025-07-01T00:00:00Z"),
                new ObjectMapper().createObjectNode(), new MediaReference(MediaReference.PHOTO_KIND, 1));

        assertThat(source.downloadMedia("chemed", message)).containsExactly(9, 8, 7);
    }
}
