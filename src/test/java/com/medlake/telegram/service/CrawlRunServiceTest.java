package com.medlake.telegram.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.medlake.telegram.config.PipelineProperties;
import com.medlake.telegram.dto.ChannelCrawlReport;
import com.medlake.telegram.dto.CrawlRunSummary;
import com.medlake.telegram.model.ChannelCrawlResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlRunServiceTest {

    private static final LocalDate RUN_DATE = LocalDate.of(2025, 7, 2);

    @Mock
    private MessageHistorySource source;

    @Mock
    private HistoryCrawler crawler;

    @Mock
    private ChannelBatchWriter writer;

    private CrawlRunService service;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        properties.setChannels(List.of("lobelia4cosmetics", "tikvahpharma", "chemed"));
        properties.getLake().setZone(ZoneId.of("Africa/Addis_Ababa"));
        // 22:30 UTC is already the next day in Addis Ababa (UTC+3)
        Clock clock = Clock.fixed(Instant.parse("2025-07-01T22:30:00Z"), ZoneOffset.UTC);
        service = new CrawlRunService(source, crawler, writer, new SyncTaskExecutor(), properties, clock);
    }

    @Test
    void failedChannelIsReportedAndOthersStillWritten() throws Exception {
        List<ObjectNode> records = List.of(record(1));
        when(crawler.crawl("lobelia4cosmetics")).thenReturn(result("lobelia4cosmetics", records));
        when(crawler.crawl("tikvahpharma")).thenThrow(new HistorySourceException("connection reset"));
        when(crawler.crawl("chemed")).thenReturn(result("chemed", List.of()));
        when(writer.write("lobelia4cosmetics", records, RUN_DATE))
                .thenReturn(Optional.of(Path.of("2025-07-02/lobelia4cosmetics/lobelia4cosmetics.json")));
        when(writer.write("chemed", List.of(), RUN_DATE)).thenReturn(Optional.empty());

        CrawlRunSummary summary = service.runAll();

        assertThat(summary.runDate()).isEqualTo(RUN_DATE);
        assertThat(summary.channels()).extracting(ChannelCrawlReport::status).containsExactly(
                ChannelCrawlReport.Status.WRITTEN, ChannelCrawlReport.Status.FAILED, ChannelCrawlReport.Status.EMPTY);
        assertThat(summary.channels().get(1).error()).contains("connection reset");
        assertThat(summary.totalMessagesCaptured()).isEqualTo(1);
        verify(writer, never()).write(eq("tikvahpharma"), anyList(), any());
    }

    @Test
    void authenticationFailureAbortsBeforeCrawling() {
        doThrow(new SourceAuthenticationException("bad api hash")).when(source).connect();

        assertThatThrownBy(() -> service.runAll()).isInstanceOf(SourceAuthenticationException.class);
        verifyNoInteractions(crawler, writer);
    }

    @Test
    void authenticationFailureDuringCrawlStopsTheRemainingChannels() {
        when(crawler.crawl("lobelia4cosmetics")).thenThrow(new SourceAuthenticationException("session revoked"));

        assertThatThrownBy(() -> service.runAll())
                .isInstanceOf(SourceAuthenticationException.class)
                .hasMessage("session revoked");
        verify(crawler, never()).crawl("tikvahpharma");
        verify(crawler, never()).crawl("chemed");
        verifyNoInteractions(writer);
    }

    @Test
    void channelThatFinishesAfterAnAbortWritesNothing() {
        AtomicReference<RuntimeException> abort = new AtomicReference<>();
        when(crawler.crawl("tikvahpharma")).thenAnswer(invocation -> {
            abort.set(new SourceAuthenticationException("session revoked"));
            return result("tikvahpharma", List.of(record(7)));
        });

        assertThatThrownBy(() -> service.crawlChannel("tikvahpharma", RUN_DATE, abort))
                .isInstanceOf(CancellationException.class);
        assertThatThrownBy(() -> service.crawlChannel("chemed", RUN_DATE, abort))
                .isInstanceOf(CancellationException.class);
        verify(crawler, never()).crawl("chemed");
        verifyNoInteractions(writer);
    }

    private static ChannelCrawlResult result(String channel, List<ObjectNode> records) {
        return new ChannelCrawlResult(channel, records, 1, 0, 0, 0, 0, 0);
    }

    private static ObjectNode record(long id) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("id", id);
        return node;
    }
}
