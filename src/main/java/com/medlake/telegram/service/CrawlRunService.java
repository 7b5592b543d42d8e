package com.medlake.telegram.service;

import com.medlake.telegram.config.PipelineProperties;
import com.medlake.telegram.dto.ChannelCrawlReport;
import com.medlake.telegram.dto.CrawlRunSummary;
import com.medlake.telegram.model.ChannelCrawlResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Crawls every configured channel and writes one batch unit per channel. A channel that fails is
 * reported and leaves the other channels untouched.
 */
@Service
public class CrawlRunService {

    private static final Logger logger = LoggerFactory.getLogger(CrawlRunService.class);

    private final MessageHistorySource source;
    private final HistoryCrawler crawler;
    private final ChannelBatchWriter writer;
    private final TaskExecutor crawlExecutor;
    private final PipelineProperties properties;
    private final Clock clock;

    public CrawlRunService(MessageHistorySource source,
                           HistoryCrawler crawler,
                           ChannelBatchWriter writer,
                           @Qualifier("crawlExecutor") TaskExecutor crawlExecutor,
                           PipelineProperties properties,
                           Clock clock) {
        this.source = source;
        this.crawler = crawler;
        this.writer = writer;
        this.crawlExecutor = crawlExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws SourceAuthenticationException when the source rejects the session, before or during the run;
     *                                       channels not yet crawled are skipped and nothing more is written
     * @throws HistorySourceException        when the source cannot be reached at connect time
     */
    public CrawlRunSummary runAll() {
        source.connect();
        LocalDate runDate = LocalDate.now(clock.withZone(properties.getLake().getZone()));
        List<String> channels = properties.getChannels();
        logger.info("Starting crawl of {} channels for run date {}", channels.size(), runDate);

        AtomicReference<RuntimeException> abort = new AtomicReference<>();
        List<CompletableFuture<ChannelCrawlReport>> futures = new ArrayList<>(channels.size());
        for (String channel : channels) {
            if (abort.get() != null) {
                break;
            }
            futures.add(CompletableFuture.supplyAsync(() -> crawlChannel(channel, runDate, abort), crawlExecutor));
        }

        List<ChannelCrawlReport> reports = new ArrayList<>(futures.size());
        for (CompletableFuture<ChannelCrawlReport> future : futures) {
            try {
                reports.add(future.join());
            } catch (CompletionException e) {
                awaitAll(futures);
                RuntimeException cause = abort.get();
                if (cause == null && e.getCause() instanceof RuntimeException failure) {
                    cause = failure;
                }
                logger.error("Crawl run {} aborted: {}", runDate, cause != null ? cause.getMessage() : e.getMessage());
                throw cause != null ? cause : e;
            }
        }

        CrawlRunSummary summary = new CrawlRunSummary(runDate, List.copyOf(reports));
        logger.info("Crawl run {} finished: written={} empty={} failed={} messages={} media failures={}",
                runDate,
                summary.countByStatus(ChannelCrawlReport.Status.WRITTEN),
                summary.countByStatus(ChannelCrawlReport.Status.EMPTY),
                summary.countByStatus(ChannelCrawlReport.Status.FAILED),
                summary.totalMessagesCaptured(),
                summary.totalMediaFailed());
        return summary;
    }

    /**
     * Crawls and writes one channel. A fatal failure is published through {@code abort}; a channel that
     * sees it set does not crawl, or does not write what it already crawled.
     */
    ChannelCrawlReport crawlChannel(String channel, LocalDate runDate, AtomicReference<RuntimeException> abort) {
        ensureNotAborted(channel, abort);
        ChannelCrawlResult result;
        try {
            result = crawler.crawl(channel);
        } catch (SourceAuthenticationException e) {
            abort.compareAndSet(null, e);
            throw e;
        } catch (HistorySourceException e) {
            logger.error("Crawl of @{} failed; no batch written: {}", channel, e.getMessage(), e);
            return ChannelCrawlReport.failed(channel, e.getMessage());
        } catch (RuntimeException e) {
            abort.compareAndSet(null, e);
            throw e;
        }
        ensureNotAborted(channel, abort);
        try {
            Path written = writer.write(channel, result.records(), runDate).orElse(null);
            return ChannelCrawlReport.of(result, written);
        } catch (IOException e) {
            logger.error("Could not write batch for @{}: {}", channel, e.getMessage(), e);
            return ChannelCrawlReport.failed(channel, "batch write failed: " + e.getMessage());
        }
    }

    private static void ensureNotAborted(String channel, AtomicReference<RuntimeException> abort) {
        RuntimeException cause = abort.get();
        if (cause != null) {
            throw new CancellationException("Crawl of @" + channel + " skipped, run aborted: " + cause.getMessage());
        }
    }

    /**
     * Waits until every submitted channel has finished, so no crawl outlives the run that started it.
     */
    private static void awaitAll(List<CompletableFuture<ChannelCrawlReport>> futures) {
        for (CompletableFuture<ChannelCrawlReport> future : futures) {
            try {
                future.join();
            } catch (CompletionException | CancellationException e) {
                logger.debug("Channel crawl ended after abort: {}", e.getMessage());
            }
        }
    }
}
