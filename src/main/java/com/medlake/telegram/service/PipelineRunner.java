package com.medlake.telegram.service;

import com.medlake.telegram.dto.CrawlRunSummary;
import com.medlake.telegram.dto.EnrichmentRunSummary;
import com.medlake.telegram.dto.LoadRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for stage runs, shared by the schedules and the operations endpoint. A stage never runs
 * twice at the same time; a trigger that finds it running gets an empty result.
 */
@Service
public class PipelineRunner {

    private static final Logger logger = LoggerFactory.getLogger(PipelineRunner.class);

    private final CrawlRunService crawlRunService;
    private final BatchUnitLoader batchUnitLoader;
    private final DetectionEnricher detectionEnricher;
    private final boolean crawlScheduleEnabled;
    private final boolean loadScheduleEnabled;
    private final boolean enrichScheduleEnabled;

    private final AtomicBoolean crawlRunning = new AtomicBoolean(false);
    private final AtomicBoolean loadRunning = new AtomicBoolean(false);
    private final AtomicBoolean enrichRunning = new AtomicBoolean(false);

    public PipelineRunner(CrawlRunService crawlRunService,
                          BatchUnitLoader batchUnitLoader,
                          DetectionEnricher detectionEnricher,
                          @Value("${app.scheduler.crawl.enabled:false}") boolean crawlScheduleEnabled,
                          @Value("${app.scheduler.load.enabled:false}") boolean loadScheduleEnabled,
                          @Value("${app.scheduler.enrich.enabled:false}") boolean enrichScheduleEnabled) {
        this.crawlRunService = crawlRunService;
        this.batchUnitLoader = batchUnitLoader;
        this.detectionEnricher = detectionEnricher;
        this.crawlScheduleEnabled = crawlScheduleEnabled;
        this.loadScheduleEnabled = loadScheduleEnabled;
        this.enrichScheduleEnabled = enrichScheduleEnabled;
    }

    public Optional<CrawlRunSummary> runCrawl() throws Exception {
        return runGuarded("crawl", crawlRunning, crawlRunService::runAll);
    }

    public Optional<LoadRunSummary> runLoad() throws Exception {
        return runGuarded("load", loadRunning, batchUnitLoader::loadAll);
    }

    public Optional<EnrichmentRunSummary> runEnrichment() throws Exception {
        return runGuarded("enrich", enrichRunning, detectionEnricher::enrichAll);
    }

    @Scheduled(cron = "${app.scheduler.crawl.cron:0 0 1 * * *}", zone = "${app.lake.zone:UTC}")
    public void scheduledCrawl() {
        if (crawlScheduleEnabled) {
            runScheduled("crawl", this::runCrawl);
        }
    }

    @Scheduled(cron = "${app.scheduler.load.cron:0 30 1 * * *}", zone = "${app.lake.zone:UTC}")
    public void scheduledLoad() {
        if (loadScheduleEnabled) {
            runScheduled("load", this::runLoad);
        }
    }

    @Scheduled(cron = "${app.scheduler.enrich.cron:0 0 2 * * *}", zone = "${app.lake.zone:UTC}")
    public void scheduledEnrichment() {
        if (enrichScheduleEnabled) {
            runScheduled("enrich", this::runEnrichment);
        }
    }

    private <T> Optional<T> runGuarded(String stage, AtomicBoolean running, Callable<T> run) throws Exception {
        if (!running.compareAndSet(false, true)) {
            logger.info("Stage '{}' is already running; trigger ignored.", stage);
            return Optional.empty();
        }
        long started = System.currentTimeMillis();
        try {
            T summary = run.call();
            logger.info("Stage '{}' completed in {} ms", stage, System.currentTimeMillis() - started);
            return Optional.of(summary);
        } finally {
            running.set(false);
        }
    }

    private void runScheduled(String stage, Callable<? extends Optional<?>> trigger) {
        try {
            trigger.call();
        } catch (IOException e) {
            logger.error("Scheduled '{}' run failed on the data lake: {}", stage, e.getMessage(), e);
        } catch (Exception e) {
            logger.error("Scheduled '{}' run aborted: {}", stage, e.getMessage(), e);
        }
    }
}
