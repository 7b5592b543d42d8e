package com.medlake.telegram.controller;

import com.medlake.telegram.dto.CorpusStatusResponse;
import com.medlake.telegram.service.CorpusStatusService;
import com.medlake.telegram.service.HistorySourceException;
import com.medlake.telegram.service.PipelineRunner;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@RestController
@RequestMapping("/api/pipeline")
@Tag(name = "Pipeline", description = "On-demand triggers for the crawl, load and enrichment stages")
public class PipelineController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineController.class);

    private final PipelineRunner pipelineRunner;
    private final CorpusStatusService corpusStatusService;

    public PipelineController(PipelineRunner pipelineRunner, CorpusStatusService corpusStatusService) {
        this.pipelineRunner = pipelineRunner;
        this.corpusStatusService = corpusStatusService;
    }

    @Operation(summary = "Crawl all configured channels",
            description = "Crawls each channel back to the lookback boundary and writes one batch file per channel.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Crawl finished; per-channel outcome in the body"),
            @ApiResponse(responseCode = "409", description = "A crawl is already running"),
            @ApiResponse(responseCode = "503", description = "History source or storage unavailable"),
            @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    @PostMapping("/crawl")
    public ResponseEntity<?> crawl() {
        return trigger("crawl", pipelineRunner::runCrawl);
    }

    @Operation(summary = "Load batch files into raw storage",
            description = "Applies every batch file in the data lake; keys already stored are skipped.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Load finished; per-batch outcome in the body"),
            @ApiResponse(responseCode = "409", description = "A load is already running"),
            @ApiResponse(responseCode = "503", description = "Storage unavailable"),
            @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    @PostMapping("/load")
    public ResponseEntity<?> load() {
        return trigger("load", pipelineRunner::runLoad);
    }

    @Operation(summary = "Run object detection over new media assets")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Enrichment finished; per-asset outcome in the body"),
            @ApiResponse(responseCode = "409", description = "An enrichment run is already in progress"),
            @ApiResponse(responseCode = "503", description = "Storage unavailable"),
            @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    @PostMapping("/enrich")
    public ResponseEntity<?> enrich() {
        return trigger("enrich", pipelineRunner::runEnrichment);
    }

    @Operation(summary = "Row counts of the raw tables")
    @GetMapping("/status")
    public ResponseEntity<CorpusStatusResponse> status() {
        return ResponseEntity.ok(corpusStatusService.currentStatus());
    }

    @Operation(summary = "Loaded message count for one channel")
    @GetMapping("/status/channels/{channel}")
    public ResponseEntity<Map<String, Object>> channelStatus(
            @Parameter(description = "Channel handle without '@'", required = true)
            @PathVariable String channel) {
        return ResponseEntity.ok(Map.of("channel", channel, "messages", corpusStatusService.messageCount(channel)));
    }

    private ResponseEntity<?> trigger(String stage, Callable<? extends Optional<?>> run) {
        logger.info("Received request to run stage '{}'", stage);
        try {
            Optional<?> summary = run.call();
            if (summary.isEmpty()) {
                return ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(Map.of("stage", stage, "error", "already running"));
            }
            return ResponseEntity.ok(summary.get());
        } catch (HistorySourceException | DataAccessException e) {
            logger.error("Stage '{}' could not start: {}", stage, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("stage", stage, "error", String.valueOf(e.getMessage())));
        } catch (Exception e) {
            logger.error("Stage '{}' failed: {}", stage, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("stage", stage, "error", String.valueOf(e.getMessage())));
        }
    }
}
