package com.medlake.telegram.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medlake.telegram.config.PipelineProperties;
import com.medlake.telegram.dto.BatchLoadReport;
import com.medlake.telegram.dto.LoadRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Moves batch units from the data lake into {@code raw_telegram_messages}. Each file is applied in its
 * own transaction; keys already stored are skipped, so replaying a file has no effect.
 */
@Service
public class BatchUnitLoader {

    private static final Logger logger = LoggerFactory.getLogger(BatchUnitLoader.class);

    private final ObjectMapper objectMapper;
    private final RawStorageSchema schema;
    private final RawMessageStore messageStore;
    private final TransactionTemplate transactionTemplate;
    private final Path basePath;
    private final String imagesDir;

    public BatchUnitLoader(ObjectMapper objectMapper,
                           RawStorageSchema schema,
                           RawMessageStore messageStore,
                           PlatformTransactionManager transactionManager,
                           PipelineProperties properties) {
        this.objectMapper = objectMapper;
        this.schema = schema;
        this.messageStore = messageStore;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.basePath = Paths.get(properties.getLake().getBasePath());
        this.imagesDir = properties.getLake().getImagesDir();
    }

    /**
     * Loads every batch unit found under the lake root.
     *
     * @throws org.springframework.dao.DataAccessException when the schema cannot be ensured
     */
    public LoadRunSummary loadAll() throws IOException {
        schema.ensureSchema();
        List<Path> files = discoverBatchFiles();
        logger.info("Found {} batch files under {}", files.size(), basePath);

        List<BatchLoadReport> reports = new ArrayList<>(files.size());
        for (Path file : files) {
            reports.add(loadBatch(file));
        }
        LoadRunSummary summary = new LoadRunSummary(reports);
        logger.info("Load run finished: files={} failed={} records seen={} inserted={} duplicate={} malformed={}",
                summary.filesProcessed(), summary.filesFailed(), summary.recordsSeen(),
                summary.recordsInserted(), summary.recordsDuplicate(), summary.recordsMalformed());
        return summary;
    }

    /**
     * Applies one batch unit. Parse failures and failures inside the batch transaction are reported on
     * the batch; only an unreachable schema propagates.
     */
    public BatchLoadReport loadBatch(Path file) {
        String label = describe(file);
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            logger.error("Could not read batch {}: {}", label, e.getMessage());
            return BatchLoadReport.failed(label, 0, "unreadable: " + e.getMessage());
        }
        if (root == null || !root.isArray()) {
            logger.error("Batch {} is not a JSON array; skipping file", label);
            return BatchLoadReport.failed(label, 0, "root is not a JSON array");
        }
        if (root.isEmpty()) {
            logger.warn("Batch {} is empty", label);
            return BatchLoadReport.empty(label);
        }

        schema.ensureSchema();
        JsonNode records = root;
        Counts counts = new Counts();
        try {
            transactionTemplate.executeWithoutResult(status -> {
                for (JsonNode record : records) {
                    counts.seen++;
                    applyRecord(label, counts.seen, record, counts);
                }
            });
        } catch (RuntimeException e) {
            logger.error("Batch {} failed at record {}; rolled back: {}", label, counts.seen, e.getMessage(), e);
            return BatchLoadReport.failed(label, counts.seen, e.getMessage());
        }
        logger.info("Loaded batch {}: seen={} inserted={} duplicate={} malformed={}",
                label, counts.seen, counts.inserted, counts.duplicates, counts.malformed);
        return BatchLoadReport.loaded(label, counts.seen, counts.inserted, counts.duplicates, counts.malformed);
    }

    private void applyRecord(String label, int position, JsonNode record, Counts counts) {
        JsonNode id = record.get("id");
        JsonNode channel = record.get(HistoryCrawler.CHANNEL_FIELD);
        if (!record.isObject() || id == null || !id.isIntegralNumber() || !id.canConvertToLong()
                || channel == null || !channel.isTextual() || channel.asText().isBlank()) {
            counts.malformed++;
            logger.warn("Skipping malformed record #{} in {}: missing id or {}", position, label,
                    HistoryCrawler.CHANNEL_FIELD);
            return;
        }
        if (messageStore.insertIfAbsent(id.asLong(), channel.asText(), toJson(record))) {
            counts.inserted++;
        } else {
            counts.duplicates++;
        }
    }

    List<Path> discoverBatchFiles() throws IOException {
        if (!Files.isDirectory(basePath)) {
            logger.info("Data lake root {} does not exist yet", basePath);
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        for (Path dateDir : sortedEntries(basePath)) {
            if (!Files.isDirectory(dateDir) || dateDir.getFileName().toString().equals(imagesDir)) {
                continue;
            }
            for (Path channelDir : sortedEntries(dateDir)) {
                if (!Files.isDirectory(channelDir)) {
                    continue;
                }
                for (Path file : sortedEntries(channelDir)) {
                    String name = file.getFileName().toString();
                    if (Files.isRegularFile(file) && name.endsWith(".json") && !name.startsWith(".")) {
                        files.add(file);
                    }
                }
            }
        }
        return files;
    }

    private static List<Path> sortedEntries(Path dir) throws IOException {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            stream.forEach(entries::add);
        }
        entries.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return entries;
    }

    private String describe(Path file) {
        Path absoluteBase = basePath.toAbsolutePath().normalize();
        Path absoluteFile = file.toAbsolutePath().normalize();
        return absoluteFile.startsWith(absoluteBase)
                ? absoluteBase.relativize(absoluteFile).toString()
                : file.toString();
    }

    private String toJson(JsonNode record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static final class Counts {
        int seen;
        int inserted;
        int duplicates;
        int malformed;
    }
}
