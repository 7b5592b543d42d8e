package com.medlake.telegram.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.medlake.telegram.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Writes one channel's crawl output as the batch unit {@code <base>/<run-date>/<channel>/<channel>.json}.
 */
@Service
public class ChannelBatchWriter {

    private static final Logger logger = LoggerFactory.getLogger(ChannelBatchWriter.class);

    private final ObjectMapper objectMapper;
    private final Path basePath;

    public ChannelBatchWriter(ObjectMapper objectMapper, PipelineProperties properties) {
        this.objectMapper = objectMapper;
        this.basePath = Paths.get(properties.getLake().getBasePath());
    }

    public Path batchPath(String channel, LocalDate runDate) {
        return basePath.resolve(runDate.format(DateTimeFormatter.ISO_LOCAL_DATE))
                .resolve(channel)
                .resolve(channel + ".json");
    }

    /**
     * Replaces the run-date's batch for the channel.
     *
     * @return the written file, or empty when there was nothing to write
     */
    public Optional<Path> write(String channel, List<ObjectNode> records, LocalDate runDate) throws IOException {
        if (records == null || records.isEmpty()) {
            logger.warn("Nothing captured for @{} on {}; no batch written", channel, runDate);
            return Optional.empty();
        }
        Path target = batchPath(channel, runDate);
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), "." + channel, ".json.part");
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, records);
            }
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.info("Wrote {} records for @{} to {}", records.size(), channel, target);
        return Optional.of(target);
    }
}
