package com.medlake.telegram.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.medlake.telegram.config.PipelineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ChannelBatchWriterTest {

    private static final LocalDate RUN_DATE = LocalDate.of(2025, 7, 1);

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ChannelBatchWriter writer;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        properties.getLake().setBasePath(tempDir.toString());
        writer = new ChannelBatchWriter(objectMapper, properties);
    }

    @Test
    void writesOneJsonArrayPerRunDateAndChannel() throws Exception {
        List<ObjectNode> records = List.of(record(2, "2025-07-01T10:15:30+03:00"), record(1, "2025-06-30T08:00:00Z"));

        Optional<Path> written = writer.write("lobelia4cosmetics", records, RUN_DATE);

        assertThat(written).contains(tempDir.resolve("2025-07-01/lobelia4cosmetics/lobelia4cosmetics.json"));
        JsonNode parsed = objectMapper.readTree(written.get().toFile());
        assertThat(parsed.isArray()).isTrue();
        assertThat(parsed.size()).isEqualTo(2);
        assertThat(parsed.get(0).get("id").asLong()).isEqualTo(2L);
        assertThat(OffsetDateTime.parse(parsed.get(0).get("date").asText()))
                .isEqualTo(OffsetDateTime.parse("2025-07-01T10:15:30+03:00"));
        assertThat(Files.readString(written.get())).contains(System.lineSeparator());
    }

    @Test
    void nothingCapturedWritesNothing() throws Exception {
        Optional<Path> written = writer.write("tikvahpharma", List.of(), RUN_DATE);

        assertThat(written).isEmpty();
        assertThat(Files.exists(tempDir.resolve("2025-07-01"))).isFalse();
    }

    @Test
    void rerunOnTheSameDayReplacesTheBatch() throws Exception {
        writer.write("tikvahpharma", List.of(record(1, "2025-07-01T00:00:00Z")), RUN_DATE);
        Path path = writer.write("tikvahpharma",
                List.of(record(3, "2025-07-01T02:00:00Z"), record(2, "2025-07-01T01:00:00Z")), RUN_DATE).orElseThrow();

        assertThat(objectMapper.readTree(path.toFile()).size()).isEqualTo(2);
        try (Stream<Path> files = Files.list(path.getParent())) {
            assertThat(files).containsExactly(path);
        }
    }

    private ObjectNode record(long id, String date) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", id);
        node.put("date", date);
        node.put(HistoryCrawler.CHANNEL_FIELD, "lobelia4cosmetics");
        return node;
    }
}
