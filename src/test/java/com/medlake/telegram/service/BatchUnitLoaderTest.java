package com.medlake.telegram.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.medlake.telegram.config.PipelineProperties;
import com.medlake.telegram.dto.BatchLoadReport;
import com.medlake.telegram.dto.LoadRunSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class BatchUnitLoaderTest {

    @TempDir
    Path lake;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private H2TestDatabase database;
    private BatchUnitLoader loader;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        properties.getLake().setBasePath(lake.toString());
        database = new H2TestDatabase(properties);
        RawMessageStore store = new RawMessageStore(database.jdbcTemplate, database.schema);
        loader = new BatchUnitLoader(objectMapper, database.schema, store, database.transactionManager, properties);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void replayingABatchInsertsNothing() throws Exception {
        writeBatch("2025-07-01", "tikvahpharma", records("tikvahpharma", 3, 2, 1));

        LoadRunSummary first = loader.loadAll();
        LoadRunSummary second = loader.loadAll();

        assertThat(first.recordsInserted()).isEqualTo(3);
        assertThat(second.recordsInserted()).isZero();
        assertThat(second.recordsDuplicate()).isEqualTo(3);
        assertThat(database.count(database.schema.messagesTable())).isEqualTo(3);
    }

    @Test
    void malformedRecordIsSkippedAndTheRestLoaded() throws Exception {
        ArrayNode batch = objectMapper.createArrayNode();
        for (int id = 100; id >= 1; id--) {
            ObjectNode record = record("lobelia4cosmetics", id);
            if (id == 50) {
                record.remove(HistoryCrawler.CHANNEL_FIELD);
            }
            batch.add(record);
        }
        Path file = writeBatch("2025-07-01", "lobelia4cosmetics", batch);

        BatchLoadReport report = loader.loadBatch(file);

        assertThat(report.status()).isEqualTo(BatchLoadReport.Status.LOADED);
        assertThat(report.recordsSeen()).isEqualTo(100);
        assertThat(report.inserted()).isEqualTo(99);
        assertThat(report.malformed()).isEqualTo(1);
        assertThat(database.count(database.schema.messagesTable())).isEqualTo(99);
    }

    @Test
    void recordsWithoutIntegralIdAreMalformed() throws Exception {
        ArrayNode batch = objectMapper.createArrayNode();
        batch.add(record("chemed", 1));
        batch.add(record("chemed", 2).put("id", "2"));
        batch.add(record("chemed", 3).put(HistoryCrawler.CHANNEL_FIELD, " "));
        batch.add("not an object");

        BatchLoadReport report = loader.loadBatch(writeBatch("2025-07-01", "chemed", batch));

        assertThat(report.inserted()).isEqualTo(1);
        assertThat(report.malformed()).isEqualTo(3);
    }

    @Test
    void firstPayloadForAKeyWins() throws Exception {
        ArrayNode batch = objectMapper.createArrayNode();
        batch.add(record("tikvahpharma", 7).put("message", "first"));
        batch.add(record("tikvahpharma", 7).put("message", "second"));

        BatchLoadReport report = loader.loadBatch(writeBatch("2025-07-01", "tikvahpharma", batch));
        loader.loadBatch(writeBatch("2025-07-02", "tikvahpharma",
                objectMapper.createArrayNode().add(record("tikvahpharma", 7).put("message", "third"))));

        assertThat(report.inserted()).isEqualTo(1);
        assertThat(report.duplicates()).isEqualTo(1);
        String stored = database.jdbcTemplate.queryForObject(
                "SELECT message_data FROM " + database.schema.messagesTable() + " WHERE message_id = 7", String.class);
        assertThat(objectMapper.readTree(stored))
                .isEqualTo(objectMapper.readTree(objectMapper.writeValueAsString(batch.get(0))));
    }

    @Test
    void storageFailureRollsBackTheWholeBatch() throws Exception {
        ArrayNode batch = objectMapper.createArrayNode();
        batch.add(record("tikvahpharma", 3));
        batch.add(record("tikvahpharma", 2));
        batch.add(record("x".repeat(300), 1));

        BatchLoadReport report = loader.loadBatch(writeBatch("2025-07-01", "tikvahpharma", batch));

        assertThat(report.status()).isEqualTo(BatchLoadReport.Status.FAILED);
        assertThat(report.inserted()).isZero();
        assertThat(database.count(database.schema.messagesTable())).isZero();
    }

    @Test
    void badFilesFailAloneAndImagesAreIgnored() throws Exception {
        writeBatch("2025-07-01", "chemed", records("chemed", 2, 1));
        writeRaw("2025-07-01/broken/broken.json", "[{\"id\": 1,");
        writeRaw("2025-07-01/object/object.json", "{\"id\": 1}");
        writeRaw("2025-07-01/empty/empty.json", "[]");
        writeRaw("images/chemed_1_1.json", "[]");

        LoadRunSummary summary = loader.loadAll();

        assertThat(summary.batches()).extracting(BatchLoadReport::file).containsExactly(
                Path.of("2025-07-01", "broken", "broken.json").toString(),
                Path.of("2025-07-01", "chemed", "chemed.json").toString(),
                Path.of("2025-07-01", "empty", "empty.json").toString(),
                Path.of("2025-07-01", "object", "object.json").toString());
        assertThat(summary.batches()).extracting(BatchLoadReport::status).containsExactly(
                BatchLoadReport.Status.FAILED, BatchLoadReport.Status.LOADED,
                BatchLoadReport.Status.EMPTY, BatchLoadReport.Status.FAILED);
        assertThat(summary.filesFailed()).isEqualTo(2);
        assertThat(summary.recordsInserted()).isEqualTo(2);
    }

    @Test
    void missingLakeLoadsNothing() throws Exception {
        PipelineProperties properties = new PipelineProperties();
        properties.getLake().setBasePath(lake.resolve("absent").toString());
        BatchUnitLoader emptyLakeLoader = new BatchUnitLoader(objectMapper, database.schema,
                new RawMessageStore(database.jdbcTemplate, database.schema), database.transactionManager, properties);

        assertThat(emptyLakeLoader.loadAll().batches()).isEmpty();
    }

    private ArrayNode records(String channel, long... ids) {
        ArrayNode batch = objectMapper.createArrayNode();
        for (long id : ids) {
            batch.add(record(channel, id));
        }
        return batch;
    }

    private ObjectNode record(String channel, long id) {
        ObjectNode record = objectMapper.createObjectNode();
        record.put("_", "Message");
        record.put("id", id);
        record.put("date", "2025-07-01T08:00:00Z");
        record.put("message", "stock update " + id);
        record.put(HistoryCrawler.CHANNEL_FIELD, channel);
        return record;
    }

    private Path writeBatch(String date, String channel, ArrayNode records) throws Exception {
        return writeRaw(date + "/" + channel + "/" + channel + ".json", objectMapper.writeValueAsString(records));
    }

    private Path writeRaw(String relative, String content) throws Exception {
        Path file = lake.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
