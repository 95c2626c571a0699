package com.brutesearch.orchestrator.service.sink;

import com.brutesearch.orchestrator.dto.ResultRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Appends each record as one JSON object per line to {@code <dir>/<jobId>.jsonl}.
 */
@Slf4j
public class JsonLinesResultSink implements ResultSink {

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonLinesResultSink(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public synchronized void accept(String jobId, List<ResultRecord> records) throws IOException {
        if (records == null || records.isEmpty()) {
            return;
        }
        Files.createDirectories(directory);
        Path file = fileFor(jobId);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (ResultRecord record : records) {
                writer.write(objectMapper.writeValueAsString(record));
                writer.newLine();
            }
        }
        log.debug("Wrote {} records to {}", records.size(), file);
    }

    public Path fileFor(String jobId) {
        return directory.resolve(jobId + ".jsonl");
    }
}
