package com.pricemonitor.engine.infrastructure.batch;

import com.pricemonitor.common.json.JacksonConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Reads scraper output files into raw records.
 *
 * <p>{@code .json}: an array of objects, or an object holding that array under {@code products}.
 * {@code .jsonl}: one object per line; a line that is not a JSON object is logged and left out so
 * the rest of the file still gets ingested.
 */
@Slf4j
@Component
public class JsonBatchFileReader {

    private static final TypeReference<Map<String, Object>> RECORD = new TypeReference<>() {};

    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    public List<Map<String, Object>> read(Path file) {
        var name = file.getFileName().toString();
        try {
            return name.endsWith(".jsonl") ? readLines(file) : readDocument(file);
        } catch (IOException e) {
            throw BatchFileException.unreadable(file, e);
        } catch (JacksonException e) {
            throw BatchFileException.malformed(file, e.getOriginalMessage(), e);
        }
    }

    private List<Map<String, Object>> readDocument(Path file) throws IOException {
        JsonNode root;
        try (var in = Files.newInputStream(file)) {
            root = objectMapper.readTree(in);
        }
        var array = root != null && root.isObject() ? root.get("products") : root;
        if (array == null || !array.isArray()) {
            throw BatchFileException.malformed(file, "expected an array of records", null);
        }
        var records = new ArrayList<Map<String, Object>>(array.size());
        for (var node : array) {
            if (node.isObject()) {
                records.add(objectMapper.convertValue(node, RECORD));
            } else {
                log.warn("batch.record.skipped: file={}, reason=not_an_object", file.getFileName());
            }
        }
        return records;
    }

    private List<Map<String, Object>> readLines(Path file) throws IOException {
        var records = new ArrayList<Map<String, Object>>();
        int lineNumber = 0;
        for (var line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(objectMapper.readValue(line, RECORD));
            } catch (JacksonException e) {
                log.warn("batch.line.skipped: file={}, line={}, reason={}",
                        file.getFileName(), lineNumber, e.getOriginalMessage());
            }
        }
        return records;
    }
}
