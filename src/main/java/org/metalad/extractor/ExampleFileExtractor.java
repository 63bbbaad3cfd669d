package org.metalad.extractor;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.metalad.record.RecordType;

/**
 * Minimal file extractor reporting the path and size of a file
 */
public class ExampleFileExtractor implements Extractor {
    public static final String NAME = "metalad_example_file";
    public static final UUID ID = UUID.fromString("89fae179-eceb-4af2-8088-dfebdae6e2c0");
    public static final String VERSION = "0.0.1";

    private final ExtractionContext context;

    public ExampleFileExtractor(ExtractionContext context) {
        this.context = context;
    }

    @Override
    public UUID getId() {
        return ID;
    }

    @Override
    public String getVersion() {
        return VERSION;
    }

    @Override
    public RecordType getType() {
        return RecordType.FILE;
    }

    @Override
    public OutputMode getOutputMode() {
        return OutputMode.IMMEDIATE;
    }

    @Override
    public boolean ensureContentAvailable() {
        return Files.exists(context.getAbsoluteFilePath());
    }

    @Override
    public ExtractorResult extract(OutputStream sink) throws IOException {
        Path file = context.getAbsoluteFilePath();
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("type", "file");
        data.put("path", context.getFilePath().toString());
        data.put("content_byte_size", Files.size(file));
        data.put("comment", "example file extractor executed at " + System.currentTimeMillis());

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("type", "file");
        status.put("status", "ok");
        return new ExtractorResult(VERSION, Collections.emptyMap(), true, status, data);
    }
}
