package org.metalad.extractor;

import java.io.OutputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.metalad.record.RecordType;

/**
 * Minimal dataset extractor reporting the identity of the dataset
 */
public class ExampleDatasetExtractor implements Extractor {
    public static final String NAME = "metalad_example_dataset";
    public static final UUID ID = UUID.fromString("b3c487ea-e670-4801-bcdc-29639bf1269b");
    public static final String VERSION = "0.0.1";

    private final ExtractionContext context;

    public ExampleDatasetExtractor(ExtractionContext context) {
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
        return RecordType.DATASET;
    }

    @Override
    public OutputMode getOutputMode() {
        return OutputMode.IMMEDIATE;
    }

    @Override
    public boolean ensureContentAvailable() {
        return true;
    }

    @Override
    public ExtractorResult extract(OutputStream sink) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("id", context.getDataset().getDatasetId().toString());
        data.put("refcommit", context.getDataset().getCurrentVersion());
        data.put("comment", "example dataset extractor executed at " + System.currentTimeMillis());

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("type", "dataset");
        status.put("status", "ok");
        return new ExtractorResult(VERSION, Collections.emptyMap(), true, status, data);
    }
}
