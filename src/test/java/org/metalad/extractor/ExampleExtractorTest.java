package org.metalad.extractor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;

import org.metalad.dataset.FileSystemRepository;
import org.metalad.record.MetadataPath;
import org.metalad.testdata.TestDataHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Test class for the example dataset and file extractors
 */
public class ExampleExtractorTest {
    private static final TestDataHarness testData = new TestDataHarness();
    private FileSystemRepository dataset;

    @TempDir
    public Path tempFolder;

    @BeforeEach
    public void createDataset() throws Exception {
        dataset = testData.createDataset(
            tempFolder.resolve("ds"), TestDataHarness.ROOT_ID, "v1", "a/b.txt");
    }

    @Test
    public void datasetExtractor() throws Exception {
        ExampleDatasetExtractor extractor = new ExampleDatasetExtractor(
            ExtractionContext.forDataset(dataset, null));

        ExtractorResult result = extractor.extract(new ByteArrayOutputStream());

        assertTrue(result.isSuccess());
        assertEquals(ExampleDatasetExtractor.VERSION, result.getExtractorVersion());
        assertEquals(OutputMode.IMMEDIATE, extractor.getOutputMode());
        JsonNode data = result.getImmediateData();
        assertEquals(TestDataHarness.ROOT_ID.toString(), data.get("id").asText());
        assertEquals("v1", data.get("refcommit").asText());
        assertEquals("dataset", result.getStatusFields().get("type"));
    }

    @Test
    public void fileExtractor() throws Exception {
        ExampleFileExtractor extractor = new ExampleFileExtractor(
            ExtractionContext.forFile(dataset, MetadataPath.of("a/b.txt"), null));

        assertTrue(extractor.ensureContentAvailable());
        ExtractorResult result = extractor.extract(new ByteArrayOutputStream());

        JsonNode data = result.getImmediateData();
        assertEquals("a/b.txt", data.get("path").asText());
        assertEquals("a/b.txt".length(), data.get("content_byte_size").asLong());
        assertEquals(ExampleFileExtractor.ID, extractor.getId());
    }

    /**
     * Check that a missing file is reported as unavailable content
     */
    @Test
    public void fileExtractor_missingFile() throws Exception {
        ExampleFileExtractor extractor = new ExampleFileExtractor(
            ExtractionContext.forFile(dataset, MetadataPath.of("missing"), null));

        assertFalse(extractor.ensureContentAvailable());
    }
}
