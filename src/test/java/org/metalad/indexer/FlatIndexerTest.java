package org.metalad.indexer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.metalad.record.MetadataRecord;
import org.metalad.record.RecordType;
import org.metalad.testdata.TestDataHarness;
import org.junit.jupiter.api.Test;

/**
 * Test class for FlatIndexer
 */
public class FlatIndexerTest {
    private static final TestDataHarness testData = new TestDataHarness();
    private final Indexer indexer = new FlatIndexer();

    @Test
    public void index_fileRecord() {
        MetadataRecord record = testData.fileRecord(TestDataHarness.ROOT_ID, "v1", "a/b");

        Map<String, Object> index = indexer.index(record);

        assertEquals(
            Arrays.asList(
                "test_extractor.path", "test_extractor.keywords[0]",
                "test_extractor.keywords[1]"),
            new ArrayList<>(index.keySet()));
        assertEquals("a/b", index.get("test_extractor.path"));
        assertEquals("test", index.get("test_extractor.keywords[0]"));
    }

    /**
     * Check nested objects, scalar conversion, nulls and key encoding
     */
    @Test
    public void index_nested() {
        ObjectNode extracted = JsonNodeFactory.instance.objectNode();
        extracted.put("@context", "https://schema.org");
        ObjectNode author = extracted.putObject("author");
        author.put("full name", "A. Person");
        author.put("age", 42);
        author.putNull("orcid");
        extracted.putArray("tags").addObject().put("a-b.c:d", true);
        MetadataRecord record = testData.builder(RecordType.DATASET, TestDataHarness.ROOT_ID, "v1")
            .extractorName("metalad_core")
            .extractedMetadata(extracted)
            .build();

        Map<String, Object> index = indexer.index(record);

        assertEquals("https://schema.org", index.get("metalad_core.context"));
        assertEquals("A. Person", index.get("metalad_core.author.full_name"));
        assertEquals("42", index.get("metalad_core.author.age"));
        assertTrue(index.containsKey("metalad_core.author.orcid"));
        assertNull(index.get("metalad_core.author.orcid"));
        assertEquals("true", index.get("metalad_core.tags[0].a_b_c-d"));
        assertEquals(5, index.size());
    }

    @Test
    public void index_scalarMetadata() {
        MetadataRecord record = testData.builder(RecordType.DATASET, TestDataHarness.ROOT_ID, "v1")
            .extractedMetadata(JsonNodeFactory.instance.textNode("plain"))
            .build();

        Map<String, Object> index = indexer.index(record);

        assertEquals(1, index.size());
        assertEquals("plain", index.get("test_extractor"));
    }

    @Test
    public void encodeKey() {
        assertEquals("name", FlatIndexer.encodeKey("@@name"));
        assertEquals("a_b_c_d-e", FlatIndexer.encodeKey("a/b c-d:e"));
    }
}
