package org.metalad.aggregate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.metalad.MetadataStore;
import org.metalad.ObjectRef;
import org.metalad.dataset.FileSystemRepository;
import org.metalad.index.Containment;
import org.metalad.index.IndexUpdate;
import org.metalad.index.SubDatasetEntry;
import org.metalad.index.VersionIndex;
import org.metalad.record.MetadataPath;
import org.metalad.record.MetadataRecord;
import org.metalad.testdata.TestDataHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Test class for Aggregator
 */
public class AggregatorTest {
    private static final TestDataHarness testData = new TestDataHarness();
    private static final MetadataPath SUB_PATH = MetadataPath.of("d/e");

    private FileSystemRepository root;
    private FileSystemRepository sub;
    private MetadataStore rootStore;
    private final Aggregator aggregator = new Aggregator();

    @TempDir
    public Path tempFolder;

    @BeforeEach
    public void createDatasets() throws IOException {
        root = testData.createDataset(
            tempFolder.resolve("root"), TestDataHarness.ROOT_ID, "r1", "a/b/c");
        sub = testData.createDataset(
            tempFolder.resolve("root").resolve("d").resolve("e"), TestDataHarness.SUB_ID, "s1",
            "f");
        rootStore = MetadataStore.open(root.getStorePath());
    }

    /**
     * Store a dataset record and a record of file "f" for a sub-dataset version
     */
    private MetadataStore addSubMetadata(String version) throws Exception {
        MetadataStore subStore = MetadataStore.open(sub.getStorePath());
        ObjectRef datasetRef = subStore.putRecord(
            testData.datasetRecord(TestDataHarness.SUB_ID, version));
        ObjectRef fileRef = subStore.putRecord(
            testData.fileRecord(TestDataHarness.SUB_ID, version, "f"));
        subStore.getIndexManager().seal(TestDataHarness.SUB_ID, version, Arrays.asList(
            IndexUpdate.datasetLevel(datasetRef),
            IndexUpdate.file(MetadataPath.of("f"), fileRef)
        ));
        return subStore;
    }

    /**
     * Check that the root store answers for the sub-dataset after aggregation
     */
    @Test
    public void aggregate_copiesIndexAndObjects() throws Exception {
        MetadataStore subStore = addSubMetadata("s1");

        List<AggregationResult> results = aggregator.aggregate(root, rootStore, 1);

        assertEquals(1, results.size());
        AggregationResult result = results.get(0);
        assertEquals(AggregationResult.Status.OK, result.getStatus());
        assertEquals(SUB_PATH, result.getSubPath());
        assertEquals(2, result.getCopiedObjects());
        assertEquals(Collections.singletonList("s1"), result.getCopiedVersions());
        assertEquals("r1", result.getEdge().getRootDatasetVersion());
        assertEquals("s1", result.getEdge().getSubDatasetVersion());

        VersionIndex rootIndex = rootStore.getIndexManager().get(TestDataHarness.ROOT_ID, "r1");
        SubDatasetEntry entry = rootIndex.getDatasetTree().get(SUB_PATH);
        VersionIndex subIndex = subStore.getIndexManager().get(TestDataHarness.SUB_ID, "s1");
        assertEquals(TestDataHarness.SUB_ID, entry.getDatasetId());
        assertEquals("s1", entry.getDatasetVersion());
        assertEquals(subIndex.getDatasetLevelRef(), entry.getDatasetLevelRef());

        ObjectRef fileRef = rootIndex.getFileTree().get(MetadataPath.of("d/e/f"));
        assertEquals(subIndex.getFileTree().get(MetadataPath.of("f")), fileRef);
        MetadataRecord fileRecord = rootStore.getRecord(fileRef);
        assertEquals(testData.fileRecord(TestDataHarness.SUB_ID, "s1", "f"), fileRecord);

        VersionIndex imported = rootStore.getIndexManager().get(TestDataHarness.SUB_ID, "s1");
        assertEquals(
            new Containment(TestDataHarness.ROOT_ID, "r1", SUB_PATH), imported.getContainment());
        assertEquals(subIndex.getFileTree(), imported.getFileTree());
    }

    /**
     * Check that aggregating twice copies no objects the second time
     */
    @Test
    public void aggregate_idempotent() throws Exception {
        addSubMetadata("s1");
        aggregator.aggregate(root, rootStore, 1);
        long objectCount = rootStore.getObjectStore().count();

        AggregationResult second = aggregator.aggregate(root, rootStore, 1).get(0);

        assertEquals(AggregationResult.Status.OK, second.getStatus());
        assertEquals(0, second.getCopiedObjects());
        assertEquals(objectCount, rootStore.getObjectStore().count());
    }

    /**
     * Check that versions other than the current one are imported with ambiguous containment
     */
    @Test
    public void aggregate_otherVersionsAmbiguous() throws Exception {
        addSubMetadata("s0");
        addSubMetadata("s1");

        AggregationResult result = aggregator.aggregate(root, rootStore, 1).get(0);

        assertEquals(Arrays.asList("s0", "s1"), result.getCopiedVersions());
        Containment old = rootStore.getIndexManager().get(TestDataHarness.SUB_ID, "s0")
            .getContainment();
        assertTrue(old.isAmbiguous());
        assertEquals(TestDataHarness.ROOT_ID, old.getRootDatasetId());
        assertEquals(SUB_PATH, old.getDatasetPath());
        assertFalse(rootStore.getIndexManager().get(TestDataHarness.SUB_ID, "s1")
                        .getContainment().isAmbiguous());
    }

    /**
     * Check that a containment observed earlier is not replaced by an ambiguous one
     */
    @Test
    public void aggregate_keepsKnownContainment() throws Exception {
        addSubMetadata("s0");
        sub = FileSystemRepository.create(sub.getPath(), TestDataHarness.SUB_ID, "s0");
        aggregator.aggregate(root, rootStore, 1);

        addSubMetadata("s1");
        sub = FileSystemRepository.create(sub.getPath(), TestDataHarness.SUB_ID, "s1");
        root = FileSystemRepository.create(root.getPath(), TestDataHarness.ROOT_ID, "r2");
        aggregator.aggregate(root, rootStore, 1);

        assertEquals(
            new Containment(TestDataHarness.ROOT_ID, "r1", SUB_PATH),
            rootStore.getIndexManager().get(TestDataHarness.SUB_ID, "s0").getContainment());
        assertEquals(
            new Containment(TestDataHarness.ROOT_ID, "r2", SUB_PATH),
            rootStore.getIndexManager().get(TestDataHarness.SUB_ID, "s1").getContainment());
        assertEquals(
            "s0", rootStore.getIndexManager().get(TestDataHarness.ROOT_ID, "r1").getDatasetTree()
                .get(SUB_PATH).getDatasetVersion());
    }

    /**
     * Check that a sub-dataset without metadata for its current version gets an entry without
     * a ref
     */
    @Test
    public void aggregate_noMetadataForCurrentVersion() throws Exception {
        addSubMetadata("s0");

        AggregationResult result = aggregator.aggregate(root, rootStore, 1).get(0);

        assertEquals(AggregationResult.Status.OK, result.getStatus());
        SubDatasetEntry entry = rootStore.getIndexManager().get(TestDataHarness.ROOT_ID, "r1")
            .getDatasetTree().get(SUB_PATH);
        assertEquals("s1", entry.getDatasetVersion());
        assertNull(entry.getDatasetLevelRef());
    }

    /**
     * Check that a sub-dataset without store fails while its siblings are aggregated
     */
    @Test
    public void aggregate_missingSubStore() throws Exception {
        addSubMetadata("s1");
        testData.createDataset(
            tempFolder.resolve("root").resolve("x"), TestDataHarness.NESTED_ID, "n1");

        List<AggregationResult> results = aggregator.aggregate(root, rootStore, 1);

        assertEquals(2, results.size());
        assertEquals(SUB_PATH, results.get(0).getSubPath());
        assertEquals(AggregationResult.Status.OK, results.get(0).getStatus());
        assertEquals(MetadataPath.of("x"), results.get(1).getSubPath());
        assertEquals(AggregationResult.Status.ERROR, results.get(1).getStatus());
        assertTrue(results.get(1).getMessage().contains("x"));
        assertFalse(rootStore.getIndexManager().get(TestDataHarness.ROOT_ID, "r1")
                        .getDatasetTree().containsKey(MetadataPath.of("x")));
    }

    /**
     * Check that an index entry whose blob is missing is skipped and reported
     */
    @Test
    public void aggregate_danglingRef() throws Exception {
        MetadataStore subStore = addSubMetadata("s1");
        subStore.getIndexManager().seal(TestDataHarness.SUB_ID, "s1", Collections.singletonList(
            IndexUpdate.file(MetadataPath.of("lost"), ObjectRef.of("abcdef"))));

        AggregationResult result = aggregator.aggregate(root, rootStore, 1).get(0);

        assertEquals(AggregationResult.Status.PARTIAL, result.getStatus());
        assertEquals(1, result.getEntryErrors().size());
        assertEquals("abcdef", result.getEntryErrors().get(0).getObjectRef());
        VersionIndex rootIndex = rootStore.getIndexManager().get(TestDataHarness.ROOT_ID, "r1");
        assertTrue(rootIndex.getFileTree().containsKey(MetadataPath.of("d/e/f")));
        assertFalse(rootIndex.getFileTree().containsKey(MetadataPath.of("d/e/lost")));
    }

    @Test
    public void aggregate_depth() throws Exception {
        addSubMetadata("s1");
        FileSystemRepository nested = testData.createDataset(
            sub.getPath().resolve("n"), TestDataHarness.NESTED_ID, "n1", "g");
        MetadataStore.open(nested.getStorePath());

        assertEquals(1, aggregator.aggregate(root, rootStore, 1).size());

        List<AggregationResult> unlimited = aggregator.aggregate(root, rootStore, -1);
        assertEquals(2, unlimited.size());
        assertEquals(MetadataPath.of("d/e/n"), unlimited.get(1).getSubPath());
        assertEquals(AggregationResult.Status.OK, unlimited.get(1).getStatus());
        assertTrue(rootStore.getIndexManager().get(TestDataHarness.ROOT_ID, "r1")
                       .getDatasetTree().containsKey(MetadataPath.of("d/e/n")));

        assertThrows(
            IllegalArgumentException.class, () -> aggregator.aggregate(root, rootStore, 0));
        assertThrows(
            IllegalArgumentException.class, () -> aggregator.aggregate(root, rootStore, -2));
    }

    /**
     * Check aggregation of explicit sub-dataset paths
     */
    @Test
    public void aggregate_subPaths() throws Exception {
        addSubMetadata("s1");

        List<AggregationResult> results = aggregator.aggregate(
            root, rootStore, Arrays.asList(SUB_PATH, MetadataPath.of("nowhere")));

        assertEquals(AggregationResult.Status.OK, results.get(0).getStatus());
        assertEquals(AggregationResult.Status.ERROR, results.get(1).getStatus());
        assertNull(results.get(1).getEdge());
    }

    /**
     * Check that a custom locator is used to find sub-dataset stores
     */
    @Test
    public void aggregate_storeLocator() throws Exception {
        MetadataStore subStore = addSubMetadata("s1");
        Aggregator locating = new Aggregator(dataset -> subStore);

        AggregationResult result = locating.aggregate(root, rootStore, 1).get(0);

        assertEquals(AggregationResult.Status.OK, result.getStatus());
        assertEquals(2, result.getCopiedObjects());
    }
}
