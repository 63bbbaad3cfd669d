package org.metalad.dataset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.metalad.record.MetadataPath;
import org.metalad.testdata.TestDataHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Test class for FileSystemRepository
 */
public class FileSystemRepositoryTest {
    private static final TestDataHarness testData = new TestDataHarness();
    private FileSystemRepository root;

    @TempDir
    public Path tempFolder;

    /**
     * Create a root dataset with files, a sub-dataset at d/e and a nested sub-dataset at d/e/n
     */
    @BeforeEach
    public void createDatasets() throws IOException {
        root = testData.createDataset(
            tempFolder.resolve("root"), TestDataHarness.ROOT_ID, "r1", "a/b/c", "top.txt");
        testData.createDataset(
            tempFolder.resolve("root").resolve("d").resolve("e"), TestDataHarness.SUB_ID, "s1",
            "f");
        testData.createDataset(
            tempFolder.resolve("root").resolve("d").resolve("e").resolve("n"),
            TestDataHarness.NESTED_ID, "n1", "g");
    }

    @Test
    public void open() throws Exception {
        FileSystemRepository opened = new FileSystemRepository(tempFolder.resolve("root"));

        assertEquals(TestDataHarness.ROOT_ID, opened.getDatasetId());
        assertEquals("r1", opened.getCurrentVersion());
        assertEquals(
            opened.getPath().resolve(".metalad").resolve("store"), opened.getStorePath());
    }

    @Test
    public void open_notADataset() throws Exception {
        Files.createDirectories(tempFolder.resolve("plain"));

        assertFalse(FileSystemRepository.isDataset(tempFolder.resolve("plain")));
        assertThrows(
            FileNotFoundException.class,
            () -> new FileSystemRepository(tempFolder.resolve("plain")));
    }

    /**
     * Check that a descriptor without a version is rejected
     */
    @Test
    public void open_incompleteDescriptor() throws Exception {
        Path broken = tempFolder.resolve("broken");
        Files.createDirectories(broken.resolve(".metalad"));
        Files.write(
            broken.resolve(".metalad").resolve("dataset.yaml"),
            ("dataset_id: " + TestDataHarness.ROOT_ID + "\n").getBytes(StandardCharsets.UTF_8));

        assertThrows(IOException.class, () -> new FileSystemRepository(broken));
    }

    /**
     * Check that create updates the version of an existing dataset
     */
    @Test
    public void create_updatesVersion() throws Exception {
        FileSystemRepository.create(tempFolder.resolve("root"), TestDataHarness.ROOT_ID, "r2");

        assertEquals("r2", new FileSystemRepository(tempFolder.resolve("root")).getCurrentVersion());
    }

    @Test
    public void getSubDatasets() throws Exception {
        assertEquals(
            Arrays.asList(MetadataPath.of("d/e")), root.getSubDatasets());

        RepositoryHandle sub = root.openSubDataset(MetadataPath.of("d/e"));
        assertEquals(TestDataHarness.SUB_ID, sub.getDatasetId());
        assertEquals(Arrays.asList(MetadataPath.of("n")), sub.getSubDatasets());

        RepositoryHandle nested = root.openSubDataset(MetadataPath.of("d/e/n"));
        assertEquals(TestDataHarness.NESTED_ID, nested.getDatasetId());
        assertThrows(
            FileNotFoundException.class, () -> root.openSubDataset(MetadataPath.of("a")));
    }

    /**
     * Check that a flat enumeration reports the dataset and its own files only
     */
    @Test
    public void enumerate_flat() {
        List<String> elements = new ArrayList<>();
        root.enumerate(false).forEachRemaining(element -> elements.add(element.toString()));

        assertEquals(Arrays.asList("DATASET:.", "FILE:top.txt", "FILE:a/b/c"), elements);
    }

    @Test
    public void enumerate_recursive() {
        List<DatasetElement> elements = new ArrayList<>();
        root.enumerate(true).forEachRemaining(elements::add);

        List<String> names = new ArrayList<>();
        for (DatasetElement element : elements) {
            names.add(element.toString());
        }
        assertEquals(Arrays.asList(
            "DATASET:.", "FILE:top.txt", "FILE:a/b/c", "DATASET:d/e", "FILE:d/e/f",
            "DATASET:d/e/n", "FILE:d/e/n/g"), names);

        DatasetElement subFile = elements.get(4);
        assertEquals(TestDataHarness.SUB_ID, subFile.getDatasetId());
        assertEquals(MetadataPath.of("d/e"), subFile.getDatasetPath());
        assertEquals(MetadataPath.of("f"), subFile.getLocalPath());
        assertTrue(Files.exists(subFile.getAbsolutePath()));

        DatasetElement nested = elements.get(5);
        assertEquals(ElementType.DATASET, nested.getType());
        assertEquals(TestDataHarness.NESTED_ID, nested.getDatasetId());
        assertTrue(nested.getLocalPath().isRoot());
    }

    /**
     * Check that the iterator is exhausted after the last element
     */
    @Test
    public void enumerate_exhausted() {
        Iterator<DatasetElement> iterator = root.enumerate(false);
        while (iterator.hasNext()) {
            iterator.next();
        }

        assertThrows(java.util.NoSuchElementException.class, iterator::next);
    }
}
