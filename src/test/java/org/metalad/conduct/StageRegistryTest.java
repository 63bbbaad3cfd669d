package org.metalad.conduct;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.metalad.MetadataStore;
import org.metalad.dataset.FileSystemRepository;
import org.metalad.exceptions.ConfigurationException;
import org.metalad.extractor.ExternalExtractor;
import org.metalad.extractor.ExtractorRegistry;
import org.metalad.extractor.MetadataExtraction;
import org.metalad.index.Containment;
import org.metalad.index.VersionIndex;
import org.metalad.record.MetadataPath;
import org.metalad.record.MetadataRecord;
import org.metalad.testdata.TestDataHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Test class for StageRegistry, including complete pipeline runs over a dataset tree
 */
public class StageRegistryTest {
    private static final TestDataHarness testData = new TestDataHarness();
    private static final String TRAVERSE_EXTRACT_ADD = "provider:\n"
        + "  name: dataset-traversal\n"
        + "  arguments: {item_type: both, recursive: true}\n"
        + "processors:\n"
        + "  - name: extract\n"
        + "    arguments: {extractor_type: file, extractor_name: metalad_example_file}\n"
        + "  - name: add\n"
        + "    arguments: {aggregate: %s}\n";

    private FileSystemRepository root;
    private FileSystemRepository sub;
    private StageContext context;
    private StageRegistry registry;

    @TempDir
    public Path tempFolder;

    @BeforeEach
    public void initializeStages() throws Exception {
        Path rootPath = tempFolder.resolve("root");
        root = testData.createDataset(rootPath, TestDataHarness.ROOT_ID, "r1", "a.txt");
        sub = testData.createDataset(
            rootPath.resolve("d").resolve("e"), TestDataHarness.SUB_ID, "s1", "f");
        context = new StageContext(
            root, new MetadataExtraction(
                ExtractorRegistry.withBuiltins(), "Test Agent", "agent@example.org"));
        registry = StageRegistry.withBuiltins();
    }

    private RunSummary run(String definition, int jobs) throws Exception {
        return registry.createConductor(PipelineDefinition.parse(definition), context, jobs)
            .run();
    }

    private static List<String> labels(RunSummary summary) {
        List<String> labels = new ArrayList<>();
        for (ItemResult result : summary.getResults()) {
            labels.add(result.getLabel());
        }
        return labels;
    }

    @Test
    public void withBuiltins() {
        assertEquals(
            Collections.singleton(DatasetTraverser.NAME), registry.getProviderNames());
        assertTrue(registry.getProcessorNames().contains(ExtractProcessor.NAME));
        assertTrue(registry.getProcessorNames().contains(AddProcessor.NAME));
    }

    /**
     * Check that file metadata is extracted and added to the store of the owning dataset
     */
    @Test
    public void run_extractAndAdd() throws Exception {
        RunSummary summary = run(String.format(TRAVERSE_EXTRACT_ADD, "false"), 2);

        assertEquals(RunState.COMPLETED, summary.getState());
        assertEquals(
            Arrays.asList("DATASET:.", "FILE:a.txt", "DATASET:d/e", "FILE:d/e/f"),
            labels(summary));
        assertEquals(2, summary.getCount(Outcome.OK));
        assertEquals(2, summary.getCount(Outcome.NOTNEEDED));
        assertEquals(0, summary.getExitCode());

        ItemResult fileResult = summary.getResults().get(1);
        assertEquals(1, fileResult.getAddedRefs().size());
        MetadataStore rootStore = MetadataStore.open(root.getStorePath());
        VersionIndex rootIndex = rootStore.getIndexManager().get(TestDataHarness.ROOT_ID, "r1");
        assertEquals(
            fileResult.getAddedRefs().get(0),
            rootIndex.getFileTree().get(MetadataPath.of("a.txt")));
        assertTrue(rootIndex.getDatasetTree().isEmpty());

        MetadataStore subStore = MetadataStore.open(sub.getStorePath());
        VersionIndex subIndex = subStore.getIndexManager().get(TestDataHarness.SUB_ID, "s1");
        MetadataRecord record = subStore.getRecord(
            subIndex.getFileTree().get(MetadataPath.of("f")));
        assertEquals(MetadataPath.of("f"), record.getPath());
        assertFalse(record.hasProvenance());
    }

    /**
     * Check that with aggregation sub-dataset metadata goes to the root store with provenance
     */
    @Test
    public void run_extractAndAddAggregated() throws Exception {
        RunSummary summary = run(String.format(TRAVERSE_EXTRACT_ADD, "true"), 1);

        assertEquals(2, summary.getCount(Outcome.OK));
        MetadataStore rootStore = MetadataStore.open(root.getStorePath());
        VersionIndex rootIndex = rootStore.getIndexManager().get(TestDataHarness.ROOT_ID, "r1");
        MetadataRecord record = rootStore.getRecord(
            rootIndex.getFileTree().get(MetadataPath.of("d/e/f")));
        assertTrue(record.hasProvenance());
        assertEquals(MetadataPath.of("d/e"), record.getDatasetPath());
        assertEquals(
            new Containment(TestDataHarness.ROOT_ID, "r1", MetadataPath.of("d/e")),
            rootStore.getIndexManager().get(TestDataHarness.SUB_ID, "s1").getContainment());
        assertFalse(
            MetadataStore.open(sub.getStorePath()).getIndexManager()
                .contains(TestDataHarness.SUB_ID, "s1"));
    }

    /**
     * Check that a dataset extractor only runs on dataset items of a flat traversal
     */
    @Test
    public void run_datasetExtractor() throws Exception {
        RunSummary summary = run(
            "provider: {name: dataset-traversal, arguments: {item_type: dataset}}\n"
                + "processors:\n"
                + "  - {name: extract, arguments: {extractor_type: dataset,"
                + " extractor_name: metalad_example_dataset}}\n"
                + "  - {name: add}\n", 1);

        assertEquals(Collections.singletonList("DATASET:."), labels(summary));
        assertEquals(Outcome.OK, summary.getResults().get(0).getOutcome());
        VersionIndex rootIndex = MetadataStore.open(root.getStorePath()).getIndexManager()
            .get(TestDataHarness.ROOT_ID, "r1");
        assertEquals(
            summary.getResults().get(0).getAddedRefs().get(0), rootIndex.getDatasetLevelRef());
    }

    /**
     * Check that an external extractor failing on some files turns those items into errors while
     * the other items are extracted and added
     */
    @Test
    public void run_externalExtractorPartialFailure() throws Exception {
        assumeTrue(Files.isExecutable(Paths.get("/bin/sh")));
        for (String file : Arrays.asList("bad-1.txt", "bad-2.txt", "c.txt")) {
            Files.write(root.getPath().resolve(file), file.getBytes(StandardCharsets.UTF_8));
        }
        String script = "case \"$5\" in\n"
            + "  bad*) echo \"cannot read $5\" >&2; exit 3 ;;\n"
            + "  *) printf '{\"file\": \"%s\"}' \"$5\" ;;\n"
            + "esac\n";
        Map<String, Object> extractorArguments = new LinkedHashMap<>();
        extractorArguments.put(
            ExternalExtractor.PARAM_COMMAND, Arrays.asList("/bin/sh", "-c", script, "extractor"));
        extractorArguments.put(ExternalExtractor.PARAM_VERSION, "1.0");
        extractorArguments.put(
            ExternalExtractor.PARAM_EXTRACTOR_ID, "11111111-2222-3333-4444-555555555555");
        extractorArguments.put(ExternalExtractor.PARAM_OUTPUT_CATEGORY, "IMMEDIATE");
        extractorArguments.put(ExternalExtractor.PARAM_CONTENT_REQUIRED, "false");

        Map<String, Object> extract = new LinkedHashMap<>();
        extract.put("name", ExtractProcessor.NAME);
        Map<String, Object> extractArguments = new LinkedHashMap<>();
        extractArguments.put("extractor_type", "file");
        extractArguments.put("extractor_name", ExternalExtractor.FILE_NAME);
        extractArguments.put("extractor_arguments", extractorArguments);
        extract.put("arguments", extractArguments);
        Map<String, Object> provider = new LinkedHashMap<>();
        provider.put("name", DatasetTraverser.NAME);
        provider.put("arguments", Collections.singletonMap("item_type", "file"));
        Map<String, Object> definition = new LinkedHashMap<>();
        definition.put("provider", provider);
        definition.put(
            "processors", Arrays.asList(extract, Collections.singletonMap("name", "add")));

        RunSummary summary = run(new ObjectMapper().writeValueAsString(definition), 2);

        assertEquals(RunState.COMPLETED, summary.getState());
        assertEquals(
            Arrays.asList("FILE:a.txt", "FILE:bad-1.txt", "FILE:bad-2.txt", "FILE:c.txt"),
            labels(summary));
        assertEquals(2, summary.getCount(Outcome.OK));
        assertEquals(2, summary.getCount(Outcome.ERROR));
        assertFalse(summary.isTotalFailure());
        assertEquals(0, summary.getExitCode());
        for (ItemResult result : summary.getResults()) {
            if (result.getLabel().contains("bad")) {
                assertEquals(Outcome.ERROR, result.getOutcome());
                assertTrue(result.getMessage().startsWith(ExtractProcessor.NAME + ": "));
                assertTrue(result.getAddedRefs().isEmpty());
            } else {
                assertEquals(Outcome.OK, result.getOutcome());
                assertEquals(1, result.getAddedRefs().size());
            }
        }

        VersionIndex rootIndex = MetadataStore.open(root.getStorePath()).getIndexManager()
            .get(TestDataHarness.ROOT_ID, "r1");
        assertEquals(2, rootIndex.getFileTree().size());
        assertTrue(rootIndex.getFileTree().containsKey(MetadataPath.of("c.txt")));
    }

    /**
     * Check that add without extracted records is not needed
     */
    @Test
    public void run_addWithoutRecords() throws Exception {
        RunSummary summary = run(
            "provider: {name: dataset-traversal, arguments: {item_type: file}}\n"
                + "processors: [{name: add}]\n", 1);

        assertEquals(Collections.singletonList("FILE:a.txt"), labels(summary));
        assertEquals(1, summary.getCount(Outcome.NOTNEEDED));
    }

    @Test
    public void createConductor_unknownStages() {
        assertThrows(
            ConfigurationException.class,
            () -> run("provider: {name: nothing}\n", 1));
        assertThrows(
            ConfigurationException.class,
            () -> run(
                "provider: {name: dataset-traversal, arguments: {item_type: file}}\n"
                    + "processors: [{name: index}]\n", 1));
    }

    /**
     * Check that stage arguments are validated before the run starts
     */
    @Test
    public void createConductor_invalidArguments() {
        assertThrows(
            ConfigurationException.class,
            () -> run("provider: {name: dataset-traversal}\n", 1));
        assertThrows(
            ConfigurationException.class,
            () -> run(
                "provider: {name: dataset-traversal, arguments: {item_type: all}}\n", 1));
        assertThrows(
            ConfigurationException.class,
            () -> run(
                "provider: {name: dataset-traversal,"
                    + " arguments: {item_type: file, depth: 2}}\n", 1));
        assertThrows(
            ConfigurationException.class,
            () -> run(
                "provider: {name: dataset-traversal,"
                    + " arguments: {item_type: file, recursive: maybe}}\n", 1));
        assertThrows(
            ConfigurationException.class,
            () -> run(
                "provider: {name: dataset-traversal, arguments: {item_type: file}}\n"
                    + "processors: [{name: extract, arguments: {extractor_type: dataset,"
                    + " extractor_name: metalad_example_file}}]\n", 1));
        assertThrows(
            ConfigurationException.class,
            () -> run(
                "provider: {name: dataset-traversal, arguments: {item_type: file}}\n"
                    + "processors: [{name: extract, arguments: {extractor_type: file,"
                    + " extractor_name: no_such_extractor}}]\n", 1));
        assertThrows(
            ConfigurationException.class,
            () -> run("provider: {name: dataset-traversal, arguments: {item_type: file}}\n", 0));
    }

    /**
     * Check that custom stages can be registered
     */
    @Test
    public void registerProcessor() throws Exception {
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        registry.registerProcessor("collect", (arguments, stageContext) -> new Processor() {
            @Override
            public String getName() {
                return "collect";
            }

            @Override
            public void process(PipelineData data) {
                seen.add(data.getElement().getPath().toString());
            }
        });

        RunSummary summary = run(
            "provider: {name: dataset-traversal, arguments: {item_type: file, recursive: true}}\n"
                + "processors: [{name: collect}]\n", 1);

        assertEquals(2, summary.getCount(Outcome.OK));
        assertEquals(Arrays.asList("a.txt", "d/e/f"), seen);
    }
}
