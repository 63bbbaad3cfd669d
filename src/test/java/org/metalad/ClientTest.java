package org.metalad;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.metalad.add.MetadataAdder;
import org.metalad.dataset.FileSystemRepository;
import org.metalad.record.RecordCodec;
import org.metalad.testdata.TestDataHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Test class for the command line Client
 */
public class ClientTest {
    private static final TestDataHarness testData = new TestDataHarness();
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private Path rootPath;

    @TempDir
    public Path tempFolder;

    @BeforeEach
    public void initializeStreams() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        rootPath = tempFolder.resolve("root");
    }

    private int run(InputStream in, String... args) {
        Client client = new Client(
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8), in);
        return client.run(args);
    }

    private int run(String... args) {
        return run(new ByteArrayInputStream(new byte[0]), args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private List<String> stdoutLines() {
        return Arrays.asList(stdout().trim().split("\n"));
    }

    private void initRoot() {
        assertEquals(
            0, run("-dataset", rootPath.toString(), "-init", "-id",
                   TestDataHarness.ROOT_ID.toString(), "-version", "r1"));
        out.reset();
    }

    @Test
    public void help() {
        assertEquals(0, run("-h"));
        assertTrue(stdout().contains("-dataset"));
    }

    /**
     * Check the exit codes of invalid invocations
     */
    @Test
    public void invalidInvocations() {
        assertEquals(2, run("-nosuchoption"));
        assertTrue(stderr().contains("Error parsing cli arguments"));

        assertEquals(1, run("-dump"));
        assertTrue(stderr().contains("dataset path must be supplied"));

        initRoot();
        assertEquals(2, run("-dataset", rootPath.toString()));

        assertEquals(1, run("-dataset", tempFolder.resolve("absent").toString(), "-dump"));
    }

    @Test
    public void init() throws Exception {
        initRoot();

        FileSystemRepository dataset = new FileSystemRepository(rootPath);
        assertEquals(TestDataHarness.ROOT_ID, dataset.getDatasetId());
        assertEquals("r1", dataset.getCurrentVersion());
        assertTrue(Files.exists(dataset.getStorePath().resolve("objectstore.yaml")));
    }

    @Test
    public void extract() throws Exception {
        initRoot();
        Files.write(rootPath.resolve("a.txt"), "abc".getBytes(StandardCharsets.UTF_8));

        int exitCode = run(
            "-dataset", rootPath.toString(), "-extract", "-extractor", "metalad_example_file",
            "-path", "a.txt", "-agentname", "Test Agent", "-agentemail", "agent@example.org");

        assertEquals(0, exitCode, stderr());
        Object extracted = RecordCodec.readMap(stdout().trim()).get("extracted_metadata");
        assertTrue(extracted.toString().contains("content_byte_size=3"));
        assertTrue(stdout().contains("\"agent_name\":\"Test Agent\""));
    }

    /**
     * Check that a default agent email is derived from an agent name with spaces
     */
    @Test
    public void extract_defaultAgentEmail() throws Exception {
        initRoot();

        int exitCode = run(
            "-dataset", rootPath.toString(), "-extract", "-extractor",
            "metalad_example_dataset", "-agentname", "Test Agent");

        assertEquals(0, exitCode, stderr());
        assertTrue(stdout().contains("\"agent_email\":\"Test.Agent@localhost\""));
    }

    @Test
    public void extract_unknownExtractor() {
        initRoot();

        assertEquals(
            1, run("-dataset", rootPath.toString(), "-extract", "-extractor", "nothing"));
        assertTrue(stderr().contains("unknown extractor"));
    }

    /**
     * Check that records read from stdin are added and can be dumped
     */
    @Test
    public void add_dump() throws Exception {
        initRoot();
        String input = RecordCodec.toJson(testData.datasetRecord(TestDataHarness.ROOT_ID, "r1"))
            + "\n\n"
            + RecordCodec.toJson(testData.fileRecord(TestDataHarness.ROOT_ID, "r1", "a/b"))
            + "\n";

        int exitCode = run(
            new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
            "-dataset", rootPath.toString(), "-add");

        assertEquals(0, exitCode, stderr());
        assertEquals(2, stdoutLines().size());
        assertTrue(stdoutLines().get(0).startsWith("added "));

        out.reset();
        assertEquals(0, run("-dataset", rootPath.toString(), "-dump", "-url", ":a/b"));
        assertEquals(2, stdoutLines().size());
        assertEquals(
            testData.fileRecord(TestDataHarness.ROOT_ID, "r1", "a/b"),
            RecordCodec.fromJson(stdoutLines().get(1)));

        out.reset();
        assertEquals(0, run("-dataset", rootPath.toString(), "-dump", "-url", ":*", "-flat"));
        assertTrue(stdout().contains("\"test_extractor.keywords[1]\":\"a/b\""));
    }

    @Test
    public void add_fromFileWithAdditionalValues() throws Exception {
        initRoot();
        String line = RecordCodec.getMapper().writeValueAsString(
            testData.recordMap("dataset", TestDataHarness.ROOT_ID, "r1", null));
        Path input = tempFolder.resolve("records.jsonl");
        Files.write(input, (line + "\n").getBytes(StandardCharsets.UTF_8));

        assertEquals(
            1, run("-dataset", rootPath.toString(), "-add", "-input", input.toString(),
                   "-additional", "{\"agent_name\": \"Other\"}"));
        assertTrue(stderr().contains("Line 1"));

        assertEquals(
            0, run("-dataset", rootPath.toString(), "-add", "-input", input.toString(),
                   "-additional", "{\"agent_name\": \"Other\"}", "-allowoverride"),
            stderr());
    }

    /**
     * Check that a record of another dataset is rejected unless mismatches are allowed
     */
    @Test
    public void add_idMismatch() throws Exception {
        initRoot();
        byte[] input = RecordCodec.toBytes(testData.datasetRecord(TestDataHarness.SUB_ID, "s1"));

        assertEquals(
            1, run(new ByteArrayInputStream(input), "-dataset", rootPath.toString(), "-add"));
        assertTrue(stderr().contains("does not match ID of destination dataset"));

        assertEquals(
            0, run(
                new ByteArrayInputStream(input), "-dataset", rootPath.toString(), "-add",
                "-allowidmismatch"));
    }

    @Test
    public void aggregate() throws Exception {
        initRoot();
        Path subPath = rootPath.resolve("sub");
        FileSystemRepository sub = testData.createDataset(
            subPath, TestDataHarness.SUB_ID, "s1", "f");
        new MetadataAdder(MetadataStore.open(sub.getStorePath()), TestDataHarness.SUB_ID)
            .add(testData.fileRecord(TestDataHarness.SUB_ID, "s1", "f"), false);

        assertEquals(0, run("-dataset", rootPath.toString(), "-aggregate"), stderr());
        assertTrue(stdout().contains("sub, OK"));

        out.reset();
        assertEquals(0, run("-dataset", rootPath.toString(), "-dump", "-url", "", "-recursive"));
        assertEquals(1, stdoutLines().size());
        assertTrue(stdoutLines().get(0).contains("\"dataset_path\":\"sub\""));

        out.reset();
        assertEquals(
            1, run("-dataset", rootPath.toString(), "-aggregate", "-subpath", "missing"));
    }

    @Test
    public void conduct() throws Exception {
        initRoot();
        Files.write(rootPath.resolve("a.txt"), "abc".getBytes(StandardCharsets.UTF_8));
        Path pipeline = tempFolder.resolve("pipeline.yaml");
        Files.write(
            pipeline, ("provider: {name: dataset-traversal, arguments: {item_type: file}}\n"
                + "processors:\n"
                + "  - {name: extract, arguments: {extractor_type: file,"
                + " extractor_name: metalad_example_file}}\n"
                + "  - {name: add}\n").getBytes(StandardCharsets.UTF_8));

        int exitCode = run(
            "-dataset", rootPath.toString(), "-conduct", pipeline.toString(), "-jobs", "2",
            "-agentname", "Test Agent", "-agentemail", "agent@example.org");

        assertEquals(0, exitCode, stderr());
        assertEquals("ok FILE:a.txt", stdoutLines().get(0));
        assertTrue(stdoutLines().get(1).startsWith("COMPLETED"));
    }

    /**
     * Check that an invalid pipeline is reported as a failed run
     */
    @Test
    public void conduct_invalidPipeline() throws Exception {
        initRoot();
        Path pipeline = tempFolder.resolve("pipeline.yaml");
        Files.write(pipeline, "provider: {name: nothing}\n".getBytes(StandardCharsets.UTF_8));

        assertEquals(1, run("-dataset", rootPath.toString(), "-conduct", pipeline.toString()));
        assertTrue(stdout().startsWith("FAILED"));
    }
}
