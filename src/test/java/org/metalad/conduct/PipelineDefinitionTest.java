package org.metalad.conduct;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.metalad.exceptions.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Test class for PipelineDefinition
 */
public class PipelineDefinitionTest {
    private static final String YAML = "provider:\n"
        + "  name: dataset-traversal\n"
        + "  arguments: {item_type: both, recursive: true}\n"
        + "processors:\n"
        + "  - name: extract\n"
        + "    arguments:\n"
        + "      extractor_type: file\n"
        + "      extractor_name: metalad_example_file\n"
        + "  - name: add\n";

    @TempDir
    public Path tempFolder;

    @Test
    public void parse_yaml() throws Exception {
        PipelineDefinition definition = PipelineDefinition.parse(YAML);

        assertEquals("dataset-traversal", definition.getProvider().getName());
        assertEquals(true, definition.getProvider().getArguments().get("recursive"));
        assertEquals(2, definition.getProcessors().size());
        assertEquals(
            "metalad_example_file",
            definition.getProcessors().get(0).getArguments().get("extractor_name"));
        assertEquals("add", definition.getProcessors().get(1).getName());
        assertTrue(definition.getProcessors().get(1).getArguments().isEmpty());
    }

    @Test
    public void parse_json() throws Exception {
        PipelineDefinition definition = PipelineDefinition.parse(
            "{\"provider\": {\"name\": \"dataset-traversal\","
                + " \"arguments\": {\"item_type\": \"file\"}}}");

        assertEquals("file", definition.getProvider().getArguments().get("item_type"));
        assertTrue(definition.getProcessors().isEmpty());
    }

    @Test
    public void load() throws Exception {
        Path file = tempFolder.resolve("pipeline.yaml");
        Files.write(file, YAML.getBytes(StandardCharsets.UTF_8));

        PipelineDefinition definition = PipelineDefinition.load(file);

        assertEquals(2, definition.getProcessors().size());
        assertThrows(
            ConfigurationException.class,
            () -> PipelineDefinition.load(tempFolder.resolve("missing.yaml")));
    }

    /**
     * Check that malformed descriptions are rejected
     */
    @Test
    public void parse_invalid() {
        assertThrows(ConfigurationException.class, () -> PipelineDefinition.parse("[1, 2]"));
        assertThrows(
            ConfigurationException.class, () -> PipelineDefinition.parse("processors: []"));
        assertThrows(
            ConfigurationException.class,
            () -> PipelineDefinition.parse("provider: {arguments: {}}"));
        assertThrows(
            ConfigurationException.class,
            () -> PipelineDefinition.parse("provider: {name: p, arguments: [1]}"));
        assertThrows(
            ConfigurationException.class,
            () -> PipelineDefinition.parse("provider: {name: p}\nprocessors: {name: add}"));
        assertThrows(
            ConfigurationException.class,
            () -> PipelineDefinition.parse("provider: {name: p}\nprocessors: [add]"));
        assertThrows(
            ConfigurationException.class,
            () -> PipelineDefinition.parse("provider: {name: '  '}"));
    }
}
