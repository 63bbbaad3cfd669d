package org.metalad.conduct;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.exceptions.ConfigurationException;
import org.metalad.record.RecordCodec;

/**
 * Description of a pipeline, read from YAML or JSON:
 * <pre>
 * provider:
 *   name: dataset-traversal
 *   arguments: {item_type: both, recursive: true}
 * processors:
 *   - name: extract
 *     arguments: {extractor_type: file, extractor_name: metalad_example_file}
 *   - name: add
 * </pre>
 */
public class PipelineDefinition {
    private static final Log logDefinition = LogFactory.getLog(PipelineDefinition.class);

    /**
     * Name and arguments of one stage
     */
    public static class Stage {
        private final String name;
        private final Map<String, Object> arguments;

        public Stage(String name, Map<String, Object> arguments) {
            this.name = name;
            this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(
                arguments == null ? Collections.emptyMap() : arguments));
        }

        public String getName() {
            return name;
        }

        public Map<String, Object> getArguments() {
            return arguments;
        }

        @Override
        public String toString() {
            return name + arguments;
        }
    }

    private final Stage provider;
    private final List<Stage> processors;

    public PipelineDefinition(Stage provider, List<Stage> processors) {
        this.provider = provider;
        this.processors = List.copyOf(processors);
    }

    public Stage getProvider() {
        return provider;
    }

    public List<Stage> getProcessors() {
        return processors;
    }

    /**
     * @param file YAML or JSON pipeline description
     * @throws ConfigurationException When the file cannot be read or is not a valid description
     */
    public static PipelineDefinition load(Path file) throws ConfigurationException {
        Map<String, Object> content;
        try {
            ObjectMapper om = new ObjectMapper(new YAMLFactory());
            content = om.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {
            });

        } catch (IOException ioe) {
            String errMsg = "Unable to read pipeline definition " + file + ": " + ioe.getMessage();
            logDefinition.error(errMsg);
            throw new ConfigurationException(errMsg, ioe);
        }
        return fromMap(content);
    }

    public static PipelineDefinition parse(String text) throws ConfigurationException {
        Map<String, Object> content;
        try {
            ObjectMapper om = new ObjectMapper(new YAMLFactory());
            content = om.readValue(text, new TypeReference<Map<String, Object>>() {
            });

        } catch (IOException ioe) {
            String errMsg = "Invalid pipeline definition: " + ioe.getMessage();
            logDefinition.error(errMsg);
            throw new ConfigurationException(errMsg, ioe);
        }
        return fromMap(content);
    }

    static PipelineDefinition fromMap(Map<String, Object> content)
        throws ConfigurationException {
        if (content == null || !(content.get("provider") instanceof Map)) {
            throw invalid("'provider' mapping is required");
        }
        Stage provider = toStage(content.get("provider"), "provider");

        List<Stage> processors = new ArrayList<>();
        Object processorList = content.get("processors");
        if (processorList != null) {
            if (!(processorList instanceof List)) {
                throw invalid("'processors' must be a list");
            }
            int position = 0;
            for (Object processor : (List<?>) processorList) {
                processors.add(toStage(processor, "processors[" + position++ + "]"));
            }
        }
        return new PipelineDefinition(provider, processors);
    }

    private static Stage toStage(Object value, String where) throws ConfigurationException {
        if (!(value instanceof Map)) {
            throw invalid(where + " must be a mapping with 'name' and 'arguments'");
        }
        Map<?, ?> stage = (Map<?, ?>) value;
        Object name = stage.get("name");
        if (!(name instanceof String) || ((String) name).isBlank()) {
            throw invalid(where + ".name is required");
        }
        Object arguments = stage.get("arguments");
        if (arguments != null && !(arguments instanceof Map)) {
            throw invalid(where + ".arguments must be a mapping");
        }
        return new Stage(
            (String) name,
            arguments == null ? null : RecordCodec.toStringKeyMap((Map<?, ?>) arguments));
    }

    private static ConfigurationException invalid(String detail) {
        String errMsg = "Invalid pipeline definition: " + detail;
        logDefinition.error(errMsg);
        return new ConfigurationException(errMsg);
    }
}
