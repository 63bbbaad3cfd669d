package org.metalad.extractor;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.exceptions.ConfigurationException;
import org.metalad.exceptions.ExternalFailureException;
import org.metalad.record.RecordCodec;
import org.metalad.record.RecordType;

/**
 * ExternalExtractor delegates extraction to an external command. The command is asked for the
 * values it does not get as parameters (`--get-uuid`, `--get-version`,
 * `--get-data-output-category`, `--is-content-required` or `--get-required`) and is finally
 * invoked with `--extract`. A dataset extraction passes the dataset path and version, a file
 * extraction additionally the absolute and the dataset relative path of the file.
 *
 * <p>Every invocation is bounded by the `timeout` parameter (seconds). A command that exceeds it
 * is asked to terminate and killed after a grace period.
 */
public class ExternalExtractor implements Extractor {
    private static final Log logExternal = LogFactory.getLog(ExternalExtractor.class);

    public static final String DATASET_NAME = "external_dataset";
    public static final String FILE_NAME = "external_file";

    public static final String PARAM_COMMAND = "command";
    public static final String PARAM_ARGUMENTS = "arguments";
    public static final String PARAM_VERSION = "version";
    public static final String PARAM_EXTRACTOR_ID = "extractor-id";
    public static final String PARAM_OUTPUT_CATEGORY = "data-output-category";
    public static final String PARAM_CONTENT_REQUIRED = "content-required";
    public static final String PARAM_TIMEOUT = "timeout";

    public static final long DEFAULT_TIMEOUT_SECONDS = 300;
    public static final long GRACE_PERIOD_SECONDS = 5;

    private final RecordType type;
    private final ExtractionContext context;
    private final List<String> command;
    private final List<String> arguments;
    private final long timeoutSeconds;

    private String version;
    private UUID extractorId;
    private OutputMode outputMode;
    private Boolean contentRequired;

    /**
     * @param type    DATASET or FILE extraction
     * @param context Element to extract from
     * @throws ConfigurationException When `command` is missing or a parameter is invalid
     */
    public ExternalExtractor(RecordType type, ExtractionContext context)
        throws ConfigurationException {
        this.type = type;
        this.context = context;
        Map<String, Object> parameters = context.getParameters();

        this.command = toStringList(parameters.get(PARAM_COMMAND), PARAM_COMMAND);
        if (command.isEmpty()) {
            String errMsg = "ExternalExtractor - parameter '" + PARAM_COMMAND + "' is required";
            logExternal.error(errMsg);
            throw new ConfigurationException(errMsg);
        }
        this.arguments = toStringList(parameters.get(PARAM_ARGUMENTS), PARAM_ARGUMENTS);
        this.timeoutSeconds = parseTimeout(parameters.get(PARAM_TIMEOUT));

        Object versionParam = parameters.get(PARAM_VERSION);
        this.version = versionParam == null ? null : versionParam.toString();
        Object idParam = parameters.get(PARAM_EXTRACTOR_ID);
        if (idParam != null) {
            try {
                this.extractorId = UUID.fromString(idParam.toString());

            } catch (IllegalArgumentException iae) {
                String errMsg = "ExternalExtractor - invalid " + PARAM_EXTRACTOR_ID + ": "
                    + idParam;
                logExternal.error(errMsg);
                throw new ConfigurationException(errMsg, iae);
            }
        }
        Object categoryParam = parameters.get(PARAM_OUTPUT_CATEGORY);
        if (categoryParam != null) {
            this.outputMode = toOutputMode(categoryParam.toString());
            if (outputMode == null) {
                String errMsg = "ExternalExtractor - unsupported " + PARAM_OUTPUT_CATEGORY + ": "
                    + categoryParam;
                logExternal.error(errMsg);
                throw new ConfigurationException(errMsg);
            }
        }
        Object requiredParam = parameters.get(PARAM_CONTENT_REQUIRED);
        if (requiredParam != null) {
            this.contentRequired = Boolean.parseBoolean(requiredParam.toString());
        }
    }

    @Override
    public UUID getId() throws IOException {
        if (extractorId == null) {
            String output = runForOutput(Collections.singletonList("--get-uuid"));
            try {
                extractorId = UUID.fromString(output);

            } catch (IllegalArgumentException iae) {
                String errMsg = "ExternalExtractor - command returned an invalid uuid: " + output;
                logExternal.error(errMsg);
                throw new ExternalFailureException(errMsg, iae);
            }
        }
        return extractorId;
    }

    @Override
    public String getVersion() throws IOException {
        if (version == null) {
            version = runForOutput(Collections.singletonList("--get-version"));
        }
        return version;
    }

    @Override
    public RecordType getType() {
        return type;
    }

    @Override
    public OutputMode getOutputMode() throws IOException {
        if (outputMode == null) {
            String output = runForOutput(Collections.singletonList("--get-data-output-category"));
            OutputMode mode = toOutputMode(output);
            if (mode == null) {
                String errMsg = "ExternalExtractor - unsupported data output category: " + output;
                logExternal.error(errMsg);
                throw new ExternalFailureException(errMsg, 0);
            }
            outputMode = mode;
        }
        return outputMode;
    }

    /**
     * Dataset extractors are asked to `--get-required` content, which makes the command fetch
     * what it needs. File extractors declare with `--is-content-required` whether the file
     * content has to be present.
     */
    @Override
    public boolean ensureContentAvailable() throws IOException {
        if (type == RecordType.DATASET) {
            if (Boolean.FALSE.equals(contentRequired)) {
                return true;
            }
            List<String> args = new ArrayList<>();
            args.add("--get-required");
            args.addAll(elementArguments());
            runForOutput(args);
            return true;
        }

        if (contentRequired == null) {
            String output = runForOutput(Collections.singletonList("--is-content-required"));
            if (output.equalsIgnoreCase("true")) {
                contentRequired = true;
            } else if (output.equalsIgnoreCase("false")) {
                contentRequired = false;
            } else {
                String errMsg = "ExternalExtractor - expected True or False from"
                    + " --is-content-required, got: " + output;
                logExternal.error(errMsg);
                throw new ExternalFailureException(errMsg, 0);
            }
        }
        return !contentRequired || Files.exists(context.getAbsoluteFilePath());
    }

    @Override
    public ExtractorResult extract(OutputStream sink) throws IOException {
        List<String> args = new ArrayList<>();
        args.add("--extract");
        args.addAll(elementArguments());

        Path stdout = Files.createTempFile("external-extract-", ".out");
        try {
            run(args, stdout);
            JsonNode immediateData = null;
            if (getOutputMode() == OutputMode.IMMEDIATE) {
                String output = Files.readString(stdout, StandardCharsets.UTF_8).trim();
                try {
                    immediateData = RecordCodec.getMapper().readTree(output);

                } catch (JsonProcessingException jpe) {
                    String errMsg = "ExternalExtractor - output of " + command
                        + " is not valid JSON: " + jpe.getOriginalMessage();
                    logExternal.error(errMsg);
                    throw new ExternalFailureException(errMsg, jpe);
                }
            } else {
                Files.copy(stdout, sink);
            }

            Map<String, Object> status = new LinkedHashMap<>();
            status.put("type", type.getName());
            status.put("status", "ok");
            return new ExtractorResult(
                getVersion(), context.getParameters(), true, status, immediateData);

        } finally {
            Files.deleteIfExists(stdout);
        }
    }

    private List<String> elementArguments() {
        List<String> args = new ArrayList<>();
        args.add(context.getDataset().getPath().toString());
        args.add(context.getDataset().getCurrentVersion());
        if (type == RecordType.FILE) {
            args.add(context.getAbsoluteFilePath().toString());
            args.add(context.getFilePath().toString());
        }
        return args;
    }

    private String runForOutput(List<String> args) throws IOException {
        Path stdout = Files.createTempFile("external-query-", ".out");
        try {
            run(args, stdout);
            return Files.readString(stdout, StandardCharsets.UTF_8).trim();

        } finally {
            Files.deleteIfExists(stdout);
        }
    }

    /**
     * Run the command with its configured arguments followed by `args`, stdout goes to a file
     */
    private void run(List<String> args, Path stdout) throws IOException {
        List<String> commandLine = new ArrayList<>(command);
        commandLine.addAll(arguments);
        commandLine.addAll(args);

        Path stderr = Files.createTempFile("external-", ".err");
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(commandLine)
                .directory(context.getDataset().getPath().toFile())
                .redirectOutput(stdout.toFile())
                .redirectError(stderr.toFile());
            logExternal.debug("ExternalExtractor.run - executing: " + commandLine);

            Process process;
            try {
                process = processBuilder.start();

            } catch (IOException ioe) {
                String errMsg = "ExternalExtractor - cannot start " + commandLine + ": "
                    + ioe.getMessage();
                logExternal.error(errMsg);
                throw new ExternalFailureException(errMsg, ioe);
            }

            boolean finished;
            try {
                finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);

            } catch (InterruptedException ie) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                String errMsg = "ExternalExtractor - interrupted while waiting for "
                    + commandLine;
                logExternal.warn(errMsg);
                throw new ExternalFailureException(errMsg, ie);
            }

            if (!finished) {
                terminate(process);
                String errMsg = "ExternalExtractor - " + commandLine + " timed out after "
                    + timeoutSeconds + " seconds";
                logExternal.error(errMsg);
                throw new ExternalFailureException(errMsg, -1);
            }

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                String errMsg = "ExternalExtractor - " + commandLine + " exited with " + exitCode
                    + ": " + Files.readString(stderr, StandardCharsets.UTF_8).trim();
                logExternal.error(errMsg);
                throw new ExternalFailureException(errMsg, exitCode);
            }

        } finally {
            Files.deleteIfExists(stderr);
        }
    }

    private static void terminate(Process process) {
        process.destroy();
        try {
            if (!process.waitFor(GRACE_PERIOD_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }

        } catch (InterruptedException ie) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    private static OutputMode toOutputMode(String category) {
        switch (category.trim().toUpperCase()) {
            case "IMMEDIATE":
                return OutputMode.IMMEDIATE;
            case "FILE":
                return OutputMode.EXTERNAL_FILE;
            default:
                return null;
        }
    }

    private static long parseTimeout(Object value) throws ConfigurationException {
        if (value == null) {
            return DEFAULT_TIMEOUT_SECONDS;
        }
        String errMsg = "ExternalExtractor - " + PARAM_TIMEOUT + " must be a positive number of"
            + " seconds: " + value;
        long timeout;
        try {
            timeout = Long.parseLong(value.toString().trim());

        } catch (NumberFormatException nfe) {
            logExternal.error(errMsg);
            throw new ConfigurationException(errMsg, nfe);
        }
        if (timeout <= 0) {
            logExternal.error(errMsg);
            throw new ConfigurationException(errMsg);
        }
        return timeout;
    }

    private static List<String> toStringList(Object value, String name)
        throws ConfigurationException {
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (value instanceof String) {
            result.add((String) value);
        } else if (value instanceof List) {
            for (Object element : (List<?>) value) {
                result.add(String.valueOf(element));
            }
        } else {
            String errMsg = "ExternalExtractor - parameter '" + name
                + "' must be a string or a list of strings";
            logExternal.error(errMsg);
            throw new ConfigurationException(errMsg);
        }
        return result;
    }
}
