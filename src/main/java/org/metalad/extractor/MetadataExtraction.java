package org.metalad.extractor;

import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.exceptions.ConfigurationException;
import org.metalad.exceptions.ExternalFailureException;
import org.metalad.filestore.FileStoreUtility;
import org.metalad.record.MetadataRecord;
import org.metalad.record.RecordCodec;

/**
 * MetadataExtraction runs a registered extractor on one element and wraps its output into a
 * MetadataRecord tagged with the element's dataset id and current version.
 */
public class MetadataExtraction {
    private static final Log logExtraction = LogFactory.getLog(MetadataExtraction.class);

    private final ExtractorRegistry registry;
    private final String agentName;
    private final String agentEmail;

    public MetadataExtraction(ExtractorRegistry registry, String agentName, String agentEmail) {
        FileStoreUtility.ensureNotNull(registry, "registry", "MetadataExtraction");
        FileStoreUtility.ensureNotNull(agentName, "agentName", "MetadataExtraction");
        FileStoreUtility.checkForEmptyAndValidString(
            agentEmail, "agentEmail", "MetadataExtraction");
        if (agentName.trim().isEmpty()) {
            throw new IllegalArgumentException(
                "Calling Method: MetadataExtraction(): agentName cannot be empty.");
        }
        this.registry = registry;
        this.agentName = agentName;
        this.agentEmail = agentEmail;
    }

    public ExtractorRegistry getRegistry() {
        return registry;
    }

    /**
     * Run an extractor
     *
     * @param extractorName Registered extractor name
     * @param context       Element to extract from
     * @return Record holding the extracted metadata
     * @throws ConfigurationException   When the extractor is unknown or misconfigured
     * @throws FileNotFoundException    When the content the extractor needs is not available
     * @throws ExternalFailureException When the extractor fails
     * @throws IOException              When the extraction cannot be performed
     */
    public MetadataRecord extract(String extractorName, ExtractionContext context)
        throws ConfigurationException, IOException {
        Extractor extractor = registry.create(extractorName, context);
        if (!extractor.ensureContentAvailable()) {
            String errMsg = "MetadataExtraction - content not available for " + extractorName
                + " on " + describe(context);
            logExtraction.warn(errMsg);
            throw new FileNotFoundException(errMsg);
        }

        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        ExtractorResult result = extractor.extract(sink);
        if (!result.isSuccess()) {
            String errMsg = "MetadataExtraction - extractor " + extractorName + " failed on "
                + describe(context) + ": " + result.getStatusFields();
            logExtraction.error(errMsg);
            throw new ExternalFailureException(errMsg, 0);
        }

        JsonNode extracted = result.getImmediateData();
        if (extractor.getOutputMode() == OutputMode.EXTERNAL_FILE) {
            try {
                extracted = RecordCodec.getMapper().readTree(sink.toByteArray());

            } catch (JsonProcessingException jpe) {
                String errMsg = "MetadataExtraction - output of " + extractorName + " on "
                    + describe(context) + " is not valid JSON: " + jpe.getOriginalMessage();
                logExtraction.error(errMsg);
                throw new ExternalFailureException(errMsg, jpe);
            }
        }

        logExtraction.debug(
            "MetadataExtraction.extract - " + extractorName + " extracted " + describe(context));
        return new MetadataRecord.Builder()
            .type(context.getType())
            .datasetId(context.getDataset().getDatasetId())
            .datasetVersion(context.getDataset().getCurrentVersion())
            .path(context.getFilePath())
            .extractorName(extractorName)
            .extractorVersion(result.getExtractorVersion())
            .extractionParameter(result.getExtractionParameter())
            .extractionTime(System.currentTimeMillis() / 1000.0)
            .agentName(agentName)
            .agentEmail(agentEmail)
            .extractedMetadata(extracted)
            .build();
    }

    private static String describe(ExtractionContext context) {
        String dataset = context.getDataset().getDatasetId() + "@"
            + context.getDataset().getCurrentVersion();
        return context.getFilePath() == null ? dataset : dataset + ":" + context.getFilePath();
    }
}
