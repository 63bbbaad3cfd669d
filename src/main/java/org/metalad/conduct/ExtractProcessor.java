package org.metalad.conduct;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.dataset.DatasetElement;
import org.metalad.dataset.ElementType;
import org.metalad.exceptions.ConfigurationException;
import org.metalad.extractor.ExtractionContext;
import org.metalad.extractor.MetadataExtraction;
import org.metalad.record.MetadataRecord;
import org.metalad.record.RecordType;

/**
 * Processor that runs one extractor on the items of its type. Items of the other type are
 * `notneeded`, items whose content is missing are `impossible`.
 */
public class ExtractProcessor implements Processor {
    private static final Log logExtract = LogFactory.getLog(ExtractProcessor.class);

    public static final String NAME = "extract";

    private final MetadataExtraction extraction;
    private final RecordType extractorType;
    private final String extractorName;
    private final Map<String, Object> extractorParameters;

    /**
     * @throws ConfigurationException When the extractor is unknown or describes the other type
     */
    public ExtractProcessor(
        MetadataExtraction extraction, RecordType extractorType, String extractorName,
        Map<String, Object> extractorParameters) throws ConfigurationException {
        RecordType registeredType = extraction.getRegistry().getType(extractorName);
        if (registeredType != extractorType) {
            String errMsg = "Stage " + NAME + ": extractor " + extractorName + " is a "
                + registeredType.getName() + " extractor, extractor_type is "
                + extractorType.getName();
            logExtract.error(errMsg);
            throw new ConfigurationException(errMsg);
        }
        this.extraction = extraction;
        this.extractorType = extractorType;
        this.extractorName = extractorName;
        this.extractorParameters = extractorParameters;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(PipelineData data) throws IOException, ConfigurationException {
        DatasetElement element = data.getElement();
        if (element == null) {
            data.setOutcome(Outcome.IMPOSSIBLE, "item is not a dataset element");
            return;
        }
        boolean isFile = element.getType() == ElementType.FILE;
        if (isFile != (extractorType == RecordType.FILE)) {
            data.setOutcome(
                Outcome.NOTNEEDED,
                "not a " + extractorType.getName() + " element, " + extractorName + " skipped");
            return;
        }

        ExtractionContext context = isFile
            ? ExtractionContext.forFile(
                element.getDataset(), element.getLocalPath(), extractorParameters)
            : ExtractionContext.forDataset(element.getDataset(), extractorParameters);
        try {
            MetadataRecord record = extraction.extract(extractorName, context);
            data.addRecord(record);

        } catch (FileNotFoundException fnfe) {
            data.setOutcome(Outcome.IMPOSSIBLE, fnfe.getMessage());
        }
    }
}
