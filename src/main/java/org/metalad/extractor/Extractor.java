package org.metalad.extractor;

import java.io.IOException;
import java.io.OutputStream;
import java.util.UUID;

import org.metalad.record.RecordType;

/**
 * An extractor produces the metadata of one dataset or one file. Instances are created per
 * element by the {@link ExtractorRegistry} and are bound to their {@link ExtractionContext}.
 */
public interface Extractor {

        UUID getId() throws IOException;

        String getVersion() throws IOException;

        /**
         * @return Whether the extractor describes datasets or files
         */
        RecordType getType();

        OutputMode getOutputMode() throws IOException;

        /**
         * Make the content the extractor needs available
         *
         * @return False if the content cannot be provided
         * @throws IOException When preparing the content fails
         */
        boolean ensureContentAvailable() throws IOException;

        /**
         * Run the extraction
         *
         * @param sink Receives the JSON metadata of EXTERNAL_FILE extractors, unused otherwise
         * @return Result of the extraction
         * @throws IOException When the extraction fails, external process failures are reported
         *                     as {@link org.metalad.exceptions.ExternalFailureException}
         */
        ExtractorResult extract(OutputStream sink) throws IOException;
}
