package org.metalad.extractor;

/**
 * How an extractor delivers its metadata
 */
public enum OutputMode {
    /** returned as immediate data of the ExtractorResult */
    IMMEDIATE,
    /** written as JSON to the sink given to extract() */
    EXTERNAL_FILE
}
