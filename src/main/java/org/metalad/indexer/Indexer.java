package org.metalad.indexer;

import java.util.Map;

import org.metalad.record.MetadataRecord;

/**
 * An Indexer turns the extracted metadata of a record into key-value pairs for search.
 */
public interface Indexer {

        /**
         * @param record Metadata record
         * @return Keys mapped to string values or null
         */
        Map<String, Object> index(MetadataRecord record);
}
