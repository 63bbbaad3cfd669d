package org.metalad.extractor;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.metalad.dataset.RepositoryHandle;
import org.metalad.filestore.FileStoreUtility;
import org.metalad.record.MetadataPath;
import org.metalad.record.RecordType;

/**
 * What an extractor works on: a dataset at its current version and, for file extractors, a file
 * of that dataset, plus the parameters given to the extractor.
 */
public final class ExtractionContext {
    private final RepositoryHandle dataset;
    private final MetadataPath filePath;
    private final Map<String, Object> parameters;

    private ExtractionContext(
        RepositoryHandle dataset, MetadataPath filePath, Map<String, Object> parameters) {
        FileStoreUtility.ensureNotNull(dataset, "dataset", "ExtractionContext");
        this.dataset = dataset;
        this.filePath = filePath;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(
            parameters == null ? Collections.emptyMap() : parameters));
    }

    public static ExtractionContext forDataset(
        RepositoryHandle dataset, Map<String, Object> parameters) {
        return new ExtractionContext(dataset, null, parameters);
    }

    public static ExtractionContext forFile(
        RepositoryHandle dataset, MetadataPath filePath, Map<String, Object> parameters) {
        FileStoreUtility.ensureNotNull(filePath, "filePath", "ExtractionContext.forFile");
        return new ExtractionContext(dataset, filePath, parameters);
    }

    public RepositoryHandle getDataset() {
        return dataset;
    }

    /**
     * @return Path of the file relative to the dataset, null for dataset extraction
     */
    public MetadataPath getFilePath() {
        return filePath;
    }

    public Path getAbsoluteFilePath() {
        return filePath == null ? null : dataset.getPath().resolve(filePath.toString());
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public RecordType getType() {
        return filePath == null ? RecordType.DATASET : RecordType.FILE;
    }
}
