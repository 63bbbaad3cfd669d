package org.metalad.dataset;

import java.nio.file.Path;
import java.util.UUID;

import org.metalad.record.MetadataPath;

/**
 * An element found when enumerating a dataset tree: a dataset (the root or a sub-dataset) or a
 * file of a dataset.
 */
public final class DatasetElement {
    private final ElementType type;
    private final RepositoryHandle dataset;
    private final MetadataPath datasetPath;
    private final MetadataPath localPath;

    /**
     * @param type        Element type
     * @param dataset     Dataset that owns the element; a DATASET element owns itself
     * @param datasetPath Path of the owning dataset relative to the enumeration root
     * @param localPath   Path of a file relative to its dataset, ROOT for DATASET elements
     */
    public DatasetElement(
        ElementType type, RepositoryHandle dataset, MetadataPath datasetPath,
        MetadataPath localPath) {
        this.type = type;
        this.dataset = dataset;
        this.datasetPath = datasetPath;
        this.localPath = localPath;
    }

    public ElementType getType() {
        return type;
    }

    public RepositoryHandle getDataset() {
        return dataset;
    }

    public UUID getDatasetId() {
        return dataset.getDatasetId();
    }

    public String getDatasetVersion() {
        return dataset.getCurrentVersion();
    }

    public MetadataPath getDatasetPath() {
        return datasetPath;
    }

    public MetadataPath getLocalPath() {
        return localPath;
    }

    /**
     * @return Path of the element relative to the enumeration root
     */
    public MetadataPath getPath() {
        return datasetPath.resolve(localPath);
    }

    public Path getAbsolutePath() {
        return dataset.getPath().resolve(localPath.toString());
    }

    @Override
    public String toString() {
        return type + ":" + (getPath().isRoot() ? "." : getPath().toString());
    }
}
