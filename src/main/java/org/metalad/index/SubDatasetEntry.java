package org.metalad.index;

import java.util.Objects;
import java.util.UUID;

import org.metalad.ObjectRef;
import org.metalad.filestore.FileStoreUtility;

/**
 * Entry of the dataset tree of a VersionIndex: the sub-dataset that was aggregated at a path,
 * the version it had, and the ref of its dataset-level metadata if it has any.
 */
public final class SubDatasetEntry {
    private final UUID datasetId;
    private final String datasetVersion;
    private final ObjectRef datasetLevelRef;

    public SubDatasetEntry(UUID datasetId, String datasetVersion, ObjectRef datasetLevelRef) {
        FileStoreUtility.ensureNotNull(datasetId, "datasetId", "SubDatasetEntry");
        FileStoreUtility.ensureNotNull(datasetVersion, "datasetVersion", "SubDatasetEntry");
        this.datasetId = datasetId;
        this.datasetVersion = datasetVersion;
        this.datasetLevelRef = datasetLevelRef;
    }

    public UUID getDatasetId() {
        return datasetId;
    }

    public String getDatasetVersion() {
        return datasetVersion;
    }

    /**
     * @return Ref of the dataset-level metadata of the sub-dataset, or null
     */
    public ObjectRef getDatasetLevelRef() {
        return datasetLevelRef;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof SubDatasetEntry)) {
            return false;
        }
        SubDatasetEntry that = (SubDatasetEntry) other;
        return datasetId.equals(that.datasetId) && datasetVersion.equals(that.datasetVersion)
            && Objects.equals(datasetLevelRef, that.datasetLevelRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(datasetId, datasetVersion, datasetLevelRef);
    }

    @Override
    public String toString() {
        return datasetId + "@" + datasetVersion;
    }
}
