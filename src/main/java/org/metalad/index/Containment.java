package org.metalad.index;

import java.util.Objects;
import java.util.UUID;

import org.metalad.filestore.FileStoreUtility;
import org.metalad.record.MetadataPath;

/**
 * Containment records where an imported VersionIndex was found in a root dataset: the root
 * dataset id, the root dataset version and the path of the sub-dataset in the root. The root
 * version is null when the sub-dataset version was never observed at the path in a known root
 * version, the containment is then ambiguous.
 */
public final class Containment {
    private final UUID rootDatasetId;
    private final String rootDatasetVersion;
    private final MetadataPath datasetPath;

    public Containment(UUID rootDatasetId, String rootDatasetVersion, MetadataPath datasetPath) {
        FileStoreUtility.ensureNotNull(rootDatasetId, "rootDatasetId", "Containment");
        FileStoreUtility.ensureNotNull(datasetPath, "datasetPath", "Containment");
        this.rootDatasetId = rootDatasetId;
        this.rootDatasetVersion = rootDatasetVersion;
        this.datasetPath = datasetPath;
    }

    public UUID getRootDatasetId() {
        return rootDatasetId;
    }

    /**
     * @return Root dataset version, null if unknown
     */
    public String getRootDatasetVersion() {
        return rootDatasetVersion;
    }

    public MetadataPath getDatasetPath() {
        return datasetPath;
    }

    public boolean isAmbiguous() {
        return rootDatasetVersion == null;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof Containment)) {
            return false;
        }
        Containment that = (Containment) other;
        return rootDatasetId.equals(that.rootDatasetId)
            && Objects.equals(rootDatasetVersion, that.rootDatasetVersion)
            && datasetPath.equals(that.datasetPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rootDatasetId, rootDatasetVersion, datasetPath);
    }

    @Override
    public String toString() {
        return rootDatasetId + "@" + (rootDatasetVersion == null ? "?" : rootDatasetVersion) + ":"
            + datasetPath;
    }
}
