package org.metalad.aggregate;

import java.util.UUID;

import org.metalad.record.MetadataPath;

/**
 * The containment of a sub-dataset version at a path of a root dataset version, as observed
 * during one aggregation.
 */
public final class AggregationEdge {
    private final UUID rootDatasetId;
    private final String rootDatasetVersion;
    private final MetadataPath subPath;
    private final UUID subDatasetId;
    private final String subDatasetVersion;

    public AggregationEdge(
        UUID rootDatasetId, String rootDatasetVersion, MetadataPath subPath, UUID subDatasetId,
        String subDatasetVersion) {
        this.rootDatasetId = rootDatasetId;
        this.rootDatasetVersion = rootDatasetVersion;
        this.subPath = subPath;
        this.subDatasetId = subDatasetId;
        this.subDatasetVersion = subDatasetVersion;
    }

    public UUID getRootDatasetId() {
        return rootDatasetId;
    }

    public String getRootDatasetVersion() {
        return rootDatasetVersion;
    }

    public MetadataPath getSubPath() {
        return subPath;
    }

    public UUID getSubDatasetId() {
        return subDatasetId;
    }

    public String getSubDatasetVersion() {
        return subDatasetVersion;
    }

    @Override
    public String toString() {
        return rootDatasetId + "@" + rootDatasetVersion + ":" + subPath + " -> " + subDatasetId
            + "@" + subDatasetVersion;
    }
}
