package org.metalad.index;

import java.util.UUID;

import org.metalad.ObjectRef;
import org.metalad.record.MetadataPath;

/**
 * One result of resolving a path and version pattern against the version indexes of a dataset.
 */
public final class IndexMatch {

    public enum Kind {
        /** dataset-level metadata of the indexed dataset, path "" */
        DATASET,
        /** metadata of a file, the path is relative to the indexed dataset */
        FILE,
        /** dataset-level metadata of an aggregated sub-dataset at path */
        SUB_DATASET
    }

    private final VersionIndex index;
    private final Kind kind;
    private final MetadataPath path;
    private final ObjectRef objectRef;

    public IndexMatch(VersionIndex index, Kind kind, MetadataPath path, ObjectRef objectRef) {
        this.index = index;
        this.kind = kind;
        this.path = path;
        this.objectRef = objectRef;
    }

    public UUID getDatasetId() {
        return index.getDatasetId();
    }

    public String getDatasetVersion() {
        return index.getDatasetVersion();
    }

    public VersionIndex getIndex() {
        return index;
    }

    public Kind getKind() {
        return kind;
    }

    public MetadataPath getPath() {
        return path;
    }

    public ObjectRef getObjectRef() {
        return objectRef;
    }

    /**
     * @return Sub-dataset entry for SUB_DATASET matches, null otherwise
     */
    public SubDatasetEntry getSubDataset() {
        return kind == Kind.SUB_DATASET ? index.getDatasetTree().get(path) : null;
    }

    @Override
    public String toString() {
        return getDatasetId() + "@" + getDatasetVersion() + ":" + path + " -> " + objectRef;
    }
}
