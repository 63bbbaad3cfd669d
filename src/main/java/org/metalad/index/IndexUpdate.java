package org.metalad.index;

import org.metalad.ObjectRef;
import org.metalad.filestore.FileStoreUtility;
import org.metalad.record.MetadataPath;

/**
 * One entry to set when sealing a VersionIndex. An update replaces any existing entry with the
 * same key, entries without update are inherited from the previous generation.
 */
public final class IndexUpdate {

    public enum Kind {
        DATASET_LEVEL, FILE, SUB_DATASET, SUB_DATASET_IF_ABSENT
    }

    private final Kind kind;
    private final MetadataPath path;
    private final ObjectRef objectRef;
    private final SubDatasetEntry subDataset;

    private IndexUpdate(
        Kind kind, MetadataPath path, ObjectRef objectRef, SubDatasetEntry subDataset) {
        this.kind = kind;
        this.path = path;
        this.objectRef = objectRef;
        this.subDataset = subDataset;
    }

    /**
     * Set the dataset-level metadata ref
     */
    public static IndexUpdate datasetLevel(ObjectRef objectRef) {
        FileStoreUtility.ensureNotNull(objectRef, "objectRef", "IndexUpdate.datasetLevel");
        return new IndexUpdate(Kind.DATASET_LEVEL, MetadataPath.ROOT, objectRef, null);
    }

    /**
     * Set the metadata ref of a file
     */
    public static IndexUpdate file(MetadataPath path, ObjectRef objectRef) {
        FileStoreUtility.ensureNotNull(path, "path", "IndexUpdate.file");
        FileStoreUtility.ensureNotNull(objectRef, "objectRef", "IndexUpdate.file");
        if (path.isRoot()) {
            throw new IllegalArgumentException("File entries require a non-empty path");
        }
        return new IndexUpdate(Kind.FILE, path, objectRef, null);
    }

    /**
     * Set the sub-dataset aggregated at a path
     */
    public static IndexUpdate subDataset(MetadataPath path, SubDatasetEntry entry) {
        FileStoreUtility.ensureNotNull(path, "path", "IndexUpdate.subDataset");
        FileStoreUtility.ensureNotNull(entry, "entry", "IndexUpdate.subDataset");
        if (path.isRoot()) {
            throw new IllegalArgumentException("Sub-dataset entries require a non-empty path");
        }
        return new IndexUpdate(Kind.SUB_DATASET, path, entry.getDatasetLevelRef(), entry);
    }

    /**
     * Set the sub-dataset at a path unless the index being sealed already has an entry there.
     * The check is made against the head the seal derives from.
     */
    public static IndexUpdate subDatasetIfAbsent(MetadataPath path, SubDatasetEntry entry) {
        IndexUpdate update = subDataset(path, entry);
        return new IndexUpdate(Kind.SUB_DATASET_IF_ABSENT, path, update.objectRef, entry);
    }

    public Kind getKind() {
        return kind;
    }

    public MetadataPath getPath() {
        return path;
    }

    /**
     * @return Ref to set, null for sub-dataset entries without dataset-level metadata
     */
    public ObjectRef getObjectRef() {
        return objectRef;
    }

    public SubDatasetEntry getSubDataset() {
        return subDataset;
    }

    @Override
    public String toString() {
        return kind + ":" + path + "=" + (subDataset != null ? subDataset : objectRef);
    }
}
