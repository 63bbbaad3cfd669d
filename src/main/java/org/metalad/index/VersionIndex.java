package org.metalad.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

import org.metalad.ObjectRef;
import org.metalad.filestore.FileStoreUtility;
import org.metalad.record.MetadataPath;

/**
 * VersionIndex maps the elements of one dataset version to the refs of their metadata: the
 * dataset-level ref, a file tree (path to ref) and a dataset tree of aggregated sub-datasets.
 * File entries of an aggregated sub-dataset live in the file tree below the sub-dataset path.
 *
 * A VersionIndex is immutable. Every seal of the same (dataset id, dataset version) key creates
 * a new generation with a higher generation number, older generations stay as they are.
 */
public final class VersionIndex {
    private final UUID datasetId;
    private final String datasetVersion;
    private final int generation;
    private final long sealedTime;
    private final ObjectRef datasetLevelRef;
    private final Map<MetadataPath, ObjectRef> fileTree;
    private final Map<MetadataPath, SubDatasetEntry> datasetTree;
    private final Containment containment;

    public VersionIndex(
        UUID datasetId, String datasetVersion, int generation, long sealedTime,
        ObjectRef datasetLevelRef, Map<MetadataPath, ObjectRef> fileTree,
        Map<MetadataPath, SubDatasetEntry> datasetTree, Containment containment) {
        FileStoreUtility.ensureNotNull(datasetId, "datasetId", "VersionIndex");
        FileStoreUtility.ensureNotNull(datasetVersion, "datasetVersion", "VersionIndex");
        this.datasetId = datasetId;
        this.datasetVersion = datasetVersion;
        this.generation = generation;
        this.sealedTime = sealedTime;
        this.datasetLevelRef = datasetLevelRef;
        this.fileTree = Collections.unmodifiableMap(new TreeMap<>(fileTree));
        this.datasetTree = Collections.unmodifiableMap(new TreeMap<>(datasetTree));
        this.containment = containment;
    }

    /**
     * @return Generation 0 of a key, the base of its first seal
     */
    static VersionIndex empty(UUID datasetId, String datasetVersion) {
        return new VersionIndex(datasetId, datasetVersion, 0, 0L, null, Collections.emptyMap(),
                                Collections.emptyMap(), null);
    }

    /**
     * Derive the next generation: all entries of this index, overwritten by the updates in list
     * order.
     *
     * @param updates     Entries to set
     * @param containment Containment of the next generation, null keeps the current one
     * @param sealedTime  Seal time in milliseconds since the epoch
     * @param generation  Generation number of the result, greater than this generation
     * @return New VersionIndex
     */
    VersionIndex apply(
        List<IndexUpdate> updates, Containment containment, long sealedTime, int generation) {
        if (generation <= this.generation) {
            throw new IllegalArgumentException(
                "Generation " + generation + " must be greater than " + this.generation);
        }
        ObjectRef newDatasetLevelRef = datasetLevelRef;
        Map<MetadataPath, ObjectRef> newFileTree = new TreeMap<>(fileTree);
        Map<MetadataPath, SubDatasetEntry> newDatasetTree = new TreeMap<>(datasetTree);
        for (IndexUpdate update : updates) {
            switch (update.getKind()) {
                case DATASET_LEVEL:
                    newDatasetLevelRef = update.getObjectRef();
                    break;
                case FILE:
                    newFileTree.put(update.getPath(), update.getObjectRef());
                    break;
                case SUB_DATASET:
                    newDatasetTree.put(update.getPath(), update.getSubDataset());
                    break;
                case SUB_DATASET_IF_ABSENT:
                    newDatasetTree.putIfAbsent(update.getPath(), update.getSubDataset());
                    break;
                default:
                    throw new IllegalStateException("Unknown update kind: " + update.getKind());
            }
        }
        return new VersionIndex(
            datasetId, datasetVersion, generation, sealedTime, newDatasetLevelRef, newFileTree,
            newDatasetTree, containment != null ? containment : this.containment);
    }

    /**
     * Find the entries whose path matches a pattern. The dataset-level entry has the path "".
     * A literal pattern is answered with map lookups.
     *
     * @param pattern Path pattern
     * @return Matches in the order dataset-level, sub-datasets, files
     */
    public List<IndexMatch> match(GlobPattern pattern) {
        List<IndexMatch> matches = new ArrayList<>();
        if (pattern.isLiteral()) {
            MetadataPath path = MetadataPath.of(pattern.getGlob());
            if (path.isRoot()) {
                if (datasetLevelRef != null) {
                    matches.add(new IndexMatch(this, IndexMatch.Kind.DATASET, path, datasetLevelRef));
                }
                return matches;
            }
            SubDatasetEntry subDataset = datasetTree.get(path);
            if (subDataset != null && subDataset.getDatasetLevelRef() != null) {
                matches.add(new IndexMatch(
                    this, IndexMatch.Kind.SUB_DATASET, path, subDataset.getDatasetLevelRef()));
            }
            ObjectRef fileRef = fileTree.get(path);
            if (fileRef != null) {
                matches.add(new IndexMatch(this, IndexMatch.Kind.FILE, path, fileRef));
            }
            return matches;
        }

        if (datasetLevelRef != null && pattern.matches("")) {
            matches.add(new IndexMatch(
                this, IndexMatch.Kind.DATASET, MetadataPath.ROOT, datasetLevelRef));
        }
        for (Map.Entry<MetadataPath, SubDatasetEntry> entry : datasetTree.entrySet()) {
            ObjectRef ref = entry.getValue().getDatasetLevelRef();
            if (ref != null && pattern.matches(entry.getKey().toString())) {
                matches.add(new IndexMatch(this, IndexMatch.Kind.SUB_DATASET, entry.getKey(), ref));
            }
        }
        for (Map.Entry<MetadataPath, ObjectRef> entry : fileTree.entrySet()) {
            if (pattern.matches(entry.getKey().toString())) {
                matches.add(new IndexMatch(
                    this, IndexMatch.Kind.FILE, entry.getKey(), entry.getValue()));
            }
        }
        return matches;
    }

    /**
     * @return Every ref this index references
     */
    public List<ObjectRef> getReferencedRefs() {
        List<ObjectRef> refs = new ArrayList<>();
        if (datasetLevelRef != null) {
            refs.add(datasetLevelRef);
        }
        for (SubDatasetEntry entry : datasetTree.values()) {
            if (entry.getDatasetLevelRef() != null) {
                refs.add(entry.getDatasetLevelRef());
            }
        }
        refs.addAll(fileTree.values());
        return refs;
    }

    public UUID getDatasetId() {
        return datasetId;
    }

    public String getDatasetVersion() {
        return datasetVersion;
    }

    public int getGeneration() {
        return generation;
    }

    /**
     * @return Seal time in milliseconds since the epoch
     */
    public long getSealedTime() {
        return sealedTime;
    }

    /**
     * @return Dataset-level metadata ref, null if the dataset has none
     */
    public ObjectRef getDatasetLevelRef() {
        return datasetLevelRef;
    }

    public Map<MetadataPath, ObjectRef> getFileTree() {
        return fileTree;
    }

    public Map<MetadataPath, SubDatasetEntry> getDatasetTree() {
        return datasetTree;
    }

    /**
     * @return Containment of an index imported by aggregation, null for a dataset's own index
     */
    public Containment getContainment() {
        return containment;
    }

    @Override
    public String toString() {
        return "VersionIndex{" + datasetId + "@" + datasetVersion + " g" + generation + ", files="
            + fileTree.size() + ", datasets=" + datasetTree.size() + "}";
    }
}
