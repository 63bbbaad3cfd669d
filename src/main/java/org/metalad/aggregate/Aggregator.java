package org.metalad.aggregate;

import java.io.IOException;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.MetadataStore;
import org.metalad.ObjectRef;
import org.metalad.ObjectStore;
import org.metalad.dataset.RepositoryHandle;
import org.metalad.exceptions.ConsistencyException;
import org.metalad.exceptions.ObjectNotFoundException;
import org.metalad.filestore.FileStoreUtility;
import org.metalad.index.Containment;
import org.metalad.index.IndexUpdate;
import org.metalad.index.SubDatasetEntry;
import org.metalad.index.VersionIndex;
import org.metalad.index.VersionIndexManager;
import org.metalad.record.MetadataPath;

/**
 * Aggregator copies the metadata of sub-datasets into the store of a root dataset, so that the
 * root store answers queries about the whole tree without the sub-dataset stores.
 *
 * For a sub-dataset at `sub_path` with current version W and a root at current version V:
 * <ul>
 * <li>every blob referenced by the sub-dataset's index at W is copied into the root store, refs
 * are preserved;</li>
 * <li>the root index (root id, V) gets a sub-dataset entry at `sub_path` and the sub-dataset's
 * file entries below `sub_path`;</li>
 * <li>the sub-dataset's index at W is copied into the root store with containment
 * (root id, V, sub_path).</li>
 * </ul>
 * Indexes of other sub-dataset versions are copied as well, but their containment has no root
 * version: there is no evidence that such a version was ever present at `sub_path` of a root
 * version.
 */
public class Aggregator {
    private static final Log logAggregator = LogFactory.getLog(Aggregator.class);

    private final StoreLocator storeLocator;

    public Aggregator(StoreLocator storeLocator) {
        FileStoreUtility.ensureNotNull(storeLocator, "storeLocator", "Aggregator");
        this.storeLocator = storeLocator;
    }

    public Aggregator() {
        this(StoreLocator.fileSystem());
    }

    /**
     * Aggregate all sub-datasets of a root down to a nesting depth
     *
     * @param root      Root dataset
     * @param rootStore Store of the root dataset
     * @param depth     Nesting depth, 1 for direct sub-datasets, -1 for unlimited
     * @return One result per sub-dataset, in walk order
     * @throws IllegalArgumentException When depth is 0 or less than -1
     * @throws IOException              When the sub-dataset links of the root cannot be read
     */
    public List<AggregationResult> aggregate(
        RepositoryHandle root, MetadataStore rootStore, int depth) throws IOException,
        InterruptedException {
        FileStoreUtility.ensureNotNull(root, "root", "aggregate");
        FileStoreUtility.ensureNotNull(rootStore, "rootStore", "aggregate");
        if (depth == 0 || depth < -1) {
            String errMsg = "Aggregation depth must be >= 1 or -1 (unlimited), was: " + depth;
            logAggregator.error(errMsg);
            throw new IllegalArgumentException(errMsg);
        }

        List<AggregationResult> results = new ArrayList<>();
        Map<MetadataPath, RepositoryHandle> subDatasets = new LinkedHashMap<>();
        collectSubDatasets(root, MetadataPath.ROOT, 1, depth, subDatasets, results);
        for (Map.Entry<MetadataPath, RepositoryHandle> entry : subDatasets.entrySet()) {
            results.add(aggregateIsolated(root, rootStore, entry.getKey(), entry.getValue()));
        }
        return results;
    }

    /**
     * Aggregate the sub-datasets at the given paths
     *
     * @param root      Root dataset
     * @param rootStore Store of the root dataset
     * @param subPaths  Paths of sub-datasets relative to the root
     * @return One result per path
     */
    public List<AggregationResult> aggregate(
        RepositoryHandle root, MetadataStore rootStore, List<MetadataPath> subPaths)
        throws IOException, InterruptedException {
        FileStoreUtility.ensureNotNull(root, "root", "aggregate");
        FileStoreUtility.ensureNotNull(rootStore, "rootStore", "aggregate");
        FileStoreUtility.ensureNotNull(subPaths, "subPaths", "aggregate");

        List<AggregationResult> results = new ArrayList<>();
        for (MetadataPath subPath : subPaths) {
            RepositoryHandle subDataset;
            try {
                subDataset = root.openSubDataset(subPath);

            } catch (IOException ioe) {
                String errMsg = "Unable to open sub-dataset at " + subPath + ": " + ioe.getMessage();
                logAggregator.error(errMsg);
                results.add(AggregationResult.error(subPath, errMsg));
                continue;
            }
            results.add(aggregateIsolated(root, rootStore, subPath, subDataset));
        }
        return results;
    }

    /**
     * Aggregate one sub-dataset, turning its store and index errors into an error result so that
     * the siblings are still aggregated
     */
    private AggregationResult aggregateIsolated(
        RepositoryHandle root, MetadataStore rootStore, MetadataPath subPath,
        RepositoryHandle subDataset) throws InterruptedException {
        try {
            return aggregateSubDataset(root, rootStore, subPath, subDataset);

        } catch (IOException ioe) {
            String errMsg = "Aggregation of sub-dataset at " + subPath + " failed: "
                + ioe.getMessage();
            logAggregator.error(errMsg);
            return AggregationResult.error(subPath, errMsg);
        }
    }

    private void collectSubDatasets(
        RepositoryHandle dataset, MetadataPath prefix, int level, int depth,
        Map<MetadataPath, RepositoryHandle> subDatasets, List<AggregationResult> results)
        throws IOException {
        for (MetadataPath relativePath : dataset.getSubDatasets()) {
            MetadataPath subPath = prefix.resolve(relativePath);
            RepositoryHandle subDataset;
            try {
                subDataset = dataset.openSubDataset(relativePath);

            } catch (IOException ioe) {
                String errMsg = "Unable to open sub-dataset at " + subPath + ": " + ioe.getMessage();
                logAggregator.error(errMsg);
                results.add(AggregationResult.error(subPath, errMsg));
                continue;
            }
            subDatasets.put(subPath, subDataset);
            if (depth == -1 || level < depth) {
                collectSubDatasets(subDataset, subPath, level + 1, depth, subDatasets, results);
            }
        }
    }

    /**
     * Copy the metadata of one sub-dataset into the root store
     */
    protected AggregationResult aggregateSubDataset(
        RepositoryHandle root, MetadataStore rootStore, MetadataPath subPath,
        RepositoryHandle subDataset) throws IOException, InterruptedException {
        UUID rootId = root.getDatasetId();
        String rootVersion = root.getCurrentVersion();
        UUID subId = subDataset.getDatasetId();
        String subVersion = subDataset.getCurrentVersion();
        logAggregator.debug("Aggregating " + subId + "@" + subVersion + " at " + subPath + " into "
                                + rootId + "@" + rootVersion);

        MetadataStore subStore;
        List<String> subVersions;
        try {
            subStore = storeLocator.locate(subDataset);
            subVersions = subStore.getIndexManager().getVersions(subId);

        } catch (IOException ioe) {
            String errMsg = "Unable to read metadata store of sub-dataset at " + subPath + ": "
                + ioe.getMessage();
            logAggregator.error(errMsg);
            return AggregationResult.error(subPath, errMsg);
        }

        AggregationResult result = new AggregationResult(subPath);
        result.setEdge(new AggregationEdge(rootId, rootVersion, subPath, subId, subVersion));
        VersionIndexManager rootIndex = rootStore.getIndexManager();

        // Versions other than the current one cannot be placed in a root version
        for (String version : subVersions) {
            if (version.equals(subVersion)) {
                continue;
            }
            VersionIndex subIndex = subStore.getIndexManager().get(subId, version);
            Set<ObjectRef> copied = copyObjects(subIndex, subStore, rootStore, result);
            Containment containment = new Containment(rootId, null, subPath);
            if (rootIndex.contains(subId, version)) {
                Containment existing = rootIndex.get(subId, version).getContainment();
                if (existing != null && !existing.isAmbiguous()) {
                    // keep a containment that an earlier aggregation observed
                    containment = null;
                }
            }
            rootIndex.seal(subId, version, copyUpdates(subIndex, copied, MetadataPath.ROOT),
                           containment);
            result.addCopiedVersion(version);
        }

        SubDatasetEntry subDatasetEntry;
        List<IndexUpdate> rootUpdates = new ArrayList<>();
        if (subVersions.contains(subVersion)) {
            VersionIndex subIndex = subStore.getIndexManager().get(subId, subVersion);
            Set<ObjectRef> copied = copyObjects(subIndex, subStore, rootStore, result);
            rootIndex.seal(subId, subVersion, copyUpdates(subIndex, copied, MetadataPath.ROOT),
                           new Containment(rootId, rootVersion, subPath));
            result.addCopiedVersion(subVersion);

            ObjectRef datasetLevelRef = subIndex.getDatasetLevelRef();
            subDatasetEntry = new SubDatasetEntry(
                subId, subVersion,
                datasetLevelRef != null && copied.contains(datasetLevelRef) ? datasetLevelRef : null);
            rootUpdates.addAll(copyUpdates(subIndex, copied, subPath));
        } else {
            logAggregator.warn("Sub-dataset at " + subPath + " has no metadata for its current"
                                   + " version " + subVersion);
            subDatasetEntry = new SubDatasetEntry(subId, subVersion, null);
        }
        rootUpdates.add(0, IndexUpdate.subDataset(subPath, subDatasetEntry));
        rootIndex.seal(rootId, rootVersion, rootUpdates);

        logAggregator.info("Aggregated " + result.getEdge() + ": " + result.getStatus() + ", "
                               + result.getCopiedObjects() + " new objects");
        return result;
    }

    /**
     * Copy every blob an index references into the root store. A ref that is missing in the
     * sub-dataset store is recorded as an entry error and left out of the returned set.
     *
     * @return Refs that are present in the root store
     */
    private Set<ObjectRef> copyObjects(
        VersionIndex subIndex, MetadataStore subStore, MetadataStore rootStore,
        AggregationResult result) throws IOException, InterruptedException {
        ObjectStore source = subStore.getObjectStore();
        ObjectStore target = rootStore.getObjectStore();
        Set<ObjectRef> copied = new HashSet<>();
        for (ObjectRef ref : subIndex.getReferencedRefs()) {
            if (copied.contains(ref)) {
                continue;
            }
            try {
                if (!target.exists(ref)) {
                    ObjectRef targetRef = target.put(source.getBytes(ref));
                    if (!targetRef.equals(ref)) {
                        String errMsg = "Ref changed when copying blob " + ref + " to root store: "
                            + targetRef + ". The stores use different algorithms.";
                        logAggregator.error(errMsg);
                        throw new ConsistencyException(errMsg, ref.getHexDigest());
                    }
                    result.addCopiedObject();
                }
                copied.add(ref);

            } catch (ObjectNotFoundException onfe) {
                String errMsg = "Dangling ref " + ref + " in index " + subIndex;
                logAggregator.error(errMsg);
                result.addEntryError(new ConsistencyException(errMsg, ref.getHexDigest()));

            } catch (ConsistencyException ce) {
                result.addEntryError(ce);

            } catch (NoSuchAlgorithmException nsae) {
                String errMsg = "Root store algorithm not available: " + nsae.getMessage();
                logAggregator.error(errMsg);
                throw new IOException(errMsg, nsae);
            }
        }
        return copied;
    }

    /**
     * Translate the entries of an index into updates below a prefix, skipping entries whose
     * blob could not be copied
     */
    private List<IndexUpdate> copyUpdates(
        VersionIndex subIndex, Set<ObjectRef> copied, MetadataPath prefix) {
        List<IndexUpdate> updates = new ArrayList<>();
        if (prefix.isRoot() && subIndex.getDatasetLevelRef() != null
            && copied.contains(subIndex.getDatasetLevelRef())) {
            updates.add(IndexUpdate.datasetLevel(subIndex.getDatasetLevelRef()));
        }
        for (Map.Entry<MetadataPath, SubDatasetEntry> entry : subIndex.getDatasetTree().entrySet()) {
            SubDatasetEntry subEntry = entry.getValue();
            ObjectRef ref = subEntry.getDatasetLevelRef();
            if (ref != null && !copied.contains(ref)) {
                subEntry = new SubDatasetEntry(
                    subEntry.getDatasetId(), subEntry.getDatasetVersion(), null);
            }
            updates.add(IndexUpdate.subDataset(prefix.resolve(entry.getKey()), subEntry));
        }
        for (Map.Entry<MetadataPath, ObjectRef> entry : subIndex.getFileTree().entrySet()) {
            if (copied.contains(entry.getValue())) {
                updates.add(IndexUpdate.file(prefix.resolve(entry.getKey()), entry.getValue()));
            }
        }
        return updates;
    }
}
