package org.metalad.dump;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.MetadataStore;
import org.metalad.ObjectRef;
import org.metalad.filestore.FileStoreUtility;
import org.metalad.index.Containment;
import org.metalad.index.GlobPattern;
import org.metalad.index.SubDatasetEntry;
import org.metalad.index.VersionIndex;
import org.metalad.index.VersionIndexManager;
import org.metalad.record.MetadataPath;
import org.metalad.record.MetadataRecord;

/**
 * MetadataDumper reads the records a metadata URL selects from a store. Records of aggregated
 * sub-datasets are reported with the provenance stored in the index: the root dataset id, the
 * root version and the sub-dataset path.
 *
 * A dataset path or local path pattern selects the paths it matches. If recursive, it also
 * selects everything below them, so the empty pattern selects the whole tree.
 */
public class MetadataDumper {
    private static final Log logDumper = LogFactory.getLog(MetadataDumper.class);

    private final MetadataStore store;

    public MetadataDumper(MetadataStore store) {
        FileStoreUtility.ensureNotNull(store, "store", "MetadataDumper");
        this.store = store;
    }

    /**
     * Dump the records a URL selects
     *
     * @param rootDatasetId Id of the dataset that owns the store, used by tree URLs
     * @param url           Metadata URL
     * @param recursive     Select everything below matching paths
     * @return Selected records, dataset-level record of each dataset before its files
     * @throws IOException When the index or a blob cannot be read, or a ref is dangling
     */
    public List<MetadataRecord> dump(UUID rootDatasetId, MetadataUrl url, boolean recursive)
        throws IOException {
        FileStoreUtility.ensureNotNull(url, "url", "dump");
        if (url.getScheme() == MetadataUrl.Scheme.TREE) {
            FileStoreUtility.ensureNotNull(rootDatasetId, "rootDatasetId", "dump");
            VersionIndex index = findIndex(rootDatasetId, url.getVersion());
            if (index == null) {
                return Collections.emptyList();
            }
            return dumpIndex(index, null, url, recursive);
        }

        VersionIndex index = findIndex(url.getDatasetId(), url.getVersion());
        if (index == null) {
            return Collections.emptyList();
        }
        return dumpIndex(index, index.getContainment(), url, recursive);
    }

    private VersionIndex findIndex(UUID datasetId, String requestedVersion) throws IOException {
        VersionIndexManager indexManager = store.getIndexManager();
        String version = requestedVersion != null
            ? requestedVersion : indexManager.getLatestVersion(datasetId);
        if (version == null || !indexManager.contains(datasetId, version)) {
            logDumper.warn("No metadata for dataset " + datasetId + "@"
                               + (version == null ? "latest" : version) + " in " + store);
            return null;
        }
        return indexManager.get(datasetId, version);
    }

    private List<MetadataRecord> dumpIndex(
        VersionIndex index, Containment containment, MetadataUrl url, boolean recursive)
        throws IOException {
        GlobPattern datasetPattern = GlobPattern.compile(url.getDatasetPath().toString());
        GlobPattern localPattern = GlobPattern.compile(url.getLocalPath().toString());
        List<MetadataRecord> records = new ArrayList<>();

        if (selects(datasetPattern, MetadataPath.ROOT, recursive)) {
            if (index.getDatasetLevelRef() != null) {
                records.add(tag(store.getRecord(index.getDatasetLevelRef()), containment));
            }
            for (Map.Entry<MetadataPath, ObjectRef> file : index.getFileTree().entrySet()) {
                if (owningSubDataset(index, file.getKey()) == null
                    && selects(localPattern, file.getKey(), recursive)) {
                    records.add(tag(store.getRecord(file.getValue()), containment));
                }
            }
        }

        for (Map.Entry<MetadataPath, SubDatasetEntry> entry : index.getDatasetTree().entrySet()) {
            MetadataPath subPath = entry.getKey();
            if (!selects(datasetPattern, subPath, recursive)) {
                continue;
            }
            Containment subContainment = new Containment(
                index.getDatasetId(), index.getDatasetVersion(), subPath);
            ObjectRef datasetLevelRef = entry.getValue().getDatasetLevelRef();
            if (datasetLevelRef != null) {
                records.add(tag(store.getRecord(datasetLevelRef), subContainment));
            }
            for (Map.Entry<MetadataPath, ObjectRef> file : index.getFileTree().entrySet()) {
                if (!subPath.equals(owningSubDataset(index, file.getKey()))) {
                    continue;
                }
                MetadataPath localPath = file.getKey().relativize(subPath);
                if (selects(localPattern, localPath, recursive)) {
                    records.add(tag(store.getRecord(file.getValue()), subContainment));
                }
            }
        }
        return records;
    }

    /**
     * @return Path of the deepest sub-dataset that contains the file, null if the file belongs to
     * the indexed dataset itself
     */
    private static MetadataPath owningSubDataset(VersionIndex index, MetadataPath filePath) {
        MetadataPath owner = null;
        for (MetadataPath subPath : index.getDatasetTree().keySet()) {
            if (!subPath.equals(filePath) && filePath.startsWith(subPath)
                && (owner == null || subPath.getParts().size() > owner.getParts().size())) {
                owner = subPath;
            }
        }
        return owner;
    }

    /**
     * @return True if the pattern matches the path, or, if recursive, one of its ancestors
     */
    static boolean selects(GlobPattern pattern, MetadataPath path, boolean recursive) {
        if (pattern.matches(path.toString())) {
            return true;
        }
        if (!recursive) {
            return false;
        }
        List<String> parts = path.getParts();
        for (int i = 0; i < parts.size(); i++) {
            if (pattern.matches(String.join("/", parts.subList(0, i)))) {
                return true;
            }
        }
        return false;
    }

    private static MetadataRecord tag(MetadataRecord record, Containment containment) {
        if (containment == null) {
            return record;
        }
        return record.withProvenance(
            containment.getRootDatasetId(), containment.getRootDatasetVersion(),
            containment.getDatasetPath());
    }
}
