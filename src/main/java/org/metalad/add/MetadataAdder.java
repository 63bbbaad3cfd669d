package org.metalad.add;

import java.io.IOException;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.MetadataStore;
import org.metalad.ObjectRef;
import org.metalad.exceptions.MetadataKeyException;
import org.metalad.exceptions.VersionIndexNotFoundException;
import org.metalad.filestore.FileStoreUtility;
import org.metalad.index.Containment;
import org.metalad.index.IndexUpdate;
import org.metalad.index.SubDatasetEntry;
import org.metalad.index.VersionIndex;
import org.metalad.index.VersionIndexManager;
import org.metalad.record.MetadataPath;
import org.metalad.record.MetadataRecord;
import org.metalad.record.RecordCodec;
import org.metalad.record.RecordType;

/**
 * MetadataAdder validates metadata records and adds them to the store of a destination dataset.
 *
 * A record without provenance describes the destination dataset itself and is indexed under its
 * own (dataset_id, dataset_version). A record with provenance describes an element of a
 * sub-dataset at `dataset_path` of the destination, which must be the root dataset named by
 * `root_dataset_id`. Such a record is indexed twice: under the sub-dataset's own key with the
 * record's containment, and, if the root version is known, in the root index below
 * `dataset_path`.
 */
public class MetadataAdder {
    private static final Log logAdder = LogFactory.getLog(MetadataAdder.class);

    private final MetadataStore store;
    private final UUID destinationId;

    /**
     * @param store         Store of the destination dataset
     * @param destinationId Id of the destination dataset
     */
    public MetadataAdder(MetadataStore store, UUID destinationId) {
        FileStoreUtility.ensureNotNull(store, "store", "MetadataAdder");
        FileStoreUtility.ensureNotNull(destinationId, "destinationId", "MetadataAdder");
        this.store = store;
        this.destinationId = destinationId;
    }

    /**
     * Merge the additional values into the metadata and build a record from the result
     *
     * @param metadata   Record keys as read from JSON
     * @param parameters Add options
     * @return Validated record
     * @throws MetadataKeyException If additional values override keys without permission, or the
     *                              merged keys do not form a valid record
     */
    public static MetadataRecord prepare(Map<String, Object> metadata, AddParameters parameters)
        throws MetadataKeyException {
        FileStoreUtility.ensureNotNull(metadata, "metadata", "prepare");
        FileStoreUtility.ensureNotNull(parameters, "parameters", "prepare");
        List<String> overriddenKeys = new ArrayList<>();
        for (String key : parameters.getAdditionalValues().keySet()) {
            if (metadata.containsKey(key)) {
                overriddenKeys.add(key);
            }
        }
        if (!overriddenKeys.isEmpty()) {
            if (!parameters.isAllowOverride()) {
                throw new MetadataKeyException(
                    "Keys overridden by additional values", overriddenKeys);
            }
            logAdder.info(
                "MetadataAdder.prepare - keys overridden in additional values: " + String.join(
                    ", ", overriddenKeys));
        }

        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(parameters.getAdditionalValues());
        return RecordCodec.fromMap(merged, parameters.isAllowUnknown());
    }

    /**
     * Validate and add metadata given as JSON keys
     *
     * @return Ref of the stored record
     * @see #prepare(Map, AddParameters)
     * @see #add(MetadataRecord, boolean)
     */
    public ObjectRef add(Map<String, Object> metadata, AddParameters parameters)
        throws IOException, NoSuchAlgorithmException, InterruptedException {
        return add(prepare(metadata, parameters), parameters.isAllowIdMismatch());
    }

    /**
     * Store a record and index it
     *
     * @param record          Record to add
     * @param allowIdMismatch Add the record even if it does not belong to the destination
     * @return Ref of the stored record
     * @throws MetadataKeyException When the record belongs to another dataset and mismatches are
     *                              not allowed, or the root index holds a different dataset at
     *                              the record's dataset_path
     * @throws IOException          When the record cannot be stored or indexed
     */
    public ObjectRef add(MetadataRecord record, boolean allowIdMismatch)
        throws IOException, NoSuchAlgorithmException, InterruptedException {
        FileStoreUtility.ensureNotNull(record, "record", "add");
        checkDatasetIds(record, allowIdMismatch);

        ObjectRef objectRef = store.putRecord(record);
        VersionIndexManager indexManager = store.getIndexManager();

        if (!record.hasProvenance() || record.getDatasetPath().isRoot()) {
            indexManager.seal(
                record.getDatasetId(), record.getDatasetVersion(),
                Collections.singletonList(ownUpdate(record, objectRef)));
            logAdder.debug("MetadataAdder.add - added " + describe(record) + " as " + objectRef);
            return objectRef;
        }

        Containment containment = new Containment(
            record.getRootDatasetId(), record.getRootDatasetVersion(), record.getDatasetPath());
        indexManager.seal(
            record.getDatasetId(), record.getDatasetVersion(),
            Collections.singletonList(ownUpdate(record, objectRef)), containment);

        if (record.getRootDatasetVersion() == null) {
            logAdder.info(
                "MetadataAdder.add - root version unknown, " + describe(record)
                    + " is indexed with ambiguous containment only");
            return objectRef;
        }

        MetadataPath datasetPath = record.getDatasetPath();
        SubDatasetEntry existing = findSubDataset(
            record.getRootDatasetId(), record.getRootDatasetVersion(), datasetPath);
        if (existing != null && !existing.getDatasetId().equals(record.getDatasetId())) {
            String errMsg = "Root index contains dataset " + existing.getDatasetId() + " at "
                + datasetPath + ", record describes dataset " + record.getDatasetId();
            logAdder.error(errMsg);
            throw new MetadataKeyException(
                errMsg, Collections.singletonList(RecordCodec.DATASET_ID));
        }

        List<IndexUpdate> rootUpdates = new ArrayList<>();
        if (record.getType() == RecordType.DATASET) {
            rootUpdates.add(IndexUpdate.subDataset(
                datasetPath, new SubDatasetEntry(
                    record.getDatasetId(), record.getDatasetVersion(), objectRef)));
        } else {
            // A concurrent dataset record for this path may be sealed before us, keep its entry
            rootUpdates.add(IndexUpdate.subDatasetIfAbsent(
                datasetPath, new SubDatasetEntry(
                    record.getDatasetId(), record.getDatasetVersion(), null)));
            rootUpdates.add(IndexUpdate.file(datasetPath.resolve(record.getPath()), objectRef));
        }
        indexManager.seal(record.getRootDatasetId(), record.getRootDatasetVersion(), rootUpdates);
        logAdder.debug(
            "MetadataAdder.add - added " + describe(record) + " to root " + record
                .getRootDatasetId() + "@" + record.getRootDatasetVersion() + " as " + objectRef);
        return objectRef;
    }

    private void checkDatasetIds(MetadataRecord record, boolean allowIdMismatch)
        throws MetadataKeyException {
        String key;
        UUID claimedId;
        if (record.hasProvenance()) {
            key = RecordCodec.ROOT_DATASET_ID;
            claimedId = record.getRootDatasetId();
        } else {
            key = RecordCodec.DATASET_ID;
            claimedId = record.getDatasetId();
        }
        if (claimedId.equals(destinationId)) {
            return;
        }

        String errMsg = "value of \"" + key + "\" (" + claimedId + ") does not match ID of"
            + " destination dataset (" + destinationId + ")";
        if (!allowIdMismatch) {
            logAdder.error(errMsg);
            throw new MetadataKeyException(errMsg, Collections.singletonList(key));
        }
        logAdder.warn(errMsg);
    }

    private SubDatasetEntry findSubDataset(
        UUID rootId, String rootVersion, MetadataPath datasetPath) throws IOException {
        try {
            VersionIndex rootIndex = store.getIndexManager().get(rootId, rootVersion);
            return rootIndex.getDatasetTree().get(datasetPath);

        } catch (VersionIndexNotFoundException vinfe) {
            return null;
        }
    }

    private static IndexUpdate ownUpdate(MetadataRecord record, ObjectRef objectRef) {
        return record.getType() == RecordType.FILE
            ? IndexUpdate.file(record.getPath(), objectRef)
            : IndexUpdate.datasetLevel(objectRef);
    }

    private static String describe(MetadataRecord record) {
        String element = record.getDatasetId() + "@" + record.getDatasetVersion();
        return record.getPath() == null ? element : element + ":" + record.getPath();
    }
}
