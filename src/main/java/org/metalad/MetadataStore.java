package org.metalad;

import java.io.IOException;
import java.nio.file.Path;
import java.security.NoSuchAlgorithmException;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.exceptions.ConsistencyException;
import org.metalad.exceptions.MetadataKeyException;
import org.metalad.exceptions.ObjectNotFoundException;
import org.metalad.exceptions.StoreFactoryException;
import org.metalad.index.FileVersionIndexManager;
import org.metalad.index.VersionIndexManager;
import org.metalad.record.MetadataRecord;
import org.metalad.record.RecordCodec;

/**
 * MetadataStore is the metadata store of one dataset: an ObjectStore holding the serialized
 * records and a VersionIndexManager referencing them, both below the same store path.
 */
public class MetadataStore {
    private static final Log logStore = LogFactory.getLog(MetadataStore.class);

    private final ObjectStore objectStore;
    private final VersionIndexManager indexManager;

    public MetadataStore(ObjectStore objectStore, VersionIndexManager indexManager) {
        this.objectStore = objectStore;
        this.indexManager = indexManager;
    }

    /**
     * Open or create a store with the default object store settings
     *
     * @param storePath Root directory of the store
     * @return MetadataStore
     * @throws StoreFactoryException When the object store cannot be initialized
     * @throws IOException           When the index cannot be initialized
     */
    public static MetadataStore open(Path storePath) throws IOException {
        ObjectStore objectStore = ObjectStoreFactory.getDefaultObjectStore(storePath);
        return new MetadataStore(objectStore, new FileVersionIndexManager(storePath));
    }

    public ObjectStore getObjectStore() {
        return objectStore;
    }

    public VersionIndexManager getIndexManager() {
        return indexManager;
    }

    public Path getStorePath() {
        return objectStore.getStorePath();
    }

    /**
     * Store a record in canonical form
     *
     * @param record Metadata record
     * @return Ref of the stored record
     */
    public ObjectRef putRecord(MetadataRecord record) throws IOException, NoSuchAlgorithmException,
        InterruptedException {
        return objectStore.put(RecordCodec.toBytes(record));
    }

    /**
     * Read a stored record
     *
     * @param objectRef Ref of the record
     * @return MetadataRecord
     * @throws ObjectNotFoundException When the ref does not exist
     * @throws ConsistencyException    When the blob is not a valid record
     * @throws IOException             When the blob cannot be read
     */
    public MetadataRecord getRecord(ObjectRef objectRef) throws IOException {
        byte[] blob = objectStore.getBytes(objectRef);
        try {
            return RecordCodec.fromBytes(blob);

        } catch (MetadataKeyException | IOException e) {
            String errMsg = "Blob is not a valid metadata record: " + objectRef + ". "
                + e.getMessage();
            logStore.error(errMsg);
            throw new ConsistencyException(errMsg, objectRef.getHexDigest());
        }
    }

    @Override
    public String toString() {
        return "MetadataStore{" + getStorePath() + "}";
    }
}
