package org.metalad;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.security.NoSuchAlgorithmException;

import org.metalad.exceptions.ConsistencyException;
import org.metalad.exceptions.ObjectNotFoundException;

/**
 * ObjectStore is a content-addressable, append-only blob store. A blob is addressed by the hex
 * digest of its own content (its ObjectRef), so storing the same bytes twice yields the same
 * ObjectRef and keeps a single copy. Storage classes (like `FileObjectStore`) must implement this
 * interface.
 */
public interface ObjectStore {
        /**
         * The `put` method atomically stores the content of the given stream and returns its
         * ObjectRef. The content is first written to a temporary file while its digest is
         * calculated, and then published to its permanent address with an atomic move, so
         * concurrent readers never observe a partially written blob.
         *
         * `put` is idempotent. When a blob with the same digest already exists, its bytes are
         * compared with the new content; identical content makes the call a no-op, different
         * content (a digest collision or a corrupted blob) raises a ConsistencyException.
         *
         * @param content Input stream of the blob, closed by this method
         * @return ObjectRef of the stored blob
         * @throws IOException              I/O error when writing or moving the blob
         * @throws ConsistencyException     When the digest exists with different content
         * @throws NoSuchAlgorithmException When the store algorithm is not supported
         * @throws InterruptedException     When synchronizing on the ObjectRef is interrupted
         */
        ObjectRef put(InputStream content) throws IOException, ConsistencyException,
                NoSuchAlgorithmException, InterruptedException;

        /**
         * Overload of `put` for content that is already in memory
         */
        ObjectRef put(byte[] content) throws IOException, ConsistencyException,
                NoSuchAlgorithmException, InterruptedException;

        /**
         * The `get` method opens a stream to the blob with the given ObjectRef.
         *
         * @param objectRef Content identifier
         * @return InputStream to the blob, to be closed by the caller
         * @throws ObjectNotFoundException When no blob exists for the ObjectRef
         * @throws IOException             I/O error when opening the blob
         */
        InputStream get(ObjectRef objectRef) throws ObjectNotFoundException, IOException;

        /**
         * Read the whole blob with the given ObjectRef into memory.
         *
         * @param objectRef Content identifier
         * @return Content of the blob
         * @throws ObjectNotFoundException When no blob exists for the ObjectRef
         * @throws IOException             I/O error when reading the blob
         */
        byte[] getBytes(ObjectRef objectRef) throws ObjectNotFoundException, IOException;

        /**
         * @param objectRef Content identifier
         * @return True if a blob is stored for the ObjectRef
         */
        boolean exists(ObjectRef objectRef);

        /**
         * Count the blobs that are stored, excluding temporary files.
         *
         * @return Number of stored blobs
         * @throws IOException I/O error when walking the store
         */
        long count() throws IOException;

        /**
         * @return Root directory of the store
         */
        Path getStorePath();
}
