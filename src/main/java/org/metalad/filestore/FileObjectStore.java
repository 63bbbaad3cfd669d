package org.metalad.filestore;

import java.io.BufferedWriter;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Properties;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import javax.xml.bind.DatatypeConverter;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.ObjectRef;
import org.metalad.ObjectStore;
import org.metalad.exceptions.ConsistencyException;
import org.metalad.exceptions.ObjectNotFoundException;

/**
 * FileObjectStore is an ObjectStore adapter class that stores blobs in a sharded directory tree
 * below `objects/` of a given store path. To instantiate FileObjectStore, the calling app must
 * provide the properties described by its single constructor.
 */
public class FileObjectStore implements ObjectStore {
    private static final Log logObjectStore = LogFactory.getLog(FileObjectStore.class);
    private static final int TIME_OUT_MILLISEC = 1000;
    private static final Collection<String> objectLockedRefs = new ArrayList<>(100);
    private final Path STORE_ROOT;
    private final int DIRECTORY_DEPTH;
    private final int DIRECTORY_WIDTH;
    private final String OBJECT_STORE_ALGORITHM;
    private final Path OBJECT_STORE_DIRECTORY;
    private final Path OBJECT_TMP_FILE_DIRECTORY;

    public static final String OBJECTSTORE_YAML = "objectstore.yaml";

    public static final String[] SUPPORTED_HASH_ALGORITHMS = {"MD5", "SHA-1", "SHA-256",
        "SHA-384", "SHA-512", "SHA-512/224", "SHA-512/256"};

    public static final String DEFAULT_ALGORITHM = "SHA-256";
    public static final int DEFAULT_DEPTH = 2;
    public static final int DEFAULT_WIDTH = 2;

    public enum ObjectStoreProperties {
        storePath, storeDepth, storeWidth, storeAlgorithm
    }

    /**
     * Constructor to initialize FileObjectStore, properties are required. Upon initialization,
     * if an existing config file (objectstore.yaml) is present, it is verified against the
     * supplied properties. If not, FileObjectStore checks that no `objects` directory exists at
     * the supplied store path before initializing.
     *
     * @param storeProperties Properties object with the following keys: storePath, storeDepth,
     *                        storeWidth, storeAlgorithm
     * @throws IllegalArgumentException Constructor arguments cannot be null, empty or less than 1,
     *                                  or do not match an existing configuration
     * @throws IllegalStateException    Store directories exist but the configuration is missing
     * @throws IOException              Issue with creating directories
     * @throws NoSuchAlgorithmException Unsupported store algorithm
     */
    public FileObjectStore(Properties storeProperties) throws IllegalArgumentException,
        IOException, NoSuchAlgorithmException {
        logObjectStore.debug("Initializing FileObjectStore");
        FileStoreUtility.ensureNotNull(
            storeProperties, "storeProperties", "FileObjectStore - constructor"
        );
        String storePathString = storeProperties.getProperty(
            ObjectStoreProperties.storePath.name()
        );
        FileStoreUtility.ensureNotNull(
            storePathString, "storePath", "FileObjectStore - constructor"
        );

        Path storePath = Paths.get(storePathString);
        int storeDepth = parseIntProperty(storeProperties, ObjectStoreProperties.storeDepth,
                                          DEFAULT_DEPTH);
        int storeWidth = parseIntProperty(storeProperties, ObjectStoreProperties.storeWidth,
                                          DEFAULT_WIDTH);
        String storeAlgorithm = storeProperties.getProperty(
            ObjectStoreProperties.storeAlgorithm.name(), DEFAULT_ALGORITHM
        );

        verifyObjectStoreProperties(storePath, storeDepth, storeWidth, storeAlgorithm);

        STORE_ROOT = storePath;
        DIRECTORY_DEPTH = storeDepth;
        DIRECTORY_WIDTH = storeWidth;
        OBJECT_STORE_ALGORITHM = storeAlgorithm;
        OBJECT_STORE_DIRECTORY = storePath.resolve("objects");
        OBJECT_TMP_FILE_DIRECTORY = OBJECT_STORE_DIRECTORY.resolve("tmp");

        try {
            Files.createDirectories(OBJECT_TMP_FILE_DIRECTORY);
            logObjectStore.debug("Created store and store tmp directories.");

        } catch (IOException ioe) {
            logObjectStore.fatal("Failed to initialize FileObjectStore - unable to create"
                                     + " directories. Exception: " + ioe.getMessage());
            throw ioe;
        }

        Path objectStoreYaml = STORE_ROOT.resolve(OBJECTSTORE_YAML);
        if (!Files.exists(objectStoreYaml)) {
            writeObjectStoreYaml(
                buildObjectStoreYamlString(DIRECTORY_DEPTH, DIRECTORY_WIDTH, OBJECT_STORE_ALGORITHM)
            );
            logObjectStore.info("objectstore.yaml written to storePath: " + objectStoreYaml);
        }
        logObjectStore.debug(
            "FileObjectStore initialized. Store Depth: " + DIRECTORY_DEPTH + ". Store Width: "
                + DIRECTORY_WIDTH + ". Store Algorithm: " + OBJECT_STORE_ALGORITHM);
    }

    private static int parseIntProperty(
        Properties properties, ObjectStoreProperties key, int defaultValue) {
        String value = properties.getProperty(key.name());
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());

        } catch (NumberFormatException nfe) {
            String errMsg = "Property " + key.name() + " is not an integer: " + value;
            logObjectStore.error(errMsg);
            throw new IllegalArgumentException(errMsg);
        }
    }

    // Configuration and Initialization Related Methods

    /**
     * Determines whether FileObjectStore can instantiate by validating a set of arguments. If the
     * configuration file (`objectstore.yaml`) exists, its properties are compared with the given
     * values and a mismatch throws an exception. If not, an existing `objects` directory at the
     * store path throws an exception.
     *
     * @param storePath      Path where the store keeps its blobs
     * @param storeDepth     Depth of directories
     * @param storeWidth     Width of directories
     * @param storeAlgorithm Algorithm to use when calculating object addresses
     * @throws NoSuchAlgorithmException If algorithm supplied is not supported
     * @throws IOException              If `objectstore.yaml` cannot be read
     * @throws IllegalArgumentException If depth or width is less than 1, or config mismatch
     * @throws IllegalStateException    If the objects directory exists, but the config is missing
     */
    protected void verifyObjectStoreProperties(
        Path storePath, int storeDepth, int storeWidth, String storeAlgorithm
    ) throws NoSuchAlgorithmException, IOException, IllegalArgumentException,
        IllegalStateException {
        if (storeDepth <= 0 || storeWidth <= 0) {
            String errMsg =
                "Depth and width must be > than 0. Depth: " + storeDepth + ". Width: " + storeWidth;
            logObjectStore.fatal(errMsg);
            throw new IllegalArgumentException(errMsg);
        }
        validateAlgorithm(storeAlgorithm);

        Path objectStoreYaml = storePath.resolve(OBJECTSTORE_YAML);
        if (Files.exists(objectStoreYaml)) {
            logObjectStore.debug("objectstore.yaml found, checking properties.");
            HashMap<String, Object> properties = loadObjectStoreYaml(storePath);
            FileStoreUtility.checkObjectEquality(
                "store depth", storeDepth, properties.get(ObjectStoreProperties.storeDepth.name()));
            FileStoreUtility.checkObjectEquality(
                "store width", storeWidth, properties.get(ObjectStoreProperties.storeWidth.name()));
            FileStoreUtility.checkObjectEquality(
                "store algorithm", storeAlgorithm,
                properties.get(ObjectStoreProperties.storeAlgorithm.name()));
            logObjectStore.debug("objectstore.yaml found and ObjectStore verified");

        } else {
            Path objectsDirectory = storePath.resolve("objects");
            if (Files.isDirectory(objectsDirectory)) {
                String errMsg = "FileObjectStore - Unable to initialize ObjectStore."
                    + " `objectstore.yaml` is not found but potential conflicting directory"
                    + " exists: " + objectsDirectory + ". Please choose a new folder or delete"
                    + " the conflicting directory and try again.";
                logObjectStore.fatal(errMsg);
                throw new IllegalStateException(errMsg);
            }
        }
    }

    /**
     * Get the properties of the store from an existing 'objectstore.yaml'
     *
     * @param storePath Path to root of store
     * @return HashMap of the properties
     * @throws IOException If `objectstore.yaml` cannot be read
     */
    protected HashMap<String, Object> loadObjectStoreYaml(Path storePath) throws IOException {
        File objectStoreYamlFile = storePath.resolve(OBJECTSTORE_YAML).toFile();
        ObjectMapper om = new ObjectMapper(new YAMLFactory());
        HashMap<String, Object> properties = new HashMap<>();

        try {
            HashMap<?, ?> yamlProperties = om.readValue(objectStoreYamlFile, HashMap.class);
            properties.put(ObjectStoreProperties.storeDepth.name(), yamlProperties.get("store_depth"));
            properties.put(ObjectStoreProperties.storeWidth.name(), yamlProperties.get("store_width"));
            properties.put(
                ObjectStoreProperties.storeAlgorithm.name(), yamlProperties.get("store_algorithm")
            );

        } catch (IOException ioe) {
            logObjectStore.fatal(
                "Unable to retrieve 'objectstore.yaml'. IOException: " + ioe.getMessage());
            throw ioe;
        }
        return properties;
    }

    /**
     * Write a 'objectstore.yaml' file to STORE_ROOT
     *
     * @param yamlString Content of the configuration
     * @throws IOException If unable to write `objectstore.yaml`
     */
    protected void writeObjectStoreYaml(String yamlString) throws IOException {
        Path objectStoreYaml = STORE_ROOT.resolve(OBJECTSTORE_YAML);

        try (BufferedWriter writer = new BufferedWriter(
            new OutputStreamWriter(Files.newOutputStream(objectStoreYaml), StandardCharsets.UTF_8)
        )) {
            writer.write(yamlString);

        } catch (IOException ioe) {
            logObjectStore.fatal(
                "Unable to write 'objectstore.yaml'. IOException: " + ioe.getMessage());
            throw ioe;
        }
    }

    /**
     * Build the content of the configuration file 'objectstore.yaml'
     *
     * @param storeDepth     Depth of store
     * @param storeWidth     Width of store
     * @param storeAlgorithm Algorithm that calculates the address of a blob
     * @return String representing the contents of 'objectstore.yaml'
     */
    protected String buildObjectStoreYamlString(
        int storeDepth, int storeWidth, String storeAlgorithm) {
        return String.format(
            "# Configuration of the metadata object store\n\n"
                + "############### Directory Structure ###############\n"
                + "# Number of directories when sharding a blob address\n"
                + "store_depth: %d  # WARNING: DO NOT CHANGE UNLESS SETTING UP NEW STORE\n"
                + "# Width of each directory when sharding a blob address\n"
                + "store_width: %d  # WARNING: DO NOT CHANGE UNLESS SETTING UP NEW STORE\n"
                + "# Example with depth 2 and width 2:\n"
                + "#    objects\n" + "#    └── 7f\n" + "#        └── 5c\n"
                + "#            └── c18f0b04e812a3b4c8f686ce34e6fec558804bf61e54b176742a7f6368d6\n\n"
                + "############### Hash Algorithm ###############\n"
                + "# Algorithm that calculates the address of a blob\n"
                + "store_algorithm: \"%s\"\n", storeDepth, storeWidth, storeAlgorithm
        );
    }

    /**
     * Checks whether a given algorithm is supported
     *
     * @param algorithm String value (ex. SHA-256)
     * @throws IllegalArgumentException Algorithm cannot be null or empty
     * @throws NoSuchAlgorithmException Algorithm not supported
     */
    protected void validateAlgorithm(String algorithm) throws IllegalArgumentException,
        NoSuchAlgorithmException {
        FileStoreUtility.checkForEmptyAndValidString(algorithm, "algorithm", "validateAlgorithm");
        if (!Arrays.asList(SUPPORTED_HASH_ALGORITHMS).contains(algorithm)) {
            String errMsg = "Algorithm not supported: " + algorithm + ". Supported algorithms: "
                + Arrays.toString(SUPPORTED_HASH_ALGORITHMS);
            logObjectStore.error(errMsg);
            throw new NoSuchAlgorithmException(errMsg);
        }
    }

    // ObjectStore Public API Methods

    @Override
    public ObjectRef put(InputStream content) throws IOException, ConsistencyException,
        NoSuchAlgorithmException, InterruptedException {
        FileStoreUtility.ensureNotNull(content, "content", "put");

        File tmpFile = FileStoreUtility.generateTmpFile("tmp", OBJECT_TMP_FILE_DIRECTORY);
        String hexDigest;
        try {
            hexDigest = writeToTmpFileAndGenerateDigest(tmpFile, content);

        } catch (IOException ioe) {
            Files.deleteIfExists(tmpFile.toPath());
            String errMsg = "Unexpected exception while writing blob. " + ioe.getMessage();
            logObjectStore.error(errMsg);
            throw new IOException(errMsg, ioe);
        }

        ObjectRef objectRef = ObjectRef.of(hexDigest);
        Path objRealPath = getObjectPath(objectRef);

        try {
            synchronizeObjectLockedRefs(hexDigest);

        } catch (InterruptedException ie) {
            Files.deleteIfExists(tmpFile.toPath());
            throw ie;
        }
        try {
            if (!Files.exists(objRealPath)) {
                FileStoreUtility.atomicMove(tmpFile.toPath(), objRealPath);
                logObjectStore.debug("Stored blob: " + objRealPath);

            } else {
                // The digest matches, the bytes must too
                long mismatch = Files.mismatch(tmpFile.toPath(), objRealPath);
                Files.deleteIfExists(tmpFile.toPath());
                if (mismatch != -1) {
                    String errMsg = "Blob already exists with different content for ref: "
                        + hexDigest + ". First differing byte: " + mismatch;
                    logObjectStore.error(errMsg);
                    throw new ConsistencyException(errMsg, hexDigest);
                }
                logObjectStore.debug("Blob already exists, skipping put for ref: " + hexDigest);
            }

        } finally {
            releaseObjectLockedRefs(hexDigest);
            Files.deleteIfExists(tmpFile.toPath());
        }
        return objectRef;
    }

    @Override
    public ObjectRef put(byte[] content) throws IOException, ConsistencyException,
        NoSuchAlgorithmException, InterruptedException {
        FileStoreUtility.ensureNotNull(content, "content", "put");
        return put(new ByteArrayInputStream(content));
    }

    @Override
    public InputStream get(ObjectRef objectRef) throws ObjectNotFoundException, IOException {
        FileStoreUtility.ensureNotNull(objectRef, "objectRef", "get");
        Path objRealPath = getObjectPath(objectRef);
        if (!Files.exists(objRealPath)) {
            String errMsg = "No blob found for ref: " + objectRef;
            logObjectStore.debug(errMsg);
            throw new ObjectNotFoundException(errMsg);
        }
        return Files.newInputStream(objRealPath);
    }

    @Override
    public byte[] getBytes(ObjectRef objectRef) throws ObjectNotFoundException, IOException {
        try (InputStream blob = get(objectRef)) {
            return blob.readAllBytes();
        }
    }

    @Override
    public boolean exists(ObjectRef objectRef) {
        FileStoreUtility.ensureNotNull(objectRef, "objectRef", "exists");
        return Files.exists(getObjectPath(objectRef));
    }

    @Override
    public long count() throws IOException {
        long count = 0;
        List<Path> files = FileStoreUtility.getFilesFromDir(OBJECT_STORE_DIRECTORY);
        for (Path file : files) {
            if (!file.startsWith(OBJECT_TMP_FILE_DIRECTORY)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public Path getStorePath() {
        return STORE_ROOT;
    }

    /**
     * @return Name of the algorithm that calculates blob addresses
     */
    public String getAlgorithm() {
        return OBJECT_STORE_ALGORITHM;
    }

    /**
     * Get the permanent path of a blob from its ObjectRef
     *
     * @param objectRef Content identifier
     * @return Path below `objects/`, which may not exist
     */
    protected Path getObjectPath(ObjectRef objectRef) {
        String objRelativePath = FileStoreUtility.getHierarchicalPathString(
            DIRECTORY_DEPTH, DIRECTORY_WIDTH, objectRef.getHexDigest()
        );
        return OBJECT_STORE_DIRECTORY.resolve(objRelativePath);
    }

    /**
     * Write the stream into a tmp file while calculating its digest with the store algorithm.
     * The stream is closed.
     *
     * @param tmpFile    File to write into
     * @param dataStream Stream of the blob
     * @return Lower-case hex digest of the content
     * @throws NoSuchAlgorithmException Store algorithm not supported
     * @throws IOException              Issue with reading the stream or writing the file
     */
    protected String writeToTmpFileAndGenerateDigest(File tmpFile, InputStream dataStream)
        throws NoSuchAlgorithmException, IOException {
        MessageDigest messageDigest = MessageDigest.getInstance(OBJECT_STORE_ALGORITHM);
        try (dataStream; FileOutputStream os = new FileOutputStream(tmpFile)) {
            byte[] buffer = new byte[8192];
            int bytesRead;
            while ((bytesRead = dataStream.read(buffer)) != -1) {
                os.write(buffer, 0, bytesRead);
                messageDigest.update(buffer, 0, bytesRead);
            }
            os.flush();
        }
        return DatatypeConverter.printHexBinary(messageDigest.digest()).toLowerCase();
    }

    /**
     * Multiple threads may put the same content, the move into the permanent address and the
     * comparison with an existing blob must be coordinated per ref.
     *
     * @param hexDigest Address of the blob
     * @throws InterruptedException When an issue occurs when attempting to sync the ref
     */
    private static void synchronizeObjectLockedRefs(String hexDigest) throws InterruptedException {
        synchronized (objectLockedRefs) {
            while (objectLockedRefs.contains(hexDigest)) {
                try {
                    objectLockedRefs.wait(TIME_OUT_MILLISEC);

                } catch (InterruptedException ie) {
                    String errMsg =
                        "Synchronization has been interrupted while trying to sync ref: "
                            + hexDigest;
                    logObjectStore.error(errMsg);
                    throw new InterruptedException(errMsg);
                }
            }
            logObjectStore.debug("Synchronizing objectLockedRefs for ref: " + hexDigest);
            objectLockedRefs.add(hexDigest);
        }
    }

    /**
     * Remove the given ref from 'objectLockedRefs' and notify other threads
     *
     * @param hexDigest Address of the blob
     */
    private static void releaseObjectLockedRefs(String hexDigest) {
        synchronized (objectLockedRefs) {
            logObjectStore.debug("Releasing objectLockedRefs for ref: " + hexDigest);
            objectLockedRefs.remove(hexDigest);
            objectLockedRefs.notifyAll();
        }
    }
}
