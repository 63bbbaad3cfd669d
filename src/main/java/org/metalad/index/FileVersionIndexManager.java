package org.metalad.index;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.ObjectRef;
import org.metalad.exceptions.VersionIndexNotFoundException;
import org.metalad.filestore.FileStoreUtility;
import org.metalad.record.MetadataPath;

/**
 * FileVersionIndexManager persists version indexes below `index/` of a store path.
 *
 * <pre>
 * index/version.json                       index schema version
 * index/tmp/                               generations being written
 * index/&lt;uuid, 3 levels&gt;/versions.json     dataset id and its versions in seal order
 * index/&lt;uuid, 3 levels&gt;/&lt;sha256(version), 2 levels&gt;/HEAD
 *                                          number of the current generation
 * index/&lt;uuid&gt;/&lt;version&gt;/g&lt;N&gt;/              one directory per generation:
 *     version-index.json, dataset-level-metadata.id, file-tree.json, dataset-tree.json
 * </pre>
 *
 * A generation directory is written below `index/tmp` and moved into place atomically, a new
 * version is listed in `versions.json`, then HEAD is replaced atomically. Readers that follow
 * HEAD therefore only see complete generations. A generation directory above HEAD left by an
 * interrupted seal is never reused, the next seal takes the following number. Heads are cached
 * in memory and revalidated against HEAD.
 */
public class FileVersionIndexManager implements VersionIndexManager {
    private static final Log logIndex = LogFactory.getLog(FileVersionIndexManager.class);
    private static final int TIME_OUT_MILLISEC = 1000;
    private static final Collection<String> indexLockedDatasets = new ArrayList<>(100);

    public static final String INDEX_SCHEMA_VERSION = "1.0";
    public static final String VERSION_JSON = "version.json";
    public static final String VERSIONS_JSON = "versions.json";
    public static final String HEAD = "HEAD";
    public static final String VERSION_INDEX_JSON = "version-index.json";
    public static final String DATASET_LEVEL_METADATA_ID = "dataset-level-metadata.id";
    public static final String FILE_TREE_JSON = "file-tree.json";
    public static final String DATASET_TREE_JSON = "dataset-tree.json";

    private static final String VERSION_DIGEST_ALGORITHM = "SHA-256";

    private final Path INDEX_DIRECTORY;
    private final Path INDEX_TMP_DIRECTORY;
    private final String lockPrefix;
    private final ObjectMapper mapper = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
        .configure(SerializationFeature.INDENT_OUTPUT, true);
    private final Map<Path, VersionIndex> headCache = new ConcurrentHashMap<>();

    /**
     * Open or create the index below the given store path
     *
     * @param storePath Root directory of the store
     * @throws IOException           When the index directories cannot be created
     * @throws IllegalStateException When the index was written with an unsupported schema
     */
    public FileVersionIndexManager(Path storePath) throws IOException, IllegalStateException {
        FileStoreUtility.ensureNotNull(storePath, "storePath", "FileVersionIndexManager");
        INDEX_DIRECTORY = storePath.resolve("index");
        INDEX_TMP_DIRECTORY = INDEX_DIRECTORY.resolve("tmp");
        lockPrefix = INDEX_DIRECTORY.toAbsolutePath().normalize() + "|";

        try {
            Files.createDirectories(INDEX_TMP_DIRECTORY);

        } catch (IOException ioe) {
            logIndex.fatal("Unable to create index directories at: " + INDEX_DIRECTORY + ". "
                               + ioe.getMessage());
            throw ioe;
        }
        verifyIndexSchemaVersion();
    }

    /**
     * Write `version.json` if it is missing, otherwise check that its major version is supported
     */
    protected void verifyIndexSchemaVersion() throws IOException, IllegalStateException {
        Path versionJson = INDEX_DIRECTORY.resolve(VERSION_JSON);
        if (!Files.exists(versionJson)) {
            Map<String, Object> content = new LinkedHashMap<>();
            content.put("index_schema_version", INDEX_SCHEMA_VERSION);
            FileStoreUtility.replaceAtomically(
                versionJson, mapper.writeValueAsBytes(content), INDEX_TMP_DIRECTORY);
            logIndex.debug("version.json written to: " + versionJson);
            return;
        }

        Map<String, Object> content = readJson(versionJson);
        Object schemaVersion = content.get("index_schema_version");
        String existingMajor = String.valueOf(schemaVersion).split("\\.")[0];
        String supportedMajor = INDEX_SCHEMA_VERSION.split("\\.")[0];
        if (!supportedMajor.equals(existingMajor)) {
            String errMsg = "Unsupported index schema version: " + schemaVersion + " in "
                + versionJson + ". Supported: " + INDEX_SCHEMA_VERSION;
            logIndex.fatal(errMsg);
            throw new IllegalStateException(errMsg);
        }
    }

    @Override
    public VersionIndex seal(UUID datasetId, String datasetVersion, List<IndexUpdate> updates)
        throws IOException, InterruptedException {
        return seal(datasetId, datasetVersion, updates, null);
    }

    @Override
    public VersionIndex seal(
        UUID datasetId, String datasetVersion, List<IndexUpdate> updates,
        Containment containment) throws IOException, InterruptedException {
        FileStoreUtility.ensureNotNull(datasetId, "datasetId", "seal");
        FileStoreUtility.ensureNotNull(datasetVersion, "datasetVersion", "seal");
        FileStoreUtility.ensureNotNull(updates, "updates", "seal");
        if (datasetVersion.isEmpty()) {
            throw new IllegalArgumentException("Calling Method: seal(): datasetVersion cannot be"
                                                   + " empty.");
        }

        String lockId = lockPrefix + datasetId;
        synchronizeIndexLockedDatasets(lockId);
        try {
            Path versionDirectory = getVersionDirectory(datasetId, datasetVersion);
            VersionIndex head = readHead(versionDirectory);
            VersionIndex base = head != null ? head : VersionIndex.empty(datasetId, datasetVersion);
            // Generations above HEAD are left over from interrupted seals, never reuse their number
            int nextGeneration = Math.max(
                base.getGeneration(), highestGeneration(versionDirectory)) + 1;
            VersionIndex sealed = base.apply(
                updates, containment, System.currentTimeMillis(), nextGeneration);

            Path tmpGeneration = FileStoreUtility.generateTmpDirectory("g", INDEX_TMP_DIRECTORY);
            try {
                writeGeneration(tmpGeneration, sealed);
                Path generationDirectory = versionDirectory.resolve("g" + sealed.getGeneration());
                if (!FileStoreUtility.atomicMove(tmpGeneration, generationDirectory)) {
                    String errMsg = "Generation directory already exists: " + generationDirectory;
                    logIndex.error(errMsg);
                    throw new IOException(errMsg);
                }

            } finally {
                FileStoreUtility.deleteRecursively(tmpGeneration);
            }

            if (head == null) {
                appendVersion(datasetId, datasetVersion);
            }
            FileStoreUtility.replaceAtomically(
                versionDirectory.resolve(HEAD),
                String.valueOf(sealed.getGeneration()).getBytes(StandardCharsets.UTF_8),
                INDEX_TMP_DIRECTORY);
            headCache.put(versionDirectory, sealed);
            logIndex.debug("Sealed " + sealed + " with " + updates.size() + " updates");
            return sealed;

        } finally {
            releaseIndexLockedDatasets(lockId);
        }
    }

    @Override
    public VersionIndex get(UUID datasetId, String datasetVersion)
        throws VersionIndexNotFoundException, IOException {
        FileStoreUtility.ensureNotNull(datasetId, "datasetId", "get");
        FileStoreUtility.ensureNotNull(datasetVersion, "datasetVersion", "get");
        VersionIndex head = readHead(getVersionDirectory(datasetId, datasetVersion));
        if (head == null) {
            String errMsg = "No version index for dataset " + datasetId + "@" + datasetVersion;
            logIndex.debug(errMsg);
            throw new VersionIndexNotFoundException(errMsg);
        }
        return head;
    }

    @Override
    public boolean contains(UUID datasetId, String datasetVersion) throws IOException {
        return Files.exists(getVersionDirectory(datasetId, datasetVersion).resolve(HEAD));
    }

    @Override
    public List<String> getVersions(UUID datasetId) throws IOException {
        FileStoreUtility.ensureNotNull(datasetId, "datasetId", "getVersions");
        List<String> versions = new ArrayList<>();
        for (String datasetVersion : readListedVersions(datasetId)) {
            // An interrupted first seal may list a version before its HEAD exists
            if (contains(datasetId, datasetVersion)) {
                versions.add(datasetVersion);
            }
        }
        return versions;
    }

    /**
     * @return Content of `versions.json`, empty if the dataset is unknown
     */
    private List<String> readListedVersions(UUID datasetId) throws IOException {
        List<String> versions = new ArrayList<>();
        Path versionsJson = getDatasetDirectory(datasetId).resolve(VERSIONS_JSON);
        if (!Files.exists(versionsJson)) {
            return versions;
        }
        Map<String, Object> content = readJson(versionsJson);
        for (Object version : (List<?>) content.get("versions")) {
            versions.add(String.valueOf(version));
        }
        return versions;
    }

    @Override
    public String getLatestVersion(UUID datasetId) throws IOException {
        List<String> versions = getVersions(datasetId);
        for (int i = versions.size() - 1; i >= 0; i--) {
            if (contains(datasetId, versions.get(i))) {
                return versions.get(i);
            }
        }
        return null;
    }

    @Override
    public Set<UUID> getDatasetIds() throws IOException {
        Set<UUID> datasetIds = new HashSet<>();
        for (Path file : FileStoreUtility.getFilesFromDir(INDEX_DIRECTORY)) {
            if (file.startsWith(INDEX_TMP_DIRECTORY)
                || !file.getFileName().toString().equals(VERSIONS_JSON)) {
                continue;
            }
            datasetIds.add(UUID.fromString(String.valueOf(readJson(file).get("dataset_id"))));
        }
        return datasetIds;
    }

    @Override
    public List<IndexMatch> resolve(UUID datasetId, String pathPattern, String versionPattern)
        throws IOException {
        FileStoreUtility.ensureNotNull(datasetId, "datasetId", "resolve");
        List<String> versions = new ArrayList<>();
        if (versionPattern == null || versionPattern.equals("latest")) {
            String latest = getLatestVersion(datasetId);
            if (latest != null) {
                versions.add(latest);
            }
        } else if (versionPattern.equals("*")) {
            versions.addAll(getVersions(datasetId));
        } else if (contains(datasetId, versionPattern)) {
            versions.add(versionPattern);
        }

        GlobPattern pattern = GlobPattern.compile(pathPattern);
        List<IndexMatch> matches = new ArrayList<>();
        for (String version : versions) {
            matches.addAll(get(datasetId, version).match(pattern));
        }
        return matches;
    }

    /**
     * @return Directory of a dataset: the dataset id split into 3 levels of 2 characters
     */
    protected Path getDatasetDirectory(UUID datasetId) {
        return INDEX_DIRECTORY.resolve(
            FileStoreUtility.getHierarchicalPathString(3, 2, datasetId.toString()));
    }

    /**
     * @return Directory of a dataset version: the SHA-256 of the version split into 2 levels of 2
     * characters below the dataset directory
     */
    protected Path getVersionDirectory(UUID datasetId, String datasetVersion) {
        try {
            String versionDigest = FileStoreUtility.getStringHexDigest(
                datasetVersion, VERSION_DIGEST_ALGORITHM);
            return getDatasetDirectory(datasetId).resolve(
                FileStoreUtility.getHierarchicalPathString(2, 2, versionDigest));

        } catch (NoSuchAlgorithmException nsae) {
            String errMsg = VERSION_DIGEST_ALGORITHM + " is not available: " + nsae.getMessage();
            logIndex.fatal(errMsg);
            throw new IllegalStateException(errMsg, nsae);
        }
    }

    /**
     * Read the head generation of a version directory, from the cache if it is current
     *
     * @return Head or null if the version was never sealed
     */
    protected VersionIndex readHead(Path versionDirectory) throws IOException {
        Path headFile = versionDirectory.resolve(HEAD);
        if (!Files.exists(headFile)) {
            return null;
        }
        int generation = Integer.parseInt(
            new String(Files.readAllBytes(headFile), StandardCharsets.UTF_8).trim());
        VersionIndex cached = headCache.get(versionDirectory);
        if (cached != null && cached.getGeneration() == generation) {
            return cached;
        }
        VersionIndex head = readGeneration(versionDirectory.resolve("g" + generation));
        headCache.put(versionDirectory, head);
        return head;
    }

    protected void writeGeneration(Path directory, VersionIndex index) throws IOException {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("index_schema_version", INDEX_SCHEMA_VERSION);
        header.put("dataset_id", index.getDatasetId().toString());
        header.put("dataset_version", index.getDatasetVersion());
        header.put("generation", index.getGeneration());
        header.put("sealed_time", index.getSealedTime());
        Containment containment = index.getContainment();
        if (containment != null) {
            Map<String, Object> containmentMap = new LinkedHashMap<>();
            containmentMap.put("root_dataset_id", containment.getRootDatasetId().toString());
            containmentMap.put("root_dataset_version", containment.getRootDatasetVersion());
            containmentMap.put("dataset_path", containment.getDatasetPath().toString());
            header.put("containment", containmentMap);
        } else {
            header.put("containment", null);
        }
        mapper.writeValue(directory.resolve(VERSION_INDEX_JSON).toFile(), header);

        if (index.getDatasetLevelRef() != null) {
            Files.write(
                directory.resolve(DATASET_LEVEL_METADATA_ID),
                index.getDatasetLevelRef().getHexDigest().getBytes(StandardCharsets.UTF_8));
        }

        Map<String, String> fileTree = new TreeMap<>();
        for (Map.Entry<MetadataPath, ObjectRef> entry : index.getFileTree().entrySet()) {
            fileTree.put(entry.getKey().toString(), entry.getValue().getHexDigest());
        }
        mapper.writeValue(directory.resolve(FILE_TREE_JSON).toFile(), fileTree);

        Map<String, Object> datasetTree = new TreeMap<>();
        for (Map.Entry<MetadataPath, SubDatasetEntry> entry : index.getDatasetTree().entrySet()) {
            SubDatasetEntry subDataset = entry.getValue();
            Map<String, Object> subDatasetMap = new LinkedHashMap<>();
            subDatasetMap.put("dataset_id", subDataset.getDatasetId().toString());
            subDatasetMap.put("dataset_version", subDataset.getDatasetVersion());
            subDatasetMap.put(
                "dataset_level_metadata", subDataset.getDatasetLevelRef() == null
                    ? null : subDataset.getDatasetLevelRef().getHexDigest());
            datasetTree.put(entry.getKey().toString(), subDatasetMap);
        }
        mapper.writeValue(directory.resolve(DATASET_TREE_JSON).toFile(), datasetTree);
    }

    protected VersionIndex readGeneration(Path directory) throws IOException {
        Map<String, Object> header = readJson(directory.resolve(VERSION_INDEX_JSON));
        UUID datasetId = UUID.fromString(String.valueOf(header.get("dataset_id")));
        String datasetVersion = String.valueOf(header.get("dataset_version"));
        int generation = ((Number) header.get("generation")).intValue();
        long sealedTime = ((Number) header.get("sealed_time")).longValue();

        Containment containment = null;
        Object containmentValue = header.get("containment");
        if (containmentValue instanceof Map) {
            Map<?, ?> containmentMap = (Map<?, ?>) containmentValue;
            Object rootVersion = containmentMap.get("root_dataset_version");
            containment = new Containment(
                UUID.fromString(String.valueOf(containmentMap.get("root_dataset_id"))),
                rootVersion == null ? null : rootVersion.toString(),
                MetadataPath.of(String.valueOf(containmentMap.get("dataset_path"))));
        }

        ObjectRef datasetLevelRef = null;
        Path datasetLevelFile = directory.resolve(DATASET_LEVEL_METADATA_ID);
        if (Files.exists(datasetLevelFile)) {
            datasetLevelRef = ObjectRef.of(
                new String(Files.readAllBytes(datasetLevelFile), StandardCharsets.UTF_8));
        }

        Map<MetadataPath, ObjectRef> fileTree = new TreeMap<>();
        Map<String, String> fileTreeJson = mapper.readValue(
            directory.resolve(FILE_TREE_JSON).toFile(), new TypeReference<Map<String, String>>() {
            });
        for (Map.Entry<String, String> entry : fileTreeJson.entrySet()) {
            fileTree.put(MetadataPath.of(entry.getKey()), ObjectRef.of(entry.getValue()));
        }

        Map<MetadataPath, SubDatasetEntry> datasetTree = new TreeMap<>();
        Map<String, Map<String, String>> datasetTreeJson = mapper.readValue(
            directory.resolve(DATASET_TREE_JSON).toFile(),
            new TypeReference<Map<String, Map<String, String>>>() {
            });
        for (Map.Entry<String, Map<String, String>> entry : datasetTreeJson.entrySet()) {
            Map<String, String> subDataset = entry.getValue();
            String ref = subDataset.get("dataset_level_metadata");
            datasetTree.put(MetadataPath.of(entry.getKey()), new SubDatasetEntry(
                UUID.fromString(subDataset.get("dataset_id")), subDataset.get("dataset_version"),
                ref == null ? null : ObjectRef.of(ref)));
        }

        return new VersionIndex(datasetId, datasetVersion, generation, sealedTime,
                                datasetLevelRef, fileTree, datasetTree, containment);
    }

    /**
     * Highest generation directory of a version, sealed or not
     *
     * @return Generation number, 0 if there is none
     */
    protected int highestGeneration(Path versionDirectory) throws IOException {
        int highest = 0;
        if (!Files.isDirectory(versionDirectory)) {
            return highest;
        }
        List<Path> entries;
        try (Stream<Path> stream = Files.list(versionDirectory)) {
            entries = stream.collect(Collectors.toList());
        }
        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            if (Files.isDirectory(entry) && name.matches("g[0-9]+")) {
                highest = Math.max(highest, Integer.parseInt(name.substring(1)));
            }
        }
        return highest;
    }

    /**
     * Append a version to `versions.json` of its dataset, called with the dataset lock held.
     * A version that is already listed is not added again.
     */
    protected void appendVersion(UUID datasetId, String datasetVersion) throws IOException {
        List<String> versions = readListedVersions(datasetId);
        if (versions.contains(datasetVersion)) {
            return;
        }
        versions.add(datasetVersion);
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("dataset_id", datasetId.toString());
        content.put("versions", versions);
        FileStoreUtility.replaceAtomically(
            getDatasetDirectory(datasetId).resolve(VERSIONS_JSON),
            mapper.writeValueAsBytes(content), INDEX_TMP_DIRECTORY);
    }

    private Map<String, Object> readJson(Path file) throws IOException {
        File jsonFile = file.toFile();
        try {
            return mapper.readValue(jsonFile, new TypeReference<Map<String, Object>>() {
            });

        } catch (IOException ioe) {
            String errMsg = "Unable to read index file: " + file + ". " + ioe.getMessage();
            logIndex.error(errMsg);
            throw ioe;
        }
    }

    /**
     * Seals of one dataset read its versions and heads and must not interleave.
     *
     * @param lockId Store and dataset id
     * @throws InterruptedException When waiting is interrupted
     */
    private static void synchronizeIndexLockedDatasets(String lockId)
        throws InterruptedException {
        synchronized (indexLockedDatasets) {
            while (indexLockedDatasets.contains(lockId)) {
                try {
                    indexLockedDatasets.wait(TIME_OUT_MILLISEC);

                } catch (InterruptedException ie) {
                    String errMsg =
                        "Synchronization has been interrupted while trying to sync dataset: "
                            + lockId;
                    logIndex.error(errMsg);
                    throw new InterruptedException(errMsg);
                }
            }
            logIndex.debug("Synchronizing indexLockedDatasets for: " + lockId);
            indexLockedDatasets.add(lockId);
        }
    }

    private static void releaseIndexLockedDatasets(String lockId) {
        synchronized (indexLockedDatasets) {
            logIndex.debug("Releasing indexLockedDatasets for: " + lockId);
            indexLockedDatasets.remove(lockId);
            indexLockedDatasets.notifyAll();
        }
    }
}
