package org.metalad.dataset;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.filestore.FileStoreUtility;
import org.metalad.record.MetadataPath;

/**
 * FileSystemRepository is a RepositoryHandle for datasets kept as plain directories. A directory
 * is a dataset if it contains `.metalad/dataset.yaml` with the keys `dataset_id` and
 * `dataset_version`. The metadata store of the dataset lives in `.metalad/store`. A dataset
 * directory below another dataset is a sub-dataset of it.
 */
public class FileSystemRepository implements RepositoryHandle {
    private static final Log logRepository = LogFactory.getLog(FileSystemRepository.class);

    public static final String METALAD_DIRECTORY = ".metalad";
    public static final String DATASET_YAML = "dataset.yaml";
    public static final String STORE_DIRECTORY = "store";

    private final Path path;
    private final UUID datasetId;
    private final String datasetVersion;

    /**
     * Open the dataset at a directory
     *
     * @param path Dataset directory
     * @throws FileNotFoundException When the directory has no dataset descriptor
     * @throws IOException           When the descriptor cannot be read or is incomplete
     */
    public FileSystemRepository(Path path) throws IOException {
        FileStoreUtility.ensureNotNull(path, "path", "FileSystemRepository");
        this.path = path.toAbsolutePath().normalize();
        Path descriptor = descriptorPath(this.path);
        if (!Files.exists(descriptor)) {
            String errMsg = "Not a dataset, descriptor missing: " + descriptor;
            logRepository.debug(errMsg);
            throw new FileNotFoundException(errMsg);
        }

        ObjectMapper om = new ObjectMapper(new YAMLFactory());
        HashMap<?, ?> content = om.readValue(descriptor.toFile(), HashMap.class);
        Object id = content.get("dataset_id");
        Object version = content.get("dataset_version");
        if (id == null || version == null) {
            String errMsg = "Dataset descriptor requires dataset_id and dataset_version: "
                + descriptor;
            logRepository.error(errMsg);
            throw new IOException(errMsg);
        }
        try {
            this.datasetId = UUID.fromString(id.toString());

        } catch (IllegalArgumentException iae) {
            String errMsg = "Invalid dataset_id in " + descriptor + ": " + id;
            logRepository.error(errMsg);
            throw new IOException(errMsg, iae);
        }
        this.datasetVersion = version.toString();
    }

    /**
     * Create or update the dataset descriptor of a directory
     *
     * @param path           Dataset directory, created if missing
     * @param datasetId      Id of the dataset
     * @param datasetVersion Current version of the dataset
     * @return Handle of the dataset
     * @throws IOException When the descriptor cannot be written
     */
    public static FileSystemRepository create(Path path, UUID datasetId, String datasetVersion)
        throws IOException {
        FileStoreUtility.ensureNotNull(datasetId, "datasetId", "create");
        FileStoreUtility.checkForEmptyAndValidString(datasetVersion, "datasetVersion", "create");
        Path descriptor = descriptorPath(path);
        Files.createDirectories(descriptor.getParent());

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("dataset_id", datasetId.toString());
        content.put("dataset_version", datasetVersion);
        new ObjectMapper(new YAMLFactory()).writeValue(descriptor.toFile(), content);
        logRepository.debug("Wrote dataset descriptor: " + descriptor);
        return new FileSystemRepository(path);
    }

    /**
     * @return True if the directory is a dataset
     */
    public static boolean isDataset(Path directory) {
        return Files.isRegularFile(descriptorPath(directory));
    }

    private static Path descriptorPath(Path directory) {
        return directory.resolve(METALAD_DIRECTORY).resolve(DATASET_YAML);
    }

    private static boolean isHidden(Path entry) {
        return entry.getFileName().toString().startsWith(".");
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public UUID getDatasetId() {
        return datasetId;
    }

    @Override
    public String getCurrentVersion() {
        return datasetVersion;
    }

    @Override
    public Path getStorePath() {
        return path.resolve(METALAD_DIRECTORY).resolve(STORE_DIRECTORY);
    }

    @Override
    public Iterator<DatasetElement> enumerate(boolean recursive) {
        return new ElementIterator(this, recursive);
    }

    @Override
    public List<MetadataPath> getSubDatasets() throws IOException {
        List<MetadataPath> subDatasets = new ArrayList<>();
        Deque<Path> directories = new ArrayDeque<>();
        directories.push(path);
        while (!directories.isEmpty()) {
            for (Path entry : listSorted(directories.pop())) {
                if (isHidden(entry) || !Files.isDirectory(entry)) {
                    continue;
                }
                if (isDataset(entry)) {
                    subDatasets.add(MetadataPath.of(path.relativize(entry).toString()));
                } else {
                    directories.push(entry);
                }
            }
        }
        subDatasets.sort(null);
        return subDatasets;
    }

    @Override
    public RepositoryHandle openSubDataset(MetadataPath subPath) throws IOException {
        FileStoreUtility.ensureNotNull(subPath, "subPath", "openSubDataset");
        if (subPath.isRoot()) {
            throw new IllegalArgumentException("Sub-dataset path cannot be empty");
        }
        return new FileSystemRepository(path.resolve(subPath.toString()));
    }

    private static List<Path> listSorted(Path directory) throws IOException {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream.sorted().collect(Collectors.toList());
        }
    }

    @Override
    public String toString() {
        return "FileSystemRepository{" + path + ", " + datasetId + "@" + datasetVersion + "}";
    }

    /**
     * Depth first walk over the dataset tree that lists one directory at a time
     */
    private static class ElementIterator implements Iterator<DatasetElement> {
        private final FileSystemRepository root;
        private final boolean recursive;
        private final Deque<PendingDirectory> pending = new ArrayDeque<>();
        private final Deque<DatasetElement> buffer = new ArrayDeque<>();

        ElementIterator(FileSystemRepository root, boolean recursive) {
            this.root = root;
            this.recursive = recursive;
            buffer.add(new DatasetElement(
                ElementType.DATASET, root, MetadataPath.ROOT, MetadataPath.ROOT));
            pending.push(new PendingDirectory(root.path, root, MetadataPath.ROOT));
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !pending.isEmpty()) {
                expand(pending.pop());
            }
            return !buffer.isEmpty();
        }

        @Override
        public DatasetElement next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }

        private void expand(PendingDirectory pendingDirectory) {
            Path directory = pendingDirectory.directory;
            FileSystemRepository owner = pendingDirectory.owner;
            MetadataPath ownerPath = pendingDirectory.ownerPath;
            List<PendingDirectory> subDirectories = new ArrayList<>();
            try {
                for (Path entry : listSorted(directory)) {
                    if (isHidden(entry)) {
                        continue;
                    }
                    if (Files.isDirectory(entry)) {
                        if (isDataset(entry)) {
                            if (recursive) {
                                FileSystemRepository subDataset = new FileSystemRepository(entry);
                                MetadataPath subPath = MetadataPath.of(
                                    root.path.relativize(entry).toString());
                                buffer.add(new DatasetElement(
                                    ElementType.DATASET, subDataset, subPath, MetadataPath.ROOT));
                                subDirectories.add(new PendingDirectory(entry, subDataset, subPath));
                            }
                        } else {
                            subDirectories.add(new PendingDirectory(entry, owner, ownerPath));
                        }
                    } else {
                        MetadataPath localPath = MetadataPath.of(
                            owner.path.relativize(entry).toString());
                        buffer.add(new DatasetElement(ElementType.FILE, owner, ownerPath, localPath));
                    }
                }

            } catch (IOException ioe) {
                String errMsg = "Unable to enumerate directory: " + directory + ". "
                    + ioe.getMessage();
                logRepository.error(errMsg);
                throw new UncheckedIOException(errMsg, ioe);
            }
            // Keep the listing order when walking the sub-directories
            for (int i = subDirectories.size() - 1; i >= 0; i--) {
                pending.push(subDirectories.get(i));
            }
        }
    }

    private static class PendingDirectory {
        private final Path directory;
        private final FileSystemRepository owner;
        private final MetadataPath ownerPath;

        PendingDirectory(Path directory, FileSystemRepository owner, MetadataPath ownerPath) {
            this.directory = directory;
            this.owner = owner;
            this.ownerPath = ownerPath;
        }
    }
}
