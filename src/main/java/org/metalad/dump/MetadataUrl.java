package org.metalad.dump;

import java.util.UUID;

import org.metalad.record.MetadataPath;

/**
 * Address of metadata in a store. A tree URL selects datasets by their path in the root dataset,
 * a UUID URL selects one dataset by its id. Both can name a version and a path pattern of files
 * inside the selected datasets.
 *
 * <pre>
 * TREE: ["tree:"] [DATASET_PATH] ["@" VERSION] [":" [LOCAL_PATH]]
 * UUID: "uuid:" UUID ["@" VERSION] [":" [LOCAL_PATH]]
 * </pre>
 */
public final class MetadataUrl {

    public enum Scheme {
        TREE, UUID
    }

    private final Scheme scheme;
    private final MetadataPath datasetPath;
    private final UUID datasetId;
    private final String version;
    private final MetadataPath localPath;

    private MetadataUrl(
        Scheme scheme, MetadataPath datasetPath, UUID datasetId, String version,
        MetadataPath localPath) {
        this.scheme = scheme;
        this.datasetPath = datasetPath;
        this.datasetId = datasetId;
        this.version = version;
        this.localPath = localPath;
    }

    public static MetadataUrl tree(MetadataPath datasetPath, String version, MetadataPath localPath) {
        return new MetadataUrl(Scheme.TREE, datasetPath, null, version, localPath);
    }

    public static MetadataUrl uuid(UUID datasetId, String version, MetadataPath localPath) {
        return new MetadataUrl(Scheme.UUID, MetadataPath.ROOT, datasetId, version, localPath);
    }

    public Scheme getScheme() {
        return scheme;
    }

    /**
     * @return Dataset path pattern of a tree URL, ROOT for UUID URLs
     */
    public MetadataPath getDatasetPath() {
        return datasetPath;
    }

    /**
     * @return Dataset id of a UUID URL, null for tree URLs
     */
    public UUID getDatasetId() {
        return datasetId;
    }

    /**
     * @return Requested version, null for the latest
     */
    public String getVersion() {
        return version;
    }

    public MetadataPath getLocalPath() {
        return localPath;
    }

    @Override
    public String toString() {
        String head = scheme == Scheme.TREE ? "tree:" + datasetPath : "uuid:" + datasetId;
        return head + (version != null ? "@" + version : "") + ":" + localPath;
    }
}
