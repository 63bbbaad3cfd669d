package org.metalad.index;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.metalad.exceptions.VersionIndexNotFoundException;

/**
 * VersionIndexManager keeps the version indexes of the datasets whose metadata lives in one
 * store. Seals of the same dataset id are serialized, concurrent callers never lose updates.
 */
public interface VersionIndexManager {
        /**
         * Seal a new generation of the index of (datasetId, datasetVersion). The new generation
         * contains all entries of the current head, overwritten by the given updates; a key
         * without head starts from an empty index. The containment of the head is kept.
         *
         * When two callers seal the same key at the same time, the seals are applied one after
         * the other: for an entry set by both the later seal wins, all other entries of both
         * seals survive. Conditional updates such as {@link IndexUpdate#subDatasetIfAbsent} are
         * evaluated against the head the seal derives from.
         *
         * @param datasetId      Dataset id
         * @param datasetVersion Dataset version
         * @param updates        Entries to set, may be empty
         * @return The new head
         * @throws IOException          When the generation cannot be written
         * @throws InterruptedException When waiting for a concurrent seal is interrupted
         */
        VersionIndex seal(UUID datasetId, String datasetVersion, List<IndexUpdate> updates)
            throws IOException, InterruptedException;

        /**
         * Seal with an explicit containment, used for indexes imported by aggregation
         *
         * @param containment Containment of the new generation, null keeps the head's
         */
        VersionIndex seal(
            UUID datasetId, String datasetVersion, List<IndexUpdate> updates,
            Containment containment) throws IOException, InterruptedException;

        /**
         * @return Head generation of the key
         * @throws VersionIndexNotFoundException When the key was never sealed
         * @throws IOException                   When the index cannot be read
         */
        VersionIndex get(UUID datasetId, String datasetVersion)
            throws VersionIndexNotFoundException, IOException;

        boolean contains(UUID datasetId, String datasetVersion) throws IOException;

        /**
         * @return Versions of the dataset in the order of their first seal, empty if unknown
         */
        List<String> getVersions(UUID datasetId) throws IOException;

        /**
         * @return Most recently sealed new version of the dataset, null if unknown
         */
        String getLatestVersion(UUID datasetId) throws IOException;

        /**
         * @return Ids of all datasets with at least one sealed version
         */
        Set<UUID> getDatasetIds() throws IOException;

        /**
         * Find the entries of a dataset that match a path and a version pattern.
         *
         * @param datasetId      Dataset id
         * @param pathPattern    Glob pattern, null matches everything; "" is the dataset-level
         *                       entry
         * @param versionPattern Exact version, "*" for all versions, "latest" or null for the
         *                       latest version
         * @return Matches, grouped by version in seal order
         * @throws IOException When an index cannot be read
         */
        List<IndexMatch> resolve(UUID datasetId, String pathPattern, String versionPattern)
            throws IOException;
}
