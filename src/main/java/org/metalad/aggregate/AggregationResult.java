package org.metalad.aggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.metalad.exceptions.ConsistencyException;
import org.metalad.record.MetadataPath;

/**
 * Result of aggregating one sub-dataset into a root store
 */
public class AggregationResult {

    public enum Status {
        /** all entries were copied */
        OK,
        /** some entries referenced missing blobs and were skipped */
        PARTIAL,
        /** the sub-dataset or its store could not be read, nothing was copied */
        ERROR
    }

    private final MetadataPath subPath;
    private AggregationEdge edge;
    private String message;
    private boolean failed;
    private long copiedObjects;
    private final List<String> copiedVersions = new ArrayList<>();
    private final List<ConsistencyException> entryErrors = new ArrayList<>();

    AggregationResult(MetadataPath subPath) {
        this.subPath = subPath;
    }

    static AggregationResult error(MetadataPath subPath, String message) {
        AggregationResult result = new AggregationResult(subPath);
        result.failed = true;
        result.message = message;
        return result;
    }

    void setEdge(AggregationEdge edge) {
        this.edge = edge;
    }

    void addCopiedObject() {
        copiedObjects++;
    }

    void addCopiedVersion(String version) {
        copiedVersions.add(version);
    }

    void addEntryError(ConsistencyException error) {
        entryErrors.add(error);
    }

    public Status getStatus() {
        if (failed) {
            return Status.ERROR;
        }
        return entryErrors.isEmpty() ? Status.OK : Status.PARTIAL;
    }

    public MetadataPath getSubPath() {
        return subPath;
    }

    /**
     * @return Observed containment, null if the sub-dataset could not be opened
     */
    public AggregationEdge getEdge() {
        return edge;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return Number of blobs that were not yet in the root store
     */
    public long getCopiedObjects() {
        return copiedObjects;
    }

    /**
     * @return Sub-dataset versions whose indexes were copied, the current version last
     */
    public List<String> getCopiedVersions() {
        return Collections.unmodifiableList(copiedVersions);
    }

    public List<ConsistencyException> getEntryErrors() {
        return Collections.unmodifiableList(entryErrors);
    }

    @Override
    public String toString() {
        return "AggregationResult{" + subPath + ", " + getStatus()
            + (message != null ? ", " + message : "") + "}";
    }
}
