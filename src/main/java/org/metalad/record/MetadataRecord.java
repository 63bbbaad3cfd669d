package org.metalad.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import org.metalad.filestore.FileStoreUtility;

/**
 * MetadataRecord is an immutable metadata record about one dataset or one file of a dataset
 * version, as produced by one extractor invocation. Records of sub-datasets that were added to a
 * root dataset's store carry provenance: the root dataset id, the root dataset version (null when
 * the containment in a root version is unknown) and the path of the sub-dataset in the root.
 *
 * Instances are created with {@link Builder}.
 */
public final class MetadataRecord {

    public static final int RECORD_SCHEMA_VERSION = 1;

    private final RecordType type;
    private final UUID datasetId;
    private final String datasetVersion;
    private final MetadataPath path;
    private final String extractorName;
    private final String extractorVersion;
    private final Map<String, Object> extractionParameter;
    private final double extractionTime;
    private final String agentName;
    private final String agentEmail;
    private final JsonNode extractedMetadata;
    private final boolean hasProvenance;
    private final UUID rootDatasetId;
    private final String rootDatasetVersion;
    private final MetadataPath datasetPath;

    private MetadataRecord(Builder builder) {
        this.type = builder.type;
        this.datasetId = builder.datasetId;
        this.datasetVersion = builder.datasetVersion;
        this.path = builder.path;
        this.extractorName = builder.extractorName;
        this.extractorVersion = builder.extractorVersion;
        this.extractionParameter = Collections.unmodifiableMap(
            new LinkedHashMap<>(builder.extractionParameter));
        this.extractionTime = builder.extractionTime;
        this.agentName = builder.agentName;
        this.agentEmail = builder.agentEmail;
        this.extractedMetadata = builder.extractedMetadata.deepCopy();
        this.hasProvenance = builder.hasProvenance;
        this.rootDatasetId = builder.rootDatasetId;
        this.rootDatasetVersion = builder.rootDatasetVersion;
        this.datasetPath = builder.datasetPath;
    }

    public RecordType getType() {
        return type;
    }

    public UUID getDatasetId() {
        return datasetId;
    }

    public String getDatasetVersion() {
        return datasetVersion;
    }

    /**
     * @return Path of the described file, null for dataset records
     */
    public MetadataPath getPath() {
        return path;
    }

    public String getExtractorName() {
        return extractorName;
    }

    public String getExtractorVersion() {
        return extractorVersion;
    }

    public Map<String, Object> getExtractionParameter() {
        return extractionParameter;
    }

    /**
     * @return Time of extraction in seconds since the epoch
     */
    public double getExtractionTime() {
        return extractionTime;
    }

    public String getAgentName() {
        return agentName;
    }

    public String getAgentEmail() {
        return agentEmail;
    }

    /**
     * @return Copy of the extractor output, opaque to the store
     */
    public JsonNode getExtractedMetadata() {
        return extractedMetadata.deepCopy();
    }

    public boolean hasProvenance() {
        return hasProvenance;
    }

    public UUID getRootDatasetId() {
        return rootDatasetId;
    }

    /**
     * @return Version of the root dataset that contains this record's dataset, null if the record
     * has no provenance or the containing root version is unknown
     */
    public String getRootDatasetVersion() {
        return rootDatasetVersion;
    }

    public MetadataPath getDatasetPath() {
        return datasetPath;
    }

    /**
     * @return Copy of this record tagged with the given provenance
     */
    public MetadataRecord withProvenance(
        UUID rootDatasetId, String rootDatasetVersion, MetadataPath datasetPath) {
        return toBuilder().provenance(rootDatasetId, rootDatasetVersion, datasetPath).build();
    }

    /**
     * @return Copy of this record without provenance
     */
    public MetadataRecord withoutProvenance() {
        Builder builder = toBuilder();
        builder.hasProvenance = false;
        builder.rootDatasetId = null;
        builder.rootDatasetVersion = null;
        builder.datasetPath = null;
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .type(type)
            .datasetId(datasetId)
            .datasetVersion(datasetVersion)
            .path(path)
            .extractorName(extractorName)
            .extractorVersion(extractorVersion)
            .extractionParameter(extractionParameter)
            .extractionTime(extractionTime)
            .agentName(agentName)
            .agentEmail(agentEmail)
            .extractedMetadata(extractedMetadata);
        if (hasProvenance) {
            builder.provenance(rootDatasetId, rootDatasetVersion, datasetPath);
        }
        return builder;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MetadataRecord)) {
            return false;
        }
        MetadataRecord that = (MetadataRecord) other;
        return type == that.type && datasetId.equals(that.datasetId)
            && datasetVersion.equals(that.datasetVersion) && Objects.equals(path, that.path)
            && extractorName.equals(that.extractorName)
            && extractorVersion.equals(that.extractorVersion)
            && extractionParameter.equals(that.extractionParameter)
            && Double.compare(extractionTime, that.extractionTime) == 0
            && agentName.equals(that.agentName) && agentEmail.equals(that.agentEmail)
            && extractedMetadata.equals(that.extractedMetadata)
            && hasProvenance == that.hasProvenance
            && Objects.equals(rootDatasetId, that.rootDatasetId)
            && Objects.equals(rootDatasetVersion, that.rootDatasetVersion)
            && Objects.equals(datasetPath, that.datasetPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, datasetId, datasetVersion, path, extractorName, extractedMetadata);
    }

    @Override
    public String toString() {
        return "MetadataRecord{" + type.getName() + " " + datasetId + "@" + datasetVersion
            + (path != null ? ":" + path : "") + ", extractor=" + extractorName + "}";
    }

    /**
     * Builder of MetadataRecord instances. `build()` checks that all mandatory values are set,
     * that file records have a path and that dataset records have none.
     */
    public static class Builder {
        private RecordType type;
        private UUID datasetId;
        private String datasetVersion;
        private MetadataPath path;
        private String extractorName;
        private String extractorVersion;
        private Map<String, Object> extractionParameter = new LinkedHashMap<>();
        private double extractionTime = System.currentTimeMillis() / 1000.0;
        private String agentName;
        private String agentEmail;
        private JsonNode extractedMetadata = NullNode.getInstance();
        private boolean hasProvenance;
        private UUID rootDatasetId;
        private String rootDatasetVersion;
        private MetadataPath datasetPath;

        public Builder type(RecordType type) {
            this.type = type;
            return this;
        }

        public Builder datasetId(UUID datasetId) {
            this.datasetId = datasetId;
            return this;
        }

        public Builder datasetVersion(String datasetVersion) {
            this.datasetVersion = datasetVersion;
            return this;
        }

        public Builder path(MetadataPath path) {
            this.path = path;
            return this;
        }

        public Builder extractorName(String extractorName) {
            this.extractorName = extractorName;
            return this;
        }

        public Builder extractorVersion(String extractorVersion) {
            this.extractorVersion = extractorVersion;
            return this;
        }

        public Builder extractionParameter(Map<String, Object> extractionParameter) {
            this.extractionParameter = extractionParameter == null
                ? new LinkedHashMap<>() : new LinkedHashMap<>(extractionParameter);
            return this;
        }

        public Builder extractionTime(double extractionTime) {
            this.extractionTime = extractionTime;
            return this;
        }

        public Builder agentName(String agentName) {
            this.agentName = agentName;
            return this;
        }

        public Builder agentEmail(String agentEmail) {
            this.agentEmail = agentEmail;
            return this;
        }

        public Builder extractedMetadata(JsonNode extractedMetadata) {
            this.extractedMetadata = extractedMetadata == null
                ? NullNode.getInstance() : extractedMetadata;
            return this;
        }

        /**
         * @param rootDatasetId      Id of the root dataset, not null
         * @param rootDatasetVersion Version of the root dataset, null if unknown
         * @param datasetPath        Path of the sub-dataset in the root dataset, not null
         */
        public Builder provenance(
            UUID rootDatasetId, String rootDatasetVersion, MetadataPath datasetPath) {
            this.hasProvenance = true;
            this.rootDatasetId = rootDatasetId;
            this.rootDatasetVersion = rootDatasetVersion;
            this.datasetPath = datasetPath;
            return this;
        }

        /**
         * @return New MetadataRecord
         * @throws IllegalArgumentException If mandatory values are missing or the path does not
         *                                  fit the record type
         */
        public MetadataRecord build() throws IllegalArgumentException {
            FileStoreUtility.ensureNotNull(type, "type", "MetadataRecord.Builder.build");
            FileStoreUtility.ensureNotNull(datasetId, "datasetId", "MetadataRecord.Builder.build");
            FileStoreUtility.ensureNotNull(
                datasetVersion, "datasetVersion", "MetadataRecord.Builder.build");
            FileStoreUtility.ensureNotNull(
                extractorName, "extractorName", "MetadataRecord.Builder.build");
            FileStoreUtility.ensureNotNull(
                extractorVersion, "extractorVersion", "MetadataRecord.Builder.build");
            FileStoreUtility.ensureNotNull(agentName, "agentName", "MetadataRecord.Builder.build");
            FileStoreUtility.ensureNotNull(
                agentEmail, "agentEmail", "MetadataRecord.Builder.build");
            if (type == RecordType.FILE && (path == null || path.isRoot())) {
                throw new IllegalArgumentException("File record requires a non-empty path");
            }
            if (type == RecordType.DATASET && path != null) {
                throw new IllegalArgumentException("Dataset record must not have a path");
            }
            if (hasProvenance) {
                FileStoreUtility.ensureNotNull(
                    rootDatasetId, "rootDatasetId", "MetadataRecord.Builder.build");
                FileStoreUtility.ensureNotNull(
                    datasetPath, "datasetPath", "MetadataRecord.Builder.build");
            }
            return new MetadataRecord(this);
        }
    }
}
