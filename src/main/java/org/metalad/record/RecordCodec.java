package org.metalad.record;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.exceptions.MetadataKeyException;

/**
 * RecordCodec converts metadata records from and to their JSON wire form. The canonical form
 * used for storage has sorted keys, no insignificant white space and UTF-8 encoding, so equal
 * records always produce equal bytes and thus equal ObjectRefs. Sequences of records are
 * exchanged as JSON Lines, one record per line.
 */
public class RecordCodec {
    private static final Log logCodec = LogFactory.getLog(RecordCodec.class);

    public static final String TYPE = "type";
    public static final String DATASET_ID = "dataset_id";
    public static final String DATASET_VERSION = "dataset_version";
    public static final String PATH = "path";
    public static final String EXTRACTOR_NAME = "extractor_name";
    public static final String EXTRACTOR_VERSION = "extractor_version";
    public static final String EXTRACTION_PARAMETER = "extraction_parameter";
    public static final String EXTRACTION_TIME = "extraction_time";
    public static final String AGENT_NAME = "agent_name";
    public static final String AGENT_EMAIL = "agent_email";
    public static final String EXTRACTED_METADATA = "extracted_metadata";
    public static final String ROOT_DATASET_ID = "root_dataset_id";
    public static final String ROOT_DATASET_VERSION = "root_dataset_version";
    public static final String DATASET_PATH = "dataset_path";
    public static final String RECORD_SCHEMA_VERSION = "record_schema_version";

    public static final List<String> REQUIRED_KEYS = Collections.unmodifiableList(Arrays.asList(
        TYPE, EXTRACTOR_NAME, EXTRACTOR_VERSION, EXTRACTION_PARAMETER, EXTRACTION_TIME,
        AGENT_NAME, AGENT_EMAIL, DATASET_ID, DATASET_VERSION, EXTRACTED_METADATA));

    /**
     * Keys that are either all present or all absent
     */
    public static final List<String> PROVENANCE_KEYS = Collections.unmodifiableList(Arrays.asList(
        ROOT_DATASET_ID, ROOT_DATASET_VERSION, DATASET_PATH));

    public static final List<String> OPTIONAL_KEYS = Collections.unmodifiableList(Arrays.asList(
        PATH, RECORD_SCHEMA_VERSION));

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private RecordCodec() {
    }

    /**
     * @return The shared JSON mapper
     */
    public static ObjectMapper getMapper() {
        return MAPPER;
    }

    /**
     * Convert a record into a map of its JSON keys, sorted by key
     *
     * @param record Metadata record
     * @return Sorted map, nested maps are plain Java collections
     */
    public static Map<String, Object> toMap(MetadataRecord record) {
        Map<String, Object> map = new TreeMap<>();
        map.put(TYPE, record.getType().getName());
        map.put(DATASET_ID, record.getDatasetId().toString());
        map.put(DATASET_VERSION, record.getDatasetVersion());
        if (record.getPath() != null) {
            map.put(PATH, record.getPath().toString());
        }
        map.put(EXTRACTOR_NAME, record.getExtractorName());
        map.put(EXTRACTOR_VERSION, record.getExtractorVersion());
        map.put(EXTRACTION_PARAMETER, record.getExtractionParameter());
        map.put(EXTRACTION_TIME, record.getExtractionTime());
        map.put(AGENT_NAME, record.getAgentName());
        map.put(AGENT_EMAIL, record.getAgentEmail());
        map.put(EXTRACTED_METADATA, MAPPER.convertValue(record.getExtractedMetadata(), Object.class));
        if (record.hasProvenance()) {
            map.put(ROOT_DATASET_ID, record.getRootDatasetId().toString());
            map.put(ROOT_DATASET_VERSION, record.getRootDatasetVersion());
            map.put(DATASET_PATH, record.getDatasetPath().toString());
        }
        map.put(RECORD_SCHEMA_VERSION, MetadataRecord.RECORD_SCHEMA_VERSION);
        return map;
    }

    /**
     * Serialize a record in canonical form
     *
     * @param record Metadata record
     * @return Canonical JSON text
     */
    public static String toJson(MetadataRecord record) {
        try {
            return MAPPER.writeValueAsString(toMap(record));

        } catch (JsonProcessingException jpe) {
            String errMsg = "Unable to serialize record: " + record + ". " + jpe.getMessage();
            logCodec.error(errMsg);
            throw new IllegalStateException(errMsg, jpe);
        }
    }

    /**
     * @param record Metadata record
     * @return UTF-8 bytes of the canonical JSON text
     */
    public static byte[] toBytes(MetadataRecord record) {
        return toJson(record).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Parse a record from JSON text. Unknown keys are rejected.
     *
     * @param json JSON object text
     * @return MetadataRecord
     * @throws IOException          If the text is not a JSON object
     * @throws MetadataKeyException If keys are missing, unknown, or do not fit the record type
     */
    public static MetadataRecord fromJson(String json) throws IOException, MetadataKeyException {
        Map<String, Object> map = MAPPER.readValue(json, new TypeReference<Map<String, Object>>() {
        });
        return fromMap(map, false);
    }

    public static MetadataRecord fromBytes(byte[] json) throws IOException, MetadataKeyException {
        return fromJson(new String(json, StandardCharsets.UTF_8));
    }

    /**
     * Create a record from a map of JSON keys.
     *
     * @param map          Map of JSON keys to values
     * @param allowUnknown If true, unknown keys are logged and ignored, otherwise rejected
     * @return MetadataRecord
     * @throws MetadataKeyException If keys are missing, unknown, only partially present
     *                              (provenance), carry invalid values, or do not fit the type
     */
    public static MetadataRecord fromMap(Map<String, Object> map, boolean allowUnknown)
        throws MetadataKeyException {
        checkKeys(map, allowUnknown);

        MetadataRecord.Builder builder = new MetadataRecord.Builder();
        RecordType type;
        try {
            type = RecordType.fromName(stringValue(map, TYPE));

        } catch (IllegalArgumentException iae) {
            throw new MetadataKeyException("Unknown type " + map.get(TYPE));
        }
        if (type == RecordType.FILE && !map.containsKey(PATH)) {
            throw new MetadataKeyException("Missing path-property in file-type metadata");
        }
        if (type == RecordType.DATASET && map.containsKey(PATH)) {
            throw new MetadataKeyException("Extraneous path-property in dataset-type metadata");
        }

        Object schemaVersion = map.get(RECORD_SCHEMA_VERSION);
        if (schemaVersion != null && (!(schemaVersion instanceof Number)
            || ((Number) schemaVersion).intValue() > MetadataRecord.RECORD_SCHEMA_VERSION)) {
            throw new MetadataKeyException(
                "Unsupported record schema version " + schemaVersion,
                Collections.singletonList(RECORD_SCHEMA_VERSION));
        }

        builder.type(type)
            .datasetId(uuidValue(map, DATASET_ID))
            .datasetVersion(stringValue(map, DATASET_VERSION))
            .extractorName(stringValue(map, EXTRACTOR_NAME))
            .extractorVersion(stringValue(map, EXTRACTOR_VERSION))
            .extractionParameter(mapValue(map, EXTRACTION_PARAMETER))
            .extractionTime(numberValue(map, EXTRACTION_TIME))
            .agentName(stringValue(map, AGENT_NAME))
            .agentEmail(stringValue(map, AGENT_EMAIL))
            .extractedMetadata(MAPPER.valueToTree(map.get(EXTRACTED_METADATA)));
        if (type == RecordType.FILE) {
            builder.path(pathValue(map, PATH));
        }
        if (map.containsKey(ROOT_DATASET_ID)) {
            Object rootVersion = map.get(ROOT_DATASET_VERSION);
            builder.provenance(
                uuidValue(map, ROOT_DATASET_ID),
                rootVersion == null ? null : rootVersion.toString(),
                pathValue(map, DATASET_PATH));
        }

        try {
            return builder.build();

        } catch (IllegalArgumentException iae) {
            throw new MetadataKeyException(iae.getMessage());
        }
    }

    /**
     * Check the presence of required keys, the completeness of the provenance keys and the
     * absence of unknown keys
     *
     * @param map          Map of JSON keys to values
     * @param allowUnknown If true, unknown keys are only logged
     * @throws MetadataKeyException If a check fails
     */
    public static void checkKeys(Map<String, Object> map, boolean allowUnknown)
        throws MetadataKeyException {
        List<String> missingKeys = new ArrayList<>();
        for (String key : REQUIRED_KEYS) {
            if (!map.containsKey(key)) {
                missingKeys.add(key);
            }
        }
        if (!missingKeys.isEmpty()) {
            throw new MetadataKeyException("Missing keys", missingKeys);
        }

        List<String> presentProvenanceKeys = new ArrayList<>();
        List<String> missingProvenanceKeys = new ArrayList<>();
        for (String key : PROVENANCE_KEYS) {
            if (map.containsKey(key)) {
                presentProvenanceKeys.add(key);
            } else {
                missingProvenanceKeys.add(key);
            }
        }
        if (!presentProvenanceKeys.isEmpty() && !missingProvenanceKeys.isEmpty()) {
            throw new MetadataKeyException("Non mandatory keys missing", missingProvenanceKeys);
        }

        List<String> unknownKeys = new ArrayList<>();
        for (String key : map.keySet()) {
            if (!REQUIRED_KEYS.contains(key) && !PROVENANCE_KEYS.contains(key)
                && !OPTIONAL_KEYS.contains(key)) {
                unknownKeys.add(key);
            }
        }
        if (!unknownKeys.isEmpty()) {
            if (!allowUnknown) {
                throw new MetadataKeyException("Unknown keys", unknownKeys);
            }
            logCodec.warn("Unknown keys in metadata: " + String.join(", ", unknownKeys));
        }
    }

    /**
     * Write records as JSON Lines, one canonical record per line. The stream is flushed but not
     * closed.
     *
     * @param records Records to write
     * @param output  Destination stream
     * @throws IOException If writing fails
     */
    public static void writeJsonLines(Collection<MetadataRecord> records, OutputStream output)
        throws IOException {
        BufferedWriter writer = new BufferedWriter(
            new OutputStreamWriter(output, StandardCharsets.UTF_8));
        for (MetadataRecord record : records) {
            writer.write(toJson(record));
            writer.write('\n');
        }
        writer.flush();
    }

    /**
     * Read records from JSON Lines. Blank lines are skipped.
     *
     * @param input Source stream, not closed
     * @return Records in input order
     * @throws IOException          If a line is not a JSON object
     * @throws MetadataKeyException If a record is invalid, the message names the line number
     */
    public static List<MetadataRecord> readJsonLines(InputStream input) throws IOException,
        MetadataKeyException {
        List<MetadataRecord> records = new ArrayList<>();
        BufferedReader reader = new BufferedReader(
            new InputStreamReader(input, StandardCharsets.UTF_8));
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            try {
                records.add(fromJson(line));

            } catch (MetadataKeyException mke) {
                String errMsg = "Line " + lineNumber + ": " + mke.getMessage();
                logCodec.error(errMsg);
                throw new MetadataKeyException(errMsg);
            }
        }
        return records;
    }

    /**
     * Parse a JSON object text into a plain map
     *
     * @param json JSON object text
     * @return Map of keys to plain Java values
     * @throws IOException If the text is not a JSON object
     */
    public static Map<String, Object> readMap(String json) throws IOException {
        return MAPPER.readValue(json, new TypeReference<Map<String, Object>>() {
        });
    }

    private static String stringValue(Map<String, Object> map, String key)
        throws MetadataKeyException {
        Object value = map.get(key);
        if (value == null) {
            throw new MetadataKeyException("Value must not be null", Collections.singletonList(key));
        }
        return value.toString();
    }

    private static UUID uuidValue(Map<String, Object> map, String key)
        throws MetadataKeyException {
        String value = stringValue(map, key);
        try {
            return UUID.fromString(value);

        } catch (IllegalArgumentException iae) {
            throw new MetadataKeyException(
                "Invalid UUID '" + value + "'", Collections.singletonList(key));
        }
    }

    private static MetadataPath pathValue(Map<String, Object> map, String key)
        throws MetadataKeyException {
        Object value = map.get(key);
        try {
            return MetadataPath.of(value == null ? "" : value.toString());

        } catch (IllegalArgumentException iae) {
            throw new MetadataKeyException(iae.getMessage(), Collections.singletonList(key));
        }
    }

    private static double numberValue(Map<String, Object> map, String key)
        throws MetadataKeyException {
        Object value = map.get(key);
        if (!(value instanceof Number)) {
            throw new MetadataKeyException(
                "Value must be a number", Collections.singletonList(key));
        }
        return ((Number) value).doubleValue();
    }

    private static Map<String, Object> mapValue(Map<String, Object> map, String key)
        throws MetadataKeyException {
        Object value = map.get(key);
        if (!(value instanceof Map)) {
            throw new MetadataKeyException(
                "Value must be a JSON object", Collections.singletonList(key));
        }
        return toStringKeyMap((Map<?, ?>) value);
    }

    /**
     * Copy a parsed JSON or YAML mapping into a map with string keys, keeping the entry order
     *
     * @param map Mapping as returned by a parser
     * @return New map, keys converted with String.valueOf
     */
    public static Map<String, Object> toStringKeyMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return copy;
    }
}
