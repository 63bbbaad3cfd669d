package org.metalad.testdata;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.metalad.dataset.FileSystemRepository;
import org.metalad.record.MetadataPath;
import org.metalad.record.MetadataRecord;
import org.metalad.record.RecordType;

/*
 * This class returns test blobs with their expected SHA-256 digests, fixed dataset ids and
 * factories for metadata records and dataset directories.
 */
public class TestDataHarness {
        public static final UUID ROOT_ID = UUID.fromString("a4f1f0b2-5a55-4d3e-9a51-2f1de07c1c01");
        public static final UUID SUB_ID = UUID.fromString("0c8b1e52-7f7b-4c59-8b57-6a2ac2b3d502");
        public static final UUID NESTED_ID =
                UUID.fromString("5e3f2d8a-1c4b-4e6f-a7d9-0b1c2d3e4f03");

        public Map<String, String> blobDigests;

        public TestDataHarness() {
                blobDigests = new HashMap<>();
                blobDigests.put(
                        "hello metadata",
                        "a97b7b9226ca04c876f51783fc465f30be0c70b936d9b5663cc13e49e1d40769"
                );
                blobDigests.put(
                        "another blob",
                        "3d93c1bc90ef2af4ee33a627e6d4ab54f602d0c3c88aee6fa52c21f50f11a588"
                );
                blobDigests.put(
                        "", "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855"
                );
        }

        public MetadataRecord datasetRecord(UUID datasetId, String datasetVersion) {
                ObjectNode extracted = JsonNodeFactory.instance.objectNode();
                extracted.put("name", "dataset " + datasetId);
                extracted.put("version", datasetVersion);
                return builder(RecordType.DATASET, datasetId, datasetVersion)
                        .extractedMetadata(extracted)
                        .build();
        }

        public MetadataRecord fileRecord(UUID datasetId, String datasetVersion, String path) {
                ObjectNode extracted = JsonNodeFactory.instance.objectNode();
                extracted.put("path", path);
                extracted.putArray("keywords").add("test").add(path);
                return builder(RecordType.FILE, datasetId, datasetVersion)
                        .path(MetadataPath.of(path))
                        .extractedMetadata(extracted)
                        .build();
        }

        public MetadataRecord.Builder builder(
                RecordType type, UUID datasetId, String datasetVersion) {
                Map<String, Object> parameter = new LinkedHashMap<>();
                parameter.put("mode", "test");
                return new MetadataRecord.Builder()
                        .type(type)
                        .datasetId(datasetId)
                        .datasetVersion(datasetVersion)
                        .extractorName("test_extractor")
                        .extractorVersion("1.0")
                        .extractionParameter(parameter)
                        .extractionTime(1700000000.5)
                        .agentName("Test Agent")
                        .agentEmail("agent@example.org");
        }

        /**
         * Record keys as a JSON parser would produce them
         */
        public Map<String, Object> recordMap(
                String type, UUID datasetId, String datasetVersion, String path) {
                Map<String, Object> map = new LinkedHashMap<>();
                map.put("type", type);
                map.put("dataset_id", datasetId.toString());
                map.put("dataset_version", datasetVersion);
                if (path != null) {
                        map.put("path", path);
                }
                map.put("extractor_name", "test_extractor");
                map.put("extractor_version", "1.0");
                map.put("extraction_parameter", new LinkedHashMap<>());
                map.put("extraction_time", 1700000000.5);
                map.put("agent_name", "Test Agent");
                map.put("agent_email", "agent@example.org");
                Map<String, Object> extracted = new LinkedHashMap<>();
                extracted.put("info", "value");
                map.put("extracted_metadata", extracted);
                return map;
        }

        /**
         * Create a dataset directory with files, each file contains its own path
         */
        public FileSystemRepository createDataset(
                Path directory, UUID datasetId, String datasetVersion, String... files)
                throws IOException {
                FileSystemRepository dataset = FileSystemRepository.create(
                        directory, datasetId, datasetVersion
                );
                for (String file : files) {
                        Path filePath = directory.resolve(file);
                        Files.createDirectories(filePath.getParent());
                        Files.write(filePath, file.getBytes(StandardCharsets.UTF_8));
                }
                return dataset;
        }
}
