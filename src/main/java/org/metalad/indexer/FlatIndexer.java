package org.metalad.indexer;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import org.metalad.record.MetadataRecord;

/**
 * FlatIndexer flattens the extracted metadata into dotted keys below the extractor name. Object
 * members are joined with '.', array elements get an `[index]` suffix and scalars become
 * strings. Key characters that would collide with this syntax are replaced.
 */
public class FlatIndexer implements Indexer {

    @Override
    public Map<String, Object> index(MetadataRecord record) {
        Map<String, Object> index = new LinkedHashMap<>();
        flatten(encodeKey(record.getExtractorName()), record.getExtractedMetadata(), index);
        return index;
    }

    private static void flatten(String baseKey, JsonNode node, Map<String, Object> index) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            index.put(baseKey, null);

        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                flatten(baseKey + "[" + i + "]", node.get(i), index);
            }

        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = encodeKey(field.getKey());
                flatten(baseKey.isEmpty() ? key : baseKey + "." + key, field.getValue(), index);
            }

        } else {
            index.put(baseKey, node.asText());
        }
    }

    static String encodeKey(String key) {
        String stripped = key;
        while (stripped.startsWith("@")) {
            stripped = stripped.substring(1);
        }
        return stripped.replace('/', '_')
            .replace(' ', '_')
            .replace('-', '_')
            .replace('.', '_')
            .replace(':', '-');
    }
}
