package org.metalad.dump;

import java.util.UUID;

import org.metalad.record.MetadataPath;

/**
 * Parses metadata URLs, see {@link MetadataUrl}. A URL without scheme is a tree URL, an empty
 * URL selects the root dataset at its latest version.
 */
public class MetadataUrlParser {
    private static final String UUID_HEADER = "uuid:";
    private static final String TREE_HEADER = "tree:";
    private static final int UUID_LENGTH = 36;

    private String remaining;

    private MetadataUrlParser(String url) {
        this.remaining = url;
    }

    /**
     * @param url Metadata URL, null is treated as ""
     * @return Parsed URL
     * @throws IllegalArgumentException When a UUID URL has no valid UUID
     */
    public static MetadataUrl parse(String url) throws IllegalArgumentException {
        return new MetadataUrlParser(url == null ? "" : url.trim()).parse();
    }

    private MetadataUrl parse() {
        if (match(UUID_HEADER)) {
            if (remaining.length() < UUID_LENGTH) {
                throw new IllegalArgumentException("Incomplete UUID in metadata URL: " + remaining);
            }
            UUID datasetId = UUID.fromString(fetch(UUID_LENGTH));
            String version = parseVersion();
            MetadataPath localPath = MetadataPath.ROOT;
            if (match(":")) {
                localPath = MetadataPath.of(takeRemaining());
            } else if (!remaining.isEmpty()) {
                throw new IllegalArgumentException(
                    "Unexpected characters after UUID in metadata URL: " + remaining);
            }
            return MetadataUrl.uuid(datasetId, version, localPath);
        }

        match(TREE_HEADER);
        int versionStart = remaining.indexOf('@');
        if (versionStart >= 0) {
            MetadataPath datasetPath = MetadataPath.of(fetch(versionStart));
            String version = parseVersion();
            match(":");
            return MetadataUrl.tree(datasetPath, version, MetadataPath.of(takeRemaining()));
        }
        int pathStart = remaining.indexOf(':');
        if (pathStart >= 0) {
            MetadataPath datasetPath = MetadataPath.of(fetch(pathStart));
            match(":");
            return MetadataUrl.tree(datasetPath, null, MetadataPath.of(takeRemaining()));
        }
        return MetadataUrl.tree(MetadataPath.of(takeRemaining()), null, MetadataPath.ROOT);
    }

    /**
     * A version starts with '@' and ends before ':' or at the end of the URL
     */
    private String parseVersion() {
        if (!match("@")) {
            return null;
        }
        int end = remaining.indexOf(':');
        String version = end >= 0 ? fetch(end) : takeRemaining();
        if (version.isEmpty()) {
            throw new IllegalArgumentException("Empty version in metadata URL");
        }
        return version;
    }

    private boolean match(String prefix) {
        if (remaining.startsWith(prefix)) {
            remaining = remaining.substring(prefix.length());
            return true;
        }
        return false;
    }

    private String fetch(int length) {
        String result = remaining.substring(0, length);
        remaining = remaining.substring(length);
        return result;
    }

    private String takeRemaining() {
        String result = remaining;
        remaining = "";
        return result;
    }
}
