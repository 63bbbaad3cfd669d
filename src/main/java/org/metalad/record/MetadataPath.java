package org.metalad.record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A relative, '/'-separated path of a file or sub-dataset inside a dataset. The empty path
 * denotes the dataset itself. Paths are normalized: leading "./", empty segments and "."
 * segments are removed, ".." segments and absolute paths are rejected.
 */
public final class MetadataPath implements Comparable<MetadataPath> {

    public static final MetadataPath ROOT = new MetadataPath(Collections.emptyList());

    private final List<String> parts;
    private final String path;

    private MetadataPath(List<String> parts) {
        this.parts = Collections.unmodifiableList(parts);
        this.path = String.join("/", parts);
    }

    /**
     * Parse and normalize a path
     *
     * @param path Relative path, null and "" denote the dataset itself
     * @return MetadataPath
     * @throws IllegalArgumentException If the path is absolute or contains ".."
     */
    public static MetadataPath of(String path) throws IllegalArgumentException {
        if (path == null || path.isEmpty() || path.equals(".")) {
            return ROOT;
        }
        String normalized = path.replace('\\', '/');
        if (normalized.startsWith("/")) {
            throw new IllegalArgumentException("MetadataPath must be relative: " + path);
        }
        List<String> parts = new ArrayList<>();
        for (String part : normalized.split("/")) {
            if (part.isEmpty() || part.equals(".")) {
                continue;
            }
            if (part.equals("..")) {
                throw new IllegalArgumentException(
                    "MetadataPath must not contain '..' segments: " + path);
            }
            parts.add(part);
        }
        return parts.isEmpty() ? ROOT : new MetadataPath(parts);
    }

    /**
     * @param other Path relative to this path
     * @return This path followed by the other path
     */
    public MetadataPath resolve(MetadataPath other) {
        if (other.isRoot()) {
            return this;
        }
        if (isRoot()) {
            return other;
        }
        List<String> joined = new ArrayList<>(parts);
        joined.addAll(other.parts);
        return new MetadataPath(joined);
    }

    public MetadataPath resolve(String other) {
        return resolve(of(other));
    }

    /**
     * @param prefix Possible ancestor of this path
     * @return True if this path equals the prefix or lies below it
     */
    public boolean startsWith(MetadataPath prefix) {
        return prefix.parts.size() <= parts.size()
            && parts.subList(0, prefix.parts.size()).equals(prefix.parts);
    }

    /**
     * @param prefix Ancestor of this path
     * @return The part of this path below the prefix
     * @throws IllegalArgumentException If the prefix is not an ancestor
     */
    public MetadataPath relativize(MetadataPath prefix) throws IllegalArgumentException {
        if (!startsWith(prefix)) {
            throw new IllegalArgumentException(prefix + " is not a prefix of " + this);
        }
        return new MetadataPath(new ArrayList<>(parts.subList(prefix.parts.size(), parts.size())));
    }

    public boolean isRoot() {
        return parts.isEmpty();
    }

    public List<String> getParts() {
        return parts;
    }

    /**
     * @return Last segment of the path, "" for the dataset itself
     */
    public String getName() {
        return isRoot() ? "" : parts.get(parts.size() - 1);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof MetadataPath && path.equals(((MetadataPath) other).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public int compareTo(MetadataPath other) {
        return path.compareTo(other.path);
    }

    @Override
    public String toString() {
        return path;
    }
}
