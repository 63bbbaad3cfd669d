package org.metalad;

import java.util.Objects;

/**
 * ObjectRef is the content identifier of a blob in an ObjectStore: the lower-case hex digest of
 * the blob's bytes, calculated with the store algorithm. ObjectRefs are plain values; holding one
 * does not keep the blob alive, the ObjectStore alone owns blob lifetime.
 */
public final class ObjectRef implements Comparable<ObjectRef> {
    private final String hexDigest;

    private ObjectRef(String hexDigest) {
        this.hexDigest = hexDigest;
    }

    /**
     * Create an ObjectRef from a hex digest
     *
     * @param hexDigest Hex digest, upper- or lower-case
     * @return ObjectRef with the lower-case digest
     * @throws IllegalArgumentException If the digest is null, empty or not hexadecimal
     */
    public static ObjectRef of(String hexDigest) throws IllegalArgumentException {
        if (hexDigest == null || hexDigest.trim().isEmpty()) {
            throw new IllegalArgumentException("ObjectRef digest cannot be null or empty.");
        }
        String digest = hexDigest.trim().toLowerCase();
        for (int i = 0; i < digest.length(); i++) {
            char ch = digest.charAt(i);
            boolean hex = (ch >= '0' && ch <= '9') || (ch >= 'a' && ch <= 'f');
            if (!hex) {
                throw new IllegalArgumentException(
                    "ObjectRef digest contains non-hexadecimal character: " + hexDigest);
            }
        }
        return new ObjectRef(digest);
    }

    /**
     * Return the hex digest (address) of the blob
     *
     * @return hexDigest
     */
    public String getHexDigest() {
        return hexDigest;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ObjectRef)) {
            return false;
        }
        return hexDigest.equals(((ObjectRef) other).hexDigest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hexDigest);
    }

    @Override
    public int compareTo(ObjectRef other) {
        return hexDigest.compareTo(other.hexDigest);
    }

    @Override
    public String toString() {
        return hexDigest;
    }
}
