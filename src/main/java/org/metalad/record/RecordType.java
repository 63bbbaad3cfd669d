package org.metalad.record;

/**
 * The kind of element a metadata record describes.
 */
public enum RecordType {
    DATASET("dataset"), FILE("file");

    private final String typeName;

    RecordType(String typeName) {
        this.typeName = typeName;
    }

    public String getName() {
        return typeName;
    }

    /**
     * @param typeName "dataset" or "file"
     * @return RecordType
     * @throws IllegalArgumentException For any other name
     */
    public static RecordType fromName(String typeName) throws IllegalArgumentException {
        for (RecordType recordType : values()) {
            if (recordType.typeName.equals(typeName)) {
                return recordType;
            }
        }
        throw new IllegalArgumentException("Unknown record type: " + typeName);
    }
}
