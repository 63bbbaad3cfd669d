package org.metalad.dataset;

/**
 * Type of an element of a dataset tree
 */
public enum ElementType {
    DATASET, FILE
}
