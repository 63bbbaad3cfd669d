package org.metalad.conduct;

/**
 * Outcome of one pipeline item
 */
public enum Outcome {
    OK("ok"),
    NOTNEEDED("notneeded"),
    IMPOSSIBLE("impossible"),
    ERROR("error");

    private final String name;

    Outcome(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
