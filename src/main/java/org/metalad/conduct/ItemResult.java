package org.metalad.conduct;

import java.util.List;

import org.metalad.ObjectRef;

/**
 * Final state of one pipeline item. Records produced for the item are not kept, only the refs
 * they were stored under.
 */
public final class ItemResult {
    private final String label;
    private final Outcome outcome;
    private final String message;
    private final List<ObjectRef> addedRefs;

    public ItemResult(String label, Outcome outcome, String message, List<ObjectRef> addedRefs) {
        this.label = label;
        this.outcome = outcome;
        this.message = message;
        this.addedRefs = List.copyOf(addedRefs);
    }

    public String getLabel() {
        return label;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getMessage() {
        return message;
    }

    public List<ObjectRef> getAddedRefs() {
        return addedRefs;
    }

    @Override
    public String toString() {
        return outcome.getName() + " " + label + (message == null ? "" : ": " + message);
    }
}
