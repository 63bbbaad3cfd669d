package org.metalad.conduct;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.metalad.ObjectRef;
import org.metalad.dataset.DatasetElement;
import org.metalad.record.MetadataRecord;

/**
 * PipelineData carries one item through the processor chain. Processors read the element, add
 * the records they produce and set the outcome. An item is handled by one worker at a time, so
 * the class is not synchronized.
 */
public class PipelineData {
    private final String label;
    private final DatasetElement element;
    private final List<MetadataRecord> records = new ArrayList<>();
    private final List<ObjectRef> addedRefs = new ArrayList<>();
    private final Map<String, Object> attributes = new HashMap<>();
    private Outcome outcome = Outcome.OK;
    private String message;
    private long sequence;

    public PipelineData(DatasetElement element) {
        this(element.toString(), element);
    }

    public PipelineData(String label, DatasetElement element) {
        this.label = label;
        this.element = element;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return The dataset element of the item, null for items of providers that do not
     * enumerate datasets
     */
    public DatasetElement getElement() {
        return element;
    }

    public List<MetadataRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public void addRecord(MetadataRecord record) {
        records.add(record);
    }

    public List<ObjectRef> getAddedRefs() {
        return Collections.unmodifiableList(addedRefs);
    }

    public void addRef(ObjectRef objectRef) {
        addedRefs.add(objectRef);
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Set the outcome. Processing of the item ends after the current processor unless the
     * outcome is OK.
     */
    public void setOutcome(Outcome outcome, String message) {
        this.outcome = outcome;
        this.message = message;
    }

    long getSequence() {
        return sequence;
    }

    void setSequence(long sequence) {
        this.sequence = sequence;
    }

    ItemResult toResult() {
        return new ItemResult(label, outcome, message, addedRefs);
    }
}
