package org.metalad.conduct;

import java.io.IOException;
import java.security.NoSuchAlgorithmException;

import org.metalad.MetadataStore;
import org.metalad.ObjectRef;
import org.metalad.add.MetadataAdder;
import org.metalad.dataset.DatasetElement;
import org.metalad.dataset.RepositoryHandle;
import org.metalad.record.MetadataRecord;

/**
 * Processor that adds the records of an item to a store. Without aggregation a record goes to
 * the store of the dataset that contains the element. With aggregation, records of elements in
 * sub-datasets go to the store of the pipeline's root dataset, tagged with the sub-dataset's
 * path and the root's current version.
 */
public class AddProcessor implements Processor {
    public static final String NAME = "add";

    private final StageContext context;
    private final boolean aggregate;

    public AddProcessor(StageContext context, boolean aggregate) {
        this.context = context;
        this.aggregate = aggregate;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(PipelineData data) throws IOException, NoSuchAlgorithmException,
        InterruptedException {
        if (data.getRecords().isEmpty()) {
            data.setOutcome(Outcome.NOTNEEDED, "no metadata to add");
            return;
        }
        DatasetElement element = data.getElement();
        boolean intoRoot = aggregate && element != null && !element.getDatasetPath().isRoot();

        for (MetadataRecord record : data.getRecords()) {
            ObjectRef objectRef;
            if (intoRoot) {
                RepositoryHandle root = context.getRoot();
                MetadataStore rootStore = context.getStore(root);
                MetadataRecord tagged = record.withProvenance(
                    root.getDatasetId(), root.getCurrentVersion(), element.getDatasetPath());
                objectRef = new MetadataAdder(rootStore, root.getDatasetId()).add(tagged, false);
            } else {
                RepositoryHandle dataset = element == null ? context.getRoot()
                    : element.getDataset();
                objectRef = new MetadataAdder(context.getStore(dataset), dataset.getDatasetId())
                    .add(record, false);
            }
            data.addRef(objectRef);
        }
    }
}
