package org.metalad.conduct;

import java.util.Iterator;
import java.util.NoSuchElementException;

import org.metalad.dataset.DatasetElement;
import org.metalad.dataset.ElementType;
import org.metalad.dataset.RepositoryHandle;

/**
 * Provider that enumerates the elements of a dataset, optionally including its sub-datasets
 */
public class DatasetTraverser implements Provider {
    public static final String NAME = "dataset-traversal";

    public enum ItemType {
        FILE, DATASET, BOTH;

        boolean accepts(ElementType type) {
            return this == BOTH || (this == FILE) == (type == ElementType.FILE);
        }
    }

    private final RepositoryHandle dataset;
    private final ItemType itemType;
    private final boolean recursive;

    public DatasetTraverser(RepositoryHandle dataset, ItemType itemType, boolean recursive) {
        this.dataset = dataset;
        this.itemType = itemType;
        this.recursive = recursive;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Iterator<PipelineData> provide() {
        Iterator<DatasetElement> elements = dataset.enumerate(recursive);
        return new Iterator<PipelineData>() {
            private DatasetElement nextElement;

            @Override
            public boolean hasNext() {
                while (nextElement == null && elements.hasNext()) {
                    DatasetElement candidate = elements.next();
                    if (itemType.accepts(candidate.getType())) {
                        nextElement = candidate;
                    }
                }
                return nextElement != null;
            }

            @Override
            public PipelineData next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                PipelineData data = new PipelineData(nextElement);
                nextElement = null;
                return data;
            }
        };
    }
}
