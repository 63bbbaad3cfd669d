package org.metalad.conduct;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.metalad.MetadataStore;
import org.metalad.dataset.RepositoryHandle;
import org.metalad.extractor.MetadataExtraction;
import org.metalad.filestore.FileStoreUtility;

/**
 * What the stages of a pipeline share: the dataset the pipeline runs on, the extraction runner
 * and the stores opened so far.
 */
public class StageContext {
    private final RepositoryHandle root;
    private final MetadataExtraction extraction;
    private final Map<Path, MetadataStore> stores = new HashMap<>();

    public StageContext(RepositoryHandle root, MetadataExtraction extraction) {
        FileStoreUtility.ensureNotNull(root, "root", "StageContext");
        FileStoreUtility.ensureNotNull(extraction, "extraction", "StageContext");
        this.root = root;
        this.extraction = extraction;
    }

    public RepositoryHandle getRoot() {
        return root;
    }

    public MetadataExtraction getExtraction() {
        return extraction;
    }

    /**
     * @return The store of a dataset, opened once per store path
     * @throws IOException When the store cannot be opened
     */
    public synchronized MetadataStore getStore(RepositoryHandle dataset) throws IOException {
        Path storePath = dataset.getStorePath();
        MetadataStore store = stores.get(storePath);
        if (store == null) {
            store = MetadataStore.open(storePath);
            stores.put(storePath, store);
        }
        return store;
    }
}
