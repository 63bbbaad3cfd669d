package org.metalad.aggregate;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;

import org.metalad.MetadataStore;
import org.metalad.dataset.RepositoryHandle;

/**
 * Finds the metadata store of a dataset
 */
public interface StoreLocator {

    /**
     * @param dataset Dataset handle
     * @return The existing store of the dataset
     * @throws FileNotFoundException When the dataset has no store
     * @throws IOException           When the store cannot be opened
     */
    MetadataStore locate(RepositoryHandle dataset) throws IOException;

    /**
     * @return Locator that opens the store at {@link RepositoryHandle#getStorePath()} if it exists
     */
    static StoreLocator fileSystem() {
        return dataset -> {
            if (!Files.isDirectory(dataset.getStorePath())) {
                throw new FileNotFoundException(
                    "No metadata store for dataset " + dataset.getDatasetId() + " at "
                        + dataset.getStorePath());
            }
            return MetadataStore.open(dataset.getStorePath());
        };
    }
}
