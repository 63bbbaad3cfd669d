package org.metalad.dataset;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

import org.metalad.record.MetadataPath;

/**
 * RepositoryHandle gives the store components explicit access to a dataset of a version
 * controlled tree: its identity, its current version, its elements and its sub-datasets.
 */
public interface RepositoryHandle {

        /**
         * @return Root directory of the dataset
         */
        Path getPath();

        UUID getDatasetId();

        /**
         * @return Current version of the dataset
         */
        String getCurrentVersion();

        /**
         * @return Directory of the metadata store of this dataset
         */
        Path getStorePath();

        /**
         * Lazily enumerate the elements of the dataset. The first element is the dataset itself,
         * followed by its files. If recursive, sub-datasets at any depth and their files follow.
         * Hidden entries (names starting with '.') are never reported.
         *
         * @param recursive Descend into sub-datasets
         * @return Iterator of elements, paths are relative to this dataset
         */
        Iterator<DatasetElement> enumerate(boolean recursive);

        /**
         * @return Paths of the direct sub-datasets, relative to this dataset, sorted
         * @throws IOException When the tree cannot be read
         */
        List<MetadataPath> getSubDatasets() throws IOException;

        /**
         * @param path Path of a direct or nested sub-dataset
         * @return Handle of the sub-dataset
         * @throws IOException When no dataset exists at the path
         */
        RepositoryHandle openSubDataset(MetadataPath path) throws IOException;
}
