package org.metalad;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import org.metalad.exceptions.StoreFactoryException;
import org.metalad.filestore.FileObjectStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Test class for ObjectStoreFactory
 */
public class ObjectStoreFactoryTest {

    @TempDir
    public Path tempFolder;

    /**
     * Check that the factory creates a FileObjectStore and its configuration file
     */
    @Test
    public void getObjectStore() throws Exception {
        Properties storeProperties = new Properties();
        storeProperties.setProperty("storePath", tempFolder.resolve("store").toString());
        storeProperties.setProperty("storeDepth", "3");
        storeProperties.setProperty("storeWidth", "2");
        storeProperties.setProperty("storeAlgorithm", "SHA-256");

        ObjectStore objectStore = ObjectStoreFactory.getObjectStore(
            "org.metalad.filestore.FileObjectStore", storeProperties
        );

        assertNotNull(objectStore);
        assertTrue(objectStore instanceof FileObjectStore);
        assertTrue(Files.exists(tempFolder.resolve("store").resolve("objectstore.yaml")));
    }

    @Test
    public void getDefaultObjectStore() throws Exception {
        ObjectStore objectStore = ObjectStoreFactory.getDefaultObjectStore(
            tempFolder.resolve("store")
        );

        assertEquals(tempFolder.resolve("store"), objectStore.getStorePath());
        assertEquals(
            FileObjectStore.DEFAULT_ALGORITHM, ((FileObjectStore) objectStore).getAlgorithm()
        );
    }

    @Test
    public void getObjectStore_unknownClass() {
        Properties storeProperties = new Properties();
        storeProperties.setProperty("storePath", tempFolder.resolve("store").toString());

        assertThrows(
            StoreFactoryException.class,
            () -> ObjectStoreFactory.getObjectStore("org.metalad.NoSuchStore", storeProperties)
        );
    }

    @Test
    public void getObjectStore_notAnObjectStore() {
        Properties storeProperties = new Properties();
        storeProperties.setProperty("storePath", tempFolder.resolve("store").toString());

        assertThrows(
            StoreFactoryException.class,
            () -> ObjectStoreFactory.getObjectStore("java.lang.String", storeProperties)
        );
    }

    @Test
    public void getObjectStore_nullArguments() {
        assertThrows(
            StoreFactoryException.class,
            () -> ObjectStoreFactory.getObjectStore(null, new Properties())
        );
        assertThrows(
            StoreFactoryException.class,
            () -> ObjectStoreFactory.getObjectStore(FileObjectStore.class.getName(), null)
        );
    }

    /**
     * Check that a constructor failure is reported as a StoreFactoryException
     */
    @Test
    public void getObjectStore_constructorFailure() throws Exception {
        Path storePath = tempFolder.resolve("store");
        Files.createDirectories(storePath.resolve("objects"));
        Properties storeProperties = new Properties();
        storeProperties.setProperty("storePath", storePath.toString());

        assertThrows(
            StoreFactoryException.class,
            () -> ObjectStoreFactory.getObjectStore(
                FileObjectStore.class.getName(), storeProperties)
        );
    }
}
