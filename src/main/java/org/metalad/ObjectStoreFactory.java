package org.metalad;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Path;
import java.util.Properties;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.exceptions.StoreFactoryException;
import org.metalad.filestore.FileObjectStore;

/**
 * ObjectStoreFactory is a factory class that generates an ObjectStore from the name of its
 * implementing class and a set of properties.
 */
public class ObjectStoreFactory {
    private static final Log logFactory = LogFactory.getLog(ObjectStoreFactory.class);

    public static final String DEFAULT_STORE_CLASS = FileObjectStore.class.getName();

    /**
     * Factory method to generate an ObjectStore
     *
     * @param classPackage    String of the class name, ex.
     *                        "org.metalad.filestore.FileObjectStore"
     * @param storeProperties Properties object with the following keys: storePath, storeDepth,
     *                        storeWidth, storeAlgorithm
     * @return ObjectStore instance ready to store blobs
     * @throws StoreFactoryException When the store fails to initialize due to permissions or
     *                               class-related issues
     */
    public static ObjectStore getObjectStore(String classPackage, Properties storeProperties)
        throws StoreFactoryException {
        if (classPackage == null || classPackage.trim().isEmpty()) {
            String errMsg = "ObjectStoreFactory - classPackage cannot be null or empty.";
            logFactory.error(errMsg);
            throw new StoreFactoryException(errMsg);
        }
        if (storeProperties == null) {
            String errMsg = "ObjectStoreFactory - storeProperties cannot be null.";
            logFactory.error(errMsg);
            throw new StoreFactoryException(errMsg);
        }

        logFactory.debug("Creating new 'ObjectStore' from class: " + classPackage);
        try {
            Class<?> storeClass = Class.forName(classPackage);
            if (!ObjectStore.class.isAssignableFrom(storeClass)) {
                String errMsg = "ObjectStoreFactory - Class does not implement ObjectStore: "
                    + classPackage;
                logFactory.error(errMsg);
                throw new StoreFactoryException(errMsg);
            }
            Constructor<?> constructor = storeClass.getConstructor(Properties.class);
            return (ObjectStore) constructor.newInstance(storeProperties);

        } catch (ClassNotFoundException cnfe) {
            String errMsg = "ObjectStoreFactory - Unable to find class: " + classPackage;
            logFactory.error(errMsg);
            throw new StoreFactoryException(errMsg);

        } catch (NoSuchMethodException nsme) {
            String errMsg = "ObjectStoreFactory - Constructor(Properties) not found for: "
                + classPackage;
            logFactory.error(errMsg);
            throw new StoreFactoryException(errMsg);

        } catch (IllegalAccessException | InstantiationException e) {
            String errMsg = "ObjectStoreFactory - Error instantiating: " + classPackage + " - "
                + e.getMessage();
            logFactory.error(errMsg);
            throw new StoreFactoryException(errMsg);

        } catch (InvocationTargetException ite) {
            String errMsg = "ObjectStoreFactory - Error creating '" + classPackage
                + "' instance: " + ite.getCause();
            logFactory.error(errMsg);
            throw new StoreFactoryException(errMsg);
        }
    }

    /**
     * Open or create the default file based store with default depth, width and algorithm
     *
     * @param storePath Root directory of the store
     * @return ObjectStore
     * @throws StoreFactoryException When the store fails to initialize
     */
    public static ObjectStore getDefaultObjectStore(Path storePath) throws StoreFactoryException {
        Properties storeProperties = new Properties();
        storeProperties.setProperty(
            FileObjectStore.ObjectStoreProperties.storePath.name(), storePath.toString());
        return getObjectStore(DEFAULT_STORE_CLASS, storeProperties);
    }
}
