package org.metalad.extractor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.exceptions.ConfigurationException;
import org.metalad.filestore.FileStoreUtility;
import org.metalad.record.RecordType;

/**
 * ExtractorRegistry maps extractor names to factories. Extractors are registered explicitly,
 * {@link #withBuiltins()} provides the extractors shipped with this library.
 */
public class ExtractorRegistry {
    private static final Log logRegistry = LogFactory.getLog(ExtractorRegistry.class);

    /**
     * Creates an extractor bound to one element
     */
    @FunctionalInterface
    public interface Factory {
        Extractor create(ExtractionContext context) throws ConfigurationException;
    }

    private final Map<String, RecordType> types = new LinkedHashMap<>();
    private final Map<String, Factory> factories = new LinkedHashMap<>();

    /**
     * @return Registry with metalad_example_dataset, metalad_example_file, external_dataset
     * and external_file
     */
    public static ExtractorRegistry withBuiltins() {
        ExtractorRegistry registry = new ExtractorRegistry();
        registry.register(
            ExampleDatasetExtractor.NAME, RecordType.DATASET, ExampleDatasetExtractor::new);
        registry.register(ExampleFileExtractor.NAME, RecordType.FILE, ExampleFileExtractor::new);
        registry.register(
            ExternalExtractor.DATASET_NAME, RecordType.DATASET,
            context -> new ExternalExtractor(RecordType.DATASET, context));
        registry.register(
            ExternalExtractor.FILE_NAME, RecordType.FILE,
            context -> new ExternalExtractor(RecordType.FILE, context));
        return registry;
    }

    /**
     * Register an extractor, replacing an extractor of the same name
     *
     * @param name    Extractor name
     * @param type    Type of the elements the extractor describes
     * @param factory Factory creating the extractor
     */
    public synchronized void register(String name, RecordType type, Factory factory) {
        FileStoreUtility.checkForEmptyAndValidString(name, "name", "register");
        FileStoreUtility.ensureNotNull(type, "type", "register");
        FileStoreUtility.ensureNotNull(factory, "factory", "register");
        types.put(name, type);
        factories.put(name, factory);
    }

    public synchronized boolean contains(String name) {
        return factories.containsKey(name);
    }

    public synchronized Set<String> getNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(factories.keySet()));
    }

    /**
     * @param name Extractor name
     * @return Type of the elements the extractor describes
     * @throws ConfigurationException When no extractor of that name is registered
     */
    public synchronized RecordType getType(String name) throws ConfigurationException {
        RecordType type = types.get(name);
        if (type == null) {
            String errMsg = "ExtractorRegistry - unknown extractor: " + name + ". Known: "
                + factories.keySet();
            logRegistry.error(errMsg);
            throw new ConfigurationException(errMsg);
        }
        return type;
    }

    /**
     * Create an extractor for an element
     *
     * @param name    Extractor name
     * @param context Element and parameters
     * @return Extractor
     * @throws ConfigurationException When the name is unknown, the extractor does not describe
     *                                elements of the context's type or its parameters are
     *                                invalid
     */
    public Extractor create(String name, ExtractionContext context)
        throws ConfigurationException {
        FileStoreUtility.ensureNotNull(context, "context", "create");
        RecordType type = getType(name);
        if (type != context.getType()) {
            String errMsg = "ExtractorRegistry - extractor " + name + " describes "
                + type.getName() + " elements, cannot extract from a " + context.getType()
                .getName();
            logRegistry.error(errMsg);
            throw new ConfigurationException(errMsg);
        }
        Factory factory;
        synchronized (this) {
            factory = factories.get(name);
        }
        return factory.create(context);
    }
}
