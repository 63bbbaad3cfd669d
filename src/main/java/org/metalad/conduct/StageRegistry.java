package org.metalad.conduct;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.exceptions.ConfigurationException;
import org.metalad.record.RecordType;

/**
 * StageRegistry maps stage names to the factories of providers and processors. The built-in
 * stages are `dataset-traversal`, `extract` and `add`.
 */
public class StageRegistry {
    private static final Log logRegistry = LogFactory.getLog(StageRegistry.class);

    @FunctionalInterface
    public interface ProviderFactory {
        Provider create(Map<String, Object> arguments, StageContext context)
            throws ConfigurationException;
    }

    @FunctionalInterface
    public interface ProcessorFactory {
        Processor create(Map<String, Object> arguments, StageContext context)
            throws ConfigurationException;
    }

    private final Map<String, ProviderFactory> providers = new LinkedHashMap<>();
    private final Map<String, ProcessorFactory> processors = new LinkedHashMap<>();

    public static StageRegistry withBuiltins() {
        StageRegistry registry = new StageRegistry();
        registry.registerProvider(DatasetTraverser.NAME, StageRegistry::createTraverser);
        registry.registerProcessor(ExtractProcessor.NAME, StageRegistry::createExtract);
        registry.registerProcessor(AddProcessor.NAME, StageRegistry::createAdd);
        return registry;
    }

    public void registerProvider(String name, ProviderFactory factory) {
        providers.put(name, factory);
    }

    public void registerProcessor(String name, ProcessorFactory factory) {
        processors.put(name, factory);
    }

    public Set<String> getProviderNames() {
        return providers.keySet();
    }

    public Set<String> getProcessorNames() {
        return processors.keySet();
    }

    /**
     * Create the stages of a pipeline and a conductor running them
     *
     * @param definition Pipeline description
     * @param context    Shared stage context
     * @param jobs       Number of workers
     * @return Conductor ready to run
     * @throws ConfigurationException When a stage is unknown or has invalid arguments
     */
    public Conductor createConductor(
        PipelineDefinition definition, StageContext context, int jobs)
        throws ConfigurationException {
        PipelineDefinition.Stage providerStage = definition.getProvider();
        ProviderFactory providerFactory = providers.get(providerStage.getName());
        if (providerFactory == null) {
            throw unknown("provider", providerStage.getName(), providers.keySet());
        }
        Provider provider = providerFactory.create(providerStage.getArguments(), context);

        List<Processor> chain = new ArrayList<>();
        for (PipelineDefinition.Stage stage : definition.getProcessors()) {
            ProcessorFactory factory = processors.get(stage.getName());
            if (factory == null) {
                throw unknown("processor", stage.getName(), processors.keySet());
            }
            chain.add(factory.create(stage.getArguments(), context));
        }

        if (jobs < 1) {
            String errMsg = "Number of jobs must be >= 1, got: " + jobs;
            logRegistry.error(errMsg);
            throw new ConfigurationException(errMsg);
        }
        return new Conductor(provider, chain, jobs);
    }

    private static ConfigurationException unknown(String kind, String name, Set<String> known) {
        String errMsg = "Unknown " + kind + " stage: " + name + ". Known: " + known;
        logRegistry.error(errMsg);
        return new ConfigurationException(errMsg);
    }

    private static Provider createTraverser(Map<String, Object> arguments, StageContext context)
        throws ConfigurationException {
        StageArguments args = new StageArguments(DatasetTraverser.NAME, arguments);
        args.checkKnown("item_type", "recursive");
        String itemType = args.getChoice("item_type", null, "file", "dataset", "both");
        boolean recursive = args.getBoolean("recursive", false);
        return new DatasetTraverser(
            context.getRoot(), DatasetTraverser.ItemType.valueOf(itemType.toUpperCase()),
            recursive);
    }

    private static Processor createExtract(Map<String, Object> arguments, StageContext context)
        throws ConfigurationException {
        StageArguments args = new StageArguments(ExtractProcessor.NAME, arguments);
        args.checkKnown("extractor_type", "extractor_name", "extractor_arguments");
        String type = args.getChoice("extractor_type", null, "file", "dataset");
        String name = args.getString("extractor_name", null);
        return new ExtractProcessor(
            context.getExtraction(), RecordType.fromName(type), name,
            args.getMap("extractor_arguments"));
    }

    private static Processor createAdd(Map<String, Object> arguments, StageContext context)
        throws ConfigurationException {
        StageArguments args = new StageArguments(AddProcessor.NAME, arguments);
        args.checkKnown("aggregate");
        return new AddProcessor(context, args.getBoolean("aggregate", false));
    }
}
