package org.metalad;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.add.AddParameters;
import org.metalad.add.MetadataAdder;
import org.metalad.aggregate.AggregationResult;
import org.metalad.aggregate.Aggregator;
import org.metalad.conduct.Conductor;
import org.metalad.conduct.ItemResult;
import org.metalad.conduct.PipelineDefinition;
import org.metalad.conduct.RunSummary;
import org.metalad.conduct.StageContext;
import org.metalad.conduct.StageRegistry;
import org.metalad.dataset.FileSystemRepository;
import org.metalad.dump.MetadataDumper;
import org.metalad.dump.MetadataUrlParser;
import org.metalad.exceptions.ConfigurationException;
import org.metalad.extractor.ExtractionContext;
import org.metalad.extractor.ExtractorRegistry;
import org.metalad.extractor.MetadataExtraction;
import org.metalad.indexer.FlatIndexer;
import org.metalad.record.MetadataPath;
import org.metalad.record.MetadataRecord;
import org.metalad.record.RecordCodec;

/**
 * Command line client. Every command works on the dataset given with `-dataset`; its metadata
 * store is `.metalad/store` below the dataset directory.
 */
public class Client {
    private static final Log logClient = LogFactory.getLog(Client.class);

    private final PrintStream out;
    private final PrintStream err;
    private final InputStream in;

    public Client(PrintStream out, PrintStream err, InputStream in) {
        this.out = out;
        this.err = err;
        this.in = in;
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            System.out.println("MetaladClient - No arguments provided. Use flag '-h' for help.");
        }
        int exitCode = new Client(System.out, System.err, System.in).run(args);
        System.exit(exitCode);
    }

    /**
     * Execute one command
     *
     * @param args Command line arguments
     * @return Process exit code, 0 on success
     */
    public int run(String[] args) {
        Options options = addClientOptions();
        CommandLineParser parser = new DefaultParser(false);
        HelpFormatter formatter = new HelpFormatter();
        CommandLine cmd;
        try {
            cmd = parser.parse(options, args);

        } catch (ParseException e) {
            err.println("Error parsing cli arguments: " + e.getMessage());
            formatter.printHelp("Metalad Client Options", options);
            return 2;
        }

        if (cmd.hasOption("h")) {
            formatter.printHelp("MetaladClient", options);
            return 0;
        }

        try {
            if (!cmd.hasOption("dataset")) {
                throw new IllegalArgumentException(
                    "MetaladClient - dataset path must be supplied, use '-dataset [path]'");
            }
            Path datasetPath = Paths.get(cmd.getOptionValue("dataset"));

            if (cmd.hasOption("init")) {
                return init(cmd, datasetPath);
            }

            FileSystemRepository dataset = new FileSystemRepository(datasetPath);
            if (cmd.hasOption("extract")) {
                return extract(cmd, dataset);
            } else if (cmd.hasOption("add")) {
                return add(cmd, dataset);
            } else if (cmd.hasOption("dump")) {
                return dump(cmd, dataset);
            } else if (cmd.hasOption("aggregate")) {
                return aggregate(cmd, dataset);
            } else if (cmd.hasOption("conduct")) {
                return conduct(cmd, dataset);
            }
            err.println("MetaladClient - No command found, use -h for help.");
            return 2;

        } catch (ConfigurationException | IOException | IllegalArgumentException e) {
            String errMsg = "MetaladClient - " + e.getMessage();
            logClient.error(errMsg);
            err.println(errMsg);
            return 1;

        } catch (Exception e) {
            String errMsg = "MetaladClient - unexpected error: " + e;
            logClient.error(errMsg, e);
            err.println(errMsg);
            return 1;
        }
    }

    private static Options addClientOptions() {
        Options options = new Options();
        options.addOption("h", "help", false, "Show help options.");
        // Mandatory option
        options.addOption("dataset", "datasetpath", true, "Path to the dataset.");
        // Commands
        options.addOption("init", "initdataset", false, "Create a dataset and its store.");
        options.addOption("extract", "extractmetadata", false, "Run an extractor, print JSON.");
        options.addOption("add", "addmetadata", false, "Add JSON Lines records to the store.");
        options.addOption("dump", "dumpmetadata", false, "Print records selected by -url.");
        options.addOption("aggregate", "aggregatemetadata", false, "Aggregate sub-datasets.");
        options.addOption("conduct", "conductpipeline", true, "Run the pipeline in this file.");
        // Arguments
        options.addOption("id", "datasetid", true, "Dataset id (UUID) for -init.");
        options.addOption("version", "datasetversion", true, "Dataset version for -init.");
        options.addOption("extractor", "extractorname", true, "Extractor to run.");
        options.addOption("path", "filepath", true, "File to extract from, relative path.");
        options.addOption(Option.builder("param").longOpt("extractorparam").hasArgs()
                              .desc("Extractor parameter key=value, repeatable.").build());
        options.addOption("agentname", "agent_name", true, "Agent name of extracted records.");
        options.addOption("agentemail", "agent_email", true, "Agent email of extracted records.");
        options.addOption("input", "inputfile", true, "JSON Lines file for -add, default stdin.");
        options.addOption(
            "additional", "additionalvalues", true, "JSON object merged into added records.");
        options.addOption("allowoverride", "allow_override", false, "Allow overriding keys.");
        options.addOption("allowunknown", "allow_unknown", false, "Ignore unknown keys.");
        options.addOption("allowidmismatch", "allow_id_mismatch", false, "Allow foreign ids.");
        options.addOption("url", "metadataurl", true, "Metadata URL (tree or uuid) for -dump.");
        options.addOption("recursive", "recursivedump", false, "Dump everything below matches.");
        options.addOption("flat", "flatindex", false, "Print dumped metadata as flat index.");
        options.addOption("depth", "aggregatedepth", true, "Aggregation depth, -1 unlimited.");
        options.addOption(Option.builder("subpath").longOpt("subdatasetpath").hasArgs()
                              .desc("Sub-dataset to aggregate, repeatable.").build());
        options.addOption("jobs", "numberofjobs", true, "Number of pipeline workers.");
        return options;
    }

    private int init(CommandLine cmd, Path datasetPath) throws IOException {
        String id = cmd.getOptionValue("id");
        UUID datasetId = id == null ? UUID.randomUUID() : UUID.fromString(id);
        String version = cmd.getOptionValue("version", "1");
        FileSystemRepository dataset = FileSystemRepository.create(
            datasetPath, datasetId, version);
        MetadataStore.open(dataset.getStorePath());
        out.println("Initialized dataset " + datasetId + "@" + version + " at " + dataset
            .getPath());
        return 0;
    }

    private int extract(CommandLine cmd, FileSystemRepository dataset)
        throws ConfigurationException, IOException {
        String extractorName = cmd.getOptionValue("extractor");
        ensureNotNull(extractorName, "-extractor");
        Map<String, Object> parameters = new LinkedHashMap<>();
        String[] params = cmd.getOptionValues("param");
        if (params != null) {
            for (String param : params) {
                int separator = param.indexOf('=');
                if (separator <= 0) {
                    throw new IllegalArgumentException(
                        "Extractor parameter must be key=value: " + param);
                }
                parameters.put(param.substring(0, separator), param.substring(separator + 1));
            }
        }

        ExtractionContext context = cmd.hasOption("path")
            ? ExtractionContext.forFile(
                dataset, MetadataPath.of(cmd.getOptionValue("path")), parameters)
            : ExtractionContext.forDataset(dataset, parameters);
        MetadataRecord record = createExtraction(cmd).extract(extractorName, context);
        out.println(RecordCodec.toJson(record));
        return 0;
    }

    private int add(CommandLine cmd, FileSystemRepository dataset) throws IOException,
        NoSuchAlgorithmException, InterruptedException {
        Map<String, Object> additionalValues = cmd.hasOption("additional")
            ? RecordCodec.readMap(cmd.getOptionValue("additional")) : null;
        AddParameters parameters = new AddParameters(
            additionalValues, cmd.hasOption("allowoverride"), cmd.hasOption("allowunknown"),
            cmd.hasOption("allowidmismatch"));

        MetadataAdder adder = new MetadataAdder(
            MetadataStore.open(dataset.getStorePath()), dataset.getDatasetId());
        int added = 0;
        try (InputStream input = cmd.hasOption("input")
            ? Files.newInputStream(Paths.get(cmd.getOptionValue("input"))) : in;
             BufferedReader reader = new BufferedReader(
                 new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.trim().isEmpty()) {
                    continue;
                }
                try {
                    ObjectRef objectRef = adder.add(RecordCodec.readMap(line), parameters);
                    out.println("added " + objectRef);
                    added++;

                } catch (IllegalArgumentException iae) {
                    throw new IllegalArgumentException(
                        "Line " + lineNumber + ": " + iae.getMessage(), iae);
                }
            }
        }
        logClient.info("MetaladClient - added " + added + " record(s) to " + dataset);
        return 0;
    }

    private int dump(CommandLine cmd, FileSystemRepository dataset) throws IOException {
        MetadataDumper dumper = new MetadataDumper(MetadataStore.open(dataset.getStorePath()));
        List<MetadataRecord> records = dumper.dump(
            dataset.getDatasetId(), MetadataUrlParser.parse(cmd.getOptionValue("url")),
            cmd.hasOption("recursive"));
        if (cmd.hasOption("flat")) {
            FlatIndexer indexer = new FlatIndexer();
            for (MetadataRecord record : records) {
                out.println(RecordCodec.getMapper().writeValueAsString(indexer.index(record)));
            }
        } else {
            RecordCodec.writeJsonLines(records, out);
        }
        return 0;
    }

    private int aggregate(CommandLine cmd, FileSystemRepository dataset) throws IOException,
        InterruptedException {
        MetadataStore rootStore = MetadataStore.open(dataset.getStorePath());
        Aggregator aggregator = new Aggregator();
        List<AggregationResult> results;
        if (cmd.hasOption("subpath")) {
            List<MetadataPath> subPaths = new ArrayList<>();
            for (String subPath : cmd.getOptionValues("subpath")) {
                subPaths.add(MetadataPath.of(subPath));
            }
            results = aggregator.aggregate(dataset, rootStore, subPaths);
        } else {
            int depth = Integer.parseInt(cmd.getOptionValue("depth", "1"));
            results = aggregator.aggregate(dataset, rootStore, depth);
        }

        boolean failed = false;
        for (AggregationResult result : results) {
            out.println(result);
            failed |= result.getStatus() == AggregationResult.Status.ERROR;
        }
        return failed ? 1 : 0;
    }

    private int conduct(CommandLine cmd, FileSystemRepository dataset) throws IOException,
        InterruptedException {
        int jobs = Integer.parseInt(cmd.getOptionValue("jobs", "1"));
        RunSummary summary;
        try {
            PipelineDefinition definition = PipelineDefinition.load(
                Paths.get(cmd.getOptionValue("conduct")));
            StageContext context = new StageContext(dataset, createExtraction(cmd));
            Conductor conductor = StageRegistry.withBuiltins().createConductor(
                definition, context, jobs);
            summary = conductor.run();

        } catch (ConfigurationException ce) {
            summary = RunSummary.failed(ce.getMessage());
        }

        for (ItemResult result : summary.getResults()) {
            out.println(result);
        }
        out.println(summary);
        return summary.getExitCode();
    }

    private static MetadataExtraction createExtraction(CommandLine cmd) {
        String agentName = cmd.getOptionValue("agentname", System.getProperty("user.name"));
        String agentEmail = cmd.getOptionValue(
            "agentemail", agentName.trim().replaceAll("\\s+", ".") + "@localhost");
        return new MetadataExtraction(ExtractorRegistry.withBuiltins(), agentName, agentEmail);
    }

    private static void ensureNotNull(Object object, String argument) {
        if (object == null) {
            String errMsg = "MetaladClient - " + argument + " cannot be null.";
            throw new IllegalArgumentException(errMsg);
        }
    }
}
