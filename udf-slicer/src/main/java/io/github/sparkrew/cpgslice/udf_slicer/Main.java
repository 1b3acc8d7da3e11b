package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.ExtractionResult;
import io.github.sparkrew.cpgslice.udf_slicer.model.Graph;
import io.github.sparkrew.cpgslice.udf_slicer.model.PipelineResult;
import io.github.sparkrew.cpgslice.udf_slicer.model.SliceResult;
import io.github.sparkrew.cpgslice.udf_slicer.model.VerificationReport;
import io.github.sparkrew.cpgslice.udf_slicer.utils.CpgNames;
import io.github.sparkrew.cpgslice.udf_slicer.utils.IssueLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

public class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_VERIFICATION_FAILED = 1;
    static final int EXIT_IO_ERROR = 2;

    static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * The command line with every subcommand registered. Unreadable input and unwritable output end the command
     * with {@link #EXIT_IO_ERROR}.
     */
    static CommandLine commandLine() {
        return new CommandLine(new CLIEntryPoint())
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    if (ex instanceof GraphInputUnavailableException || ex instanceof GraphOutputException) {
                        log.error(ex.getMessage(), ex.getCause());
                        return EXIT_IO_ERROR;
                    }
                    throw ex;
                });
    }

    @CommandLine.Command(
            name = "cpgslice",
            subcommands = {Extractor.class, Filter.class, ExtractionChecker.class, FilterChecker.class,
                    Processor.class, SchemaReport.class},
            mixinStandardHelpOptions = true,
            version = "0.1")
    public static class CLIEntryPoint implements Runnable {
        @Override
        public void run() {
            CommandLine.usage(this, System.out);
        }
    }

    @CommandLine.Command(name = "extract", mixinStandardHelpOptions = true, version = "0.1",
            description = "Extract the edges of the given types and the nodes they touch.")
    static class Extractor implements Callable<Integer> {
        @CommandLine.Parameters(index = "0", paramLabel = "INPUT_DOT", description = "The exported graph")
        Path input;

        @CommandLine.Parameters(index = "1", paramLabel = "OUTPUT_DIR",
                description = "Directory receiving <TYPES>_original.dot")
        Path outputDir;

        @CommandLine.Option(
                names = {"-e", "--edge-types"},
                paramLabel = "EDGE-TYPES",
                description = "Edge types to extract, comma separated or repeated (default: ${DEFAULT-VALUE})",
                split = ",",
                defaultValue = "CFG,CALL"
        )
        List<String> edgeTypes;

        @Override
        public Integer call() {
            String text = SlicePipeline.read(GraphTextSource.ofPath(input));
            ExtractionResult result = SubgraphExtractor.extract(GraphParser.parse(text, Set.of()), edgeTypes);
            Path target = outputDir.resolve(CpgNames.joinEdgeTypes(edgeTypes) + "_original.dot");
            SlicePipeline.writeText(target, SubgraphExtractor.render(result));
            log.info("Subgraph written to: {}", target);
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "filter", mixinStandardHelpOptions = true, version = "0.1",
            description = "Keep only user-defined functions, their CFG bodies and the calls between them.")
    static class Filter implements Callable<Integer> {
        @CommandLine.Parameters(index = "0", paramLabel = "INPUT_DOT", description = "A CFG+CALL subgraph")
        Path input;

        @CommandLine.Parameters(index = "1", paramLabel = "OUTPUT_DIR",
                description = "Directory receiving <base>_udf_filtered.dot")
        Path outputDir;

        @Override
        public Integer call() {
            String text = SlicePipeline.read(GraphTextSource.ofPath(input));
            Graph graph = GraphParser.parse(text, CpgNames.CLASSIFICATION_KEYS);
            SliceResult result = UdfFilter.filter(graph);
            String baseName = baseName(input);
            Path target = outputDir.resolve(baseName + "_udf_filtered.dot");
            SlicePipeline.writeText(target, UdfFilter.render(graph, result, baseName));
            log.info("UDF-filtered graph written to: {}", target);
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "verify-extraction", mixinStandardHelpOptions = true, version = "0.1",
            description = "Verify an extracted subgraph against the original graph.")
    static class ExtractionChecker implements Callable<Integer> {
        @CommandLine.Parameters(index = "0", paramLabel = "ORIGINAL_DOT", description = "The exported graph")
        Path original;

        @CommandLine.Parameters(index = "1", paramLabel = "EXTRACTED_DOT", description = "The extracted subgraph")
        Path extracted;

        @CommandLine.Option(
                names = {"-e", "--edge-types"},
                paramLabel = "EDGE-TYPES",
                description = "Edge types that were extracted (default: ${DEFAULT-VALUE})",
                split = ",",
                defaultValue = "CFG,CALL"
        )
        List<String> edgeTypes;

        @CommandLine.Option(
                names = {"-o", "--output-report"},
                paramLabel = "REPORT",
                description = "Write the verification report to this JSON file"
        )
        Path reportPath;

        @CommandLine.Option(
                names = {"--max-issues"},
                paramLabel = "N",
                description = "Maximum issues listed per problem kind. The rest are dropped from the report "
                        + "and counted in a trailing line. 0 keeps every issue (default: ${DEFAULT-VALUE})",
                defaultValue = "" + IssueLists.DEFAULT_MAX_ISSUES
        )
        int maxIssues;

        @Override
        public Integer call() {
            Graph originalGraph = GraphParser.parse(SlicePipeline.read(GraphTextSource.ofPath(original)));
            Graph extractedGraph = GraphParser.parse(SlicePipeline.read(GraphTextSource.ofPath(extracted)));
            VerificationReport report = ExtractionVerifier.verify(originalGraph, extractedGraph, edgeTypes,
                    maxIssues);
            if (reportPath != null) {
                ReportWriter.write(reportPath, ReportWriter.document(original.toString(), extracted.toString(),
                        originalGraph, extractedGraph, report));
            }
            return report.overallPassed() ? EXIT_OK : EXIT_VERIFICATION_FAILED;
        }
    }

    @CommandLine.Command(name = "verify-filter", mixinStandardHelpOptions = true, version = "0.1",
            description = "Verify a UDF-filtered graph against the subgraph it was filtered from.")
    static class FilterChecker implements Callable<Integer> {
        @CommandLine.Parameters(index = "0", paramLabel = "ORIGINAL_DOT", description = "The CFG+CALL subgraph")
        Path original;

        @CommandLine.Parameters(index = "1", paramLabel = "FILTERED_DOT", description = "The UDF-filtered graph")
        Path filtered;

        @CommandLine.Option(
                names = {"-o", "--output-report"},
                paramLabel = "REPORT",
                description = "Write the verification report to this JSON file"
        )
        Path reportPath;

        @CommandLine.Option(
                names = {"--max-issues"},
                paramLabel = "N",
                description = "Maximum issues listed per problem kind. The rest are dropped from the report "
                        + "and counted in a trailing line. 0 keeps every issue (default: ${DEFAULT-VALUE})",
                defaultValue = "" + IssueLists.DEFAULT_MAX_ISSUES
        )
        int maxIssues;

        @Override
        public Integer call() {
            Graph originalGraph = GraphParser.parse(SlicePipeline.read(GraphTextSource.ofPath(original)));
            Graph filteredGraph = GraphParser.parse(SlicePipeline.read(GraphTextSource.ofPath(filtered)));
            VerificationReport report = UdfFilterVerifier.verify(originalGraph, filteredGraph, maxIssues);
            if (reportPath != null) {
                ReportWriter.write(reportPath, ReportWriter.document(original.toString(), filtered.toString(),
                        originalGraph, filteredGraph, report));
            }
            return report.overallPassed() ? EXIT_OK : EXIT_VERIFICATION_FAILED;
        }
    }

    @CommandLine.Command(name = "process", mixinStandardHelpOptions = true, version = "0.1",
            description = "Extract, filter and verify one exported graph.")
    static class Processor implements Callable<Integer> {
        @CommandLine.Parameters(index = "0", paramLabel = "INPUT_DOT", description = "The exported graph")
        Path input;

        @CommandLine.Parameters(index = "1", paramLabel = "OUTPUT_DIR",
                description = "Directory receiving the subgraph and udf folders")
        Path outputDir;

        @CommandLine.Option(
                names = {"-e", "--edge-types"},
                paramLabel = "EDGE-TYPES",
                description = "Edge types to extract, comma separated or repeated (default: ${DEFAULT-VALUE})",
                split = ",",
                defaultValue = "CFG,CALL"
        )
        List<String> edgeTypes;

        @CommandLine.Option(
                names = {"--skip-verification"},
                description = "Only produce the graphs, do not verify them"
        )
        boolean skipVerification;

        @CommandLine.Option(
                names = {"--max-issues"},
                paramLabel = "N",
                description = "Maximum issues listed per problem kind. The rest are dropped from the report "
                        + "and counted in a trailing line. 0 keeps every issue (default: ${DEFAULT-VALUE})",
                defaultValue = "" + IssueLists.DEFAULT_MAX_ISSUES
        )
        int maxIssues;

        @Override
        public Integer call() {
            PipelineResult result = SlicePipeline.process(GraphTextSource.ofPath(input), outputDir, edgeTypes,
                    !skipVerification, maxIssues);
            if (result.verified() && !result.passed()) {
                return EXIT_VERIFICATION_FAILED;
            }
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "schema", mixinStandardHelpOptions = true, version = "0.1",
            description = "Report node types and attribute keys across many filtered graphs.")
    static class SchemaReport implements Callable<Integer> {
        @CommandLine.Option(
                names = {"--root"},
                paramLabel = "ROOT",
                description = "Directory searched recursively for graphs",
                required = true
        )
        Path root;

        @CommandLine.Option(
                names = {"--out"},
                paramLabel = "OUT",
                description = "Directory receiving the JSON reports",
                required = true
        )
        Path outDir;

        @CommandLine.Option(
                names = {"--pattern"},
                paramLabel = "TAIL",
                description = "Relative path tail a graph must match (default: ${DEFAULT-VALUE})",
                defaultValue = SchemaReporter.DEFAULT_PATTERN
        )
        String pattern;

        @Override
        public Integer call() {
            SchemaReporter.report(root, outDir, pattern);
            return EXIT_OK;
        }
    }

    static String baseName(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".dot") ? name.substring(0, name.length() - ".dot".length()) : name;
    }
}
