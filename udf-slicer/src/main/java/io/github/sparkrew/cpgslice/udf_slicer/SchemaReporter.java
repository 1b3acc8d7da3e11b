package io.github.sparkrew.cpgslice.udf_slicer;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.github.sparkrew.cpgslice.udf_slicer.model.FileSchema;
import io.github.sparkrew.cpgslice.udf_slicer.model.Graph;
import io.github.sparkrew.cpgslice.udf_slicer.model.NodeRecord;
import io.github.sparkrew.cpgslice.udf_slicer.model.SchemaReport;
import io.github.sparkrew.cpgslice.udf_slicer.utils.CpgNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Summarizes which node types and attribute keys occur across many filtered graphs.
 * <p>
 * For every matching file the node types are collected together with, per type, the keys seen on any node ("any")
 * and on every node ("all"). Across files the report lists the types present everywhere, the per-type lenient and
 * strict key sets, the cross-type views and the global key union.
 */
public class SchemaReporter {

    public static final String DEFAULT_PATTERN = "udf/CFG_CALL_original_udf_filtered.dot";

    public static final String NODE_TYPES_FILE = "node_types.json";
    public static final String PROPERTIES_BY_TYPE_FILE = "properties_by_type.json";
    public static final String PROPERTIES_CROSS_TYPES_FILE = "properties_cross_types.json";
    public static final String PROPERTIES_GLOBAL_FILE = "properties_global.json";

    private static final Logger log = LoggerFactory.getLogger(SchemaReporter.class);
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    /**
     * Find all matching graphs under {@code root}, build the four reports and write them to {@code outDir}.
     *
     * @return the written reports
     * @throws GraphInputUnavailableException if nothing matches or a file cannot be read
     * @throws GraphOutputException           if a report cannot be written
     */
    public static SchemaReport report(Path root, Path outDir, String pattern) {
        List<Path> files = findFiles(root, pattern);
        if (files.isEmpty()) {
            throw new GraphInputUnavailableException("No files matched pattern '" + pattern + "' under " + root);
        }
        log.info("Found {} graph files matching {}", files.size(), pattern);

        Map<String, FileSchema> perFile = new LinkedHashMap<>();
        for (Path file : files) {
            String text = SlicePipeline.read(GraphTextSource.ofPath(file));
            perFile.put(relativeName(root, file), summarize(GraphParser.parse(text)));
        }
        SchemaReport report = buildReports(root.toString(), pattern, perFile, Instant.now().toString());
        writeJson(outDir.resolve(NODE_TYPES_FILE), report.nodeTypes());
        writeJson(outDir.resolve(PROPERTIES_BY_TYPE_FILE), report.propertiesByType());
        writeJson(outDir.resolve(PROPERTIES_CROSS_TYPES_FILE), report.crossTypes());
        writeJson(outDir.resolve(PROPERTIES_GLOBAL_FILE), report.global());
        log.info("Schema report written to: {}", outDir);
        return report;
    }

    /**
     * Files whose path relative to {@code root} ends with the path segments of {@code pattern}, sorted.
     */
    public static List<Path> findFiles(Path root, String pattern) {
        Path tail = Path.of(pattern);
        String fileName = tail.getFileName().toString();
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().equals(fileName))
                    .filter(p -> root.relativize(p).endsWith(tail))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new GraphInputUnavailableException(root.toString(), e);
        }
    }

    /**
     * Node types of one graph with the keys seen on any and on every node of each type. Nodes without a label are
     * ignored.
     */
    public static FileSchema summarize(Graph graph) {
        SortedSet<String> types = new TreeSet<>();
        SortedMap<String, SortedSet<String>> any = new TreeMap<>();
        SortedMap<String, SortedSet<String>> all = new TreeMap<>();
        for (NodeRecord node : graph.nodes().values()) {
            String type = node.attributes().get(CpgNames.LABEL);
            if (type == null) {
                continue;
            }
            Set<String> keys = new HashSet<>(node.attributes().keySet());
            keys.remove(CpgNames.LABEL);
            types.add(type);
            any.computeIfAbsent(type, k -> new TreeSet<>()).addAll(keys);
            SortedSet<String> common = all.get(type);
            if (common == null) {
                all.put(type, new TreeSet<>(keys));
            } else {
                common.retainAll(keys);
            }
        }
        return new FileSchema(types, any, all);
    }

    /**
     * Build the four report documents from per-file summaries.
     *
     * @param root        root directory, as written into the reports
     * @param pattern     the matched path tail
     * @param perFile     summaries by relative file name, in output order
     * @param generatedAt timestamp written into every report
     */
    public static SchemaReport buildReports(String root, String pattern, Map<String, FileSchema> perFile,
                                            String generatedAt) {
        List<String> fileNames = new ArrayList<>(perFile.keySet());
        SortedSet<String> allTypes = new TreeSet<>();
        perFile.values().forEach(f -> allTypes.addAll(f.types()));
        SortedSet<String> commonTypes = intersection(perFile.values().stream().map(FileSchema::types).toList());

        Map<String, SortedSet<String>> unionAnyByType = new TreeMap<>();
        Map<String, SortedSet<String>> intersectionAllByType = new TreeMap<>();
        Map<String, SchemaReport.TypeProperties> byType = new LinkedHashMap<>();
        for (String type : allTypes) {
            List<String> present = fileNames.stream().filter(f -> perFile.get(f).types().contains(type)).toList();
            List<Set<String>> anySets = new ArrayList<>();
            List<Set<String>> allSets = new ArrayList<>();
            Map<String, SchemaReport.FileKeys> byFile = new LinkedHashMap<>();
            for (String file : present) {
                SortedSet<String> any = perFile.get(file).anyKeys().get(type);
                SortedSet<String> all = perFile.get(file).allKeys().get(type);
                anySets.add(any);
                allSets.add(all);
                byFile.put(file, new SchemaReport.FileKeys(List.copyOf(any), List.copyOf(all)));
            }
            SortedSet<String> unionAny = union(anySets);
            SortedSet<String> intersectionAny = intersection(anySets);
            SortedSet<String> unionAll = union(allSets);
            SortedSet<String> intersectionAll = intersection(allSets);
            unionAnyByType.put(type, unionAny);
            intersectionAllByType.put(type, intersectionAll);

            byType.put(type, new SchemaReport.TypeProperties(
                    present,
                    new SchemaReport.LenientKeys(List.copyOf(intersectionAny),
                            List.copyOf(difference(unionAny, intersectionAny)), List.copyOf(unionAny)),
                    new SchemaReport.StrictKeys(List.copyOf(intersectionAll),
                            List.copyOf(difference(unionAll, intersectionAll)), List.copyOf(unionAll)),
                    byFile));
        }

        List<SchemaReport.TypePresence> nonIntersectional = new ArrayList<>();
        Map<String, Map<String, Integer>> presenceMatrix = new LinkedHashMap<>();
        for (String type : allTypes) {
            Map<String, Integer> row = new LinkedHashMap<>();
            SortedSet<String> presentIn = new TreeSet<>();
            for (String file : fileNames) {
                boolean present = perFile.get(file).types().contains(type);
                row.put(file, present ? 1 : 0);
                if (present) {
                    presentIn.add(file);
                }
            }
            presenceMatrix.put(type, row);
            if (!commonTypes.contains(type)) {
                nonIntersectional.add(new SchemaReport.TypePresence(type, List.copyOf(presentIn)));
            }
        }
        SchemaReport.NodeTypes nodeTypes = new SchemaReport.NodeTypes(generatedAt, root, pattern, fileNames,
                List.copyOf(commonTypes), nonIntersectional, presenceMatrix);

        SortedSet<String> interTypesAny = intersection(unionAnyByType.values());
        SortedSet<String> unionTypesAny = union(unionAnyByType.values());
        SortedSet<String> interTypesAll = intersection(intersectionAllByType.values());
        SortedSet<String> unionTypesAll = union(intersectionAllByType.values());
        SortedMap<String, List<String>> coverage = new TreeMap<>();
        unionAnyByType.forEach((type, keys) ->
                keys.forEach(key -> coverage.computeIfAbsent(key, k -> new ArrayList<>()).add(type)));
        SchemaReport.CrossTypes crossTypes = new SchemaReport.CrossTypes(generatedAt, root, pattern,
                new SchemaReport.CrossTypesLenient(List.copyOf(interTypesAny), List.copyOf(unionTypesAny),
                        List.copyOf(difference(unionTypesAny, interTypesAny)), coverage),
                new SchemaReport.CrossTypesStrict(List.copyOf(interTypesAll), List.copyOf(unionTypesAll),
                        List.copyOf(difference(unionTypesAll, interTypesAll))));

        return new SchemaReport(
                nodeTypes,
                new SchemaReport.PropertiesByType(generatedAt, root, pattern, byType),
                crossTypes,
                new SchemaReport.GlobalProperties(generatedAt, root, pattern, List.copyOf(unionTypesAny)));
    }

    private static String relativeName(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static SortedSet<String> union(Collection<? extends Set<String>> sets) {
        SortedSet<String> result = new TreeSet<>();
        sets.forEach(result::addAll);
        return result;
    }

    // Empty when there is nothing to intersect.
    private static SortedSet<String> intersection(Collection<? extends Set<String>> sets) {
        SortedSet<String> result = null;
        for (Set<String> set : sets) {
            if (result == null) {
                result = new TreeSet<>(set);
            } else {
                result.retainAll(set);
            }
        }
        return result == null ? new TreeSet<>() : result;
    }

    private static SortedSet<String> difference(Set<String> from, Set<String> remove) {
        SortedSet<String> result = new TreeSet<>(from);
        result.removeAll(remove);
        return result;
    }

    private static void writeJson(Path target, Object content) {
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                gson.toJson(content, writer);
            }
            log.info("Written: {}", target);
        } catch (IOException e) {
            log.error("Failed to write {}", target, e);
            throw new GraphOutputException(target.toString(), e);
        }
    }
}
