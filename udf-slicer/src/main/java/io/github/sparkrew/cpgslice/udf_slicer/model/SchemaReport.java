package io.github.sparkrew.cpgslice.udf_slicer.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

/**
 * The four documents of a schema report. Field names are part of the output format.
 */
public record SchemaReport(
        NodeTypes nodeTypes,
        PropertiesByType propertiesByType,
        CrossTypes crossTypes,
        GlobalProperties global
) {

    public record NodeTypes(
            @SerializedName("generated_at_utc") String generatedAtUtc,
            @SerializedName("root") String root,
            @SerializedName("pattern") String pattern,
            @SerializedName("files") List<String> files,
            @SerializedName("intersectional_types") List<String> intersectionalTypes,
            @SerializedName("non_intersectional_types") List<TypePresence> nonIntersectionalTypes,
            @SerializedName("presence_matrix") Map<String, Map<String, Integer>> presenceMatrix
    ) {
    }

    public record TypePresence(
            @SerializedName("type") String type,
            @SerializedName("present_in") List<String> presentIn
    ) {
    }

    public record PropertiesByType(
            @SerializedName("generated_at_utc") String generatedAtUtc,
            @SerializedName("root") String root,
            @SerializedName("pattern") String pattern,
            @SerializedName("types") Map<String, TypeProperties> types
    ) {
    }

    public record TypeProperties(
            @SerializedName("files_present_in") List<String> filesPresentIn,
            @SerializedName("lenient") LenientKeys lenient,
            @SerializedName("strict") StrictKeys strict,
            @SerializedName("by_file") Map<String, FileKeys> byFile
    ) {
    }

    /**
     * Keys seen on at least one node of the type, compared across files.
     */
    public record LenientKeys(
            @SerializedName("intersection") List<String> intersection,
            @SerializedName("non_intersection") List<String> nonIntersection,
            @SerializedName("union") List<String> union
    ) {
    }

    /**
     * Keys seen on every node of the type, compared across files.
     */
    public record StrictKeys(
            @SerializedName("intersection_all_nodes") List<String> intersectionAllNodes,
            @SerializedName("non_intersection_all_nodes") List<String> nonIntersectionAllNodes,
            @SerializedName("union_all_nodes") List<String> unionAllNodes
    ) {
    }

    public record FileKeys(
            @SerializedName("any") List<String> any,
            @SerializedName("all") List<String> all
    ) {
    }

    public record CrossTypes(
            @SerializedName("generated_at_utc") String generatedAtUtc,
            @SerializedName("root") String root,
            @SerializedName("pattern") String pattern,
            @SerializedName("lenient") CrossTypesLenient lenient,
            @SerializedName("strict") CrossTypesStrict strict
    ) {
    }

    public record CrossTypesLenient(
            @SerializedName("intersection_across_types") List<String> intersectionAcrossTypes,
            @SerializedName("union_across_types") List<String> unionAcrossTypes,
            @SerializedName("non_intersection_across_types") List<String> nonIntersectionAcrossTypes,
            @SerializedName("coverage") Map<String, List<String>> coverage
    ) {
    }

    public record CrossTypesStrict(
            @SerializedName("intersection_across_types_all_nodes") List<String> intersectionAcrossTypesAllNodes,
            @SerializedName("union_across_types_all_nodes") List<String> unionAcrossTypesAllNodes,
            @SerializedName("non_intersection_across_types_all_nodes") List<String> nonIntersectionAcrossTypesAllNodes
    ) {
    }

    public record GlobalProperties(
            @SerializedName("generated_at_utc") String generatedAtUtc,
            @SerializedName("root") String root,
            @SerializedName("pattern") String pattern,
            @SerializedName("global_property_union") List<String> globalPropertyUnion
    ) {
    }
}
