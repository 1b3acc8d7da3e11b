package io.github.sparkrew.cpgslice.udf_slicer.model;

import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Node types found in one graph file and, per type, the attribute keys seen on any node of that type and on every
 * node of that type. The {@code label} key is never included.
 */
public record FileSchema(
        SortedSet<String> types,
        SortedMap<String, SortedSet<String>> anyKeys,
        SortedMap<String, SortedSet<String>> allKeys
) {
}
