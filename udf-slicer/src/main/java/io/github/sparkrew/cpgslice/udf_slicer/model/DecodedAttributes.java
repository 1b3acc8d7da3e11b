package io.github.sparkrew.cpgslice.udf_slicer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decoded key/value pairs of one attribute block and the fragments the decoder could not make sense of.
 */
public record DecodedAttributes(Map<String, String> values, List<String> skippedFragments) {

    public DecodedAttributes {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        skippedFragments = List.copyOf(skippedFragments);
    }
}
