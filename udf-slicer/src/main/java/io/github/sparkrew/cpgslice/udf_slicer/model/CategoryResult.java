package io.github.sparkrew.cpgslice.udf_slicer.model;

import java.util.List;

/**
 * Outcome of one verification category.
 */
public record CategoryResult(boolean passed, List<String> issues) {

    public CategoryResult {
        issues = List.copyOf(issues);
    }
}
