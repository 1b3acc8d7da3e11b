package io.github.sparkrew.cpgslice.udf_slicer.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-category verification outcome. A category passes when it collected no issues; the report passes when every
 * category passes. Reports are assembled through {@link Builder} and are immutable afterwards.
 */
public record VerificationReport(Map<String, CategoryResult> categories, boolean overallPassed) {

    public VerificationReport {
        categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories));
    }

    public CategoryResult category(String name) {
        return categories.get(name);
    }

    public List<String> failedCategories() {
        return categories.entrySet().stream()
                .filter(e -> !e.getValue().passed())
                .map(Map.Entry::getKey)
                .toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<String, List<String>> issuesByCategory = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Register a category so that it shows up in the report even when it collects no issues.
         */
        public Builder category(String name) {
            issuesByCategory.computeIfAbsent(name, k -> new ArrayList<>());
            return this;
        }

        public Builder issue(String category, String issue) {
            issuesByCategory.computeIfAbsent(category, k -> new ArrayList<>()).add(issue);
            return this;
        }

        public Builder issues(String category, Collection<String> issues) {
            issuesByCategory.computeIfAbsent(category, k -> new ArrayList<>()).addAll(issues);
            return this;
        }

        public VerificationReport build() {
            Map<String, CategoryResult> categories = new LinkedHashMap<>();
            boolean allPassed = true;
            for (Map.Entry<String, List<String>> entry : issuesByCategory.entrySet()) {
                boolean passed = entry.getValue().isEmpty();
                categories.put(entry.getKey(), new CategoryResult(passed, entry.getValue()));
                allPassed &= passed;
            }
            return new VerificationReport(categories, allPassed);
        }
    }
}
