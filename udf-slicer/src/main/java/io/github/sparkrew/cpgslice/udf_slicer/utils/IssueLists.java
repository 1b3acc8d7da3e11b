package io.github.sparkrew.cpgslice.udf_slicer.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Helpers for keeping verification issue lists readable on large graphs.
 */
public class IssueLists {

    // Keep every issue unless a limit is asked for.
    public static final int DEFAULT_MAX_ISSUES = 0;

    /**
     * Keep at most {@code maxIssues} issues and summarize the rest in one trailing line.
     * A non-positive limit keeps everything.
     */
    public static List<String> capped(Collection<String> issues, int maxIssues) {
        if (maxIssues <= 0 || issues.size() <= maxIssues) {
            return new ArrayList<>(issues);
        }
        List<String> capped = new ArrayList<>(issues.stream().limit(maxIssues).toList());
        capped.add("... and " + (issues.size() - maxIssues) + " more");
        return capped;
    }
}
