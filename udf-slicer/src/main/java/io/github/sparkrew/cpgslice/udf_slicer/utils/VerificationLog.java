package io.github.sparkrew.cpgslice.udf_slicer.utils;

import io.github.sparkrew.cpgslice.udf_slicer.model.CategoryResult;
import io.github.sparkrew.cpgslice.udf_slicer.model.VerificationReport;
import org.slf4j.Logger;

import java.util.Locale;
import java.util.Map;

/**
 * Logs the summary of a verification report.
 */
public class VerificationLog {

    public static void logSummary(Logger log, String title, VerificationReport report) {
        log.info("{} summary", title);
        for (Map.Entry<String, CategoryResult> entry : report.categories().entrySet()) {
            String category = entry.getKey().toUpperCase(Locale.ROOT).replace('_', ' ');
            CategoryResult result = entry.getValue();
            if (result.passed()) {
                log.info("{}: PASSED", category);
            } else {
                log.warn("{}: FAILED", category);
                result.issues().forEach(issue -> log.warn("   - {}", issue));
            }
        }
        if (report.overallPassed()) {
            log.info("OVERALL: PASSED");
        } else {
            log.warn("OVERALL: FAILED ({})", String.join(", ", report.failedCategories()));
        }
    }
}
