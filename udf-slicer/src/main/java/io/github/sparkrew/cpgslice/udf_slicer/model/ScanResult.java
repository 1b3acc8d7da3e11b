package io.github.sparkrew.cpgslice.udf_slicer.model;

import java.util.List;

/**
 * Declarations in source order together with the diagnostics for fragments that could not be scanned.
 */
public record ScanResult(List<Declaration> declarations, List<ScanDiagnostic> diagnostics) {

    public ScanResult {
        declarations = List.copyOf(declarations);
        diagnostics = List.copyOf(diagnostics);
    }
}
