package com.yang.generator.codegen.model.core.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Problems reported during one generation run, in report order.
 *
 * Warnings never stop a run (unless the caller asks for it); an error is the reason a run
 * was abandoned. Structure only: callers do the logging.
 */
@Getter
public class ToolDiagnostics {
    private final List<String> warnings = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    public void warn(String message) {
        warnings.add(message);
    }

    public void error(String message) {
        errors.add(message);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
