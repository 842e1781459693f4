package com.ili.analysis.bulk;

import com.ili.analysis.core.model.SurveyRun;

import java.util.List;
import java.util.Objects;

/**
 * Result of importing one survey.
 *
 * @param run          the valid rows as a survey run
 * @param totalRecords number of data rows read
 * @param errors       rows that were dropped, with the reason
 */
public record ImportResult(SurveyRun run, long totalRecords, List<ImportError> errors) {

    public ImportResult {
        Objects.requireNonNull(run, "run is required");
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long importedCount() {
        return run.size();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A dropped input row.
     *
     * @param lineNumber the line number in the input (1-based, header is line 1)
     * @param featureId  the feature identifier of the row, if any
     * @param message    the reason
     */
    public record ImportError(long lineNumber, String featureId, String message) {}

    @Override
    public String toString() {
        return "ImportResult{run=" + run.runId() +
                ", total=" + totalRecords +
                ", imported=" + importedCount() +
                ", errors=" + errors.size() + '}';
    }
}
