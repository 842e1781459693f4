package com.ili.analysis.bulk;

import java.io.InputStream;
import java.io.Reader;

/**
 * Reads one survey's feature list in the canonical schema.
 * Vendor-specific column mapping happens before this boundary.
 */
public interface FeatureImporter {

    /**
     * Imports a survey from an input stream (UTF-8).
     *
     * @param input    the input stream to read from
     * @param runId    identifier assigned to the survey
     * @param callback optional progress callback
     * @return the import result
     */
    ImportResult importRun(InputStream input, String runId, ProgressCallback callback);

    /**
     * Imports a survey from a reader.
     */
    ImportResult importRun(Reader reader, String runId, ProgressCallback callback);

    /**
     * Returns the format supported by this importer (e.g., "csv").
     */
    String getFormat();
}
