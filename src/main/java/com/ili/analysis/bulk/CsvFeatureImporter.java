package com.ili.analysis.bulk;

import com.ili.analysis.api.AnalysisInputException;
import com.ili.analysis.core.model.FeatureRecord;
import com.ili.analysis.core.model.SurveyRun;
import com.ili.analysis.rules.ClockPositions;
import com.ili.analysis.rules.DefaultFeatureTypeRules;
import com.ili.analysis.rules.FeatureTypeNormalizer;
import com.ili.analysis.rules.OrientationRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CSV importer for the canonical feature schema.
 *
 * <p>Expected header (column order is free, only {@code distance} is mandatory):</p>
 * <pre>
 * feature_id,distance,joint_number,relative_position,clock_position,feature_type,orientation,depth_percent,length,width,wall_thickness
 * F-001,100.0,1,0.0,3:00,Metal Loss,EXT,15,1.2,0.8,0.25
 * </pre>
 *
 * <p>Clock positions, orientations and feature-type labels are normalized on the way in.
 * Unparseable optional numbers become absent. Rows with a missing or negative distance or a
 * negative depth are dropped and reported as import errors. A row without a feature id is
 * given {@code <runId>-<line>}.</p>
 */
public class CsvFeatureImporter implements FeatureImporter {
    private static final Logger log = LoggerFactory.getLogger(CsvFeatureImporter.class);
    private static final int PROGRESS_INTERVAL = 1_000;

    private final FeatureTypeNormalizer typeNormalizer;

    public CsvFeatureImporter() {
        this(DefaultFeatureTypeRules.createDefaultNormalizer());
    }

    public CsvFeatureImporter(FeatureTypeNormalizer typeNormalizer) {
        this.typeNormalizer = typeNormalizer;
    }

    @Override
    public ImportResult importRun(InputStream input, String runId, ProgressCallback callback) {
        return importRun(new InputStreamReader(input, StandardCharsets.UTF_8), runId, callback);
    }

    /**
     * @throws AnalysisInputException if the input is empty or has no {@code distance} column
     * @throws UncheckedIOException   if reading fails
     */
    @Override
    public ImportResult importRun(Reader reader, String runId, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ImportResult.ImportError> errors = new ArrayList<>();
        List<FeatureRecord> features = new ArrayList<>();
        long totalRecords = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String headerLine = br.readLine();
            if (headerLine == null) {
                throw new AnalysisInputException("Run " + runId + ": input is empty");
            }
            Map<String, Integer> columns = indexHeader(splitLine(stripBom(headerLine)));
            if (!columns.containsKey("distance")) {
                throw new AnalysisInputException("Run " + runId + ": no distance column in header " + columns.keySet());
            }

            String line;
            long lineNumber = 1;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                totalRecords++;
                Row row = new Row(splitLine(line), columns);
                String featureId = row.text("feature_id");
                if (featureId == null) {
                    featureId = runId + "-" + lineNumber;
                }

                try {
                    features.add(toRecord(row, runId, featureId));
                } catch (IllegalArgumentException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, featureId, e.getMessage()));
                    log.warn("import.error run={} line={} featureId={} error={}", runId, lineNumber, featureId, e.getMessage());
                }

                if (totalRecords % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(totalRecords, -1, "Processed " + totalRecords + " rows");
                }
            }
        } catch (IOException e) {
            log.error("import.failed run={} error={}", runId, e.getMessage());
            throw new UncheckedIOException("Failed to read run " + runId, e);
        }

        ImportResult result = new ImportResult(new SurveyRun(runId, features), totalRecords, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private FeatureRecord toRecord(Row row, String runId, String featureId) {
        Double distance = row.number("distance");
        if (distance == null) {
            throw new IllegalArgumentException("distance is missing or not a number");
        }
        Double joint = row.number("joint_number");
        return FeatureRecord.builder()
                .runId(runId)
                .featureId(featureId)
                .distance(distance)
                .jointNumber(joint != null ? (int) Math.round(joint) : null)
                .relativePosition(row.number("relative_position"))
                .clockDeg(ClockPositions.toDegrees(row.text("clock_position")))
                .category(typeNormalizer.normalize(row.text("feature_type")))
                .orientation(OrientationRules.normalize(row.text("orientation")))
                .depthPct(row.number("depth_percent"))
                .lengthIn(row.number("length"))
                .widthIn(row.number("width"))
                .wallThicknessIn(row.number("wall_thickness"))
                .build();
    }

    private static Map<String, Integer> indexHeader(List<String> header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            columns.putIfAbsent(header.get(i).trim().toLowerCase(Locale.ROOT), i);
        }
        return columns;
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }

    /**
     * Splits one CSV line, honouring double-quoted fields with {@code ""} escapes.
     */
    static List<String> splitLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    private static final class Row {
        private final List<String> fields;
        private final Map<String, Integer> columns;

        private Row(List<String> fields, Map<String, Integer> columns) {
            this.fields = fields;
            this.columns = columns;
        }

        String text(String column) {
            Integer index = columns.get(column);
            if (index == null || index >= fields.size()) {
                return null;
            }
            String value = fields.get(index).trim();
            return value.isEmpty() ? null : value;
        }

        Double number(String column) {
            String value = text(column);
            if (value == null) {
                return null;
            }
            try {
                double parsed = Double.parseDouble(value);
                return Double.isNaN(parsed) ? null : parsed;
            } catch (NumberFormatException e) {
                log.debug("Non-numeric {} value '{}' treated as absent", column, value);
                return null;
            }
        }
    }
}
