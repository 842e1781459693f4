package com.ili.analysis.bulk;

import com.ili.analysis.api.AnalysisInputException;
import com.ili.analysis.core.model.FeatureCategory;
import com.ili.analysis.core.model.FeatureRecord;
import com.ili.analysis.core.model.Orientation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CsvFeatureImporter Tests")
class CsvFeatureImporterTest {

    private static final String HEADER =
            "feature_id,distance,joint_number,relative_position,clock_position,feature_type,orientation,depth_percent,length,width,wall_thickness\n";

    private CsvFeatureImporter importer;

    @BeforeEach
    void setUp() {
        importer = new CsvFeatureImporter();
    }

    private ImportResult importCsv(String csv) {
        return importer.importRun(new StringReader(csv), "2015", ProgressCallback.NOOP);
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Should import the canonical survey fixture")
        void testFixture() throws IOException {
            ImportResult result;
            try (InputStream in = getClass().getResourceAsStream("/surveys/run_2015.csv")) {
                assertNotNull(in);
                result = importer.importRun(in, "2015", ProgressCallback.NOOP);
            }

            assertEquals(5, result.totalRecords());
            assertEquals(5, result.importedCount());
            assertFalse(result.hasErrors());

            List<FeatureRecord> features = result.run().features();
            FeatureRecord weld = features.get(0);
            assertEquals(FeatureCategory.GIRTH_WELD, weld.category());
            assertEquals(10, weld.jointNumber());
            assertNull(weld.clockDeg());
            assertTrue(weld.isControlPoint());

            FeatureRecord loss = features.get(1);
            assertEquals("ML-1", loss.featureId());
            assertEquals("2015", loss.runId());
            assertEquals(100.0, loss.distance());
            assertEquals(90.0, loss.clockDeg(), 1e-9);
            assertEquals(FeatureCategory.METAL_LOSS, loss.category());
            assertEquals(Orientation.OD, loss.orientation());
            assertEquals(15.0, loss.depthPct(), 1e-9);
            assertEquals(0.25, loss.wallThicknessIn(), 1e-9);

            FeatureRecord quoted = features.get(2);
            assertEquals("ML-2", quoted.featureId());
            assertEquals(285.0, quoted.clockDeg(), 1e-9);
            assertEquals(Orientation.ID, quoted.orientation());

            assertEquals(FeatureCategory.DENT, features.get(4).category());
        }

        @Test
        @DisplayName("Header matching should ignore case, order and a byte order mark")
        void testHeaderVariants() {
            ImportResult result = importCsv("\uFEFFDepth_Percent,DISTANCE,Feature_ID\n12,40.5,X-1\n");

            FeatureRecord record = result.run().features().get(0);
            assertEquals("X-1", record.featureId());
            assertEquals(40.5, record.distance());
            assertEquals(12.0, record.depthPct(), 1e-9);
        }

        @Test
        @DisplayName("Missing feature ids should be derived from the run and line")
        void testGeneratedFeatureId() {
            ImportResult result = importCsv(HEADER + ",55.0,,,,Metal Loss,,,,,\n");
            assertEquals("2015-2", result.run().features().get(0).featureId());
        }

        @Test
        @DisplayName("Unparseable optional numbers should become absent")
        void testBadOptionalNumber() {
            ImportResult result = importCsv(HEADER + "F1,55.0,abc,,,Metal Loss,,n/a,,,\n");

            FeatureRecord record = result.run().features().get(0);
            assertNull(record.jointNumber());
            assertNull(record.depthPct());
            assertFalse(result.hasErrors());
        }

        @Test
        void testBlankLinesSkipped() {
            ImportResult result = importCsv(HEADER + "F1,55.0,,,,Dent,,,,,\n\n   \nF2,60.0,,,,Dent,,,,,\n");
            assertEquals(2, result.totalRecords());
            assertEquals(2, result.importedCount());
        }

        @Test
        void testSplitLine() {
            assertEquals(List.of("a", "b,c", "say \"hi\"", ""),
                    CsvFeatureImporter.splitLine("a,\"b,c\",\"say \"\"hi\"\"\","));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Rows with a bad distance or negative depth should be reported, not imported")
        void testRowErrors() {
            ImportResult result = importCsv(HEADER
                    + "F1,abc,,,,Metal Loss,,,,,\n"
                    + "F2,-5.0,,,,Metal Loss,,,,,\n"
                    + "F3,10.0,,,,Metal Loss,,-4,,,\n"
                    + "F4,20.0,,,,Metal Loss,,12,,,\n");

            assertEquals(4, result.totalRecords());
            assertEquals(1, result.importedCount());
            assertEquals(3, result.errorCount());
            assertEquals(2, result.errors().get(0).lineNumber());
            assertEquals("F1", result.errors().get(0).featureId());
            assertEquals("F3", result.errors().get(2).featureId());
        }

        @Test
        void testEmptyInput() {
            assertThrows(AnalysisInputException.class, () -> importCsv(""));
        }

        @Test
        void testMissingDistanceColumn() {
            assertThrows(AnalysisInputException.class, () -> importCsv("feature_id,depth_percent\nF1,10\n"));
        }

        @Test
        @DisplayName("Read failures should surface as unchecked IO errors")
        void testReadFailure() {
            Reader failing = new Reader() {
                @Override
                public int read(char[] cbuf, int off, int len) throws IOException {
                    throw new IOException("disk gone");
                }

                @Override
                public void close() {
                }
            };
            assertThrows(UncheckedIOException.class,
                    () -> importer.importRun(failing, "2015", ProgressCallback.NOOP));
        }
    }

    @Test
    @DisplayName("Should report completion to the progress callback")
    void testProgress() {
        List<Long> totals = new ArrayList<>();
        importer.importRun(new StringReader(HEADER + "F1,1.0,,,,Dent,,,,,\n"), "2015",
                (processed, total, message) -> totals.add(total));

        assertEquals(List.of(1L), totals);
        assertEquals("csv", importer.getFormat());
    }
}
