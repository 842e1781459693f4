package com.ili.analysis.alignment;

import com.ili.analysis.core.model.FeatureRecord;
import com.ili.analysis.core.model.SurveyRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Aligns a later survey onto a reference survey using matched control points.
 */
public class RunAligner {
    private static final Logger log = LoggerFactory.getLogger(RunAligner.class);

    private final ControlPointExtractor extractor;
    private final ControlPointMatcher matcher;

    public RunAligner() {
        this(new ControlPointExtractor(), new ControlPointMatcher());
    }

    public RunAligner(ControlPointExtractor extractor, ControlPointMatcher matcher) {
        this.extractor = extractor;
        this.matcher = matcher;
    }

    /**
     * Extracts and matches control points, fits the piecewise transform, applies it to Run B
     * and measures residuals.
     */
    public AlignmentResult align(SurveyRun runA, SurveyRun runB) {
        List<FeatureRecord> cpA = extractor.extract(runA.features());
        List<FeatureRecord> cpB = extractor.extract(runB.features());

        List<ControlPointPair> matched = matcher.match(cpA, cpB);
        AlignmentQuality quality = AlignmentQuality.forControlPointCount(matched.size());

        PiecewiseTransform transform = PiecewiseTransform.fit(matched);
        SurveyRun aligned = transform.apply(runB);
        List<ControlPointResidual> residuals = transform.residuals(matched);

        AlignmentResult result = new AlignmentResult(aligned, transform.segments(), matched, residuals, quality);
        log.info("alignment.completed runA={} runB={} controlPoints={} segments={} quality={} maxResidualFt={}",
                runA.runId(), runB.runId(), matched.size(), result.segments().size(), quality,
                result.maxAbsResidual().isPresent() ? result.maxAbsResidual().getAsDouble() : "n/a");
        return result;
    }
}
