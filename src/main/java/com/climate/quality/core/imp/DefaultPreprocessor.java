package com.climate.quality.core.imp;

import com.climate.quality.core.Preprocessor;
import com.climate.quality.model.Dataset;
import com.climate.quality.model.PreprocessingResult;
import com.climate.quality.model.ValidationReport;
import com.climate.quality.validators.DuplicateDetector;
import com.climate.quality.validators.MissingValueImputer;
import com.climate.quality.validators.RangeValidator;
import com.climate.quality.validators.StructuralValidator;
import com.climate.quality.validators.TemporalConsistencyChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;

/**
 * 预处理器默认实现。
 * 按固定顺序串联各校验步骤，结构校验未通过时短路返回。
 */
public class DefaultPreprocessor implements Preprocessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultPreprocessor.class);

    private final StructuralValidator structuralValidator;
    private final MissingValueImputer imputer;
    private final RangeValidator rangeValidator;
    private final TemporalConsistencyChecker temporalChecker;
    private final DuplicateDetector duplicateDetector;

    public DefaultPreprocessor(StructuralValidator structuralValidator,
                               MissingValueImputer imputer,
                               RangeValidator rangeValidator,
                               TemporalConsistencyChecker temporalChecker,
                               DuplicateDetector duplicateDetector) {
        this.structuralValidator = structuralValidator;
        this.imputer = imputer;
        this.rangeValidator = rangeValidator;
        this.temporalChecker = temporalChecker;
        this.duplicateDetector = duplicateDetector;
    }

    @Override
    public PreprocessingResult process(Dataset data) {
        Objects.requireNonNull(data, "No dataset supplied for preprocessing");

        List<String> issues = structuralValidator.validate(data);
        if (!issues.isEmpty()) {
            log.warn("Dataset failed structural validation, row-level checks skipped: {}", issues);
            return new PreprocessingResult(data, ValidationReport.structuralFailure(issues));
        }

        Dataset cleaned = imputer.impute(data);
        Map<String, SortedSet<Integer>> rangeAnomalies = rangeValidator.validate(cleaned);
        SortedSet<Integer> temporal = temporalChecker.check(cleaned);
        SortedSet<Integer> duplicates = duplicateDetector.detect(cleaned);

        ValidationReport report = ValidationReport.of(rangeAnomalies, temporal, duplicates);
        log.info("Preprocessed {} row(s): {} range anomaly(ies) in {} column(s), {} time gap(s), {} duplicate(s)",
                cleaned.getRowCount(), report.getRangeAnomalyCount(), rangeAnomalies.size(),
                temporal.size(), duplicates.size());
        return new PreprocessingResult(cleaned, report);
    }
}
