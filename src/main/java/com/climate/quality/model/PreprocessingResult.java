package com.climate.quality.model;

import java.util.Objects;

/**
 * 预处理输出：清洗后的数据表与校验报告。
 * 结构校验未通过时，dataset 为未经填充的原始数据表。
 */
public final class PreprocessingResult {
    private final Dataset dataset;
    private final ValidationReport report;

    public PreprocessingResult(Dataset dataset, ValidationReport report) {
        this.dataset = Objects.requireNonNull(dataset, "dataset");
        this.report = Objects.requireNonNull(report, "report");
    }

    public Dataset getDataset() { return dataset; }
    public ValidationReport getReport() { return report; }
}
