package com.climate.quality;

import com.climate.quality.core.AnomalyOrchestrator;
import com.climate.quality.core.Preprocessor;
import com.climate.quality.core.imp.DefaultAnomalyOrchestrator;
import com.climate.quality.core.imp.DefaultPreprocessor;
import com.climate.quality.detectors.CorrelationAnomalyDetector;
import com.climate.quality.detectors.MultivariateOutlierDetector;
import com.climate.quality.detectors.StatisticalAnomalyDetector;
import com.climate.quality.detectors.TemporalAnomalyDetector;
import com.climate.quality.model.AnomalyReport;
import com.climate.quality.model.Dataset;
import com.climate.quality.model.DatasetSummary;
import com.climate.quality.model.PreprocessingResult;
import com.climate.quality.model.QualityAssessment;
import com.climate.quality.model.RangeTable;
import com.climate.quality.model.ValidationResult;
import com.climate.quality.validators.DuplicateDetector;
import com.climate.quality.validators.MissingValueImputer;
import com.climate.quality.validators.RangeValidator;
import com.climate.quality.validators.StructuralValidator;
import com.climate.quality.validators.TemporalConsistencyChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 气候观测数据质量引擎。
 * 按配置组装预处理器与异常检测编排器，对外提供单阶段与完整评估入口。
 *
 * 引擎只持有不可变配置与无状态组件，每次评估的统计量均在调用内部新建，可安全复用于不相关的数据集。
 *
 * 用法：
 * <pre>
 *   ClimateQualityEngine engine = new ClimateQualityEngine(AppConfig.loadDefault());
 *   QualityAssessment assessment = engine.assess(dataset);
 * </pre>
 */
public class ClimateQualityEngine {

    private static final Logger log = LoggerFactory.getLogger(ClimateQualityEngine.class);

    private final AppConfig config;
    private final Preprocessor preprocessor;
    private final AnomalyOrchestrator orchestrator;

    /**
     * @throws ConfigurationException 配置校验未通过
     */
    public ClimateQualityEngine(AppConfig config) {
        this.config = Objects.requireNonNull(config, "config");

        ValidationResult validation = config.validate();
        for (String warning : validation.getWarnings()) {
            log.warn("Configuration warning: {}", warning);
        }
        if (!validation.isValid()) {
            log.error("Configuration rejected: {}", validation.getErrors());
            throw new ConfigurationException(validation);
        }

        this.preprocessor = new DefaultPreprocessor(
                new StructuralValidator(config.getRequiredColumns(), config.getTimestampColumn()),
                new MissingValueImputer(),
                new RangeValidator(RangeTable.builtIn()),
                new TemporalConsistencyChecker(config.getTimestampColumn(), config.getMaxGapMillis()),
                new DuplicateDetector()
        );

        this.orchestrator = new DefaultAnomalyOrchestrator(
                new StatisticalAnomalyDetector(config.getZScoreThreshold()),
                new MultivariateOutlierDetector(config.getContamination(), config.getRandomSeed(),
                        config.getTreeCount(), config.getMaxSamples()),
                new TemporalAnomalyDetector(config.getTimestampColumn(), config.getRollingWindow(),
                        config.getRollingThreshold()),
                new CorrelationAnomalyDetector(config.getCorrelationThreshold())
        );

        log.info("Climate quality engine initialized with {}", config);
    }

    public PreprocessingResult preprocess(Dataset data) {
        return preprocessor.process(data);
    }

    public AnomalyReport detectAnomalies(Dataset data) {
        return orchestrator.detect(data);
    }

    /**
     * 完整评估：预处理 → 异常检测 → 生成摘要。
     * 异常检测作用于预处理输出的数据表；结构校验未通过时即为原始数据表。
     */
    public QualityAssessment assess(Dataset data) {
        Objects.requireNonNull(data, "No dataset supplied for assessment");

        PreprocessingResult preprocessed = preprocessor.process(data);
        AnomalyReport anomalies = orchestrator.detect(preprocessed.getDataset());
        DatasetSummary summary = DatasetSummary.of(preprocessed.getDataset(), data,
                preprocessed.getReport(), anomalies);

        return new QualityAssessment(data, preprocessed.getDataset(),
                preprocessed.getReport(), anomalies, summary);
    }

    public AppConfig getConfig() {
        return config;
    }
}
