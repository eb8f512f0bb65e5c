package com.climate.quality;

import com.climate.quality.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * 应用配置类。
 * 校验阈值、滚动窗口、孤立森林参数等均为可配置的默认值，不随数据自动调整。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /** 类路径上的默认配置文件 */
    public static final String DEFAULT_RESOURCE = "climate-quality.properties";

    // ---- 结构与预处理校验 ----
    private List<String> requiredColumns = List.of("Timestamp", "Location");
    private String timestampColumn = "timestamp";
    private double maxGapHours = 24.0;

    // ---- 统计检测 ----
    private double zScoreThreshold = 3.0;
    private int rollingWindow = 5;
    private double rollingThreshold = 3.0;
    private double correlationThreshold = 0.95;

    // ---- 孤立森林 ----
    private double contamination = 0.1;
    private long randomSeed = 42L;
    private int treeCount = 100;
    private int maxSamples = 256;

    public static AppConfig defaults() {
        return new AppConfig();
    }

    /**
     * 从文件加载配置，未出现的键取默认值。
     *
     * @throws ConfigurationException 文件无法读取或取值格式错误
     */
    public static AppConfig load(String configPath) {
        Properties props = new Properties();
        try (InputStream in = new FileInputStream(configPath)) {
            props.load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read config file " + configPath, e);
        }
        log.info("Loaded configuration from {}", configPath);
        return fromProperties(props);
    }

    /**
     * 从类路径加载 {@value #DEFAULT_RESOURCE}；资源不存在时使用内置默认值。
     */
    public static AppConfig loadDefault() {
        Properties props = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.warn("{} not found on classpath, using built-in defaults.", DEFAULT_RESOURCE);
                return defaults();
            }
            props.load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read classpath resource " + DEFAULT_RESOURCE, e);
        }
        return fromProperties(props);
    }

    public static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();
        try {
            config.requiredColumns = parseList(props.getProperty(
                    "validation.required.columns", "Timestamp,Location"));
            config.timestampColumn = props.getProperty(
                    "validation.timestamp.column", "timestamp").trim();
            config.maxGapHours = Double.parseDouble(
                    props.getProperty("validation.temporal.max.gap.hours", "24").trim());
            config.zScoreThreshold = Double.parseDouble(
                    props.getProperty("detection.zscore.threshold", "3.0").trim());
            config.rollingWindow = Integer.parseInt(
                    props.getProperty("detection.rolling.window", "5").trim());
            config.rollingThreshold = Double.parseDouble(
                    props.getProperty("detection.rolling.threshold", "3.0").trim());
            config.correlationThreshold = Double.parseDouble(
                    props.getProperty("detection.correlation.threshold", "0.95").trim());
            config.contamination = Double.parseDouble(
                    props.getProperty("detection.isolation.contamination", "0.1").trim());
            config.randomSeed = Long.parseLong(
                    props.getProperty("detection.isolation.seed", "42").trim());
            config.treeCount = Integer.parseInt(
                    props.getProperty("detection.isolation.trees", "100").trim());
            config.maxSamples = Integer.parseInt(
                    props.getProperty("detection.isolation.max.samples", "256").trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Malformed numeric property: " + e.getMessage(), e);
        }
        return config;
    }

    /**
     * 校验全部参数，一次性返回所有问题
     */
    public ValidationResult validate() {
        ValidationResult result = ValidationResult.success();
        if (requiredColumns.isEmpty()) {
            result.addError("validation.required.columns must name at least one column");
        }
        if (timestampColumn == null || timestampColumn.isBlank()) {
            result.addError("validation.timestamp.column must not be blank");
        }
        if (!(maxGapHours > 0)) {
            result.addError("validation.temporal.max.gap.hours must be positive, got " + maxGapHours);
        }
        if (!(zScoreThreshold > 0)) {
            result.addError("detection.zscore.threshold must be positive, got " + zScoreThreshold);
        }
        if (rollingWindow < 2) {
            result.addError("detection.rolling.window must be at least 2, got " + rollingWindow);
        }
        if (!(rollingThreshold > 0)) {
            result.addError("detection.rolling.threshold must be positive, got " + rollingThreshold);
        } else if (rollingWindow >= 2 && rollingThreshold >= (rollingWindow - 1) / Math.sqrt(rollingWindow)) {
            // 窗口包含当前值时，偏离度的理论上限为 (w-1)/sqrt(w)
            result.addWarning("detection.rolling.threshold " + rollingThreshold
                    + " is unreachable with window " + rollingWindow
                    + "; temporal anomalies will never be flagged");
        }
        if (!(correlationThreshold > 0 && correlationThreshold <= 1)) {
            result.addError("detection.correlation.threshold must be in (0, 1], got " + correlationThreshold);
        }
        if (!(contamination > 0 && contamination <= 0.5)) {
            result.addError("detection.isolation.contamination must be in (0, 0.5], got " + contamination);
        }
        if (treeCount < 1) {
            result.addError("detection.isolation.trees must be at least 1, got " + treeCount);
        }
        if (maxSamples < 2) {
            result.addError("detection.isolation.max.samples must be at least 2, got " + maxSamples);
        }
        return result;
    }

    private static List<String> parseList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : Arrays.asList(value.split(","))) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return List.copyOf(items);
    }

    // ---- Fluent setters ----
    public AppConfig setRequiredColumns(List<String> requiredColumns) { this.requiredColumns = List.copyOf(requiredColumns); return this; }
    public AppConfig setTimestampColumn(String timestampColumn) { this.timestampColumn = timestampColumn; return this; }
    public AppConfig setMaxGapHours(double maxGapHours) { this.maxGapHours = maxGapHours; return this; }
    public AppConfig setZScoreThreshold(double zScoreThreshold) { this.zScoreThreshold = zScoreThreshold; return this; }
    public AppConfig setRollingWindow(int rollingWindow) { this.rollingWindow = rollingWindow; return this; }
    public AppConfig setRollingThreshold(double rollingThreshold) { this.rollingThreshold = rollingThreshold; return this; }
    public AppConfig setCorrelationThreshold(double correlationThreshold) { this.correlationThreshold = correlationThreshold; return this; }
    public AppConfig setContamination(double contamination) { this.contamination = contamination; return this; }
    public AppConfig setRandomSeed(long randomSeed) { this.randomSeed = randomSeed; return this; }
    public AppConfig setTreeCount(int treeCount) { this.treeCount = treeCount; return this; }
    public AppConfig setMaxSamples(int maxSamples) { this.maxSamples = maxSamples; return this; }

    // ---- Getters ----
    public List<String> getRequiredColumns() { return requiredColumns; }
    public String getTimestampColumn() { return timestampColumn; }
    public double getMaxGapHours() { return maxGapHours; }
    public long getMaxGapMillis() { return (long) (maxGapHours * 60 * 60 * 1000L); }
    public double getZScoreThreshold() { return zScoreThreshold; }
    public int getRollingWindow() { return rollingWindow; }
    public double getRollingThreshold() { return rollingThreshold; }
    public double getCorrelationThreshold() { return correlationThreshold; }
    public double getContamination() { return contamination; }
    public long getRandomSeed() { return randomSeed; }
    public int getTreeCount() { return treeCount; }
    public int getMaxSamples() { return maxSamples; }

    @Override
    public String toString() {
        return "AppConfig{requiredColumns=" + requiredColumns
                + ", timestampColumn='" + timestampColumn + "'"
                + ", maxGapHours=" + maxGapHours
                + ", zScore=" + zScoreThreshold
                + ", rollingWindow=" + rollingWindow
                + ", rollingThreshold=" + rollingThreshold
                + ", correlation=" + correlationThreshold
                + ", contamination=" + contamination
                + ", seed=" + randomSeed
                + ", trees=" + treeCount
                + ", maxSamples=" + maxSamples + "}";
    }
}
