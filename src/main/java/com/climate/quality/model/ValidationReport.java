package com.climate.quality.model;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;

/**
 * 预处理校验报告。
 *
 * 结构校验是后续逐行校验的闸门：存在结构问题时，范围异常、时间不连续和重复记录三项必为空。
 * 该约束由两个工厂方法保证，不存在同时携带结构问题与逐行结果的实例。
 */
public final class ValidationReport implements Serializable {

    private final List<String> structureIssues;
    /** 列名 -> 超出合理范围的行索引；无违规的列不出现 */
    private final Map<String, SortedSet<Integer>> rangeAnomalies;
    private final SortedSet<Integer> temporalInconsistencies;
    private final SortedSet<Integer> duplicates;

    private ValidationReport(List<String> structureIssues,
                             Map<String, SortedSet<Integer>> rangeAnomalies,
                             SortedSet<Integer> temporalInconsistencies,
                             SortedSet<Integer> duplicates) {
        this.structureIssues = structureIssues;
        this.rangeAnomalies = rangeAnomalies;
        this.temporalInconsistencies = temporalInconsistencies;
        this.duplicates = duplicates;
    }

    /**
     * 结构校验未通过的报告，逐行校验结果均为空。
     *
     * @param issues 结构问题描述，不可为空
     */
    public static ValidationReport structuralFailure(List<String> issues) {
        if (issues == null || issues.isEmpty()) {
            throw new IllegalArgumentException("A structural failure needs at least one issue");
        }
        return new ValidationReport(List.copyOf(issues), Collections.emptyMap(),
                Collections.emptySortedSet(), Collections.emptySortedSet());
    }

    /**
     * 结构校验通过的报告。空的列条目会被剔除，保持报告稀疏。
     */
    public static ValidationReport of(Map<String, ? extends Collection<Integer>> rangeAnomalies,
                                      Collection<Integer> temporalInconsistencies,
                                      Collection<Integer> duplicates) {
        Map<String, SortedSet<Integer>> range = IndexSets.copyOf(rangeAnomalies);
        if (range.values().stream().anyMatch(SortedSet::isEmpty)) {
            Map<String, SortedSet<Integer>> sparse = new LinkedHashMap<>(range);
            sparse.values().removeIf(SortedSet::isEmpty);
            range = Collections.unmodifiableMap(sparse);
        }
        return new ValidationReport(Collections.emptyList(), range,
                IndexSets.copyOf(temporalInconsistencies), IndexSets.copyOf(duplicates));
    }

    public boolean isStructurallyValid() {
        return structureIssues.isEmpty();
    }

    public List<String> getStructureIssues() { return structureIssues; }
    public Map<String, SortedSet<Integer>> getRangeAnomalies() { return rangeAnomalies; }
    public SortedSet<Integer> getTemporalInconsistencies() { return temporalInconsistencies; }
    public SortedSet<Integer> getDuplicates() { return duplicates; }

    /**
     * @return 指定列的范围异常行；无异常时返回空集合
     */
    public SortedSet<Integer> getRangeAnomalies(String column) {
        return rangeAnomalies.getOrDefault(column, Collections.emptySortedSet());
    }

    public int getRangeAnomalyCount() {
        return IndexSets.total(rangeAnomalies);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationReport)) return false;
        ValidationReport that = (ValidationReport) o;
        return structureIssues.equals(that.structureIssues)
                && rangeAnomalies.equals(that.rangeAnomalies)
                && temporalInconsistencies.equals(that.temporalInconsistencies)
                && duplicates.equals(that.duplicates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(structureIssues, rangeAnomalies, temporalInconsistencies, duplicates);
    }

    @Override
    public String toString() {
        return "ValidationReport{structureIssues=" + structureIssues
                + ", rangeAnomalies=" + rangeAnomalies
                + ", temporalInconsistencies=" + temporalInconsistencies
                + ", duplicates=" + duplicates + "}";
    }
}
