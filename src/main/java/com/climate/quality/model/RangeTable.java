package com.climate.quality.model;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 气象要素合理范围表。
 * 列名与表中变量名完全一致时才做范围校验，表外的列一律不校验。
 */
public final class RangeTable implements Serializable {

    private static final RangeTable BUILT_IN = new RangeTable(List.of(
            new RangeBound("temperature", -90, 60),      // °C
            new RangeBound("humidity", 0, 100),          // %
            new RangeBound("precipitation", 0, 2000),    // mm
            new RangeBound("pressure", 870, 1090),       // hPa
            new RangeBound("wind_speed", 0, 408)         // km/h，有记录的最大阵风约407
    ));

    private final Map<String, RangeBound> bounds;

    public RangeTable(Collection<RangeBound> entries) {
        Map<String, RangeBound> map = new LinkedHashMap<>();
        for (RangeBound entry : entries) {
            if (map.putIfAbsent(entry.getVariableName(), entry) != null) {
                throw new IllegalArgumentException("Duplicate range entry: " + entry.getVariableName());
            }
        }
        this.bounds = Collections.unmodifiableMap(map);
    }

    /**
     * 内置的五项物理量范围
     */
    public static RangeTable builtIn() {
        return BUILT_IN;
    }

    /**
     * @return 变量的范围；未登记时返回null
     */
    public RangeBound get(String variableName) {
        return bounds.get(variableName);
    }

    public boolean contains(String variableName) {
        return bounds.containsKey(variableName);
    }

    public Collection<RangeBound> getEntries() {
        return bounds.values();
    }

    @Override
    public String toString() {
        return "RangeTable" + bounds.values();
    }
}
