package com.climate.quality.validators;

import com.climate.quality.model.Dataset;
import com.climate.quality.model.RangeBound;
import com.climate.quality.model.RangeTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 合理范围校验器。
 * 仅校验列名登记在范围表中的数值列，值小于下限或大于上限的行判定为异常。
 * 返回结果只包含存在违规的列。
 */
public class RangeValidator {

    private static final Logger log = LoggerFactory.getLogger(RangeValidator.class);

    private final RangeTable rangeTable;

    public RangeValidator(RangeTable rangeTable) {
        this.rangeTable = rangeTable;
    }

    public Map<String, SortedSet<Integer>> validate(Dataset data) {
        Map<String, SortedSet<Integer>> anomalies = new LinkedHashMap<>();

        for (String column : data.getNumericColumns()) {
            RangeBound bound = rangeTable.get(column);
            if (bound == null) continue;

            List<Double> values = data.getNumericColumn(column);
            SortedSet<Integer> invalid = new TreeSet<>();
            for (int i = 0; i < values.size(); i++) {
                Double value = values.get(i);
                if (value != null && bound.isViolatedBy(value)) {
                    invalid.add(i);
                }
            }
            if (!invalid.isEmpty()) {
                anomalies.put(column, invalid);
                log.debug("Column '{}' has {} value(s) outside {}", column, invalid.size(), bound);
            }
        }
        return anomalies;
    }
}
