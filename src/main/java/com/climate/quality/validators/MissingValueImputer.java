package com.climate.quality.validators;

import com.climate.quality.model.ColumnType;
import com.climate.quality.model.Dataset;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 缺失值填充器。
 * - 数值列：以本次调用中该列非缺失值的均值填充
 * - 文本列：以出现次数最多的值填充，次数相同时取字典序最小者
 * - 时间列：原样透传
 * 整列缺失时没有可用的均值或众数，该列保持不变。
 *
 * 每次调用都在方法内重新计算统计量，不在实例上保留任何拟合状态。
 */
public class MissingValueImputer {

    private static final Logger log = LoggerFactory.getLogger(MissingValueImputer.class);

    public Dataset impute(Dataset data) {
        Dataset result = data;
        int filled = 0;

        for (String column : data.getColumnNames()) {
            ColumnType type = data.getColumnType(column);
            if (type == ColumnType.TIMESTAMP) continue;

            int missing = data.countMissing(column);
            if (missing == 0) continue;
            if (missing == data.getRowCount()) {
                log.debug("Column '{}' is entirely missing, imputation skipped.", column);
                continue;
            }

            Object fill = (type == ColumnType.NUMERIC)
                    ? columnMean(data.getNumericColumn(column))
                    : mostFrequent(data.getColumn(column));

            List<Object> values = new ArrayList<>(data.getColumn(column));
            for (int i = 0; i < values.size(); i++) {
                if (values.get(i) == null) {
                    values.set(i, fill);
                }
            }
            result = result.withColumn(column, values);
            filled += missing;
            log.debug("Filled {} missing value(s) in column '{}' with {}", missing, column, fill);
        }

        if (filled > 0) {
            log.info("Imputed {} missing cell(s) across {} row(s).", filled, data.getRowCount());
        }
        return result;
    }

    private static double columnMean(List<Double> values) {
        Mean mean = new Mean();
        for (Double value : values) {
            if (value != null) {
                mean.increment(value);
            }
        }
        return mean.getResult();
    }

    private static String mostFrequent(List<Object> values) {
        // TreeMap 保证次数相同时取字典序最小者
        Map<String, Integer> counts = new TreeMap<>();
        for (Object value : values) {
            if (value != null) {
                counts.merge(value.toString(), 1, Integer::sum);
            }
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
