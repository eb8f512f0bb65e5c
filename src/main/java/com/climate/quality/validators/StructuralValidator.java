package com.climate.quality.validators;

import com.climate.quality.model.Dataset;
import com.climate.quality.model.TimestampParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 结构校验器。
 * 检查必需列是否存在（区分大小写），以及时间列中的每个值是否均可解析。
 * 校验结果为问题描述列表，空列表表示结构有效。本校验是后续逐行校验的闸门。
 */
public class StructuralValidator {

    private static final Logger log = LoggerFactory.getLogger(StructuralValidator.class);

    public static final String INVALID_TIMESTAMP_ISSUE = "Invalid timestamp format";

    private final List<String> requiredColumns;
    private final String timestampColumn;

    public StructuralValidator(List<String> requiredColumns, String timestampColumn) {
        this.requiredColumns = List.copyOf(requiredColumns);
        this.timestampColumn = timestampColumn;
    }

    public List<String> validate(Dataset data) {
        List<String> issues = new ArrayList<>();

        for (String column : requiredColumns) {
            if (!data.hasColumn(column)) {
                issues.add("Missing required column: " + column);
            }
        }

        // 任一值无法解析即记一条问题，不逐行列举
        if (data.hasColumn(timestampColumn)) {
            for (Object value : data.getColumn(timestampColumn)) {
                if (value != null && !TimestampParser.isParseable(value)) {
                    issues.add(INVALID_TIMESTAMP_ISSUE);
                    break;
                }
            }
        }

        if (!issues.isEmpty()) {
            log.debug("Structural validation found {} issue(s): {}", issues.size(), issues);
        }
        return issues;
    }
}
