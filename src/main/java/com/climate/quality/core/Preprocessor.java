package com.climate.quality.core;

import com.climate.quality.model.Dataset;
import com.climate.quality.model.PreprocessingResult;

/**
 * 预处理器接口：校验与清洗的编排入口。
 *
 * 执行顺序：
 *   结构校验 → 缺失值填充 → 范围校验 → 时间连续性检查 → 重复记录检测
 *
 * 结构校验未通过时立即返回未经填充的原始数据表和仅含结构问题的报告，
 * 不执行后续任何步骤。结构问题以数据形式返回，不抛异常。
 */
public interface Preprocessor {

    /**
     * 对原始数据表执行校验与清洗。
     *
     * @param data 原始数据表，不可为null
     * @return 清洗后的数据表与校验报告
     */
    PreprocessingResult process(Dataset data);
}
