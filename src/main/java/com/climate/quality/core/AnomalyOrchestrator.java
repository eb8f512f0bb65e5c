package com.climate.quality.core;

import com.climate.quality.model.AnomalyReport;
import com.climate.quality.model.Dataset;

/**
 * 异常检测编排器接口。
 *
 * 对给定数据表运行全部检测器（与结构校验是否通过无关），将各自结果原样汇总为一份报告。
 * 单个检测器失败只影响其自身字段，其余检测器照常完成。
 */
public interface AnomalyOrchestrator {

    /**
     * @param data 数据表，不可为null
     * @return 汇总后的异常报告
     */
    AnomalyReport detect(Dataset data);
}
