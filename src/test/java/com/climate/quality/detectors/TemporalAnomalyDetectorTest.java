package com.climate.quality.detectors;

import com.climate.quality.model.ColumnType;
import com.climate.quality.model.Dataset;
import com.climate.quality.support.TestDatasets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.SortedSet;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TemporalAnomalyDetector 单元测试")
class TemporalAnomalyDetectorTest {

    private static final int ROWS = 20;

    /**
     * 线性递增序列（10.0, 10.1, ...），时间顺序的第 k 条记录存放在第 ROWS-1-k 行，
     * 使得行顺序与时间顺序相反。spikeAt / missingAt 为时间顺序上的位置，-1 表示不设置。
     */
    private static Dataset reversedSeries(int spikeAt, int missingAt) {
        Object[][] rows = new Object[ROWS][];
        for (int k = 0; k < ROWS; k++) {
            Double value = 10.0 + 0.1 * k;
            if (k == spikeAt) value = 50.0;
            if (k == missingAt) value = null;
            rows[ROWS - 1 - k] = new Object[]{TestDatasets.START.plusHours(k), value};
        }
        Dataset.Builder builder = Dataset.builder()
                .column("timestamp", ColumnType.TIMESTAMP)
                .column("temperature", ColumnType.NUMERIC);
        for (Object[] row : rows) {
            builder.row(row);
        }
        return builder.build();
    }

    @Test
    @DisplayName("按时间排序后标记突变行，返回原始行索引")
    void flagsSpikeByOriginalIndex() {
        TemporalAnomalyDetector detector = new TemporalAnomalyDetector("timestamp", 5, 1.5);

        Map<String, SortedSet<Integer>> result = detector.detect(reversedSeries(10, -1));

        assertThat(result.get("temperature")).containsExactly(ROWS - 1 - 10);
    }

    @Test
    @DisplayName("窗口为5时偏离度上限约1.79，默认阈值3不会触发")
    void defaultThresholdCannotTriggerWithWindowOfFive() {
        TemporalAnomalyDetector detector = new TemporalAnomalyDetector("timestamp", 5, 3.0);

        assertThat(detector.detect(reversedSeries(10, -1)).get("temperature")).isEmpty();
    }

    @Test
    @DisplayName("窗口未满的前 window-1 行不判定")
    void warmUpRowsAreNeverFlagged() {
        TemporalAnomalyDetector detector = new TemporalAnomalyDetector("timestamp", 5, 1.5);

        assertThat(detector.detect(reversedSeries(2, -1)).get("temperature")).isEmpty();
    }

    @Test
    @DisplayName("窗口含缺失值时不判定")
    void windowsWithMissingValuesAreSkipped() {
        TemporalAnomalyDetector detector = new TemporalAnomalyDetector("timestamp", 5, 1.5);

        assertThat(detector.detect(reversedSeries(12, 10)).get("temperature")).isEmpty();
    }

    @Test
    @DisplayName("缺少时间列时返回空结果")
    void missingTimestampColumnYieldsNothing() {
        TemporalAnomalyDetector detector = new TemporalAnomalyDetector("timestamp", 5, 1.5);

        assertThat(detector.detect(TestDatasets.hourlyObservations(10))).isEmpty();
    }

    @Test
    @DisplayName("常量序列标准差为0，不产生异常")
    void constantSeriesYieldsNothing() {
        TemporalAnomalyDetector detector = new TemporalAnomalyDetector("timestamp", 3, 0.5);

        Map<String, SortedSet<Integer>> result =
                detector.detect(TestDatasets.series("humidity", 40, 40, 40, 40, 40, 40));

        assertThat(result.get("humidity")).isEmpty();
    }
}
