package com.climate.quality.validators;

import com.climate.quality.model.ColumnType;
import com.climate.quality.model.Dataset;
import com.climate.quality.support.TestDatasets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StructuralValidator 单元测试")
class StructuralValidatorTest {

    private StructuralValidator validator;

    @BeforeEach
    void setUp() {
        validator = new StructuralValidator(List.of("Timestamp", "Location"), "timestamp");
    }

    @Test
    @DisplayName("结构完整时无问题")
    void acceptsWellFormedData() {
        assertThat(validator.validate(TestDatasets.hourlyObservations(5))).isEmpty();
    }

    @Test
    @DisplayName("缺少必需列时每列报告一条问题")
    void reportsEachMissingColumn() {
        Dataset data = Dataset.builder()
                .column("Timestamp", ColumnType.TIMESTAMP)
                .column("temperature", ColumnType.NUMERIC)
                .row("2024-01-01 00:00", 10.0)
                .build();

        List<String> issues = validator.validate(data);

        assertThat(issues).containsExactly("Missing required column: Location");
    }

    @Test
    @DisplayName("必需列名区分大小写")
    void requiredColumnsAreCaseSensitive() {
        Dataset data = Dataset.builder()
                .column("timestamp", ColumnType.TIMESTAMP)
                .column("location", ColumnType.TEXT)
                .build();

        assertThat(validator.validate(data)).containsExactly(
                "Missing required column: Timestamp",
                "Missing required column: Location");
    }

    @Test
    @DisplayName("时间列存在多处非法值时只报告一次")
    void reportsInvalidTimestampOnce() {
        Dataset data = Dataset.builder()
                .column("Timestamp", ColumnType.TIMESTAMP)
                .column("Location", ColumnType.TEXT)
                .column("timestamp", ColumnType.TEXT)
                .row("2024-01-01 00:00", "Zurich", "2024-01-01 00:00")
                .row("2024-01-01 01:00", "Zurich", "not-a-date")
                .row("2024-01-01 02:00", "Zurich", "also bad")
                .row("2024-01-01 03:00", "Zurich", null)
                .build();

        assertThat(validator.validate(data)).containsExactly(StructuralValidator.INVALID_TIMESTAMP_ISSUE);
    }

    @Test
    @DisplayName("缺失的时间值不视为格式错误")
    void ignoresMissingTimestamps() {
        Dataset data = Dataset.builder()
                .column("Timestamp", ColumnType.TIMESTAMP)
                .column("Location", ColumnType.TEXT)
                .column("timestamp", ColumnType.TIMESTAMP)
                .row("2024-01-01 00:00", "Zurich", null)
                .row("2024-01-01 01:00", "Zurich", "2024-01-01 01:00")
                .build();

        assertThat(validator.validate(data)).isEmpty();
    }
}
