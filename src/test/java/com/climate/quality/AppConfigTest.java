package com.climate.quality;

import com.climate.quality.model.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AppConfig 单元测试")
class AppConfigTest {

    @Test
    @DisplayName("默认值")
    void defaults() {
        AppConfig config = AppConfig.defaults();

        assertThat(config.getRequiredColumns()).containsExactly("Timestamp", "Location");
        assertThat(config.getTimestampColumn()).isEqualTo("timestamp");
        assertThat(config.getMaxGapMillis()).isEqualTo(24L * 60 * 60 * 1000);
        assertThat(config.getZScoreThreshold()).isEqualTo(3.0);
        assertThat(config.getRollingWindow()).isEqualTo(5);
        assertThat(config.getRollingThreshold()).isEqualTo(3.0);
        assertThat(config.getCorrelationThreshold()).isEqualTo(0.95);
        assertThat(config.getContamination()).isEqualTo(0.1);
        assertThat(config.getRandomSeed()).isEqualTo(42L);
        assertThat(config.getTreeCount()).isEqualTo(100);
        assertThat(config.getMaxSamples()).isEqualTo(256);
    }

    @Test
    @DisplayName("类路径默认配置与内置默认值一致")
    void classpathResourceMatchesDefaults() {
        AppConfig loaded = AppConfig.loadDefault();
        AppConfig defaults = AppConfig.defaults();

        assertThat(loaded.toString()).isEqualTo(defaults.toString());
    }

    @Test
    @DisplayName("属性覆盖默认值，缺省键保留默认值")
    void propertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty("validation.required.columns", " Timestamp , Station ,");
        props.setProperty("detection.rolling.threshold", " 1.5 ");
        props.setProperty("detection.isolation.seed", "7");

        AppConfig config = AppConfig.fromProperties(props);

        assertThat(config.getRequiredColumns()).containsExactly("Timestamp", "Station");
        assertThat(config.getRollingThreshold()).isEqualTo(1.5);
        assertThat(config.getRandomSeed()).isEqualTo(7L);
        assertThat(config.getZScoreThreshold()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("数值格式错误时抛出配置异常")
    void malformedNumberIsConfigurationError() {
        Properties props = new Properties();
        props.setProperty("detection.rolling.window", "five");

        assertThatThrownBy(() -> AppConfig.fromProperties(props))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("five");
    }

    @Test
    @DisplayName("从文件加载配置")
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("custom.properties");
        Files.write(file, List.of("detection.zscore.threshold=2.5", "validation.timestamp.column=Timestamp"),
                StandardCharsets.UTF_8);

        AppConfig config = AppConfig.load(file.toString());

        assertThat(config.getZScoreThreshold()).isEqualTo(2.5);
        assertThat(config.getTimestampColumn()).isEqualTo("Timestamp");
        assertThatThrownBy(() -> AppConfig.load(dir.resolve("absent.properties").toString()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("默认滚动阈值不可达时给出警告")
    void warnsAboutUnreachableRollingThreshold() {
        ValidationResult result = AppConfig.defaults().validate();

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).hasSize(1);
        assertThat(result.getWarnings().get(0)).contains("unreachable");
        assertThat(AppConfig.defaults().setRollingThreshold(1.5).validate().getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("一次性报告全部非法参数")
    void reportsAllErrors() {
        AppConfig config = AppConfig.defaults()
                .setContamination(0.7)
                .setRollingWindow(1)
                .setCorrelationThreshold(1.5)
                .setRequiredColumns(List.of());

        ValidationResult result = config.validate();

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).hasSize(4)
                .anyMatch(e -> e.contains("contamination"))
                .anyMatch(e -> e.contains("rolling.window"))
                .anyMatch(e -> e.contains("correlation"))
                .anyMatch(e -> e.contains("required.columns"));
    }
}
