package com.example.forecast.stage.local;

import com.example.forecast.model.FailureKind;
import com.example.forecast.model.FillMethod;
import com.example.forecast.model.Frequency;
import com.example.forecast.model.PreprocessingConfig;
import com.example.forecast.model.QualityFlag;
import com.example.forecast.model.TimeSeries;
import com.example.forecast.stage.StageContracts;
import com.example.forecast.stage.StageException;
import com.example.forecast.support.TestSeries;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LocalPreprocessingStageTest {

    private final LocalPreprocessingStage stage = new LocalPreprocessingStage();

    @Test
    void interpolatesGapsAndFlagsThem() throws Exception {
        TimeSeries input = TestSeries.withMissing(TestSeries.of(Frequency.DAILY, 5, i -> i + 1.0), 2);

        TimeSeries output = stage.invoke(input, PreprocessingConfig.defaults(), Instant.MAX);

        assertThat(output.values()).containsExactly(1.0, 2.0, 3.0, 4.0, 5.0);
        assertThat(output.points().get(2).quality()).isEqualTo(QualityFlag.IMPUTED);
        assertThat(output.points().get(1).quality()).isEqualTo(QualityFlag.OK);
        assertThat(StageContracts.preprocessing().violation(input, PreprocessingConfig.defaults(), output)).isEmpty();
    }

    @Test
    void forwardFillTakesFirstObservationForLeadingGap() throws Exception {
        TimeSeries input = TestSeries.withMissing(TestSeries.of(Frequency.DAILY, 5, i -> i + 1.0), 0, 1, 3);
        PreprocessingConfig config = new PreprocessingConfig(false, FillMethod.FORWARD_FILL, false);

        TimeSeries output = stage.invoke(input, config, Instant.MAX);

        assertThat(output.values()).containsExactly(3.0, 3.0, 3.0, 3.0, 5.0);
    }

    @Test
    void fillNoneKeepsMissingValues() throws Exception {
        TimeSeries input = TestSeries.withMissing(TestSeries.daily(6), 4);
        PreprocessingConfig config = new PreprocessingConfig(false, FillMethod.NONE, false);

        TimeSeries output = stage.invoke(input, config, Instant.MAX);

        assertThat(output.missingCount()).isEqualTo(1);
        assertThat(output.points().get(4).quality()).isEqualTo(QualityFlag.MISSING);
    }

    @Test
    void removesExtremeValues() throws Exception {
        TimeSeries input = TestSeries.of(Frequency.DAILY, 30, i -> i == 15 ? 1000.0 : 10.0 + (i % 3) * 0.1);
        PreprocessingConfig config = new PreprocessingConfig(true, FillMethod.NONE, false);

        TimeSeries output = stage.invoke(input, config, Instant.MAX);

        assertThat(output.points().get(15).isMissing()).isTrue();
        assertThat(output.points().get(15).quality()).isEqualTo(QualityFlag.OUTLIER);
        assertThat(output.missingCount()).isEqualTo(1);
    }

    @Test
    void normalizationIsRecordedAndReversible() throws Exception {
        TimeSeries input = TestSeries.daily(20);
        PreprocessingConfig config = new PreprocessingConfig(false, FillMethod.NONE, true);

        TimeSeries output = stage.invoke(input, config, Instant.MAX);

        assertThat(output.normalization()).isNotNull();
        assertThat(SeriesStatistics.mean(output.values())).isCloseTo(0.0, within(1e-9));
        assertThat(SeriesStatistics.std(output.values())).isCloseTo(1.0, within(1e-9));
        double restored = output.normalization().denormalize(output.values()[7]);
        assertThat(restored).isCloseTo(input.values()[7], within(1e-9));
    }

    @Test
    void constantSeriesNormalizesWithUnitScale() throws Exception {
        TimeSeries input = TestSeries.constant(Frequency.HOURLY, 5, 4.0);

        TimeSeries output = stage.invoke(input, new PreprocessingConfig(false, null, true), Instant.MAX);

        assertThat(output.normalization().scale()).isEqualTo(1.0);
        assertThat(output.values()).containsOnly(0.0);
    }

    @Test
    void seriesWithoutObservationsIsInvalidInput() {
        TimeSeries input = TestSeries.withMissing(TestSeries.daily(3), 0, 1, 2);

        assertThatThrownBy(() -> stage.invoke(input, PreprocessingConfig.defaults(), Instant.MAX))
                .isInstanceOfSatisfying(StageException.class,
                        e -> assertThat(e.kind()).isEqualTo(FailureKind.INVALID_INPUT));
    }
}
