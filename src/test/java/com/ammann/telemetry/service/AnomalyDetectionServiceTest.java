/* (C)2026 */
package com.ammann.telemetry.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.telemetry.dto.AnomalyVerdictDTO;
import com.ammann.telemetry.enumeration.DetectionMethod;
import com.ammann.telemetry.exception.MetricsStoreException;
import com.ammann.telemetry.exception.ValidationException;
import com.ammann.telemetry.model.Sample;
import com.ammann.telemetry.model.Series;
import com.ammann.telemetry.model.WindowStats;
import com.ammann.telemetry.store.MetricsStore;
import com.ammann.telemetry.support.TestSeriesFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Unit tests for {@link AnomalyDetectionService}.
 */
class AnomalyDetectionServiceTest
{

    private static final List<Sample> WINDOW_MEAN_50_STD_10 =
            TestSeriesFactory.samples(40, 60, 40, 60, 40, 60, 40, 60, 40, 60);

    private AnomalyDetectionService service;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp()
    {
        meterRegistry = new SimpleMeterRegistry();
        service = new AnomalyDetectionService();
        service.meterRegistry = meterRegistry;
        service.clock = Clock.fixed(TestSeriesFactory.BASE_TIME, ZoneOffset.UTC);
    }

    @Test
    void windowStatsUsesPopulationStandardDeviation()
    {
        WindowStats stats = service.windowStats(WINDOW_MEAN_50_STD_10, 30);

        assertThat(stats.mean()).isCloseTo(50.0, within(1e-9));
        assertThat(stats.stdDev()).isCloseTo(10.0, within(1e-9));
        assertThat(stats.sampleCount()).isEqualTo(10);
    }

    @Test
    void windowStatsOnlyConsidersTrailingSamples()
    {
        List<Sample> samples = TestSeriesFactory.samples(1000, 1000, 10, 20, 30);

        WindowStats stats = service.windowStats(samples, 3);

        assertThat(stats.mean()).isCloseTo(20.0, within(1e-9));
        assertThat(stats.sampleCount()).isEqualTo(3);
    }

    @Test
    void flagsValueFarAboveWindowMean()
    {
        AnomalyVerdictDTO verdict = service.detect("host-1", "cpu", WINDOW_MEAN_50_STD_10, 95.0);

        assertThat(verdict.mean()).isCloseTo(50.0, within(1e-9));
        assertThat(verdict.stdDev()).isCloseTo(10.0, within(1e-9));
        assertThat(verdict.zScore()).isEqualTo(4.5);
        assertThat(verdict.anomalous()).isTrue();
        assertThat(verdict.threshold()).isEqualTo(2.0);
        assertThat(verdict.method()).isEqualTo(DetectionMethod.ZSCORE);
        assertThat(verdict.timestamp()).isEqualTo(TestSeriesFactory.BASE_TIME);
        assertThat(meterRegistry.counter("analytics_anomalies_detected_total", "metric", "cpu").count())
                .isEqualTo(1.0);
    }

    @Test
    void smallStableWindowFlagsModerateJump()
    {
        List<Sample> window = TestSeriesFactory.samples(40, 42, 38, 41, 39);

        AnomalyVerdictDTO verdict = service.detect("host-1", "cpu", window, 46.0);

        assertThat(verdict.mean()).isCloseTo(40.0, within(1e-9));
        assertThat(verdict.stdDev()).isCloseTo(Math.sqrt(2.0), within(1e-9));
        assertThat(verdict.zScore()).isEqualTo(4.24);
        assertThat(verdict.anomalous()).isTrue();
    }

    @Test
    void negativeDeviationIsAlsoAnomalous()
    {
        AnomalyVerdictDTO verdict = service.detect("host-1", "cpu", WINDOW_MEAN_50_STD_10, 20.0);

        assertThat(verdict.zScore()).isEqualTo(-3.0);
        assertThat(verdict.anomalous()).isTrue();
    }

    @Test
    void gateIsStrictlyGreaterThanThreshold()
    {
        AnomalyVerdictDTO verdict = service.detect("host-1", "cpu", WINDOW_MEAN_50_STD_10, 70.0);

        assertThat(verdict.zScore()).isEqualTo(2.0);
        assertThat(verdict.anomalous()).isFalse();
        assertThat(meterRegistry.find("analytics_anomalies_detected_total").counter()).isNull();
    }

    @Test
    void zScoreIsRoundedToTwoDecimals()
    {
        AnomalyVerdictDTO verdict = service.detect("host-1", "cpu", WINDOW_MEAN_50_STD_10, 53.333);

        assertThat(verdict.zScore()).isEqualTo(0.33);
    }

    @Test
    void zeroVarianceWindowYieldsZeroScore()
    {
        List<Sample> flat = TestSeriesFactory.samples(42, 42, 42, 42, 42, 42);

        AnomalyVerdictDTO verdict = service.detect("host-1", "memory", flat, 99.0);

        assertThat(verdict.stdDev()).isZero();
        assertThat(verdict.zScore()).isZero();
        assertThat(verdict.anomalous()).isFalse();
    }

    @ParameterizedTest(name = "flat window of {0}")
    @ValueSource(doubles = {33.3, 0.1, 45.1, 77.7})
    void flatDecimalWindowHasExactlyZeroDeviation(double level)
    {
        List<Sample> flat = TestSeriesFactory.samples(level, level, level, level, level, level, level);

        AnomalyVerdictDTO verdict = service.detect("host-1", "memory", flat, 50.0);

        assertThat(verdict.mean()).isEqualTo(level);
        assertThat(verdict.stdDev()).isZero();
        assertThat(verdict.zScore()).isZero();
        assertThat(verdict.anomalous()).isFalse();
    }

    @Test
    void zeroVarianceWindowIsNeverAnomalousForBollinger()
    {
        List<Sample> flat = TestSeriesFactory.samples(42, 42, 42, 42, 42, 42);

        AnomalyVerdictDTO verdict = service.detect("host-1", "memory", flat, 99.0, DetectionMethod.BOLLINGER);

        assertThat(verdict.anomalous()).isFalse();
    }

    @Test
    void returnsNullBelowMinimumSamples()
    {
        List<Sample> window = TestSeriesFactory.samples(1, 2, 3, 4);

        assertThat(service.detect("host-1", "cpu", window, 100.0)).isNull();
        assertThat(service.detect("host-1", "cpu", List.of(), 100.0)).isNull();
    }

    @Test
    void nonFiniteSamplesAreSkipped()
    {
        List<Sample> window = new ArrayList<>(WINDOW_MEAN_50_STD_10);
        window.add(Sample.of(TestSeriesFactory.BASE_TIME.plusSeconds(3600), Double.NaN));

        AnomalyVerdictDTO verdict = service.detect("host-1", "cpu", window, 95.0);

        assertThat(verdict.mean()).isCloseTo(50.0, within(1e-9));
        assertThat(Double.isFinite(verdict.zScore())).isTrue();
    }

    @Test
    void bollingerFlagsValuesOutsideBands()
    {
        AnomalyVerdictDTO above = service.detect("host-1", "cpu", WINDOW_MEAN_50_STD_10, 71.0, DetectionMethod.BOLLINGER);
        AnomalyVerdictDTO inside = service.detect("host-1", "cpu", WINDOW_MEAN_50_STD_10, 69.0, DetectionMethod.BOLLINGER);
        AnomalyVerdictDTO below = service.detect("host-1", "cpu", WINDOW_MEAN_50_STD_10, 29.0, DetectionMethod.BOLLINGER);

        assertThat(above.anomalous()).isTrue();
        assertThat(inside.anomalous()).isFalse();
        assertThat(below.anomalous()).isTrue();
        assertThat(above.method()).isEqualTo(DetectionMethod.BOLLINGER);
    }

    @Test
    void adaptiveThresholdWidensForNoisyWindows()
    {
        // cv = 40 / 50 = 0.8, threshold = 2.0 * 1.5
        List<Sample> noisy = TestSeriesFactory.samples(10, 90, 10, 90, 10, 90, 10, 90);

        AnomalyVerdictDTO verdict = service.detect("host-1", "cpu", noisy, 170.0, DetectionMethod.ADAPTIVE);

        assertThat(verdict.threshold()).isEqualTo(3.0);
        assertThat(verdict.zScore()).isEqualTo(3.0);
        assertThat(verdict.anomalous()).isFalse();
    }

    @Test
    void adaptiveThresholdTightensForQuietWindows()
    {
        // cv = 0.2 falls in the lowest bucket
        AnomalyVerdictDTO verdict = service.detect("host-1", "cpu", WINDOW_MEAN_50_STD_10, 80.0, DetectionMethod.ADAPTIVE);

        assertThat(verdict.threshold()).isCloseTo(2.4, within(1e-9));
        assertThat(verdict.anomalous()).isTrue();
    }

    @Test
    void selectMethodFollowsCoefficientOfVariation()
    {
        assertThat(service.selectMethod(new WindowStats(50, 10, 10))).isEqualTo(DetectionMethod.ZSCORE);
        assertThat(service.selectMethod(new WindowStats(50, 2, 30))).isEqualTo(DetectionMethod.BOLLINGER);
        assertThat(service.selectMethod(new WindowStats(50, 25, 30))).isEqualTo(DetectionMethod.ADAPTIVE);
        assertThat(service.selectMethod(new WindowStats(50, 10, 30))).isEqualTo(DetectionMethod.ZSCORE);

        service.bollingerEnabled = false;
        assertThat(service.selectMethod(new WindowStats(50, 2, 30))).isEqualTo(DetectionMethod.ZSCORE);
    }

    @Test
    void detectAutoUsesSelectedMethod()
    {
        List<Sample> quiet = TestSeriesFactory.generate(25, TestSeriesFactory.BASE_TIME, Duration.ofMinutes(1),
                i -> i % 2 == 0 ? 49.0 : 51.0);

        AnomalyVerdictDTO verdict = service.detectAuto("host-1", "cpu", quiet, 60.0);

        assertThat(verdict.method()).isEqualTo(DetectionMethod.BOLLINGER);
        assertThat(verdict.anomalous()).isTrue();
    }

    @Test
    void rejectsInvalidArguments()
    {
        assertThatThrownBy(() -> service.detect(null, "cpu", WINDOW_MEAN_50_STD_10, 1.0))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.detect("host-1", " ", WINDOW_MEAN_50_STD_10, 1.0))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.detect("host-1", "cpu", WINDOW_MEAN_50_STD_10, Double.NaN))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.windowStats(WINDOW_MEAN_50_STD_10, 0))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void evaluateReadsWindowAndLatestValueFromStore()
    {
        MetricsStore store = mock(MetricsStore.class);
        service.metricsStore = store;
        when(store.latestValue("host-1", "cpu"))
                .thenReturn(Sample.of(TestSeriesFactory.BASE_TIME.plusSeconds(600), 95.0));
        when(store.recentSamples("host-1", "cpu", 30))
                .thenReturn(new Series("host-1", "Host 1", "cpu", WINDOW_MEAN_50_STD_10));

        AnomalyVerdictDTO verdict = service.evaluate("host-1", "cpu", null);

        assertThat(verdict.currentValue()).isEqualTo(95.0);
        assertThat(verdict.anomalous()).isTrue();
    }

    @Test
    void evaluateReturnsNullWithoutCurrentValue()
    {
        MetricsStore store = mock(MetricsStore.class);
        service.metricsStore = store;

        assertThat(service.evaluate("host-1", "cpu", DetectionMethod.ZSCORE)).isNull();
        verify(store, never()).recentSamples("host-1", "cpu", 30);
    }

    @Test
    void evaluatePropagatesStoreFailures()
    {
        MetricsStore store = mock(MetricsStore.class);
        service.metricsStore = store;
        when(store.latestValue("host-1", "cpu")).thenThrow(new MetricsStoreException("store down"));

        assertThatThrownBy(() -> service.evaluate("host-1", "cpu", null))
                .isInstanceOf(MetricsStoreException.class)
                .hasMessageContaining("store down");
    }

    @Test
    void worksWithoutMeterRegistry()
    {
        service.meterRegistry = null;

        AnomalyVerdictDTO verdict = service.detect("host-1", "cpu", WINDOW_MEAN_50_STD_10, 95.0);

        assertThat(verdict.anomalous()).isTrue();
    }
}
