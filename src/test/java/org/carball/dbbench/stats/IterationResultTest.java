package org.carball.dbbench.stats;

import org.carball.dbbench.baseline.BaselineResult;
import org.carball.dbbench.baseline.GitInfo;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class IterationResultTest {

    private static final List<IterationSample> SAMPLES = List.of(
            new IterationSample(0.30, 1000, 5000, 12, 20.0, 80),
            new IterationSample(0.10, 3000, 7000, 12, 10.0, 90),
            new IterationSample(0.20, 2000, 6000, 14, 30.0, 70));

    @Test
    void shouldComputeStatsPerMetric() {
        // When
        IterationResult result = IterationResult.fromIterations(SAMPLES, 2);

        // Then
        assertThat(result.executionTime().median()).isEqualTo(0.2);
        assertThat(result.primaryResult()).isEqualTo(0.2);
        assertThat(result.memoryUsed().max()).isEqualTo(3000.0);
        assertThat(result.peakMemory().min()).isEqualTo(5000.0);
        assertThat(result.queryCount().median()).isEqualTo(12.0);
        assertThat(result.dbTime().mean()).isEqualTo(20.0);
        assertThat(result.performanceScore().median()).isEqualTo(80.0);
        assertThat(result.executionTime().warmupRuns()).isEqualTo(2);
        assertThat(result.rawIterations()).hasSize(3);
    }

    @Test
    void shouldReturnEmptyStatsWithoutIterations() {
        // When
        IterationResult result = IterationResult.fromIterations(List.of(), 0);

        // Then
        assertThat(result.executionTime().iterations()).isZero();
        assertThat(result.performanceScore().mean()).isZero();
    }

    @Test
    void shouldBuildBaselineFromMedians() {
        // Given
        IterationResult result = IterationResult.fromIterations(SAMPLES, 0);

        // When
        BaselineResult baseline = result.toBaseline("listing", "com.acme.ListingBenchmark",
                Map.of("rows", 50), new GitInfo("main", "abc1234"));

        // Then
        assertThat(baseline.executionTime()).isEqualTo(0.2);
        assertThat(baseline.peakMemory()).isEqualTo(6000);
        assertThat(baseline.totalQueries()).isEqualTo(12);
        assertThat(baseline.totalDbTime()).isEqualTo(20.0);
        assertThat(baseline.performanceScore()).isEqualTo(80);
        assertThat(baseline.iterations()).isEqualTo(3);
        assertThat(baseline.hasMultipleIterations()).isTrue();
        assertThat(baseline.gitBranch()).isEqualTo("main");
        assertThat(baseline.stats()).isSameAs(result);
        assertThat(baseline.createdAt()).isNotNull();
    }
}
