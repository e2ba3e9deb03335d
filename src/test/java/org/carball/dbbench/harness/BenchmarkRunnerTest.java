package org.carball.dbbench.harness;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.dbbench.baseline.GitInfo;
import org.carball.dbbench.config.AdvisorConfig;
import org.carball.dbbench.config.BenchmarkConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BenchmarkRunnerTest {

    private ListAppender<ILoggingEvent> listAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(BenchmarkRunner.class);
        listAppender = new ListAppender<>();
        listAppender.start();
        logger.addAppender(listAppender);
        logger.setLevel(Level.WARN);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(listAppender);
    }

    @Test
    void shouldRunMeasuredIterationsWithStatistics() throws Exception {
        // Given
        CommentFeed feed = new CommentFeed();
        BenchmarkRunner runner = runner(BenchmarkConfig.defaults());

        // When
        BenchmarkRun run = runner.run(feed, 3);

        // Then
        assertThat(run.benchmarkName()).isEqualTo("CommentFeed");
        assertThat(run.iterations()).isEqualTo(3);
        assertThat(run.result().rawIterations()).hasSize(3)
                .allSatisfy(sample -> assertThat(sample.queryCount()).isEqualTo(12));
        assertThat(run.baseline().iterations()).isEqualTo(3);
        assertThat(run.baseline().stats()).isNotNull();
        assertThat(run.baseline().totalQueries()).isEqualTo(12);
        assertThat(run.baseline().benchmarkClass()).isEqualTo(CommentFeed.class.getName());
        assertThat(run.baseline().options()).containsEntry("posts", 12L);
        assertThat(run.advisorReport()).hasValueSatisfying(report -> {
            assertThat(report.getTotalQueries()).isEqualTo(12);
            assertThat(report.hasSuggestions()).isTrue();
        });
        assertThat(run.performanceScore()).isPresent();
    }

    @Test
    void shouldBuildSingleRunBaselineForOneIteration() throws Exception {
        // When
        BenchmarkRun run = runner(BenchmarkConfig.defaults()).run(new CommentFeed(), 1);

        // Then
        assertThat(run.baseline().iterations()).isEqualTo(1);
        assertThat(run.baseline().hasMultipleIterations()).isFalse();
        assertThat(run.baseline().stats()).isNull();
        assertThat(run.baseline().totalQueries()).isEqualTo(12);
    }

    @Test
    void shouldRejectFewerThanOneIteration() {
        // When/Then
        assertThatThrownBy(() -> runner(BenchmarkConfig.defaults()).run(new CommentFeed(), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 1");
    }

    @Test
    void shouldClampIterationsToMaximum() throws Exception {
        // Given
        BenchmarkConfig config = BenchmarkConfig.builder().maxIterations(2).build();

        // When
        BenchmarkRun run = runner(config).run(new CommentFeed(), 50);

        // Then
        assertThat(run.iterations()).isEqualTo(2);
        assertThat(listAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .contains("Iterations 50 outside [1, 2], using 2");
    }

    @Test
    void shouldRunWarmupWithNegativeIndices() throws Exception {
        // Given
        CommentFeed feed = new CommentFeed();
        BenchmarkConfig config = BenchmarkConfig.builder().warmupIterations(2).build();

        // When
        BenchmarkRun run = runner(config).run(feed, 2);

        // Then
        assertThat(feed.iterations).containsExactly(-1, -2, 0, 1);
        assertThat(run.result().rawIterations()).hasSize(2);
        assertThat(run.result().executionTime().warmupRuns()).isEqualTo(2);
    }

    @Test
    void shouldTearDownAndWrapFailures() {
        // Given
        FailingCase failing = new FailingCase();

        // When/Then
        assertThatThrownBy(() -> runner(BenchmarkConfig.defaults()).run(failing, 1))
                .isInstanceOf(BenchmarkException.class)
                .hasMessageContaining("Benchmark FailingCase failed")
                .hasRootCauseMessage("connection refused");
        assertThat(failing.tornDown).isTrue();
    }

    @Test
    void shouldSkipAnalysisWhenAdvisorDisabled() throws Exception {
        // Given
        BenchmarkConfig config = BenchmarkConfig.builder()
                .advisor(AdvisorConfig.builder().enabled(false).build())
                .build();

        // When
        BenchmarkRun run = runner(config).run(new CommentFeed(), 1);

        // Then
        assertThat(run.advisorReport()).isEmpty();
        assertThat(run.performanceScore()).isEmpty();
        assertThat(run.baseline().performanceScore()).isZero();
    }

    @Test
    void shouldTimeQueriesThroughContext() throws Exception {
        // Given
        BenchmarkCase lookup = new BenchmarkCase() {
            @Override
            public void benchmark(BenchmarkContext context) throws Exception {
                String name = context.query("SELECT name FROM users WHERE id = ?", List.of(7), () -> "ada");
                assertThat(name).isEqualTo("ada");
            }
        };

        // When
        BenchmarkRun run = runner(BenchmarkConfig.defaults()).run(lookup, 1);

        // Then
        assertThat(run.advisorReport()).hasValueSatisfying(report ->
                assertThat(report.getTotalQueries()).isEqualTo(1));
    }

    @Test
    void shouldReadTypedOptionsOverDefaults() throws Exception {
        // Given
        CommentFeed feed = new CommentFeed();
        feed.configure(Map.of("posts", 15));

        // When
        BenchmarkRun run = runner(BenchmarkConfig.defaults()).run(feed, 1);

        // Then
        assertThat(run.baseline().totalQueries()).isEqualTo(15);
    }

    @Test
    void shouldRejectOptionOfWrongType() {
        // Given
        CommentFeed feed = new CommentFeed();
        feed.configure(Map.of("posts", "many"));

        // When/Then
        assertThatThrownBy(() -> runner(BenchmarkConfig.defaults()).run(feed, 1))
                .isInstanceOf(BenchmarkException.class)
                .hasRootCauseInstanceOf(ClassCastException.class);
    }

    private static BenchmarkRunner runner(BenchmarkConfig config) {
        return new BenchmarkRunner(config, GitInfo::none);
    }

    static class CommentFeed extends BenchmarkCase {

        final List<Integer> iterations = new ArrayList<>();

        @Override
        public Map<String, Object> getDefaultOptions() {
            return Map.of("posts", 12);
        }

        @Override
        public void benchmark(BenchmarkContext context) {
            iterations.add(context.getIteration());
            int posts = option("posts", Integer.class, 12);
            for (int id = 1; id <= posts; id++) {
                context.record("SELECT * FROM comments WHERE post_id = " + id, List.of(), 1.5);
            }
        }
    }

    static class FailingCase extends BenchmarkCase {

        boolean tornDown = false;

        @Override
        public void benchmark(BenchmarkContext context) {
            throw new IllegalStateException("connection refused");
        }

        @Override
        public void tearDown() {
            tornDown = true;
        }
    }
}
