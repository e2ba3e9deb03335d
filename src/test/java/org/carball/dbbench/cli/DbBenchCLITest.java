package org.carball.dbbench.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.dbbench.config.ConfigurationLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class DbBenchCLITest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private DbBenchCLI cli;
    private String fixture;

    @BeforeEach
    void setUp() throws Exception {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new DbBenchCLI(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                new ConfigurationLoader(Map.of()));
        fixture = Path.of(getClass().getResource("/fixtures/query-log.json").toURI()).toString();
    }

    @Test
    void shouldPrintHelp() {
        // When
        int exitCode = cli.run(new String[]{"--help"});

        // Then
        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("Usage:").contains("baseline save <name>").contains("Exit codes");
    }

    @Test
    void shouldFailWithoutCommand() {
        // When
        int exitCode = cli.run(new String[0]);

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout()).contains("Usage:");
    }

    @Test
    void shouldRejectUnknownCommand() {
        // When
        int exitCode = cli.run(new String[]{"explode"});

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Unknown command: explode");
    }

    @Test
    void shouldAnalyzeQueryLogAsText() {
        // When
        int exitCode = cli.run(new String[]{"analyze", fixture});

        // Then
        assertThat(exitCode).isZero();
        assertThat(stdout())
                .contains("Slow Query")
                .contains("com.acme.shop.OrderService::listOpenOrders()");
    }

    @Test
    void shouldAnalyzeQueryLogAsJson() throws Exception {
        // When
        int exitCode = cli.run(new String[]{"analyze", fixture, "-f", "json"});

        // Then
        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(stdout());
        assertThat(json.get("total_queries").asInt()).isEqualTo(4);
        assertThat(json.get("unique_queries").asInt()).isEqualTo(2);
        assertThat(json.get("suggestions").get(0).get("type").asText()).isEqualTo("slow_query");
    }

    @Test
    void shouldRejectInvalidFormat() {
        // When
        int exitCode = cli.run(new String[]{"analyze", fixture, "--format", "xml"});

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Invalid format: xml");
    }

    @Test
    void shouldReportMissingQueryLog() {
        // When
        int exitCode = cli.run(new String[]{"analyze", tempDir.resolve("absent.json").toString()});

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("IO error");
    }

    @Test
    void shouldSaveBaselineAndCompareByName() {
        // Given
        String storage = tempDir.resolve("baselines").toString();
        int saved = cli.run(new String[]{"baseline", "save", "Order Listing", fixture, "--baseline-path", storage});

        // When
        int compared = cli.run(new String[]{"compare", "Order Listing", fixture, "--baseline-path", storage});

        // Then
        assertThat(saved).isZero();
        assertThat(tempDir.resolve("baselines/order_listing.baseline.json")).exists();
        assertThat(compared).isZero();
        assertThat(stdout()).contains("Baseline saved").contains("BASELINE COMPARISON").contains("Stable");
    }

    @Test
    void shouldReturnDistinctCodeForMissingBaseline() {
        // When
        int exitCode = cli.run(new String[]{"compare", "nothing-here", fixture,
                "--baseline-path", tempDir.toString()});

        // Then
        assertThat(exitCode).isEqualTo(2);
        assertThat(stderr()).contains("No baseline found for nothing-here");
    }

    @Test
    void shouldFailOnCriticalRegression() throws Exception {
        // Given
        String storage = tempDir.resolve("baselines").toString();
        cli.run(new String[]{"baseline", "save", "orders", fixture, "--baseline-path", storage});
        Path current = tempDir.resolve("current.json");
        Files.writeString(current, queryLog(10));
        Path export = tempDir.resolve("out/comparison.json");

        // When
        int exitCode = cli.run(new String[]{"compare", "orders", current.toString(),
                "--baseline-path", storage, "--fail-on-regression", "--export", export.toString()});

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout()).contains("REGRESSION DETECTED").contains("Query Count: 4 → 10");
        assertThat(new ObjectMapper().readTree(export.toFile()).get("status").asText()).isEqualTo("critical");
    }

    @Test
    void shouldNotFailOnRegressionWithoutFlag() throws Exception {
        // Given
        String storage = tempDir.resolve("baselines").toString();
        cli.run(new String[]{"baseline", "save", "orders", fixture, "--baseline-path", storage});
        Path current = tempDir.resolve("current.json");
        Files.writeString(current, queryLog(10));

        // When
        int exitCode = cli.run(new String[]{"compare", "orders", current.toString(), "--baseline-path", storage});

        // Then
        assertThat(exitCode).isZero();
    }

    @Test
    void shouldListBaselines() {
        // Given
        String storage = tempDir.resolve("baselines").toString();
        cli.run(new String[]{"baseline", "save", "orders", fixture, "--baseline-path", storage});

        // When
        int exitCode = cli.run(new String[]{"baselines", "list", "--baseline-path", storage});

        // Then
        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("Baselines in").contains("orders");
    }

    @Test
    void shouldReportEmptyBaselineDirectory() {
        // When
        int exitCode = cli.run(new String[]{"baselines", "list", "--baseline-path", tempDir.toString()});

        // Then
        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("No baselines found");
    }

    @Test
    void shouldSkipOptionValuesWhenCollectingPositionals() {
        // When/Then
        assertThat(DbBenchCLI.positionals(new String[]{
                "compare", "--baseline-path", "dir", "orders", "-f", "json",
                "--advisor.slow_query.threshold_ms", "50", "--fail-on-regression", "current.json"}))
                .containsExactly("compare", "orders", "current.json");
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static String queryLog(int count) {
        StringBuilder queries = new StringBuilder();
        for (int i = 1; i <= count; i++) {
            if (i > 1) {
                queries.append(",\n");
            }
            queries.append("    {\"sql\": \"SELECT * FROM customers WHERE id = ?\", \"bindings\": [")
                    .append(i).append("], \"time_ms\": 2.0}");
        }
        return "{\n  \"execution_time\": 0.5,\n  \"queries\": [\n" + queries + "\n  ]\n}\n";
    }
}
