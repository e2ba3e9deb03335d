package org.carball.dbbench.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private static final String ENV_PREFIX = "DBBENCH_";
    private static final String RULE_ARG_PREFIX = "--advisor.";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults.
     * The YAML file is taken from {@code --config <file>} or {@code DBBENCH_CONFIG}.
     */
    public BenchmarkConfig loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        BenchmarkConfig config = BenchmarkConfig.defaults();

        // 1. YAML file
        String configFile = findArgument(args, "--config");
        if (configFile == null) {
            configFile = environment.get(ENV_PREFIX + "CONFIG");
        }
        if (configFile != null) {
            Path path = Paths.get(configFile);
            try {
                config = loadYaml(path);
            } catch (IOException e) {
                log.warn("Could not read configuration file {}: {}", path, e.getMessage());
            }
        }

        // 2. Environment variables
        applyEnvironmentVariables(config);

        // 3. CLI arguments (highest priority)
        applyCLIArguments(config, args);

        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    /**
     * Reads a YAML configuration file on top of the defaults.
     */
    public BenchmarkConfig loadYaml(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Configuration file not found: " + path);
        }
        JsonNode root = yamlMapper.readTree(path.toFile());
        BenchmarkConfig config = BenchmarkConfig.defaults();
        if (root == null || !root.isObject()) {
            log.warn("Configuration file {} is empty or not a mapping, using defaults", path);
            return config;
        }
        applyYaml(config, root);
        log.debug("Loaded configuration file {}", path);
        return config;
    }

    void applyYaml(BenchmarkConfig config, JsonNode root) {
        JsonNode advisor = root.path("advisor");
        if (advisor.isObject()) {
            AdvisorConfig advisorConfig = config.getAdvisor();
            advisorConfig.setEnabled(booleanValue(advisor.get("enabled"), "advisor.enabled", advisorConfig.isEnabled()));

            JsonNode rules = advisor.path("rules");
            if (rules.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = rules.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> rule = fields.next();
                    if (!rule.getValue().isObject()) {
                        log.warn("Ignoring settings for rule {}: expected a mapping", rule.getKey());
                        continue;
                    }
                    Iterator<Map.Entry<String, JsonNode>> options = rule.getValue().fields();
                    while (options.hasNext()) {
                        Map.Entry<String, JsonNode> option = options.next();
                        advisorConfig.setRuleOption(rule.getKey(), option.getKey(), scalar(option.getValue()));
                    }
                }
            }

            JsonNode display = advisor.path("display");
            if (display.isObject()) {
                DisplaySettings settings = advisorConfig.getDisplay();
                settings.setMaxPerType(intValue(display.get("max_per_type"), "advisor.display.max_per_type",
                        settings.getMaxPerType()));
                settings.setMaxTotal(intValue(display.get("max_total"), "advisor.display.max_total",
                        settings.getMaxTotal()));
            }
        }

        JsonNode thresholds = root.path("regression").path("thresholds");
        if (thresholds.isObject()) {
            RegressionThresholds regression = config.getRegression();
            Iterator<Map.Entry<String, JsonNode>> metrics = thresholds.fields();
            while (metrics.hasNext()) {
                Map.Entry<String, JsonNode> metric = metrics.next();
                String name = metric.getKey();
                JsonNode level = metric.getValue();
                if (level.has("warning")) {
                    regression.warning(name, doubleValue(level.get("warning"),
                            "regression.thresholds." + name + ".warning", regression.warning(name)));
                }
                if (level.has("critical")) {
                    regression.critical(name, doubleValue(level.get("critical"),
                            "regression.thresholds." + name + ".critical", regression.critical(name)));
                }
            }
        }

        JsonNode iterations = root.path("iterations");
        if (iterations.isObject()) {
            config.setDefaultIterations(intValue(iterations.get("default"), "iterations.default", config.getDefaultIterations()));
            config.setMinIterations(intValue(iterations.get("min"), "iterations.min", config.getMinIterations()));
            config.setMaxIterations(intValue(iterations.get("max"), "iterations.max", config.getMaxIterations()));
            config.setWarmupIterations(intValue(iterations.get("warmup"), "iterations.warmup", config.getWarmupIterations()));
        }

        JsonNode baselinePath = root.path("baseline").path("path");
        if (baselinePath.isTextual()) {
            config.setBaselinePath(baselinePath.asText());
        }
    }

    private void applyEnvironmentVariables(BenchmarkConfig config) {
        AdvisorConfig advisor = config.getAdvisor();

        if (environment.containsKey(ENV_PREFIX + "ADVISOR_ENABLED")) {
            advisor.setEnabled(RuleSettings.toBoolean(ENV_PREFIX + "ADVISOR_ENABLED",
                    environment.get(ENV_PREFIX + "ADVISOR_ENABLED"), advisor.isEnabled()));
        }
        if (environment.containsKey(ENV_PREFIX + "ITERATIONS")) {
            config.setDefaultIterations(parseInt(ENV_PREFIX + "ITERATIONS",
                    environment.get(ENV_PREFIX + "ITERATIONS"), config.getDefaultIterations()));
        }
        if (environment.containsKey(ENV_PREFIX + "WARMUP")) {
            config.setWarmupIterations(parseInt(ENV_PREFIX + "WARMUP",
                    environment.get(ENV_PREFIX + "WARMUP"), config.getWarmupIterations()));
        }
        if (environment.containsKey(ENV_PREFIX + "BASELINE_PATH")) {
            config.setBaselinePath(environment.get(ENV_PREFIX + "BASELINE_PATH"));
        }
        if (environment.containsKey(ENV_PREFIX + "N_PLUS_ONE_THRESHOLD")) {
            advisor.setRuleOption("n_plus_one", "threshold", environment.get(ENV_PREFIX + "N_PLUS_ONE_THRESHOLD"));
        }
        if (environment.containsKey(ENV_PREFIX + "SLOW_QUERY_THRESHOLD_MS")) {
            advisor.setRuleOption("slow_query", "threshold_ms", environment.get(ENV_PREFIX + "SLOW_QUERY_THRESHOLD_MS"));
        }
    }

    private void applyCLIArguments(BenchmarkConfig config, String[] args) {
        AdvisorConfig advisor = config.getAdvisor();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];

            if ("--no-advisor".equals(arg)) {
                advisor.setEnabled(false);
                continue;
            }

            if (i + 1 >= args.length) {
                continue;
            }
            String value = args[i + 1];

            switch (arg) {
                case "--iterations":
                    config.setDefaultIterations(parseInt(arg, value, config.getDefaultIterations()));
                    break;
                case "--warmup":
                    config.setWarmupIterations(parseInt(arg, value, config.getWarmupIterations()));
                    break;
                case "--baseline-path":
                    config.setBaselinePath(value);
                    break;
                case "--advisor.enabled":
                    advisor.setEnabled(RuleSettings.toBoolean(arg, value, advisor.isEnabled()));
                    break;
                default:
                    // --advisor.<rule>.<key> <value>
                    if (arg.startsWith(RULE_ARG_PREFIX)) {
                        String path = arg.substring(RULE_ARG_PREFIX.length());
                        int dot = path.indexOf('.');
                        if (dot > 0 && dot < path.length() - 1) {
                            advisor.setRuleOption(path.substring(0, dot), path.substring(dot + 1), value);
                        } else {
                            log.warn("Ignoring malformed rule option {}", arg);
                        }
                    }
                    break;
            }
        }
    }

    private static String findArgument(String[] args, String name) {
        for (int i = 0; i < args.length - 1; i++) {
            if (name.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    private static int parseInt(String name, String value, int defaultValue) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", name, value);
            return defaultValue;
        }
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return node.asText();
    }

    private static int intValue(JsonNode node, String name, int defaultValue) {
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (node.isNumber()) {
            return node.intValue();
        }
        return parseInt(name, node.asText(), defaultValue);
    }

    private static double doubleValue(JsonNode node, String name, double defaultValue) {
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        try {
            return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", name, node.asText());
            return defaultValue;
        }
    }

    private static boolean booleanValue(JsonNode node, String name, boolean defaultValue) {
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return RuleSettings.toBoolean(name, node.asText(), defaultValue);
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --config <file>                      YAML configuration file
              --iterations <num>                   Measured iterations per benchmark
              --warmup <num>                       Warmup iterations (not measured)
              --baseline-path <dir>                Directory holding baseline files
              --advisor.enabled <true|false>       Enable or disable the query advisor
              --no-advisor                         Disable the query advisor
              --advisor.<rule>.<key> <value>       Override a rule setting,
                                                   e.g. --advisor.n_plus_one.threshold 20

            Environment Variables:
              DBBENCH_CONFIG                       YAML configuration file
              DBBENCH_ADVISOR_ENABLED              Enable or disable the query advisor
              DBBENCH_ITERATIONS                   Measured iterations per benchmark
              DBBENCH_WARMUP                       Warmup iterations
              DBBENCH_BASELINE_PATH                Directory holding baseline files
              DBBENCH_N_PLUS_ONE_THRESHOLD         Identical queries before N+1 is reported
              DBBENCH_SLOW_QUERY_THRESHOLD_MS      Slow query threshold in milliseconds

            Rules: n_plus_one, slow_query, hotspot, duplicate
            """;
    }
}
