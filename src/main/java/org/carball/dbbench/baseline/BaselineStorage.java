package org.carball.dbbench.baseline;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.dbbench.config.BenchmarkConfig;
import org.carball.dbbench.output.JsonMappers;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Keeps the latest baseline of each benchmark as a JSON file in one directory.
 */
@Slf4j
public class BaselineStorage {

    public static final String FILE_SUFFIX = ".baseline.json";

    private final Path storagePath;
    private final ObjectMapper objectMapper = JsonMappers.createForBaselines();

    public BaselineStorage() {
        this(Paths.get(BenchmarkConfig.DEFAULT_BASELINE_PATH));
    }

    public BaselineStorage(Path storagePath) {
        this.storagePath = storagePath;
    }

    /**
     * Writes the baseline, replacing any previous one of the same benchmark.
     *
     * @return the written file
     */
    public Path save(BaselineResult result) throws IOException {
        Files.createDirectories(storagePath);
        Path file = fileFor(result.benchmarkName());
        objectMapper.writeValue(file.toFile(), result);
        log.info("Saved baseline for {} to {}", result.benchmarkName(), file);
        return file;
    }

    /**
     * Baseline of the named benchmark. Empty when none is stored or the file cannot be read.
     */
    public Optional<BaselineResult> load(String benchmarkName) {
        Path file = fileFor(benchmarkName);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(read(file));
        } catch (IOException e) {
            log.warn("Ignoring unreadable baseline {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean exists(String benchmarkName) {
        return Files.exists(fileFor(benchmarkName));
    }

    public boolean delete(String benchmarkName) throws IOException {
        return Files.deleteIfExists(fileFor(benchmarkName));
    }

    /**
     * Every readable baseline in the storage directory, ordered by benchmark name.
     */
    public List<BaselineResult> list() throws IOException {
        List<BaselineResult> baselines = new ArrayList<>();
        if (!Files.isDirectory(storagePath)) {
            return baselines;
        }

        try (DirectoryStream<Path> files = Files.newDirectoryStream(storagePath, "*.json")) {
            for (Path file : files) {
                try {
                    baselines.add(read(file));
                } catch (IOException e) {
                    log.warn("Skipping unreadable baseline {}: {}", file, e.getMessage());
                }
            }
        }

        baselines.sort(Comparator.comparing(BaselineResult::benchmarkName,
                Comparator.nullsLast(Comparator.naturalOrder())));
        return baselines;
    }

    /**
     * Reads a baseline file from any location.
     */
    public BaselineResult read(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Baseline file not found: " + file);
        }
        return objectMapper.readValue(file.toFile(), BaselineResult.class);
    }

    public Path fileFor(String benchmarkName) {
        return storagePath.resolve(fileName(benchmarkName));
    }

    public static String fileName(String benchmarkName) {
        return benchmarkName.replaceAll("[^a-zA-Z0-9_-]", "_").toLowerCase(Locale.ROOT) + FILE_SUFFIX;
    }

    public Path getStoragePath() {
        return storagePath;
    }
}
