package org.carball.dbbench.baseline;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Branch and short commit of the working copy. Both are null outside a git repository
 * or when git is not installed.
 */
@Slf4j
public record GitInfo(String branch, String commit) {

    private static final long TIMEOUT_SECONDS = 5;

    public static GitInfo none() {
        return new GitInfo(null, null);
    }

    public static GitInfo detect() {
        return detect(Path.of("."));
    }

    public static GitInfo detect(Path directory) {
        return new GitInfo(
                git(directory, "rev-parse", "--abbrev-ref", "HEAD"),
                git(directory, "rev-parse", "--short", "HEAD"));
    }

    private static String git(Path directory, String... args) {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));

        Path output = null;
        try {
            output = Files.createTempFile("dbbench-git", ".out");
            Process process = new ProcessBuilder(command)
                    .directory(directory.toFile())
                    .redirectOutput(output.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.debug("git {} timed out", String.join(" ", args));
                return null;
            }
            String result = Files.readString(output, StandardCharsets.UTF_8).trim();
            if (process.exitValue() != 0 || result.isEmpty()) {
                return null;
            }
            return result;
        } catch (IOException e) {
            log.debug("git not available: {}", e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } finally {
            deleteQuietly(output);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }
}
