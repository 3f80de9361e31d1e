package dev.tokenbench.bench;

import dev.tokenbench.json.BenchJsonMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads and writes run records as pretty-printed JSON.
 *
 * <p>Optional outcome fields (error, response text, grade, rationale) are omitted when absent.
 */
@Slf4j
public final class ResultStore {
    private ResultStore() {}

    /** {@code <resultsDir>/benchmark_<timestamp>.json} */
    public static Path defaultPath(Path resultsDir, String timestamp) {
        return resultsDir.resolve("benchmark_" + timestamp + ".json");
    }

    /** Write {@code run} to {@code path}, creating parent directories. */
    public static Path write(Path path, BenchmarkRun run) {
        try {
            var parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            BenchJsonMapper.get().writerWithDefaultPrettyPrinter().writeValue(path.toFile(), run);
            log.debug("wrote {} outcomes to {}", run.results().size(), path);
            return path;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write results to " + path, e);
        }
    }

    public static BenchmarkRun read(Path path) {
        try {
            return BenchJsonMapper.get().readValue(path.toFile(), BenchmarkRun.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read results from " + path, e);
        }
    }
}
