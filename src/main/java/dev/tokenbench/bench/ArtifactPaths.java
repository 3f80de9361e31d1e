package dev.tokenbench.bench;

import dev.tokenbench.config.ConfigurationException;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Local files a run uploads: the sample spreadsheet, and for the xl approach the CLI binary and
 * the skill bundle.
 */
public record ArtifactPaths(
        @Nonnull Path sample, @Nonnull Optional<Path> xlBinary, @Nonnull Optional<Path> xlSkillBundle) {
    public static final Path DEFAULT_SAMPLE = Path.of("sample.xlsx");
    static final String BINARY_GLOB = "xl-*-linux-amd64";
    static final String SKILL_BUNDLE_GLOB = "xl-skill-*.zip";

    public ArtifactPaths {
        Objects.requireNonNull(sample, "sample");
        xlBinary = xlBinary == null ? Optional.empty() : xlBinary;
        xlSkillBundle = xlSkillBundle == null ? Optional.empty() : xlSkillBundle;
    }

    /**
     * Resolve and check every file the run needs.
     *
     * @param sample explicit sample path, or null for {@code sample.xlsx}
     * @param xlBinary explicit binary path, or null to search {@code assetsDir}
     * @param xlSkillBundle explicit skill zip, or null to search {@code assetsDir}
     * @param needsXl whether the xl approach is selected. The binary and bundle are ignored
     *     otherwise
     * @throws ConfigurationException if a required file is missing
     */
    public static ArtifactPaths resolve(
            @Nullable Path sample,
            @Nullable Path xlBinary,
            @Nullable Path xlSkillBundle,
            @Nonnull Path assetsDir,
            boolean needsXl) {
        var samplePath = sample == null ? DEFAULT_SAMPLE : sample;
        requireFile(samplePath, "Sample file");
        if (!needsXl) {
            return new ArtifactPaths(samplePath, Optional.empty(), Optional.empty());
        }
        var binary = xlBinary == null ? findAsset(assetsDir, BINARY_GLOB, "xl binary") : xlBinary;
        requireFile(binary, "xl binary");
        var bundle =
                xlSkillBundle == null
                        ? findAsset(assetsDir, SKILL_BUNDLE_GLOB, "xl skill bundle")
                        : xlSkillBundle;
        requireFile(bundle, "xl skill bundle");
        return new ArtifactPaths(samplePath, Optional.of(binary), Optional.of(bundle));
    }

    private static void requireFile(Path path, String what) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("%s not found: %s".formatted(what, path));
        }
    }

    /** First match of {@code glob} in {@code dir}, by file name. */
    static Path findAsset(Path dir, String glob, String what) {
        if (!Files.isDirectory(dir)) {
            throw new ConfigurationException(
                    "%s not found: assets directory %s does not exist".formatted(what, dir));
        }
        var matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> matcher.matches(p.getFileName()))
                    .filter(Files::isRegularFile)
                    .min(Comparator.comparing(p -> p.getFileName().toString()))
                    .orElseThrow(
                            () ->
                                    new ConfigurationException(
                                            "%s not found: no %s in %s".formatted(what, glob, dir)));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to list " + dir, e);
        }
    }
}
