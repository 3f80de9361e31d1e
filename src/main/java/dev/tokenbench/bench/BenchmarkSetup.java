package dev.tokenbench.bench;

import dev.tokenbench.api.ArtifactApiClient;
import dev.tokenbench.api.SkillProvisioner;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Uploads and provisions everything a run shares, and removes the uploads afterwards.
 *
 * <p>Setup is all or nothing: any failure raises {@link SetupException} after deleting whatever was
 * already uploaded.
 */
@Slf4j
public class BenchmarkSetup {
    private final ArtifactApiClient client;
    private final SkillProvisioner provisioner;
    private final String skillTitle;

    public BenchmarkSetup(ArtifactApiClient client, String skillTitle) {
        this(client, new SkillProvisioner(client), skillTitle);
    }

    BenchmarkSetup(ArtifactApiClient client, SkillProvisioner provisioner, String skillTitle) {
        this.client = Objects.requireNonNull(client);
        this.provisioner = Objects.requireNonNull(provisioner);
        this.skillTitle = Objects.requireNonNull(skillTitle);
    }

    /**
     * Upload the sample and, when {@code withXl}, the xl binary and skill.
     *
     * @throws SetupException if any upload or provisioning call fails
     */
    public SharedArtifacts provision(ArtifactPaths paths, boolean withXl) {
        List<String> uploaded = new ArrayList<>();
        try {
            log.info("Uploading {}...", paths.sample().getFileName());
            var sample = client.uploadFile(paths.sample());
            uploaded.add(sample.id());
            var artifacts = SharedArtifacts.sampleOnly(sample.id(), sample.filename());
            if (!withXl) {
                return artifacts;
            }
            var bundle =
                    paths.xlSkillBundle()
                            .orElseThrow(() -> new IllegalStateException("xl skill bundle not resolved"));
            var binaryPath =
                    paths.xlBinary()
                            .orElseThrow(() -> new IllegalStateException("xl binary not resolved"));
            log.info("Setting up {} skill...", skillTitle);
            var skillId = provisioner.getOrCreate(skillTitle, bundle);
            log.info("Uploading {}...", binaryPath.getFileName());
            var binary = client.uploadFile(binaryPath);
            uploaded.add(binary.id());
            return artifacts.withXl(binary.id(), binary.filename(), skillId);
        } catch (RuntimeException e) {
            deleteQuietly(uploaded);
            throw new SetupException("Setup failed: " + e.getMessage(), e);
        }
    }

    /** Delete every upload of the run. Failures are logged and otherwise ignored. */
    public void cleanup(SharedArtifacts artifacts) {
        deleteQuietly(artifacts.uploadedFileIds());
    }

    private void deleteQuietly(List<String> fileIds) {
        for (var fileId : fileIds) {
            try {
                client.deleteFile(fileId);
                log.debug("Deleted uploaded file {}", fileId);
            } catch (RuntimeException e) {
                log.warn("Failed to delete uploaded file {}: {}", fileId, e.getMessage());
            }
        }
    }
}
