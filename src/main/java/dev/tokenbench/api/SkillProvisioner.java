package dev.tokenbench.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.zip.ZipFile;
import lombok.extern.slf4j.Slf4j;

/** Looks up a custom skill by display title and creates it from a skill bundle when absent. */
@Slf4j
public class SkillProvisioner {
    private final ArtifactApiClient client;

    public SkillProvisioner(ArtifactApiClient client) {
        this.client = Objects.requireNonNull(client);
    }

    /**
     * Get the id of the custom skill titled {@code displayTitle}, creating it from {@code
     * bundleZip} if no such skill exists yet.
     */
    public String getOrCreate(String displayTitle, Path bundleZip) {
        var existing =
                client.listCustomSkills().stream()
                        .filter(skill -> displayTitle.equals(skill.displayTitle()))
                        .findFirst();
        if (existing.isPresent()) {
            log.info("Found existing {} skill: {}", displayTitle, existing.get().id());
            return existing.get().id();
        }
        log.info("Creating {} skill from {}", displayTitle, bundleZip.getFileName());
        var skill = client.createSkill(displayTitle, readBundle(displayTitle, bundleZip));
        log.info("Created skill: {}", skill.id());
        return skill.id();
    }

    /** Every file of the bundle, rooted under {@code <displayTitle>/}. */
    static List<ArtifactApiClient.SkillFile> readBundle(String displayTitle, Path bundleZip) {
        var files = new ArrayList<ArtifactApiClient.SkillFile>();
        try (var zip = new ZipFile(bundleZip.toFile())) {
            var entries = zip.entries();
            while (entries.hasMoreElements()) {
                var entry = entries.nextElement();
                if (entry.isDirectory()) {
                    continue;
                }
                try (var in = zip.getInputStream(entry)) {
                    files.add(
                            new ArtifactApiClient.SkillFile(
                                    displayTitle + "/" + entry.getName(), in.readAllBytes()));
                }
            }
        } catch (IOException e) {
            throw new ApiException("Failed to read skill bundle " + bundleZip, e);
        }
        if (files.isEmpty()) {
            throw new ApiException("Skill bundle is empty: " + bundleZip);
        }
        return files;
    }
}
