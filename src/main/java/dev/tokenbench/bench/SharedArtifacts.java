package dev.tokenbench.bench;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Handles produced by the setup phase and shared by every task of a run.
 *
 * @param sampleFileId Files API id of the uploaded spreadsheet
 * @param sampleFilename name the spreadsheet is mounted under in the container
 * @param xlBinaryFileId Files API id of the uploaded xl binary, present only when xl runs
 * @param xlBinaryName name the binary is mounted under in the container
 * @param xlSkillId id of the provisioned custom skill, present only when xl runs
 */
public record SharedArtifacts(
        @Nonnull String sampleFileId,
        @Nonnull String sampleFilename,
        @Nonnull Optional<String> xlBinaryFileId,
        @Nonnull Optional<String> xlBinaryName,
        @Nonnull Optional<String> xlSkillId) {

    public SharedArtifacts {
        Objects.requireNonNull(sampleFileId, "sampleFileId");
        Objects.requireNonNull(sampleFilename, "sampleFilename");
        xlBinaryFileId = xlBinaryFileId == null ? Optional.empty() : xlBinaryFileId;
        xlBinaryName = xlBinaryName == null ? Optional.empty() : xlBinaryName;
        xlSkillId = xlSkillId == null ? Optional.empty() : xlSkillId;
    }

    public static SharedArtifacts sampleOnly(String sampleFileId, String sampleFilename) {
        return new SharedArtifacts(
                sampleFileId, sampleFilename, Optional.empty(), Optional.empty(), Optional.empty());
    }

    public SharedArtifacts withXl(String binaryFileId, String binaryName, String skillId) {
        return new SharedArtifacts(
                sampleFileId,
                sampleFilename,
                Optional.of(binaryFileId),
                Optional.of(binaryName),
                Optional.of(skillId));
    }

    /** Every uploaded file id, for cleanup. */
    public List<String> uploadedFileIds() {
        var ids = new ArrayList<String>();
        ids.add(sampleFileId);
        xlBinaryFileId.ifPresent(ids::add);
        return ids;
    }
}
