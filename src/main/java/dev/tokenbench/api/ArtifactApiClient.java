package dev.tokenbench.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tokenbench.config.TokenBenchConfig;
import dev.tokenbench.json.BenchJsonMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Files API and Skills API calls needed to set up a run. Both are beta endpoints the typed SDK
 * does not cover, so they are plain HTTP.
 */
public interface ArtifactApiClient {
    String FILES_BETA = "files-api-2025-04-14";
    String SKILLS_BETA = "skills-2025-10-02";

    /** Upload a file so it can be mounted into an execution container. */
    UploadedFile uploadFile(@Nonnull Path path);

    /** Delete a previously uploaded file. */
    void deleteFile(@Nonnull String fileId);

    /** List skills created by this account. */
    List<SkillMetadata> listCustomSkills();

    /**
     * Create a custom skill.
     *
     * @param files skill files. every path must share one root directory
     */
    SkillMetadata createSkill(@Nonnull String displayTitle, @Nonnull List<SkillFile> files);

    static ArtifactApiClient of(TokenBenchConfig config) {
        return new HttpImpl(config);
    }

    record UploadedFile(String id, String filename, @Nullable Long sizeBytes) {}

    record SkillMetadata(String id, String displayTitle, @Nullable String latestVersion) {}

    record SkillFile(String path, byte[] content) {}

    @Slf4j
    class HttpImpl implements ArtifactApiClient {
        private static final String API_VERSION = "2023-06-01";
        private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");

        private final String baseUrl;
        private final String apiKey;
        private final OkHttpClient httpClient;
        private final ObjectMapper objectMapper;

        HttpImpl(TokenBenchConfig config) {
            this(
                    config.baseUrl(),
                    config.apiKey(),
                    new OkHttpClient.Builder()
                            .connectTimeout(10, TimeUnit.SECONDS)
                            .readTimeout(config.requestTimeout().toSeconds(), TimeUnit.SECONDS)
                            .build());
        }

        HttpImpl(String baseUrl, String apiKey, OkHttpClient httpClient) {
            this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
            this.apiKey = apiKey;
            this.httpClient = httpClient;
            this.objectMapper = BenchJsonMapper.get();
        }

        @Override
        public UploadedFile uploadFile(@Nonnull Path path) {
            final byte[] bytes;
            try {
                bytes = Files.readAllBytes(path);
            } catch (IOException e) {
                throw new ApiException("Failed to read " + path, e);
            }
            var body =
                    new MultipartBody.Builder()
                            .setType(MultipartBody.FORM)
                            .addFormDataPart(
                                    "file",
                                    path.getFileName().toString(),
                                    RequestBody.create(bytes, OCTET_STREAM))
                            .build();
            var request = newRequest("/v1/files", FILES_BETA).post(body).build();
            var uploaded = execute(request, UploadedFile.class);
            log.info("Uploaded {}: {}", path.getFileName(), uploaded.id());
            return uploaded;
        }

        @Override
        public void deleteFile(@Nonnull String fileId) {
            var request = newRequest("/v1/files/" + fileId, FILES_BETA).delete().build();
            execute(request, Map.class);
        }

        @Override
        public List<SkillMetadata> listCustomSkills() {
            var request = newRequest("/v1/skills?source=custom", SKILLS_BETA).get().build();
            var response = execute(request, SkillList.class);
            return response.data() == null ? List.of() : response.data();
        }

        @Override
        public SkillMetadata createSkill(@Nonnull String displayTitle, @Nonnull List<SkillFile> files) {
            var body =
                    new MultipartBody.Builder()
                            .setType(MultipartBody.FORM)
                            .addFormDataPart("display_title", displayTitle);
            for (var file : files) {
                body.addFormDataPart(
                        "files", file.path(), RequestBody.create(file.content(), OCTET_STREAM));
            }
            var request = newRequest("/v1/skills", SKILLS_BETA).post(body.build()).build();
            return execute(request, SkillMetadata.class);
        }

        private Request.Builder newRequest(String path, String beta) {
            return new Request.Builder()
                    .url(baseUrl + path)
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", API_VERSION)
                    .header("anthropic-beta", beta)
                    .header("Accept", "application/json");
        }

        private <T> T execute(Request request, Class<T> responseType) {
            log.debug("API Request: {} {}", request.method(), request.url());
            try (Response response = httpClient.newCall(request).execute()) {
                var body = response.body() == null ? "" : response.body().string();
                log.debug("API Response: {} - {}", response.code(), body);
                if (!response.isSuccessful()) {
                    throw new ApiException(
                            "%s %s failed with status %d: %s"
                                    .formatted(
                                            request.method(),
                                            request.url().encodedPath(),
                                            response.code(),
                                            body));
                }
                try {
                    return objectMapper.readValue(body.isEmpty() ? "{}" : body, responseType);
                } catch (IOException e) {
                    throw new ApiException("Failed to parse response body", e);
                }
            } catch (IOException e) {
                throw new ApiException(
                        "%s %s failed: %s"
                                .formatted(request.method(), request.url().encodedPath(), e.getMessage()),
                        e);
            }
        }

        private record SkillList(List<SkillMetadata> data) {}
    }

    /** Implementation for test doubling */
    class InMemoryImpl implements ArtifactApiClient {
        private final Map<String, UploadedFile> files = new ConcurrentHashMap<>();
        private final List<SkillMetadata> skills = new CopyOnWriteArrayList<>();
        private final List<String> deletedFileIds = new CopyOnWriteArrayList<>();

        public InMemoryImpl(SkillMetadata... existingSkills) {
            this.skills.addAll(List.of(existingSkills));
        }

        @Override
        public UploadedFile uploadFile(@Nonnull Path path) {
            var uploaded =
                    new UploadedFile(
                            "file_" + UUID.randomUUID(), path.getFileName().toString(), null);
            files.put(uploaded.id(), uploaded);
            return uploaded;
        }

        @Override
        public void deleteFile(@Nonnull String fileId) {
            if (files.remove(fileId) == null) {
                throw new ApiException("file not found: " + fileId);
            }
            deletedFileIds.add(fileId);
        }

        @Override
        public List<SkillMetadata> listCustomSkills() {
            return List.copyOf(skills);
        }

        @Override
        public SkillMetadata createSkill(@Nonnull String displayTitle, @Nonnull List<SkillFile> files) {
            var skill =
                    new SkillMetadata(
                            "skill_" + UUID.randomUUID(),
                            displayTitle,
                            String.valueOf(Instant.now().toEpochMilli()));
            skills.add(skill);
            return skill;
        }

        public List<UploadedFile> uploadedFiles() {
            return new ArrayList<>(files.values());
        }

        public List<String> deletedFileIds() {
            return Collections.unmodifiableList(deletedFileIds);
        }

        public Optional<SkillMetadata> findSkill(String displayTitle) {
            return skills.stream().filter(s -> s.displayTitle().equals(displayTitle)).findFirst();
        }
    }
}
