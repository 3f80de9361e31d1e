package dev.tokenbench.api;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.junit.jupiter.api.Assertions.*;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import dev.tokenbench.config.TokenBenchConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.junit.jupiter.api.io.TempDir;

public class ArtifactApiClientTest {

    @RegisterExtension
    static WireMockExtension wireMock =
            WireMockExtension.newInstance().options(wireMockConfig().dynamicPort()).build();

    @TempDir Path tempDir;

    private ArtifactApiClient apiClient;

    @BeforeEach
    void beforeEach() {
        wireMock.resetAll();
        var config =
                TokenBenchConfig.builder()
                        .apiKey("test-api-key")
                        .baseUrl("http://localhost:" + wireMock.getPort())
                        .build();
        apiClient = ArtifactApiClient.of(config);
    }

    @Test
    @SneakyThrows
    void uploadFileSendsMultipartWithFilesBeta() {
        wireMock.stubFor(
                post(urlEqualTo("/v1/files"))
                        .willReturn(
                                aResponse()
                                        .withStatus(200)
                                        .withHeader("Content-Type", "application/json")
                                        .withBody(
                                                """
                                                {
                                                  "id": "file_011",
                                                  "type": "file",
                                                  "filename": "sample.xlsx",
                                                  "size_bytes": 5,
                                                  "mime_type": "application/octet-stream"
                                                }
                                                """)));
        var sample = tempDir.resolve("sample.xlsx");
        Files.write(sample, new byte[] {1, 2, 3, 4, 5});

        var uploaded = apiClient.uploadFile(sample);

        assertEquals("file_011", uploaded.id());
        assertEquals("sample.xlsx", uploaded.filename());
        assertEquals(5L, uploaded.sizeBytes());
        wireMock.verify(
                postRequestedFor(urlEqualTo("/v1/files"))
                        .withHeader("x-api-key", equalTo("test-api-key"))
                        .withHeader("anthropic-version", equalTo("2023-06-01"))
                        .withHeader("anthropic-beta", equalTo(ArtifactApiClient.FILES_BETA))
                        .withHeader("Content-Type", containing("multipart/form-data"))
                        .withRequestBody(containing("filename=\"sample.xlsx\"")));
    }

    @Test
    void deleteFileCallsDelete() {
        wireMock.stubFor(
                delete(urlEqualTo("/v1/files/file_011"))
                        .willReturn(
                                aResponse()
                                        .withStatus(200)
                                        .withHeader("Content-Type", "application/json")
                                        .withBody("{\"id\": \"file_011\", \"type\": \"file_deleted\"}")));

        apiClient.deleteFile("file_011");

        wireMock.verify(deleteRequestedFor(urlEqualTo("/v1/files/file_011")));
    }

    @Test
    void listCustomSkillsParsesDisplayTitles() {
        wireMock.stubFor(
                get(urlPathEqualTo("/v1/skills"))
                        .withQueryParam("source", equalTo("custom"))
                        .willReturn(
                                aResponse()
                                        .withStatus(200)
                                        .withHeader("Content-Type", "application/json")
                                        .withBody(
                                                """
                                                {
                                                  "data": [
                                                    {"id": "skill_1", "display_title": "xl-cli", "latest_version": "1759178010641129", "source": "custom"},
                                                    {"id": "skill_2", "display_title": "other", "source": "custom"}
                                                  ],
                                                  "has_more": false
                                                }
                                                """)));

        var skills = apiClient.listCustomSkills();

        assertEquals(2, skills.size());
        assertEquals("skill_1", skills.get(0).id());
        assertEquals("xl-cli", skills.get(0).displayTitle());
        assertEquals("1759178010641129", skills.get(0).latestVersion());
        assertNull(skills.get(1).latestVersion());
        wireMock.verify(
                getRequestedFor(urlPathEqualTo("/v1/skills"))
                        .withHeader("anthropic-beta", equalTo(ArtifactApiClient.SKILLS_BETA)));
    }

    @Test
    void createSkillSendsTitleAndEveryFile() {
        wireMock.stubFor(
                post(urlEqualTo("/v1/skills"))
                        .willReturn(
                                aResponse()
                                        .withStatus(200)
                                        .withHeader("Content-Type", "application/json")
                                        .withBody(
                                                "{\"id\": \"skill_new\", \"display_title\": \"xl-cli\"}")));

        var skill =
                apiClient.createSkill(
                        "xl-cli",
                        List.of(
                                new ArtifactApiClient.SkillFile("xl-cli/SKILL.md", "# xl".getBytes()),
                                new ArtifactApiClient.SkillFile(
                                        "xl-cli/reference.md", "ref".getBytes())));

        assertEquals("skill_new", skill.id());
        wireMock.verify(
                postRequestedFor(urlEqualTo("/v1/skills"))
                        .withRequestBody(containing("name=\"display_title\""))
                        .withRequestBody(containing("filename=\"xl-cli/SKILL.md\""))
                        .withRequestBody(containing("filename=\"xl-cli/reference.md\"")));
    }

    @Test
    void errorStatusBecomesApiException() {
        wireMock.stubFor(
                get(urlPathEqualTo("/v1/skills"))
                        .willReturn(
                                aResponse()
                                        .withStatus(401)
                                        .withBody("{\"error\": {\"type\": \"authentication_error\"}}")));

        var e = assertThrows(ApiException.class, () -> apiClient.listCustomSkills());
        assertTrue(e.getMessage().contains("401"), e.getMessage());
        assertTrue(e.getMessage().contains("authentication_error"), e.getMessage());
    }

    @Test
    void unparsableBodyBecomesApiException() {
        wireMock.stubFor(
                post(urlEqualTo("/v1/skills"))
                        .willReturn(aResponse().withStatus(200).withBody("not json")));

        assertThrows(
                ApiException.class,
                () ->
                        apiClient.createSkill(
                                "xl-cli",
                                List.of(new ArtifactApiClient.SkillFile("xl-cli/a", new byte[] {1}))));
    }

    @Test
    void missingLocalFileBecomesApiException() {
        assertThrows(ApiException.class, () -> apiClient.uploadFile(tempDir.resolve("absent.xlsx")));
        assertEquals(0, wireMock.getAllServeEvents().size());
    }
}
