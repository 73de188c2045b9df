package com.tcode.gateway.directory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tcode.common.config.TcodeConfig;
import com.tcode.common.logging.SubsystemLogger;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the GitHub-backed directory against a mock server.
 */
class GitHubCodespaceDirectoryTest {

    private static final String TOKEN = "gho_1234567890abcdefghij";

    private MockWebServer server;
    private ExecutorService executor;
    private GitHubCodespaceDirectory directory;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newSingleThreadExecutor();

        TcodeConfig.GitHubConfig config = new TcodeConfig.GitHubConfig();
        config.setApiBaseUrl(server.url("/").toString());
        config.setUserAgent("tcode-test");
        directory = new GitHubCodespaceDirectory(TOKEN, config,
                new OkHttpClient.Builder().callTimeout(5, TimeUnit.SECONDS).build(),
                new ObjectMapper(), executor, SubsystemLogger.create("gateway/directory"));
    }

    @AfterEach
    void tearDown() throws Exception {
        executor.shutdownNow();
        server.shutdown();
    }

    private static MockResponse json(int code, String body) {
        return new MockResponse().setResponseCode(code)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return e.getCause();
    }

    @Test
    void listCodespaces_parsesListAndSendsHeaders() throws Exception {
        server.enqueue(json(200, """
                {"total_count": 1, "codespaces": [{
                  "id": 7, "name": "fuzzy-potato", "display_name": "fuzzy potato",
                  "state": "Available", "web_url": "https://fuzzy-potato.github.dev",
                  "repository": {"id": 1, "name": "demo", "full_name": "octo/demo"},
                  "machine": {"name": "basicLinux32gb", "cpus": 2},
                  "git_status": {"ref": "main", "ahead": 0, "behind": 1, "has_uncommitted_changes": true},
                  "extra_field": "ignored"
                }]}
                """));

        List<Codespace> codespaces = directory.listCodespaces().get(5, TimeUnit.SECONDS);

        assertEquals(1, codespaces.size());
        Codespace codespace = codespaces.get(0);
        assertEquals("fuzzy-potato", codespace.getName());
        assertEquals("octo/demo", codespace.getRepositoryFullName());
        assertEquals(2, codespace.getMachine().getCpus());
        assertTrue(codespace.getGitStatus().getHasUncommittedChanges());

        RecordedRequest request = server.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("/user/codespaces", request.getPath());
        assertEquals("Bearer " + TOKEN, request.getHeader("Authorization"));
        assertEquals("application/vnd.github+json", request.getHeader("Accept"));
        assertEquals("tcode-test", request.getHeader("User-Agent"));
    }

    @Test
    void listCodespaces_withoutListIsEmpty() throws Exception {
        server.enqueue(json(200, "{\"total_count\": 0}"));
        assertTrue(directory.listCodespaces().get(5, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void unauthorizedIsBadCredentials() {
        server.enqueue(json(401, "{\"message\": \"Bad credentials\"}"));

        DirectoryError error = assertInstanceOf(DirectoryError.class, failureOf(directory.listCodespaces()));

        assertEquals("Bad credentials", error.getMessage());
        assertEquals(401, error.getStatus());
        assertFalse(error.isRetryable());
    }

    @Test
    void missingCodespaceIsNotFound() {
        server.enqueue(json(404, "{\"message\": \"Not Found\"}"));

        DirectoryError error = assertInstanceOf(DirectoryError.class,
                failureOf(directory.getConnectionInfo("ghost")));

        assertEquals("Codespace not found", error.getMessage());
    }

    @Test
    void otherStatusCarriesCodeAndBody() {
        server.enqueue(json(500, "boom"));

        DirectoryError error = assertInstanceOf(DirectoryError.class, failureOf(directory.listCodespaces()));

        assertEquals("GitHub API Error: 500 boom", error.getMessage());
        assertEquals(500, error.getStatus());
    }

    @Test
    void getConnectionInfo_parsesTunnelProperties() throws Exception {
        server.enqueue(json(200, """
                {"name": "fuzzy-potato", "state": "Available",
                 "repository": {"full_name": "octo/demo"},
                 "connection": {"tunnelProperties": {
                   "tunnelId": "tun-1", "clusterId": "usw2", "domain": "rel.tunnels.api.visualstudio.com",
                   "connectAccessToken": "connect-secret", "managePortsAccessToken": "manage-secret",
                   "serviceUri": "https://global.rel.tunnels.api.visualstudio.com/"}}}
                """));

        CodespaceConnectionInfo info = directory.getConnectionInfo("fuzzy-potato").get(5, TimeUnit.SECONDS);

        assertEquals("octo/demo", info.getRepositoryFullName());
        assertEquals("tun-1", info.tunnelProperties().tunnelId());
        assertEquals("usw2", info.tunnelProperties().clusterId());
        assertEquals("connect-secret", info.tunnelProperties().connectAccessToken());
        assertFalse(info.tunnelProperties().toString().contains("secret"));

        RecordedRequest request = server.takeRequest();
        assertEquals("/user/codespaces/fuzzy-potato?internal=true&refresh=true", request.getPath());
    }

    @Test
    void getConnectionInfo_startingIsRetryable() {
        server.enqueue(json(200, "{\"name\": \"fuzzy-potato\", \"state\": \"Starting\"}"));

        DirectoryError error = assertInstanceOf(DirectoryError.class,
                failureOf(directory.getConnectionInfo("fuzzy-potato")));

        assertTrue(error.isRetryable());
        assertEquals("Starting", error.getCodespaceState());
        assertEquals("Codespace is Starting. This is normal during initialization - please retry in 30-60 seconds.",
                error.getMessage());
    }

    @Test
    void getConnectionInfo_shutdownIsNotRetryable() {
        server.enqueue(json(200, "{\"name\": \"fuzzy-potato\", \"state\": \"Shutdown\"}"));

        DirectoryError error = assertInstanceOf(DirectoryError.class,
                failureOf(directory.getConnectionInfo("fuzzy-potato")));

        assertFalse(error.isRetryable());
        assertEquals("Codespace is not available. Current state: Shutdown. Please start the codespace first.",
                error.getMessage());
    }

    @Test
    void getConnectionInfo_withoutTunnelPropertiesFails() {
        server.enqueue(json(200, "{\"name\": \"fuzzy-potato\", \"state\": \"Available\", \"connection\": {}}"));

        Throwable error = failureOf(directory.getConnectionInfo("fuzzy-potato"));

        assertInstanceOf(DirectoryError.class, error);
        assertTrue(error.getMessage().startsWith("Tunnel properties not found"));
    }

    @Test
    void startCodespace_postsAndReturnsState() throws Exception {
        server.enqueue(json(202, "{\"name\": \"fuzzy-potato\", \"state\": \"Starting\"}"));

        Codespace codespace = directory.startCodespace("fuzzy-potato").get(5, TimeUnit.SECONDS);

        assertEquals("Starting", codespace.getState());
        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/user/codespaces/fuzzy-potato/start", request.getPath());
    }

    @Test
    void stopCodespace_posts() throws Exception {
        server.enqueue(json(202, "{\"name\": \"fuzzy-potato\", \"state\": \"ShuttingDown\"}"));

        directory.stopCodespace("fuzzy-potato").get(5, TimeUnit.SECONDS);

        assertEquals("/user/codespaces/fuzzy-potato/stop", server.takeRequest().getPath());
    }

    @Test
    void networkFailureIsDirectoryError() {
        TcodeConfig.GitHubConfig config = new TcodeConfig.GitHubConfig();
        config.setApiBaseUrl("http://127.0.0.1:1/");
        GitHubCodespaceDirectory unreachable = new GitHubCodespaceDirectory(TOKEN, config,
                new OkHttpClient(), new ObjectMapper(), executor, SubsystemLogger.create("gateway/directory"));

        Throwable error = failureOf(unreachable.listCodespaces());

        assertInstanceOf(DirectoryError.class, error);
        assertTrue(error.getMessage().startsWith("GitHub request failed"));
    }
}
