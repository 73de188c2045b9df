package com.tcode.gateway.directory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tcode.common.config.TcodeConfig;
import com.tcode.common.logging.LogRedact;
import com.tcode.common.logging.SubsystemLogger;
import com.tcode.tunnel.transport.TunnelProperties;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * {@link CodespaceDirectory} backed by the GitHub REST API.
 * <p>
 * The token is not validated up front; a bad token surfaces as
 * {@code "Bad credentials"} on the first call.
 */
public class GitHubCodespaceDirectory implements CodespaceDirectory {

    private static final String ACCEPT = "application/vnd.github+json";
    private static final MediaType JSON = MediaType.get("application/json");
    private static final TypeReference<List<Codespace>> CODESPACE_LIST = new TypeReference<>() {
    };

    private final String accessToken;
    private final HttpUrl apiBase;
    private final String userAgent;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final SubsystemLogger log;

    public GitHubCodespaceDirectory(String accessToken, TcodeConfig.GitHubConfig config,
            OkHttpClient httpClient, ObjectMapper objectMapper, Executor executor, SubsystemLogger log) {
        this.accessToken = accessToken;
        this.apiBase = HttpUrl.get(config.getApiBaseUrl());
        this.userAgent = config.getUserAgent();
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.log = log;
        log.debug("Directory client created", Map.of("token", LogRedact.maskToken(accessToken)));
    }

    @Override
    public CompletableFuture<List<Codespace>> listCodespaces() {
        return CompletableFuture.supplyAsync(() -> {
            JsonNode root = call(get(url("user", "codespaces").build()));
            JsonNode list = root.path("codespaces");
            if (!list.isArray()) {
                return List.<Codespace>of();
            }
            List<Codespace> codespaces = objectMapper.convertValue(list, CODESPACE_LIST);
            log.debug("Codespaces listed", Map.of("count", codespaces.size()));
            return codespaces;
        }, executor);
    }

    @Override
    public CompletableFuture<CodespaceConnectionInfo> getConnectionInfo(String codespaceName) {
        return CompletableFuture.supplyAsync(() -> {
            HttpUrl url = url("user", "codespaces", codespaceName)
                    .addQueryParameter("internal", "true")
                    .addQueryParameter("refresh", "true")
                    .build();
            JsonNode root = call(get(url));
            Codespace codespace = objectMapper.convertValue(root, Codespace.class);

            String state = codespace.getState();
            if (state != null && !"Available".equals(state)) {
                throw DirectoryError.notAvailable(state);
            }
            JsonNode props = root.path("connection").path("tunnelProperties");
            if (props.isMissingNode() || props.isNull()) {
                throw new DirectoryError("Tunnel properties not found in response. Codespace may not be ready.", 0);
            }
            TunnelProperties tunnel = objectMapper.convertValue(props, TunnelProperties.class);
            log.info("Resolved tunnel properties", Map.of("codespace", codespaceName, "tunnel", tunnel.toString()));
            return new CodespaceConnectionInfo(codespace, tunnel);
        }, executor);
    }

    @Override
    public CompletableFuture<Codespace> startCodespace(String codespaceName) {
        return changeState(codespaceName, "start");
    }

    @Override
    public CompletableFuture<Codespace> stopCodespace(String codespaceName) {
        return changeState(codespaceName, "stop");
    }

    private CompletableFuture<Codespace> changeState(String codespaceName, String action) {
        return CompletableFuture.supplyAsync(() -> {
            Request request = authorized(url("user", "codespaces", codespaceName, action).build())
                    .post(RequestBody.create(new byte[0], JSON))
                    .build();
            Codespace codespace = objectMapper.convertValue(call(request), Codespace.class);
            log.info("Codespace " + action + " requested",
                    Map.of("codespace", codespaceName, "state", String.valueOf(codespace.getState())));
            return codespace;
        }, executor);
    }

    // =========================================================================
    // HTTP helpers
    // =========================================================================

    private HttpUrl.Builder url(String... segments) {
        HttpUrl.Builder builder = apiBase.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder;
    }

    private Request.Builder authorized(HttpUrl url) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + accessToken)
                .header("Accept", ACCEPT)
                .header("User-Agent", userAgent);
    }

    private Request get(HttpUrl url) {
        return authorized(url).get().build();
    }

    private JsonNode call(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            log.debug("GitHub response", Map.of("path", request.url().encodedPath(), "status", response.code()));

            if (response.code() == 401) {
                throw new DirectoryError("Bad credentials", 401);
            }
            if (response.code() == 404) {
                throw new DirectoryError("Codespace not found", 404);
            }
            if (!response.isSuccessful()) {
                throw new DirectoryError("GitHub API Error: " + response.code() + " "
                        + LogRedact.redactSensitiveText(text), response.code());
            }
            if (text.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(text);
        } catch (IOException e) {
            log.error("GitHub request failed: " + request.url().encodedPath(), e);
            throw new CompletionException(new DirectoryError("GitHub request failed: " + e.getMessage(), e));
        }
    }
}
