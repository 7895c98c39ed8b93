package org.codesync.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.codesync.sync.SyncValidationException;
import org.codesync.sync.WorkspaceNotFoundException;
import org.codesync.sync.WorkspaceSyncException;
import org.codesync.sync.dto.ConfirmSyncRequest;
import org.codesync.sync.dto.ConfirmSyncResponse;
import org.codesync.sync.dto.ExecuteRequest;
import org.codesync.sync.dto.ExecuteResult;
import org.codesync.sync.dto.SyncRequest;
import org.codesync.sync.dto.SyncResponse;
import org.codesync.sync.dto.WorkspaceManifest;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;

/**
 * 基于 Spring {@link RestClient} 的 HTTP 实现。409 的响应体按正常结果解析。
 */
public class RestWorkspaceSyncApi implements WorkspaceSyncApi {

    private final RestClient restClient;

    public RestWorkspaceSyncApi(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public WorkspaceManifest manifest(String workspaceId) {
        return call(workspaceId, () -> restClient.get()
                .uri("/api/workspaces/{id}/manifest", workspaceId)
                .accept(MediaType.APPLICATION_JSON)
                .exchange((request, response) -> {
                    if (response.getStatusCode().is2xxSuccessful()) {
                        return response.bodyTo(WorkspaceManifest.class);
                    }
                    throw failure(workspaceId, response.getStatusCode(), response.bodyTo(JsonNode.class));
                }));
    }

    @Override
    public SyncResponse sync(String workspaceId, SyncRequest body) {
        return call(workspaceId, () -> restClient.post()
                .uri("/api/workspaces/{id}/sync", workspaceId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .exchange((request, response) -> {
                    if (response.getStatusCode().is2xxSuccessful() || isConflictBody(response.getStatusCode())) {
                        return response.bodyTo(SyncResponse.class);
                    }
                    throw failure(workspaceId, response.getStatusCode(), response.bodyTo(JsonNode.class));
                }));
    }

    @Override
    public ConfirmSyncResponse confirm(String workspaceId, ConfirmSyncRequest body) {
        return call(workspaceId, () -> restClient.post()
                .uri("/api/workspaces/{id}/sync/confirm", workspaceId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .exchange((request, response) -> {
                    if (response.getStatusCode().is2xxSuccessful() || isConflictBody(response.getStatusCode())) {
                        return response.bodyTo(ConfirmSyncResponse.class);
                    }
                    throw failure(workspaceId, response.getStatusCode(), response.bodyTo(JsonNode.class));
                }));
    }

    @Override
    public ExecuteResult execute(String workspaceId, ExecuteRequest body) {
        return call(workspaceId, () -> restClient.post()
                .uri("/api/workspaces/{id}/execute", workspaceId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .exchange((request, response) -> {
                    if (response.getStatusCode().is2xxSuccessful()) {
                        return response.bodyTo(ExecuteResult.class);
                    }
                    throw failure(workspaceId, response.getStatusCode(), response.bodyTo(JsonNode.class));
                }));
    }

    private static boolean isConflictBody(HttpStatusCode status) {
        return status.value() == HttpStatus.CONFLICT.value();
    }

    private static WorkspaceSyncException failure(String workspaceId, HttpStatusCode status, JsonNode body) {
        String message = body != null && body.hasNonNull("errorMessage")
                ? body.get("errorMessage").asText()
                : "HTTP " + status.value();
        if (status.value() == HttpStatus.BAD_REQUEST.value()) {
            return new SyncValidationException(message);
        }
        if (status.value() == HttpStatus.NOT_FOUND.value()) {
            return new WorkspaceNotFoundException(workspaceId);
        }
        return new WorkspaceSyncException("服务端返回 " + status.value() + "：" + message);
    }

    private static <T> T call(String workspaceId, RemoteCall<T> call) {
        try {
            return call.run();
        } catch (RestClientException e) {
            throw new WorkspaceSyncException("调用同步服务失败（workspace=" + workspaceId + "）：" + e.getMessage(), e);
        } catch (IOException e) {
            throw new WorkspaceSyncException("读取同步服务响应失败（workspace=" + workspaceId + "）", e);
        }
    }

    @FunctionalInterface
    private interface RemoteCall<T> {
        T run() throws IOException;
    }
}
