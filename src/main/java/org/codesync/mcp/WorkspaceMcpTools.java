package org.codesync.mcp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.codesync.sync.WorkspaceService;
import org.codesync.sync.dto.ConfirmSyncRequest;
import org.codesync.sync.dto.ConfirmSyncResponse;
import org.codesync.sync.dto.CreateWorkspaceRequest;
import org.codesync.sync.dto.CreateWorkspaceResult;
import org.codesync.sync.dto.ExecuteRequest;
import org.codesync.sync.dto.ExecuteResult;
import org.codesync.sync.dto.FileAction;
import org.codesync.sync.dto.SyncFileClientState;
import org.codesync.sync.dto.SyncRequest;
import org.codesync.sync.dto.SyncResponse;
import org.codesync.sync.dto.WorkspaceManifest;
import org.codesync.sync.dto.WorkspaceSummary;
import org.codesync.sync.execution.JobStatus;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 工作区同步 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>创建、列出工作区（{@code ws_create_workspace}、{@code ws_list_workspaces}）与拉取清单（{@code ws_get_manifest}）。</li>
 *   <li>两阶段同步（{@code ws_sync} -> 上传 -> {@code ws_confirm_sync}）。</li>
 *   <li>触发执行（{@code ws_execute}）与查询任务状态（{@code ws_job_status}）。</li>
 * </ul>
 * <p>
 * 复杂参数（变更列表、最终动作列表）以 JSON 文本传入。
 */
@Component
public class WorkspaceMcpTools {

    /**
     * 入参解析用的 JSON 解析器（只做反序列化，默认配置即可）。
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final WorkspaceService workspaceService;

    public WorkspaceMcpTools(WorkspaceService workspaceService) {
        this.workspaceService = workspaceService;
    }

    @Tool(
            name = "ws_create_workspace",
            description = "创建一个空的协作工作区，返回 workspaceId 与初始版本。"
    )
    public CreateWorkspaceResult createWorkspace(
            @ToolParam(description = "工作区名称") String name,
            @ToolParam(required = false, description = "创建者用户标识") String createdBy
    ) {
        return workspaceService.create(new CreateWorkspaceRequest(name, createdBy));
    }

    @Tool(
            name = "ws_list_workspaces",
            description = "列出用户是成员的全部工作区（含用户角色 owner/member）。"
    )
    public List<WorkspaceSummary> listWorkspaces(
            @ToolParam(description = "用户标识") String userId
    ) {
        return workspaceService.listWorkspaces(userId);
    }

    @Tool(
            name = "ws_get_manifest",
            description = "拉取工作区已提交的清单（每个文件附带短时下载地址）与当前版本号。"
    )
    public WorkspaceManifest getManifest(
            @ToolParam(description = "工作区标识") String workspaceId
    ) {
        return workspaceService.manifest(workspaceId);
    }

    @Tool(
            name = "ws_sync",
            description = "同步第一阶段：提交本地版本号与变更列表，返回每个路径的处理要求（upload/delete/none）、上传凭证与预留版本。"
                    + "版本不一致时返回 workspace_conflict。"
    )
    /**
     * 第一阶段：只做校验与分配，不修改工作区。
     * <p>
     * files 示例：{@code [{"filePath":"/main.py","kind":"file","action":"modified","clientHash":"..."}]}
     */
    public SyncResponse sync(
            @ToolParam(description = "工作区标识") String workspaceId,
            @ToolParam(description = "客户端所基于的工作区版本") long workspaceVersion,
            @ToolParam(description = "变更列表（JSON 数组，元素包含 filePath/kind/action/clientHash）") String files
    ) {
        List<SyncFileClientState> changes = parse(files, "files", new TypeReference<List<SyncFileClientState>>() {
        });
        return workspaceService.sync(workspaceId, new SyncRequest(workspaceVersion, changes));
    }

    @Tool(
            name = "ws_confirm_sync",
            description = "同步第二阶段：所有上传完成后提交最终动作（upsert/delete），成功时工作区版本 +1；"
                    + "预留未知/已提交/已过期/被抢先时返回 conflict。"
    )
    /**
     * 第二阶段：一次条件写入完成提交。
     * <p>
     * syncActions 示例：{@code [{"filePath":"/main.py","fileId":"...","storageKey":"...","action":"upsert","kind":"file","clientHash":"...","size":12}]}
     */
    public ConfirmSyncResponse confirmSync(
            @ToolParam(description = "工作区标识") String workspaceId,
            @ToolParam(description = "ws_sync 返回的 provisionalVersion") long provisionalVersion,
            @ToolParam(required = false, description = "ws_sync 返回的 reservationId") String reservationId,
            @ToolParam(description = "最终动作列表（JSON 数组）") String syncActions
    ) {
        List<FileAction> actions = parse(syncActions, "syncActions", new TypeReference<List<FileAction>>() {
        });
        return workspaceService.confirm(workspaceId, new ConfirmSyncRequest(provisionalVersion, reservationId, actions));
    }

    @Tool(
            name = "ws_execute",
            description = "针对已提交的工作区版本运行入口文件，返回 jobId；状态通过 ws_job_status 查询。"
    )
    public ExecuteResult execute(
            @ToolParam(description = "工作区标识") String workspaceId,
            @ToolParam(description = "入口文件路径（例如 /main.py）") String entrypointFile,
            @ToolParam(required = false, description = "标准输入") String input,
            @ToolParam(required = false, description = "语言（默认 python）") String language
    ) {
        return workspaceService.execute(workspaceId, new ExecuteRequest(entrypointFile, input, language));
    }

    @Tool(
            name = "ws_job_status",
            description = "查询执行任务状态（queued/running/succeeded/failed）。"
    )
    public JobStatus jobStatus(
            @ToolParam(description = "ws_execute 返回的 jobId") String jobId
    ) {
        return workspaceService.jobStatus(jobId);
    }

    private static <T> List<T> parse(String json, String name, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<T> parsed = OBJECT_MAPPER.readValue(json, type);
            return parsed == null ? List.of() : parsed;
        } catch (Exception e) {
            throw new IllegalArgumentException(name + " 不是合法的 JSON 数组：" + e.getMessage(), e);
        }
    }
}
