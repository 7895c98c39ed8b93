package org.codesync.web;

import org.codesync.sync.WorkspaceService;
import org.codesync.sync.dto.ConfirmStatus;
import org.codesync.sync.dto.ConfirmSyncRequest;
import org.codesync.sync.dto.ConfirmSyncResponse;
import org.codesync.sync.dto.CreateWorkspaceRequest;
import org.codesync.sync.dto.CreateWorkspaceResult;
import org.codesync.sync.dto.ExecuteRequest;
import org.codesync.sync.dto.ExecuteResult;
import org.codesync.sync.dto.SyncResponse;
import org.codesync.sync.dto.SyncStatus;
import org.codesync.sync.dto.SyncRequest;
import org.codesync.sync.dto.WorkspaceManifest;
import org.codesync.sync.dto.WorkspaceSummary;
import org.codesync.sync.execution.JobStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 工作区同步的 HTTP 接口。
 * <ul>
 *   <li>sync：200（ok/no_changes），409（workspace_conflict）。</li>
 *   <li>confirm：200（success），409（conflict）。</li>
 *   <li>其余错误由 {@link SyncExceptionHandler} 映射。</li>
 * </ul>
 * 认证层通过 {@value #CALLER_HEADER} 头传入调用者；携带该头时只有工作区成员可以访问。
 */
@RestController
@RequestMapping("/api")
public class WorkspaceSyncController {

    public static final String CALLER_HEADER = "X-User-Id";

    private final WorkspaceService workspaceService;

    public WorkspaceSyncController(WorkspaceService workspaceService) {
        this.workspaceService = workspaceService;
    }

    @PostMapping("/workspaces")
    public ResponseEntity<CreateWorkspaceResult> create(@RequestBody CreateWorkspaceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workspaceService.create(request));
    }

    @GetMapping("/workspaces")
    public List<WorkspaceSummary> list(@RequestParam("userId") String userId) {
        return workspaceService.listWorkspaces(userId);
    }

    @GetMapping("/workspaces/{workspaceId}/manifest")
    public WorkspaceManifest manifest(
            @PathVariable String workspaceId,
            @RequestHeader(value = CALLER_HEADER, required = false) String callerId
    ) {
        return workspaceService.manifest(workspaceId, callerId);
    }

    @PostMapping("/workspaces/{workspaceId}/sync")
    public ResponseEntity<SyncResponse> sync(
            @PathVariable String workspaceId,
            @RequestHeader(value = CALLER_HEADER, required = false) String callerId,
            @RequestBody SyncRequest request
    ) {
        SyncResponse response = workspaceService.sync(workspaceId, callerId, request);
        HttpStatus status = response.status() == SyncStatus.WORKSPACE_CONFLICT ? HttpStatus.CONFLICT : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @PostMapping("/workspaces/{workspaceId}/sync/confirm")
    public ResponseEntity<ConfirmSyncResponse> confirm(
            @PathVariable String workspaceId,
            @RequestHeader(value = CALLER_HEADER, required = false) String callerId,
            @RequestBody ConfirmSyncRequest request
    ) {
        ConfirmSyncResponse response = workspaceService.confirm(workspaceId, callerId, request);
        HttpStatus status = response.status() == ConfirmStatus.CONFLICT ? HttpStatus.CONFLICT : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @PostMapping("/workspaces/{workspaceId}/execute")
    public ResponseEntity<ExecuteResult> execute(
            @PathVariable String workspaceId,
            @RequestHeader(value = CALLER_HEADER, required = false) String callerId,
            @RequestBody ExecuteRequest request
    ) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(workspaceService.execute(workspaceId, callerId, request));
    }

    @GetMapping("/jobs/{jobId}")
    public JobStatus job(@PathVariable String jobId) {
        return workspaceService.jobStatus(jobId);
    }
}
