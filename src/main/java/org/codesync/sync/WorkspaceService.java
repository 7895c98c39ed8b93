package org.codesync.sync;

import org.codesync.sync.dto.ConfirmSyncRequest;
import org.codesync.sync.dto.ConfirmSyncResponse;
import org.codesync.sync.dto.CreateWorkspaceRequest;
import org.codesync.sync.dto.CreateWorkspaceResult;
import org.codesync.sync.dto.ExecuteRequest;
import org.codesync.sync.dto.ExecuteResult;
import org.codesync.sync.dto.ManifestEntry;
import org.codesync.sync.dto.SyncRequest;
import org.codesync.sync.dto.SyncResponse;
import org.codesync.sync.dto.WorkspaceManifest;
import org.codesync.sync.dto.WorkspaceSummary;
import org.codesync.sync.execution.ExecutionGateway;
import org.codesync.sync.execution.ExecutionJob;
import org.codesync.sync.execution.JobStatus;
import org.codesync.sync.execution.JobStatusChannel;
import org.codesync.sync.store.MetadataStore;
import org.codesync.sync.store.WorkspaceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * 服务端门面：HTTP 控制器与 MCP 工具共用的工作区操作入口。
 * <p>
 * 带 {@code callerId} 的操作会校验调用者是工作区成员；调用者身份本身由外部认证层保证，
 * {@code callerId} 为 null 时不做成员校验（例如进程内调用）。
 */
public class WorkspaceService {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceService.class);

    public static final long INITIAL_VERSION = 1L;

    static final String ROLE_OWNER = "owner";
    static final String ROLE_MEMBER = "member";

    private final MetadataStore metadataStore;
    private final ServerSyncValidator syncValidator;
    private final ServerCommitter committer;
    private final UploadCapabilityIssuer capabilityIssuer;
    private final ExecutionGateway executionGateway;
    private final JobStatusChannel jobStatusChannel;
    private final WorkspaceSyncProperties.Execution executionProperties;
    private final Clock clock;

    public WorkspaceService(
            MetadataStore metadataStore,
            ServerSyncValidator syncValidator,
            ServerCommitter committer,
            UploadCapabilityIssuer capabilityIssuer,
            ExecutionGateway executionGateway,
            JobStatusChannel jobStatusChannel,
            WorkspaceSyncProperties.Execution executionProperties,
            Clock clock
    ) {
        this.metadataStore = metadataStore;
        this.syncValidator = syncValidator;
        this.committer = committer;
        this.capabilityIssuer = capabilityIssuer;
        this.executionGateway = executionGateway;
        this.jobStatusChannel = jobStatusChannel;
        this.executionProperties = executionProperties;
        this.clock = clock;
    }

    public CreateWorkspaceResult create(CreateWorkspaceRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new SyncValidationException("工作区名称不能为空");
        }
        String workspaceId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        WorkspaceRecord record = WorkspaceRecord.create(workspaceId, request.name().trim(), request.createdBy(), now, INITIAL_VERSION);
        metadataStore.create(record);
        log.info("工作区已创建：{}（{}），创建者 {}", workspaceId, record.name(), record.createdBy());
        return new CreateWorkspaceResult(workspaceId, record.name(), record.createdBy(), now, INITIAL_VERSION);
    }

    /**
     * 列出用户是成员的全部工作区。
     */
    public List<WorkspaceSummary> listWorkspaces(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new SyncValidationException("必须指定 userId");
        }
        return metadataStore.findByMember(userId).stream()
                .map(record -> new WorkspaceSummary(record.workspaceId(), record.name(), record.createdBy(), record.createdAt(),
                        userId.equals(record.createdBy()) ? ROLE_OWNER : ROLE_MEMBER))
                .toList();
    }

    public WorkspaceManifest manifest(String workspaceId) {
        return manifest(workspaceId, null);
    }

    /**
     * 拉取已提交清单；每个文件附带一个短时下载地址。
     */
    public WorkspaceManifest manifest(String workspaceId, String callerId) {
        WorkspaceRecord record = requireWorkspace(workspaceId);
        requireMember(record, callerId);
        List<ManifestEntry> entries = record.manifest().stream()
                .map(entry -> entry.isFile()
                        ? entry.withDownloadUrl(capabilityIssuer.issueDownload(entry.storageKey()).url())
                        : entry)
                .toList();
        return new WorkspaceManifest(entries, record.version());
    }

    public SyncResponse sync(String workspaceId, SyncRequest request) {
        return sync(workspaceId, null, request);
    }

    public SyncResponse sync(String workspaceId, String callerId, SyncRequest request) {
        requireMember(requireWorkspace(workspaceId), callerId);
        return syncValidator.sync(workspaceId, request);
    }

    public ConfirmSyncResponse confirm(String workspaceId, ConfirmSyncRequest request) {
        return confirm(workspaceId, null, request);
    }

    public ConfirmSyncResponse confirm(String workspaceId, String callerId, ConfirmSyncRequest request) {
        requireMember(requireWorkspace(workspaceId), callerId);
        return committer.confirm(workspaceId, request);
    }

    public ExecuteResult execute(String workspaceId, ExecuteRequest request) {
        return execute(workspaceId, null, request);
    }

    /**
     * 针对当前已提交版本触发执行；入口必须是清单中的文件，语言必须在白名单内。
     */
    public ExecuteResult execute(String workspaceId, String callerId, ExecuteRequest request) {
        if (request == null || request.entrypointFile() == null) {
            throw new SyncValidationException("必须指定 entrypointFile");
        }
        String entrypoint = WorkspacePaths.requireValid(request.entrypointFile());
        String language = request.language() == null || request.language().isBlank()
                ? executionProperties.getDefaultLanguage()
                : request.language().trim().toLowerCase(Locale.ROOT);
        if (!executionProperties.getLanguages().contains(language)) {
            throw new SyncValidationException("不支持的语言：" + language + "（支持 " + executionProperties.getLanguages() + "）");
        }

        WorkspaceRecord record = requireWorkspace(workspaceId);
        requireMember(record, callerId);
        ManifestEntry entry = record.entries().get(entrypoint);
        if (entry == null || !entry.isFile()) {
            throw new SyncValidationException("入口文件不在已提交的工作区中：" + entrypoint);
        }
        String jobId = executionGateway.submit(new ExecutionJob(workspaceId, record.version(), entrypoint, request.input(), language));
        return new ExecuteResult(jobId, workspaceId, record.version());
    }

    public JobStatus jobStatus(String jobId) {
        return jobStatusChannel.poll(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private static void requireMember(WorkspaceRecord record, String callerId) {
        if (callerId != null && !record.isMember(callerId)) {
            log.info("拒绝非成员访问：workspace={}，user={}", record.workspaceId(), callerId);
            throw new WorkspaceAccessDeniedException(record.workspaceId(), callerId);
        }
    }

    private WorkspaceRecord requireWorkspace(String workspaceId) {
        return metadataStore.find(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException(workspaceId));
    }
}
