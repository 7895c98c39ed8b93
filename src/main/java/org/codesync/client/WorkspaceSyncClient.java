package org.codesync.client;

import org.codesync.sync.ConfirmRaceLostException;
import org.codesync.sync.UploadFailureException;
import org.codesync.sync.VersionConflictException;
import org.codesync.sync.dto.ExecuteRequest;
import org.codesync.sync.dto.ExecuteResult;
import org.codesync.sync.dto.SyncAction;
import org.codesync.sync.dto.SyncFileClientState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 客户端同步状态机：差异 -> sync -> 上传 -> confirm -> 执行。
 * <p>
 * 状态流转：
 * <ul>
 *   <li>{@code IDLE -> DIFFING -> EXECUTE}（没有变更）或 {@code -> SYNCING}。</li>
 *   <li>{@code SYNCING -> ABORTED}（冲突/错误）、{@code -> EXECUTE}（no_changes）或 {@code -> UPLOADING}。</li>
 *   <li>{@code UPLOADING -> ABORTED}（任一失败，不发送 confirm）或 {@code -> CONFIRMING}。</li>
 *   <li>{@code CONFIRMING -> EXECUTE} 或 {@code -> ABORTED}。</li>
 * </ul>
 * 所有失败都在轮次边界处理：不重试单个步骤，下一轮会先重新拉取清单再计算差异。
 * 同一个客户端实例一次只运行一轮。
 * <p>
 * {@link #cancel()} 放弃正在进行的一轮（例如用户离开页面）：取消未完成的上传，轮次以 ABORTED 结束，
 * 不会发送 confirm。confirm 已发出后取消不再生效。
 */
public class WorkspaceSyncClient {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceSyncClient.class);

    public static final String MESSAGE_STALE_VIEW = "工作区视图已过期，正在重新加载";
    public static final String MESSAGE_NOT_SAVED = "更改未保存，请重试";
    public static final String MESSAGE_FAILED = "同步失败，请重试";
    public static final String MESSAGE_CANCELLED = "同步已取消，更改未保存";

    private final String workspaceId;
    private final WorkspaceSyncApi api;
    private final ManifestDiffer differ;
    private final SyncCoordinator syncCoordinator;
    private final UploadExecutor uploadExecutor;
    private final ConfirmCoordinator confirmCoordinator;
    private final LocalWorkspaceCache cache;
    private final Executor roundExecutor;

    private volatile RoundState state = RoundState.IDLE;
    private volatile boolean cancelRequested;
    private volatile UploadExecutor.UploadBatch activeUploads;
    private boolean reloadRequired = true;

    public WorkspaceSyncClient(
            String workspaceId,
            WorkspaceSyncApi api,
            UploadExecutor uploadExecutor,
            LocalWorkspaceCache cache,
            Executor roundExecutor
    ) {
        this.workspaceId = workspaceId;
        this.api = api;
        this.differ = new ManifestDiffer();
        this.syncCoordinator = new SyncCoordinator(api);
        this.uploadExecutor = uploadExecutor;
        this.confirmCoordinator = new ConfirmCoordinator(api);
        this.cache = cache;
        this.roundExecutor = roundExecutor;
    }

    public String workspaceId() {
        return workspaceId;
    }

    public RoundState state() {
        return state;
    }

    public LocalWorkspaceCache cache() {
        return cache;
    }

    /**
     * 在轮次线程池上运行一轮；取消返回的 future 等同于调用 {@link #cancel()}。
     */
    public CompletableFuture<RoundResult> runRoundAsync(Collection<ClientFileState> files, ExecuteRequest execute) {
        CompletableFuture<RoundResult> result = new CompletableFuture<>() {
            @Override
            public boolean cancel(boolean mayInterruptIfRunning) {
                WorkspaceSyncClient.this.cancel();
                return super.cancel(mayInterruptIfRunning);
            }
        };
        roundExecutor.execute(() -> {
            if (result.isDone()) {
                return;
            }
            try {
                result.complete(runRound(files, execute));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * 放弃正在进行的一轮。
     *
     * @return 当前有轮次在进行并已发出取消信号时返回 true
     */
    public boolean cancel() {
        if (state == RoundState.IDLE) {
            return false;
        }
        cancelRequested = true;
        UploadExecutor.UploadBatch uploads = activeUploads;
        if (uploads != null) {
            uploads.cancel();
        }
        log.info("已请求取消同步轮次：workspace={}，当前状态 {}", workspaceId, state);
        return true;
    }

    /**
     * 运行一轮同步。
     *
     * @param files   编辑器中的当前条目
     * @param execute 成功后要触发的执行（为 null 时只同步）
     */
    public synchronized RoundResult runRound(Collection<ClientFileState> files, ExecuteRequest execute) {
        List<RoundState> transitions = new ArrayList<>();
        cancelRequested = false;
        try {
            moveTo(RoundState.DIFFING, transitions);
            if (reloadRequired || !cache.isLoaded()) {
                cache.reload(api.manifest(workspaceId));
                reloadRequired = false;
            }
            WorkspaceSnapshot snapshot = cache.snapshot().orElseThrow();
            Set<SyncFileClientState> changes = differ.diff(files, snapshot.entries().values());

            if (!changes.isEmpty()) {
                moveTo(RoundState.SYNCING, transitions);
                SyncPlan plan = syncCoordinator.prepare(workspaceId, snapshot.version(), changes);
                if (plan.hasEffectiveActions()) {
                    throwIfCancelled();
                    moveTo(RoundState.UPLOADING, transitions);
                    List<UploadReceipt> receipts = upload(uploadTasks(plan, files));

                    throwIfCancelled();
                    moveTo(RoundState.CONFIRMING, transitions);
                    ConfirmedSync confirmed = confirmCoordinator.confirm(workspaceId, plan, receipts);
                    cache.applyCommitted(confirmed);
                    log.info("同步成功：workspace={}，版本 {} -> {}", workspaceId, snapshot.version(), confirmed.version());
                }
            }

            moveTo(RoundState.EXECUTE, transitions);
            long version = cache.snapshot().orElseThrow().version();
            String jobId = null;
            if (execute != null) {
                ExecuteResult result = api.execute(workspaceId, execute);
                jobId = result.jobId();
            }
            state = RoundState.IDLE;
            return new RoundResult(RoundState.EXECUTE, transitions, version, jobId, null, null);
        } catch (RoundCancelledException e) {
            return abort(transitions, MESSAGE_CANCELLED, e);
        } catch (VersionConflictException | ConfirmRaceLostException e) {
            return abort(transitions, MESSAGE_STALE_VIEW, e);
        } catch (UploadFailureException e) {
            return abort(transitions, cancelRequested ? MESSAGE_CANCELLED : MESSAGE_NOT_SAVED, e);
        } catch (RuntimeException e) {
            return abort(transitions, MESSAGE_FAILED, e);
        }
    }

    private List<UploadReceipt> upload(List<UploadTask> tasks) {
        UploadExecutor.UploadBatch batch = uploadExecutor.submit(tasks);
        activeUploads = batch;
        try {
            if (cancelRequested) {
                batch.cancel();
            }
            return batch.await();
        } finally {
            activeUploads = null;
        }
    }

    private void throwIfCancelled() {
        if (cancelRequested) {
            throw new RoundCancelledException(workspaceId);
        }
    }

    private RoundResult abort(List<RoundState> transitions, String userMessage, RuntimeException error) {
        moveTo(RoundState.ABORTED, transitions);
        log.warn("同步轮次中止：workspace={}，{}", workspaceId, error.getMessage());
        reloadRequired = true;
        state = RoundState.IDLE;
        Long version = cache.snapshot().map(WorkspaceSnapshot::version).orElse(null);
        return new RoundResult(RoundState.ABORTED, transitions, version, null, userMessage, error);
    }

    private void moveTo(RoundState next, List<RoundState> transitions) {
        state = next;
        transitions.add(next);
    }

    private static List<UploadTask> uploadTasks(SyncPlan plan, Collection<ClientFileState> files) {
        Map<String, ClientFileState> byPath = new HashMap<>();
        for (ClientFileState file : files) {
            byPath.put(file.filePath(), file);
        }
        List<UploadTask> tasks = new ArrayList<>();
        for (SyncAction action : plan.transfers()) {
            ClientFileState file = byPath.get(action.filePath());
            if (file == null || file.content() == null) {
                throw new IllegalStateException("服务端要求上传本地不存在的文件：" + action.filePath());
            }
            tasks.add(new UploadTask(action, file.content()));
        }
        return tasks;
    }
}
