package org.codesync.client;

import org.codesync.sync.HashingUtils;
import org.codesync.sync.UploadFailureException;
import org.codesync.sync.dto.SyncAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 并行上传：只做字节传输，不含协议逻辑。
 * <p>
 * 全部成功才算上传完成；任意一个失败会取消其余传输并抛出 {@link UploadFailureException}，
 * 此时不能发送 confirm。
 */
public class UploadExecutor {

    private static final Logger log = LoggerFactory.getLogger(UploadExecutor.class);

    private final BlobUploader uploader;
    private final ExecutorService executor;

    public UploadExecutor(BlobUploader uploader, ExecutorService executor) {
        this.uploader = uploader;
        this.executor = executor;
    }

    public List<UploadReceipt> uploadAll(List<UploadTask> tasks) {
        return submit(tasks).await();
    }

    public UploadBatch submit(List<UploadTask> tasks) {
        CompletionService<UploadReceipt> completion = new ExecutorCompletionService<>(executor);
        List<Future<UploadReceipt>> futures = new ArrayList<>(tasks.size());
        for (UploadTask task : tasks) {
            futures.add(completion.submit(() -> transfer(task)));
        }
        return new UploadBatch(completion, futures);
    }

    private UploadReceipt transfer(UploadTask task) {
        SyncAction action = task.action();
        if (!action.requiresTransfer()) {
            throw new IllegalArgumentException("不是文件上传动作：" + action.filePath());
        }
        try {
            uploader.put(action.filePath(), action.uploadCapability(), task.content());
        } catch (UploadFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UploadFailureException(action.filePath(), false, "上传失败：" + action.filePath(), e);
        }
        log.debug("已上传 {}（{} 字节）", action.filePath(), task.content().length);
        return new UploadReceipt(action.filePath(), action.storageKey(), HashingUtils.sha256Hex(task.content()), task.content().length);
    }

    /**
     * 一批正在进行的上传。
     */
    public static final class UploadBatch {

        private final CompletionService<UploadReceipt> completion;
        private final List<Future<UploadReceipt>> futures;

        private UploadBatch(CompletionService<UploadReceipt> completion, List<Future<UploadReceipt>> futures) {
            this.completion = completion;
            this.futures = futures;
        }

        /**
         * 等待全部完成；第一个失败会取消其余传输。
         *
         * @return 按路径排序的回执
         */
        public List<UploadReceipt> await() {
            List<UploadReceipt> receipts = new ArrayList<>(futures.size());
            try {
                for (int i = 0; i < futures.size(); i++) {
                    receipts.add(completion.take().get());
                }
            } catch (ExecutionException e) {
                cancel();
                Throwable cause = e.getCause();
                if (cause instanceof UploadFailureException failure) {
                    throw failure;
                }
                throw new UploadFailureException(null, false, "上传失败：" + cause.getMessage(), cause);
            } catch (CancellationException e) {
                cancel();
                throw new UploadFailureException(null, false, "上传已取消", e);
            } catch (InterruptedException e) {
                cancel();
                Thread.currentThread().interrupt();
                throw new UploadFailureException(null, false, "上传被中断", e);
            }
            receipts.sort(Comparator.comparing(UploadReceipt::filePath));
            return receipts;
        }

        public void cancel() {
            for (Future<UploadReceipt> future : futures) {
                future.cancel(true);
            }
        }

        public boolean isDone() {
            return futures.stream().allMatch(Future::isDone);
        }
    }
}
