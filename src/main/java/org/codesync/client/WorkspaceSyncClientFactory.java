package org.codesync.client;

import org.springframework.web.client.RestClient;

import java.net.URI;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 按服务地址与工作区创建 {@link WorkspaceSyncClient}。
 * 所有客户端共享工厂持有的上传线程池与轮次线程池，关闭工厂时一并关闭。
 */
public class WorkspaceSyncClientFactory implements AutoCloseable {

    private final RestClient.Builder restClientBuilder;
    private final ExecutorService uploadPool;
    private final ExecutorService roundPool;
    private final Clock clock;

    public WorkspaceSyncClientFactory(RestClient.Builder restClientBuilder, int uploadParallelism, Clock clock) {
        this.restClientBuilder = restClientBuilder;
        this.uploadPool = Executors.newFixedThreadPool(uploadParallelism);
        // 轮次线程大部分时间阻塞在网络请求上，按需创建
        this.roundPool = Executors.newCachedThreadPool();
        this.clock = clock;
    }

    public WorkspaceSyncClient create(String baseUrl, String workspaceId) {
        RestClient restClient = restClientBuilder.clone().baseUrl(baseUrl).build();
        WorkspaceSyncApi api = new RestWorkspaceSyncApi(restClient);
        UploadExecutor uploads = new UploadExecutor(new RestBlobUploader(restClient, URI.create(baseUrl)), uploadPool);
        return new WorkspaceSyncClient(workspaceId, api, uploads, new LocalWorkspaceCache(clock), roundPool);
    }

    @Override
    public void close() {
        shutdown(roundPool);
        shutdown(uploadPool);
    }

    private static void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
