package org.codesync.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.codesync.sync.blob.BlobStore;
import org.codesync.sync.blob.FileSystemBlobStore;
import org.codesync.sync.execution.InMemoryExecutionGateway;
import org.codesync.sync.store.FileSystemMetadataStore;
import org.codesync.sync.store.InMemoryMetadataStore;
import org.codesync.sync.store.MetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;

/**
 * 工作区同步服务的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>对象存储固定在 {@code <storageRoot>/blobs}；文件版元数据在 {@code <storageRoot>/metadata}。</li>
 *   <li>未配置签名密钥时随机生成，只适用于单实例部署。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class WorkspaceSyncConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceSyncConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetadataStore metadataStore(WorkspaceSyncProperties properties, ObjectMapper objectMapper) {
        if (properties.getMetadataStore() == WorkspaceSyncProperties.MetadataStoreType.FILE) {
            return new FileSystemMetadataStore(Path.of(properties.getStorageRoot(), "metadata"), objectMapper);
        }
        return new InMemoryMetadataStore();
    }

    @Bean
    public BlobStore blobStore(WorkspaceSyncProperties properties) {
        return new FileSystemBlobStore(Path.of(properties.getStorageRoot(), "blobs"));
    }

    @Bean
    public UploadCapabilityIssuer uploadCapabilityIssuer(WorkspaceSyncProperties properties, Clock clock) {
        byte[] secret;
        String configured = properties.getCapabilitySecret();
        if (configured == null || configured.isBlank()) {
            secret = new byte[32];
            new SecureRandom().nextBytes(secret);
            log.warn("未配置 app.sync.capability-secret，已随机生成签名密钥（仅适用于单实例部署）");
        } else {
            secret = configured.getBytes(StandardCharsets.UTF_8);
        }
        return new UploadCapabilityIssuer(
                secret,
                properties.getPublicBaseUrl(),
                properties.getCapabilityTtl(),
                properties.getDownloadTtl(),
                clock
        );
    }

    @Bean
    public SyncReservationStore syncReservationStore(MetadataStore metadataStore, WorkspaceSyncProperties properties, Clock clock) {
        return new SyncReservationStore(metadataStore, properties.getReservationTtl(), clock);
    }

    @Bean
    public ServerSyncValidator serverSyncValidator(
            MetadataStore metadataStore,
            SyncReservationStore reservations,
            UploadCapabilityIssuer capabilityIssuer,
            WorkspaceSyncProperties properties
    ) {
        return new ServerSyncValidator(metadataStore, reservations, capabilityIssuer, properties.getMaxFilesPerSync());
    }

    @Bean
    public ServerCommitter serverCommitter(
            MetadataStore metadataStore,
            SyncReservationStore reservations,
            BlobStore blobStore,
            WorkspaceSyncProperties properties,
            Clock clock
    ) {
        return new ServerCommitter(metadataStore, reservations, blobStore, properties.isVerifyUploads(), clock);
    }

    @Bean
    public InMemoryExecutionGateway executionGateway(WorkspaceSyncProperties properties, Clock clock) {
        return new InMemoryExecutionGateway(properties.getExecution().getJobRetention(), clock);
    }

    @Bean
    public WorkspaceService workspaceService(
            MetadataStore metadataStore,
            ServerSyncValidator syncValidator,
            ServerCommitter committer,
            UploadCapabilityIssuer capabilityIssuer,
            InMemoryExecutionGateway executionGateway,
            WorkspaceSyncProperties properties,
            Clock clock
    ) {
        return new WorkspaceService(
                metadataStore,
                syncValidator,
                committer,
                capabilityIssuer,
                executionGateway,
                executionGateway,
                properties.getExecution(),
                clock
        );
    }
}
