package org.codesync.sync;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * 工作区同步服务的业务配置（{@code app.sync.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>{@link #storageRoot}：对象存储与（可选的）元数据文件的根目录。</li>
 *   <li>{@link #capabilityTtl}/{@link #reservationTtl}：上传凭证与版本预留的有效期，过期后客户端必须重新发起整轮同步。</li>
 *   <li>{@link #capabilitySecret}：凭证签名密钥；多实例部署时必须显式配置为相同的值。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.sync")
public class WorkspaceSyncProperties {

    /**
     * 数据根目录：对象存储位于 {@code <root>/blobs}，文件版元数据位于 {@code <root>/metadata}。
     */
    @NotBlank
    private String storageRoot = "./data";

    /**
     * 元数据存储实现：memory（单进程）或 file（多实例共享同一目录时使用）。
     */
    @NotNull
    private MetadataStoreType metadataStore = MetadataStoreType.MEMORY;

    /**
     * 上传凭证（签名 URL）的有效期。
     */
    @NotNull
    private Duration capabilityTtl = Duration.ofMinutes(15);

    /**
     * 清单拉取时附带的下载凭证有效期。
     */
    @NotNull
    private Duration downloadTtl = Duration.ofMinutes(15);

    /**
     * sync 阶段版本预留的有效期；超过则 confirm 返回 reservation_expired。
     * <p>
     * 建议不小于 {@link #capabilityTtl}，否则上传尚可进行时预留已经失效。
     */
    @NotNull
    private Duration reservationTtl = Duration.ofMinutes(20);

    /**
     * 凭证签名密钥（HMAC-SHA256）。为空时每次启动随机生成，仅适用于单实例。
     */
    private String capabilitySecret;

    /**
     * 生成凭证 URL 时使用的对外地址；为空时签发相对地址（{@code /blobs?...}）。
     */
    private String publicBaseUrl = "http://localhost:8080";

    /**
     * 单个对象允许上传的最大字节数。
     */
    @NotNull
    private DataSize uploadMaxBytes = DataSize.ofMegabytes(10);

    /**
     * 单次 sync 请求允许携带的最大文件数（上限保护）。
     */
    @Min(1)
    @Max(100_000)
    private int maxFilesPerSync = 1_000;

    /**
     * confirm 阶段是否校验对象存储中的实际内容（大小 + sha256）与客户端声明一致。
     */
    private boolean verifyUploads = true;

    @Valid
    @NotNull
    private Execution execution = new Execution();

    @Valid
    @NotNull
    private Client client = new Client();

    public String getStorageRoot() {
        return storageRoot;
    }

    public void setStorageRoot(String storageRoot) {
        this.storageRoot = storageRoot;
    }

    public MetadataStoreType getMetadataStore() {
        return metadataStore;
    }

    public void setMetadataStore(MetadataStoreType metadataStore) {
        this.metadataStore = metadataStore;
    }

    public Duration getCapabilityTtl() {
        return capabilityTtl;
    }

    public void setCapabilityTtl(Duration capabilityTtl) {
        this.capabilityTtl = capabilityTtl;
    }

    public Duration getDownloadTtl() {
        return downloadTtl;
    }

    public void setDownloadTtl(Duration downloadTtl) {
        this.downloadTtl = downloadTtl;
    }

    public Duration getReservationTtl() {
        return reservationTtl;
    }

    public void setReservationTtl(Duration reservationTtl) {
        this.reservationTtl = reservationTtl;
    }

    public String getCapabilitySecret() {
        return capabilitySecret;
    }

    public void setCapabilitySecret(String capabilitySecret) {
        this.capabilitySecret = capabilitySecret;
    }

    public String getPublicBaseUrl() {
        return publicBaseUrl;
    }

    public void setPublicBaseUrl(String publicBaseUrl) {
        this.publicBaseUrl = publicBaseUrl;
    }

    public DataSize getUploadMaxBytes() {
        return uploadMaxBytes;
    }

    public void setUploadMaxBytes(DataSize uploadMaxBytes) {
        this.uploadMaxBytes = uploadMaxBytes;
    }

    public int getMaxFilesPerSync() {
        return maxFilesPerSync;
    }

    public void setMaxFilesPerSync(int maxFilesPerSync) {
        this.maxFilesPerSync = maxFilesPerSync;
    }

    public boolean isVerifyUploads() {
        return verifyUploads;
    }

    public void setVerifyUploads(boolean verifyUploads) {
        this.verifyUploads = verifyUploads;
    }

    public Execution getExecution() {
        return execution;
    }

    public void setExecution(Execution execution) {
        this.execution = execution;
    }

    public Client getClient() {
        return client;
    }

    public void setClient(Client client) {
        this.client = client;
    }

    public enum MetadataStoreType {
        MEMORY,
        FILE
    }

    /**
     * 执行触发相关配置（{@code app.sync.execution.*}）。
     */
    public static class Execution {

        /**
         * 允许执行的语言白名单。
         */
        @NotEmpty
        private List<String> languages = List.of("python");

        /**
         * 请求未指定语言时使用的默认值。
         */
        @NotBlank
        private String defaultLanguage = "python";

        /**
         * 任务进入终态后在内存中保留的时长，过后不再可查询。
         */
        @NotNull
        private Duration jobRetention = Duration.ofHours(1);

        public List<String> getLanguages() {
            return languages;
        }

        public void setLanguages(List<String> languages) {
            this.languages = languages;
        }

        public String getDefaultLanguage() {
            return defaultLanguage;
        }

        public void setDefaultLanguage(String defaultLanguage) {
            this.defaultLanguage = defaultLanguage;
        }

        public Duration getJobRetention() {
            return jobRetention;
        }

        public void setJobRetention(Duration jobRetention) {
            this.jobRetention = jobRetention;
        }
    }

    /**
     * 同步客户端配置（{@code app.sync.client.*}）。
     */
    public static class Client {

        /**
         * 单轮同步中并行上传的最大线程数。
         */
        @Min(1)
        @Max(64)
        private int uploadParallelism = 4;

        public int getUploadParallelism() {
            return uploadParallelism;
        }

        public void setUploadParallelism(int uploadParallelism) {
            this.uploadParallelism = uploadParallelism;
        }
    }
}
