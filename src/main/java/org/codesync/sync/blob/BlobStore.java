package org.codesync.sync.blob;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * 对象存储（blob store）。
 * <p>
 * 上传由客户端凭证直接写入（{@link #put}），删除只由服务端在提交后发起（{@link #delete}），
 * 客户端永远无法单方面删除内容。
 */
public interface BlobStore {

    /**
     * 整体写入对象；同一 key 重复写入相同字节得到相同结果（幂等）。
     *
     * @param expectedSha256 内容必须匹配的 sha256（为 null 时不校验）
     * @throws BlobTooLargeException        内容超过 {@code maxBytes}
     * @throws BlobContentMismatchException 内容哈希与 {@code expectedSha256} 不一致，已有对象保持不变
     */
    void put(String storageKey, InputStream content, long maxBytes, String expectedSha256) throws IOException;

    Optional<BlobInfo> stat(String storageKey) throws IOException;

    /**
     * @throws java.nio.file.NoSuchFileException 对象不存在
     */
    InputStream open(String storageKey) throws IOException;

    /**
     * @return 对象存在并被删除时返回 true；对象本就不存在时返回 false
     */
    boolean delete(String storageKey) throws IOException;
}
