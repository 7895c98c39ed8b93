package org.codesync.sync.blob;

import org.codesync.sync.WorkspaceSyncException;

/**
 * 上传内容的 sha256 与凭证绑定的哈希不一致；对象未被写入。
 */
public class BlobContentMismatchException extends WorkspaceSyncException {

    public BlobContentMismatchException(String storageKey, String expectedSha256, String actualSha256) {
        super("上传内容与凭证声明的哈希不一致：" + storageKey + "（期望 " + expectedSha256 + "，实际 " + actualSha256 + "）");
    }
}
