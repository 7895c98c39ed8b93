package org.codesync.sync.blob;

import org.codesync.sync.WorkspaceSyncException;

public class BlobTooLargeException extends WorkspaceSyncException {

    public BlobTooLargeException(String storageKey, long maxBytes) {
        super("对象过大：" + storageKey + "（上限 " + maxBytes + " 字节）");
    }
}
