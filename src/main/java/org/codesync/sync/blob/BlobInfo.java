package org.codesync.sync.blob;

/**
 * @param storageKey 对象键
 * @param size       字节数
 * @param sha256     内容 sha256
 */
public record BlobInfo(String storageKey, long size, String sha256) {
}
