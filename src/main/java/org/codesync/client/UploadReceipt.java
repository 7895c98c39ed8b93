package org.codesync.client;

/**
 * 一次成功上传的回执；哈希与大小由实际发送的字节重新计算。
 *
 * @param filePath    路径
 * @param storageKey  对象键
 * @param contentHash sha256
 * @param size        字节数
 */
public record UploadReceipt(String filePath, String storageKey, String contentHash, long size) {
}
