package org.codesync.client;

/**
 * 把字节写到上传凭证指向的对象。失败时抛出 {@link org.codesync.sync.UploadFailureException}。
 */
@FunctionalInterface
public interface BlobUploader {

    void put(String filePath, String capabilityUrl, byte[] content);
}
