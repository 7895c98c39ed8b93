package org.codesync.sync.blob;

import org.codesync.sync.HashingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * 本地文件系统实现的对象存储（根目录下按对象键分层存放）。
 * <p>
 * 写入采用“同目录临时文件 -> move 替换”，保证读者不会看到写了一半的对象，
 * 同时让重复上传同一内容成为幂等操作。写入时同步计算 sha256，与期望值不符的内容不会落到目标键上。
 */
public class FileSystemBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemBlobStore.class);

    private final StorageKeyResolver resolver;

    public FileSystemBlobStore(Path root) {
        this.resolver = new StorageKeyResolver(root);
        try {
            Files.createDirectories(resolver.root());
        } catch (IOException e) {
            throw new IllegalStateException("无法创建对象存储目录：" + resolver.root(), e);
        }
    }

    @Override
    public void put(String storageKey, InputStream content, long maxBytes, String expectedSha256) throws IOException {
        Path target = resolver.resolve(storageKey);
        Path parent = target.getParent();
        Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, "blob-", ".tmp");
        try {
            long written = 0;
            MessageDigest digest = HashingUtils.sha256Digest();
            try (OutputStream out = new DigestOutputStream(Files.newOutputStream(tmp), digest)) {
                byte[] buffer = new byte[8192];
                int read;
                while ((read = content.read(buffer)) >= 0) {
                    written += read;
                    if (written > maxBytes) {
                        throw new BlobTooLargeException(storageKey, maxBytes);
                    }
                    out.write(buffer, 0, read);
                }
            }
            String actual = HashingUtils.toHex(digest);
            if (expectedSha256 != null && !expectedSha256.equalsIgnoreCase(actual)) {
                throw new BlobContentMismatchException(storageKey, expectedSha256, actual);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("对象已写入：{}（{} 字节）", storageKey, written);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Override
    public Optional<BlobInfo> stat(String storageKey) throws IOException {
        Path target = resolver.resolve(storageKey);
        if (!Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS)) {
            return Optional.empty();
        }
        return Optional.of(new BlobInfo(storageKey, Files.size(target), HashingUtils.sha256Hex(target)));
    }

    @Override
    public InputStream open(String storageKey) throws IOException {
        return Files.newInputStream(resolver.resolve(storageKey));
    }

    @Override
    public boolean delete(String storageKey) throws IOException {
        return Files.deleteIfExists(resolver.resolve(storageKey));
    }
}
