package org.codesync.sync.blob;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * 对象键解析器：把对象键解析成存储根目录下的受控绝对路径，并确保它不会逃逸出根目录。
 * <p>
 * 设计目标：
 * <ul>
 *   <li>对象键只允许 {@code [A-Za-z0-9._-]} 组成的片段，以 / 分隔；拒绝 {@code .}、{@code ..} 与空片段。</li>
 *   <li>逐级检查已存在的目录，拒绝符号链接/junction 造成的路径逃逸。</li>
 * </ul>
 */
public class StorageKeyResolver {

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9._-]{1,200}");
    private static final int MAX_KEY_LENGTH = 1024;

    private final Path root;

    public StorageKeyResolver(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Path resolve(String storageKey) {
        if (storageKey == null || storageKey.isBlank() || storageKey.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("非法的对象键：" + storageKey);
        }
        for (String segment : storageKey.split("/", -1)) {
            if (!SEGMENT.matcher(segment).matches() || segment.equals(".") || segment.equals("..")) {
                throw new IllegalArgumentException("非法的对象键：" + storageKey);
            }
        }
        Path absolute = root.resolve(storageKey).normalize();
        if (!absolute.startsWith(root)) {
            throw new IllegalArgumentException("对象键不在存储根目录范围内：" + storageKey);
        }
        validateWithinRoot(absolute);
        return absolute;
    }

    private void validateWithinRoot(Path absolute) {
        if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        Path rootReal;
        try {
            rootReal = root.toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("存储根目录无法解析：" + root, e);
        }
        // 对 root -> 目标路径 的逐级目录做 realPath 校验，防止中间某一级是链接导致逃逸。
        Path current = root;
        for (Path segment : root.relativize(absolute)) {
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                break;
            }
            if (Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("对象路径包含符号链接：" + root.relativize(current));
            }
            try {
                if (!current.toRealPath().startsWith(rootReal)) {
                    throw new IllegalArgumentException("对象路径逃逸出存储根目录：" + root.relativize(current));
                }
            } catch (IOException e) {
                throw new IllegalArgumentException("对象路径无法解析：" + root.relativize(current), e);
            }
        }
    }
}
