package org.codesync.client;

import org.codesync.sync.HashingUtils;
import org.codesync.sync.dto.EntryKind;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * 客户端编辑器中的一个条目（当前内容）。目录没有内容。
 * <p>
 * 不可变：构造时复制内容，并只计算一次内容哈希；相等性按内容比较。
 */
public final class ClientFileState {

    private final String filePath;
    private final EntryKind kind;
    private final byte[] content;
    private final String contentHash;

    /**
     * @param filePath 工作区内路径
     * @param kind     条目类型
     * @param content  文件内容（目录为 null）
     */
    public ClientFileState(String filePath, EntryKind kind, byte[] content) {
        this.filePath = filePath;
        this.kind = kind;
        this.content = content == null ? null : content.clone();
        this.contentHash = this.content == null ? null : HashingUtils.sha256Hex(this.content);
    }

    public static ClientFileState file(String filePath, byte[] content) {
        return new ClientFileState(filePath, EntryKind.FILE, content == null ? new byte[0] : content);
    }

    public static ClientFileState file(String filePath, String text) {
        return file(filePath, (text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
    }

    public static ClientFileState folder(String filePath) {
        return new ClientFileState(filePath, EntryKind.FOLDER, null);
    }

    public String filePath() {
        return filePath;
    }

    public EntryKind kind() {
        return kind;
    }

    /**
     * @return 内容副本（目录为 null）
     */
    public byte[] content() {
        return content == null ? null : content.clone();
    }

    public String contentHash() {
        return contentHash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClientFileState other)) {
            return false;
        }
        return Objects.equals(filePath, other.filePath)
                && kind == other.kind
                && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filePath, kind, contentHash);
    }

    @Override
    public String toString() {
        return "ClientFileState[filePath=" + filePath + ", kind=" + kind
                + ", size=" + (content == null ? "-" : content.length) + ", contentHash=" + contentHash + "]";
    }
}
