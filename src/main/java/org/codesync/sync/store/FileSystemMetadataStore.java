package org.codesync.sync.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.codesync.sync.Reservation;
import org.codesync.sync.VersionConflictException;
import org.codesync.sync.WorkspaceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * 文件版元数据存储：每个工作区一个 JSON 文档（{@code <dir>/<workspaceId>.json}），清单与预留都在其中。
 * <p>
 * 并发模型：
 * <ul>
 *   <li>读：直接读取文档。写入采用“临时文件 -> 原子 move 替换”，读者只会看到完整的旧文档或新文档。</li>
 *   <li>写：在 {@code <workspaceId>.lock} 上持有操作系统文件锁后，比较版本再替换，
 *       因此共享同一目录的多个服务实例之间同样满足条件写入语义。</li>
 *   <li>同一 JVM 内对同一文件重复加锁会抛 {@link java.nio.channels.OverlappingFileLockException}，
 *       因此进程内先按锁文件串行（所有实例共享），再获取文件锁。</li>
 * </ul>
 */
public class FileSystemMetadataStore implements MetadataStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemMetadataStore.class);

    private static final Pattern WORKSPACE_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final Path directory;
    private final ObjectMapper objectMapper;
    /**
     * 进程内锁，按锁文件绝对路径共享，同一 JVM 中指向同一目录的多个实例也互斥。
     */
    private static final ConcurrentHashMap<Path, Object> LOCAL_LOCKS = new ConcurrentHashMap<>();

    public FileSystemMetadataStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new IllegalStateException("无法创建元数据目录：" + this.directory, e);
        }
    }

    @Override
    public void create(WorkspaceRecord record) {
        String workspaceId = requireValidId(record.workspaceId());
        withWorkspaceLock(workspaceId, () -> {
            Path document = documentPath(workspaceId);
            if (Files.exists(document)) {
                throw new IllegalStateException("工作区已存在：" + workspaceId);
            }
            write(document, record);
            return null;
        });
    }

    @Override
    public Optional<WorkspaceRecord> find(String workspaceId) {
        if (workspaceId == null || !WORKSPACE_ID.matcher(workspaceId).matches()) {
            return Optional.empty();
        }
        return read(documentPath(workspaceId));
    }

    @Override
    public List<WorkspaceRecord> findByMember(String userId) {
        if (userId == null) {
            return List.of();
        }
        List<WorkspaceRecord> result = new ArrayList<>();
        try (DirectoryStream<Path> documents = Files.newDirectoryStream(directory, "*.json")) {
            for (Path document : documents) {
                read(document).filter(record -> record.isMember(userId)).ifPresent(result::add);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("列出工作区元数据失败：" + directory, e);
        }
        result.sort(BY_CREATION);
        return result;
    }

    @Override
    public WorkspaceRecord updateReservations(String workspaceId, UnaryOperator<Map<String, Reservation>> mutation) {
        if (workspaceId == null || !WORKSPACE_ID.matcher(workspaceId).matches()) {
            throw new WorkspaceNotFoundException(workspaceId);
        }
        return withWorkspaceLock(workspaceId, () -> {
            Path document = documentPath(workspaceId);
            WorkspaceRecord current = read(document).orElseThrow(() -> new WorkspaceNotFoundException(workspaceId));
            WorkspaceRecord next = current.withReservations(mutation.apply(new HashMap<>(current.reservations())));
            write(document, next);
            return next;
        });
    }

    @Override
    public CommitResult compareAndSet(String workspaceId, long expectedVersion, UnaryOperator<WorkspaceRecord> mutation) {
        if (workspaceId == null || !WORKSPACE_ID.matcher(workspaceId).matches()) {
            throw new WorkspaceNotFoundException(workspaceId);
        }
        return withWorkspaceLock(workspaceId, () -> {
            Path document = documentPath(workspaceId);
            WorkspaceRecord current = read(document).orElseThrow(() -> new WorkspaceNotFoundException(workspaceId));
            if (current.version() != expectedVersion) {
                throw new VersionConflictException(current.version(),
                        "工作区版本已变化：期望 " + expectedVersion + "，当前 " + current.version());
            }
            WorkspaceRecord next = mutation.apply(current);
            MetadataStore.requireAdvanceByOne(current, next);
            write(document, next);
            log.debug("工作区 {} 元数据已提交：{} -> {}", workspaceId, current.version(), next.version());
            return new CommitResult(current, next);
        });
    }

    private <T> T withWorkspaceLock(String workspaceId, Supplier<T> action) {
        Path lockFile = directory.resolve(workspaceId + ".lock");
        Object localLock = LOCAL_LOCKS.computeIfAbsent(lockFile, k -> new Object());
        synchronized (localLock) {
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.get();
            } catch (IOException e) {
                throw new UncheckedIOException("获取工作区文件锁失败：" + workspaceId, e);
            }
        }
    }

    private Optional<WorkspaceRecord> read(Path document) {
        try {
            byte[] bytes = Files.readAllBytes(document);
            return Optional.of(objectMapper.readValue(bytes, WorkspaceRecord.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("读取工作区元数据失败：" + document.getFileName(), e);
        }
    }

    private void write(Path document, WorkspaceRecord record) {
        Path tmp = null;
        try {
            tmp = Files.createTempFile(directory, "ws-", ".tmp");
            Files.write(tmp, objectMapper.writeValueAsBytes(record));
            try {
                Files.move(tmp, document, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, document, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("写入工作区元数据失败：" + document.getFileName(), e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    private Path documentPath(String workspaceId) {
        return directory.resolve(workspaceId + ".json");
    }

    private static String requireValidId(String workspaceId) {
        if (workspaceId == null || !WORKSPACE_ID.matcher(workspaceId).matches()) {
            throw new IllegalArgumentException("非法的工作区标识：" + workspaceId);
        }
        return workspaceId;
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("清理临时文件失败：{}", tmp, e);
        }
    }
}
