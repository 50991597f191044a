package com.lux032.musicpipeline.lease;

import com.lux032.musicpipeline.model.LeaseRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于文件锁的跨进程租约
 * 锁由操作系统持有，进程退出(包括崩溃)时自动释放
 */
@Slf4j
public class FileExclusiveLease implements ExclusiveLease {

    private static final long POLL_INTERVAL_MS = 500;

    // 同一 JVM 内每个锁文件只允许打开一个通道，关闭其它通道会连带释放系统锁
    private static final Set<Path> CLAIMED = ConcurrentHashMap.newKeySet();

    private final Path lockFile;
    private final Clock clock;
    private volatile FileHandle current;

    public FileExclusiveLease(Path lockFile, Clock clock) {
        this.lockFile = lockFile.toAbsolutePath().normalize();
        this.clock = clock;
    }

    @Override
    public Optional<LeaseHandle> tryAcquire(Duration timeout) throws InterruptedException {
        long deadline = clock.millis() + Math.max(0, timeout.toMillis());
        while (true) {
            Optional<LeaseHandle> handle = attempt();
            if (handle.isPresent() || timeout.isZero() || timeout.isNegative()) {
                return handle;
            }
            long remaining = deadline - clock.millis();
            if (remaining <= 0) {
                return Optional.empty();
            }
            Thread.sleep(Math.min(POLL_INTERVAL_MS, remaining));
        }
    }

    private Optional<LeaseHandle> attempt() {
        if (!CLAIMED.add(lockFile)) {
            return Optional.empty();
        }

        FileChannel channel = null;
        try {
            Path parent = lockFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock;
            try {
                lock = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                lock = null;
            }
            if (lock == null) {
                channel.close();
                CLAIMED.remove(lockFile);
                return Optional.empty();
            }

            LeaseRecord record = new LeaseRecord(ProcessHandle.current().pid(), clock.instant());
            writeRecord(channel, record);
            FileHandle handle = new FileHandle(channel, lock, record);
            current = handle;
            log.debug("获取导入租约: {} (pid={})", lockFile, record.getHolderPid());
            return Optional.of(handle);
        } catch (IOException e) {
            log.warn("获取租约失败: {} - {}", lockFile, e.getMessage());
            closeQuietly(channel);
            CLAIMED.remove(lockFile);
            return Optional.empty();
        }
    }

    private static void writeRecord(FileChannel channel, LeaseRecord record) throws IOException {
        channel.truncate(0);
        channel.write(ByteBuffer.wrap(record.toFileContent().getBytes(StandardCharsets.UTF_8)), 0);
        channel.force(false);
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("关闭锁文件通道失败: {}", e.getMessage());
        }
    }

    @Override
    public boolean isHeld() {
        return current != null;
    }

    @Override
    public String getName() {
        return lockFile.toString();
    }

    public Path getLockFile() {
        return lockFile;
    }

    private final class FileHandle implements LeaseHandle {

        private final FileChannel channel;
        private final FileLock lock;
        private final LeaseRecord record;
        private final AtomicBoolean released = new AtomicBoolean();

        private FileHandle(FileChannel channel, FileLock lock, LeaseRecord record) {
            this.channel = channel;
            this.lock = lock;
            this.record = record;
        }

        @Override
        public void release() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                channel.truncate(0);
                lock.release();
            } catch (IOException e) {
                log.warn("释放租约失败: {} - {}", lockFile, e.getMessage());
            } finally {
                closeQuietly(channel);
                current = null;
                CLAIMED.remove(lockFile);
                log.debug("释放导入租约: {}", lockFile);
            }
        }

        @Override
        public LeaseRecord getRecord() {
            return record;
        }
    }
}
