package com.lux032.musicpipeline.lease;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

class FileExclusiveLeaseTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteHolderRecordAndTruncateOnRelease() throws Exception {
        Path lockFile = tempDir.resolve("locks/import.lock");
        FileExclusiveLease lease = new FileExclusiveLease(lockFile, Clock.systemUTC());

        LeaseHandle handle = lease.tryAcquire(Duration.ZERO).orElseThrow();
        String content = new String(Files.readAllBytes(lockFile), StandardCharsets.UTF_8);
        Assertions.assertTrue(content.startsWith(ProcessHandle.current().pid() + "\n"));
        Assertions.assertEquals(ProcessHandle.current().pid(), handle.getRecord().getHolderPid());

        handle.release();
        Assertions.assertEquals(0, Files.size(lockFile));
        Assertions.assertFalse(lease.isHeld());
    }

    @Test
    void shouldAdmitExactlyOneOfConcurrentContenders() throws Exception {
        Path lockFile = tempDir.resolve("import.lock");
        FileExclusiveLease lease = new FileExclusiveLease(lockFile, Clock.systemUTC());
        // 另一个实例指向同一文件，模拟另一个组件
        FileExclusiveLease other = new FileExclusiveLease(lockFile, Clock.systemUTC());

        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Optional<LeaseHandle>>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                FileExclusiveLease target = i % 2 == 0 ? lease : other;
                futures.add(executor.submit(() -> {
                    start.await();
                    return target.tryAcquire(Duration.ZERO);
                }));
            }
            start.countDown();

            int winners = 0;
            LeaseHandle winner = null;
            for (Future<Optional<LeaseHandle>> future : futures) {
                Optional<LeaseHandle> result = future.get(5, TimeUnit.SECONDS);
                if (result.isPresent()) {
                    winners++;
                    winner = result.get();
                }
            }
            Assertions.assertEquals(1, winners);

            winner.release();
            Assertions.assertTrue(other.tryAcquire(Duration.ZERO).isPresent());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldTimeOutWhileHeld() throws Exception {
        FileExclusiveLease lease = new FileExclusiveLease(tempDir.resolve("import.lock"), Clock.systemUTC());
        LeaseHandle handle = lease.tryAcquire(Duration.ZERO).orElseThrow();
        try {
            Assertions.assertTrue(lease.tryAcquire(Duration.ofMillis(300)).isEmpty());
        } finally {
            handle.release();
        }
    }

    @Test
    void shouldIgnoreRepeatedRelease() throws Exception {
        FileExclusiveLease lease = new FileExclusiveLease(tempDir.resolve("import.lock"), Clock.systemUTC());
        LeaseHandle first = lease.tryAcquire(Duration.ZERO).orElseThrow();
        first.release();
        LeaseHandle second = lease.tryAcquire(Duration.ZERO).orElseThrow();

        // 旧句柄再次释放不能影响新的持有者
        first.release();
        Assertions.assertTrue(lease.isHeld());
        Assertions.assertTrue(lease.tryAcquire(Duration.ZERO).isEmpty());
        second.release();
    }
}
