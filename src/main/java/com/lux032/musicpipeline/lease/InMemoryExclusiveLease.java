package com.lux032.musicpipeline.lease;

import com.lux032.musicpipeline.model.LeaseRecord;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单进程部署使用的内存租约
 * 使用不可重入的信号量，同一线程重复获取同样会被拒绝
 */
public class InMemoryExclusiveLease implements ExclusiveLease {

    private final String name;
    private final Clock clock;
    private final Semaphore permit = new Semaphore(1);

    public InMemoryExclusiveLease(String name, Clock clock) {
        this.name = name;
        this.clock = clock;
    }

    @Override
    public Optional<LeaseHandle> tryAcquire(Duration timeout) throws InterruptedException {
        boolean acquired = timeout.isZero() || timeout.isNegative()
            ? permit.tryAcquire()
            : permit.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!acquired) {
            return Optional.empty();
        }
        LeaseRecord record = new LeaseRecord(ProcessHandle.current().pid(), clock.instant());
        return Optional.of(new MemoryHandle(record));
    }

    @Override
    public boolean isHeld() {
        return permit.availablePermits() == 0;
    }

    @Override
    public String getName() {
        return name;
    }

    private final class MemoryHandle implements LeaseHandle {

        private final LeaseRecord record;
        private final AtomicBoolean released = new AtomicBoolean();

        private MemoryHandle(LeaseRecord record) {
            this.record = record;
        }

        @Override
        public void release() {
            if (released.compareAndSet(false, true)) {
                permit.release();
            }
        }

        @Override
        public LeaseRecord getRecord() {
            return record;
        }
    }
}
