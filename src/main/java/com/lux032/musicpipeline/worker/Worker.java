package com.lux032.musicpipeline.worker;

import com.lux032.musicpipeline.model.ActionResult;
import com.lux032.musicpipeline.model.WorkItem;
import com.lux032.musicpipeline.queue.Debouncer;
import com.lux032.musicpipeline.queue.WorkQueue;
import com.lux032.musicpipeline.service.EventLog;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * 单个队列的常驻 worker
 * 出队 -> 等待防抖窗口 -> 解除去重标记 -> 执行动作 -> 成功后处理
 */
@Slf4j
public class Worker implements Runnable {

    private static final long POLL_TIMEOUT_SECONDS = 1;
    private static final long ERROR_BACKOFF_MS = 5000;

    private final Debouncer debouncer;
    private final WorkQueue queue;
    private final Action action;
    private final EventLog eventLog;
    private final BooleanSupplier stopping;
    private final Clock clock;
    private final List<Consumer<WorkItem>> successHooks = new CopyOnWriteArrayList<>();

    private final AtomicReference<String> currentTarget = new AtomicReference<>();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();

    public Worker(Debouncer debouncer, Action action, EventLog eventLog, BooleanSupplier stopping, Clock clock) {
        this.debouncer = debouncer;
        this.queue = debouncer.getQueue();
        this.action = action;
        this.eventLog = eventLog;
        this.stopping = stopping;
        this.clock = clock;
    }

    /**
     * 注册成功后的处理(缓存失效、链式入队等)
     */
    public Worker onSuccess(Consumer<WorkItem> hook) {
        successHooks.add(hook);
        return this;
    }

    @Override
    public void run() {
        String name = queue.getName().getKey();
        log.info("{} worker started", name);
        eventLog.info(action.getName() + " worker started");

        while (!stopping.getAsBoolean()) {
            try {
                processNext();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("{} worker error", name, e);
                try {
                    Thread.sleep(ERROR_BACKOFF_MS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        log.info("{} worker stopped", name);
    }

    /**
     * 处理下一个任务
     * @return 是否执行了动作
     */
    boolean processNext() throws InterruptedException {
        WorkItem item = queue.poll(POLL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (item == null) {
            return false;
        }

        long dequeuedAt = clock.millis();
        if (!debouncer.awaitQuiet(item, dequeuedAt, stopping)) {
            log.info("停止信号到达，放弃等待中的任务: {}", item.getTarget());
            return false;
        }

        // 解除标记后，执行期间到达的通知会生成一个新的后续任务
        queue.release(item.getTarget());
        debouncer.forget(item.getTarget(), clock.millis());

        execute(item);
        return true;
    }

    private void execute(WorkItem item) throws InterruptedException {
        currentTarget.set(item.getTarget());
        try {
            ActionResult result = action.execute(item);
            switch (result.getStatus()) {
                case SUCCEEDED:
                    succeeded.incrementAndGet();
                    runSuccessHooks(item);
                    break;
                case FAILED:
                    failed.incrementAndGet();
                    log.warn("{} failed for {}: {}", action.getName(), item.getTarget(), result.getDetail());
                    break;
                default:
                    skipped.incrementAndGet();
                    log.debug("{} skipped {}: {}", action.getName(), item.getTarget(), result.getDetail());
                    break;
            }
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            failed.incrementAndGet();
            log.error("{} exception for {}", action.getName(), item.getTarget(), e);
            eventLog.error(action.getName() + " exception: " + abbreviate(String.valueOf(e.getMessage())));
        } finally {
            currentTarget.set(null);
        }
    }

    private void runSuccessHooks(WorkItem item) {
        for (Consumer<WorkItem> hook : successHooks) {
            try {
                hook.accept(item);
            } catch (RuntimeException e) {
                log.error("{} 后续处理失败: {}", action.getName(), item.getTarget(), e);
            }
        }
    }

    private static String abbreviate(String message) {
        return message.length() <= 200 ? message : message.substring(0, 200);
    }

    public WorkQueue getQueue() {
        return queue;
    }

    public Action getAction() {
        return action;
    }

    public String getCurrentTarget() {
        return currentTarget.get();
    }

    public long getSucceededCount() {
        return succeeded.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    public long getSkippedCount() {
        return skipped.get();
    }
}
