package com.lux032.musicpipeline.queue;

import com.lux032.musicpipeline.model.QueueName;
import com.lux032.musicpipeline.model.WorkItem;

import java.time.Clock;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 任务队列
 * FIFO 队列使用 LinkedBlockingQueue，歌词队列使用按 WorkItem 自然顺序的 PriorityBlockingQueue
 */
public class WorkQueue {

    private final QueueName name;
    private final BlockingQueue<WorkItem> items;
    private final DedupGuard guard;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    private WorkQueue(QueueName name, BlockingQueue<WorkItem> items, Clock clock) {
        this.name = name;
        this.items = items;
        this.guard = new DedupGuard();
        this.clock = clock;
    }

    public static WorkQueue fifo(QueueName name, Clock clock) {
        return new WorkQueue(name, new LinkedBlockingQueue<>(), clock);
    }

    public static WorkQueue prioritized(QueueName name, Clock clock) {
        return new WorkQueue(name, new PriorityBlockingQueue<>(), clock);
    }

    public QueueName getName() {
        return name;
    }

    public boolean submit(String target) {
        return submit(target, WorkItem.DEFAULT_PRIORITY, 0);
    }

    public boolean submit(String target, int priority) {
        return submit(target, priority, 0);
    }

    /**
     * 提交任务，target 已在队列中等待时被吸收
     * @return 是否创建了新的任务
     */
    public boolean submit(String target, int priority, int attempt) {
        if (!guard.tryMark(target)) {
            return false;
        }
        items.offer(new WorkItem(target, clock.millis(), priority, attempt, sequence.incrementAndGet()));
        return true;
    }

    public WorkItem poll(long timeout, TimeUnit unit) throws InterruptedException {
        return items.poll(timeout, unit);
    }

    /**
     * 解除 target 的去重标记，使其可以再次入队
     */
    public void release(String target) {
        guard.clear(target);
    }

    public boolean isPending(String target) {
        return guard.isPending(target);
    }

    public int depth() {
        return items.size();
    }

    public int pendingTargets() {
        return guard.size();
    }
}
