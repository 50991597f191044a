package com.lux032.musicpipeline.model;

import lombok.Getter;
import lombok.ToString;

/**
 * 队列中的待处理任务
 * 以 target 作为身份标识，排序规则: priority 升序，其次入队时间，最后入队序号
 */
@Getter
@ToString
public final class WorkItem implements Comparable<WorkItem> {

    public static final int DEFAULT_PRIORITY = 0;

    private final String target;
    private final long enqueuedAt;
    private final int priority;
    private final int attempt;
    private final long sequence;

    public WorkItem(String target, long enqueuedAt, int priority, int attempt, long sequence) {
        if (target == null || target.isEmpty()) {
            throw new IllegalArgumentException("target must not be empty");
        }
        this.target = target;
        this.enqueuedAt = enqueuedAt;
        this.priority = priority;
        this.attempt = attempt;
        this.sequence = sequence;
    }

    @Override
    public int compareTo(WorkItem other) {
        int byPriority = Integer.compare(priority, other.priority);
        if (byPriority != 0) {
            return byPriority;
        }
        int byTime = Long.compare(enqueuedAt, other.enqueuedAt);
        if (byTime != 0) {
            return byTime;
        }
        return Long.compare(sequence, other.sequence);
    }
}
