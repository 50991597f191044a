package com.lux032.musicpipeline.queue;

import java.util.HashSet;
import java.util.Set;

/**
 * 去重守卫: 同一队列中每个 target 至多一个待处理任务
 */
public class DedupGuard {

    private final Set<String> pending = new HashSet<>();

    /**
     * 标记 target 为待处理
     * @return 原先未标记时返回 true
     */
    public synchronized boolean tryMark(String target) {
        return pending.add(target);
    }

    public synchronized void clear(String target) {
        pending.remove(target);
    }

    public synchronized boolean isPending(String target) {
        return pending.contains(target);
    }

    public synchronized int size() {
        return pending.size();
    }
}
