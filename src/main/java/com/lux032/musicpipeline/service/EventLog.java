package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.model.EventLevel;
import com.lux032.musicpipeline.model.EventLogEntry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 事件日志 - 收集流水线运行事件
 * 供 Web 状态接口增量轮询，同时写入 SLF4J
 */
@Slf4j
public class EventLog {

    public static final int DEFAULT_CAPACITY = 100;
    public static final int DEFAULT_TAIL_LIMIT = 50;

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final int capacity;
    private final Clock clock;
    // 新的在头部
    private final Deque<EventLogEntry> entries = new ArrayDeque<>();
    private long lastId;

    public EventLog(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    public EventLogEntry info(String message) {
        return append(EventLevel.INFO, message);
    }

    public EventLogEntry success(String message) {
        return append(EventLevel.SUCCESS, message);
    }

    public EventLogEntry warning(String message) {
        return append(EventLevel.WARNING, message);
    }

    public EventLogEntry error(String message) {
        return append(EventLevel.ERROR, message);
    }

    /**
     * 添加日志条目，超过容量时淘汰最旧的条目
     */
    public EventLogEntry append(EventLevel level, String message) {
        EventLogEntry entry;
        synchronized (this) {
            lastId++;
            entry = new EventLogEntry(
                lastId,
                LocalDateTime.now(clock).format(FORMATTER),
                level.key(),
                message
            );
            entries.addFirst(entry);
            while (entries.size() > capacity) {
                entries.removeLast();
            }
        }

        switch (level) {
            case ERROR:
                log.error("[{}] {}", level.name(), message);
                break;
            case WARNING:
                log.warn("[{}] {}", level.name(), message);
                break;
            default:
                log.info("[{}] {}", level.name(), message);
                break;
        }
        return entry;
    }

    /**
     * 获取日志，结果按写入顺序(旧的在前)排列
     * @param sinceId 为空时返回最近 limit 条；否则返回 id 大于 sinceId 的最早 limit 条
     */
    public synchronized List<EventLogEntry> tail(Long sinceId, int limit) {
        List<EventLogEntry> result = new ArrayList<>();
        if (limit <= 0) {
            return result;
        }

        if (sinceId == null) {
            Iterator<EventLogEntry> newestFirst = entries.iterator();
            while (newestFirst.hasNext() && result.size() < limit) {
                result.add(0, newestFirst.next());
            }
            return result;
        }

        Iterator<EventLogEntry> oldestFirst = entries.descendingIterator();
        while (oldestFirst.hasNext() && result.size() < limit) {
            EventLogEntry entry = oldestFirst.next();
            if (entry.getId() > sinceId) {
                result.add(entry);
            }
        }
        return result;
    }

    public synchronized long getLastId() {
        return lastId;
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
