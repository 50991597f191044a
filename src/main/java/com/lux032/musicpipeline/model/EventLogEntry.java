package com.lux032.musicpipeline.model;

import lombok.Data;

/**
 * 事件日志条目
 */
@Data
public class EventLogEntry {
    private final long id;
    private final String timestamp;
    private final String level;
    private final String message;
}
