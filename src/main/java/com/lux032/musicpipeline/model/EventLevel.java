package com.lux032.musicpipeline.model;

/**
 * 事件日志级别
 */
public enum EventLevel {
    INFO,
    SUCCESS,
    WARNING,
    ERROR;

    public String key() {
        return name().toLowerCase();
    }
}
