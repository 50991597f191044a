package com.lux032.musicpipeline.model;

/**
 * 任务队列名称
 */
public enum QueueName {

    /**
     * 收件箱导入
     */
    INBOX("inbox"),

    /**
     * 曲库目录重建
     */
    LIBRARY("library"),

    /**
     * 封面获取
     */
    COVER("cover"),

    /**
     * 歌词获取(优先级队列)
     */
    LYRICS("lyrics");

    private final String key;

    QueueName(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
