package com.lux032.musicpipeline.model;

import lombok.Data;

/**
 * 收件箱统计
 */
@Data
public class InboxStats {
    private int tracks;
    private long totalBytes;
    private String totalSize = "0 B";
    private String totalTime = "0 minutes";   // 按每首 3 分钟估算
    private int artists;
    private int albums;
    private String computedAt;
}
