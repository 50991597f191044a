package com.lux032.musicpipeline.model;

import lombok.Data;

/**
 * slskd 搜索结果中的单个文件
 */
@Data
public class SlskdFile {
    private String username;
    private String filename;
    private long size;
    private Integer bitrate;
    private Integer length;
    private Integer bitDepth;
    private String searchId;
}
