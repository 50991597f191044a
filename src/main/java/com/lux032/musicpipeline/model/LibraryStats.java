package com.lux032.musicpipeline.model;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 音乐库统计
 */
@Data
public class LibraryStats {
    private int tracks;
    private int albums;
    private int albumArtists;
    private String totalTime = "unknown";
    private String totalSize = "unknown";
    private Map<String, Long> formats = new LinkedHashMap<>();
    private int missingTracksCount;   // -1 表示统计失败或超时
    private Map<String, Long> topGenres = new LinkedHashMap<>();
    private Map<String, Long> years = new LinkedHashMap<>();
    private Map<String, Long> labels = new LinkedHashMap<>();
    private String computedAt;
}
