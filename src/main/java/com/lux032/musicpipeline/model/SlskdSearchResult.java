package com.lux032.musicpipeline.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * slskd 搜索结果(已过滤、排序)
 */
@Data
public class SlskdSearchResult {
    private String searchId;
    private String query;
    private int totalResults;
    private List<SlskdFile> results = new ArrayList<>();
}
