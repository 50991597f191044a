package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.model.CommandResult;
import com.lux032.musicpipeline.model.LibraryStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 音乐库统计服务
 * 通过多次 beets 查询汇总，单项失败不影响其它项
 */
@Slf4j
public class LibraryStatsService {

    private static final Duration STATS_TIMEOUT = Duration.ofSeconds(120);
    private static final Duration LIST_TIMEOUT = Duration.ofSeconds(180);
    private static final Duration MISSING_TIMEOUT = Duration.ofSeconds(300);

    private final BeetsCli beets;
    private final Clock clock;

    public LibraryStatsService(BeetsCli beets, Clock clock) {
        this.beets = beets;
        this.clock = clock;
    }

    public LibraryStats compute() {
        log.info("Computing fresh library stats");
        LibraryStats stats = new LibraryStats();
        try {
            CommandResult base = beets.stats(STATS_TIMEOUT);
            if (base.isSuccess()) {
                parseBaseStats(base.getOutput(), stats);
            } else {
                log.warn("beet stats 失败: {}", base.abbreviatedOutput(200));
            }

            CommandResult formats = beets.listTracks("$format", LIST_TIMEOUT);
            if (formats.isSuccess()) {
                stats.setFormats(topCounts(nonEmptyLines(formats.getOutput()), 10));
            } else {
                log.warn("Format stats failed or timed out");
            }

            CommandResult missing = beets.missing(MISSING_TIMEOUT);
            if (missing.isSuccess()) {
                stats.setMissingTracksCount(nonEmptyLines(missing.getOutput()).size());
            } else {
                log.warn("Missing tracks count failed or timed out - skipping");
                stats.setMissingTracksCount(-1);
            }

            CommandResult genres = beets.listAlbums("$genre|$year", LIST_TIMEOUT);
            if (genres.isSuccess()) {
                parseGenresAndYears(genres.getOutput(), stats);
            } else {
                log.warn("Genre/year stats failed or timed out");
            }

            CommandResult labels = beets.listAlbums("$label", LIST_TIMEOUT);
            if (labels.isSuccess()) {
                List<String> known = new ArrayList<>();
                for (String label : nonEmptyLines(labels.getOutput())) {
                    if (!"unknown".equals(label.toLowerCase(Locale.ROOT))) {
                        known.add(label);
                    }
                }
                stats.setLabels(topCounts(known, 15));
            } else {
                log.warn("Label stats failed or timed out");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("统计被中断，返回部分结果");
        }
        stats.setComputedAt(Instant.now(clock).toString());
        return stats;
    }

    /**
     * 解析 beet stats 输出
     */
    static void parseBaseStats(String output, LibraryStats stats) {
        for (String raw : output.split("\\R")) {
            String line = raw.trim();
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String key = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();
            switch (key) {
                case "Tracks":
                    stats.setTracks(parseCount(value));
                    break;
                case "Albums":
                    stats.setAlbums(parseCount(value));
                    break;
                case "Album artists":
                    stats.setAlbumArtists(parseCount(value));
                    break;
                case "Total time":
                    stats.setTotalTime(value);
                    break;
                case "Approximate total size":
                    stats.setTotalSize(value);
                    break;
                default:
                    break;
            }
        }
    }

    static void parseGenresAndYears(String output, LibraryStats stats) {
        List<String> genres = new ArrayList<>();
        List<String> years = new ArrayList<>();
        for (String line : output.split("\\R")) {
            int bar = line.indexOf('|');
            if (bar < 0) {
                continue;
            }
            String genre = line.substring(0, bar).trim();
            String year = line.substring(bar + 1).trim();
            if (!genre.isEmpty()) {
                genres.add(genre);
            }
            if (!year.isEmpty() && !"0".equals(year)) {
                years.add(year);
            }
        }
        stats.setTopGenres(topCounts(genres, 5));
        stats.setYears(topCounts(years, 5));
    }

    /**
     * 按出现次数降序取前 N 项，次数相同时保持首次出现的顺序
     */
    static Map<String, Long> topCounts(List<String> values, int limit) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String value : values) {
            counts.merge(value, 1L, Long::sum);
        }
        Map<String, Integer> firstSeen = new HashMap<>();
        int index = 0;
        for (String key : counts.keySet()) {
            firstSeen.put(key, index++);
        }

        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Comparator.<Map.Entry<String, Long>>comparingLong(Map.Entry::getValue).reversed()
            .thenComparing(e -> firstSeen.get(e.getKey())));

        Map<String, Long> top = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : entries) {
            if (top.size() >= limit) {
                break;
            }
            top.put(entry.getKey(), entry.getValue());
        }
        return top;
    }

    private static List<String> nonEmptyLines(String output) {
        List<String> lines = new ArrayList<>();
        for (String line : output.split("\\R")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }

    private static int parseCount(String value) {
        try {
            return value.isEmpty() ? 0 : Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.debug("无法解析统计数值: {}", value);
            return 0;
        }
    }
}
