package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.model.InboxStats;
import com.lux032.musicpipeline.util.FileSystemUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.util.stream.Stream;

/**
 * 收件箱统计服务
 */
@Slf4j
public class InboxStatsService {

    // 只取样前 200 个顶层目录
    private static final int TOP_LEVEL_SAMPLE = 200;
    private static final int ESTIMATED_MINUTES_PER_TRACK = 3;

    private final Path inboxRoot;
    private final FileSystemUtils fileSystemUtils;
    private final Clock clock;

    public InboxStatsService(Path inboxRoot, FileSystemUtils fileSystemUtils, Clock clock) {
        this.inboxRoot = inboxRoot;
        this.fileSystemUtils = fileSystemUtils;
        this.clock = clock;
    }

    public InboxStats compute() {
        log.info("Computing fresh inbox stats");
        InboxStats stats = new InboxStats();
        stats.setComputedAt(Instant.now(clock).toString());

        if (!Files.isDirectory(inboxRoot)) {
            log.warn("Inbox path does not exist: {}", inboxRoot);
            return stats;
        }

        long[] totals = new long[2]; // [0] 音轨数, [1] 字节数
        try {
            Files.walkFileTree(inboxRoot, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        totals[1] += attrs.size();
                        if (fileSystemUtils.isAudioFile(file)) {
                            totals[0]++;
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("无法访问: {} - {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.error("Error computing inbox stats: {}", e.getMessage());
        }

        int topLevel = 0;
        try (Stream<Path> children = Files.list(inboxRoot)) {
            topLevel = (int) children.limit(TOP_LEVEL_SAMPLE)
                .filter(Files::isDirectory)
                .map(p -> p.getFileName().toString())
                .filter(name -> !name.startsWith(".") && !name.contains("_UNPACK_"))
                .count();
        } catch (IOException e) {
            log.warn("Error sampling directories: {}", e.getMessage());
        }

        stats.setTracks((int) totals[0]);
        stats.setTotalBytes(totals[1]);
        stats.setTotalSize(FileSystemUtils.formatSize(totals[1]));
        stats.setTotalTime(formatMinutes(totals[0] * ESTIMATED_MINUTES_PER_TRACK));
        stats.setArtists(topLevel);
        stats.setAlbums(topLevel);
        return stats;
    }

    static String formatMinutes(long minutes) {
        if (minutes <= 0) {
            return "0 minutes";
        }
        long days = minutes / (24 * 60);
        long hours = (minutes % (24 * 60)) / 60;
        long rest = minutes % 60;
        StringBuilder sb = new StringBuilder();
        if (days > 0) {
            sb.append(days).append(days == 1 ? " day" : " days");
        }
        if (hours > 0) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(hours).append(hours == 1 ? " hour" : " hours");
        }
        if (rest > 0) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(rest).append(rest == 1 ? " minute" : " minutes");
        }
        return sb.toString();
    }
}
